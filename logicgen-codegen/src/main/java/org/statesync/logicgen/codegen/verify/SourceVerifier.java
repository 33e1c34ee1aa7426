/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.statesync.logicgen.codegen.verify;

import org.statesync.logicgen.annotation.Internal;
import org.statesync.logicgen.annotation.VisibleForTesting;
import org.statesync.logicgen.codegen.exception.CodeGenException;

import org.codehaus.commons.compiler.CompileException;
import org.codehaus.janino.Parser;
import org.codehaus.janino.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;

/**
 * Checks that generated Java source is syntactically valid by running it through the Janino
 * parser. Types are not resolved, so the generated class does not need the runtime or the schema
 * classes on the classpath.
 */
@Internal
public final class SourceVerifier {

    private static final Logger LOG = LoggerFactory.getLogger(SourceVerifier.class);

    private SourceVerifier() {}

    /**
     * Parses the given compilation unit.
     *
     * @param fileName name used in error locations, e.g. {@code GameLogic.java}
     * @throws CodeGenException if the source does not parse
     */
    public static void verify(String fileName, String code) {
        try {
            new Parser(new Scanner(fileName, new StringReader(code)))
                    .parseAbstractCompilationUnit();
        } catch (CompileException e) {
            LOG.error("Failed to parse generated code:\n{}", addLineNumber(code));
            throw new CodeGenException(
                    "Generated source "
                            + fileName
                            + " is not valid Java: "
                            + e.getMessage()
                            + ". This is a bug. Please file an issue.",
                    e);
        } catch (IOException e) {
            throw new CodeGenException("Could not read generated source " + fileName + ".", e);
        }
        LOG.debug("Generated source {} parsed successfully.", fileName);
    }

    /** Prefixes every line with its number, to make parse errors easy to locate in the log. */
    @VisibleForTesting
    static String addLineNumber(String code) {
        // split with a negative limit to keep trailing empty lines
        String[] lines = code.split("\n", -1);
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            builder.append("/* ").append(i + 1).append(" */").append(lines[i]).append("\n");
        }
        return builder.toString();
    }
}

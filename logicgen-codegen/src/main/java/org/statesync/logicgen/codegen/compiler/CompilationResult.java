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

package org.statesync.logicgen.codegen.compiler;

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.validate.ValidationIssue;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** Output of one {@link LogicCompiler#compile} run. */
@PublicEvolving
public final class CompilationResult {

    private final String className;
    private final String javaSource;
    @Nullable private final String typeScriptSource;
    private final List<ValidationIssue> warnings;

    public CompilationResult(
            String className,
            String javaSource,
            @Nullable String typeScriptSource,
            List<ValidationIssue> warnings) {
        this.className = className;
        this.javaSource = javaSource;
        this.typeScriptSource = typeScriptSource;
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
    }

    public String getClassName() {
        return className;
    }

    public String getJavaSource() {
        return javaSource;
    }

    /** Present only when TypeScript generation is enabled. */
    public Optional<String> getTypeScriptSource() {
        return Optional.ofNullable(typeScriptSource);
    }

    /** Validation warnings; empty when validation is disabled. */
    public List<ValidationIssue> getWarnings() {
        return warnings;
    }
}

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

package org.statesync.logicgen.codegen.generator;

import org.statesync.logicgen.annotation.Internal;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Imports of the generated class. Every class starts with the runtime types that handler
 * signatures and the {@link Coercions} helpers rely on; emitters add what else they reference.
 * Imports are written sorted.
 */
@Internal
public final class ImportCollector {

    static final List<String> BASELINE =
            Collections.unmodifiableList(
                    Arrays.asList(
                            "java.util.List",
                            "java.util.Map",
                            "org.statesync.logicgen.runtime.HandlerException",
                            "org.statesync.logicgen.runtime.Session",
                            "org.statesync.logicgen.runtime.Values"));

    private final Set<String> imports = new TreeSet<>(BASELINE);

    public void add(String qualifiedName) {
        imports.add(qualifiedName);
    }

    public void addAll(Collection<String> qualifiedNames) {
        imports.addAll(qualifiedNames);
    }

    public Set<String> getImports() {
        return Collections.unmodifiableSet(imports);
    }

    /** Writes the import block, {@code java.*} first, then everything else. */
    public void writeTo(JavaCodeBuilder code) {
        boolean wroteJava = false;
        for (String name : imports) {
            if (name.startsWith("java.")) {
                code.stmt("import " + name);
                wroteJava = true;
            }
        }
        boolean first = true;
        for (String name : imports) {
            if (!name.startsWith("java.")) {
                if (first && wroteJava) {
                    code.newLine();
                }
                first = false;
                code.stmt("import " + name);
            }
        }
    }
}

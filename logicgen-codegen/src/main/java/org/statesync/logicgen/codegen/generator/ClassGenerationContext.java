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
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.schema.SchemaContext;

import javax.annotation.Nullable;

import java.util.Collections;
import java.util.Set;

/** What all methods of one generated class share. Created once per compilation. */
@Internal
public final class ClassGenerationContext {

    private final NodeGraph graph;
    @Nullable private final SchemaContext schema;
    private final NodeTypeRegistry registry;
    private final String stateType;
    private final boolean traceEnabled;
    private final Set<String> cancellableFunctions;
    private final ImportCollector imports = new ImportCollector();

    public ClassGenerationContext(
            NodeGraph graph,
            @Nullable SchemaContext schema,
            NodeTypeRegistry registry,
            String stateType,
            boolean traceEnabled,
            Set<String> cancellableFunctions) {
        this.graph = graph;
        this.schema = schema;
        this.registry = registry;
        this.stateType = stateType;
        this.traceEnabled = traceEnabled;
        this.cancellableFunctions = Collections.unmodifiableSet(cancellableFunctions);
    }

    public NodeGraph getGraph() {
        return graph;
    }

    @Nullable
    public SchemaContext getSchema() {
        return schema;
    }

    public NodeTypeRegistry getRegistry() {
        return registry;
    }

    public String getStateType() {
        return stateType;
    }

    public boolean isTraceEnabled() {
        return traceEnabled;
    }

    public boolean isCancellable(String functionName) {
        return cancellableFunctions.contains(functionName);
    }

    public ImportCollector getImports() {
        return imports;
    }
}

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

package org.statesync.logicgen.codegen.nodes;

import org.statesync.logicgen.annotation.Internal;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

/** Registers the core node kinds with their emitters. */
@Internal
public final class CoreNodeCatalog {

    private CoreNodeCatalog() {}

    public static void registerAll(NodeTypeRegistry registry) {
        StateNodes.register(registry);
        ArrayNodes.register(registry);
        MapNodes.register(registry);
        LogicNodes.register(registry);
        MathNodes.register(registry);
        GeoNodes.register(registry);
        RandomNodes.register(registry);
        TimeNodes.register(registry);
        StructNodes.register(registry);
        StringNodes.register(registry);
        VariableNodes.register(registry);
        FunctionNodes.register(registry);
        EventNodes.register(registry);
        SessionNodes.register(registry);
        FilterNodes.register(registry);
        BatchNodes.register(registry);
    }
}

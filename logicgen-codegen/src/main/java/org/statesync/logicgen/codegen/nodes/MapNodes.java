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

import org.statesync.logicgen.codegen.generator.Coercions;
import org.statesync.logicgen.codegen.generator.EmitContext;
import org.statesync.logicgen.codegen.generator.JavaExpression;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.schema.JavaTypes;

import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/** Map kinds. Writes go through the map accessors of a state path. */
final class MapNodes {

    private static final String CATEGORY = "map";

    private MapNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("SetMapValue")
                        .category(CATEGORY)
                        .description("Puts an entry into the map at a state path.")
                        .input(required("path", "string"))
                        .input(required("key", "string"))
                        .input(required("value", "any"))
                        .emitter(MapNodes::emitSetMapValue)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("GetMapValue")
                        .category(CATEGORY)
                        .description("Looks up a key.")
                        .input(required("map", "map"))
                        .input(required("key", "string"))
                        .output("value", "any")
                        .output("exists", "bool")
                        .emitter(MapNodes::emitGetMapValue)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("RemoveMapKey")
                        .category(CATEGORY)
                        .description("Removes an entry from the map at a state path.")
                        .input(required("path", "string"))
                        .input(required("key", "string"))
                        .emitter(MapNodes::emitRemoveMapKey)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("HasMapKey")
                        .category(CATEGORY)
                        .description("Whether a key is present.")
                        .input(required("map", "map"))
                        .input(required("key", "string"))
                        .output("exists", "bool")
                        .emitter(MapNodes::emitHasMapKey)
                        .build());
    }

    private static void emitSetMapValue(EmitContext context, Node node) {
        context.putPathEntry(
                node,
                context.requireConstantString(node, "path"),
                context.resolveInput(node, "key"),
                context.resolveInput(node, "value"));
    }

    private static void emitRemoveMapKey(EmitContext context, Node node) {
        context.removePathEntry(
                node,
                context.requireConstantString(node, "path"),
                context.resolveInput(node, "key"));
    }

    private static void emitGetMapValue(EmitContext context, Node node) {
        JavaExpression map = context.resolveInput(node, "map");
        String mapType = map.isMap() ? map.getType() : "Map<?, ?>";
        String local = context.newLocal(node.getId() + "_map");
        context.code().declare(mapType, local, Coercions.toMap(map));
        String key = context.resolveInput(node, "key").getCode();
        String exists =
                context.declareOutput(
                        node, "exists", "boolean", local + ".containsKey(" + key + ")");
        String valueType = JavaTypes.boxed(Coercions.mapValueType(map));
        context.declareOutput(
                node, "value", valueType, exists + " ? " + local + ".get(" + key + ") : null");
    }

    private static void emitHasMapKey(EmitContext context, Node node) {
        String map = Coercions.toMap(context.resolveInput(node, "map"));
        String key = context.resolveInput(node, "key").getCode();
        context.declareOutput(node, "exists", "boolean", map + ".containsKey(" + key + ")");
    }
}

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
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/** Random values drawn from {@code ThreadLocalRandom}. */
final class RandomNodes {

    private static final String CATEGORY = "random";
    private static final String RANDOM = "ThreadLocalRandom.current()";

    private RandomNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("RandomInt")
                        .category(CATEGORY)
                        .description("A random integer in [min, max].")
                        .input(required("min", "int"))
                        .input(required("max", "int"))
                        .output("value", "int")
                        .emitter(RandomNodes::emitRandomInt)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("RandomFloat")
                        .category(CATEGORY)
                        .description("A random number in [min, max).")
                        .input(required("min", "float64"))
                        .input(required("max", "float64"))
                        .output("value", "float64")
                        .emitter(RandomNodes::emitRandomFloat)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("RandomBool")
                        .category(CATEGORY)
                        .description("true with the given probability.")
                        .input(required("probability", "float64"))
                        .output("value", "bool")
                        .emitter(RandomNodes::emitRandomBool)
                        .build());
    }

    private static void emitRandomInt(EmitContext context, Node node) {
        addImport(context);
        String min = Coercions.toInt(context.resolveInput(node, "min"));
        String max = Coercions.toInt(context.resolveInput(node, "max"));
        context.declareOutput(
                node,
                "value",
                "int",
                RANDOM + ".nextInt(" + min + ", " + NodeSupport.paren(max) + " + 1)");
    }

    private static void emitRandomFloat(EmitContext context, Node node) {
        addImport(context);
        String min = NodeSupport.paren(Coercions.toDouble(context.resolveInput(node, "min")));
        String max = NodeSupport.paren(Coercions.toDouble(context.resolveInput(node, "max")));
        context.declareOutput(
                node,
                "value",
                "double",
                min + " + " + RANDOM + ".nextDouble() * (" + max + " - " + min + ")");
    }

    private static void emitRandomBool(EmitContext context, Node node) {
        addImport(context);
        String probability =
                NodeSupport.paren(Coercions.toDouble(context.resolveInput(node, "probability")));
        context.declareOutput(
                node, "value", "boolean", RANDOM + ".nextDouble() < " + probability);
    }

    private static void addImport(EmitContext context) {
        context.addImport("java.util.concurrent.ThreadLocalRandom");
    }
}

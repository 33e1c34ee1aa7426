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

import org.statesync.logicgen.codegen.generator.EmitContext;
import org.statesync.logicgen.codegen.generator.Names;
import org.statesync.logicgen.codegen.generator.ParameterTypes;
import org.statesync.logicgen.codegen.graph.FunctionDefinition;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

import java.util.ArrayList;
import java.util.List;

import static org.statesync.logicgen.codegen.registry.PortDefinition.optional;
import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/** Calls of graph functions, which compile to static methods of the generated class. */
final class FunctionNodes {

    private static final String CATEGORY = "function";

    private FunctionNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("CallFunction")
                        .category(CATEGORY)
                        .description("Calls a graph function with named arguments.")
                        .input(required("function", "string"))
                        .input(optional("args", "map"))
                        .output("result", "any")
                        .emitter(FunctionNodes::emitCallFunction)
                        .build());
    }

    /**
     * Emits {@code fn([cancellation, ]session, state, args...)}. Arguments follow the declared
     * parameter order whatever the order of the {@code args} map.
     */
    private static void emitCallFunction(EmitContext context, Node node) {
        String name = context.requireConstantString(node, "function");
        FunctionDefinition function = context.getGraph().findFunction(name);
        if (function == null) {
            throw context.error(node, "calls unknown function '" + name + "'");
        }
        List<String> arguments = new ArrayList<>();
        if (context.requiresCancellation(name)) {
            String cancellation = context.cancellationVariable();
            if (cancellation == null) {
                throw context.error(
                        node,
                        "function '" + name + "' waits and needs a cancellation token here");
            }
            arguments.add(cancellation);
        }
        arguments.add(context.requireSession(node));
        arguments.add(context.stateVariable());
        arguments.addAll(
                NodeSupport.namedArguments(context, node, "args", function.getParameters()));
        context.markThrowsChecked();

        String call = Names.functionMethod(name) + "(" + String.join(", ", arguments) + ")";
        if (function.hasReturnType()) {
            String returnType =
                    ParameterTypes.toJavaType(context.getSchema(), function.getReturnType());
            context.declareOutput(node, "result", returnType, call);
        } else {
            context.code().stmt(call);
        }
    }
}

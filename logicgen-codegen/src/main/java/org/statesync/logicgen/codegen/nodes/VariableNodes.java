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
import org.statesync.logicgen.codegen.generator.JavaExpression;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.graph.ReferenceValue;
import org.statesync.logicgen.codegen.graph.ReferenceValue.ReferenceKind;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/**
 * Graph variables and constants. Variables are method locals declared up front, so a value set
 * inside a loop or branch is visible after it.
 */
final class VariableNodes {

    private static final String CATEGORY = "variable";

    private VariableNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("SetVariable")
                        .category(CATEGORY)
                        .description("Assigns a graph variable.")
                        .input(required("name", "string"))
                        .input(required("value", "any"))
                        .emitter(VariableNodes::emitSetVariable)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("GetVariable")
                        .category(CATEGORY)
                        .description("Reads a graph variable.")
                        .input(required("name", "string"))
                        .output("value", "any")
                        .emitter(VariableNodes::emitGetVariable)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("Constant")
                        .category(CATEGORY)
                        .description("A fixed value.")
                        .input(required("value", "any"))
                        .output("value", "any")
                        .emitter(VariableNodes::emitConstant)
                        .build());
    }

    private static void emitSetVariable(EmitContext context, Node node) {
        context.assignVariable(
                node,
                context.requireConstantString(node, "name"),
                context.resolveInput(node, "value"));
    }

    /** Copies the variable so that later assignments do not change this output. */
    private static void emitGetVariable(EmitContext context, Node node) {
        String name = context.requireConstantString(node, "name");
        JavaExpression value =
                context.resolveValue(node, ReferenceValue.of(ReferenceKind.VARIABLE, name));
        context.declareOutput(node, "value", value.getType(), value.getCode());
    }

    private static void emitConstant(EmitContext context, Node node) {
        JavaExpression value = context.resolveInput(node, "value");
        context.declareOutput(node, "value", value.getType(), value.getCode());
    }
}

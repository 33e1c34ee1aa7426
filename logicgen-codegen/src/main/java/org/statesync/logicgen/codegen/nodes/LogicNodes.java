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
import org.statesync.logicgen.codegen.generator.Comparisons;
import org.statesync.logicgen.codegen.generator.EmitContext;
import org.statesync.logicgen.codegen.generator.JavaExpression;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.schema.JavaTypes;

import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/** Boolean logic and comparisons. */
final class LogicNodes {

    private static final String CATEGORY = "logic";

    private LogicNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                binary("And", "Both inputs are true.").emitter(LogicNodes::emitAnd).build());
        registry.registerCore(
                binary("Or", "Either input is true.").emitter(LogicNodes::emitOr).build());
        registry.registerCore(
                NodeDefinition.newBuilder("Not")
                        .category(CATEGORY)
                        .description("Negates a boolean.")
                        .input(required("value", "bool"))
                        .output("result", "bool")
                        .emitter(LogicNodes::emitNot)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("Compare")
                        .category(CATEGORY)
                        .description("Compares two values with ==, !=, <, <=, > or >=.")
                        .input(required("left", "any"))
                        .input(required("op", "string"))
                        .input(required("right", "any"))
                        .output("result", "bool")
                        .emitter(LogicNodes::emitCompare)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("IsNull")
                        .category(CATEGORY)
                        .description("Whether a value is null.")
                        .input(required("value", "any"))
                        .output("result", "bool")
                        .emitter(LogicNodes::emitIsNull)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("IsEmpty")
                        .category(CATEGORY)
                        .description("Whether a value is null, an empty string or collection.")
                        .input(required("value", "any"))
                        .output("result", "bool")
                        .emitter(LogicNodes::emitIsEmpty)
                        .build());
    }

    private static NodeDefinition.Builder binary(String type, String description) {
        return NodeDefinition.newBuilder(type)
                .category(CATEGORY)
                .description(description)
                .input(required("a", "bool"))
                .input(required("b", "bool"))
                .output("result", "bool");
    }

    private static void emitAnd(EmitContext context, Node node) {
        emitBinary(context, node, "&&");
    }

    private static void emitOr(EmitContext context, Node node) {
        emitBinary(context, node, "||");
    }

    private static void emitBinary(EmitContext context, Node node, String operator) {
        String a = Coercions.toBoolean(context.resolveInput(node, "a"));
        String b = Coercions.toBoolean(context.resolveInput(node, "b"));
        context.declareOutput(
                node,
                "result",
                "boolean",
                NodeSupport.paren(a) + " " + operator + " " + NodeSupport.paren(b));
    }

    private static void emitNot(EmitContext context, Node node) {
        String value = Coercions.toBoolean(context.resolveInput(node, "value"));
        context.declareOutput(node, "result", "boolean", "!" + NodeSupport.paren(value));
    }

    private static void emitCompare(EmitContext context, Node node) {
        String op = context.requireConstantString(node, "op");
        if (!Comparisons.isSupported(op)) {
            throw context.error(node, "unsupported comparison operator '" + op + "'");
        }
        JavaExpression left = context.resolveInput(node, "left");
        JavaExpression right = context.resolveInput(node, "right");
        context.declareOutput(node, "result", "boolean", Comparisons.condition(op, left, right));
    }

    private static void emitIsNull(EmitContext context, Node node) {
        JavaExpression value = context.resolveInput(node, "value");
        String check =
                value.isTyped() && JavaTypes.isPrimitive(value.getType())
                        ? "false"
                        : value.getCode() + " == null";
        context.declareOutput(node, "result", "boolean", check);
    }

    private static void emitIsEmpty(EmitContext context, Node node) {
        context.declareOutput(
                node,
                "result",
                "boolean",
                "Values.isEmpty(" + context.resolveInput(node, "value").getCode() + ")");
    }
}

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
import org.statesync.logicgen.codegen.registry.NodeEmitter;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/**
 * Arithmetic. Sums, differences, products, remainders, minimum and maximum keep the wider of
 * both primitive operand types; everything else computes in {@code double}. Division and modulo
 * by zero yield zero.
 */
final class MathNodes {

    private static final String CATEGORY = "math";

    private MathNodes() {}

    static void register(NodeTypeRegistry registry) {
        registerBinary(registry, "Add", "Sum of a and b.", MathNodes::emitAdd);
        registerBinary(registry, "Subtract", "Difference of a and b.", MathNodes::emitSubtract);
        registerBinary(registry, "Multiply", "Product of a and b.", MathNodes::emitMultiply);
        registerBinary(registry, "Divide", "Quotient of a and b.", MathNodes::emitDivide);
        registerBinary(registry, "Modulo", "Remainder of a and b.", MathNodes::emitModulo);
        registerBinary(registry, "Min", "The smaller of a and b.", MathNodes::emitMin);
        registerBinary(registry, "Max", "The larger of a and b.", MathNodes::emitMax);

        registerUnary(registry, "Abs", "Math.abs(%s)");
        registerUnary(registry, "Round", "(double) Math.round(%s)");
        registerUnary(registry, "Floor", "Math.floor(%s)");
        registerUnary(registry, "Ceil", "Math.ceil(%s)");
        registerUnary(registry, "Sqrt", "Math.sqrt(%s)");
        registerUnary(registry, "Sin", "Math.sin(%s)");
        registerUnary(registry, "Cos", "Math.cos(%s)");

        registry.registerCore(
                NodeDefinition.newBuilder("Pow")
                        .category(CATEGORY)
                        .description("base raised to exp.")
                        .input(required("base", "float64"))
                        .input(required("exp", "float64"))
                        .output("result", "float64")
                        .emitter(
                                (context, node) ->
                                        emitCall(context, node, "Math.pow", "base", "exp"))
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("Atan2")
                        .category(CATEGORY)
                        .description("The angle of the point (x, y) in radians.")
                        .input(required("y", "float64"))
                        .input(required("x", "float64"))
                        .output("result", "float64")
                        .emitter(
                                (context, node) ->
                                        emitCall(context, node, "Math.atan2", "y", "x"))
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("Clamp")
                        .category(CATEGORY)
                        .description("value limited to the range [min, max].")
                        .input(required("value", "float64"))
                        .input(required("min", "float64"))
                        .input(required("max", "float64"))
                        .output("result", "float64")
                        .emitter(MathNodes::emitClamp)
                        .build());
    }

    private static void registerBinary(
            NodeTypeRegistry registry, String type, String description, NodeEmitter emitter) {
        registry.registerCore(
                NodeDefinition.newBuilder(type)
                        .category(CATEGORY)
                        .description(description)
                        .input(required("a", "number"))
                        .input(required("b", "number"))
                        .output("result", "number")
                        .emitter(emitter)
                        .build());
    }

    /** A one-argument function of {@code value}; {@code template} receives the operand. */
    private static void registerUnary(NodeTypeRegistry registry, String type, String template) {
        registry.registerCore(
                NodeDefinition.newBuilder(type)
                        .category(CATEGORY)
                        .description(type + " of value.")
                        .input(required("value", "float64"))
                        .output("result", "float64")
                        .emitter((context, node) -> emitUnary(context, node, template))
                        .build());
    }

    private static void emitUnary(EmitContext context, Node node, String template) {
        String value = Coercions.toDouble(context.resolveInput(node, "value"));
        context.declareOutput(node, "result", "double", String.format(template, value));
    }

    private static void emitAdd(EmitContext context, Node node) {
        emitArithmetic(context, node, "+");
    }

    private static void emitSubtract(EmitContext context, Node node) {
        emitArithmetic(context, node, "-");
    }

    private static void emitMultiply(EmitContext context, Node node) {
        emitArithmetic(context, node, "*");
    }

    private static void emitArithmetic(EmitContext context, Node node, String operator) {
        Operands operands = Operands.of(context, node);
        context.declareOutput(
                node,
                "result",
                operands.type,
                NodeSupport.paren(operands.a)
                        + " "
                        + operator
                        + " "
                        + NodeSupport.paren(operands.b));
    }

    private static void emitDivide(EmitContext context, Node node) {
        String a = Coercions.toDouble(context.resolveInput(node, "a"));
        String divisor = context.newLocal(node.getId() + "_divisor");
        String b = Coercions.toDouble(context.resolveInput(node, "b"));
        context.code().declare("double", divisor, b);
        context.declareOutput(
                node,
                "result",
                "double",
                divisor + " == 0 ? 0.0 : " + NodeSupport.paren(a) + " / " + divisor);
    }

    private static void emitModulo(EmitContext context, Node node) {
        Operands operands = Operands.of(context, node);
        String divisor = context.newLocal(node.getId() + "_divisor");
        context.code().declare(operands.type, divisor, operands.b);
        context.declareOutput(
                node,
                "result",
                operands.type,
                divisor + " == 0 ? 0 : " + NodeSupport.paren(operands.a) + " % " + divisor);
    }

    private static void emitMin(EmitContext context, Node node) {
        Operands operands = Operands.of(context, node);
        context.declareOutput(
                node, "result", operands.type, "Math.min(" + operands.a + ", " + operands.b + ")");
    }

    private static void emitMax(EmitContext context, Node node) {
        Operands operands = Operands.of(context, node);
        context.declareOutput(
                node, "result", operands.type, "Math.max(" + operands.a + ", " + operands.b + ")");
    }

    private static void emitCall(
            EmitContext context, Node node, String function, String first, String second) {
        String a = Coercions.toDouble(context.resolveInput(node, first));
        String b = Coercions.toDouble(context.resolveInput(node, second));
        context.declareOutput(node, "result", "double", function + "(" + a + ", " + b + ")");
    }

    private static void emitClamp(EmitContext context, Node node) {
        String value = Coercions.toDouble(context.resolveInput(node, "value"));
        String min = Coercions.toDouble(context.resolveInput(node, "min"));
        String max = Coercions.toDouble(context.resolveInput(node, "max"));
        context.declareOutput(
                node,
                "result",
                "double",
                "Math.max(" + min + ", Math.min(" + max + ", " + value + "))");
    }

    /** Both operands of a binary node, converted to their common type. */
    private static final class Operands {
        private final String type;
        private final String a;
        private final String b;

        private Operands(String type, String a, String b) {
            this.type = type;
            this.a = a;
            this.b = b;
        }

        static Operands of(EmitContext context, Node node) {
            JavaExpression a = context.resolveInput(node, "a");
            JavaExpression b = context.resolveInput(node, "b");
            String type = Coercions.numericResultType(a, b);
            return new Operands(type, Coercions.coerceTo(type, a), Coercions.coerceTo(type, b));
        }
    }
}

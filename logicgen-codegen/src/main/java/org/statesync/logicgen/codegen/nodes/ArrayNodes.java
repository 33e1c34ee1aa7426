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

import static org.statesync.logicgen.codegen.registry.PortDefinition.optional;
import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/**
 * Array kinds. Those taking a {@code path} mutate the state through the array accessors; those
 * taking an {@code array} value work on a copy and leave their input untouched.
 */
final class ArrayNodes {

    private static final String CATEGORY = "array";

    private ArrayNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("AddToArray")
                        .category(CATEGORY)
                        .description("Appends to a state array or to a copy of an array.")
                        .input(optional("array", "[]any"))
                        .input(optional("path", "string"))
                        .input(required("element", "any"))
                        .output("result", "[]any")
                        .emitter(ArrayNodes::emitAddToArray)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("ArrayAppend")
                        .category(CATEGORY)
                        .description("Appends an item to the array at a state path.")
                        .input(required("path", "string"))
                        .input(required("item", "any"))
                        .emitter(ArrayNodes::emitArrayAppend)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("RemoveFromArray")
                        .category(CATEGORY)
                        .description("Removes the element at an index of a state array.")
                        .input(required("path", "string"))
                        .input(required("index", "int"))
                        .emitter(ArrayNodes::emitRemoveFromArray)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("FilterArray")
                        .category(CATEGORY)
                        .description("The elements matching a condition.")
                        .input(required("array", "[]any"))
                        .input(optional("field", "string"))
                        .input(optional("op", "string", "=="))
                        .input(optional("value", "any"))
                        .output("result", "[]any")
                        .emitter(ArrayNodes::emitFilterArray)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("FindInArray")
                        .category(CATEGORY)
                        .description("The first element equal to a value, or whose field is.")
                        .input(required("array", "[]any"))
                        .input(optional("field", "string"))
                        .input(required("value", "any"))
                        .output("item", "any")
                        .output("index", "int")
                        .emitter(ArrayNodes::emitFindInArray)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("ArrayLength")
                        .category(CATEGORY)
                        .description("The number of elements.")
                        .input(required("array", "[]any"))
                        .output("length", "int")
                        .emitter(ArrayNodes::emitArrayLength)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("ArrayAt")
                        .category(CATEGORY)
                        .description("The element at an index; null when out of bounds.")
                        .input(required("array", "[]any"))
                        .input(required("index", "int"))
                        .output("item", "any")
                        .output("valid", "bool")
                        .emitter(ArrayNodes::emitArrayAt)
                        .build());
    }

    private static void emitAddToArray(EmitContext context, Node node) {
        JavaExpression element = context.resolveInput(node, "element");
        if (node.isInputProvided("path")) {
            String path = context.requireConstantString(node, "path");
            context.appendToPath(node, path, element);
            context.bindOutput(node, "result", context.readPath(node, path));
            return;
        }
        if (!node.isInputProvided("array")) {
            throw context.error(node, "AddToArray needs an array or a path");
        }
        JavaExpression array = context.resolveInput(node, "array");
        String elementType = JavaTypes.boxed(Coercions.elementType(array));
        context.addImport(NodeSupport.ARRAY_LIST);
        String result =
                context.declareOutput(
                        node,
                        "result",
                        "List<" + elementType + ">",
                        "new ArrayList<" + elementType + ">(" + Coercions.toList(array) + ")");
        context.code()
                .stmt(result + ".add(" + Coercions.coerceTo(elementType, element) + ")");
    }

    private static void emitArrayAppend(EmitContext context, Node node) {
        context.appendToPath(
                node,
                context.requireConstantString(node, "path"),
                context.resolveInput(node, "item"));
    }

    private static void emitRemoveFromArray(EmitContext context, Node node) {
        context.removeFromPath(
                node,
                context.requireConstantString(node, "path"),
                context.resolveInput(node, "index"));
    }

    private static void emitFilterArray(EmitContext context, Node node) {
        JavaExpression list = arrayInput(context, node);
        String elementType = Coercions.elementType(list);
        context.addImport(NodeSupport.ARRAY_LIST);
        String result =
                context.declareOutput(
                        node, "result", list.getType(), "new ArrayList<" + elementType + ">()");
        String item = context.newLocal(node.getId() + "_item");
        context.code().beginForEach(elementType, item, list.getCode());
        if (node.isInputProvided("value")) {
            String condition =
                    NodeSupport.matchCondition(
                            context,
                            node,
                            JavaExpression.of(item, elementType),
                            NodeSupport.optionalConstantString(context, node, "field"),
                            context.requireConstantString(node, "op"),
                            context.resolveInput(node, "value"));
            context.code().beginIf(condition).stmt(result + ".add(" + item + ")").endIf();
        } else {
            // without a value every element passes
            context.code().stmt(result + ".add(" + item + ")");
        }
        context.code().endFor();
    }

    private static void emitFindInArray(EmitContext context, Node node) {
        JavaExpression list = arrayInput(context, node);
        String elementType = Coercions.elementType(list);
        String item = context.declareOutput(node, "item", elementType, "null");
        String index = context.declareOutput(node, "index", "int", "-1");
        String counter = context.newLocal("i");
        String candidate = list.getCode() + ".get(" + counter + ")";
        String condition =
                NodeSupport.matchCondition(
                        context,
                        node,
                        JavaExpression.of(candidate, elementType),
                        NodeSupport.optionalConstantString(context, node, "field"),
                        "==",
                        context.resolveInput(node, "value"));
        context.code()
                .beginFor(
                        "int " + counter + " = 0",
                        counter + " < " + list.getCode() + ".size()",
                        counter + "++")
                .beginIf(condition)
                .assign(index, counter)
                .assign(item, candidate)
                .breakStmt()
                .endIf()
                .endFor();
    }

    private static void emitArrayLength(EmitContext context, Node node) {
        JavaExpression array = context.resolveInput(node, "array");
        String length =
                array.isList()
                        ? array.getCode() + ".size()"
                        : "Values.sizeOf(" + array.getCode() + ")";
        context.declareOutput(node, "length", "int", length);
    }

    private static void emitArrayAt(EmitContext context, Node node) {
        JavaExpression list = arrayInput(context, node);
        String elementType = Coercions.elementType(list);
        String index = context.newLocal(node.getId() + "_position");
        context.code().declare("int", index, Coercions.toInt(context.resolveInput(node, "index")));
        String valid =
                context.declareOutput(
                        node,
                        "valid",
                        "boolean",
                        index + " >= 0 && " + index + " < " + list.getCode() + ".size()");
        context.declareOutput(
                node,
                "item",
                elementType,
                valid + " ? " + list.getCode() + ".get(" + index + ") : null");
    }

    private static JavaExpression arrayInput(EmitContext context, Node node) {
        return NodeSupport.declareList(context, node, context.resolveInput(node, "array"));
    }
}

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
import org.statesync.logicgen.codegen.generator.RecordAccess;
import org.statesync.logicgen.codegen.graph.InputValue;
import org.statesync.logicgen.codegen.graph.MapValue;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.graph.ReferenceValue;
import org.statesync.logicgen.codegen.graph.ReferenceValue.ReferenceKind;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.statesync.logicgen.codegen.registry.PortDefinition.optional;
import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/** Conditional operations over whole arrays, and views. */
final class BatchNodes {

    private static final String CATEGORY = "batch";

    private BatchNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("UpdateWhere")
                        .category(CATEGORY)
                        .description("Updates the matching elements of a state array.")
                        .input(required("path", "string"))
                        .input(required("whereField", "string"))
                        .input(optional("whereOp", "string", "=="))
                        .input(required("whereValue", "any"))
                        .input(optional("setField", "string"))
                        .input(optional("setValue", "any"))
                        .input(optional("updates", "map"))
                        .output("count", "int")
                        .emitter(BatchNodes::emitUpdateWhere)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("FindWhere")
                        .category(CATEGORY)
                        .description("The first element whose field matches a condition.")
                        .input(required("array", "[]any"))
                        .input(required("field", "string"))
                        .input(optional("op", "string", "=="))
                        .input(required("value", "any"))
                        .output("item", "any")
                        .output("index", "int")
                        .output("found", "bool")
                        .emitter(BatchNodes::emitFindWhere)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("CountWhere")
                        .category(CATEGORY)
                        .description("The number of elements whose field matches a condition.")
                        .input(required("array", "[]any"))
                        .input(required("field", "string"))
                        .input(optional("op", "string", "=="))
                        .input(required("value", "any"))
                        .output("count", "int")
                        .emitter(BatchNodes::emitCountWhere)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("GetView")
                        .category("view")
                        .description("Evaluates a view of the state.")
                        .input(required("view", "string"))
                        .output("value", "number")
                        .emitter(BatchNodes::emitGetView)
                        .build());
    }

    /**
     * Elements are updated in place, so the array must hold records or maps. The fields to set
     * come from {@code updates}, or from the {@code setField} and {@code setValue} pair.
     */
    private static void emitUpdateWhere(EmitContext context, Node node) {
        String path = context.requireConstantString(node, "path");
        Map<String, JavaExpression> updates = updates(context, node);
        JavaExpression list =
                NodeSupport.declareList(context, node, context.readPath(node, path));
        String elementType = Coercions.elementType(list);
        String itemLocal = context.newLocal(node.getId() + "_item");
        JavaExpression item = JavaExpression.of(itemLocal, elementType);
        String condition =
                NodeSupport.matchCondition(
                        context,
                        node,
                        item,
                        context.requireConstantString(node, "whereField"),
                        context.requireConstantString(node, "whereOp"),
                        context.resolveInput(node, "whereValue"));
        String count = context.declareOutput(node, "count", "int", "0");
        context.code().beginForEach(elementType, item.getCode(), list.getCode()).beginIf(condition);
        for (Map.Entry<String, JavaExpression> update : updates.entrySet()) {
            context.code()
                    .stmt(RecordAccess.write(context, item, update.getKey(), update.getValue()));
        }
        context.code().stmt(count + "++").endIf().endFor();
    }

    private static Map<String, JavaExpression> updates(EmitContext context, Node node) {
        Map<String, JavaExpression> updates = new LinkedHashMap<>();
        InputValue input = node.getInput("updates");
        if (input != null) {
            if (input.getKind() != InputValue.Kind.MAP) {
                throw context.error(node, "input 'updates' must be a map of field values");
            }
            for (Map.Entry<String, InputValue> entry :
                    ((MapValue) input).getEntries().entrySet()) {
                updates.put(entry.getKey(), context.resolveValue(node, entry.getValue()));
            }
        } else if (node.isInputProvided("setField")) {
            updates.put(
                    context.requireConstantString(node, "setField"),
                    context.resolveInput(node, "setValue"));
        } else {
            throw context.error(node, "UpdateWhere needs 'updates' or 'setField' and 'setValue'");
        }
        return updates;
    }

    private static void emitFindWhere(EmitContext context, Node node) {
        JavaExpression list = arrayInput(context, node);
        String elementType = Coercions.elementType(list);
        String item = context.declareOutput(node, "item", elementType, "null");
        String index = context.declareOutput(node, "index", "int", "-1");
        String found = context.declareOutput(node, "found", "boolean", "false");
        String counter = context.newLocal("i");
        String candidate = list.getCode() + ".get(" + counter + ")";
        String condition = condition(context, node, JavaExpression.of(candidate, elementType));
        context.code()
                .beginFor(
                        "int " + counter + " = 0",
                        counter + " < " + list.getCode() + ".size()",
                        counter + "++")
                .beginIf(condition)
                .assign(index, counter)
                .assign(item, candidate)
                .assign(found, "true")
                .breakStmt()
                .endIf()
                .endFor();
    }

    private static void emitCountWhere(EmitContext context, Node node) {
        JavaExpression list = arrayInput(context, node);
        String elementType = Coercions.elementType(list);
        String count = context.declareOutput(node, "count", "int", "0");
        String item = context.newLocal(node.getId() + "_item");
        String condition = condition(context, node, JavaExpression.of(item, elementType));
        context.code()
                .beginForEach(elementType, item, list.getCode())
                .beginIf(condition)
                .stmt(count + "++")
                .endIf()
                .endFor();
    }

    private static void emitGetView(EmitContext context, Node node) {
        String view = context.requireConstantString(node, "view");
        JavaExpression value =
                context.resolveValue(node, ReferenceValue.of(ReferenceKind.VIEW, view));
        context.declareOutput(node, "value", value.getType(), value.getCode());
    }

    private static String condition(EmitContext context, Node node, JavaExpression item) {
        return NodeSupport.matchCondition(
                context,
                node,
                item,
                context.requireConstantString(node, "field"),
                context.requireConstantString(node, "op"),
                context.resolveInput(node, "value"));
    }

    private static JavaExpression arrayInput(EmitContext context, Node node) {
        return NodeSupport.declareList(context, node, context.resolveInput(node, "array"));
    }
}

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
import org.statesync.logicgen.codegen.generator.RecordAccess;
import org.statesync.logicgen.codegen.graph.InputValue;
import org.statesync.logicgen.codegen.graph.MapValue;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.schema.FieldDef;
import org.statesync.logicgen.codegen.schema.SchemaContext;
import org.statesync.logicgen.codegen.schema.TypeDef;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.statesync.logicgen.codegen.registry.PortDefinition.optional;
import static org.statesync.logicgen.codegen.registry.PortDefinition.required;
import static org.statesync.logicgen.utils.StringUtils.quote;

/**
 * Records. With a schema, structs of a declared type are instances of the generated record
 * class; otherwise they are plain maps.
 */
final class StructNodes {

    private static final String CATEGORY = "struct";

    private StructNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("CreateStruct")
                        .category(CATEGORY)
                        .description("Creates a struct from field values.")
                        .input(optional("type", "string"))
                        .input(required("fields", "map"))
                        .output("result", "any")
                        .emitter(StructNodes::emitCreateStruct)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("UpdateStruct")
                        .category(CATEGORY)
                        .description("Writes field values into a struct.")
                        .input(required("object", "any"))
                        .input(required("fields", "map"))
                        .output("result", "any")
                        .emitter(StructNodes::emitUpdateStruct)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("GetStructField")
                        .category(CATEGORY)
                        .description("Reads one field of a struct.")
                        .input(required("object", "any"))
                        .input(required("field", "string"))
                        .output("value", "any")
                        .emitter(StructNodes::emitGetStructField)
                        .build());
    }

    private static void emitCreateStruct(EmitContext context, Node node) {
        Map<String, InputValue> fields = fieldsInput(context, node);
        String typeName = NodeSupport.optionalConstantString(context, node, "type");
        SchemaContext schema = context.getSchema();
        if (typeName == null || schema == null) {
            List<String> entries = new ArrayList<>();
            for (Map.Entry<String, InputValue> entry : fields.entrySet()) {
                entries.add(quote(entry.getKey()));
                entries.add(context.resolveValue(node, entry.getValue()).getCode());
            }
            context.declareOutput(
                    node,
                    "result",
                    "Map<String, Object>",
                    "Values.mapOf(" + String.join(", ", entries) + ")");
            return;
        }
        if (!schema.hasType(typeName)) {
            throw context.error(node, "unknown struct type '" + typeName + "'");
        }
        TypeDef type = schema.getType(typeName);
        for (String field : fields.keySet()) {
            if (type.findField(field) == null) {
                throw context.error(
                        node, "type '" + typeName + "' has no field '" + field + "'");
            }
        }
        String result = context.declareOutput(node, "result", typeName, "new " + typeName + "()");
        JavaExpression target = JavaExpression.of(result, typeName);
        for (FieldDef field : type.getFields()) {
            InputValue value = fields.get(field.getName());
            if (value != null) {
                context.code()
                        .stmt(
                                RecordAccess.write(
                                        context,
                                        target,
                                        field.getName(),
                                        context.resolveValue(node, value)));
            }
        }
    }

    /** Writes the fields into the struct in place; the result is the same struct. */
    private static void emitUpdateStruct(EmitContext context, Node node) {
        Map<String, InputValue> fields = fieldsInput(context, node);
        JavaExpression object = context.resolveInput(node, "object");
        String result = context.declareOutput(node, "result", object.getType(), object.getCode());
        JavaExpression target =
                object.isTyped()
                        ? JavaExpression.of(result, object.getType())
                        : JavaExpression.untyped(result);
        TypeDef record = RecordAccess.recordTypeOf(context, target);
        for (Map.Entry<String, InputValue> entry : fields.entrySet()) {
            if (record != null && record.findField(entry.getKey()) == null) {
                throw context.error(
                        node,
                        "type '" + record.getName() + "' has no field '" + entry.getKey() + "'");
            }
            JavaExpression value = context.resolveValue(node, entry.getValue());
            context.code().stmt(RecordAccess.write(context, target, entry.getKey(), value));
        }
    }

    private static void emitGetStructField(EmitContext context, Node node) {
        JavaExpression object = context.resolveInput(node, "object");
        String field = context.requireConstantString(node, "field");
        TypeDef record = RecordAccess.recordTypeOf(context, object);
        if (record != null && record.findField(field) == null) {
            throw context.error(
                    node, "type '" + record.getName() + "' has no field '" + field + "'");
        }
        JavaExpression value = RecordAccess.read(context, object, field);
        context.declareOutput(node, "value", value.getType(), value.getCode());
    }

    private static Map<String, InputValue> fieldsInput(EmitContext context, Node node) {
        InputValue fields = node.getInput("fields");
        if (fields == null || fields.getKind() != InputValue.Kind.MAP) {
            throw context.error(node, "input 'fields' must be a map of field values");
        }
        return ((MapValue) fields).getEntries();
    }
}

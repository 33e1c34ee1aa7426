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

package org.statesync.logicgen.codegen.typescript;

import org.statesync.logicgen.annotation.Internal;
import org.statesync.logicgen.codegen.graph.EventHandler;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.graph.Parameter;
import org.statesync.logicgen.codegen.schema.FieldDef;
import org.statesync.logicgen.codegen.schema.FieldType;
import org.statesync.logicgen.codegen.schema.SchemaDefinition;
import org.statesync.logicgen.codegen.schema.TypeDef;

import javax.annotation.Nullable;

import static org.statesync.logicgen.utils.StringUtils.capitalize;
import static org.statesync.logicgen.utils.StringUtils.quote;
import static org.statesync.logicgen.utils.StringUtils.toIdentifier;

/**
 * Generates the TypeScript module a client uses to talk to the generated handlers: one interface
 * per schema type, the {@code EventName} constants, and per handler a parameter interface and a
 * typed send function.
 */
@Internal
public class TypeScriptBindingsGenerator {

    private static final String INDENT = "  ";

    @Nullable private final SchemaDefinition schema;

    public TypeScriptBindingsGenerator(@Nullable SchemaDefinition schema) {
        this.schema = schema;
    }

    public String generate(NodeGraph graph) {
        StringBuilder ts = new StringBuilder();
        ts.append("// Code generated by logicgen. DO NOT EDIT.\n");
        if (!graph.getVersion().isEmpty()) {
            ts.append("// Graph version: ").append(graph.getVersion()).append('\n');
        }
        if (schema != null) {
            for (TypeDef type : schema.getTypes()) {
                ts.append('\n');
                writeInterface(ts, type);
            }
        }

        ts.append("\nexport const EventName = {\n");
        for (EventHandler handler : graph.getHandlers()) {
            ts.append(INDENT)
                    .append(typeName(handler))
                    .append(": ")
                    .append(quote(handler.getEvent()))
                    .append(",\n");
        }
        ts.append("} as const;\n\n");
        ts.append("export type EventName = (typeof EventName)[keyof typeof EventName];\n\n");
        ts.append("/** Delivers an event to the server. */\n");
        ts.append("export type Send = (event: EventName, params: unknown) => void;\n");

        for (EventHandler handler : graph.getHandlers()) {
            ts.append('\n');
            writeHandler(ts, handler);
        }
        return ts.toString();
    }

    private static void writeInterface(StringBuilder ts, TypeDef type) {
        ts.append("export interface ").append(type.getName()).append(" {\n");
        for (FieldDef field : type.getFields()) {
            FieldType fieldType = field.getType();
            boolean optional =
                    field.isOptional() || fieldType.getCategory() == FieldType.Category.OPTIONAL;
            // an optional field is written as name?: T rather than name: T | null
            FieldType written =
                    fieldType.getCategory() == FieldType.Category.OPTIONAL
                            ? fieldType.getElementType()
                            : fieldType;
            ts.append(INDENT)
                    .append(field.getName())
                    .append(optional ? "?: " : ": ")
                    .append(TypeScriptTypeMapper.toTypeScript(written))
                    .append(";\n");
        }
        ts.append("}\n");
    }

    private static void writeHandler(StringBuilder ts, EventHandler handler) {
        String paramsType = typeName(handler) + "Params";
        ts.append("export interface ").append(paramsType).append(" {\n");
        for (Parameter parameter : handler.getParameters()) {
            ts.append(INDENT)
                    .append(parameter.getName())
                    .append(": ")
                    .append(TypeScriptTypeMapper.parameterType(parameter.getType()))
                    .append(";\n");
        }
        ts.append("}\n\n");
        ts.append("export function send")
                .append(typeName(handler))
                .append("(send: Send, params: ")
                .append(paramsType)
                .append("): void {\n")
                .append(INDENT)
                .append("send(EventName.")
                .append(typeName(handler))
                .append(", params);\n")
                .append("}\n");
    }

    private static String typeName(EventHandler handler) {
        return capitalize(toIdentifier(handler.getName()));
    }
}

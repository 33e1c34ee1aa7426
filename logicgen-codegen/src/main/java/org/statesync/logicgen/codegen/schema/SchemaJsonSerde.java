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

package org.statesync.logicgen.codegen.schema;

import org.statesync.logicgen.annotation.Internal;
import org.statesync.logicgen.codegen.exception.SchemaParseException;
import org.statesync.logicgen.utils.json.JsonDeserializer;
import org.statesync.logicgen.utils.json.JsonSerializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Json serializer and deserializer for {@link SchemaDefinition}. */
@Internal
public class SchemaJsonSerde
        implements JsonSerializer<SchemaDefinition>, JsonDeserializer<SchemaDefinition> {

    public static final SchemaJsonSerde INSTANCE = new SchemaJsonSerde();

    private static final String PACKAGE_NAME = "package";
    private static final String TYPES_NAME = "types";
    private static final String NAME = "name";
    private static final String ID = "id";
    private static final String FIELDS_NAME = "fields";
    private static final String TYPE = "type";
    private static final String KEY = "key";
    private static final String OPTIONAL = "optional";

    @Override
    public void serialize(SchemaDefinition schema, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeStringField(PACKAGE_NAME, schema.getPackageName());
        generator.writeArrayFieldStart(TYPES_NAME);
        for (TypeDef type : schema.getTypes()) {
            generator.writeStartObject();
            generator.writeStringField(NAME, type.getName());
            generator.writeNumberField(ID, type.getId());
            generator.writeArrayFieldStart(FIELDS_NAME);
            for (FieldDef field : type.getFields()) {
                generator.writeStartObject();
                generator.writeStringField(NAME, field.getName());
                generator.writeStringField(TYPE, field.getType().toString());
                if (field.isKey()) {
                    generator.writeBooleanField(KEY, true);
                }
                if (field.isOptional()) {
                    generator.writeBooleanField(OPTIONAL, true);
                }
                generator.writeEndObject();
            }
            generator.writeEndArray();
            generator.writeEndObject();
        }
        generator.writeEndArray();
        generator.writeEndObject();
    }

    @Override
    public SchemaDefinition deserialize(JsonNode node) {
        if (!node.isObject()) {
            throw new SchemaParseException("Schema document must be a JSON object.");
        }
        JsonNode typesJson = node.get(TYPES_NAME);
        if (typesJson == null || !typesJson.isArray() || typesJson.size() == 0) {
            throw new SchemaParseException("Schema must declare a non-empty 'types' array.");
        }
        List<TypeDef> types = new ArrayList<>();
        Set<String> typeNames = new HashSet<>();
        for (JsonNode typeJson : typesJson) {
            String typeName = requiredText(typeJson, NAME, "schema type");
            if (!typeNames.add(typeName)) {
                throw new SchemaParseException("Duplicate schema type '" + typeName + "'.");
            }
            int id = typeJson.path(ID).asInt(types.size() + 1);
            List<FieldDef> fields = new ArrayList<>();
            Set<String> fieldNames = new HashSet<>();
            JsonNode fieldsJson = typeJson.get(FIELDS_NAME);
            if (fieldsJson != null && fieldsJson.isArray()) {
                for (JsonNode fieldJson : fieldsJson) {
                    String where = "type '" + typeName + "'";
                    String fieldName = requiredText(fieldJson, NAME, where + " field");
                    if (!fieldNames.add(fieldName)) {
                        throw new SchemaParseException(
                                where + ": duplicate field '" + fieldName + "'.");
                    }
                    String typeText =
                            requiredText(fieldJson, TYPE, where + ", field '" + fieldName + "'");
                    fields.add(
                            new FieldDef(
                                    fieldName,
                                    FieldType.parse(typeText),
                                    fieldJson.path(KEY).asBoolean(false),
                                    fieldJson.path(OPTIONAL).asBoolean(false)));
                }
            }
            types.add(new TypeDef(typeName, id, fields));
        }
        JsonNode packageJson = node.get(PACKAGE_NAME);
        return new SchemaDefinition(packageJson == null ? "" : packageJson.asText(), types);
    }

    private static String requiredText(JsonNode json, String field, String where) {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new SchemaParseException(where + ": missing mandatory field '" + field + "'.");
        }
        return value.asText();
    }
}

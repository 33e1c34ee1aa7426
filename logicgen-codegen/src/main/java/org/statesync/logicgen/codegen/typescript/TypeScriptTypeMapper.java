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
import org.statesync.logicgen.codegen.exception.CodeGenException;
import org.statesync.logicgen.codegen.exception.SchemaParseException;
import org.statesync.logicgen.codegen.schema.FieldType;

import javax.annotation.Nullable;

/** Maps schema and parameter types to TypeScript. */
@Internal
public final class TypeScriptTypeMapper {

    private TypeScriptTypeMapper() {}

    public static String toTypeScript(FieldType type) {
        switch (type.getCategory()) {
            case OPTIONAL:
                return union(toTypeScript(type.getElementType()), "null");
            case ARRAY:
                String element = toTypeScript(type.getElementType());
                return (element.contains(" ") ? "(" + element + ")" : element) + "[]";
            case MAP:
                return "Record<"
                        + toTypeScript(type.getKeyType())
                        + ", "
                        + toTypeScript(type.getElementType())
                        + ">";
            case RECORD:
                return type.getName();
            case PRIMITIVE:
                return primitive(type.getName());
            default:
                throw new IllegalStateException("Unknown type category " + type.getCategory());
        }
    }

    /**
     * Maps the type of a handler parameter, which besides schema types accepts the loose names
     * {@code number}, {@code integer}, {@code boolean} and {@code any}.
     */
    public static String parameterType(@Nullable String graphType) {
        if (graphType == null) {
            return "unknown";
        }
        String trimmed = graphType.trim();
        switch (trimmed) {
            case "":
            case "any":
            case "object":
                return "unknown";
            case "number":
            case "integer":
            case "long":
            case "float":
            case "double":
                return "number";
            case "boolean":
                return "boolean";
            default:
                break;
        }
        try {
            return toTypeScript(FieldType.parse(trimmed));
        } catch (SchemaParseException e) {
            throw new CodeGenException("Invalid parameter type '" + graphType + "'.", e);
        }
    }

    private static String primitive(String name) {
        switch (name) {
            case "string":
                return "string";
            case "bool":
                return "boolean";
            case "bytes":
                return "Uint8Array";
            case "any":
                return "unknown";
            default:
                // all integer and float widths
                return "number";
        }
    }

    private static String union(String type, String other) {
        return type.endsWith(" | " + other) ? type : type + " | " + other;
    }
}

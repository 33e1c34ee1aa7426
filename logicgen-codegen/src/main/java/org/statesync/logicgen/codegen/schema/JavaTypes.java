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

import java.util.HashMap;
import java.util.Map;

/** Mapping from schema field types to the Java types used by the generated state classes. */
@Internal
public final class JavaTypes {

    public static final String OBJECT = "Object";

    private static final Map<String, String> PRIMITIVE_TYPES = new HashMap<>();
    private static final Map<String, String> BOXED_TYPES = new HashMap<>();

    static {
        for (String small :
                new String[] {"int", "int8", "int16", "int32", "uint8", "uint16", "uint32"}) {
            PRIMITIVE_TYPES.put(small, "int");
        }
        PRIMITIVE_TYPES.put("int64", "long");
        PRIMITIVE_TYPES.put("uint", "long");
        PRIMITIVE_TYPES.put("uint64", "long");
        PRIMITIVE_TYPES.put("float32", "float");
        PRIMITIVE_TYPES.put("float64", "double");
        PRIMITIVE_TYPES.put("string", "String");
        PRIMITIVE_TYPES.put("bool", "boolean");
        PRIMITIVE_TYPES.put("bytes", "byte[]");
        PRIMITIVE_TYPES.put("any", OBJECT);

        BOXED_TYPES.put("int", "Integer");
        BOXED_TYPES.put("long", "Long");
        BOXED_TYPES.put("float", "Float");
        BOXED_TYPES.put("double", "Double");
        BOXED_TYPES.put("boolean", "Boolean");
        BOXED_TYPES.put("byte", "Byte");
        BOXED_TYPES.put("short", "Short");
        BOXED_TYPES.put("char", "Character");
    }

    private JavaTypes() {}

    /** The declared Java type of a field or parameter of the given schema type. */
    public static String toJavaType(FieldType type) {
        switch (type.getCategory()) {
            case PRIMITIVE:
                return PRIMITIVE_TYPES.get(type.getName());
            case RECORD:
                return type.getName();
            case OPTIONAL:
                return boxed(toJavaType(type.getElementType()));
            case ARRAY:
                return "List<" + boxed(toJavaType(type.getElementType())) + ">";
            case MAP:
                return "Map<"
                        + boxed(toJavaType(type.getKeyType()))
                        + ", "
                        + boxed(toJavaType(type.getElementType()))
                        + ">";
            default:
                throw new IllegalStateException("Unknown category " + type.getCategory());
        }
    }

    /** Parses a schema type expression and maps it. */
    public static String toJavaType(String schemaType) {
        return toJavaType(FieldType.parse(schemaType));
    }

    /** The wrapper class of a primitive Java type, other types unchanged. */
    public static String boxed(String javaType) {
        String boxed = BOXED_TYPES.get(javaType);
        return boxed == null ? javaType : boxed;
    }

    public static boolean isPrimitive(String javaType) {
        return BOXED_TYPES.containsKey(javaType);
    }

    public static boolean isNumeric(String javaType) {
        switch (javaType) {
            case "int":
            case "long":
            case "float":
            case "double":
            case "short":
            case "byte":
            case "Integer":
            case "Long":
            case "Float":
            case "Double":
                return true;
            default:
                return false;
        }
    }

    public static boolean isBoolean(String javaType) {
        return "boolean".equals(javaType) || "Boolean".equals(javaType);
    }
}

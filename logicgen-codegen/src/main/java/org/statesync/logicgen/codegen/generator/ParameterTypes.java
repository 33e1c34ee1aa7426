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

package org.statesync.logicgen.codegen.generator;

import org.statesync.logicgen.annotation.Internal;
import org.statesync.logicgen.codegen.exception.CodeGenException;
import org.statesync.logicgen.codegen.exception.SchemaParseException;
import org.statesync.logicgen.codegen.schema.FieldType;
import org.statesync.logicgen.codegen.schema.JavaTypes;
import org.statesync.logicgen.codegen.schema.SchemaContext;

import javax.annotation.Nullable;

/**
 * Maps the types declared on handler, filter and function parameters and on function return
 * values to Java. Besides the schema field grammar, graphs use the loose names {@code number},
 * {@code float}, {@code boolean} and {@code any}. Record names the schema does not define, and
 * all records when compiling without a schema, become {@code Object}.
 */
@Internal
public final class ParameterTypes {

    private ParameterTypes() {}

    public static String toJavaType(@Nullable SchemaContext schema, @Nullable String graphType) {
        if (graphType == null) {
            return JavaTypes.OBJECT;
        }
        String trimmed = graphType.trim();
        switch (trimmed) {
            case "":
            case "any":
            case "object":
                return JavaTypes.OBJECT;
            case "number":
            case "float":
            case "double":
                return "double";
            case "integer":
                return "int";
            case "long":
                return "long";
            case "boolean":
                return "boolean";
            default:
                break;
        }
        FieldType type;
        try {
            type = FieldType.parse(trimmed);
        } catch (SchemaParseException e) {
            throw new CodeGenException("Invalid parameter type '" + graphType + "'.", e);
        }
        return toJavaType(schema, type);
    }

    private static String toJavaType(@Nullable SchemaContext schema, FieldType type) {
        if (type.getCategory() == FieldType.Category.OPTIONAL) {
            return JavaTypes.boxed(toJavaType(schema, type.unwrapOptional()));
        }
        if (type.isArray()) {
            return "List<" + JavaTypes.boxed(elementType(schema, type.getElementType())) + ">";
        }
        if (type.isMap()) {
            return "Map<"
                    + JavaTypes.boxed(elementType(schema, type.getKeyType()))
                    + ", "
                    + JavaTypes.boxed(elementType(schema, type.getElementType()))
                    + ">";
        }
        if (type.isRecord()) {
            String name = type.getName();
            return schema != null && schema.hasType(name) ? name : JavaTypes.OBJECT;
        }
        return JavaTypes.toJavaType(type);
    }

    /** Nested types accept the loose names as well. */
    private static String elementType(@Nullable SchemaContext schema, FieldType type) {
        if (type.getCategory() == FieldType.Category.RECORD) {
            String loose = toJavaType(null, type.getName());
            if (!JavaTypes.OBJECT.equals(loose)) {
                return loose;
            }
        }
        return toJavaType(schema, type);
    }
}

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

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.schema.JavaTypes;

import javax.annotation.Nullable;

/**
 * Converts {@link JavaExpression}s to the Java type a statement needs. Typed expressions are used
 * as they are or cast, untyped ones go through the runtime {@code Values} helpers, which the
 * generated class always imports.
 */
@PublicEvolving
public final class Coercions {

    private Coercions() {}

    public static String toDouble(JavaExpression expression) {
        if ("double".equals(expression.getType())) {
            return expression.getCode();
        }
        if (expression.isPrimitiveNumeric()) {
            return "(double) " + expression.getCode();
        }
        return "Values.toDouble(" + expression.getCode() + ")";
    }

    public static String toLong(JavaExpression expression) {
        String type = expression.getType();
        if ("long".equals(type) || "int".equals(type)) {
            return expression.getCode();
        }
        if (expression.isPrimitiveNumeric()) {
            return "(long) (" + expression.getCode() + ")";
        }
        return "Values.toLong(" + expression.getCode() + ")";
    }

    public static String toInt(JavaExpression expression) {
        String type = expression.getType();
        if ("int".equals(type)) {
            return expression.getCode();
        }
        if (expression.isPrimitiveNumeric()) {
            return "(int) (" + expression.getCode() + ")";
        }
        return "(int) Values.toLong(" + expression.getCode() + ")";
    }

    public static String toBoolean(JavaExpression expression) {
        if ("boolean".equals(expression.getType())) {
            return expression.getCode();
        }
        return "Boolean.TRUE.equals(" + expression.getCode() + ")";
    }

    /** String form of a value; {@code null} stays {@code null} for untyped values. */
    public static String toStringValue(JavaExpression expression) {
        if (expression.isString()) {
            return expression.getCode();
        }
        if (expression.isTyped()) {
            return "String.valueOf(" + expression.getCode() + ")";
        }
        return "(String) " + expression.getCode();
    }

    /** Text of a value as it is concatenated or formatted; never {@code null}. */
    public static String toText(JavaExpression expression) {
        return "String.valueOf(" + expression.getCode() + ")";
    }

    public static String toList(JavaExpression expression) {
        if (expression.isList()) {
            return expression.getCode();
        }
        return "Values.asList(" + expression.getCode() + ")";
    }

    public static String toMap(JavaExpression expression) {
        if (expression.isMap()) {
            return expression.getCode();
        }
        return "((Map<?, ?>) " + expression.getCode() + ")";
    }

    /** Element type of a list expression, {@code Object} when unknown. */
    public static String elementType(JavaExpression listExpression) {
        String type = listExpression.getType();
        if (type != null && type.startsWith("List<") && type.endsWith(">")) {
            return type.substring("List<".length(), type.length() - 1);
        }
        return JavaTypes.OBJECT;
    }

    /** Value type of a map expression, {@code Object} when unknown. */
    public static String mapValueType(JavaExpression mapExpression) {
        String type = mapExpression.getType();
        if (type != null && type.startsWith("Map<") && type.endsWith(">")) {
            String arguments = type.substring("Map<".length(), type.length() - 1);
            int depth = 0;
            for (int i = 0; i < arguments.length(); i++) {
                char c = arguments.charAt(i);
                if (c == '<') {
                    depth++;
                } else if (c == '>') {
                    depth--;
                } else if (c == ',' && depth == 0) {
                    return arguments.substring(i + 1).trim();
                }
            }
        }
        return JavaTypes.OBJECT;
    }

    /**
     * Converts an expression so that it can be assigned to a variable, field or parameter of the
     * target type. An unknown target accepts anything.
     */
    public static String coerceTo(@Nullable String targetType, JavaExpression expression) {
        String code = expression.getCode();
        if (targetType == null
                || JavaTypes.OBJECT.equals(targetType)
                || targetType.equals(expression.getType())
                || expression.isNullLiteral() && !JavaTypes.isPrimitive(targetType)) {
            return code;
        }
        switch (JavaTypes.boxed(targetType)) {
            case "Integer":
                return toInt(expression);
            case "Long":
                return toLong(expression);
            case "Double":
                return toDouble(expression);
            case "Float":
                return "(float) " + toDouble(expression);
            case "Boolean":
                return toBoolean(expression);
            case "String":
                return toStringValue(expression);
            default:
                break;
        }
        if (targetType.indexOf('<') >= 0) {
            return "(" + targetType + ") (Object) " + code;
        }
        return "(" + targetType + ") " + code;
    }

    /**
     * The type of the sum, difference or product of two numbers: the wider of both primitive
     * types, {@code double} if either is unknown.
     */
    public static String numericResultType(JavaExpression left, JavaExpression right) {
        if (!left.isPrimitiveNumeric() || !right.isPrimitiveNumeric()) {
            return "double";
        }
        return wider(left.getType(), right.getType());
    }

    /** The wider of two primitive numeric types. */
    public static String wider(String left, String right) {
        return rank(left) >= rank(right) ? normalize(left) : normalize(right);
    }

    private static int rank(String type) {
        switch (type) {
            case "double":
            case "float":
                return 3;
            case "long":
                return 2;
            default:
                return 1;
        }
    }

    private static String normalize(String type) {
        switch (type) {
            case "double":
            case "float":
                return "double";
            case "long":
                return "long";
            default:
                return "int";
        }
    }
}

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

import javax.annotation.Nullable;

/**
 * Renders the comparison operators of {@code Compare}, {@code FilterArray} and the batch nodes:
 * {@code ==}, {@code !=}, {@code <}, {@code <=}, {@code >} and {@code >=}. Numbers of different
 * types compare by value; equality of other values is {@link Object#equals(Object)}.
 */
@PublicEvolving
public final class Comparisons {

    private Comparisons() {}

    public static boolean isSupported(@Nullable String op) {
        return op != null && render(op, "a", "b", true) != null;
    }

    /**
     * A boolean expression comparing both values.
     *
     * @throws IllegalArgumentException for an unknown operator
     */
    public static String condition(String op, JavaExpression left, JavaExpression right) {
        boolean primitive =
                left.isPrimitiveNumeric() && right.isPrimitiveNumeric()
                        || "boolean".equals(left.getType()) && "boolean".equals(right.getType());
        String rendered;
        if (primitive) {
            rendered = render(op, left.getCode(), right.getCode(), true);
        } else {
            rendered = render(op, left.getCode(), right.getCode(), false);
        }
        if (rendered == null) {
            throw new IllegalArgumentException("Unknown comparison operator '" + op + "'.");
        }
        return rendered;
    }

    @Nullable
    private static String render(String op, String left, String right, boolean primitive) {
        switch (op) {
            case "==":
                return primitive
                        ? left + " == " + right
                        : "Values.looseEquals(" + left + ", " + right + ")";
            case "!=":
                return primitive
                        ? left + " != " + right
                        : "!Values.looseEquals(" + left + ", " + right + ")";
            case "<":
            case "<=":
            case ">":
            case ">=":
                return primitive
                        ? left + " " + op + " " + right
                        : "Values.compare(" + left + ", " + right + ") " + op + " 0";
            default:
                return null;
        }
    }
}

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

import javax.annotation.Nullable;

import static org.statesync.logicgen.utils.StringUtils.quote;

/** Renders scalar constants of a node graph as Java literals. */
@Internal
public final class LiteralFormatter {

    private LiteralFormatter() {}

    /**
     * Formats a scalar constant.
     *
     * @throws IllegalArgumentException for maps, lists and other non-scalar values
     */
    public static JavaExpression format(@Nullable Object value) {
        if (value == null) {
            return JavaExpression.NULL;
        }
        if (value instanceof String) {
            return JavaExpression.of(quote((String) value), "String");
        }
        if (value instanceof Boolean) {
            return JavaExpression.of(value.toString(), "boolean");
        }
        if (value instanceof Long || value instanceof Integer) {
            long number = ((Number) value).longValue();
            if (number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return JavaExpression.of(Long.toString(number), "int");
            }
            return JavaExpression.of(number + "L", "long");
        }
        if (value instanceof Double || value instanceof Float) {
            return JavaExpression.of(formatDouble(((Number) value).doubleValue()), "double");
        }
        throw new IllegalArgumentException(
                "Cannot render " + value.getClass().getName() + " as a Java literal.");
    }

    private static String formatDouble(double value) {
        if (Double.isNaN(value)) {
            return "Double.NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
        }
        // Double.toString always yields a '.' or an exponent, both read back as double.
        return Double.toString(value);
    }
}

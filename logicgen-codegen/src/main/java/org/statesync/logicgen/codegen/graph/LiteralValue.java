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

package org.statesync.logicgen.codegen.graph;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.Objects;

/**
 * A constant input. The value is a {@link String}, a {@link Long}, a {@link Double}, a {@link
 * Boolean} or {@code null}.
 */
@PublicEvolving
public final class LiteralValue extends InputValue {

    public static final LiteralValue NULL = new LiteralValue(null);

    @Nullable private final Object value;

    private LiteralValue(@Nullable Object value) {
        this.value = value;
    }

    public static LiteralValue of(@Nullable Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return new LiteralValue(((Number) value).longValue());
        }
        if (value instanceof Float) {
            return new LiteralValue(((Float) value).doubleValue());
        }
        if (value instanceof String
                || value instanceof Long
                || value instanceof Double
                || value instanceof Boolean) {
            return new LiteralValue(value);
        }
        throw new IllegalArgumentException(
                "Unsupported literal of type " + value.getClass().getName());
    }

    @Override
    public Kind getKind() {
        return Kind.LITERAL;
    }

    @Nullable
    public Object getValue() {
        return value;
    }

    public boolean isNull() {
        return value == null;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isNumber() {
        return value instanceof Long || value instanceof Double;
    }

    public boolean isInteger() {
        return value instanceof Long;
    }

    public boolean isBoolean() {
        return value instanceof Boolean;
    }

    /** Whether this literal is {@code null} or the empty string. */
    public boolean isBlank() {
        return value == null || (value instanceof String && ((String) value).isEmpty());
    }

    /** Whether this literal is the number zero. */
    public boolean isZero() {
        return isNumber() && ((Number) value).doubleValue() == 0.0d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Objects.equals(value, ((LiteralValue) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}

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

import java.util.Objects;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * A Java expression together with its static type. The type is {@code null} when the generator
 * cannot know it, which happens for values read without a schema; such expressions are treated
 * as {@code Object} and converted through the runtime {@code Values} helpers.
 */
@PublicEvolving
public final class JavaExpression {

    public static final JavaExpression NULL = new JavaExpression("null", null);

    private final String code;
    @Nullable private final String type;

    private JavaExpression(String code, @Nullable String type) {
        this.code = checkNotNull(code);
        this.type = type;
    }

    public static JavaExpression of(String code, @Nullable String type) {
        return new JavaExpression(code, type);
    }

    public static JavaExpression untyped(String code) {
        return new JavaExpression(code, null);
    }

    public String getCode() {
        return code;
    }

    /** The Java type, {@code null} when unknown. */
    @Nullable
    public String getType() {
        return type;
    }

    /** The declared type of a local holding this expression. */
    public String getDeclarationType() {
        return type == null ? JavaTypes.OBJECT : type;
    }

    public boolean isTyped() {
        return type != null && !JavaTypes.OBJECT.equals(type);
    }

    public boolean isNullLiteral() {
        return "null".equals(code);
    }

    public boolean isNumeric() {
        return type != null && JavaTypes.isNumeric(type);
    }

    /** A primitive number, as opposed to a boxed one that may hold {@code null}. */
    public boolean isPrimitiveNumeric() {
        return isNumeric() && JavaTypes.isPrimitive(type);
    }

    public boolean isBoolean() {
        return type != null && JavaTypes.isBoolean(type);
    }

    public boolean isString() {
        return "String".equals(type);
    }

    public boolean isList() {
        return type != null && type.startsWith("List<");
    }

    public boolean isMap() {
        return type != null && type.startsWith("Map<");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JavaExpression that = (JavaExpression) o;
        return code.equals(that.code) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, type);
    }

    @Override
    public String toString() {
        return code;
    }
}

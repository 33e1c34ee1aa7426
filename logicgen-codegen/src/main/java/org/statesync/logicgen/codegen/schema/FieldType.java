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

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.exception.SchemaParseException;

import javax.annotation.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * A parsed schema field type: a primitive, a record name, {@code *T}, {@code []T} or {@code
 * map[K]V}.
 */
@PublicEvolving
public final class FieldType {

    /** Structural category of a field type. */
    public enum Category {
        PRIMITIVE,
        RECORD,
        OPTIONAL,
        ARRAY,
        MAP
    }

    public static final Set<String> PRIMITIVES =
            Collections.unmodifiableSet(
                    new HashSet<>(
                            Arrays.asList(
                                    "int", "int8", "int16", "int32", "int64", "uint", "uint8",
                                    "uint16", "uint32", "uint64", "float32", "float64", "string",
                                    "bool", "bytes", "any")));

    private final Category category;
    @Nullable private final String name;
    @Nullable private final FieldType elementType;
    @Nullable private final FieldType keyType;

    private FieldType(
            Category category,
            @Nullable String name,
            @Nullable FieldType elementType,
            @Nullable FieldType keyType) {
        this.category = category;
        this.name = name;
        this.elementType = elementType;
        this.keyType = keyType;
    }

    public static FieldType primitive(String name) {
        return new FieldType(Category.PRIMITIVE, checkNotNull(name), null, null);
    }

    public static FieldType record(String name) {
        return new FieldType(Category.RECORD, checkNotNull(name), null, null);
    }

    public static FieldType optional(FieldType inner) {
        return new FieldType(Category.OPTIONAL, null, checkNotNull(inner), null);
    }

    public static FieldType arrayOf(FieldType element) {
        return new FieldType(Category.ARRAY, null, checkNotNull(element), null);
    }

    public static FieldType mapOf(FieldType key, FieldType value) {
        return new FieldType(Category.MAP, null, checkNotNull(value), checkNotNull(key));
    }

    /**
     * Parses a type expression.
     *
     * @throws SchemaParseException if the text is not a valid type expression
     */
    public static FieldType parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new SchemaParseException("Field type must not be empty.");
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("*")) {
            return optional(parse(trimmed.substring(1)));
        }
        if (trimmed.startsWith("[]")) {
            return arrayOf(parse(trimmed.substring(2)));
        }
        if (trimmed.startsWith("map[")) {
            int depth = 0;
            for (int i = 3; i < trimmed.length(); i++) {
                char c = trimmed.charAt(i);
                if (c == '[') {
                    depth++;
                } else if (c == ']') {
                    depth--;
                    if (depth == 0) {
                        String key = trimmed.substring(4, i);
                        String value = trimmed.substring(i + 1);
                        if (key.isEmpty() || value.isEmpty()) {
                            throw new SchemaParseException("Invalid map type '" + text + "'.");
                        }
                        return mapOf(parse(key), parse(value));
                    }
                }
            }
            throw new SchemaParseException("Unclosed map key in type '" + text + "'.");
        }
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            boolean valid =
                    i == 0 ? Character.isJavaIdentifierStart(c) : Character.isJavaIdentifierPart(c);
            if (!valid) {
                throw new SchemaParseException("Invalid type name '" + text + "'.");
            }
        }
        return PRIMITIVES.contains(trimmed) ? primitive(trimmed) : record(trimmed);
    }

    public Category getCategory() {
        return category;
    }

    /** The primitive or record name; {@code null} for composite types. */
    @Nullable
    public String getName() {
        return name;
    }

    /** The element of an array, the value of a map, or the wrapped type of an optional. */
    @Nullable
    public FieldType getElementType() {
        return elementType;
    }

    @Nullable
    public FieldType getKeyType() {
        return keyType;
    }

    public boolean isArray() {
        return unwrapOptional().category == Category.ARRAY;
    }

    public boolean isMap() {
        return unwrapOptional().category == Category.MAP;
    }

    public boolean isRecord() {
        return unwrapOptional().category == Category.RECORD;
    }

    public boolean isPrimitive() {
        return unwrapOptional().category == Category.PRIMITIVE;
    }

    /** This type with every {@code *} prefix removed. */
    public FieldType unwrapOptional() {
        FieldType current = this;
        while (current.category == Category.OPTIONAL) {
            current = current.elementType;
        }
        return current;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldType that = (FieldType) o;
        return category == that.category
                && Objects.equals(name, that.name)
                && Objects.equals(elementType, that.elementType)
                && Objects.equals(keyType, that.keyType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, name, elementType, keyType);
    }

    @Override
    public String toString() {
        switch (category) {
            case OPTIONAL:
                return "*" + elementType;
            case ARRAY:
                return "[]" + elementType;
            case MAP:
                return "map[" + keyType + "]" + elementType;
            default:
                return name;
        }
    }
}

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

package org.statesync.logicgen.codegen.path;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.Objects;

import static org.statesync.logicgen.utils.Preconditions.checkArgument;
import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * One dot-separated element of a {@link ParsedPath}. A literal index keeps the digits it was
 * written with for {@link #toString()}; equality only looks at the position.
 */
@PublicEvolving
public final class PathSegment {

    private final String fieldName;
    private final IndexKind indexKind;
    @Nullable private final String indexValue;
    @Nullable private final String keyField;
    @Nullable private final String indexText;

    private PathSegment(
            String fieldName,
            IndexKind indexKind,
            @Nullable String indexValue,
            @Nullable String keyField,
            @Nullable String indexText) {
        this.fieldName = checkNotNull(fieldName);
        this.indexKind = checkNotNull(indexKind);
        this.indexValue = indexValue;
        this.keyField = keyField;
        this.indexText = indexText;
    }

    public static PathSegment field(String fieldName) {
        return new PathSegment(fieldName, IndexKind.NONE, null, null, null);
    }

    public static PathSegment literalIndex(String fieldName, int index) {
        return literalIndex(fieldName, index, String.valueOf(index));
    }

    /** A literal index written as {@code text}, which may carry leading zeros. */
    public static PathSegment literalIndex(String fieldName, int index, String text) {
        checkArgument(index >= 0, "index must not be negative");
        return new PathSegment(
                fieldName, IndexKind.LITERAL, String.valueOf(index), null, checkNotNull(text));
    }

    public static PathSegment variableIndex(String fieldName, String variable) {
        return new PathSegment(
                fieldName, IndexKind.VARIABLE, checkNotNull(variable), null, variable);
    }

    public static PathSegment keyLookup(String fieldName, String variable, String keyField) {
        return new PathSegment(
                fieldName,
                IndexKind.KEY_LOOKUP,
                checkNotNull(variable),
                checkNotNull(keyField),
                variable);
    }

    public String getFieldName() {
        return fieldName;
    }

    public IndexKind getIndexKind() {
        return indexKind;
    }

    public boolean isIndexed() {
        return indexKind != IndexKind.NONE;
    }

    /** The literal position, or the variable holding the position, key or lookup value. */
    @Nullable
    public String getIndexValue() {
        return indexValue;
    }

    /** For {@link IndexKind#KEY_LOOKUP}, the element field compared with the variable. */
    @Nullable
    public String getKeyField() {
        return keyField;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PathSegment that = (PathSegment) o;
        return fieldName.equals(that.fieldName)
                && indexKind == that.indexKind
                && Objects.equals(indexValue, that.indexValue)
                && Objects.equals(keyField, that.keyField);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fieldName, indexKind, indexValue, keyField);
    }

    @Override
    public String toString() {
        switch (indexKind) {
            case NONE:
                return fieldName;
            case KEY_LOOKUP:
                return fieldName + "[" + indexText + ":" + keyField + "]";
            default:
                return fieldName + "[" + indexText + "]";
        }
    }
}

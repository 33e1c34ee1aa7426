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

import javax.annotation.Nullable;

import static org.statesync.logicgen.utils.StringUtils.capitalize;

/**
 * Accessor names and Java types for one field of a generated state class. Without a schema the
 * names follow the same conventions and the types are unknown.
 *
 * <ul>
 *   <li>scalar: {@code getX()}, {@code setX(v)}
 *   <li>array: additionally {@code appendX(v)}, {@code removeXAt(i)}, {@code updateXAt(i, v)},
 *       {@code getXAt(i)}, {@code getXSize()}
 *   <li>map: additionally {@code putXEntry(k, v)}, {@code removeXEntry(k)}, {@code
 *       getXEntry(k)}
 * </ul>
 */
@PublicEvolving
public final class FieldAccessInfo {

    private final String ownerType;
    private final String fieldName;
    @Nullable private final FieldType fieldType;
    private final String capitalized;

    FieldAccessInfo(String ownerType, String fieldName, @Nullable FieldType fieldType) {
        this.ownerType = ownerType;
        this.fieldName = fieldName;
        this.fieldType = fieldType;
        this.capitalized = capitalize(fieldName);
    }

    /** Accessor names for a field whose type is unknown. */
    public static FieldAccessInfo untyped(String ownerType, String fieldName) {
        return new FieldAccessInfo(ownerType, fieldName, null);
    }

    public String getOwnerType() {
        return ownerType;
    }

    public String getFieldName() {
        return fieldName;
    }

    @Nullable
    public FieldType getFieldType() {
        return fieldType;
    }

    public boolean isTyped() {
        return fieldType != null;
    }

    public boolean isArray() {
        return fieldType != null && fieldType.isArray();
    }

    public boolean isMap() {
        return fieldType != null && fieldType.isMap();
    }

    /** The declared Java type, {@code null} when untyped. */
    @Nullable
    public String getJavaType() {
        return fieldType == null ? null : JavaTypes.toJavaType(fieldType);
    }

    /** Java type of an array element or map value, {@code null} when unknown. */
    @Nullable
    public String getElementJavaType() {
        if (fieldType == null) {
            return null;
        }
        FieldType unwrapped = fieldType.unwrapOptional();
        if (unwrapped.getCategory() == FieldType.Category.ARRAY
                || unwrapped.getCategory() == FieldType.Category.MAP) {
            return JavaTypes.boxed(JavaTypes.toJavaType(unwrapped.getElementType()));
        }
        return null;
    }

    public String getGetterName() {
        return "get" + capitalized;
    }

    public String getSetterName() {
        return "set" + capitalized;
    }

    public String getAppendName() {
        return "append" + capitalized;
    }

    public String getRemoveAtName() {
        return "remove" + capitalized + "At";
    }

    public String getUpdateAtName() {
        return "update" + capitalized + "At";
    }

    public String getGetAtName() {
        return "get" + capitalized + "At";
    }

    public String getSizeName() {
        return "get" + capitalized + "Size";
    }

    public String getPutEntryName() {
        return "put" + capitalized + "Entry";
    }

    public String getRemoveEntryName() {
        return "remove" + capitalized + "Entry";
    }

    public String getGetEntryName() {
        return "get" + capitalized + "Entry";
    }

    @Override
    public String toString() {
        return ownerType + "." + fieldName + (fieldType == null ? "" : " " + fieldType);
    }
}

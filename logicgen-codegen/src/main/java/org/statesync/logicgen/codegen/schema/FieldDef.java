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

import java.util.Objects;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/** A field of a schema record. */
@PublicEvolving
public final class FieldDef {

    private final String name;
    private final FieldType type;
    private final boolean key;
    private final boolean optional;

    public FieldDef(String name, FieldType type, boolean key, boolean optional) {
        this.name = checkNotNull(name);
        this.type = checkNotNull(type);
        this.key = key;
        this.optional = optional || type.getCategory() == FieldType.Category.OPTIONAL;
    }

    public String getName() {
        return name;
    }

    public FieldType getType() {
        return type;
    }

    /** Whether elements of arrays of this record are identified by this field. */
    public boolean isKey() {
        return key;
    }

    public boolean isOptional() {
        return optional;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FieldDef fieldDef = (FieldDef) o;
        return key == fieldDef.key
                && optional == fieldDef.optional
                && name.equals(fieldDef.name)
                && type.equals(fieldDef.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, key, optional);
    }

    @Override
    public String toString() {
        return name + " " + type;
    }
}

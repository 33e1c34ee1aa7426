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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/** A record type of the schema. */
@PublicEvolving
public final class TypeDef {

    private final String name;
    private final int id;
    private final List<FieldDef> fields;

    public TypeDef(String name, int id, List<FieldDef> fields) {
        this.name = checkNotNull(name);
        this.id = id;
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
    }

    public String getName() {
        return name;
    }

    public int getId() {
        return id;
    }

    public List<FieldDef> getFields() {
        return fields;
    }

    @Nullable
    public FieldDef findField(String fieldName) {
        for (FieldDef field : fields) {
            if (field.getName().equals(fieldName)) {
                return field;
            }
        }
        return null;
    }

    /** The field marked as key, or {@code null}. */
    @Nullable
    public FieldDef getKeyField() {
        for (FieldDef field : fields) {
            if (field.isKey()) {
                return field;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return name;
    }
}

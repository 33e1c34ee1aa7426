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

import static org.statesync.logicgen.utils.Preconditions.checkArgument;

/** A parsed state schema. The first type is the root state type. */
@PublicEvolving
public final class SchemaDefinition {

    private final String packageName;
    private final List<TypeDef> types;

    public SchemaDefinition(String packageName, List<TypeDef> types) {
        checkArgument(!types.isEmpty(), "a schema needs at least one type");
        this.packageName = packageName;
        this.types = Collections.unmodifiableList(new ArrayList<>(types));
    }

    public String getPackageName() {
        return packageName;
    }

    public List<TypeDef> getTypes() {
        return types;
    }

    public TypeDef getRootType() {
        return types.get(0);
    }

    @Nullable
    public TypeDef findType(String name) {
        for (TypeDef type : types) {
            if (type.getName().equals(name)) {
                return type;
            }
        }
        return null;
    }
}

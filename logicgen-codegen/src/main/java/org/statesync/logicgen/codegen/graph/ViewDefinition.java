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

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/** A named aggregate over an array of the state, readable from any node as {@code view:name}. */
@PublicEvolving
public final class ViewDefinition {

    private final String name;
    private final String path;
    private final ViewOperation operation;
    @Nullable private final String field;

    public ViewDefinition(
            String name, String path, ViewOperation operation, @Nullable String field) {
        this.name = checkNotNull(name);
        this.path = checkNotNull(path);
        this.operation = checkNotNull(operation);
        this.field = field == null || field.isEmpty() ? null : field;
    }

    public String getName() {
        return name;
    }

    /** Path of the aggregated array, relative to the root state. */
    public String getPath() {
        return path;
    }

    public ViewOperation getOperation() {
        return operation;
    }

    @Nullable
    public String getField() {
        return field;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ViewDefinition that = (ViewDefinition) o;
        return name.equals(that.name)
                && path.equals(that.path)
                && operation == that.operation
                && Objects.equals(field, that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, path, operation, field);
    }
}

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

package org.statesync.logicgen.codegen.registry;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.Objects;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * An input or output port of a node kind. The type is descriptive ({@code number}, {@code
 * string}, {@code bool}, {@code any}, {@code []any}, ...) and drives literal type warnings.
 */
@PublicEvolving
public final class PortDefinition {

    private final String name;
    private final String type;
    private final boolean required;
    @Nullable private final Object defaultValue;

    private PortDefinition(
            String name, String type, boolean required, @Nullable Object defaultValue) {
        this.name = checkNotNull(name);
        this.type = checkNotNull(type);
        this.required = required;
        this.defaultValue = defaultValue;
    }

    public static PortDefinition required(String name, String type) {
        return new PortDefinition(name, type, true, null);
    }

    public static PortDefinition optional(String name, String type) {
        return new PortDefinition(name, type, false, null);
    }

    public static PortDefinition optional(String name, String type, Object defaultValue) {
        return new PortDefinition(name, type, false, checkNotNull(defaultValue));
    }

    public static PortDefinition output(String name, String type) {
        return new PortDefinition(name, type, true, null);
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    @Nullable
    public Object getDefaultValue() {
        return defaultValue;
    }

    public boolean hasDefaultValue() {
        return defaultValue != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PortDefinition that = (PortDefinition) o;
        return required == that.required
                && name.equals(that.name)
                && type.equals(that.type)
                && Objects.equals(defaultValue, that.defaultValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, required, defaultValue);
    }

    @Override
    public String toString() {
        return name + ": " + type + (required ? "" : "?");
    }
}

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

/** Aggregate computed by a {@link ViewDefinition}. */
@PublicEvolving
public enum ViewOperation {
    COUNT("count"),
    SUM("sum"),
    MIN("min"),
    MAX("max"),
    AVG("avg");

    private final String name;

    ViewOperation(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /** Whether the aggregate reads a numeric field of each element. */
    public boolean needsField() {
        return this != COUNT;
    }

    @Nullable
    public static ViewOperation fromName(String name) {
        for (ViewOperation op : values()) {
            if (op.name.equals(name)) {
                return op;
            }
        }
        return null;
    }
}

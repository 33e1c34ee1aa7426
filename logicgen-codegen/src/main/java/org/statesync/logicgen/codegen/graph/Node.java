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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/** A single node of a fragment: an id unique within the fragment, a kind and its inputs. */
@PublicEvolving
public final class Node {

    private final String id;
    private final String type;
    private final Map<String, InputValue> inputs;

    public Node(String id, String type, Map<String, InputValue> inputs) {
        this.id = checkNotNull(id, "node id must not be null");
        this.type = checkNotNull(type, "node type must not be null");
        this.inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public String getId() {
        return id;
    }

    public String getType() {
        return type;
    }

    public Map<String, InputValue> getInputs() {
        return inputs;
    }

    @Nullable
    public InputValue getInput(String port) {
        return inputs.get(port);
    }

    /**
     * Whether a usable value is bound to the port. A missing port, a {@code null} literal and
     * the empty string all count as not provided.
     */
    public boolean isInputProvided(String port) {
        InputValue value = inputs.get(port);
        if (value == null) {
            return false;
        }
        return !(value instanceof LiteralValue) || !((LiteralValue) value).isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Node node = (Node) o;
        return id.equals(node.id) && type.equals(node.type) && inputs.equals(node.inputs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, inputs);
    }

    @Override
    public String toString() {
        return id + " (" + type + ")";
    }
}

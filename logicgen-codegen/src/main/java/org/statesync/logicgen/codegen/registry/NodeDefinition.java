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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.statesync.logicgen.utils.Preconditions.checkArgument;
import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * The contract of a node kind: its ports and, optionally, the emitter producing its code. A kind
 * without emitter still validates; it compiles to a marker comment.
 */
@PublicEvolving
public final class NodeDefinition {

    private final String type;
    private final String category;
    private final String description;
    private final List<PortDefinition> inputs;
    private final List<PortDefinition> outputs;
    @Nullable private final NodeEmitter emitter;

    private NodeDefinition(
            String type,
            String category,
            String description,
            List<PortDefinition> inputs,
            List<PortDefinition> outputs,
            @Nullable NodeEmitter emitter) {
        this.type = type;
        this.category = category;
        this.description = description;
        this.inputs = Collections.unmodifiableList(new ArrayList<>(inputs));
        this.outputs = Collections.unmodifiableList(new ArrayList<>(outputs));
        this.emitter = emitter;
    }

    public static Builder newBuilder(String type) {
        return new Builder(type);
    }

    public String getType() {
        return type;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public List<PortDefinition> getInputs() {
        return inputs;
    }

    public List<PortDefinition> getOutputs() {
        return outputs;
    }

    @Nullable
    public PortDefinition findInput(String name) {
        for (PortDefinition port : inputs) {
            if (port.getName().equals(name)) {
                return port;
            }
        }
        return null;
    }

    @Nullable
    public PortDefinition findOutput(String name) {
        for (PortDefinition port : outputs) {
            if (port.getName().equals(name)) {
                return port;
            }
        }
        return null;
    }

    @Nullable
    public NodeEmitter getEmitter() {
        return emitter;
    }

    public boolean hasEmitter() {
        return emitter != null;
    }

    /** A copy of this definition with another emitter. */
    public NodeDefinition withEmitter(@Nullable NodeEmitter newEmitter) {
        return new NodeDefinition(type, category, description, inputs, outputs, newEmitter);
    }

    @Override
    public String toString() {
        return type + inputs + " -> " + outputs;
    }

    /** Builder for {@link NodeDefinition}. */
    @PublicEvolving
    public static final class Builder {

        private final String type;
        private String category = "custom";
        private String description = "";
        private final List<PortDefinition> inputs = new ArrayList<>();
        private final List<PortDefinition> outputs = new ArrayList<>();
        @Nullable private NodeEmitter emitter;

        private Builder(String type) {
            this.type = type;
        }

        public Builder category(String category) {
            this.category = checkNotNull(category);
            return this;
        }

        public Builder description(String description) {
            this.description = checkNotNull(description);
            return this;
        }

        public Builder input(PortDefinition port) {
            inputs.add(checkNotNull(port));
            return this;
        }

        public Builder output(String name, String portType) {
            outputs.add(PortDefinition.output(name, portType));
            return this;
        }

        public Builder emitter(@Nullable NodeEmitter emitter) {
            this.emitter = emitter;
            return this;
        }

        public NodeDefinition build() {
            checkArgument(
                    type != null && !type.trim().isEmpty(), "node type must not be empty");
            return new NodeDefinition(type, category, description, inputs, outputs, emitter);
        }
    }
}

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * A named node sub-graph with its own parameters, nodes and flow edges. Handlers, filters and
 * functions are fragments; node ids are only unique within one fragment.
 */
@PublicEvolving
public abstract class GraphFragment {

    private final String name;
    @Nullable private final String description;
    private final List<Parameter> parameters;
    private final List<Node> nodes;
    private final List<FlowEdge> flow;

    protected GraphFragment(
            String name,
            @Nullable String description,
            List<Parameter> parameters,
            List<Node> nodes,
            List<FlowEdge> flow) {
        this.name = checkNotNull(name, "fragment name must not be null");
        this.description = description;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.flow = Collections.unmodifiableList(new ArrayList<>(flow));
    }

    public abstract FragmentKind getKind();

    public String getName() {
        return name;
    }

    @Nullable
    public String getDescription() {
        return description;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<Node> getNodes() {
        return nodes;
    }

    public List<FlowEdge> getFlow() {
        return flow;
    }

    /** The first node with the given id, or {@code null}. */
    @Nullable
    public Node findNode(String id) {
        for (Node node : nodes) {
            if (node.getId().equals(id)) {
                return node;
            }
        }
        return null;
    }

    @Nullable
    public Parameter findParameter(String parameterName) {
        for (Parameter parameter : parameters) {
            if (parameter.getName().equals(parameterName)) {
                return parameter;
            }
        }
        return null;
    }

    /** Prefix used in diagnostics, e.g. {@code handler 'OnJoin'}. */
    public String describe() {
        return getKind().getDisplayName() + " '" + name + "'";
    }

    @Override
    public String toString() {
        return describe();
    }
}

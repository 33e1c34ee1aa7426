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

import java.util.List;

/**
 * A fragment compiled to a per-viewer state transformation. The parameters are bound when the
 * filter is installed, the nodes run on every state snapshot sent to the viewer.
 */
@PublicEvolving
public final class FilterDefinition extends GraphFragment {

    public FilterDefinition(
            String name,
            @Nullable String description,
            List<Parameter> parameters,
            List<Node> nodes,
            List<FlowEdge> flow) {
        super(name, description, parameters, nodes, flow);
    }

    @Override
    public FragmentKind getKind() {
        return FragmentKind.FILTER;
    }
}

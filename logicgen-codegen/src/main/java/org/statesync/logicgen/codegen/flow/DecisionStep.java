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

package org.statesync.logicgen.codegen.flow;

import org.statesync.logicgen.annotation.Internal;
import org.statesync.logicgen.codegen.graph.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** An {@code If} node with its true and false blocks. Either block may be empty. */
@Internal
public final class DecisionStep extends FlowStep {

    private final List<FlowStep> thenSteps;
    private final List<FlowStep> elseSteps;

    public DecisionStep(Node node, List<FlowStep> thenSteps, List<FlowStep> elseSteps) {
        super(node);
        this.thenSteps = Collections.unmodifiableList(new ArrayList<>(thenSteps));
        this.elseSteps = Collections.unmodifiableList(new ArrayList<>(elseSteps));
    }

    public List<FlowStep> getThenSteps() {
        return thenSteps;
    }

    public List<FlowStep> getElseSteps() {
        return elseSteps;
    }
}

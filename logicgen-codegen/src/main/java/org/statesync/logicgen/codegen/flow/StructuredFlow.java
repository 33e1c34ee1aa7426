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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** The result of reconstructing a fragment: the top level block and any structure issues. */
@Internal
public final class StructuredFlow {

    private final List<FlowStep> steps;
    private final List<StructureIssue> issues;
    private final Set<String> placedNodeIds;

    public StructuredFlow(
            List<FlowStep> steps, List<StructureIssue> issues, Set<String> placedNodeIds) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.issues = Collections.unmodifiableList(new ArrayList<>(issues));
        this.placedNodeIds = Collections.unmodifiableSet(new LinkedHashSet<>(placedNodeIds));
    }

    public List<FlowStep> getSteps() {
        return steps;
    }

    public List<StructureIssue> getIssues() {
        return issues;
    }

    public boolean isWellStructured() {
        return issues.isEmpty();
    }

    /** Ids of the nodes placed in the block tree, in emission order. */
    public Set<String> getPlacedNodeIds() {
        return placedNodeIds;
    }
}

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
import org.statesync.logicgen.codegen.registry.BuiltinNodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** An iteration node with its body block. */
@Internal
public final class LoopStep extends FlowStep {

    private final BuiltinNodeKind kind;
    private final List<FlowStep> bodySteps;

    public LoopStep(Node node, BuiltinNodeKind kind, List<FlowStep> bodySteps) {
        super(node);
        this.kind = kind;
        this.bodySteps = Collections.unmodifiableList(new ArrayList<>(bodySteps));
    }

    public BuiltinNodeKind getKind() {
        return kind;
    }

    public List<FlowStep> getBodySteps() {
        return bodySteps;
    }
}

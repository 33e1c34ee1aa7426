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
import org.statesync.logicgen.codegen.registry.BuiltinNodeKind;

import java.util.List;

/**
 * Decides whether every path through a structured block ends in a {@code Return}. A loop never
 * counts as returning because its body may run zero times.
 */
@Internal
public final class ReturnPathAnalyzer {

    private ReturnPathAnalyzer() {}

    public static boolean allPathsReturn(List<FlowStep> steps) {
        for (FlowStep step : steps) {
            if (alwaysReturns(step)) {
                return true;
            }
        }
        return false;
    }

    private static boolean alwaysReturns(FlowStep step) {
        if (step instanceof DecisionStep) {
            DecisionStep decision = (DecisionStep) step;
            return allPathsReturn(decision.getThenSteps())
                    && allPathsReturn(decision.getElseSteps());
        }
        if (step instanceof LoopStep) {
            return false;
        }
        return BuiltinNodeKind.fromType(step.getNode().getType()) == BuiltinNodeKind.RETURN;
    }
}

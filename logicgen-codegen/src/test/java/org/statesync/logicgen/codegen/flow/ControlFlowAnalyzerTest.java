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

import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.registry.BuiltinNodeKind;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.handler;

/** Tests for {@link ControlFlowAnalyzer} and {@link ReturnPathAnalyzer}. */
public class ControlFlowAnalyzerTest {

    private static final String SET = "'type': 'SetField', 'inputs': {'path': 'phase', 'value': 1}";

    // ==================== Decisions ====================

    @Test
    public void testDecisionWithJoin() {
        StructuredFlow flow =
                analyze(
                        "{'id': 'check', 'type': 'If', 'inputs': {'condition': true}},"
                                + "{'id': 'yes', "
                                + SET
                                + "}, {'id': 'no', "
                                + SET
                                + "}, {'id': 'after', "
                                + SET
                                + "}",
                        "{'from': 'start', 'to': 'check'},"
                                + "{'from': 'check', 'to': 'yes', 'label': 'true'},"
                                + "{'from': 'check', 'to': 'no', 'label': 'false'},"
                                + "{'from': 'yes', 'to': 'after'}, {'from': 'no', 'to': 'after'}");

        assertThat(flow.isWellStructured()).isTrue();
        assertThat(ids(flow.getSteps())).containsExactly("check", "after");
        DecisionStep decision = (DecisionStep) flow.getSteps().get(0);
        assertThat(ids(decision.getThenSteps())).containsExactly("yes");
        assertThat(ids(decision.getElseSteps())).containsExactly("no");
    }

    @Test
    public void testExplicitNextEdgeIsTheJoin() {
        StructuredFlow flow =
                analyze(
                        "{'id': 'check', 'type': 'If', 'inputs': {'condition': true}},"
                                + "{'id': 'yes', "
                                + SET
                                + "}, {'id': 'after', "
                                + SET
                                + "}",
                        "{'from': 'start', 'to': 'check'},"
                                + "{'from': 'check', 'to': 'yes', 'label': 'true'},"
                                + "{'from': 'check', 'to': 'after', 'label': 'next'}");

        assertThat(ids(flow.getSteps())).containsExactly("check", "after");
        DecisionStep decision = (DecisionStep) flow.getSteps().get(0);
        assertThat(ids(decision.getThenSteps())).containsExactly("yes");
        assertThat(decision.getElseSteps()).isEmpty();
    }

    @Test
    public void testConditionFieldActsAsLabel() {
        StructuredFlow flow =
                analyze(
                        "{'id': 'check', 'type': 'If', 'inputs': {'condition': true}},"
                                + "{'id': 'no', "
                                + SET
                                + "}",
                        "{'from': 'start', 'to': 'check'},"
                                + "{'from': 'check', 'to': 'no', 'condition': 'false'}");

        DecisionStep decision = (DecisionStep) flow.getSteps().get(0);
        assertThat(decision.getThenSteps()).isEmpty();
        assertThat(ids(decision.getElseSteps())).containsExactly("no");
    }

    @Test
    public void testBranchesMeetingBeforeTheJoinAreReported() {
        StructuredFlow flow =
                analyze(
                        "{'id': 'check', 'type': 'If', 'inputs': {'condition': true}},"
                                + "{'id': 'a', "
                                + SET
                                + "}, {'id': 'b', "
                                + SET
                                + "}, {'id': 'after', "
                                + SET
                                + "}",
                        "{'from': 'start', 'to': 'check'},"
                                + "{'from': 'check', 'to': 'a', 'label': 'true'},"
                                + "{'from': 'check', 'to': 'b', 'label': 'false'},"
                                + "{'from': 'check', 'to': 'after', 'label': 'next'},"
                                + "{'from': 'a', 'to': 'b'}, {'from': 'b', 'to': 'after'}");

        assertThat(flow.isWellStructured()).isFalse();
        assertThat(flow.getIssues().get(0).getNodeId()).isEqualTo("check");
        assertThat(flow.getIssues().get(0).getMessage())
                .isEqualTo("both branches reach node 'b' before their join 'after'");
    }

    @Test
    public void testDuplicateLabelsAreReported() {
        StructuredFlow flow =
                analyze(
                        "{'id': 'check', 'type': 'If', 'inputs': {'condition': true}},"
                                + "{'id': 'a', "
                                + SET
                                + "}, {'id': 'b', "
                                + SET
                                + "}",
                        "{'from': 'start', 'to': 'check'},"
                                + "{'from': 'check', 'to': 'a', 'label': 'true'},"
                                + "{'from': 'check', 'to': 'b', 'label': 'true'}");

        assertThat(flow.getIssues()).hasSize(1);
        assertThat(flow.getIssues().get(0).getNodeId()).isEqualTo("check");
        assertThat(flow.getIssues().get(0).getMessage())
                .isEqualTo("has 2 edges labeled 'true', at most one is allowed");
    }

    // ==================== Loops ====================

    @Test
    public void testLoopBodyAndExit() {
        StructuredFlow flow =
                analyze(
                        "{'id': 'each', 'type': 'ForEach', 'inputs': {'array': 'state:players'}},"
                                + "{'id': 'one', "
                                + SET
                                + "}, {'id': 'two', "
                                + SET
                                + "}, {'id': 'after', "
                                + SET
                                + "}",
                        "{'from': 'start', 'to': 'each'},"
                                + "{'from': 'each', 'to': 'one', 'label': 'body'},"
                                + "{'from': 'one', 'to': 'two'}, {'from': 'two', 'to': 'each'},"
                                + "{'from': 'each', 'to': 'after', 'label': 'done'}");

        assertThat(flow.isWellStructured()).isTrue();
        assertThat(ids(flow.getSteps())).containsExactly("each", "after");
        LoopStep loop = (LoopStep) flow.getSteps().get(0);
        assertThat(loop.getKind()).isEqualTo(BuiltinNodeKind.FOR_EACH);
        assertThat(ids(loop.getBodySteps())).containsExactly("one", "two");
    }

    @Test
    public void testLoopBodyLeakingIntoExitIsReported() {
        StructuredFlow flow =
                analyze(
                        "{'id': 'each', 'type': 'ForEach', 'inputs': {'array': 'state:players'}},"
                                + "{'id': 'one', "
                                + SET
                                + "}, {'id': 'after', "
                                + SET
                                + "}, {'id': 'tail', "
                                + SET
                                + "}",
                        "{'from': 'start', 'to': 'each'},"
                                + "{'from': 'each', 'to': 'one', 'label': 'body'},"
                                + "{'from': 'one', 'to': 'tail'},"
                                + "{'from': 'each', 'to': 'after', 'label': 'done'},"
                                + "{'from': 'after', 'to': 'tail'}");

        assertThat(flow.isWellStructured()).isFalse();
        assertThat(flow.getIssues().get(0).getMessage())
                .isEqualTo(
                        "loop body reaches node 'tail'"
                                + " that is also reachable from the loop exit");
    }

    // ==================== Returns ====================

    @Test
    public void testAllPathsReturn() {
        StructuredFlow both =
                analyze(
                        "{'id': 'check', 'type': 'If', 'inputs': {'condition': true}},"
                                + "{'id': 'r1', 'type': 'Return', 'inputs': {}},"
                                + "{'id': 'r2', 'type': 'Return', 'inputs': {}}",
                        "{'from': 'start', 'to': 'check'},"
                                + "{'from': 'check', 'to': 'r1', 'label': 'true'},"
                                + "{'from': 'check', 'to': 'r2', 'label': 'false'}");
        StructuredFlow oneSided =
                analyze(
                        "{'id': 'check', 'type': 'If', 'inputs': {'condition': true}},"
                                + "{'id': 'r1', 'type': 'Return', 'inputs': {}}",
                        "{'from': 'start', 'to': 'check'},"
                                + "{'from': 'check', 'to': 'r1', 'label': 'true'}");

        assertThat(ReturnPathAnalyzer.allPathsReturn(both.getSteps())).isTrue();
        assertThat(ReturnPathAnalyzer.allPathsReturn(oneSided.getSteps())).isFalse();
    }

    private static StructuredFlow analyze(String nodes, String flow) {
        NodeGraph graph = handler("", nodes, flow);
        return ControlFlowAnalyzer.analyze(graph.getHandlers().get(0));
    }

    private static List<String> ids(List<FlowStep> steps) {
        List<String> ids = new ArrayList<>();
        for (FlowStep step : steps) {
            ids.add(step.getNode().getId());
        }
        return ids;
    }
}

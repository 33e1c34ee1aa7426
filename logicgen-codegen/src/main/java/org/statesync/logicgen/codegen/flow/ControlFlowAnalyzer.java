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
import org.statesync.logicgen.codegen.graph.FlowEdge;
import org.statesync.logicgen.codegen.graph.GraphFragment;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.BuiltinNodeKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rebuilds nested blocks from the flow edges of a fragment.
 *
 * <p>Emission starts at the successor of {@code start}. For an {@code If} node the join is the
 * node of its {@code next} edge if it has one, otherwise the first node, in breadth-first order
 * from the false target, that is also reachable from the true target. Both branches stop at the
 * join. For a loop node the body runs from the {@code body} target back to the loop node or to
 * the loop exit; after the loop emission continues at the exit ({@code done} edge, or the plain
 * one). Shapes these rules cannot nest faithfully are reported as {@link StructureIssue}s.
 */
@Internal
public final class ControlFlowAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(ControlFlowAnalyzer.class);

    private static final Set<String> SINGLE_LABELS =
            new HashSet<>(
                    Arrays.asList(
                            FlowEdge.LABEL_TRUE,
                            FlowEdge.LABEL_FALSE,
                            FlowEdge.LABEL_BODY,
                            FlowEdge.LABEL_DONE));

    private final FlowIndex index;
    private final List<StructureIssue> issues = new ArrayList<>();
    private final Set<String> placed = new LinkedHashSet<>();

    private ControlFlowAnalyzer(GraphFragment fragment) {
        this.index = new FlowIndex(fragment);
    }

    public static StructuredFlow analyze(GraphFragment fragment) {
        ControlFlowAnalyzer analyzer = new ControlFlowAnalyzer(fragment);
        analyzer.checkEdgeCounts();
        List<FlowStep> steps =
                analyzer.buildChain(analyzer.index.entry(), Collections.<String>emptySet());
        LOG.debug(
                "Reconstructed {} with {} placed nodes and {} structure issues.",
                fragment.describe(),
                analyzer.placed.size(),
                analyzer.issues.size());
        return new StructuredFlow(steps, analyzer.issues, analyzer.placed);
    }

    private void checkEdgeCounts() {
        for (Node node : index.getNodes()) {
            int continuations = 0;
            Map<String, Integer> labelCounts = new HashMap<>();
            for (FlowEdge edge : index.getOutgoing(node.getId())) {
                if (edge.isContinuation()) {
                    continuations++;
                } else {
                    labelCounts.merge(edge.getEffectiveLabel(), 1, Integer::sum);
                }
            }
            if (continuations > 1) {
                issues.add(
                        new StructureIssue(
                                node.getId(),
                                "has "
                                        + continuations
                                        + " unlabeled continuation edges, at most one is allowed"));
            }
            for (Map.Entry<String, Integer> entry : labelCounts.entrySet()) {
                if (entry.getValue() > 1 && SINGLE_LABELS.contains(entry.getKey())) {
                    issues.add(
                            new StructureIssue(
                                    node.getId(),
                                    "has "
                                            + entry.getValue()
                                            + " edges labeled '"
                                            + entry.getKey()
                                            + "', at most one is allowed"));
                }
            }
        }
    }

    /**
     * Builds the block starting at {@code startId}. The chain ends at {@code end}, at one of the
     * stop nodes, at a node already placed, or after a jump or return.
     */
    private List<FlowStep> buildChain(@Nullable String startId, Set<String> stops) {
        List<FlowStep> steps = new ArrayList<>();
        String current = startId;
        while (current != null && !FlowEdge.END.equals(current) && !stops.contains(current)) {
            if (FlowEdge.START.equals(current) || placed.contains(current)) {
                break;
            }
            Node node = index.getNode(current);
            if (node == null) {
                // dangling edge targets are reported by the validator
                break;
            }
            placed.add(current);
            BuiltinNodeKind kind = BuiltinNodeKind.fromType(node.getType());
            BuiltinNodeKind.Role role = kind == null ? null : kind.getRole();
            if (role == BuiltinNodeKind.Role.DECISION) {
                current = buildDecision(node, stops, steps);
            } else if (role == BuiltinNodeKind.Role.ITERATION) {
                current = buildLoop(node, kind, stops, steps);
            } else if (role == BuiltinNodeKind.Role.JUMP || role == BuiltinNodeKind.Role.TERMINAL) {
                steps.add(new NodeStep(node));
                current = null;
            } else {
                steps.add(new NodeStep(node));
                current = index.continuation(node.getId());
            }
        }
        return steps;
    }

    @Nullable
    private String buildDecision(Node node, Set<String> stops, List<FlowStep> steps) {
        String id = node.getId();
        String trueTarget = index.successor(id, FlowEdge.LABEL_TRUE);
        String falseTarget = index.successor(id, FlowEdge.LABEL_FALSE);
        String join = findJoin(id, trueTarget, falseTarget, stops);

        Set<String> innerStops = new HashSet<>(stops);
        innerStops.add(id);
        if (join != null) {
            innerStops.add(join);
        }
        Set<String> trueRegion = index.reachable(trueTarget, innerStops);
        for (String shared : index.breadthFirst(falseTarget, innerStops)) {
            if (trueRegion.contains(shared)) {
                issues.add(
                        new StructureIssue(
                                id,
                                "both branches reach node '"
                                        + shared
                                        + "' before their join"
                                        + (join == null ? "" : " '" + join + "'")));
                break;
            }
        }
        List<FlowStep> thenSteps = buildChain(trueTarget, innerStops);
        List<FlowStep> elseSteps = buildChain(falseTarget, innerStops);
        steps.add(new DecisionStep(node, thenSteps, elseSteps));
        return join;
    }

    @Nullable
    private String findJoin(
            String id,
            @Nullable String trueTarget,
            @Nullable String falseTarget,
            Set<String> stops) {
        String explicit = index.continuation(id);
        if (explicit != null) {
            return explicit;
        }
        if (trueTarget == null || falseTarget == null) {
            return null;
        }
        Set<String> barriers = new HashSet<>(stops);
        barriers.add(id);
        Set<String> trueRegion = index.reachable(trueTarget, barriers);
        for (String candidate : index.breadthFirst(falseTarget, barriers)) {
            if (trueRegion.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    @Nullable
    private String buildLoop(
            Node node, BuiltinNodeKind kind, Set<String> stops, List<FlowStep> steps) {
        String id = node.getId();
        String bodyTarget = index.successor(id, FlowEdge.LABEL_BODY);
        String exit = index.loopExit(id);

        Set<String> exitBarriers = new HashSet<>(stops);
        exitBarriers.add(id);
        Set<String> exitRegion = index.reachable(exit, exitBarriers);

        Set<String> bodyStops = new HashSet<>(exitBarriers);
        if (exit != null) {
            bodyStops.add(exit);
        }
        for (String bodyNode : index.breadthFirst(bodyTarget, bodyStops)) {
            if (exitRegion.contains(bodyNode)) {
                issues.add(
                        new StructureIssue(
                                id,
                                "loop body reaches node '"
                                        + bodyNode
                                        + "' that is also reachable from the loop exit"));
                break;
            }
        }
        List<FlowStep> bodySteps = buildChain(bodyTarget, bodyStops);
        steps.add(new LoopStep(node, kind, bodySteps));
        return exit;
    }
}

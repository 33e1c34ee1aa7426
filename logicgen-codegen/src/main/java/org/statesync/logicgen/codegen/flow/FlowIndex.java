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

import javax.annotation.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Adjacency lookups over the flow edges of one fragment. */
@Internal
public final class FlowIndex {

    private final GraphFragment fragment;
    private final Map<String, Node> nodesById = new LinkedHashMap<>();
    private final Map<String, List<FlowEdge>> outgoing = new HashMap<>();
    private final Map<String, Integer> inDegree = new HashMap<>();

    public FlowIndex(GraphFragment fragment) {
        this.fragment = fragment;
        for (Node node : fragment.getNodes()) {
            nodesById.putIfAbsent(node.getId(), node);
        }
        for (FlowEdge edge : fragment.getFlow()) {
            outgoing.computeIfAbsent(edge.getFrom(), k -> new ArrayList<>()).add(edge);
            inDegree.merge(edge.getTo(), 1, Integer::sum);
        }
    }

    public GraphFragment getFragment() {
        return fragment;
    }

    @Nullable
    public Node getNode(String id) {
        return nodesById.get(id);
    }

    public boolean containsNode(String id) {
        return nodesById.containsKey(id);
    }

    public Collection<Node> getNodes() {
        return nodesById.values();
    }

    public List<FlowEdge> getOutgoing(String id) {
        List<FlowEdge> edges = outgoing.get(id);
        return edges == null ? Collections.<FlowEdge>emptyList() : edges;
    }

    /** Target of the first edge leaving {@code id} with the given label. */
    @Nullable
    public String successor(String id, String label) {
        for (FlowEdge edge : getOutgoing(id)) {
            if (label.equals(edge.getEffectiveLabel())) {
                return edge.getTo();
            }
        }
        return null;
    }

    /** Target of the first unlabeled or {@code next} edge leaving {@code id}. */
    @Nullable
    public String continuation(String id) {
        for (FlowEdge edge : getOutgoing(id)) {
            if (edge.isContinuation()) {
                return edge.getTo();
            }
        }
        return null;
    }

    /** Where a loop continues when it ends: its {@code done} edge, else the plain one. */
    @Nullable
    public String loopExit(String id) {
        String done = successor(id, FlowEdge.LABEL_DONE);
        return done != null ? done : continuation(id);
    }

    /**
     * The first node to run. That is the successor of {@code start}; graphs without a start edge
     * begin at the first declared node nobody flows into.
     */
    @Nullable
    public String entry() {
        String fromStart = continuation(FlowEdge.START);
        if (fromStart != null) {
            return fromStart;
        }
        if (!getOutgoing(FlowEdge.START).isEmpty()) {
            return getOutgoing(FlowEdge.START).get(0).getTo();
        }
        for (Node node : nodesById.values()) {
            if (!inDegree.containsKey(node.getId())) {
                return node.getId();
            }
        }
        return nodesById.isEmpty() ? null : nodesById.keySet().iterator().next();
    }

    /** Nodes reachable from {@code from}, in breadth-first order, never entering a barrier. */
    public List<String> breadthFirst(@Nullable String from, Set<String> barriers) {
        List<String> order = new ArrayList<>();
        if (from == null || FlowEdge.isSentinel(from) || barriers.contains(from)) {
            return order;
        }
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(from);
        seen.add(from);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            order.add(current);
            for (FlowEdge edge : getOutgoing(current)) {
                String next = edge.getTo();
                if (!FlowEdge.isSentinel(next)
                        && !barriers.contains(next)
                        && containsNode(next)
                        && seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return order;
    }

    public Set<String> reachable(@Nullable String from, Set<String> barriers) {
        return new LinkedHashSet<>(breadthFirst(from, barriers));
    }
}

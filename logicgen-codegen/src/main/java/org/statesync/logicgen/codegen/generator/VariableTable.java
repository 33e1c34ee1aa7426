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

package org.statesync.logicgen.codegen.generator;

import org.statesync.logicgen.annotation.Internal;

import javax.annotation.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Names and visibility of the locals of one generated method.
 *
 * <p>Every local gets a name unique within the method: a taken name is suffixed with {@code _2},
 * {@code _3} and so on. Node outputs are recorded under {@code <nodeId>:<port>} in a stack of
 * block scopes that mirrors the braces of the emitted code, so an output declared inside a branch
 * or loop body is not visible after the block closes.
 */
@Internal
public final class VariableTable {

    private final Set<String> usedNames = new HashSet<>();
    private final Map<String, Integer> suffixCounters = new HashMap<>();
    private final Deque<Map<String, JavaExpression>> scopes = new ArrayDeque<>();
    private final Set<String> emittedNodes = new HashSet<>();

    public VariableTable() {
        scopes.push(new LinkedHashMap<>());
    }

    /** Marks a name as taken without declaring anything. */
    public void reserve(String name) {
        usedNames.add(name);
    }

    public boolean isUsed(String name) {
        return usedNames.contains(name);
    }

    /** Allocates a fresh name based on the preferred one. */
    public String allocate(String preferred) {
        String base = Names.isKeyword(preferred) ? preferred + "_" : preferred;
        if (usedNames.add(base)) {
            return base;
        }
        int counter = suffixCounters.getOrDefault(base, 1);
        String candidate;
        do {
            counter++;
            candidate = base + "_" + counter;
        } while (!usedNames.add(candidate));
        suffixCounters.put(base, counter);
        return candidate;
    }

    public void pushScope() {
        scopes.push(new LinkedHashMap<>());
    }

    public void popScope() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot pop the method scope.");
        }
        scopes.pop();
    }

    public void bindOutput(String nodeId, String port, JavaExpression expression) {
        scopes.peek().put(key(nodeId, port), expression);
        emittedNodes.add(nodeId);
    }

    /** The visible expression of an output, {@code null} if it is not in scope. */
    @Nullable
    public JavaExpression lookupOutput(String nodeId, String port) {
        String key = key(nodeId, port);
        for (Map<String, JavaExpression> scope : scopes) {
            JavaExpression expression = scope.get(key);
            if (expression != null) {
                return expression;
            }
        }
        return null;
    }

    /** Visible outputs of a node, in the order they were bound. */
    public Map<String, JavaExpression> outputsOf(String nodeId) {
        Map<String, JavaExpression> outputs = new LinkedHashMap<>();
        String prefix = nodeId + ":";
        for (Map<String, JavaExpression> scope : scopes) {
            for (Map.Entry<String, JavaExpression> entry : scope.entrySet()) {
                if (entry.getKey().startsWith(prefix)) {
                    outputs.putIfAbsent(
                            entry.getKey().substring(prefix.length()), entry.getValue());
                }
            }
        }
        return outputs;
    }

    public void markEmitted(String nodeId) {
        emittedNodes.add(nodeId);
    }

    /** Whether the node was emitted before, in scope or not. */
    public boolean wasEmitted(String nodeId) {
        return emittedNodes.contains(nodeId);
    }

    private static String key(String nodeId, String port) {
        return nodeId + ":" + port;
    }
}

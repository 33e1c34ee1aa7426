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

import org.statesync.logicgen.codegen.exception.CodeGenException;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.schema.SchemaContext;

import org.junit.jupiter.api.Test;

import javax.annotation.Nullable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameGraph;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameSchema;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.graph;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.handler;

/**
 * Tests for {@link JavaSourceGenerator}. Node level output is covered by the node catalog tests,
 * these focus on the class skeleton:
 *
 * <ul>
 *   <li>file header, package and member layout
 *   <li>view methods and filter classes
 *   <li>parameter naming and cancellation tokens
 *   <li>fragments that cannot be generated
 * </ul>
 */
public class JavaSourceGeneratorTest {

    private static final String SLOW_GRAPH =
            "{'functions': ["
                    + "{'name': 'slow', 'nodes': [{'id': 'pause', 'type': 'Wait',"
                    + " 'inputs': {'duration': 10}}], 'flow': [{'from': 'start', 'to': 'pause'}]},"
                    + "{'name': 'slower', 'nodes': [{'id': 'call', 'type': 'CallFunction',"
                    + " 'inputs': {'function': 'slow'}}],"
                    + " 'flow': [{'from': 'start', 'to': 'call'}]},"
                    + "{'name': 'quick', 'nodes': [], 'flow': []}],"
                    + " 'handlers': [{'name': 'OnTest', 'event': 'test', 'nodes': ["
                    + "{'id': 'call', 'type': 'CallFunction', 'inputs': {'function': 'slower'}}],"
                    + " 'flow': [{'from': 'start', 'to': 'call'}]}]}";

    // ==================== Class Layout ====================

    @Test
    public void testHeaderAndEmptyHandler() {
        String code = generate(handler("", "", ""), null);

        assertThat(code)
                .startsWith(
                        "// Code generated by logicgen. DO NOT EDIT.\n"
                                + "// Graph version: 1\n"
                                + "\n"
                                + "package com.example.game;\n")
                .contains("public final class GameLogic {\n\n    private GameLogic() {}\n")
                .contains("    /** Handles the 'test' event. */\n")
                .contains(
                        "    public static void onTest(Session<GameState> session, String senderId)"
                                + " throws HandlerException {\n"
                                + "        GameState state = session.getState();\n")
                .doesNotContain("FILTER_REGISTRY")
                .endsWith("    }\n}\n");
    }

    @Test
    public void testNoVersionNoPackage() {
        String code =
                generate(graph("{'handlers': [{'name': 'OnPing', 'event': 'ping'}]}"), null);

        assertThat(code)
                .startsWith("// Code generated by logicgen. DO NOT EDIT.\n\n")
                .doesNotContain("Graph version")
                .doesNotContain("package ");
    }

    @Test
    public void testViewMethods() {
        String code =
                generate(
                        graph(
                                "{'views': ["
                                        + "{'name': 'playerCount', 'path': 'players',"
                                        + " 'op': 'count'},"
                                        + "{'name': 'topScore', 'path': 'players', 'op': 'max',"
                                        + " 'field': 'score'}]}"),
                        new SchemaContext(gameSchema()));

        assertThat(code)
                .contains("    /** View 'playerCount': count over players. */\n")
                .contains("    public static int viewPlayerCount(GameState state) {\n")
                .contains("    /** View 'topScore': max over players. */\n")
                .contains("    public static double viewTopScore(GameState state) {\n")
                .contains("return 0.0;")
                .contains("Double.NEGATIVE_INFINITY");
        assertThat(code.indexOf("viewPlayerCount")).isLessThan(code.indexOf("viewTopScore"));
    }

    @Test
    public void testFilterClass() {
        String code = generate(gameGraph(), new SchemaContext(gameSchema()));

        assertThat(code)
                .contains(
                        "    private static final FilterRegistry<GameState> FILTER_REGISTRY ="
                                + " new FilterRegistry<GameState>();\n")
                .contains("    /** Hides the round counter. */\n")
                .contains(
                        "    public static final class MaskRoundFilter"
                                + " implements StateFilter<GameState> {\n")
                .contains("        public GameState apply(GameState state) {\n");
    }

    // ==================== Parameters ====================

    @Test
    public void testParameterNamesClashingWithGeneratedNames() {
        String code =
                generate(
                        handler(
                                "{'name': 'session', 'type': 'string'},"
                                        + "{'name': 'state', 'type': 'integer'},"
                                        + "{'name': 'class', 'type': 'boolean'}",
                                "",
                                ""),
                        null);

        assertThat(code)
                .contains(
                        "onTest(Session<GameState> session, String senderId,"
                                + " String sessionParam, int stateParam, boolean class_)");
    }

    @Test
    public void testCancellationPropagatesThroughCalls() {
        NodeGraph graph = graph(SLOW_GRAPH);

        assertThat(JavaSourceGenerator.cancellableFunctions(graph))
                .containsExactly("slow", "slower");

        String code = generate(graph, null);
        assertThat(code)
                .contains(
                        "public static void slow(CancellationToken cancellation,"
                                + " Session<GameState> session, GameState state)")
                .contains(
                        "public static void quick(Session<GameState> session, GameState state)")
                .contains(
                        "public static void onTest(CancellationToken cancellation,"
                                + " Session<GameState> session, String senderId)")
                .contains("slower(cancellation, session, state);")
                .contains("slow(cancellation, session, state);");
    }

    // ==================== Failures ====================

    @Test
    public void testTypedFunctionWithoutReturn() {
        NodeGraph graph =
                graph(
                        "{'functions': [{'name': 'score', 'returnType': 'integer',"
                                + " 'nodes': [], 'flow': []}]}");

        assertThatThrownBy(() -> generate(graph, null))
                .isInstanceOf(CodeGenException.class)
                .hasMessage("function 'score' returns integer but not every path ends in a Return");
    }

    @Test
    public void testUnstructuredFlow() {
        NodeGraph graph =
                handler(
                        "",
                        "{'id': 'check', 'type': 'If', 'inputs': {'condition': true}},"
                                + "{'id': 'a', 'type': 'SetVariable',"
                                + " 'inputs': {'name': 'x', 'value': 1}},"
                                + "{'id': 'b', 'type': 'SetVariable',"
                                + " 'inputs': {'name': 'x', 'value': 2}}",
                        "{'from': 'start', 'to': 'check'},"
                                + "{'from': 'check', 'to': 'a', 'label': 'true'},"
                                + "{'from': 'check', 'to': 'b', 'label': 'true'}");

        assertThatThrownBy(() -> generate(graph, null))
                .isInstanceOf(CodeGenException.class)
                .hasMessageStartingWith(
                        "handler 'OnTest' has control flow that cannot be nested: ");
    }

    private static String generate(NodeGraph graph, @Nullable SchemaContext schema) {
        return new JavaSourceGenerator(
                        NodeTypeRegistry.createDefault(), schema, "GameLogic", "GameState", false)
                .generate(graph);
    }
}

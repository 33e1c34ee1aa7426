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

package org.statesync.logicgen.codegen.compiler;

import org.statesync.logicgen.codegen.exception.GraphValidationException;
import org.statesync.logicgen.codegen.exception.ReferenceResolutionException;
import org.statesync.logicgen.codegen.generator.CodegenOptions;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.validate.ValidationResult;
import org.statesync.logicgen.config.Configuration;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameGraph;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameSchema;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.graph;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.handler;

/**
 * Tests for {@link LogicCompiler}. The tests cover:
 *
 * <ul>
 *   <li>Handler scenarios: empty handler, branching, host-only rejection.
 *   <li>Error reporting for dangling references with and without validation.
 *   <li>Placeholders for kinds without an emitter.
 *   <li>Determinism and the optional outputs.
 * </ul>
 */
public class LogicCompilerTest {

    // ==================== Scenarios ====================

    @Test
    public void testEmptyHandler() {
        CompilationResult result =
                LogicCompiler.createDefault().compile(handler("", "", ""), null);

        String java = result.getJavaSource();
        assertThat(result.getClassName()).isEqualTo("GameLogic");
        assertThat(java)
                .startsWith("// Code generated by logicgen. DO NOT EDIT.\n")
                .contains("// Graph version: 1")
                .contains("package com.example.game;")
                .contains("import org.statesync.logicgen.runtime.Session;")
                .contains("public final class GameLogic {")
                .contains("private GameLogic() {")
                .contains(
                        "public static void onTest(Session<GameState> session, String senderId)"
                                + " throws HandlerException {")
                .contains("        GameState state = session.getState();\n    }\n")
                .doesNotContain("return;")
                .doesNotContain("FILTER_REGISTRY")
                .doesNotContain("PermissionDeniedException");
        assertThat(result.getWarnings()).isEmpty();
        assertThat(result.getTypeScriptSource()).isEmpty();
    }

    @Test
    public void testIfElseBranches() {
        NodeGraph graph =
                handler(
                        "{'name': 'flag', 'type': 'boolean'}",
                        "{'id': 'check', 'type': 'If', 'inputs': {'condition': 'param:flag'}},"
                                + "{'id': 'yes', 'type': 'SetField',"
                                + " 'inputs': {'path': 'phase', 'value': 'yes'}},"
                                + "{'id': 'no', 'type': 'SetField',"
                                + " 'inputs': {'path': 'phase', 'value': 'no'}}",
                        "{'from': 'start', 'to': 'check'},"
                                + "{'from': 'check', 'to': 'yes', 'label': 'true'},"
                                + "{'from': 'check', 'to': 'no', 'label': 'false'}");

        String java = LogicCompiler.createDefault().compile(graph, null).getJavaSource();

        assertThat(java)
                .contains("boolean flag")
                .contains("if (flag) {")
                .contains("state.setPhase(\"yes\");")
                .contains("} else {")
                .contains("state.setPhase(\"no\");");
        assertThat(java.indexOf("setPhase(\"yes\")")).isLessThan(java.indexOf("} else {"));
        assertThat(java.indexOf("} else {")).isLessThan(java.indexOf("setPhase(\"no\")"));
    }

    @Test
    public void testHostOnlyIsCheckedBeforeAnyNode() {
        NodeGraph graph =
                graph(
                        "{'handlers': [{'name': 'OnReset', 'event': 'reset',"
                                + " 'permissions': {'hostOnly': true},"
                                + " 'nodes': [{'id': 'reset', 'type': 'SetField',"
                                + " 'inputs': {'path': 'round', 'value': 0}}],"
                                + " 'flow': [{'from': 'start', 'to': 'reset'}]}]}");

        String java = LogicCompiler.createDefault().compile(graph, null).getJavaSource();

        int hostCheck = java.indexOf("if (!session.isHost(senderId)) {");
        assertThat(hostCheck).isPositive();
        assertThat(java).contains("throw PermissionDeniedException.notHost();");
        assertThat(java)
                .contains("import org.statesync.logicgen.runtime.PermissionDeniedException;");
        assertThat(hostCheck).isLessThan(java.indexOf("GameState state = session.getState();"));
        assertThat(hostCheck).isLessThan(java.indexOf("// Node: reset (SetField)"));
    }

    @Test
    public void testPlayerParamAndAllowList() {
        NodeGraph graph =
                graph(
                        "{'handlers': [{'name': 'OnMove', 'event': 'move',"
                                + " 'permissions': {'playerParam': 'player',"
                                + " 'allowedPlayers': ['alice', 'bob']},"
                                + " 'parameters': [{'name': 'player', 'type': 'string'}],"
                                + " 'nodes': [], 'flow': []}]}");

        String java = LogicCompiler.createDefault().compile(graph, null).getJavaSource();

        assertThat(java)
                .contains(
                        "private static final List<String> ON_MOVE_ALLOWED_PLAYERS ="
                                + " Arrays.asList(\"alice\", \"bob\");")
                .contains("if (!Values.looseEquals(senderId, player)) {")
                .contains("if (!ON_MOVE_ALLOWED_PLAYERS.contains(senderId)) {")
                .contains("throw PermissionDeniedException.notAllowed();");
    }

    // ==================== Errors ====================

    @Test
    public void testDanglingReferenceFailsValidation() {
        NodeGraph graph =
                handler(
                        "",
                        "{'id': 'use', 'type': 'SetField',"
                                + " 'inputs': {'path': 'phase', 'value': 'node:ghost:result'}}",
                        "{'from': 'start', 'to': 'use'}");

        assertThatThrownBy(() -> LogicCompiler.createDefault().compile(graph, null))
                .isInstanceOf(GraphValidationException.class)
                .hasMessageContaining("ghost");

        ValidationResult result = LogicCompiler.createDefault().validate(graph, null);
        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0).getMessage())
                .isEqualTo("references unknown node 'ghost'");
    }

    @Test
    public void testDanglingReferenceFailsGenerationWithoutValidation() {
        NodeGraph graph =
                handler(
                        "",
                        "{'id': 'use', 'type': 'SetField',"
                                + " 'inputs': {'path': 'phase', 'value': 'node:ghost:result'}}",
                        "{'from': 'start', 'to': 'use'}");
        Configuration configuration = new Configuration();
        configuration.set(CodegenOptions.VALIDATE_ENABLED, false);
        LogicCompiler compiler =
                new LogicCompiler(configuration, NodeTypeRegistry.createDefault());

        assertThatThrownBy(() -> compiler.compile(graph, null))
                .isInstanceOf(ReferenceResolutionException.class)
                .hasMessage("handler 'OnTest', node 'use': references unknown node 'ghost'");
    }

    @Test
    public void testKindWithoutEmitterCompilesToPlaceholder() {
        NodeTypeRegistry registry = NodeTypeRegistry.createDefault();
        registry.register(
                NodeDefinition.newBuilder("Sparkle")
                        .category("effects")
                        .description("Client side particle effect.")
                        .build());
        NodeGraph graph =
                handler(
                        "",
                        "{'id': 'fx', 'type': 'Sparkle', 'inputs': {}}",
                        "{'from': 'start', 'to': 'fx'}");

        CompilationResult result =
                new LogicCompiler(new Configuration(), registry).compile(graph, null);

        assertThat(result.getJavaSource())
                .contains("// not implemented: node fx (Sparkle) has no emitter");
    }

    // ==================== Outputs ====================

    @Test
    public void testOutputIsDeterministic() {
        Configuration configuration = new Configuration();
        configuration.set(CodegenOptions.TYPESCRIPT_ENABLED, true);
        LogicCompiler compiler =
                new LogicCompiler(configuration, NodeTypeRegistry.createDefault());

        CompilationResult first = compiler.compile(gameGraph(), gameSchema());
        CompilationResult second = compiler.compile(gameGraph(), gameSchema());

        assertThat(second.getJavaSource()).isEqualTo(first.getJavaSource());
        assertThat(second.getTypeScriptSource()).isEqualTo(first.getTypeScriptSource());
    }

    @Test
    public void testGameGraphWithSchema() {
        Configuration configuration = new Configuration();
        configuration.set(CodegenOptions.CLASS_NAME, "PartyLogic");
        configuration.set(CodegenOptions.TYPESCRIPT_ENABLED, true);
        LogicCompiler compiler =
                new LogicCompiler(configuration, NodeTypeRegistry.createDefault());

        CompilationResult result = compiler.compile(gameGraph(), gameSchema());

        String java = result.getJavaSource();
        assertThat(result.getClassName()).isEqualTo("PartyLogic");
        assertThat(java)
                .contains("// Graph version: 1.2.0")
                .contains("import com.example.game.state.*;")
                .contains("public final class PartyLogic {")
                .contains("FilterRegistry<GameState> FILTER_REGISTRY")
                .contains("public static int viewPlayerCount(GameState state) {")
                .contains("public static double viewTotalScore(GameState state) {")
                .contains(
                        "public static final class MaskRoundFilter"
                                + " implements StateFilter<GameState> {")
                .contains(
                        "public static int bonus(Session<GameState> session, GameState state,"
                                + " int base)")
                .contains("public static void onJoin(")
                .contains("public static void onScore(")
                .contains("public static void onStart(");
        assertThat(java.indexOf("viewPlayerCount")).isLessThan(java.indexOf("MaskRoundFilter"));
        assertThat(java.indexOf("MaskRoundFilter")).isLessThan(java.indexOf("int bonus("));
        assertThat(java.indexOf("int bonus(")).isLessThan(java.indexOf("void onJoin("));
        assertThat(result.getTypeScriptSource()).isPresent();
        assertThat(result.getTypeScriptSource().get()).contains("export interface Player {");
    }

    @Test
    public void testTraceAndWaitChangeHandlerSignature() {
        NodeGraph graph =
                handler(
                        "{'name': 'delay', 'type': 'integer'}",
                        "{'id': 'pause', 'type': 'Wait',"
                                + " 'inputs': {'duration': 'param:delay', 'unit': 'ms'}}",
                        "{'from': 'start', 'to': 'pause'}");
        Configuration configuration = new Configuration();
        configuration.set(CodegenOptions.TRACE_ENABLED, true);
        LogicCompiler compiler =
                new LogicCompiler(configuration, NodeTypeRegistry.createDefault());

        String java = compiler.compile(graph, null).getJavaSource();

        assertThat(java)
                .contains(
                        "public static void onTest(CancellationToken cancellation,"
                                + " Session<GameState> session, String senderId, int delay,"
                                + " TraceSink trace) throws HandlerException {")
                .contains("import org.statesync.logicgen.runtime.CancellationToken;")
                .contains("import org.statesync.logicgen.runtime.trace.TraceSink;");
    }
}

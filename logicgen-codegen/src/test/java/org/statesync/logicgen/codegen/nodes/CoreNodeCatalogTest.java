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

package org.statesync.logicgen.codegen.nodes;

import org.statesync.logicgen.codegen.exception.CodeGenException;
import org.statesync.logicgen.codegen.generator.JavaSourceGenerator;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.graph;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.handler;

/**
 * Tests for the emitters registered by {@link CoreNodeCatalog}. Each test compiles a handler whose
 * nodes run in a straight line and checks the statements they produce.
 */
public class CoreNodeCatalogTest {

    private static final String POINTS = "{'name': 'points', 'type': 'integer'}";
    private static final String FLAG = "{'name': 'flag', 'type': 'boolean'}";
    private static final String TARGET = "{'name': 'target', 'type': 'string'}";

    // ==================== Catalog ====================

    @Test
    public void testCatalogRegistersCoreKinds() {
        NodeTypeRegistry registry = NodeTypeRegistry.createDefault();

        for (String type :
                new String[] {
                    "GetField", "SetField", "AddToArray", "Add", "Divide", "Compare", "And",
                    "EmitToAll", "EmitExcept", "CallFunction", "SetVariable", "AddFilter",
                    "GetHostPlayer", "RandomInt", "Clamp"
                }) {
            NodeDefinition definition = registry.lookup(type);
            assertThat(definition).as(type).isNotNull();
            assertThat(definition.hasEmitter()).as(type).isTrue();
        }
        assertThat(registry.lookup("Add").getCategory()).isEqualTo("math");
        assertThat(registry.lookup("EmitToAll").getCategory()).isEqualTo("event");
    }

    // ==================== Math ====================

    @Test
    public void testIntegerArithmetic() {
        String code =
                compile(
                        POINTS,
                        "{'id': 'sum', 'type': 'Add', 'inputs': {'a': 'param:points', 'b': 2}},"
                                + "{'id': 'twice', 'type': 'Multiply',"
                                + " 'inputs': {'a': 'node:sum:result', 'b': 2}},"
                                + "{'id': 'rest', 'type': 'Modulo',"
                                + " 'inputs': {'a': 'node:twice:result', 'b': 3}}",
                        "sum",
                        "twice",
                        "rest");

        assertThat(code)
                .contains("int sum_result = points + 2;")
                .contains("int twice_result = sum_result * 2;")
                .contains("int rest_divisor = 3;")
                .contains("int rest_result = rest_divisor == 0 ? 0 : twice_result % rest_divisor;");
    }

    @Test
    public void testMixedArithmeticWidensToDouble() {
        String code =
                compile(
                        POINTS,
                        "{'id': 'sum', 'type': 'Add', 'inputs': {'a': 'param:points', 'b': 0.5}},"
                                + "{'id': 'big', 'type': 'Max',"
                                + " 'inputs': {'a': 'param:points', 'b': 10000000000}}",
                        "sum",
                        "big");

        assertThat(code)
                .contains("double sum_result = ((double) points) + 0.5;")
                .contains("long big_result = Math.max(points, 10000000000L);");
    }

    @Test
    public void testDivideAlwaysYieldsDouble() {
        String code =
                compile(
                        POINTS,
                        "{'id': 'div', 'type': 'Divide', 'inputs': {'a': 'param:points', 'b': 4}}",
                        "div");

        assertThat(code)
                .contains("double div_divisor = (double) 4;")
                .contains(
                        "double div_result = div_divisor == 0 ? 0.0"
                                + " : ((double) points) / div_divisor;");
    }

    @Test
    public void testUnaryAndClamp() {
        String code =
                compile(
                        POINTS,
                        "{'id': 'r', 'type': 'Round', 'inputs': {'value': 'param:points'}},"
                                + "{'id': 'c', 'type': 'Clamp', 'inputs':"
                                + " {'value': 'node:r:result', 'min': 0.0, 'max': 10.0}}",
                        "r",
                        "c");

        assertThat(code)
                .contains("double r_result = (double) Math.round((double) points);")
                .contains("double c_result = Math.max(0.0, Math.min(10.0, r_result));");
    }

    // ==================== Logic ====================

    @Test
    public void testBooleanLogic() {
        String code =
                compile(
                        FLAG + "," + TARGET,
                        "{'id': 'neg', 'type': 'Not', 'inputs': {'value': 'param:flag'}},"
                                + "{'id': 'both', 'type': 'And',"
                                + " 'inputs': {'a': 'node:neg:result', 'b': true}},"
                                + "{'id': 'none', 'type': 'IsNull',"
                                + " 'inputs': {'value': 'param:target'}},"
                                + "{'id': 'never', 'type': 'IsNull',"
                                + " 'inputs': {'value': 'param:flag'}}",
                        "neg",
                        "both",
                        "none",
                        "never");

        assertThat(code)
                .contains("boolean neg_result = !flag;")
                .contains("boolean both_result = neg_result && true;")
                .contains("boolean none_result = target == null;")
                .contains("boolean never_result = false;");
    }

    @Test
    public void testCompare() {
        String code =
                compile(
                        POINTS + "," + TARGET,
                        "{'id': 'high', 'type': 'Compare',"
                                + " 'inputs': {'left': 'param:points', 'op': '>=', 'right': 10}},"
                                + "{'id': 'same', 'type': 'Compare',"
                                + " 'inputs': {'left': 'param:target', 'op': '==',"
                                + " 'right': 'bob'}}",
                        "high",
                        "same");

        assertThat(code)
                .contains("boolean high_result = points >= 10;")
                .contains("boolean same_result = Values.looseEquals(target, \"bob\");");
    }

    @Test
    public void testUnsupportedComparison() {
        assertThatThrownBy(
                        () ->
                                compile(
                                        POINTS,
                                        "{'id': 'odd', 'type': 'Compare', 'inputs':"
                                                + " {'left': 'param:points', 'op': '<>',"
                                                + " 'right': 1}}",
                                        "odd"))
                .isInstanceOf(CodeGenException.class)
                .hasMessageContaining("node 'odd'")
                .hasMessageContaining("unsupported comparison operator '<>'");
    }

    // ==================== Events ====================

    @Test
    public void testEvents() {
        String code =
                compile(
                        TARGET + "," + POINTS,
                        "{'id': 'all', 'type': 'EmitToAll', 'inputs': {'eventType': 'joined'}},"
                                + "{'id': 'one', 'type': 'EmitToPlayer', 'inputs':"
                                + " {'playerID': 'param:target', 'eventType': 'hi',"
                                + " 'payload': 'param:points'}},"
                                + "{'id': 'rest', 'type': 'EmitExcept',"
                                + " 'inputs': {'eventType': 'left'}}",
                        "all",
                        "one",
                        "rest");

        assertThat(code)
                .contains("session.emit(\"joined\", null);")
                .contains("session.emitTo(target, \"hi\", points);")
                .contains("session.emitExcept(senderId, \"left\", null);");
        assertThat(code.indexOf("session.emit(")).isLessThan(code.indexOf("session.emitTo("));
    }

    // ==================== Session and Filters ====================

    @Test
    public void testSessionNodes() {
        String code =
                compile(
                        TARGET,
                        "{'id': 'host', 'type': 'GetHostPlayer', 'inputs': {}},"
                                + "{'id': 'check', 'type': 'IsHost',"
                                + " 'inputs': {'playerID': 'node:host:hostPlayerID'}},"
                                + "{'id': 'kick', 'type': 'KickPlayer',"
                                + " 'inputs': {'playerID': 'param:target'}},"
                                + "{'id': 'count', 'type': 'GetPlayerCount'}",
                        "host",
                        "check",
                        "kick",
                        "count");

        assertThat(code)
                .contains("String host_hostPlayerID = session.getHostPlayerId();")
                .contains("boolean check_isHost = session.isHost(host_hostPlayerID);")
                .contains("boolean kick_kicked = session.kick(target, \"\");")
                .contains("int count_count = session.getPlayerIds().size();");
    }

    @Test
    public void testAddFilter() {
        String json =
                "{'filters': [{'name': 'hide'}],"
                        + " 'handlers': [{'name': 'OnTest', 'event': 'test', 'parameters': ["
                        + TARGET
                        + "], 'nodes': [{'id': 'add', 'type': 'AddFilter', 'inputs':"
                        + " {'viewerID': 'param:target', 'filterID': 'mask',"
                        + " 'filterName': 'hide'}}],"
                        + " 'flow': [{'from': 'start', 'to': 'add'}]}]}";
        String code =
                new JavaSourceGenerator(
                                NodeTypeRegistry.createDefault(),
                                null,
                                "GameLogic",
                                "GameState",
                                false)
                        .generate(graph(json));

        assertThat(code)
                .contains(
                        "        String add_viewer = target;\n"
                                + "        String add_key ="
                                + " session.getSessionId() + \":\" + add_viewer;\n"
                                + "        FILTER_REGISTRY.add("
                                + "add_key, \"mask\", new HideFilter());\n"
                                + "        session.setFilter(add_viewer,"
                                + " FILTER_REGISTRY.getComposed(add_key));\n");
    }

    @Test
    public void testAddUnknownFilter() {
        assertThatThrownBy(
                        () ->
                                compile(
                                        TARGET,
                                        "{'id': 'add', 'type': 'AddFilter', 'inputs':"
                                                + " {'viewerID': 'param:target', 'filterID': 'x',"
                                                + " 'filterName': 'ghost'}}",
                                        "add"))
                .isInstanceOf(CodeGenException.class)
                .hasMessage("handler 'OnTest', node 'add': adds unknown filter 'ghost'");
    }

    // ==================== Inputs ====================

    @Test
    public void testMissingRequiredInput() {
        assertThatThrownBy(
                        () ->
                                compile(
                                        POINTS,
                                        "{'id': 'sum', 'type': 'Add',"
                                                + " 'inputs': {'a': 'param:points'}}",
                                        "sum"))
                .isInstanceOf(CodeGenException.class)
                .hasMessage("handler 'OnTest', node 'sum': required input 'b' is missing");
    }

    @Test
    public void testNodeComments() {
        String code =
                compile(
                        "",
                        "{'id': 'all', 'type': 'EmitToAll', 'inputs': {'eventType': 'ping'}}",
                        "all");

        assertThat(code).contains("        // Node: all (EmitToAll)\n");
    }

    /** Compiles a handler whose nodes run in the given order. */
    static String compile(String parameters, String nodes, String... order) {
        List<String> edges = new ArrayList<>();
        String previous = "start";
        for (String id : order) {
            edges.add("{'from': '" + previous + "', 'to': '" + id + "'}");
            previous = id;
        }
        return new JavaSourceGenerator(
                        NodeTypeRegistry.createDefault(), null, "GameLogic", "GameState", false)
                .generate(handler(parameters, nodes, String.join(",", edges)));
    }
}

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

package org.statesync.logicgen.codegen.typescript;

import org.statesync.logicgen.codegen.exception.CodeGenException;
import org.statesync.logicgen.codegen.schema.FieldType;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameGraph;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameSchema;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.graph;

/**
 * Tests for {@link TypeScriptBindingsGenerator} and {@link TypeScriptTypeMapper}.
 *
 * <ul>
 *   <li>schema interfaces, including optional fields
 *   <li>event name constants and typed send functions
 *   <li>mapping of composite and loose parameter types
 * </ul>
 */
public class TypeScriptBindingsGeneratorTest {

    // ==================== Bindings ====================

    @Test
    public void testSchemaInterfaces() {
        String ts = new TypeScriptBindingsGenerator(gameSchema()).generate(gameGraph());

        assertThat(ts)
                .startsWith(
                        "// Code generated by logicgen. DO NOT EDIT.\n// Graph version: 1.2.0\n")
                .contains(
                        "export interface GameState {\n"
                                + "  phase: string;\n"
                                + "  round: number;\n"
                                + "  players: Player[];\n"
                                + "  scores: Record<string, number>;\n"
                                + "  winner?: string;\n"
                                + "}\n")
                .contains("  alive: boolean;\n  nickname?: string;\n}\n");
    }

    @Test
    public void testEventsAndSendFunctions() {
        String ts = new TypeScriptBindingsGenerator(gameSchema()).generate(gameGraph());

        assertThat(ts)
                .contains(
                        "export const EventName = {\n"
                                + "  OnJoin: \"join\",\n"
                                + "  OnScore: \"score\",\n"
                                + "  OnStart: \"start\",\n"
                                + "} as const;\n")
                .contains("export type Send = (event: EventName, params: unknown) => void;\n")
                .contains(
                        "export interface OnScoreParams {\n"
                                + "  playerId: string;\n"
                                + "  points: number;\n"
                                + "}\n\n"
                                + "export function sendOnScore(send: Send, params: OnScoreParams)"
                                + ": void {\n"
                                + "  send(EventName.OnScore, params);\n"
                                + "}\n")
                .contains("export interface OnStartParams {\n}\n");
        assertThat(ts.indexOf("sendOnJoin")).isLessThan(ts.indexOf("sendOnScore"));
    }

    @Test
    public void testWithoutSchema() {
        String ts =
                new TypeScriptBindingsGenerator(null)
                        .generate(
                                graph(
                                        "{'handlers': [{'name': 'on-chat', 'event': 'chat',"
                                                + " 'parameters': [{'name': 'text', 'type': 'any'},"
                                                + " {'name': 'tags', 'type': '[]string'}]}]}"));

        assertThat(ts)
                .doesNotContain("Graph version")
                .doesNotContain("export interface GameState")
                .contains("  On_chat: \"chat\",\n")
                .contains(
                        "export interface On_chatParams {\n  text: unknown;\n  tags: string[];\n}");
    }

    // ==================== Type Mapping ====================

    @Test
    public void testFieldTypes() {
        assertThat(map("int64")).isEqualTo("number");
        assertThat(map("float32")).isEqualTo("number");
        assertThat(map("bool")).isEqualTo("boolean");
        assertThat(map("bytes")).isEqualTo("Uint8Array");
        assertThat(map("any")).isEqualTo("unknown");
        assertThat(map("Player")).isEqualTo("Player");
        assertThat(map("*string")).isEqualTo("string | null");
        assertThat(map("**int")).isEqualTo("number | null");
        assertThat(map("[]*int")).isEqualTo("(number | null)[]");
        assertThat(map("*[]int")).isEqualTo("number[] | null");
        assertThat(map("map[string]*Player")).isEqualTo("Record<string, Player | null>");
        assertThat(map("[][]string")).isEqualTo("string[][]");
    }

    @Test
    public void testParameterTypes() {
        assertThat(TypeScriptTypeMapper.parameterType(null)).isEqualTo("unknown");
        assertThat(TypeScriptTypeMapper.parameterType(" ")).isEqualTo("unknown");
        assertThat(TypeScriptTypeMapper.parameterType("object")).isEqualTo("unknown");
        assertThat(TypeScriptTypeMapper.parameterType("integer")).isEqualTo("number");
        assertThat(TypeScriptTypeMapper.parameterType("double")).isEqualTo("number");
        assertThat(TypeScriptTypeMapper.parameterType("boolean")).isEqualTo("boolean");
        assertThat(TypeScriptTypeMapper.parameterType("string")).isEqualTo("string");
        assertThat(TypeScriptTypeMapper.parameterType("map[string]int"))
                .isEqualTo("Record<string, number>");

        assertThatThrownBy(() -> TypeScriptTypeMapper.parameterType("map[string"))
                .isInstanceOf(CodeGenException.class)
                .hasMessage("Invalid parameter type 'map[string'.");
    }

    private static String map(String type) {
        return TypeScriptTypeMapper.toTypeScript(FieldType.parse(type));
    }
}

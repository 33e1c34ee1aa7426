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

package org.statesync.logicgen.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link LogicGenCli}.
 *
 * <ul>
 *   <li>generation of Java and TypeScript files
 *   <li>validation only, with and without errors
 *   <li>exit codes and messages for bad input
 * </ul>
 */
public class LogicGenCliTest {

    private static final String GRAPH =
            "{'version': '1', 'package': 'com.example.game', 'handlers': [{'name': 'OnPing',"
                    + " 'event': 'ping', 'parameters': [{'name': 'count', 'type': 'integer'}],"
                    + " 'nodes': [{'id': 'echo', 'type': 'EmitToAll',"
                    + " 'inputs': {'eventType': 'pong', 'payload': 'param:count'}}],"
                    + " 'flow': [{'from': 'start', 'to': 'echo'}]}]}";

    private static final String BROKEN_GRAPH =
            "{'handlers': [{'name': 'OnPing', 'event': 'ping',"
                    + " 'nodes': [{'id': 'echo', 'type': 'Teleport'}],"
                    + " 'flow': [{'from': 'start', 'to': 'echo'}]}]}";

    @TempDir Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private LogicGenCli cli;

    @BeforeEach
    public void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        cli = new LogicGenCli(new PrintStream(out, true), new PrintStream(err, true));
    }

    // ==================== Generation ====================

    @Test
    public void testGenerateJavaAndTypeScript() throws Exception {
        Path input = writeJson("logic.json", GRAPH);
        Path javaFile = tempDir.resolve("gen/PingLogic.java");
        Path tsFile = tempDir.resolve("gen/ping.ts");

        int exitCode =
                cli.run(
                        new String[] {
                            "-input", input.toString(),
                            "-output", javaFile.toString(),
                            "-ts", tsFile.toString()
                        });

        assertThat(exitCode).isEqualTo(LogicGenCli.SUCCESS);
        assertThat(read(javaFile))
                .contains("package com.example.game;")
                .contains("public final class PingLogic {")
                .contains(
                        "public static void onPing(Session<GameState> session, String senderId,"
                                + " int count) throws HandlerException {");
        assertThat(read(tsFile)).contains("export function sendOnPing(");
        assertThat(text(out)).contains("Generated " + javaFile).contains("Generated " + tsFile);
    }

    @Test
    public void testDebugAddsTraceSink() throws Exception {
        Path input = writeJson("logic.json", GRAPH);
        Path javaFile = tempDir.resolve("Traced.java");

        int exitCode =
                cli.run(
                        new String[] {
                            "-input", input.toString(), "-output", javaFile.toString(), "-debug"
                        });

        assertThat(exitCode).isEqualTo(LogicGenCli.SUCCESS);
        assertThat(read(javaFile)).contains("int count, TraceSink trace)");
    }

    // ==================== Validation ====================

    @Test
    public void testValidateValidGraph() throws Exception {
        Path input = writeJson("logic.json", GRAPH);

        int exitCode = cli.run(new String[] {"-validate", "-input", input.toString()});

        assertThat(exitCode).isEqualTo(LogicGenCli.SUCCESS);
        assertThat(text(out)).contains("Graph is valid, 0 warning(s).");
    }

    @Test
    public void testValidateReportsErrors() throws Exception {
        Path input = writeJson("broken.json", BROKEN_GRAPH);

        int exitCode = cli.run(new String[] {"-validate", "-input", input.toString()});

        assertThat(exitCode).isEqualTo(LogicGenCli.FAILURE);
        assertThat(text(err))
                .contains("unknown node type 'Teleport'")
                .contains("Validation failed with 1 error(s)");
    }

    @Test
    public void testGenerateRejectsInvalidGraph() throws Exception {
        Path input = writeJson("broken.json", BROKEN_GRAPH);
        Path javaFile = tempDir.resolve("Broken.java");

        int exitCode =
                cli.run(new String[] {"-input", input.toString(), "-output", javaFile.toString()});

        assertThat(exitCode).isEqualTo(LogicGenCli.FAILURE);
        assertThat(text(err)).startsWith("Error: Graph validation failed with 1 error(s):");
        assertThat(javaFile).doesNotExist();
    }

    // ==================== Bad Input ====================

    @Test
    public void testMissingInputFile() {
        int exitCode =
                cli.run(
                        new String[] {
                            "-input", tempDir.resolve("missing.json").toString(), "-validate"
                        });

        assertThat(exitCode).isEqualTo(LogicGenCli.FAILURE);
        assertThat(text(err)).startsWith("Error: Could not read graph file ");
    }

    @Test
    public void testBadFlags() {
        assertThat(cli.run(new String[] {"-output", "X.java"})).isEqualTo(LogicGenCli.FAILURE);
        assertThat(text(err))
                .contains("Error: Missing required flag -input.")
                .contains("Usage: logicgen");
    }

    @Test
    public void testHelp() {
        assertThat(cli.run(new String[] {"-help"})).isEqualTo(LogicGenCli.SUCCESS);
        assertThat(text(out)).startsWith("Usage: logicgen");
        assertThat(text(err)).isEmpty();
    }

    private Path writeJson(String name, String singleQuotedJson) throws Exception {
        Path file = tempDir.resolve(name);
        Files.write(file, singleQuotedJson.replace('\'', '"').getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private static String read(Path file) throws Exception {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    private static String text(ByteArrayOutputStream stream) {
        return new String(stream.toByteArray(), StandardCharsets.UTF_8);
    }
}

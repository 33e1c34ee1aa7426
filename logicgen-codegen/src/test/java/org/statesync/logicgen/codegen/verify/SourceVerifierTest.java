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

package org.statesync.logicgen.codegen.verify;

import org.statesync.logicgen.codegen.exception.CodeGenException;
import org.statesync.logicgen.codegen.generator.JavaSourceGenerator;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.schema.SchemaContext;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameGraph;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameSchema;

/** Tests for {@link SourceVerifier}. */
public class SourceVerifierTest {

    @Test
    public void testValidSource() {
        String code =
                "package com.example;\n"
                        + "import java.util.List;\n"
                        + "public final class Valid {\n"
                        + "    static int size(List<String> items) { return items.size(); }\n"
                        + "}\n";

        assertThatCode(() -> SourceVerifier.verify("Valid.java", code)).doesNotThrowAnyException();
    }

    @Test
    public void testInvalidSource() {
        String code = "public final class Broken {\n    void run( {\n    }\n}\n";

        assertThatThrownBy(() -> SourceVerifier.verify("Broken.java", code))
                .isInstanceOf(CodeGenException.class)
                .hasMessageStartingWith("Generated source Broken.java is not valid Java: ")
                .hasMessageEndingWith("This is a bug. Please file an issue.");
    }

    @Test
    public void testGeneratedGameLogicParses() {
        String code =
                new JavaSourceGenerator(
                                NodeTypeRegistry.createDefault(),
                                new SchemaContext(gameSchema()),
                                "GameLogic",
                                "GameState",
                                true)
                        .generate(gameGraph());

        assertThatCode(() -> SourceVerifier.verify("GameLogic.java", code))
                .doesNotThrowAnyException();
    }

    @Test
    public void testAddLineNumber() {
        assertThat(SourceVerifier.addLineNumber("class A {\n}"))
                .isEqualTo("/* 1 */class A {\n/* 2 */}\n");
        assertThat(SourceVerifier.addLineNumber("x\n")).isEqualTo("/* 1 */x\n/* 2 */\n");
    }
}

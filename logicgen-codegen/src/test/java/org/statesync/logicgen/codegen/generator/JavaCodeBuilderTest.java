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

import org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Modifier;
import org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Param;
import org.statesync.logicgen.codegen.generator.JavaCodeBuilder.PrimitiveType;
import org.statesync.logicgen.codegen.testutils.CodeGenTestUtils;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Modifier.FINAL;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Modifier.PRIVATE;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Modifier.PUBLIC;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Modifier.STATIC;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Param.of;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.PrimitiveType.INT;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.PrimitiveType.LONG;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.genericOf;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.mods;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.params;

/**
 * Tests for {@link JavaCodeBuilder}.
 *
 * <p>Whole classes are compared with expected files in {@code
 * src/test/resources/expected/java-code-builder/}, helpers with exact equality.
 */
public class JavaCodeBuilderTest {

    private static final String EXPECTED_DIR = "java-code-builder";
    private static final String[] NO_EXCEPTIONS = new String[0];

    private JavaCodeBuilder builder;

    @BeforeEach
    public void setUp() {
        builder = new JavaCodeBuilder();
    }

    // ==================== Code Generation Tests ====================

    /** The shape of a generated logic class: registry, constructor and one handler. */
    @Test
    public void testHandlerClass() {
        String code =
                builder.beginClass(new Modifier[] {PUBLIC, FINAL}, "GameLogic", null)
                        .newLine()
                        .fieldWithInit(
                                new Modifier[] {PRIVATE, STATIC, FINAL},
                                genericOf("FilterRegistry", "GameState"),
                                "FILTER_REGISTRY",
                                "new FilterRegistry<GameState>()")
                        .field(new Modifier[] {PRIVATE}, "GameState", "state")
                        .newLine()
                        .emptyConstructor(PRIVATE, "GameLogic")
                        .newLine()
                        .javadoc("Handles the join event.")
                        .beginMethod(
                                mods(PUBLIC, STATIC),
                                PrimitiveType.VOID.toString(),
                                "onJoin",
                                new String[] {"HandlerException"},
                                of("Session<GameState>", "session"),
                                of("String", "senderId"))
                        .beginIf("!session.isHost(senderId)")
                        .throwStmt("PermissionDeniedException.notHost()")
                        .endIf()
                        .comment("Node: announce (EmitToAll)")
                        .stmt("session.emitToAll(\"joined\", senderId)")
                        .endMethod()
                        .endClass()
                        .build();

        CodeGenTestUtils.assertMatchesExpected(code, EXPECTED_DIR + "/handlerClass.java.expected");
    }

    /** Labeled loops, while loops and try blocks nest with consistent indentation. */
    @Test
    public void testLoopsAndTry() {
        String code =
                builder.beginClass(new Modifier[] {PUBLIC}, "Loops", null)
                        .beginMethod(
                                mods(STATIC),
                                "int",
                                "count",
                                NO_EXCEPTIONS,
                                of("List<Integer>", "items"),
                                of(LONG, "limit"))
                        .declare(INT, "total", "0")
                        .label("outer")
                        .beginForEach("Integer", "item", "items")
                        .beginWhile("total < limit")
                        .beginTry()
                        .assign("total", "total + item")
                        .beginCatch("ArithmeticException", "e")
                        .breakStmt()
                        .beginFinally()
                        .comment("always")
                        .endTry()
                        .endWhile()
                        .endFor()
                        .returnStmt("total")
                        .endMethod()
                        .newLine()
                        .beginMethod(mods(PUBLIC), "void", "reset", NO_EXCEPTIONS)
                        .returnStmt(null)
                        .endMethod()
                        .endClass()
                        .build();

        CodeGenTestUtils.assertMatchesExpected(code, EXPECTED_DIR + "/loopsAndTry.java.expected");
    }

    /** A nested filter class with a constructor, an override and if/else-if/else. */
    @Test
    public void testFilterClass() {
        String code =
                builder.beginClass(
                                new Modifier[] {PRIVATE, STATIC, FINAL},
                                "MaskRoundFilter",
                                "Filter<GameState>")
                        .field(new Modifier[] {PRIVATE, FINAL}, "String", "viewerId")
                        .newLine()
                        .beginConstructor(PRIVATE, "MaskRoundFilter", of("String", "viewerId"))
                        .stmt("this.viewerId = viewerId")
                        .endConstructor()
                        .newLine()
                        .override()
                        .beginMethod(
                                mods(PUBLIC),
                                "void",
                                "apply",
                                NO_EXCEPTIONS,
                                of("GameState", "state"))
                        .beginFor("int i = 0", "i < 3", "i++")
                        .beginIf("i == 0")
                        .continueStmt()
                        .beginElseIf("i == 1")
                        .stmt("state.setRound(0)")
                        .beginElse()
                        .stmt("state.setPhase(\"hidden\")")
                        .endIf()
                        .endFor()
                        .endMethod()
                        .endClass()
                        .build();

        CodeGenTestUtils.assertMatchesExpected(code, EXPECTED_DIR + "/filterClass.java.expected");
    }

    // ==================== Raw Code Tests ====================

    @Test
    public void testRawBlockKeepsRelativeIndentation() {
        String code =
                new JavaCodeBuilder(1)
                        .rawBlock("int x = 1;\nif (x > 0) {\n    x++;\n}\n\nreturn x;\n")
                        .rawUnindented("// raw")
                        .build();

        assertThat(code)
                .isEqualTo(
                        "    int x = 1;\n"
                                + "    if (x > 0) {\n"
                                + "        x++;\n"
                                + "    }\n"
                                + "\n"
                                + "    return x;\n"
                                + "// raw\n");
    }

    @Test
    public void testEmptyRawCode() {
        builder.rawBlock(null).rawBlock("").rawUnindented(null).rawUnindented("");

        assertThat(builder.isEmpty()).isTrue();
        assertThat(builder.getIndentLevel()).isZero();
    }

    @Test
    public void testJavadoc() {
        assertThat(new JavaCodeBuilder().javadoc("One line.").build())
                .isEqualTo("/** One line. */\n");
        assertThat(new JavaCodeBuilder(1).javadoc("First.", "", "Second.").build())
                .isEqualTo("    /**\n     * First.\n     *\n     * Second.\n     */\n");
    }

    @Test
    public void testCommentTextStaysInsideTheComment() {
        assertThat(new JavaCodeBuilder().comment("Node: a\nstate.setPhase(1); (Add)").build())
                .isEqualTo("// Node: a state.setPhase(1); (Add)\n");
        assertThat(new JavaCodeBuilder().comment("Node: x\\u000astate.reset(); (Add)").build())
                .isEqualTo("// Node: x\\\\u000astate.reset(); (Add)\n");
        assertThat(new JavaCodeBuilder().javadoc("Ends */ early\r\nclass X {}").build())
                .isEqualTo("/** Ends *&#47; early  class X {} */\n");
    }

    // ==================== Helper Method Tests ====================

    @Test
    public void testModsHelper() {
        assertThat(mods(PUBLIC)).isEqualTo("public");
        assertThat(mods(PRIVATE, STATIC, FINAL)).isEqualTo("private static final");
        assertThat(mods()).isEmpty();
    }

    @Test
    public void testParamsHelper() {
        assertThat(params()).isEmpty();
        assertThat(params(of(INT, "a"))).isEqualTo("int a");
        assertThat(params(of("Session<GameState>", "session"), of(LONG, "deadline")))
                .isEqualTo("Session<GameState> session, long deadline");
    }

    @Test
    public void testGenericOfHelper() {
        assertThat(genericOf("List", "String")).isEqualTo("List<String>");
        assertThat(genericOf("Map", "String", "Integer")).isEqualTo("Map<String, Integer>");
    }

    @Test
    public void testParamClass() {
        Param param = of(INT, "count");
        assertThat(param.getType()).isEqualTo("int");
        assertThat(param.getName()).isEqualTo("count");
        assertThat(param.toString()).isEqualTo("int count");
    }

    // ==================== Edge Case Tests ====================

    @Test
    public void testUnbalancedClose() {
        assertThatThrownBy(() -> builder.endMethod())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("No open block to close.");
    }

    @Test
    public void testDeepIndentation() {
        JavaCodeBuilder deep = new JavaCodeBuilder(17);
        deep.stmt("x++");

        assertThat(deep.build()).hasSize(17 * 4 + "x++;\n".length());
    }

    @Test
    public void testToString() {
        builder.beginClass(new Modifier[] {PUBLIC}, "Test", null).endClass();
        assertThat(builder.toString())
                .isEqualTo(builder.build())
                .isEqualTo("public class Test {\n}\n");
    }
}

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

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A fluent builder for Java source with automatic indentation.
 *
 * <p>The generator writes whole classes through it: the outer logic class, nested filter classes,
 * handler and function methods and the statements of every node. Blocks opened with a {@code
 * begin*} call are closed with the matching {@code end*} call.
 *
 * <pre>{@code
 * String code = new JavaCodeBuilder()
 *     .beginClass(new Modifier[] {PUBLIC, FINAL}, "GameLogic", null)
 *         .beginMethod(mods(PUBLIC, STATIC), "void", "onJoin",
 *                 new String[] {"HandlerException"}, of("Session<GameState>", "session"))
 *             .beginIf("!session.isHost(senderId)")
 *                 .throwStmt("PermissionDeniedException.notHost()")
 *             .endIf()
 *         .endMethod()
 *     .endClass()
 *     .build();
 * }</pre>
 */
@Internal
public class JavaCodeBuilder {

    private static final String INDENT = "    ";

    private final StringBuilder code;
    private int indentLevel;

    public JavaCodeBuilder() {
        this(0);
    }

    /** Creates a builder whose first line starts at the given nesting depth. */
    public JavaCodeBuilder(int indentLevel) {
        this.code = new StringBuilder();
        this.indentLevel = indentLevel;
    }

    // ==================== Type-Safe Enums ====================

    /** Java access and non-access modifiers. */
    public enum Modifier {
        PUBLIC("public"),
        PRIVATE("private"),
        PROTECTED("protected"),
        STATIC("static"),
        FINAL("final"),
        ABSTRACT("abstract");

        private final String keyword;

        Modifier(String keyword) {
            this.keyword = keyword;
        }

        @Override
        public String toString() {
            return keyword;
        }
    }

    /** Java primitive types used by generated declarations. */
    public enum PrimitiveType {
        BOOLEAN("boolean"),
        INT("int"),
        LONG("long"),
        DOUBLE("double"),
        VOID("void");

        private final String keyword;

        PrimitiveType(String keyword) {
            this.keyword = keyword;
        }

        @Override
        public String toString() {
            return keyword;
        }
    }

    // ==================== Parameter Class ====================

    /** A method or constructor parameter. */
    public static final class Param {
        private final String type;
        private final String name;

        private Param(String type, String name) {
            this.type = type;
            this.name = name;
        }

        public static Param of(PrimitiveType type, String name) {
            return new Param(type.toString(), name);
        }

        public static Param of(String type, String name) {
            return new Param(type, name);
        }

        public String getType() {
            return type;
        }

        public String getName() {
            return name;
        }

        @Override
        public String toString() {
            return type + " " + name;
        }
    }

    // ==================== Static Helper Methods ====================

    /** Joins modifiers with spaces. */
    public static String mods(Modifier... modifiers) {
        return Arrays.stream(modifiers).map(Modifier::toString).collect(Collectors.joining(" "));
    }

    /** Joins parameters into a declaration list. */
    public static String params(Param... params) {
        return Arrays.stream(params).map(Param::toString).collect(Collectors.joining(", "));
    }

    /** The generic form of a type, {@code genericOf("List", "String")} is {@code List<String>}. */
    public static String genericOf(String rawType, String... typeArguments) {
        return rawType + "<" + String.join(", ", typeArguments) + ">";
    }

    // ==================== Class Structure ====================

    /**
     * Begins a class declaration.
     *
     * @param modifiers class modifiers
     * @param className the class name
     * @param implementsInterface the interface to implement, may be null
     * @return this builder for chaining
     */
    public JavaCodeBuilder beginClass(
            Modifier[] modifiers, String className, @Nullable String implementsInterface) {
        indent();
        code.append(mods(modifiers)).append(" class ").append(className);
        if (implementsInterface != null && !implementsInterface.isEmpty()) {
            code.append(" implements ").append(implementsInterface);
        }
        code.append(" {\n");
        indentLevel++;
        return this;
    }

    public JavaCodeBuilder endClass() {
        return closeBlock();
    }

    // ==================== Fields ====================

    public JavaCodeBuilder field(Modifier[] modifiers, String type, String name) {
        indent();
        code.append(mods(modifiers)).append(' ').append(type).append(' ').append(name);
        code.append(";\n");
        return this;
    }

    public JavaCodeBuilder fieldWithInit(
            Modifier[] modifiers, String type, String name, String initialValue) {
        indent();
        code.append(mods(modifiers)).append(' ').append(type).append(' ').append(name);
        code.append(" = ").append(initialValue).append(";\n");
        return this;
    }

    // ==================== Constructor ====================

    public JavaCodeBuilder beginConstructor(Modifier modifier, String className, Param... params) {
        indent();
        code.append(modifier).append(' ').append(className);
        code.append('(').append(params(params)).append(") {\n");
        indentLevel++;
        return this;
    }

    /** Writes an empty constructor on one line, used for non-instantiable classes. */
    public JavaCodeBuilder emptyConstructor(Modifier modifier, String className) {
        indent();
        code.append(modifier).append(' ').append(className).append("() {}\n");
        return this;
    }

    public JavaCodeBuilder endConstructor() {
        return closeBlock();
    }

    // ==================== Methods ====================

    /**
     * Begins a method declaration.
     *
     * @param modifiers the space separated modifiers, see {@link #mods(Modifier...)}
     * @param returnType the return type
     * @param methodName the method name
     * @param exceptions the checked exceptions of the throws clause, may be empty
     * @param params the parameters
     * @return this builder for chaining
     */
    public JavaCodeBuilder beginMethod(
            String modifiers,
            String returnType,
            String methodName,
            String[] exceptions,
            Param... params) {
        indent();
        code.append(modifiers).append(' ').append(returnType).append(' ').append(methodName);
        code.append('(').append(params(params)).append(')');
        if (exceptions.length > 0) {
            code.append(" throws ").append(String.join(", ", exceptions));
        }
        code.append(" {\n");
        indentLevel++;
        return this;
    }

    public JavaCodeBuilder override() {
        return annotation("Override");
    }

    public JavaCodeBuilder annotation(String annotation) {
        indent();
        code.append('@').append(annotation).append('\n');
        return this;
    }

    public JavaCodeBuilder endMethod() {
        return closeBlock();
    }

    // ==================== Control Flow ====================

    public JavaCodeBuilder beginIf(String condition) {
        indent();
        code.append("if (").append(condition).append(") {\n");
        indentLevel++;
        return this;
    }

    public JavaCodeBuilder beginElseIf(String condition) {
        indentLevel--;
        indent();
        code.append("} else if (").append(condition).append(") {\n");
        indentLevel++;
        return this;
    }

    public JavaCodeBuilder beginElse() {
        indentLevel--;
        indent();
        code.append("} else {\n");
        indentLevel++;
        return this;
    }

    public JavaCodeBuilder endIf() {
        return closeBlock();
    }

    /**
     * Begins a counting loop.
     *
     * @param init initialization expression
     * @param condition loop condition
     * @param update update expression
     * @return this builder for chaining
     */
    public JavaCodeBuilder beginFor(String init, String condition, String update) {
        indent();
        code.append("for (").append(init).append("; ").append(condition).append("; ");
        code.append(update).append(") {\n");
        indentLevel++;
        return this;
    }

    /** Begins an enhanced for loop over an iterable expression. */
    public JavaCodeBuilder beginForEach(String elementType, String element, String iterable) {
        indent();
        code.append("for (").append(elementType).append(' ').append(element).append(" : ");
        code.append(iterable).append(") {\n");
        indentLevel++;
        return this;
    }

    public JavaCodeBuilder endFor() {
        return closeBlock();
    }

    public JavaCodeBuilder beginWhile(String condition) {
        indent();
        code.append("while (").append(condition).append(") {\n");
        indentLevel++;
        return this;
    }

    public JavaCodeBuilder endWhile() {
        return closeBlock();
    }

    /** Writes a statement label, the next line is the labeled loop. */
    public JavaCodeBuilder label(String label) {
        indent();
        code.append(label).append(":\n");
        return this;
    }

    public JavaCodeBuilder beginTry() {
        indent();
        code.append("try {\n");
        indentLevel++;
        return this;
    }

    public JavaCodeBuilder beginCatch(String exceptionType, String name) {
        indentLevel--;
        indent();
        code.append("} catch (").append(exceptionType).append(' ').append(name).append(") {\n");
        indentLevel++;
        return this;
    }

    public JavaCodeBuilder beginFinally() {
        indentLevel--;
        indent();
        code.append("} finally {\n");
        indentLevel++;
        return this;
    }

    public JavaCodeBuilder endTry() {
        return closeBlock();
    }

    // ==================== Statements ====================

    /** Adds a statement, the semicolon is appended. */
    public JavaCodeBuilder stmt(String statement) {
        indent();
        code.append(statement).append(";\n");
        return this;
    }

    public JavaCodeBuilder returnStmt(@Nullable String expression) {
        indent();
        if (expression == null) {
            code.append("return;\n");
        } else {
            code.append("return ").append(expression).append(";\n");
        }
        return this;
    }

    public JavaCodeBuilder throwStmt(String expression) {
        indent();
        code.append("throw ").append(expression).append(";\n");
        return this;
    }

    public JavaCodeBuilder declare(PrimitiveType type, String name, String value) {
        return declare(type.toString(), name, value);
    }

    public JavaCodeBuilder declare(String type, String name, String value) {
        indent();
        code.append(type).append(' ').append(name).append(" = ").append(value).append(";\n");
        return this;
    }

    public JavaCodeBuilder assign(String variable, String value) {
        indent();
        code.append(variable).append(" = ").append(value).append(";\n");
        return this;
    }

    public JavaCodeBuilder continueStmt() {
        indent();
        code.append("continue;\n");
        return this;
    }

    public JavaCodeBuilder breakStmt() {
        indent();
        code.append("break;\n");
        return this;
    }

    /** Adds a single line comment. */
    public JavaCodeBuilder comment(String text) {
        indent();
        code.append("// ").append(commentText(text)).append('\n');
        return this;
    }

    /** Adds a javadoc block; each element of {@code lines} becomes one line. */
    public JavaCodeBuilder javadoc(String... lines) {
        if (lines.length == 1) {
            indent();
            code.append("/** ").append(javadocText(lines[0])).append(" */\n");
            return this;
        }
        indent();
        code.append("/**\n");
        for (String line : lines) {
            indent();
            code.append(line.isEmpty() ? " *" : " * " + javadocText(line)).append('\n');
        }
        indent();
        code.append(" */\n");
        return this;
    }

    /**
     * Keeps graph supplied text inside its comment: line breaks become spaces and backslashes are
     * doubled so that no unicode escape survives.
     */
    private static String commentText(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                sb.append(' ');
            } else if (c == '\\') {
                sb.append("\\\\");
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String javadocText(String text) {
        return commentText(text).replace("*/", "*&#47;");
    }

    // ==================== Raw Code ====================

    /**
     * Appends a pre-formatted code block, adding the current indentation to each line while
     * keeping the relative indentation within the block. A trailing line break is ignored.
     */
    public JavaCodeBuilder rawBlock(@Nullable String codeBlock) {
        if (codeBlock == null || codeBlock.isEmpty()) {
            return this;
        }
        String block =
                codeBlock.endsWith("\n")
                        ? codeBlock.substring(0, codeBlock.length() - 1)
                        : codeBlock;
        for (String line : block.split("\n", -1)) {
            if (line.isEmpty()) {
                code.append('\n');
            } else {
                indent();
                code.append(line).append('\n');
            }
        }
        return this;
    }

    /** Appends raw text exactly as given. */
    public JavaCodeBuilder rawUnindented(@Nullable String rawCode) {
        if (rawCode != null && !rawCode.isEmpty()) {
            code.append(rawCode);
            if (!rawCode.endsWith("\n")) {
                code.append('\n');
            }
        }
        return this;
    }

    public JavaCodeBuilder newLine() {
        code.append('\n');
        return this;
    }

    // ==================== Build ====================

    public int getIndentLevel() {
        return indentLevel;
    }

    public boolean isEmpty() {
        return code.length() == 0;
    }

    public String build() {
        return code.toString();
    }

    @Override
    public String toString() {
        return build();
    }

    // ==================== Internal ====================

    /** Pre-computed indent strings for common levels. */
    private static final String[] INDENT_CACHE = new String[16];

    static {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < INDENT_CACHE.length; i++) {
            INDENT_CACHE[i] = sb.toString();
            sb.append(INDENT);
        }
    }

    private JavaCodeBuilder closeBlock() {
        if (indentLevel == 0) {
            throw new IllegalStateException("No open block to close.");
        }
        indentLevel--;
        indent();
        code.append("}\n");
        return this;
    }

    private void indent() {
        if (indentLevel < INDENT_CACHE.length) {
            code.append(INDENT_CACHE[indentLevel]);
        } else {
            for (int i = 0; i < indentLevel; i++) {
                code.append(INDENT);
            }
        }
    }
}

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

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.exception.CodeGenException;
import org.statesync.logicgen.codegen.flow.FlowStep;
import org.statesync.logicgen.codegen.graph.GraphFragment;
import org.statesync.logicgen.codegen.graph.InputValue;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.schema.SchemaContext;

import javax.annotation.Nullable;

import java.util.List;
import java.util.Map;

/**
 * What a {@link org.statesync.logicgen.codegen.registry.NodeEmitter} sees while one node is
 * emitted: input resolution, output and local allocation, the output writer, schema aware path
 * access and the enclosing handler, filter or function.
 *
 * <p>All failures are reported as {@link CodeGenException}s whose message names the fragment and
 * the node, see {@link #error(Node, String)}.
 */
@PublicEvolving
public interface EmitContext {

    // ==================== Compilation ====================

    NodeGraph getGraph();

    /** The handler, filter or function being emitted. */
    GraphFragment getFragment();

    /** The schema, {@code null} when the graph is compiled without one. */
    @Nullable
    SchemaContext getSchema();

    /** Java type of the session state. */
    String getStateType();

    /** The writer positioned at the current statement. */
    JavaCodeBuilder code();

    void addImport(String qualifiedName);

    // ==================== Inputs ====================

    /** Whether the input is provided or has a declared default. */
    boolean hasInput(Node node, String port);

    /**
     * Resolves an input to a Java expression, falling back to the declared default of the port.
     * An absent optional input without default resolves to {@code null}.
     *
     * @throws CodeGenException if a reference cannot be resolved or a required input is missing
     */
    JavaExpression resolveInput(Node node, String port);

    /** Resolves a value nested in an input, such as an entry of an {@code args} map. */
    JavaExpression resolveValue(Node node, InputValue value);

    /**
     * The constant value of an input: the provided literal, or the declared default. Returns
     * {@code null} for references, composite values and absent inputs.
     */
    @Nullable
    Object constantInput(Node node, String port);

    /**
     * A string input that must be a constant, such as an operator, a field name or a path.
     *
     * @throws CodeGenException if the input is absent, not a constant or not a string
     */
    String requireConstantString(Node node, String port);

    // ==================== Outputs and Locals ====================

    /**
     * Declares the local {@code <nodeId>_<port>} initialized with the given expression and binds
     * the output to it.
     *
     * @param javaType the declared type, {@code null} for {@code Object}
     * @return the name of the declared local
     */
    String declareOutput(Node node, String port, @Nullable String javaType, String initializer);

    /** Binds an output to an expression without declaring a local. */
    void bindOutput(Node node, String port, JavaExpression expression);

    /** Outputs of the node that are visible at the current statement. */
    Map<String, JavaExpression> outputsOf(Node node);

    /** Allocates a local name unique within the method. */
    String newLocal(String hint);

    /** Assigns a graph variable; all variables are declared at the top of the method. */
    void assignVariable(Node node, String name, JavaExpression value);

    // ==================== State Paths ====================

    /** Reads a state path such as {@code players[pid:id].score}. */
    JavaExpression readPath(Node node, String path);

    void writePath(Node node, String path, JavaExpression value);

    void appendToPath(Node node, String path, JavaExpression element);

    void removeFromPath(Node node, String path, JavaExpression index);

    void putPathEntry(Node node, String path, JavaExpression key, JavaExpression value);

    void removePathEntry(Node node, String path, JavaExpression key);

    // ==================== Flow ====================

    /** The innermost open loop, {@code null} outside of loops. */
    @Nullable
    LoopScope currentLoop();

    /** Emits a structured body, for emitters that open blocks of their own. */
    void emitSteps(List<FlowStep> steps);

    // ==================== Fragment ====================

    String stateVariable();

    /**
     * The session local.
     *
     * @throws CodeGenException inside a filter, which runs without a session
     */
    String requireSession(Node node);

    /** The sender local, {@code null} outside of handlers. */
    @Nullable
    String senderVariable();

    /** The cancellation token local, {@code null} if the method takes none. */
    @Nullable
    String cancellationVariable();

    /** Whether calls to the named function must pass a cancellation token. */
    boolean requiresCancellation(String functionName);

    /**
     * Records that the emitted statements may throw a {@code HandlerException}. Filters wrap
     * their body accordingly.
     */
    void markThrowsChecked();

    /** Builds an exception prefixed with the fragment and node, for the caller to throw. */
    CodeGenException error(Node node, String message);
}

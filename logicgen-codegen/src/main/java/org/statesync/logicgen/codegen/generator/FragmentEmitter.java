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
import org.statesync.logicgen.codegen.exception.CodeGenException;
import org.statesync.logicgen.codegen.exception.ReferenceResolutionException;
import org.statesync.logicgen.codegen.flow.FlowStep;
import org.statesync.logicgen.codegen.flow.ReturnPathAnalyzer;
import org.statesync.logicgen.codegen.flow.StructuredFlow;
import org.statesync.logicgen.codegen.graph.FragmentKind;
import org.statesync.logicgen.codegen.graph.GraphFragment;
import org.statesync.logicgen.codegen.graph.InputValue;
import org.statesync.logicgen.codegen.graph.ListValue;
import org.statesync.logicgen.codegen.graph.LiteralValue;
import org.statesync.logicgen.codegen.graph.MapValue;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.graph.ReferenceValue;
import org.statesync.logicgen.codegen.graph.ViewDefinition;
import org.statesync.logicgen.codegen.instrument.TraceInstrumentation;
import org.statesync.logicgen.codegen.registry.BuiltinNodeKind;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.PortDefinition;
import org.statesync.logicgen.codegen.schema.JavaTypes;
import org.statesync.logicgen.codegen.schema.SchemaContext;

import javax.annotation.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.statesync.logicgen.utils.StringUtils.quote;

/**
 * Emits the body of one generated method and serves as the {@link EmitContext} of its nodes.
 *
 * <p>A body is emitted twice. The first pass writes into a discarded buffer and learns what the
 * second pass has to know up front: the types of the graph variables, which are declared at the
 * top of the method, and whether the body can throw a checked exception. The second pass, created
 * with the first as its {@code firstPass}, writes the real code.
 */
@Internal
public final class FragmentEmitter implements EmitContext {

    private final ClassGenerationContext classContext;
    private final GraphFragment fragment;
    private final MethodFrame frame;
    private final JavaCodeBuilder code;
    private final VariableTable variables = new VariableTable();
    private final Deque<LoopScope> loops = new ArrayDeque<>();
    private final Map<String, JavaExpression> resolvedInputs = new HashMap<>();
    private final Map<String, VariableType> observedVariables = new LinkedHashMap<>();
    private final Map<String, String> variableLocals = new HashMap<>();
    @Nullable private final Map<String, String> knownVariableTypes;
    private final boolean firstPassThrowsChecked;
    private final PathAccessEmitter paths;
    private final ControlFlowEmitter flow;
    private boolean throwsChecked;

    public FragmentEmitter(
            ClassGenerationContext classContext,
            GraphFragment fragment,
            MethodFrame frame,
            int indentLevel,
            @Nullable FragmentEmitter firstPass) {
        this.classContext = classContext;
        this.fragment = fragment;
        this.frame = frame;
        this.code = new JavaCodeBuilder(indentLevel);
        this.knownVariableTypes = firstPass == null ? null : firstPass.getVariableTypes();
        this.firstPassThrowsChecked = firstPass != null && firstPass.throwsChecked;
        for (String reserved : frame.getReservedNames()) {
            variables.reserve(reserved);
        }
        this.paths = new PathAccessEmitter(this);
        this.flow = new ControlFlowEmitter(this);
    }

    /** Whether this is the first, discarded pass. */
    public boolean isFirstPass() {
        return knownVariableTypes == null;
    }

    /**
     * Writes the whole body: variable declarations, the optional event trace around the steps,
     * and the trailing {@code return state;} of filters.
     */
    public void emitBody(StructuredFlow structuredFlow) {
        if (knownVariableTypes != null) {
            for (Map.Entry<String, String> variable : knownVariableTypes.entrySet()) {
                String local = variableLocal(variable.getKey());
                code.declare(variable.getValue(), local, defaultValue(variable.getValue()));
            }
        }
        List<FlowStep> steps = structuredFlow.getSteps();
        boolean wrapChecked = fragment.getKind() == FragmentKind.FILTER && firstPassThrowsChecked;
        if (wrapChecked) {
            code.beginTry();
        }
        if (frame.getTrace() != null) {
            TraceInstrumentation.beginEvent(this);
            flow.emitSteps(steps);
            TraceInstrumentation.endEvent(this);
        } else {
            flow.emitSteps(steps);
        }
        if (fragment.getKind() == FragmentKind.FILTER
                && !ReturnPathAnalyzer.allPathsReturn(steps)) {
            code.returnStmt(Names.STATE);
        }
        if (wrapChecked) {
            code.beginCatch("HandlerException", "e")
                    .throwStmt(
                            "new IllegalStateException("
                                    + quote("Filter " + fragment.getName() + " failed.")
                                    + ", e)")
                    .endTry();
        }
    }

    /** Final types of the graph variables assigned in this pass, in order of first use. */
    public Map<String, String> getVariableTypes() {
        Map<String, String> types = new LinkedHashMap<>();
        for (Map.Entry<String, VariableType> entry : observedVariables.entrySet()) {
            types.put(entry.getKey(), entry.getValue().resolve());
        }
        return types;
    }

    public boolean throwsChecked() {
        return throwsChecked;
    }

    public MethodFrame getFrame() {
        return frame;
    }

    public ClassGenerationContext getClassContext() {
        return classContext;
    }

    public VariableTable getVariables() {
        return variables;
    }

    @Nullable
    public String traceVariable() {
        return frame.getTrace();
    }

    void pushLoop(LoopScope scope) {
        loops.push(scope);
    }

    void popLoop() {
        loops.pop();
    }

    // ==================== EmitContext ====================

    @Override
    public NodeGraph getGraph() {
        return classContext.getGraph();
    }

    @Override
    public GraphFragment getFragment() {
        return fragment;
    }

    @Nullable
    @Override
    public SchemaContext getSchema() {
        return classContext.getSchema();
    }

    @Override
    public String getStateType() {
        return classContext.getStateType();
    }

    @Override
    public JavaCodeBuilder code() {
        return code;
    }

    @Override
    public void addImport(String qualifiedName) {
        classContext.getImports().add(qualifiedName);
    }

    @Override
    public boolean hasInput(Node node, String port) {
        if (isProvided(node.getInput(port))) {
            return true;
        }
        PortDefinition definition = portOf(node, port);
        return definition != null && definition.hasDefaultValue();
    }

    @Override
    public JavaExpression resolveInput(Node node, String port) {
        String key = node.getId() + ":" + port;
        JavaExpression cached = resolvedInputs.get(key);
        if (cached != null) {
            return cached;
        }
        InputValue input = node.getInput(port);
        PortDefinition definition = portOf(node, port);
        JavaExpression resolved;
        if (isProvided(input)) {
            if (definition != null
                    && definition.isRequired()
                    && input.isLiteral()
                    && ((LiteralValue) input).isBlank()) {
                throw error(node, "required input '" + port + "' is empty");
            }
            resolved = resolveValue(node, input);
        } else if (definition != null && definition.hasDefaultValue()) {
            resolved = LiteralFormatter.format(definition.getDefaultValue());
        } else if (definition != null && definition.isRequired()) {
            throw error(node, "required input '" + port + "' is missing");
        } else {
            resolved = JavaExpression.NULL;
        }
        resolvedInputs.put(key, resolved);
        return resolved;
    }

    @Override
    public JavaExpression resolveValue(Node node, InputValue value) {
        switch (value.getKind()) {
            case LITERAL:
                return LiteralFormatter.format(((LiteralValue) value).getValue());
            case REFERENCE:
                return resolveReference(node, (ReferenceValue) value);
            case MAP:
                List<String> entries = new ArrayList<>();
                for (Map.Entry<String, InputValue> entry :
                        ((MapValue) value).getEntries().entrySet()) {
                    entries.add(quote(entry.getKey()));
                    entries.add(resolveValue(node, entry.getValue()).getCode());
                }
                return JavaExpression.of(
                        "Values.mapOf(" + String.join(", ", entries) + ")", "Map<String, Object>");
            case LIST:
                List<String> elements = new ArrayList<>();
                for (InputValue element : ((ListValue) value).getElements()) {
                    elements.add(resolveValue(node, element).getCode());
                }
                return JavaExpression.of(
                        "Values.listOf(" + String.join(", ", elements) + ")", "List<Object>");
            default:
                throw new IllegalStateException("Unknown input kind " + value.getKind());
        }
    }

    @Nullable
    @Override
    public Object constantInput(Node node, String port) {
        InputValue input = node.getInput(port);
        if (isProvided(input)) {
            return input.isLiteral() ? ((LiteralValue) input).getValue() : null;
        }
        PortDefinition definition = portOf(node, port);
        return definition != null && definition.hasDefaultValue()
                ? definition.getDefaultValue()
                : null;
    }

    @Override
    public String requireConstantString(Node node, String port) {
        InputValue input = node.getInput(port);
        if (isProvided(input) && !input.isLiteral()) {
            throw error(node, "input '" + port + "' must be a constant");
        }
        Object value = constantInput(node, port);
        if (!(value instanceof String) || ((String) value).isEmpty()) {
            throw error(node, "input '" + port + "' must be a non-empty constant string");
        }
        return (String) value;
    }

    @Override
    public String declareOutput(
            Node node, String port, @Nullable String javaType, String initializer) {
        String type = javaType == null ? JavaTypes.OBJECT : javaType;
        String name = variables.allocate(Names.outputLocal(node.getId(), port));
        code.declare(type, name, initializer);
        variables.bindOutput(node.getId(), port, JavaExpression.of(name, type));
        return name;
    }

    @Override
    public void bindOutput(Node node, String port, JavaExpression expression) {
        variables.bindOutput(node.getId(), port, expression);
    }

    @Override
    public Map<String, JavaExpression> outputsOf(Node node) {
        return variables.outputsOf(node.getId());
    }

    @Override
    public String newLocal(String hint) {
        return variables.allocate(hint);
    }

    @Override
    public void assignVariable(Node node, String name, JavaExpression value) {
        observedVariables.computeIfAbsent(name, ignored -> new VariableType()).merge(value);
        String targetType = knownVariableTypes == null ? null : knownVariableTypes.get(name);
        code.assign(variableLocal(name), Coercions.coerceTo(targetType, value));
    }

    @Override
    public JavaExpression readPath(Node node, String path) {
        return paths.read(node, path);
    }

    @Override
    public void writePath(Node node, String path, JavaExpression value) {
        paths.write(node, path, value);
    }

    @Override
    public void appendToPath(Node node, String path, JavaExpression element) {
        paths.append(node, path, element);
    }

    @Override
    public void removeFromPath(Node node, String path, JavaExpression index) {
        paths.removeAt(node, path, index);
    }

    @Override
    public void putPathEntry(Node node, String path, JavaExpression key, JavaExpression value) {
        paths.putEntry(node, path, key, value);
    }

    @Override
    public void removePathEntry(Node node, String path, JavaExpression key) {
        paths.removeEntry(node, path, key);
    }

    @Nullable
    @Override
    public LoopScope currentLoop() {
        return loops.peek();
    }

    @Override
    public void emitSteps(List<FlowStep> steps) {
        variables.pushScope();
        try {
            flow.emitSteps(steps);
        } finally {
            variables.popScope();
        }
    }

    @Override
    public String stateVariable() {
        return Names.STATE;
    }

    @Override
    public String requireSession(Node node) {
        if (frame.getSession() == null) {
            throw error(
                    node,
                    "node type '"
                            + node.getType()
                            + "' needs a session, which filters do not have");
        }
        return frame.getSession();
    }

    @Nullable
    @Override
    public String senderVariable() {
        return frame.getSender();
    }

    @Nullable
    @Override
    public String cancellationVariable() {
        return frame.getCancellation();
    }

    @Override
    public boolean requiresCancellation(String functionName) {
        return classContext.isCancellable(functionName);
    }

    @Override
    public void markThrowsChecked() {
        throwsChecked = true;
    }

    @Override
    public CodeGenException error(Node node, String message) {
        return new CodeGenException(prefix(node) + message);
    }

    ReferenceResolutionException referenceError(Node node, String message) {
        return new ReferenceResolutionException(prefix(node) + message);
    }

    String prefix(Node node) {
        return fragment.describe() + ", node '" + node.getId() + "': ";
    }

    // ==================== Resolution ====================

    private JavaExpression resolveReference(Node node, ReferenceValue reference) {
        String name = reference.getName();
        switch (reference.getReferenceKind()) {
            case PARAM:
                JavaExpression parameter = frame.getParameters().get(name);
                if (parameter == null) {
                    throw referenceError(node, "references unknown parameter '" + name + "'");
                }
                return parameter;
            case NODE:
                return resolveNodeOutput(node, name, reference.getPort());
            case VIEW:
                ViewDefinition view = getGraph().findView(name);
                if (view == null) {
                    throw referenceError(node, "references unknown view '" + name + "'");
                }
                return JavaExpression.of(
                        Names.viewMethod(name) + "(" + Names.STATE + ")", viewJavaType(view));
            case STATE:
                return readPath(node, name);
            case VARIABLE:
                return readVariable(node, name);
            case LOOP:
                return resolveLoopSlot(node, name);
            default:
                throw new IllegalStateException(
                        "Unknown reference kind " + reference.getReferenceKind());
        }
    }

    private JavaExpression resolveNodeOutput(Node node, String nodeId, String port) {
        Node source = fragment.findNode(nodeId);
        if (source == null) {
            throw referenceError(node, "references unknown node '" + nodeId + "'");
        }
        JavaExpression output = variables.lookupOutput(nodeId, port);
        if (output != null) {
            return output;
        }
        NodeDefinition definition = classContext.getRegistry().lookup(source.getType());
        if (definition != null && definition.findOutput(port) == null) {
            throw referenceError(
                    node, "references unknown output '" + port + "' of node '" + nodeId + "'");
        }
        if (definition != null && !definition.hasEmitter() && !isBuiltin(source)) {
            throw referenceError(
                    node,
                    "references output '"
                            + port
                            + "' of node '"
                            + nodeId
                            + "' whose type has no emitter");
        }
        if (variables.wasEmitted(nodeId)) {
            throw referenceError(
                    node,
                    "output '"
                            + port
                            + "' of node '"
                            + nodeId
                            + "' is not in scope here; it was declared in a branch or loop body"
                            + " that has already ended");
        }
        throw referenceError(
                node,
                "references node '"
                        + nodeId
                        + "' which has not been emitted before this node; check the flow order");
    }

    private JavaExpression resolveLoopSlot(Node node, String slot) {
        LoopScope loop = loops.peek();
        if (loop == null) {
            throw referenceError(node, "loop:" + slot + " is used outside of a loop");
        }
        JavaExpression value;
        if ("item".equals(slot)) {
            value = loop.getItem();
        } else if ("index".equals(slot)) {
            value = loop.getIndex();
        } else {
            throw referenceError(
                    node, "unknown loop slot '" + slot + "', expected 'item' or 'index'");
        }
        if (value == null) {
            throw referenceError(
                    node,
                    "loop:" + slot + " is not available in loop '" + loop.getNodeId() + "'");
        }
        return value;
    }

    /** Reads a graph variable. */
    JavaExpression readVariable(Node node, String name) {
        if (knownVariableTypes == null) {
            return JavaExpression.untyped(variableLocal(name));
        }
        String type = knownVariableTypes.get(name);
        if (type == null) {
            throw referenceError(
                    node, "variable '" + name + "' is never set by a SetVariable node");
        }
        return JavaExpression.of(variableLocal(name), type);
    }

    /** Whether the graph variable is assigned anywhere in the method. */
    boolean isKnownVariable(String name) {
        return knownVariableTypes == null
                ? observedVariables.containsKey(name)
                : knownVariableTypes.containsKey(name);
    }

    private String variableLocal(String name) {
        String local = variableLocals.get(name);
        if (local == null) {
            local = variables.allocate(Names.local(name));
            variableLocals.put(name, local);
        }
        return local;
    }

    private static boolean isBuiltin(Node node) {
        return BuiltinNodeKind.fromType(node.getType()) != null;
    }

    @Nullable
    private PortDefinition portOf(Node node, String port) {
        NodeDefinition definition = classContext.getRegistry().lookup(node.getType());
        return definition == null ? null : definition.findInput(port);
    }

    private static boolean isProvided(@Nullable InputValue input) {
        return input != null && !(input.isLiteral() && ((LiteralValue) input).isNull());
    }

    static String viewJavaType(ViewDefinition view) {
        switch (view.getOperation()) {
            case COUNT:
                return "int";
            default:
                return "double";
        }
    }

    private static String defaultValue(String javaType) {
        if (JavaTypes.isBoolean(javaType) && JavaTypes.isPrimitive(javaType)) {
            return "false";
        }
        if (JavaTypes.isPrimitive(javaType)) {
            return "0";
        }
        return "null";
    }

    /** The merged type of all values assigned to one graph variable. */
    private static final class VariableType {
        @Nullable private String type;
        private boolean unknown;
        private boolean nullable;

        void merge(JavaExpression value) {
            if (value.isNullLiteral()) {
                nullable = true;
            } else if (!value.isTyped()) {
                unknown = true;
            } else if (type == null) {
                type = value.getType();
            } else if (!type.equals(value.getType())) {
                boolean bothNumbers =
                        value.isPrimitiveNumeric()
                                && JavaTypes.isNumeric(type)
                                && JavaTypes.isPrimitive(type);
                if (bothNumbers) {
                    type = Coercions.wider(type, value.getType());
                } else {
                    unknown = true;
                }
            }
        }

        String resolve() {
            if (unknown || type == null) {
                return JavaTypes.OBJECT;
            }
            return nullable ? JavaTypes.boxed(type) : type;
        }
    }

    @Override
    public String toString() {
        return "FragmentEmitter{" + fragment.describe() + ", firstPass=" + isFirstPass() + "}";
    }
}

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
import org.statesync.logicgen.codegen.flow.ControlFlowAnalyzer;
import org.statesync.logicgen.codegen.flow.ReturnPathAnalyzer;
import org.statesync.logicgen.codegen.flow.StructureIssue;
import org.statesync.logicgen.codegen.flow.StructuredFlow;
import org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Modifier;
import org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Param;
import org.statesync.logicgen.codegen.graph.EventHandler;
import org.statesync.logicgen.codegen.graph.FilterDefinition;
import org.statesync.logicgen.codegen.graph.FunctionDefinition;
import org.statesync.logicgen.codegen.graph.GraphFragment;
import org.statesync.logicgen.codegen.graph.InputValue;
import org.statesync.logicgen.codegen.graph.LiteralValue;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.graph.Parameter;
import org.statesync.logicgen.codegen.graph.Permissions;
import org.statesync.logicgen.codegen.graph.ViewDefinition;
import org.statesync.logicgen.codegen.graph.ViewOperation;
import org.statesync.logicgen.codegen.registry.BuiltinNodeKind;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.schema.JavaTypes;
import org.statesync.logicgen.codegen.schema.SchemaContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Modifier.FINAL;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Modifier.PRIVATE;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Modifier.PUBLIC;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.Modifier.STATIC;
import static org.statesync.logicgen.codegen.generator.JavaCodeBuilder.mods;
import static org.statesync.logicgen.utils.StringUtils.quote;

/**
 * Generates the Java source of one graph: a final class of static methods with, in this order,
 * the permission allow-lists, the filter registry, view methods, filter classes, function methods
 * and handler methods.
 *
 * <p>The generated class is deterministic. It depends only on the graph, the schema, the registry
 * and the options, never on the time or on the order of hash based collections.
 */
@Internal
public class JavaSourceGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(JavaSourceGenerator.class);

    private static final String RUNTIME = "org.statesync.logicgen.runtime.";
    private static final String HANDLER_EXCEPTION = "HandlerException";
    private static final Set<String> FILTER_NODE_TYPES =
            new HashSet<>(Arrays.asList("AddFilter", "RemoveFilter", "HasFilter"));

    private final NodeTypeRegistry registry;
    @Nullable private final SchemaContext schema;
    private final String className;
    private final String fallbackStateType;
    private final boolean traceEnabled;

    public JavaSourceGenerator(
            NodeTypeRegistry registry,
            @Nullable SchemaContext schema,
            String className,
            String fallbackStateType,
            boolean traceEnabled) {
        this.registry = registry;
        this.schema = schema;
        this.className = className;
        this.fallbackStateType = fallbackStateType;
        this.traceEnabled = traceEnabled;
    }

    /**
     * Generates the source file.
     *
     * @throws CodeGenException if a fragment cannot be compiled; the message names the fragment
     *     and, where there is one, the node
     */
    public String generate(NodeGraph graph) {
        String stateType = schema == null ? fallbackStateType : schema.getRootType().getName();
        ClassGenerationContext context =
                new ClassGenerationContext(
                        graph,
                        schema,
                        registry,
                        stateType,
                        traceEnabled,
                        cancellableFunctions(graph));

        // members first, the imports they need are only known afterwards
        JavaCodeBuilder members = new JavaCodeBuilder(1);
        writeAllowLists(context, members);
        if (needsFilterRegistry(graph)) {
            context.getImports().add(RUNTIME + "FilterRegistry");
            members.fieldWithInit(
                            new Modifier[] {PRIVATE, STATIC, FINAL},
                            "FilterRegistry<" + stateType + ">",
                            Names.FILTER_REGISTRY,
                            "new FilterRegistry<" + stateType + ">()")
                    .newLine();
        }
        for (ViewDefinition view : graph.getViews()) {
            writeView(context, view, members);
        }
        for (FilterDefinition filter : graph.getFilters()) {
            writeFilter(context, filter, members);
        }
        for (FunctionDefinition function : graph.getFunctions()) {
            writeFunction(context, function, members);
        }
        for (EventHandler handler : graph.getHandlers()) {
            writeHandler(context, handler, members);
        }

        if (schema != null) {
            String schemaPackage = schema.getSchema().getPackageName();
            if (!schemaPackage.isEmpty() && !schemaPackage.equals(graph.getPackageName())) {
                context.getImports().add(schemaPackage + ".*");
            }
        }

        JavaCodeBuilder code = new JavaCodeBuilder();
        code.comment("Code generated by logicgen. DO NOT EDIT.");
        if (!graph.getVersion().isEmpty()) {
            code.comment("Graph version: " + graph.getVersion());
        }
        code.newLine();
        if (!graph.getPackageName().isEmpty()) {
            code.stmt("package " + graph.getPackageName()).newLine();
        }
        context.getImports().writeTo(code);
        code.newLine()
                .javadoc("Event handlers, filters and functions compiled from a logic graph.")
                .beginClass(new Modifier[] {PUBLIC, FINAL}, className, null)
                .newLine()
                .emptyConstructor(PRIVATE, className)
                .newLine()
                .rawUnindented(stripTrailingBlankLine(members.build()))
                .endClass();
        LOG.debug(
                "Generated {} with {} handlers, {} filters, {} functions and {} views.",
                className,
                graph.getHandlers().size(),
                graph.getFilters().size(),
                graph.getFunctions().size(),
                graph.getViews().size());
        return code.build();
    }

    // ==================== Class Members ====================

    private void writeAllowLists(ClassGenerationContext context, JavaCodeBuilder members) {
        for (EventHandler handler : context.getGraph().getHandlers()) {
            List<String> allowed = handler.getPermissions().getAllowedPlayers();
            if (allowed.isEmpty()) {
                continue;
            }
            List<String> quoted = new ArrayList<>();
            for (String player : allowed) {
                quoted.add(quote(player));
            }
            context.getImports().add("java.util.Arrays");
            members.fieldWithInit(
                    new Modifier[] {PRIVATE, STATIC, FINAL},
                    "List<String>",
                    Names.allowedPlayersConstant(handler.getName()),
                    "Arrays.asList(" + String.join(", ", quoted) + ")");
            members.newLine();
        }
    }

    /** An aggregate over the elements of a state array; empty arrays aggregate to zero. */
    private void writeView(
            ClassGenerationContext context, ViewDefinition view, JavaCodeBuilder members) {
        GraphFragment fragment =
                new FunctionDefinition(
                        Names.viewMethod(view.getName()),
                        null,
                        Collections.<Parameter>emptyList(),
                        null,
                        Collections.<Node>emptyList(),
                        Collections.emptyList());
        Node anchor = new Node(view.getName(), "GetView", Collections.emptyMap());
        FragmentEmitter body = new FragmentEmitter(context, fragment, new MethodFrame(), 2, null);

        JavaExpression array = body.readPath(anchor, view.getPath());
        String elementType = JavaTypes.boxed(Coercions.elementType(array));
        String items = body.newLocal("items");
        body.code().declare("List<" + elementType + ">", items, Coercions.toList(array));
        String returnType = FragmentEmitter.viewJavaType(view);
        switch (view.getOperation()) {
            case COUNT:
                body.code().returnStmt(items + ".size()");
                break;
            case SUM:
            case AVG:
                String total = body.newLocal("total");
                String element = body.newLocal("item");
                body.code()
                        .declare("double", total, "0.0")
                        .beginForEach(elementType, element, items)
                        .stmt(total + " += " + elementValue(body, view, element, elementType))
                        .endFor();
                if (view.getOperation() == ViewOperation.SUM) {
                    body.code().returnStmt(total);
                } else {
                    body.code()
                            .returnStmt(
                                    items
                                            + ".isEmpty() ? 0.0 : "
                                            + total
                                            + " / "
                                            + items
                                            + ".size()");
                }
                break;
            case MIN:
            case MAX:
                boolean min = view.getOperation() == ViewOperation.MIN;
                String best = body.newLocal("result");
                String item = body.newLocal("item");
                body.code()
                        .beginIf(items + ".isEmpty()")
                        .returnStmt("0.0")
                        .endIf()
                        .declare(
                                "double",
                                best,
                                min ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY")
                        .beginForEach(elementType, item, items)
                        .assign(
                                best,
                                (min ? "Math.min(" : "Math.max(")
                                        + best
                                        + ", "
                                        + elementValue(body, view, item, elementType)
                                        + ")")
                        .endFor()
                        .returnStmt(best);
                break;
            default:
                throw new IllegalStateException("Unknown view operation " + view.getOperation());
        }

        members.javadoc(
                        "View '"
                                + view.getName()
                                + "': "
                                + view.getOperation().getName()
                                + " over "
                                + view.getPath()
                                + ".")
                .beginMethod(
                        mods(PUBLIC, STATIC),
                        returnType,
                        Names.viewMethod(view.getName()),
                        new String[0],
                        Param.of(context.getStateType(), Names.STATE))
                .rawUnindented(body.code().build())
                .endMethod()
                .newLine();
    }

    private static String elementValue(
            FragmentEmitter body, ViewDefinition view, String element, String elementType) {
        JavaExpression item = JavaExpression.of(element, elementType);
        JavaExpression value =
                view.getField() == null ? item : RecordAccess.read(body, item, view.getField());
        return Coercions.toDouble(value);
    }

    private void writeFilter(
            ClassGenerationContext context, FilterDefinition filter, JavaCodeBuilder members) {
        String stateType = context.getStateType();
        String filterClass = Names.filterClass(filter.getName());
        MethodFrame frame = new MethodFrame();
        List<Param> params = new ArrayList<>();
        addParameters(filter, frame, params);
        FragmentEmitter body = emitFragment(context, filter, frame, 3);

        context.getImports().add(RUNTIME + "StateFilter");
        if (filter.getDescription() != null) {
            members.javadoc(filter.getDescription());
        }
        members.beginClass(
                new Modifier[] {PUBLIC, STATIC, FINAL},
                filterClass,
                "StateFilter<" + stateType + ">");
        if (!params.isEmpty()) {
            members.newLine();
            for (Param param : params) {
                members.field(new Modifier[] {PRIVATE, FINAL}, param.getType(), param.getName());
            }
        }
        members.newLine().beginConstructor(PUBLIC, filterClass, params.toArray(new Param[0]));
        for (Param param : params) {
            members.assign("this." + param.getName(), param.getName());
        }
        members.endConstructor()
                .newLine()
                .override()
                .beginMethod(
                        mods(PUBLIC),
                        stateType,
                        "apply",
                        new String[0],
                        Param.of(stateType, Names.STATE))
                .rawUnindented(body.code().build())
                .endMethod()
                .endClass()
                .newLine();
    }

    private void writeFunction(
            ClassGenerationContext context, FunctionDefinition function, JavaCodeBuilder members) {
        MethodFrame frame = new MethodFrame();
        List<Param> params = new ArrayList<>();
        if (context.isCancellable(function.getName())) {
            context.getImports().add(RUNTIME + "CancellationToken");
            frame.cancellation(Names.CANCELLATION);
            params.add(Param.of("CancellationToken", Names.CANCELLATION));
        }
        frame.session(Names.SESSION);
        params.add(Param.of("Session<" + context.getStateType() + ">", Names.SESSION));
        params.add(Param.of(context.getStateType(), Names.STATE));
        addParameters(function, frame, params);
        String returnType = "void";
        if (function.hasReturnType()) {
            returnType = ParameterTypes.toJavaType(schema, function.getReturnType());
            frame.returnType(returnType);
        }

        StructuredFlow flow = analyze(function);
        if (function.hasReturnType() && !ReturnPathAnalyzer.allPathsReturn(flow.getSteps())) {
            throw new CodeGenException(
                    function.describe()
                            + " returns "
                            + function.getReturnType()
                            + " but not every path ends in a Return");
        }
        FragmentEmitter body = emitFragment(context, function, frame, flow, 2);

        if (function.getDescription() != null) {
            members.javadoc(function.getDescription());
        }
        members.beginMethod(
                        mods(PUBLIC, STATIC),
                        returnType,
                        Names.functionMethod(function.getName()),
                        body.throwsChecked() ? new String[] {HANDLER_EXCEPTION} : new String[0],
                        params.toArray(new Param[0]))
                .rawUnindented(body.code().build())
                .endMethod()
                .newLine();
    }

    private void writeHandler(
            ClassGenerationContext context, EventHandler handler, JavaCodeBuilder members) {
        String stateType = context.getStateType();
        MethodFrame frame = new MethodFrame();
        List<Param> params = new ArrayList<>();
        if (isCancellable(context, handler)) {
            context.getImports().add(RUNTIME + "CancellationToken");
            frame.cancellation(Names.CANCELLATION);
            params.add(Param.of("CancellationToken", Names.CANCELLATION));
        }
        frame.session(Names.SESSION).sender(Names.SENDER_ID);
        params.add(Param.of("Session<" + stateType + ">", Names.SESSION));
        params.add(Param.of("String", Names.SENDER_ID));
        addParameters(handler, frame, params);
        if (context.isTraceEnabled()) {
            context.getImports().add(RUNTIME + "trace.TraceSink");
            frame.trace(Names.TRACE, handler.getName());
            params.add(Param.of("TraceSink", Names.TRACE));
        }

        FragmentEmitter body = emitFragment(context, handler, frame, 2);

        String doc =
                handler.getDescription() != null
                        ? handler.getDescription()
                        : "Handles the '" + handler.getEvent() + "' event.";
        members.javadoc(doc)
                .beginMethod(
                        mods(PUBLIC, STATIC),
                        "void",
                        Names.handlerMethod(handler.getName()),
                        new String[] {HANDLER_EXCEPTION},
                        params.toArray(new Param[0]));
        writePermissionChecks(context, handler, frame, members);
        members.declare(stateType, Names.STATE, Names.SESSION + ".getState()")
                .rawUnindented(body.code().build())
                .endMethod()
                .newLine();
    }

    /** Host check, then the player parameter, then the allow-list; all before any node runs. */
    private static void writePermissionChecks(
            ClassGenerationContext context,
            EventHandler handler,
            MethodFrame frame,
            JavaCodeBuilder members) {
        Permissions permissions = handler.getPermissions();
        if (permissions.isEmpty()) {
            return;
        }
        context.getImports().add(RUNTIME + "PermissionDeniedException");
        if (permissions.isHostOnly()) {
            members.beginIf("!" + Names.SESSION + ".isHost(" + Names.SENDER_ID + ")")
                    .throwStmt("PermissionDeniedException.notHost()")
                    .endIf();
        }
        String playerParam = permissions.getPlayerParam();
        if (playerParam != null) {
            JavaExpression player = frame.getParameters().get(playerParam);
            if (player == null) {
                throw new CodeGenException(
                        handler.describe()
                                + ": permission playerParam '"
                                + playerParam
                                + "' is not a parameter");
            }
            members.beginIf(
                            "!Values.looseEquals("
                                    + Names.SENDER_ID
                                    + ", "
                                    + player.getCode()
                                    + ")")
                    .throwStmt("PermissionDeniedException.notAllowed()")
                    .endIf();
        }
        if (!permissions.getAllowedPlayers().isEmpty()) {
            members.beginIf(
                            "!"
                                    + Names.allowedPlayersConstant(handler.getName())
                                    + ".contains("
                                    + Names.SENDER_ID
                                    + ")")
                    .throwStmt("PermissionDeniedException.notAllowed()")
                    .endIf();
        }
    }

    // ==================== Fragments ====================

    private void addParameters(GraphFragment fragment, MethodFrame frame, List<Param> params) {
        for (Parameter parameter : fragment.getParameters()) {
            String javaType = ParameterTypes.toJavaType(schema, parameter.getType());
            String javaName = javaName(frame, parameter.getName());
            frame.parameter(parameter.getName(), javaName, javaType);
            params.add(Param.of(javaType, javaName));
        }
    }

    /** Graph parameters named like a generated parameter get a {@code Param} suffix. */
    private static String javaName(MethodFrame frame, String graphName) {
        String javaName = Names.local(graphName);
        while (frame.getReservedNames().contains(javaName)
                || Names.SESSION.equals(javaName)
                || Names.SENDER_ID.equals(javaName)
                || Names.TRACE.equals(javaName)
                || Names.CANCELLATION.equals(javaName)) {
            javaName = javaName + "Param";
        }
        return javaName;
    }

    private static StructuredFlow analyze(GraphFragment fragment) {
        StructuredFlow flow = ControlFlowAnalyzer.analyze(fragment);
        if (!flow.isWellStructured()) {
            List<String> problems = new ArrayList<>();
            for (StructureIssue issue : flow.getIssues()) {
                problems.add(issue.toString());
            }
            throw new CodeGenException(
                    fragment.describe()
                            + " has control flow that cannot be nested: "
                            + String.join("; ", problems));
        }
        return flow;
    }

    private static FragmentEmitter emitFragment(
            ClassGenerationContext context,
            GraphFragment fragment,
            MethodFrame frame,
            int indentLevel) {
        return emitFragment(context, fragment, frame, analyze(fragment), indentLevel);
    }

    /** Emits the body twice, the second pass using what the first learned. */
    private static FragmentEmitter emitFragment(
            ClassGenerationContext context,
            GraphFragment fragment,
            MethodFrame frame,
            StructuredFlow flow,
            int indentLevel) {
        FragmentEmitter firstPass =
                new FragmentEmitter(context, fragment, frame, indentLevel, null);
        firstPass.emitBody(flow);
        FragmentEmitter secondPass =
                new FragmentEmitter(context, fragment, frame, indentLevel, firstPass);
        secondPass.emitBody(flow);
        LOG.debug(
                "Emitted {} with {} nodes and {} variables.",
                fragment.describe(),
                fragment.getNodes().size(),
                secondPass.getVariableTypes().size());
        return secondPass;
    }

    // ==================== Analysis ====================

    private static boolean needsFilterRegistry(NodeGraph graph) {
        if (!graph.getFilters().isEmpty()) {
            return true;
        }
        for (GraphFragment fragment : graph.getFragments()) {
            for (Node node : fragment.getNodes()) {
                if (FILTER_NODE_TYPES.contains(node.getType())) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Functions that wait, directly or through the functions they call. They take a leading
     * cancellation token, as do the handlers calling them.
     */
    static Set<String> cancellableFunctions(NodeGraph graph) {
        Set<String> cancellable = new LinkedHashSet<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (FunctionDefinition function : graph.getFunctions()) {
                if (!cancellable.contains(function.getName())
                        && waitsOrCalls(function, cancellable)) {
                    cancellable.add(function.getName());
                    changed = true;
                }
            }
        }
        return cancellable;
    }

    private static boolean isCancellable(ClassGenerationContext context, EventHandler handler) {
        for (Node node : handler.getNodes()) {
            if (isWait(node)) {
                return true;
            }
            String callee = calledFunction(node);
            if (callee != null && context.isCancellable(callee)) {
                return true;
            }
        }
        return false;
    }

    private static boolean waitsOrCalls(GraphFragment fragment, Set<String> cancellable) {
        for (Node node : fragment.getNodes()) {
            if (isWait(node)) {
                return true;
            }
            String callee = calledFunction(node);
            if (callee != null && cancellable.contains(callee)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWait(Node node) {
        BuiltinNodeKind kind = BuiltinNodeKind.fromType(node.getType());
        return kind != null && kind.getRole() == BuiltinNodeKind.Role.WAIT;
    }

    @Nullable
    private static String calledFunction(Node node) {
        if (!"CallFunction".equals(node.getType())) {
            return null;
        }
        InputValue function = node.getInput("function");
        if (function == null || !function.isLiteral()) {
            return null;
        }
        Object name = ((LiteralValue) function).getValue();
        return name instanceof String ? (String) name : null;
    }

    private static String stripTrailingBlankLine(String code) {
        return code.endsWith("\n\n") ? code.substring(0, code.length() - 1) : code;
    }
}

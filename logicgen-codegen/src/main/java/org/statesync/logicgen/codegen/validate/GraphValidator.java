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

package org.statesync.logicgen.codegen.validate;

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.exception.PathParseException;
import org.statesync.logicgen.codegen.exception.SchemaParseException;
import org.statesync.logicgen.codegen.exception.SchemaResolutionException;
import org.statesync.logicgen.codegen.flow.ControlFlowAnalyzer;
import org.statesync.logicgen.codegen.flow.FlowIndex;
import org.statesync.logicgen.codegen.flow.ReturnPathAnalyzer;
import org.statesync.logicgen.codegen.flow.StructureIssue;
import org.statesync.logicgen.codegen.flow.StructuredFlow;
import org.statesync.logicgen.codegen.graph.EventHandler;
import org.statesync.logicgen.codegen.graph.FilterDefinition;
import org.statesync.logicgen.codegen.graph.FlowEdge;
import org.statesync.logicgen.codegen.graph.FunctionDefinition;
import org.statesync.logicgen.codegen.graph.GraphFragment;
import org.statesync.logicgen.codegen.graph.InputValue;
import org.statesync.logicgen.codegen.graph.ListValue;
import org.statesync.logicgen.codegen.graph.LiteralValue;
import org.statesync.logicgen.codegen.graph.MapValue;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.graph.Parameter;
import org.statesync.logicgen.codegen.graph.Permissions;
import org.statesync.logicgen.codegen.graph.ReferenceValue;
import org.statesync.logicgen.codegen.graph.ViewDefinition;
import org.statesync.logicgen.codegen.path.PathParser;
import org.statesync.logicgen.codegen.registry.BuiltinNodeKind;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.registry.PortDefinition;
import org.statesync.logicgen.codegen.schema.FieldType;
import org.statesync.logicgen.codegen.schema.SchemaContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;
import static org.statesync.logicgen.utils.StringUtils.quote;

/**
 * Checks a {@link NodeGraph} before code generation. Validation never mutates the graph and
 * reports every finding of one run together instead of stopping at the first.
 */
@PublicEvolving
public class GraphValidator {

    private static final Logger LOG = LoggerFactory.getLogger(GraphValidator.class);

    static final String CALL_FUNCTION = "CallFunction";
    static final String ADD_FILTER = "AddFilter";
    static final String SET_VARIABLE = "SetVariable";

    private final NodeTypeRegistry registry;
    @Nullable private final SchemaContext schema;

    public GraphValidator(NodeTypeRegistry registry, @Nullable SchemaContext schema) {
        this.registry = checkNotNull(registry, "registry must not be null");
        this.schema = schema;
    }

    public static ValidationResult validate(
            NodeGraph graph, NodeTypeRegistry registry, @Nullable SchemaContext schema) {
        return new GraphValidator(registry, schema).validate(graph);
    }

    public ValidationResult validate(NodeGraph graph) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (GraphFragment fragment : graph.getFragments()) {
            new FragmentValidation(graph, fragment, issues).run();
        }
        checkViews(graph, issues);
        checkCycles(graph, issues);

        ValidationResult result = new ValidationResult(issues);
        for (ValidationIssue warning : result.getWarnings()) {
            LOG.warn("{}", warning);
        }
        LOG.info(
                "Validated graph with {} handler(s), {} filter(s), {} function(s): {} error(s), {}"
                        + " warning(s).",
                graph.getHandlers().size(),
                graph.getFilters().size(),
                graph.getFunctions().size(),
                result.getErrors().size(),
                result.getWarnings().size());
        return result;
    }

    // ==================== Graph Level Checks ====================

    private void checkViews(NodeGraph graph, List<ValidationIssue> issues) {
        Set<String> names = new HashSet<>();
        for (ViewDefinition view : graph.getViews()) {
            if (!names.add(view.getName())) {
                issues.add(
                        new ValidationIssue(
                                Severity.ERROR,
                                null,
                                null,
                                null,
                                "duplicate view '" + view.getName() + "'"));
            }
            if (view.getOperation().needsField() && view.getField() == null) {
                issues.add(
                        new ValidationIssue(
                                Severity.ERROR,
                                null,
                                null,
                                null,
                                "view '"
                                        + view.getName()
                                        + "' with operation '"
                                        + view.getOperation().getName()
                                        + "' needs a field"));
            }
            String problem = checkPath(view.getPath());
            if (problem != null) {
                issues.add(
                        new ValidationIssue(
                                Severity.ERROR,
                                null,
                                null,
                                null,
                                "view '" + view.getName() + "': " + problem));
            }
        }
    }

    private void checkCycles(NodeGraph graph, List<ValidationIssue> issues) {
        Map<String, List<String>> calls = new LinkedHashMap<>();
        for (FunctionDefinition function : graph.getFunctions()) {
            calls.put(function.getName(), literalTargets(function, CALL_FUNCTION, "function"));
        }
        for (List<String> cycle : findCycles(calls)) {
            issues.add(
                    new ValidationIssue(
                            Severity.ERROR,
                            null,
                            null,
                            null,
                            "circular function calls: " + String.join(" -> ", cycle)));
        }

        Map<String, List<String>> filterRefs = new LinkedHashMap<>();
        for (FilterDefinition filter : graph.getFilters()) {
            filterRefs.put(filter.getName(), literalTargets(filter, ADD_FILTER, "filterName"));
        }
        for (List<String> cycle : findCycles(filterRefs)) {
            issues.add(
                    new ValidationIssue(
                            Severity.ERROR,
                            null,
                            null,
                            null,
                            "circular filter references: " + String.join(" -> ", cycle)));
        }
    }

    private static List<String> literalTargets(
            GraphFragment fragment, String nodeType, String port) {
        List<String> targets = new ArrayList<>();
        for (Node node : fragment.getNodes()) {
            if (nodeType.equals(node.getType())) {
                String target = literalString(node.getInput(port));
                if (target != null && !targets.contains(target)) {
                    targets.add(target);
                }
            }
        }
        return targets;
    }

    /** Each cycle is reported once, starting at the first member in declaration order. */
    private static List<List<String>> findCycles(Map<String, List<String>> edges) {
        List<List<String>> cycles = new ArrayList<>();
        Set<String> done = new HashSet<>();
        for (String start : edges.keySet()) {
            List<String> path = new ArrayList<>();
            findCyclesFrom(start, edges, path, new HashSet<>(), done, cycles);
            done.add(start);
        }
        return cycles;
    }

    private static void findCyclesFrom(
            String current,
            Map<String, List<String>> edges,
            List<String> path,
            Set<String> onPath,
            Set<String> done,
            List<List<String>> cycles) {
        if (done.contains(current) || !edges.containsKey(current)) {
            return;
        }
        if (onPath.contains(current)) {
            if (path.get(0).equals(current)) {
                List<String> cycle = new ArrayList<>(path);
                cycle.add(current);
                cycles.add(cycle);
            }
            return;
        }
        path.add(current);
        onPath.add(current);
        for (String next : edges.get(current)) {
            findCyclesFrom(next, edges, path, onPath, done, cycles);
        }
        onPath.remove(current);
        path.remove(path.size() - 1);
    }

    // ==================== Helpers ====================

    @Nullable
    static String literalString(@Nullable InputValue value) {
        if (value instanceof LiteralValue && ((LiteralValue) value).isString()) {
            return (String) ((LiteralValue) value).getValue();
        }
        return null;
    }

    /** Returns a problem description, or {@code null} if the path parses and resolves. */
    @Nullable
    private String checkPath(String path) {
        try {
            if (schema != null) {
                schema.resolve(PathParser.parse(path));
            } else {
                PathParser.parse(path);
            }
            return null;
        } catch (PathParseException | SchemaResolutionException e) {
            return e.getMessage();
        }
    }

    private static boolean hasControlCharacter(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (Character.isISOControl(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean literalMatches(String portType, LiteralValue literal) {
        switch (portType) {
            case "bool":
                return literal.isBoolean();
            case "number":
            case "float64":
            case "float":
                return literal.isNumber();
            case "int":
            case "int64":
                return literal.isInteger();
            case "string":
                return literal.isString();
            default:
                return true;
        }
    }

    // ==================== Fragment Level Checks ====================

    /** The checks for one handler, filter or function. */
    private final class FragmentValidation {

        private final NodeGraph graph;
        private final GraphFragment fragment;
        private final List<ValidationIssue> issues;
        private final FlowIndex index;
        private final Set<String> referencedNodes = new HashSet<>();
        private final Set<String> variableNames = new HashSet<>();

        private FragmentValidation(
                NodeGraph graph, GraphFragment fragment, List<ValidationIssue> issues) {
            this.graph = graph;
            this.fragment = fragment;
            this.issues = issues;
            this.index = new FlowIndex(fragment);
        }

        private void run() {
            checkParameters();
            collectVariables();
            Set<String> seenIds = new HashSet<>();
            for (Node node : fragment.getNodes()) {
                if (hasControlCharacter(node.getId())) {
                    error(null, "node id " + quote(node.getId()) + " contains a control character");
                    continue;
                }
                if (hasControlCharacter(node.getType())) {
                    error(
                            node.getId(),
                            "node type " + quote(node.getType()) + " contains a control character");
                    continue;
                }
                if (!seenIds.add(node.getId())) {
                    error(node.getId(), "duplicate node id '" + node.getId() + "'");
                    continue;
                }
                checkNode(node);
            }
            checkEdges();
            StructuredFlow flow = ControlFlowAnalyzer.analyze(fragment);
            for (StructureIssue structureIssue : flow.getIssues()) {
                error(structureIssue.getNodeId(), structureIssue.getMessage());
            }
            checkReturns(flow);
            checkDeadCode();
            checkUnusedOutputs();
        }

        private void checkParameters() {
            Set<String> names = new HashSet<>();
            for (Parameter parameter : fragment.getParameters()) {
                if (!names.add(parameter.getName())) {
                    error(null, "duplicate parameter '" + parameter.getName() + "'");
                }
                try {
                    FieldType.parse(parameter.getType());
                } catch (SchemaParseException e) {
                    error(
                            null,
                            "parameter '"
                                    + parameter.getName()
                                    + "' has invalid type: "
                                    + e.getMessage());
                }
            }
            if (fragment instanceof EventHandler) {
                Permissions permissions = ((EventHandler) fragment).getPermissions();
                if (permissions.getPlayerParam() != null
                        && fragment.findParameter(permissions.getPlayerParam()) == null) {
                    error(
                            null,
                            "permission player parameter '"
                                    + permissions.getPlayerParam()
                                    + "' is not a parameter of the handler");
                }
            }
        }

        private void collectVariables() {
            for (Node node : fragment.getNodes()) {
                if (SET_VARIABLE.equals(node.getType())) {
                    String name = literalString(node.getInput("name"));
                    if (name != null) {
                        variableNames.add(name);
                    }
                }
            }
        }

        private void checkNode(Node node) {
            NodeDefinition definition = registry.lookup(node.getType());
            if (definition == null) {
                error(node.getId(), "unknown node type '" + node.getType() + "'");
            } else {
                checkPorts(node, definition);
            }
            for (Map.Entry<String, InputValue> input : node.getInputs().entrySet()) {
                checkReferences(node, input.getValue());
            }
            checkKindSpecific(node);
        }

        private void checkPorts(Node node, NodeDefinition definition) {
            for (PortDefinition port : definition.getInputs()) {
                InputValue value = node.getInput(port.getName());
                if (!node.isInputProvided(port.getName())) {
                    if (port.isRequired() && !port.hasDefaultValue()) {
                        error(node.getId(), "missing required input '" + port.getName() + "'");
                    }
                    continue;
                }
                if (value instanceof LiteralValue
                        && !literalMatches(port.getType(), (LiteralValue) value)) {
                    warning(
                            node.getId(),
                            "constant "
                                    + value
                                    + " does not match type '"
                                    + port.getType()
                                    + "' of input '"
                                    + port.getName()
                                    + "'");
                }
            }
        }

        private void checkReferences(Node node, InputValue value) {
            if (value instanceof MapValue) {
                for (InputValue entry : ((MapValue) value).getEntries().values()) {
                    checkReferences(node, entry);
                }
                return;
            }
            if (value instanceof ListValue) {
                for (InputValue element : ((ListValue) value).getElements()) {
                    checkReferences(node, element);
                }
                return;
            }
            if (!(value instanceof ReferenceValue)) {
                return;
            }
            ReferenceValue reference = (ReferenceValue) value;
            switch (reference.getReferenceKind()) {
                case NODE:
                    checkNodeReference(node, reference);
                    break;
                case PARAM:
                    if (fragment.findParameter(reference.getName()) == null) {
                        error(
                                node.getId(),
                                "references unknown parameter '" + reference.getName() + "'");
                    }
                    break;
                case VIEW:
                    if (graph.findView(reference.getName()) == null) {
                        error(
                                node.getId(),
                                "references unknown view '" + reference.getName() + "'");
                    }
                    break;
                case VARIABLE:
                    if (!variableNames.contains(reference.getName())) {
                        error(
                                node.getId(),
                                "references variable '"
                                        + reference.getName()
                                        + "' that no SetVariable node declares");
                    }
                    break;
                case LOOP:
                    if (!"item".equals(reference.getName())
                            && !"index".equals(reference.getName())) {
                        error(
                                node.getId(),
                                "invalid loop reference '"
                                        + reference
                                        + "', expected loop:item or loop:index");
                    }
                    break;
                case STATE:
                    if (schema != null
                            && schema.getRootType().findField(reference.getName()) == null) {
                        error(
                                node.getId(),
                                "references unknown state field '" + reference.getName() + "'");
                    }
                    break;
                default:
                    throw new IllegalStateException(
                            "Unhandled reference kind " + reference.getReferenceKind());
            }
        }

        private void checkNodeReference(Node node, ReferenceValue reference) {
            Node target = index.getNode(reference.getName());
            if (target == null) {
                error(node.getId(), "references unknown node '" + reference.getName() + "'");
                return;
            }
            referencedNodes.add(target.getId());
            NodeDefinition targetDefinition = registry.lookup(target.getType());
            if (targetDefinition != null
                    && !targetDefinition.getOutputs().isEmpty()
                    && targetDefinition.findOutput(reference.getPort()) == null) {
                error(
                        node.getId(),
                        "references unknown output '"
                                + reference.getPort()
                                + "' of node '"
                                + target.getId()
                                + "' ("
                                + target.getType()
                                + ")");
            }
        }

        private void checkKindSpecific(Node node) {
            String type = node.getType();
            if ("Divide".equals(type) || "Modulo".equals(type)) {
                InputValue divisor = node.getInput("b");
                if (divisor instanceof LiteralValue && ((LiteralValue) divisor).isZero()) {
                    error(node.getId(), type.toLowerCase() + " by constant zero");
                }
            } else if ("ArrayAt".equals(type)) {
                InputValue position = node.getInput("index");
                if (position instanceof LiteralValue
                        && ((LiteralValue) position).isNumber()
                        && ((Number) ((LiteralValue) position).getValue()).doubleValue() < 0) {
                    error(node.getId(), "negative constant index " + position);
                }
            } else if (CALL_FUNCTION.equals(type)) {
                String function = literalString(node.getInput("function"));
                if (function != null && graph.findFunction(function) == null) {
                    error(node.getId(), "calls unknown function '" + function + "'");
                }
            } else if (ADD_FILTER.equals(type)) {
                String filter = literalString(node.getInput("filterName"));
                if (filter != null && graph.findFilter(filter) == null) {
                    error(node.getId(), "installs unknown filter '" + filter + "'");
                }
            } else if (BuiltinNodeKind.fromType(type) == BuiltinNodeKind.RETURN
                    && fragment instanceof FunctionDefinition
                    && ((FunctionDefinition) fragment).hasReturnType()
                    && !node.isInputProvided("value")) {
                error(
                        node.getId(),
                        "Return without a value in a function returning '"
                                + ((FunctionDefinition) fragment).getReturnType()
                                + "'");
            }
            String path = literalString(node.getInput("path"));
            if (path != null && !path.isEmpty()) {
                String problem = checkPath(path);
                if (problem != null) {
                    error(node.getId(), problem);
                }
            }
        }

        private void checkEdges() {
            for (FlowEdge edge : fragment.getFlow()) {
                if (!FlowEdge.isSentinel(edge.getFrom()) && !index.containsNode(edge.getFrom())) {
                    error(null, "flow edge " + edge + " starts at unknown node");
                }
                if (!FlowEdge.isSentinel(edge.getTo()) && !index.containsNode(edge.getTo())) {
                    error(null, "flow edge " + edge + " targets unknown node");
                }
            }
        }

        private void checkReturns(StructuredFlow flow) {
            if (!(fragment instanceof FunctionDefinition)) {
                return;
            }
            FunctionDefinition function = (FunctionDefinition) fragment;
            if (!function.hasReturnType()) {
                return;
            }
            boolean hasReturn = false;
            for (Node node : fragment.getNodes()) {
                if (BuiltinNodeKind.fromType(node.getType()) == BuiltinNodeKind.RETURN) {
                    hasReturn = true;
                    break;
                }
            }
            if (!hasReturn) {
                error(
                        null,
                        "declares return type '"
                                + function.getReturnType()
                                + "' but has no Return node");
            } else if (!ReturnPathAnalyzer.allPathsReturn(flow.getSteps())) {
                error(
                        null,
                        "declares return type '"
                                + function.getReturnType()
                                + "' but not every path ends in a Return");
            }
        }

        private void checkDeadCode() {
            Set<String> reachable =
                    new LinkedHashSet<>(index.breadthFirst(index.entry(), new HashSet<>()));
            Set<String> reported = new HashSet<>();
            for (Node node : fragment.getNodes()) {
                if (!reachable.contains(node.getId()) && reported.add(node.getId())) {
                    warning(node.getId(), "node is unreachable from start");
                }
            }
        }

        private void checkUnusedOutputs() {
            Set<String> reported = new HashSet<>();
            for (Node node : fragment.getNodes()) {
                NodeDefinition definition = registry.lookup(node.getType());
                BuiltinNodeKind builtin = BuiltinNodeKind.fromType(node.getType());
                if (definition == null
                        || definition.getOutputs().isEmpty()
                        || (builtin != null
                                && builtin.getRole() == BuiltinNodeKind.Role.ITERATION)) {
                    continue;
                }
                if (!referencedNodes.contains(node.getId()) && reported.add(node.getId())) {
                    warning(node.getId(), "outputs of node are never used");
                }
            }
        }

        private void error(@Nullable String nodeId, String message) {
            issues.add(
                    new ValidationIssue(
                            Severity.ERROR,
                            fragment.getKind(),
                            fragment.getName(),
                            nodeId,
                            message));
        }

        private void warning(@Nullable String nodeId, String message) {
            issues.add(
                    new ValidationIssue(
                            Severity.WARNING,
                            fragment.getKind(),
                            fragment.getName(),
                            nodeId,
                            message));
        }
    }
}

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

import org.statesync.logicgen.codegen.flow.DecisionStep;
import org.statesync.logicgen.codegen.flow.FlowStep;
import org.statesync.logicgen.codegen.flow.LoopStep;
import org.statesync.logicgen.codegen.graph.FragmentKind;
import org.statesync.logicgen.codegen.graph.FunctionDefinition;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.instrument.TraceInstrumentation;
import org.statesync.logicgen.codegen.instrument.WaitEmitter;
import org.statesync.logicgen.codegen.registry.BuiltinNodeKind;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.schema.JavaTypes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.List;

/**
 * Writes a structured block tree: decisions become {@code if}/{@code else}, iterations become
 * {@code for} or {@code while} loops, jumps and returns become the matching statements, waits are
 * handed to {@link WaitEmitter} and every other node to the emitter registered for its type.
 */
final class ControlFlowEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(ControlFlowEmitter.class);

    private final FragmentEmitter context;

    ControlFlowEmitter(FragmentEmitter context) {
        this.context = context;
    }

    void emitSteps(List<FlowStep> steps) {
        for (FlowStep step : steps) {
            Node node = step.getNode();
            context.code().comment("Node: " + node.getId() + " (" + node.getType() + ")");
            if (step instanceof DecisionStep) {
                emitDecision((DecisionStep) step);
            } else if (step instanceof LoopStep) {
                emitLoop((LoopStep) step);
            } else {
                emitNode(node);
            }
            context.getVariables().markEmitted(node.getId());
        }
    }

    // ==================== Decisions ====================

    private void emitDecision(DecisionStep step) {
        Node node = step.getNode();
        String condition = Coercions.toBoolean(context.resolveInput(node, "condition"));
        traceControlNode(node);
        List<FlowStep> thenSteps = step.getThenSteps();
        List<FlowStep> elseSteps = step.getElseSteps();
        if (thenSteps.isEmpty() && elseSteps.isEmpty()) {
            return;
        }
        if (thenSteps.isEmpty()) {
            context.code().beginIf("!(" + condition + ")");
            context.emitSteps(elseSteps);
            context.code().endIf();
            return;
        }
        context.code().beginIf(condition);
        context.emitSteps(thenSteps);
        if (!elseSteps.isEmpty()) {
            context.code().beginElse();
            context.emitSteps(elseSteps);
        }
        context.code().endIf();
    }

    // ==================== Loops ====================

    private void emitLoop(LoopStep step) {
        switch (step.getKind()) {
            case FOR_EACH:
                emitForEach(step, false);
                break;
            case FOR_EACH_WHERE:
                emitForEach(step, true);
                break;
            case WHILE:
                emitWhile(step);
                break;
            default:
                throw context.error(step.getNode(), "'" + step.getKind() + "' is not a loop");
        }
    }

    private void emitForEach(LoopStep step, boolean filtered) {
        Node node = step.getNode();
        JavaExpression array = context.resolveInput(node, "array");
        String field = null;
        String op = null;
        JavaExpression value = null;
        if (filtered) {
            field = context.requireConstantString(node, "field");
            op = context.requireConstantString(node, "op");
            if (!Comparisons.isSupported(op)) {
                throw context.error(node, "unsupported comparison operator '" + op + "'");
            }
            value = context.resolveInput(node, "value");
        }
        traceControlNode(node);

        String elementType = Coercions.elementType(array);
        String list = context.newLocal(node.getId() + "_list");
        String index = context.newLocal(Names.outputLocal(node.getId(), "index"));
        String item = context.newLocal(Names.outputLocal(node.getId(), "item"));
        String listType = "List<" + JavaTypes.boxed(elementType) + ">";
        context.code()
                .declare(listType, list, Coercions.toList(array))
                .beginFor(
                        "int " + index + " = 0",
                        index + " < " + list + ".size()",
                        index + "++")
                .declare(elementType, item, list + ".get(" + index + ")");

        JavaExpression itemExpression = JavaExpression.of(item, elementType);
        JavaExpression indexExpression = JavaExpression.of(index, "int");
        context.getVariables().pushScope();
        try {
            context.bindOutput(node, "item", itemExpression);
            context.bindOutput(node, "index", indexExpression);
            if (filtered) {
                JavaExpression actual = RecordAccess.read(context, itemExpression, field);
                context.code()
                        .beginIf("!(" + Comparisons.condition(op, actual, value) + ")")
                        .continueStmt()
                        .endIf();
            }
            emitBody(node, step.getBodySteps(), itemExpression, indexExpression);
        } finally {
            context.getVariables().popScope();
        }
        context.code().endFor();
    }

    private void emitWhile(LoopStep step) {
        Node node = step.getNode();
        JavaExpression resolved = context.resolveInput(node, "condition");
        String condition = Coercions.toBoolean(resolved);
        if ("true".equals(condition)) {
            // a constant condition would make the code after the loop unreachable for javac
            String local = context.newLocal(node.getId() + "_condition");
            context.code().declare("boolean", local, "true");
            condition = local;
        }
        traceControlNode(node);
        if (context.hasInput(node, "maxIterations")) {
            String max = Coercions.toLong(context.resolveInput(node, "maxIterations"));
            String iterations = context.newLocal(node.getId() + "_iterations");
            context.code()
                    .declare("long", iterations, "0")
                    .beginWhile("(" + condition + ") && " + iterations + " < " + max)
                    .stmt(iterations + "++");
        } else {
            context.code().beginWhile(condition);
        }
        String cancellation = context.cancellationVariable();
        if (cancellation != null) {
            context.markThrowsChecked();
            context.code().stmt(cancellation + ".throwIfCancelled()");
        }
        context.getVariables().pushScope();
        try {
            emitBody(node, step.getBodySteps(), null, null);
        } finally {
            context.getVariables().popScope();
        }
        context.code().endWhile();
    }

    private void emitBody(
            Node loopNode,
            List<FlowStep> body,
            @Nullable JavaExpression item,
            @Nullable JavaExpression index) {
        context.pushLoop(new LoopScope(loopNode.getId(), item, index));
        try {
            context.emitSteps(body);
        } finally {
            context.popLoop();
        }
    }

    // ==================== Nodes ====================

    private void emitNode(Node node) {
        BuiltinNodeKind kind = BuiltinNodeKind.fromType(node.getType());
        if (kind == null) {
            emitRegistered(node);
            return;
        }
        switch (kind) {
            case BREAK:
            case CONTINUE:
                if (context.currentLoop() == null) {
                    throw context.error(node, kind.getTypeName() + " is used outside of a loop");
                }
                traceControlNode(node);
                if (kind == BuiltinNodeKind.BREAK) {
                    context.code().breakStmt();
                } else {
                    context.code().continueStmt();
                }
                break;
            case RETURN:
                emitReturn(node);
                break;
            case WAIT:
            case WAIT_UNTIL:
            case TIMEOUT:
                WaitEmitter.emit(context, node, kind);
                break;
            default:
                throw context.error(
                        node, kind.getTypeName() + " must open a block; check its flow edges");
        }
    }

    private void emitReturn(Node node) {
        FragmentKind fragmentKind = context.getFragment().getKind();
        String returnType = context.getFrame().getReturnType();
        String statement;
        if (fragmentKind == FragmentKind.FILTER) {
            statement = Names.STATE;
        } else if (fragmentKind == FragmentKind.FUNCTION && returnType != null) {
            if (!context.hasInput(node, "value")) {
                throw context.error(
                        node,
                        "function '"
                                + context.getFragment().getName()
                                + "' returns "
                                + ((FunctionDefinition) context.getFragment()).getReturnType()
                                + " but this Return has no value");
            }
            statement = Coercions.coerceTo(returnType, context.resolveInput(node, "value"));
        } else {
            statement = null;
        }
        traceControlNode(node);
        context.code().returnStmt(statement);
    }

    private void emitRegistered(Node node) {
        NodeDefinition definition = context.getClassContext().getRegistry().lookup(node.getType());
        if (definition == null) {
            throw context.error(node, "unknown node type '" + node.getType() + "'");
        }
        if (!definition.hasEmitter()) {
            context.code()
                    .comment(
                            "not implemented: node "
                                    + node.getId()
                                    + " ("
                                    + node.getType()
                                    + ") has no emitter");
            if (!context.isFirstPass()) {
                LOG.warn(
                        "Node type '{}' has no emitter, {} node '{}' compiles to a placeholder.",
                        node.getType(),
                        context.getFragment().describe(),
                        node.getId());
            }
            return;
        }
        String traceStart = TraceInstrumentation.beforeNode(context, node);
        definition.getEmitter().emit(context, node);
        TraceInstrumentation.afterNode(context, node, traceStart);
    }

    /** Node start and end around the header of a block node or before a jump. */
    private void traceControlNode(Node node) {
        String traceStart = TraceInstrumentation.beforeNode(context, node);
        TraceInstrumentation.afterNode(context, node, traceStart);
    }
}

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

package org.statesync.logicgen.codegen.instrument;

import org.statesync.logicgen.annotation.Internal;
import org.statesync.logicgen.codegen.generator.FragmentEmitter;
import org.statesync.logicgen.codegen.generator.JavaCodeBuilder;
import org.statesync.logicgen.codegen.generator.JavaExpression;
import org.statesync.logicgen.codegen.generator.MethodFrame;
import org.statesync.logicgen.codegen.generator.MethodFrame.TraceNames;
import org.statesync.logicgen.codegen.graph.InputValue;
import org.statesync.logicgen.codegen.graph.LiteralValue;
import org.statesync.logicgen.codegen.graph.Node;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.statesync.logicgen.utils.StringUtils.quote;

/**
 * Weaves {@code TraceSink} calls into handler bodies compiled with tracing enabled.
 *
 * <p>The whole body runs inside a {@code try} whose {@code catch} reports the failing node and
 * rethrows, and whose {@code finally} reports the end of the event with its duration. Every node
 * is wrapped in {@code onNodeStart} and {@code onNodeEnd}; waits additionally report {@code
 * onNodeWait} and {@code onNodeResume}. All methods are no-ops for methods without a trace sink.
 */
@Internal
public final class TraceInstrumentation {

    private TraceInstrumentation() {}

    /** Declares the trace locals, reports the event start and opens the {@code try}. */
    public static void beginEvent(FragmentEmitter context) {
        String trace = context.traceVariable();
        if (trace == null) {
            return;
        }
        MethodFrame frame = context.getFrame();
        List<String> params = new ArrayList<>();
        for (Map.Entry<String, JavaExpression> parameter : frame.getParameters().entrySet()) {
            params.add(quote(parameter.getKey()));
            params.add(parameter.getValue().getCode());
        }
        context.code()
                .declare("long", TraceNames.START, "System.nanoTime()")
                .declare("String", TraceNames.NODE_ID, "null")
                .declare("String", TraceNames.NODE_TYPE, "null")
                .declare("Throwable", TraceNames.ERROR, "null")
                .stmt(
                        trace
                                + ".onEventStart("
                                + sessionId(frame)
                                + ", "
                                + quote(frame.getHandlerName())
                                + ", "
                                + mapOf(params)
                                + ")")
                .beginTry();
    }

    /** Closes the {@code try} opened by {@link #beginEvent(FragmentEmitter)}. */
    public static void endEvent(FragmentEmitter context) {
        String trace = context.traceVariable();
        if (trace == null) {
            return;
        }
        MethodFrame frame = context.getFrame();
        String prefix = sessionId(frame) + ", " + quote(frame.getHandlerName()) + ", ";
        context.code()
                .beginCatch("Exception", TraceNames.EXCEPTION)
                .assign(TraceNames.ERROR, TraceNames.EXCEPTION)
                .beginIf(TraceNames.NODE_ID + " != null")
                .stmt(
                        trace
                                + ".onNodeError("
                                + prefix
                                + TraceNames.NODE_ID
                                + ", "
                                + TraceNames.NODE_TYPE
                                + ", "
                                + TraceNames.EXCEPTION
                                + ")")
                .endIf()
                .throwStmt(TraceNames.EXCEPTION)
                .beginFinally()
                .stmt(
                        trace
                                + ".onEventEnd("
                                + prefix
                                + elapsedMillis(TraceNames.START)
                                + ", "
                                + TraceNames.ERROR
                                + ")")
                .endTry();
    }

    /**
     * Reports the start of a node with its resolved inputs.
     *
     * @return the local holding the start time, {@code null} without tracing
     */
    @Nullable
    public static String beforeNode(FragmentEmitter context, Node node) {
        String trace = context.traceVariable();
        if (trace == null) {
            return null;
        }
        List<String> inputs = new ArrayList<>();
        for (Map.Entry<String, InputValue> input : node.getInputs().entrySet()) {
            InputValue value = input.getValue();
            if (value.isLiteral() && ((LiteralValue) value).isNull()) {
                continue;
            }
            inputs.add(quote(input.getKey()));
            inputs.add(context.resolveInput(node, input.getKey()).getCode());
        }
        String start = context.newLocal(node.getId() + "_traceStart");
        JavaCodeBuilder code = context.code();
        code.assign(TraceNames.NODE_ID, quote(node.getId()))
                .assign(TraceNames.NODE_TYPE, quote(node.getType()))
                .declare("long", start, "System.nanoTime()")
                .stmt(
                        trace
                                + ".onNodeStart("
                                + nodeArguments(context, node)
                                + ", "
                                + mapOf(inputs)
                                + ")");
        return start;
    }

    /** Reports the end of a node with the outputs visible at this point. */
    public static void afterNode(FragmentEmitter context, Node node, @Nullable String start) {
        String trace = context.traceVariable();
        if (trace == null || start == null) {
            return;
        }
        List<String> outputs = new ArrayList<>();
        for (Map.Entry<String, JavaExpression> output : context.outputsOf(node).entrySet()) {
            outputs.add(quote(output.getKey()));
            outputs.add(output.getValue().getCode());
        }
        context.code()
                .stmt(
                        trace
                                + ".onNodeEnd("
                                + nodeArguments(context, node)
                                + ", "
                                + mapOf(outputs)
                                + ", "
                                + elapsedMillis(start)
                                + ")");
    }

    /** Reports that the node suspends the handler for {@code waitMillis}. */
    public static void beforeWait(FragmentEmitter context, Node node, String waitMillis) {
        String trace = context.traceVariable();
        if (trace == null) {
            return;
        }
        context.code()
                .stmt(
                        trace
                                + ".onNodeWait("
                                + nodeArguments(context, node)
                                + ", "
                                + waitMillis
                                + ")");
    }

    public static void afterWait(FragmentEmitter context, Node node) {
        String trace = context.traceVariable();
        if (trace == null) {
            return;
        }
        context.code().stmt(trace + ".onNodeResume(" + nodeArguments(context, node) + ")");
    }

    // ------------------------------------------------------------------------------------------

    private static String sessionId(MethodFrame frame) {
        return frame.getSession() + ".getSessionId()";
    }

    /** Session id, handler, node id and node type. */
    private static String nodeArguments(FragmentEmitter context, Node node) {
        MethodFrame frame = context.getFrame();
        return sessionId(frame)
                + ", "
                + quote(frame.getHandlerName())
                + ", "
                + quote(node.getId())
                + ", "
                + quote(node.getType());
    }

    private static String elapsedMillis(String startLocal) {
        return "(System.nanoTime() - " + startLocal + ") / 1000000.0";
    }

    private static String mapOf(List<String> keysAndValues) {
        return "Values.mapOf(" + String.join(", ", keysAndValues) + ")";
    }
}

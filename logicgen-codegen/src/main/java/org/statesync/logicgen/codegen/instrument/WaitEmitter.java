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
import org.statesync.logicgen.codegen.generator.Coercions;
import org.statesync.logicgen.codegen.generator.FragmentEmitter;
import org.statesync.logicgen.codegen.generator.JavaExpression;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.BuiltinNodeKind;

/**
 * Emits the timing kinds. {@code Wait} and {@code WaitUntil} suspend through {@code
 * CancellationToken.await}, which throws {@code HandlerCancelledException} once the token is
 * cancelled; {@code Timeout} only records a deadline that later nodes compare against.
 */
@Internal
public final class WaitEmitter {

    private WaitEmitter() {}

    public static void emit(FragmentEmitter context, Node node, BuiltinNodeKind kind) {
        String cancellation = context.cancellationVariable();
        if (cancellation == null) {
            throw context.error(
                    node, kind.getTypeName() + " can only be used in handlers and functions");
        }
        String traceStart = TraceInstrumentation.beforeNode(context, node);
        switch (kind) {
            case WAIT:
                emitWait(context, node, cancellation);
                break;
            case WAIT_UNTIL:
                emitWaitUntil(context, node, cancellation);
                break;
            case TIMEOUT:
                emitTimeout(context, node);
                break;
            default:
                throw context.error(node, "'" + kind.getTypeName() + "' is not a timing kind");
        }
        TraceInstrumentation.afterNode(context, node, traceStart);
    }

    private static void emitWait(FragmentEmitter context, Node node, String cancellation) {
        String waitMs = context.newLocal(node.getId() + "_waitMs");
        context.code().declare("long", waitMs, durationMillis(context, node));
        TraceInstrumentation.beforeWait(context, node, waitMs);
        context.markThrowsChecked();
        context.code().stmt(cancellation + ".await(" + waitMs + ")");
        TraceInstrumentation.afterWait(context, node);
    }

    private static void emitWaitUntil(FragmentEmitter context, Node node, String cancellation) {
        boolean hasCondition = node.isInputProvided("condition");
        if (!hasCondition && !node.isInputProvided("path")) {
            throw context.error(node, "WaitUntil needs a condition or a path");
        }
        String interval = Coercions.toLong(context.resolveInput(node, "checkInterval"));
        String timeout = Coercions.toLong(context.resolveInput(node, "timeout"));
        String deadline = context.newLocal(node.getId() + "_deadline");
        context.code().declare("long", deadline, "System.currentTimeMillis() + " + timeout);
        String timedOut = context.declareOutput(node, "timedOut", "boolean", "false");

        context.code().beginWhile("true");
        // re-read on every poll
        JavaExpression condition =
                hasCondition
                        ? context.resolveValue(node, node.getInput("condition"))
                        : context.readPath(node, context.requireConstantString(node, "path"));
        context.code()
                .beginIf(Coercions.toBoolean(condition))
                .breakStmt()
                .endIf()
                .beginIf(timeout + " > 0 && System.currentTimeMillis() >= " + deadline)
                .assign(timedOut, "true")
                .breakStmt()
                .endIf();
        TraceInstrumentation.beforeWait(context, node, interval);
        context.markThrowsChecked();
        context.code().stmt(cancellation + ".await(" + interval + ")");
        TraceInstrumentation.afterWait(context, node);
        context.code().endWhile();
    }

    private static void emitTimeout(FragmentEmitter context, Node node) {
        String deadline =
                context.declareOutput(
                        node,
                        "deadline",
                        "long",
                        "System.currentTimeMillis() + " + durationMillis(context, node));
        context.bindOutput(
                node,
                "timedOut",
                JavaExpression.of("(System.currentTimeMillis() >= " + deadline + ")", "boolean"));
    }

    /** The {@code duration} input converted to milliseconds according to {@code unit}. */
    private static String durationMillis(FragmentEmitter context, Node node) {
        JavaExpression duration = context.resolveInput(node, "duration");
        String unit = context.requireConstantString(node, "unit");
        switch (unit) {
            case "ms":
                return Coercions.toLong(duration);
            case "s":
                return "(long) (" + Coercions.toDouble(duration) + " * 1000)";
            case "m":
                return "(long) (" + Coercions.toDouble(duration) + " * 60000)";
            default:
                throw context.error(node, "unknown time unit '" + unit + "', expected ms, s or m");
        }
    }
}

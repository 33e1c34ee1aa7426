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

package org.statesync.logicgen.codegen.registry;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

import static org.statesync.logicgen.codegen.registry.PortDefinition.optional;
import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/**
 * The closed set of kinds that shape control flow or suspend a handler. They are emitted by the
 * control flow reconstructor, never through a {@link NodeEmitter}.
 */
@PublicEvolving
public enum BuiltinNodeKind {
    IF("If", Role.DECISION),
    FOR_EACH("ForEach", Role.ITERATION),
    FOR_EACH_WHERE("ForEachWhere", Role.ITERATION),
    WHILE("While", Role.ITERATION),
    BREAK("Break", Role.JUMP),
    CONTINUE("Continue", Role.JUMP),
    RETURN("Return", Role.TERMINAL),
    WAIT("Wait", Role.WAIT),
    WAIT_UNTIL("WaitUntil", Role.WAIT),
    TIMEOUT("Timeout", Role.WAIT);

    /** How a built-in kind affects control flow. */
    public enum Role {
        /** Two labeled branches that join again. */
        DECISION,
        /** A body region that runs repeatedly, then an exit. */
        ITERATION,
        /** Leaves the current loop iteration or the loop. */
        JUMP,
        /** Leaves the fragment. */
        TERMINAL,
        /** Suspends the handler and needs a cancellation token. */
        WAIT
    }

    private final String typeName;
    private final Role role;

    BuiltinNodeKind(String typeName, Role role) {
        this.typeName = typeName;
        this.role = role;
    }

    public String getTypeName() {
        return typeName;
    }

    public Role getRole() {
        return role;
    }

    @Nullable
    public static BuiltinNodeKind fromType(String type) {
        for (BuiltinNodeKind kind : values()) {
            if (kind.typeName.equals(type)) {
                return kind;
            }
        }
        return null;
    }

    /** The port contract registered for this kind in the built-in tier. */
    public NodeDefinition createDefinition() {
        NodeDefinition.Builder builder =
                NodeDefinition.newBuilder(typeName).category(role == Role.WAIT ? "timing" : "flow");
        switch (this) {
            case IF:
                return builder.description("Branches on a boolean condition.")
                        .input(required("condition", "bool"))
                        .build();
            case FOR_EACH:
                return builder.description("Runs the body once per array element.")
                        .input(required("array", "[]any"))
                        .output("item", "any")
                        .output("index", "int")
                        .build();
            case FOR_EACH_WHERE:
                return builder.description("Runs the body for the elements matching a condition.")
                        .input(required("array", "[]any"))
                        .input(required("field", "string"))
                        .input(required("op", "string"))
                        .input(required("value", "any"))
                        .output("item", "any")
                        .output("index", "int")
                        .build();
            case WHILE:
                return builder.description("Runs the body while a condition holds.")
                        .input(required("condition", "bool"))
                        .input(optional("maxIterations", "int"))
                        .build();
            case BREAK:
                return builder.description("Leaves the innermost loop.").build();
            case CONTINUE:
                return builder.description("Skips to the next loop iteration.").build();
            case RETURN:
                return builder.description("Leaves the handler or returns a function value.")
                        .input(optional("value", "any"))
                        .build();
            case WAIT:
                return builder.description("Suspends the handler for a duration.")
                        .input(required("duration", "number"))
                        .input(optional("unit", "string", "ms"))
                        .build();
            case WAIT_UNTIL:
                return builder.description("Polls a condition or state path until it holds.")
                        .input(optional("condition", "bool"))
                        .input(optional("path", "string"))
                        .input(optional("checkInterval", "int", 100L))
                        .input(optional("timeout", "int", 30000L))
                        .output("timedOut", "bool")
                        .build();
            case TIMEOUT:
                return builder.description("Starts a deadline that later nodes can check.")
                        .input(required("duration", "number"))
                        .input(optional("unit", "string", "ms"))
                        .output("timedOut", "bool")
                        .output("deadline", "int64")
                        .build();
            default:
                throw new IllegalStateException("Unhandled built-in kind " + this);
        }
    }
}

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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * The signature side of a generated method: the locals it receives and the names it reserves.
 * Handlers have a session and a sender, functions a session, filters neither.
 */
@Internal
public final class MethodFrame {

    private final Map<String, JavaExpression> parameters = new LinkedHashMap<>();
    private final Set<String> reservedNames = new LinkedHashSet<>();
    @Nullable private String session;
    @Nullable private String sender;
    @Nullable private String cancellation;
    @Nullable private String trace;
    @Nullable private String returnType;
    private String handlerName = "";

    public MethodFrame() {
        reservedNames.add(Names.STATE);
        reservedNames.add(Names.FILTER_REGISTRY);
    }

    /** Binds a graph parameter to the Java parameter or field that holds it. */
    public MethodFrame parameter(String graphName, String javaName, String javaType) {
        parameters.put(graphName, JavaExpression.of(javaName, javaType));
        reservedNames.add(javaName);
        return this;
    }

    public MethodFrame session(String name) {
        this.session = name;
        reservedNames.add(name);
        return this;
    }

    public MethodFrame sender(String name) {
        this.sender = name;
        reservedNames.add(name);
        return this;
    }

    public MethodFrame cancellation(String name) {
        this.cancellation = name;
        reservedNames.add(name);
        return this;
    }

    /** Enables node tracing; {@code handlerName} is reported with every trace message. */
    public MethodFrame trace(String name, String handlerName) {
        this.trace = name;
        this.handlerName = handlerName;
        reservedNames.add(name);
        reservedNames.add(TraceNames.START);
        reservedNames.add(TraceNames.NODE_ID);
        reservedNames.add(TraceNames.NODE_TYPE);
        reservedNames.add(TraceNames.ERROR);
        reservedNames.add(TraceNames.EXCEPTION);
        return this;
    }

    public MethodFrame returnType(@Nullable String javaType) {
        this.returnType = javaType;
        return this;
    }

    public Map<String, JavaExpression> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public Set<String> getReservedNames() {
        return Collections.unmodifiableSet(reservedNames);
    }

    @Nullable
    public String getSession() {
        return session;
    }

    @Nullable
    public String getSender() {
        return sender;
    }

    @Nullable
    public String getCancellation() {
        return cancellation;
    }

    @Nullable
    public String getTrace() {
        return trace;
    }

    public String getHandlerName() {
        return handlerName;
    }

    @Nullable
    public String getReturnType() {
        return returnType;
    }

    /** Names of the locals the event trace wraps a handler body with. */
    public static final class TraceNames {
        public static final String START = "traceStart";
        public static final String NODE_ID = "traceNodeId";
        public static final String NODE_TYPE = "traceNodeType";
        public static final String ERROR = "traceError";
        public static final String EXCEPTION = "e";

        private TraceNames() {}
    }
}

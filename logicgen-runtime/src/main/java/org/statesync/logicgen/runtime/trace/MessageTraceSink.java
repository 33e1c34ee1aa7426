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

package org.statesync.logicgen.runtime.trace;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.time.Clock;
import java.util.Map;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * Base class of sinks that turn each callback into a {@link TraceMessage} and hand it to {@link
 * #publish(TraceMessage)}.
 */
@PublicEvolving
public abstract class MessageTraceSink implements TraceSink {

    private final Clock clock;

    protected MessageTraceSink() {
        this(Clock.systemUTC());
    }

    protected MessageTraceSink(Clock clock) {
        this.clock = checkNotNull(clock, "clock must not be null");
    }

    /** Delivers one message. Must not throw. */
    protected abstract void publish(TraceMessage message);

    @Override
    public void onEventStart(String sessionId, String handler, Map<String, Object> params) {
        publish(message(TraceMessageType.EVENT_START, sessionId, handler).params(params).build());
    }

    @Override
    public void onEventEnd(
            String sessionId, String handler, double durationMs, @Nullable Throwable error) {
        publish(
                message(TraceMessageType.EVENT_END, sessionId, handler)
                        .durationMs(durationMs)
                        .error(describe(error))
                        .build());
    }

    @Override
    public void onNodeStart(
            String sessionId,
            String handler,
            String nodeId,
            String nodeType,
            Map<String, Object> inputs) {
        publish(
                message(TraceMessageType.NODE_START, sessionId, handler)
                        .node(nodeId, nodeType)
                        .inputs(inputs)
                        .build());
    }

    @Override
    public void onNodeEnd(
            String sessionId,
            String handler,
            String nodeId,
            String nodeType,
            Map<String, Object> outputs,
            double durationMs) {
        publish(
                message(TraceMessageType.NODE_END, sessionId, handler)
                        .node(nodeId, nodeType)
                        .outputs(outputs)
                        .durationMs(durationMs)
                        .build());
    }

    @Override
    public void onNodeError(
            String sessionId, String handler, String nodeId, String nodeType, Throwable error) {
        publish(
                message(TraceMessageType.NODE_ERROR, sessionId, handler)
                        .node(nodeId, nodeType)
                        .error(describe(error))
                        .build());
    }

    @Override
    public void onNodeWait(
            String sessionId, String handler, String nodeId, String nodeType, long waitMs) {
        long now = clock.millis();
        publish(
                TraceMessage.builder(TraceMessageType.NODE_WAIT, sessionId, handler)
                        .node(nodeId, nodeType)
                        .waitMs(waitMs)
                        .resumeAt(now + waitMs)
                        .timestamp(now)
                        .build());
    }

    @Override
    public void onNodeResume(String sessionId, String handler, String nodeId, String nodeType) {
        publish(
                message(TraceMessageType.NODE_RESUME, sessionId, handler)
                        .node(nodeId, nodeType)
                        .build());
    }

    private TraceMessage.Builder message(TraceMessageType type, String sessionId, String handler) {
        return TraceMessage.builder(type, sessionId, handler).timestamp(clock.millis());
    }

    @Nullable
    private static String describe(@Nullable Throwable error) {
        if (error == null) {
            return null;
        }
        return error.getMessage() == null ? error.getClass().getName() : error.getMessage();
    }
}

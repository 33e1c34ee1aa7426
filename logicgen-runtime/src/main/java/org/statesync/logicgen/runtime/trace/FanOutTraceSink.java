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

import javax.annotation.concurrent.ThreadSafe;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * Broadcasts every callback to a changing set of sinks. Sinks can be attached and detached while
 * handlers are running; each callback sees a consistent snapshot of the set.
 */
@PublicEvolving
@ThreadSafe
public class FanOutTraceSink implements TraceSink {

    private final List<TraceSink> sinks;

    public FanOutTraceSink(TraceSink... sinks) {
        this.sinks = new CopyOnWriteArrayList<>(Arrays.asList(sinks));
    }

    public void addSink(TraceSink sink) {
        sinks.add(checkNotNull(sink, "sink must not be null"));
    }

    public boolean removeSink(TraceSink sink) {
        return sinks.remove(sink);
    }

    public int size() {
        return sinks.size();
    }

    @Override
    public void onEventStart(String sessionId, String handler, Map<String, Object> params) {
        for (TraceSink sink : sinks) {
            sink.onEventStart(sessionId, handler, params);
        }
    }

    @Override
    public void onEventEnd(String sessionId, String handler, double durationMs, Throwable error) {
        for (TraceSink sink : sinks) {
            sink.onEventEnd(sessionId, handler, durationMs, error);
        }
    }

    @Override
    public void onNodeStart(
            String sessionId,
            String handler,
            String nodeId,
            String nodeType,
            Map<String, Object> inputs) {
        for (TraceSink sink : sinks) {
            sink.onNodeStart(sessionId, handler, nodeId, nodeType, inputs);
        }
    }

    @Override
    public void onNodeEnd(
            String sessionId,
            String handler,
            String nodeId,
            String nodeType,
            Map<String, Object> outputs,
            double durationMs) {
        for (TraceSink sink : sinks) {
            sink.onNodeEnd(sessionId, handler, nodeId, nodeType, outputs, durationMs);
        }
    }

    @Override
    public void onNodeError(
            String sessionId, String handler, String nodeId, String nodeType, Throwable error) {
        for (TraceSink sink : sinks) {
            sink.onNodeError(sessionId, handler, nodeId, nodeType, error);
        }
    }

    @Override
    public void onNodeWait(
            String sessionId, String handler, String nodeId, String nodeType, long waitMs) {
        for (TraceSink sink : sinks) {
            sink.onNodeWait(sessionId, handler, nodeId, nodeType, waitMs);
        }
    }

    @Override
    public void onNodeResume(String sessionId, String handler, String nodeId, String nodeType) {
        for (TraceSink sink : sinks) {
            sink.onNodeResume(sessionId, handler, nodeId, nodeType);
        }
    }
}

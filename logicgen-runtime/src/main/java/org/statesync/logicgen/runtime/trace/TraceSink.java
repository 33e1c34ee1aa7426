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

import java.util.Map;

/**
 * Receives execution callbacks from handlers compiled with tracing enabled. Implementations must
 * be thread-safe and must not throw: a failing sink may not change the outcome of a handler.
 */
@PublicEvolving
public interface TraceSink {

    void onEventStart(String sessionId, String handler, Map<String, Object> params);

    void onEventEnd(
            String sessionId, String handler, double durationMs, @Nullable Throwable error);

    void onNodeStart(
            String sessionId,
            String handler,
            String nodeId,
            String nodeType,
            Map<String, Object> inputs);

    void onNodeEnd(
            String sessionId,
            String handler,
            String nodeId,
            String nodeType,
            Map<String, Object> outputs,
            double durationMs);

    void onNodeError(
            String sessionId, String handler, String nodeId, String nodeType, Throwable error);

    void onNodeWait(
            String sessionId, String handler, String nodeId, String nodeType, long waitMs);

    void onNodeResume(String sessionId, String handler, String nodeId, String nodeType);
}

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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/** One message of the trace protocol. Instances are immutable; build them with {@link #builder}. */
@PublicEvolving
public final class TraceMessage {

    private final TraceMessageType type;
    private final String sessionId;
    private final String handler;
    @Nullable private final String nodeId;
    @Nullable private final String nodeType;
    @Nullable private final Map<String, Object> inputs;
    @Nullable private final Map<String, Object> outputs;
    @Nullable private final Map<String, Object> params;
    @Nullable private final Double durationMs;
    @Nullable private final Long waitMs;
    @Nullable private final Long resumeAt;
    @Nullable private final String error;
    private final long timestamp;

    private TraceMessage(Builder builder) {
        this.type = checkNotNull(builder.type, "type must not be null");
        this.sessionId = checkNotNull(builder.sessionId, "sessionId must not be null");
        this.handler = checkNotNull(builder.handler, "handler must not be null");
        this.nodeId = builder.nodeId;
        this.nodeType = builder.nodeType;
        this.inputs = unmodifiable(builder.inputs);
        this.outputs = unmodifiable(builder.outputs);
        this.params = unmodifiable(builder.params);
        this.durationMs = builder.durationMs;
        this.waitMs = builder.waitMs;
        this.resumeAt = builder.resumeAt;
        this.error = builder.error;
        this.timestamp = builder.timestamp;
    }

    public static Builder builder(TraceMessageType type, String sessionId, String handler) {
        return new Builder(type, sessionId, handler);
    }

    public TraceMessageType getType() {
        return type;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getHandler() {
        return handler;
    }

    @Nullable
    public String getNodeId() {
        return nodeId;
    }

    @Nullable
    public String getNodeType() {
        return nodeType;
    }

    @Nullable
    public Map<String, Object> getInputs() {
        return inputs;
    }

    @Nullable
    public Map<String, Object> getOutputs() {
        return outputs;
    }

    @Nullable
    public Map<String, Object> getParams() {
        return params;
    }

    @Nullable
    public Double getDurationMs() {
        return durationMs;
    }

    @Nullable
    public Long getWaitMs() {
        return waitMs;
    }

    /** Epoch millis at which a waiting node is expected to resume. */
    @Nullable
    public Long getResumeAt() {
        return resumeAt;
    }

    @Nullable
    public String getError() {
        return error;
    }

    /** Epoch millis at which the message was created. */
    public long getTimestamp() {
        return timestamp;
    }

    @Nullable
    private static Map<String, Object> unmodifiable(@Nullable Map<String, Object> map) {
        return map == null ? null : Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TraceMessage that = (TraceMessage) o;
        return timestamp == that.timestamp
                && type == that.type
                && sessionId.equals(that.sessionId)
                && handler.equals(that.handler)
                && Objects.equals(nodeId, that.nodeId)
                && Objects.equals(nodeType, that.nodeType)
                && Objects.equals(inputs, that.inputs)
                && Objects.equals(outputs, that.outputs)
                && Objects.equals(params, that.params)
                && Objects.equals(durationMs, that.durationMs)
                && Objects.equals(waitMs, that.waitMs)
                && Objects.equals(resumeAt, that.resumeAt)
                && Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, sessionId, handler, nodeId, timestamp);
    }

    @Override
    public String toString() {
        return "TraceMessage{"
                + "type="
                + type
                + ", sessionId='"
                + sessionId
                + '\''
                + ", handler='"
                + handler
                + '\''
                + (nodeId == null ? "" : ", nodeId='" + nodeId + '\'')
                + (error == null ? "" : ", error='" + error + '\'')
                + ", timestamp="
                + timestamp
                + '}';
    }

    /** Builder for {@link TraceMessage}. */
    public static final class Builder {
        private final TraceMessageType type;
        private final String sessionId;
        private final String handler;
        private String nodeId;
        private String nodeType;
        private Map<String, Object> inputs;
        private Map<String, Object> outputs;
        private Map<String, Object> params;
        private Double durationMs;
        private Long waitMs;
        private Long resumeAt;
        private String error;
        private long timestamp;

        private Builder(TraceMessageType type, String sessionId, String handler) {
            this.type = type;
            this.sessionId = sessionId;
            this.handler = handler;
        }

        public Builder node(String nodeId, String nodeType) {
            this.nodeId = nodeId;
            this.nodeType = nodeType;
            return this;
        }

        public Builder inputs(@Nullable Map<String, Object> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(@Nullable Map<String, Object> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder params(@Nullable Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public Builder durationMs(double durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder waitMs(long waitMs) {
            this.waitMs = waitMs;
            return this;
        }

        public Builder resumeAt(long resumeAt) {
            this.resumeAt = resumeAt;
            return this;
        }

        public Builder error(@Nullable String error) {
            this.error = error;
            return this;
        }

        public Builder timestamp(long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public TraceMessage build() {
            return new TraceMessage(this);
        }
    }
}

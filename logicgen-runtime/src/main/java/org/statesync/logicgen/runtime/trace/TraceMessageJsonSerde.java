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

import org.statesync.logicgen.annotation.Internal;
import org.statesync.logicgen.utils.json.JsonDeserializer;
import org.statesync.logicgen.utils.json.JsonSerdeUtils;
import org.statesync.logicgen.utils.json.JsonSerializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.Map;

/** Json serializer and deserializer for {@link TraceMessage}. Absent fields are omitted. */
@Internal
public class TraceMessageJsonSerde
        implements JsonSerializer<TraceMessage>, JsonDeserializer<TraceMessage> {

    public static final TraceMessageJsonSerde INSTANCE = new TraceMessageJsonSerde();

    private static final String TYPE = "type";
    private static final String SESSION_ID = "sessionId";
    private static final String HANDLER = "handler";
    private static final String NODE_ID = "nodeId";
    private static final String NODE_TYPE = "nodeType";
    private static final String INPUTS = "inputs";
    private static final String OUTPUTS = "outputs";
    private static final String PARAMS = "params";
    private static final String DURATION_MS = "durationMs";
    private static final String WAIT_MS = "waitMs";
    private static final String RESUME_AT = "resumeAt";
    private static final String ERROR = "error";
    private static final String TIMESTAMP = "timestamp";

    private static final TypeReference<Map<String, Object>> MAP_TYPE =
            new TypeReference<Map<String, Object>>() {};

    @Override
    public void serialize(TraceMessage message, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeStringField(TYPE, message.getType().getWireName());
        generator.writeStringField(SESSION_ID, message.getSessionId());
        generator.writeStringField(HANDLER, message.getHandler());
        if (message.getNodeId() != null) {
            generator.writeStringField(NODE_ID, message.getNodeId());
        }
        if (message.getNodeType() != null) {
            generator.writeStringField(NODE_TYPE, message.getNodeType());
        }
        writeMap(generator, INPUTS, message.getInputs());
        writeMap(generator, OUTPUTS, message.getOutputs());
        writeMap(generator, PARAMS, message.getParams());
        if (message.getDurationMs() != null) {
            generator.writeNumberField(DURATION_MS, message.getDurationMs());
        }
        if (message.getWaitMs() != null) {
            generator.writeNumberField(WAIT_MS, message.getWaitMs());
        }
        if (message.getResumeAt() != null) {
            generator.writeNumberField(RESUME_AT, message.getResumeAt());
        }
        if (message.getError() != null) {
            generator.writeStringField(ERROR, message.getError());
        }
        generator.writeNumberField(TIMESTAMP, message.getTimestamp());
        generator.writeEndObject();
    }

    private static void writeMap(JsonGenerator generator, String field, Map<String, Object> map)
            throws IOException {
        if (map == null) {
            return;
        }
        generator.writeFieldName(field);
        JsonSerdeUtils.OBJECT_MAPPER_INSTANCE.writeValue(generator, map);
    }

    @Override
    public TraceMessage deserialize(JsonNode node) {
        TraceMessage.Builder builder =
                TraceMessage.builder(
                        TraceMessageType.fromWireName(node.get(TYPE).asText()),
                        node.get(SESSION_ID).asText(),
                        node.get(HANDLER).asText());
        if (node.hasNonNull(NODE_ID)) {
            builder.node(
                    node.get(NODE_ID).asText(),
                    node.hasNonNull(NODE_TYPE) ? node.get(NODE_TYPE).asText() : null);
        }
        builder.inputs(readMap(node, INPUTS));
        builder.outputs(readMap(node, OUTPUTS));
        builder.params(readMap(node, PARAMS));
        if (node.hasNonNull(DURATION_MS)) {
            builder.durationMs(node.get(DURATION_MS).asDouble());
        }
        if (node.hasNonNull(WAIT_MS)) {
            builder.waitMs(node.get(WAIT_MS).asLong());
        }
        if (node.hasNonNull(RESUME_AT)) {
            builder.resumeAt(node.get(RESUME_AT).asLong());
        }
        if (node.hasNonNull(ERROR)) {
            builder.error(node.get(ERROR).asText());
        }
        builder.timestamp(node.path(TIMESTAMP).asLong());
        return builder.build();
    }

    private static Map<String, Object> readMap(JsonNode node, String field) {
        if (!node.hasNonNull(field)) {
            return null;
        }
        return JsonSerdeUtils.OBJECT_MAPPER_INSTANCE.convertValue(node.get(field), MAP_TYPE);
    }
}

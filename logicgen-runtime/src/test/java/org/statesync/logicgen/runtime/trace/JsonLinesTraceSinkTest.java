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

import org.statesync.logicgen.utils.json.JsonSerdeUtils;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link JsonLinesTraceSink} and {@link TraceMessageJsonSerde}. */
public class JsonLinesTraceSinkTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(42L), ZoneOffset.UTC);

    @Test
    public void testWritesOneObjectPerLine() throws Exception {
        StringWriter out = new StringWriter();
        JsonLinesTraceSink sink = new JsonLinesTraceSink(out, CLOCK);
        sink.onEventStart("s1", "OnJoin", Collections.<String, Object>singletonMap("name", "ann"));
        sink.onEventEnd("s1", "OnJoin", 2.0, new IllegalArgumentException("bad"));

        String[] lines = out.toString().split("\n");
        assertThat(lines).hasSize(2);
        assertThat(lines[0])
                .isEqualTo(
                        "{\"type\":\"event:start\",\"sessionId\":\"s1\",\"handler\":\"OnJoin\","
                                + "\"params\":{\"name\":\"ann\"},\"timestamp\":42}");

        TraceMessage end =
                JsonSerdeUtils.readValue(
                        lines[1].getBytes(StandardCharsets.UTF_8), TraceMessageJsonSerde.INSTANCE);
        assertThat(end.getType()).isEqualTo(TraceMessageType.EVENT_END);
        assertThat(end.getDurationMs()).isEqualTo(2.0);
        assertThat(end.getError()).isEqualTo("bad");
        assertThat(end.getTimestamp()).isEqualTo(42L);
    }

    @Test
    public void testRoundTripOfNodeMessage() throws Exception {
        TraceMessage message =
                TraceMessage.builder(TraceMessageType.NODE_END, "s9", "OnTick")
                        .node("calc", "Multiply")
                        .outputs(Collections.<String, Object>singletonMap("result", 6))
                        .durationMs(0.25)
                        .timestamp(7L)
                        .build();
        byte[] json = JsonSerdeUtils.writeValueAsBytes(message, TraceMessageJsonSerde.INSTANCE);
        assertThat(JsonSerdeUtils.readValue(json, TraceMessageJsonSerde.INSTANCE))
                .isEqualTo(message);
    }

    @Test
    public void testWriteFailureDoesNotPropagate() {
        Writer broken =
                new Writer() {
                    @Override
                    public void write(char[] cbuf, int off, int len) throws IOException {
                        throw new IOException("disk full");
                    }

                    @Override
                    public void flush() {}

                    @Override
                    public void close() {}
                };
        JsonLinesTraceSink sink = new JsonLinesTraceSink(broken, CLOCK);
        sink.onNodeResume("s1", "OnTick", "wait", "Wait");
        assertThat(sink.getFailedWriteCount()).isEqualTo(1);
    }
}

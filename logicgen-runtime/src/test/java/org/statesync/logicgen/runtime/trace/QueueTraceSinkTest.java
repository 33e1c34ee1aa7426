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

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link QueueTraceSink}. */
public class QueueTraceSinkTest {

    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(1000L), ZoneOffset.UTC);

    @Test
    public void testMessagesCarryProtocolFields() throws Exception {
        QueueTraceSink sink = new QueueTraceSink(16, CLOCK);
        sink.onEventStart("s1", "OnMove", Collections.<String, Object>singletonMap("x", 1));
        sink.onNodeStart("s1", "OnMove", "add", "Add", Collections.<String, Object>emptyMap());
        sink.onNodeEnd(
                "s1", "OnMove", "add", "Add", Collections.<String, Object>emptyMap(), 1.5);
        sink.onNodeWait("s1", "OnMove", "pause", "Wait", 250L);
        sink.onNodeResume("s1", "OnMove", "pause", "Wait");
        sink.onNodeError("s1", "OnMove", "set", "SetField", new IllegalStateException("boom"));
        sink.onEventEnd("s1", "OnMove", 3.0, null);

        TraceMessage first = sink.poll(1, TimeUnit.SECONDS);
        assertThat(first.getType()).isEqualTo(TraceMessageType.EVENT_START);
        assertThat(first.getParams()).containsEntry("x", 1);
        assertThat(first.getTimestamp()).isEqualTo(1000L);

        List<TraceMessage> rest = sink.drain();
        assertThat(rest)
                .extracting(m -> m.getType().getWireName())
                .containsExactly(
                        "node:start",
                        "node:end",
                        "node:wait",
                        "node:resume",
                        "node:error",
                        "event:end");
        assertThat(rest.get(1).getDurationMs()).isEqualTo(1.5);
        assertThat(rest.get(2).getWaitMs()).isEqualTo(250L);
        assertThat(rest.get(2).getResumeAt()).isEqualTo(1250L);
        assertThat(rest.get(4).getError()).isEqualTo("boom");
        assertThat(rest.get(5).getError()).isNull();
    }

    @Test
    public void testFullQueueDropsInsteadOfBlocking() {
        QueueTraceSink sink = new QueueTraceSink(2, CLOCK);
        for (int i = 0; i < 5; i++) {
            sink.onNodeResume("s1", "OnTick", "n" + i, "Wait");
        }
        assertThat(sink.getDroppedCount()).isEqualTo(3);
        assertThat(sink.drain()).extracting(TraceMessage::getNodeId).containsExactly("n0", "n1");
    }
}

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

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/** Tests for {@link LoggingTraceSink}. */
public class LoggingTraceSinkTest {

    @Test
    public void testLogsEveryMessageType() {
        LoggingTraceSink sink = new LoggingTraceSink();

        assertThatCode(
                        () -> {
                            sink.onEventStart(
                                    "s1", "OnMove", Collections.<String, Object>emptyMap());
                            sink.onNodeWait("s1", "OnMove", "pause", "Wait", 10L);
                            sink.onNodeResume("s1", "OnMove", "pause", "Wait");
                            sink.onNodeError(
                                    "s1", "OnMove", "set", "SetField", new RuntimeException("x"));
                            sink.onEventEnd("s1", "OnMove", 2.0, new RuntimeException("x"));
                        })
                .doesNotThrowAnyException();
    }

    @Test
    public void testCombinesWithOtherSinks() {
        QueueTraceSink queue = new QueueTraceSink(4);
        FanOutTraceSink fanOut = new FanOutTraceSink(new LoggingTraceSink(), queue);

        fanOut.onNodeResume("s1", "OnTick", "pause", "Wait");

        assertThat(queue.drain()).extracting(TraceMessage::getNodeId).containsExactly("pause");
    }
}

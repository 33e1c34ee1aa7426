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
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/** Tests for {@link FanOutTraceSink}. */
public class FanOutTraceSinkTest {

    @Test
    public void testBroadcastsToAllSinks() {
        TraceSink first = mock(TraceSink.class);
        TraceSink second = mock(TraceSink.class);
        FanOutTraceSink fanOut = new FanOutTraceSink(first);
        fanOut.addSink(second);
        assertThat(fanOut.size()).isEqualTo(2);

        Map<String, Object> params = Collections.<String, Object>singletonMap("id", "p1");
        fanOut.onEventStart("s1", "OnJoin", params);
        fanOut.onNodeWait("s1", "OnJoin", "pause", "Wait", 100L);

        verify(first).onEventStart("s1", "OnJoin", params);
        verify(second).onEventStart("s1", "OnJoin", params);
        verify(first).onNodeWait("s1", "OnJoin", "pause", "Wait", 100L);
        verify(second).onNodeWait("s1", "OnJoin", "pause", "Wait", 100L);
    }

    @Test
    public void testRemovedSinkNoLongerReceives() {
        TraceSink sink = mock(TraceSink.class);
        FanOutTraceSink fanOut = new FanOutTraceSink(sink, NoOpTraceSink.INSTANCE);
        assertThat(fanOut.removeSink(sink)).isTrue();

        fanOut.onNodeError("s1", "OnJoin", "n1", "SetField", new RuntimeException("x"));
        verify(sink, never())
                .onNodeError(anyString(), anyString(), anyString(), anyString(), any());
        verify(sink, never()).onEventEnd(anyString(), eq("OnJoin"), eq(0.0), any());
    }
}

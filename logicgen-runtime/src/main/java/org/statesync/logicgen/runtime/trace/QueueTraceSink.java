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
import javax.annotation.concurrent.ThreadSafe;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.statesync.logicgen.utils.Preconditions.checkArgument;

/**
 * Buffers messages in a bounded queue for a consumer such as a debugger connection. A full queue
 * never blocks the handler: the message is dropped and counted.
 */
@PublicEvolving
@ThreadSafe
public class QueueTraceSink extends MessageTraceSink {

    private final BlockingQueue<TraceMessage> queue;
    private final AtomicLong dropped = new AtomicLong();

    public QueueTraceSink(int capacity) {
        this(capacity, Clock.systemUTC());
    }

    public QueueTraceSink(int capacity, Clock clock) {
        super(clock);
        checkArgument(capacity > 0, "capacity must be positive, but is %s", capacity);
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    @Override
    protected void publish(TraceMessage message) {
        if (!queue.offer(message)) {
            dropped.incrementAndGet();
        }
    }

    /** Retrieves the next message, waiting up to the given timeout. */
    @Nullable
    public TraceMessage poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /** Removes and returns all buffered messages. */
    public List<TraceMessage> drain() {
        List<TraceMessage> messages = new ArrayList<>();
        queue.drainTo(messages);
        return messages;
    }

    /** Number of messages dropped because the queue was full. */
    public long getDroppedCount() {
        return dropped.get();
    }
}

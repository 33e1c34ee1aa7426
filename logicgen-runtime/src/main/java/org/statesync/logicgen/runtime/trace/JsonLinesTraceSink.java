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
import org.statesync.logicgen.utils.json.JsonSerdeUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;
import static org.statesync.logicgen.utils.concurrent.LockUtils.inLock;

/**
 * Writes each message as one JSON object per line. Writes are serialized by a lock so lines of
 * concurrent handlers never interleave.
 */
@PublicEvolving
@ThreadSafe
public class JsonLinesTraceSink extends MessageTraceSink {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesTraceSink.class);

    private final Lock lock = new ReentrantLock();

    @GuardedBy("lock")
    private final Writer writer;

    private final AtomicLong failedWrites = new AtomicLong();

    public JsonLinesTraceSink(Writer writer) {
        this(writer, Clock.systemUTC());
    }

    public JsonLinesTraceSink(Writer writer, Clock clock) {
        super(clock);
        this.writer = checkNotNull(writer, "writer must not be null");
    }

    @Override
    protected void publish(TraceMessage message) {
        String line =
                new String(
                        JsonSerdeUtils.writeValueAsBytes(message, TraceMessageJsonSerde.INSTANCE),
                        StandardCharsets.UTF_8);
        try {
            inLock(
                    lock,
                    () -> {
                        writer.write(line);
                        writer.write('\n');
                        writer.flush();
                    });
        } catch (IOException e) {
            // a broken trace stream must not fail the handler being traced
            failedWrites.incrementAndGet();
            LOG.warn("Failed to write trace message {}.", message, e);
        }
    }

    /** Number of messages that could not be written. */
    public long getFailedWriteCount() {
        return failedWrites.get();
    }
}

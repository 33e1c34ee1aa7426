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

import java.nio.charset.StandardCharsets;

/** Logs every message as JSON at info level, errors at warn level. */
@PublicEvolving
public class LoggingTraceSink extends MessageTraceSink {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingTraceSink.class);

    @Override
    protected void publish(TraceMessage message) {
        if (message.getError() != null) {
            LOG.warn("[trace] {}", toJson(message));
        } else if (LOG.isInfoEnabled()) {
            LOG.info("[trace] {}", toJson(message));
        }
    }

    private static String toJson(TraceMessage message) {
        return new String(
                JsonSerdeUtils.writeValueAsBytes(message, TraceMessageJsonSerde.INSTANCE),
                StandardCharsets.UTF_8);
    }
}

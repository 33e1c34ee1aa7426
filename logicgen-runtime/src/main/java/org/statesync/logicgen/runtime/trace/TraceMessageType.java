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

/** Message types of the trace protocol, with their wire names. */
@PublicEvolving
public enum TraceMessageType {
    EVENT_START("event:start"),
    EVENT_END("event:end"),
    NODE_START("node:start"),
    NODE_END("node:end"),
    NODE_ERROR("node:error"),
    NODE_WAIT("node:wait"),
    NODE_RESUME("node:resume");

    private final String wireName;

    TraceMessageType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public static TraceMessageType fromWireName(String wireName) {
        for (TraceMessageType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trace message type: " + wireName);
    }

    @Override
    public String toString() {
        return wireName;
    }
}

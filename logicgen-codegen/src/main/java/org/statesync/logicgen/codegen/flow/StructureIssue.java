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

package org.statesync.logicgen.codegen.flow;

import org.statesync.logicgen.annotation.Internal;

import javax.annotation.Nullable;

/** A flow shape that cannot be nested into structured code. */
@Internal
public final class StructureIssue {

    @Nullable private final String nodeId;
    private final String message;

    public StructureIssue(@Nullable String nodeId, String message) {
        this.nodeId = nodeId;
        this.message = message;
    }

    @Nullable
    public String getNodeId() {
        return nodeId;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return nodeId == null ? message : "node '" + nodeId + "': " + message;
    }
}

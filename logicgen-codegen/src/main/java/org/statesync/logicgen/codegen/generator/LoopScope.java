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

package org.statesync.logicgen.codegen.generator;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

/**
 * An open loop during emission. {@code loop:item} and {@code loop:index} resolve against the
 * innermost scope; a {@code While} loop has neither.
 */
@PublicEvolving
public final class LoopScope {

    private final String nodeId;
    @Nullable private final JavaExpression item;
    @Nullable private final JavaExpression index;

    public LoopScope(
            String nodeId, @Nullable JavaExpression item, @Nullable JavaExpression index) {
        this.nodeId = nodeId;
        this.item = item;
        this.index = index;
    }

    public String getNodeId() {
        return nodeId;
    }

    @Nullable
    public JavaExpression getItem() {
        return item;
    }

    @Nullable
    public JavaExpression getIndex() {
        return index;
    }
}

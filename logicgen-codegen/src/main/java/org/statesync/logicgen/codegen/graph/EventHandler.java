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

package org.statesync.logicgen.codegen.graph;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.List;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/** A fragment compiled to a handler method invoked when a client sends {@link #getEvent()}. */
@PublicEvolving
public final class EventHandler extends GraphFragment {

    private final String event;
    private final Permissions permissions;

    public EventHandler(
            String name,
            String event,
            @Nullable Permissions permissions,
            List<Parameter> parameters,
            List<Node> nodes,
            List<FlowEdge> flow) {
        super(name, null, parameters, nodes, flow);
        this.event = checkNotNull(event, "handler event must not be null");
        this.permissions = permissions == null ? Permissions.NONE : permissions;
    }

    @Override
    public FragmentKind getKind() {
        return FragmentKind.HANDLER;
    }

    public String getEvent() {
        return event;
    }

    /** The checks applied before the first node; {@link Permissions#NONE} when unrestricted. */
    public Permissions getPermissions() {
        return permissions;
    }
}

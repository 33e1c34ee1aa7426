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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Who may trigger a handler. The checks are applied in field order: host only, then the named
 * player parameter must equal the sender, then the static allow list.
 */
@PublicEvolving
public final class Permissions {

    /** No checks. */
    public static final Permissions NONE =
            new Permissions(false, null, Collections.<String>emptyList());

    private final boolean hostOnly;
    @Nullable private final String playerParam;
    private final List<String> allowedPlayers;

    public Permissions(
            boolean hostOnly, @Nullable String playerParam, List<String> allowedPlayers) {
        this.hostOnly = hostOnly;
        this.playerParam = playerParam == null || playerParam.isEmpty() ? null : playerParam;
        this.allowedPlayers = Collections.unmodifiableList(new ArrayList<>(allowedPlayers));
    }

    public boolean isHostOnly() {
        return hostOnly;
    }

    @Nullable
    public String getPlayerParam() {
        return playerParam;
    }

    public List<String> getAllowedPlayers() {
        return allowedPlayers;
    }

    /** Whether no check applies. */
    public boolean isEmpty() {
        return !hostOnly && playerParam == null && allowedPlayers.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Permissions that = (Permissions) o;
        return hostOnly == that.hostOnly
                && Objects.equals(playerParam, that.playerParam)
                && allowedPlayers.equals(that.allowedPlayers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hostOnly, playerParam, allowedPlayers);
    }
}

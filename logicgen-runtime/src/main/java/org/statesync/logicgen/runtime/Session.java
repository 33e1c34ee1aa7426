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

package org.statesync.logicgen.runtime;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.Collection;

/**
 * The live session that generated handlers operate on. Implementations are provided by the
 * hosting server and must be safe for the threading model the server dispatches events with.
 *
 * @param <S> the root state type of the session
 */
@PublicEvolving
public interface Session<S> {

    /** Identifier of this session, used in trace messages. */
    String getSessionId();

    /** The mutable root state. Generated handlers read and write it through schema accessors. */
    S getState();

    /** Whether the given participant is the recorded host of the session. */
    boolean isHost(String playerId);

    /** The host participant, or {@code null} if the session has no host. */
    @Nullable
    String getHostPlayerId();

    /** Identifiers of all connected participants, in join order. */
    Collection<String> getPlayerIds();

    /** Broadcasts an event to every participant. */
    void emit(String event, @Nullable Object payload);

    /** Sends an event to one participant. */
    void emitTo(String playerId, String event, @Nullable Object payload);

    /** Sends an event to each of the given participants. */
    void emitToMany(Collection<String> playerIds, String event, @Nullable Object payload);

    /** Broadcasts an event to every participant except the given one. */
    void emitExcept(String excludedPlayerId, String event, @Nullable Object payload);

    /**
     * Removes a participant from the session.
     *
     * @return {@code true} if the participant was connected
     */
    boolean kick(String playerId, String reason);

    /**
     * Installs the view filter applied to the state before it is sent to the given viewer. A
     * {@code null} filter removes filtering for that viewer.
     */
    void setFilter(String viewerId, @Nullable StateFilter<S> filter);
}

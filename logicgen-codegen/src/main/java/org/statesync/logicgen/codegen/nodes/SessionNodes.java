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

package org.statesync.logicgen.codegen.nodes;

import org.statesync.logicgen.codegen.generator.Coercions;
import org.statesync.logicgen.codegen.generator.EmitContext;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

import static org.statesync.logicgen.codegen.registry.PortDefinition.optional;
import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/** Session membership. None of these are available in filters. */
final class SessionNodes {

    private static final String CATEGORY = "session";

    private SessionNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("KickPlayer")
                        .category(CATEGORY)
                        .description("Removes a player from the session.")
                        .input(required("playerID", "string"))
                        .input(optional("reason", "string", ""))
                        .output("kicked", "bool")
                        .emitter(SessionNodes::emitKickPlayer)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("GetHostPlayer")
                        .category(CATEGORY)
                        .description("The id of the host.")
                        .output("hostPlayerID", "string")
                        .emitter(SessionNodes::emitGetHostPlayer)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("IsHost")
                        .category(CATEGORY)
                        .description("Whether a player is the host.")
                        .input(required("playerID", "string"))
                        .output("isHost", "bool")
                        .emitter(SessionNodes::emitIsHost)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("GetPlayerCount")
                        .category(CATEGORY)
                        .description("The number of connected players.")
                        .output("count", "int")
                        .emitter(SessionNodes::emitGetPlayerCount)
                        .build());
    }

    private static void emitKickPlayer(EmitContext context, Node node) {
        String session = context.requireSession(node);
        String player = Coercions.toStringValue(context.resolveInput(node, "playerID"));
        String reason = Coercions.toStringValue(context.resolveInput(node, "reason"));
        context.declareOutput(
                node, "kicked", "boolean", session + ".kick(" + player + ", " + reason + ")");
    }

    private static void emitGetHostPlayer(EmitContext context, Node node) {
        String session = context.requireSession(node);
        context.declareOutput(node, "hostPlayerID", "String", session + ".getHostPlayerId()");
    }

    private static void emitIsHost(EmitContext context, Node node) {
        String session = context.requireSession(node);
        String player = Coercions.toStringValue(context.resolveInput(node, "playerID"));
        context.declareOutput(node, "isHost", "boolean", session + ".isHost(" + player + ")");
    }

    private static void emitGetPlayerCount(EmitContext context, Node node) {
        String session = context.requireSession(node);
        context.declareOutput(node, "count", "int", session + ".getPlayerIds().size()");
    }
}

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
import org.statesync.logicgen.codegen.generator.JavaExpression;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

import static org.statesync.logicgen.codegen.registry.PortDefinition.optional;
import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/** Events sent to the players of the session. */
final class EventNodes {

    private static final String CATEGORY = "event";

    private EventNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                event("EmitToAll", "Sends an event to every player.")
                        .emitter(EventNodes::emitToAll)
                        .build());
        registry.registerCore(
                event("EmitToPlayer", "Sends an event to one player.")
                        .input(required("playerID", "string"))
                        .emitter(EventNodes::emitToPlayer)
                        .build());
        registry.registerCore(
                event("EmitToMany", "Sends an event to a list of players.")
                        .input(required("playerIDs", "[]string"))
                        .emitter(EventNodes::emitToMany)
                        .build());
        registry.registerCore(
                event("EmitExcept", "Sends an event to all players but one.")
                        .input(optional("playerID", "string"))
                        .emitter(EventNodes::emitExcept)
                        .build());
    }

    private static NodeDefinition.Builder event(String type, String description) {
        return NodeDefinition.newBuilder(type)
                .category(CATEGORY)
                .description(description)
                .input(required("eventType", "string"))
                .input(optional("payload", "any"));
    }

    private static void emitToAll(EmitContext context, Node node) {
        String session = context.requireSession(node);
        context.code().stmt(session + ".emit(" + eventArguments(context, node) + ")");
    }

    private static void emitToPlayer(EmitContext context, Node node) {
        String session = context.requireSession(node);
        String player = Coercions.toStringValue(context.resolveInput(node, "playerID"));
        context.code()
                .stmt(session + ".emitTo(" + player + ", " + eventArguments(context, node) + ")");
    }

    /** Player ids that are not already a {@code List<String>} are converted one by one. */
    private static void emitToMany(EmitContext context, Node node) {
        String session = context.requireSession(node);
        JavaExpression ids = context.resolveInput(node, "playerIDs");
        String players;
        if ("List<String>".equals(ids.getType())) {
            players = ids.getCode();
        } else {
            context.addImport(NodeSupport.ARRAY_LIST);
            players = context.newLocal(node.getId() + "_players");
            String id = context.newLocal(node.getId() + "_id");
            context.code()
                    .declare("List<String>", players, "new ArrayList<String>()")
                    .beginForEach("Object", id, Coercions.toList(ids))
                    .stmt(players + ".add(String.valueOf(" + id + "))")
                    .endFor();
        }
        context.code()
                .stmt(
                        session
                                + ".emitToMany("
                                + players
                                + ", "
                                + eventArguments(context, node)
                                + ")");
    }

    private static void emitExcept(EmitContext context, Node node) {
        String session = context.requireSession(node);
        String excluded;
        if (node.isInputProvided("playerID")) {
            excluded = Coercions.toStringValue(context.resolveInput(node, "playerID"));
        } else {
            excluded = context.senderVariable();
            if (excluded == null) {
                throw context.error(node, "EmitExcept needs a playerID outside of handlers");
            }
        }
        context.code()
                .stmt(
                        session
                                + ".emitExcept("
                                + excluded
                                + ", "
                                + eventArguments(context, node)
                                + ")");
    }

    private static String eventArguments(EmitContext context, Node node) {
        String eventType = Coercions.toStringValue(context.resolveInput(node, "eventType"));
        return eventType + ", " + context.resolveInput(node, "payload").getCode();
    }
}

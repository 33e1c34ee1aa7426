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

import org.statesync.logicgen.codegen.generator.EmitContext;
import org.statesync.logicgen.codegen.generator.JavaExpression;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.schema.FieldAccessInfo;
import org.statesync.logicgen.codegen.schema.FieldDef;
import org.statesync.logicgen.codegen.schema.JavaTypes;
import org.statesync.logicgen.codegen.schema.SchemaContext;
import org.statesync.logicgen.codegen.schema.TypeDef;

import static org.statesync.logicgen.codegen.registry.PortDefinition.required;
import static org.statesync.logicgen.utils.StringUtils.capitalize;
import static org.statesync.logicgen.utils.StringUtils.quote;

/** Reading and writing the session state. */
final class StateNodes {

    private static final String CATEGORY = "state";
    private static final String PLAYERS_FIELD = "players";
    private static final String DEFAULT_PLAYER_KEY = "id";

    private StateNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("GetCurrentState")
                        .category(CATEGORY)
                        .description("The whole session state.")
                        .output("state", "any")
                        .emitter(StateNodes::emitGetCurrentState)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("GetField")
                        .category(CATEGORY)
                        .description("Reads the value at a state path.")
                        .input(required("path", "string"))
                        .output("value", "any")
                        .emitter(StateNodes::emitGetField)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("SetField")
                        .category(CATEGORY)
                        .description("Writes a value to a state path.")
                        .input(required("path", "string"))
                        .input(required("value", "any"))
                        .emitter(StateNodes::emitSetField)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("GetPlayer")
                        .category(CATEGORY)
                        .description("Finds a player of the state by its key.")
                        .input(required("playerID", "string"))
                        .output("player", "any")
                        .emitter(StateNodes::emitGetPlayer)
                        .build());
    }

    private static void emitGetCurrentState(EmitContext context, Node node) {
        context.bindOutput(
                node, "state", JavaExpression.of(context.stateVariable(), context.getStateType()));
    }

    private static void emitGetField(EmitContext context, Node node) {
        JavaExpression value =
                context.readPath(node, context.requireConstantString(node, "path"));
        context.declareOutput(node, "value", value.getType(), value.getCode());
    }

    private static void emitSetField(EmitContext context, Node node) {
        context.writePath(
                node,
                context.requireConstantString(node, "path"),
                context.resolveInput(node, "value"));
    }

    /**
     * Searches the {@code players} array of the root state for the element whose key field
     * equals the player id and throws {@code NotFoundException} when there is none.
     */
    private static void emitGetPlayer(EmitContext context, Node node) {
        JavaExpression playerId = context.resolveInput(node, "playerID");
        String state = context.stateVariable();
        FieldAccessInfo players;
        String playerType;
        String keyRead;
        SchemaContext schema = context.getSchema();
        if (schema == null) {
            players = FieldAccessInfo.untyped(context.getStateType(), PLAYERS_FIELD);
            playerType = JavaTypes.OBJECT;
            keyRead = "Values.property(%s, " + quote(DEFAULT_PLAYER_KEY) + ")";
        } else {
            TypeDef root = schema.getRootType();
            if (root.findField(PLAYERS_FIELD) == null) {
                throw context.error(
                        node,
                        "GetPlayer needs a '"
                                + PLAYERS_FIELD
                                + "' array on the state type '"
                                + root.getName()
                                + "'");
            }
            players = schema.getFieldAccessInfo(root.getName(), PLAYERS_FIELD);
            boolean recordElements =
                    players.isArray()
                            && players.getFieldType().unwrapOptional().getElementType().isRecord();
            if (!recordElements) {
                throw context.error(
                        node, "'" + PLAYERS_FIELD + "' must be an array of records for GetPlayer");
            }
            playerType = players.getElementJavaType();
            FieldDef key = schema.getType(playerType).getKeyField();
            String keyName = key == null ? DEFAULT_PLAYER_KEY : key.getName();
            keyRead = "%s.get" + capitalize(keyName) + "()";
        }

        context.addImport("org.statesync.logicgen.runtime.NotFoundException");
        context.markThrowsChecked();
        String player = context.declareOutput(node, "player", playerType, "null");
        String counter = context.newLocal("i");
        String candidate = state + "." + players.getGetAtName() + "(" + counter + ")";
        context.code()
                .beginFor(
                        "int " + counter + " = 0",
                        counter + " < " + state + "." + players.getSizeName() + "()",
                        counter + "++")
                .beginIf(
                        "Values.looseEquals("
                                + String.format(keyRead, candidate)
                                + ", "
                                + playerId.getCode()
                                + ")")
                .assign(player, candidate)
                .breakStmt()
                .endIf()
                .endFor()
                .beginIf(player + " == null")
                .throwStmt(
                        "new NotFoundException("
                                + quote("player not found: ")
                                + " + "
                                + playerId.getCode()
                                + ")")
                .endIf();
    }
}

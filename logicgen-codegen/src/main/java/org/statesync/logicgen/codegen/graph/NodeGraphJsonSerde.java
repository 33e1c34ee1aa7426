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

import org.statesync.logicgen.annotation.Internal;
import org.statesync.logicgen.codegen.exception.GraphParseException;
import org.statesync.logicgen.utils.json.JsonDeserializer;
import org.statesync.logicgen.utils.json.JsonSerializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;

import javax.annotation.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Json serializer and deserializer for {@link NodeGraph}. Structural problems such as a missing
 * node id are reported as {@link GraphParseException}.
 */
@Internal
public class NodeGraphJsonSerde implements JsonSerializer<NodeGraph>, JsonDeserializer<NodeGraph> {

    public static final NodeGraphJsonSerde INSTANCE = new NodeGraphJsonSerde();

    private static final String VERSION = "version";
    private static final String PACKAGE = "package";
    private static final String HANDLERS = "handlers";
    private static final String FILTERS = "filters";
    private static final String FUNCTIONS = "functions";
    private static final String VIEWS = "views";

    private static final String NAME = "name";
    private static final String EVENT = "event";
    private static final String DESCRIPTION = "description";
    private static final String PERMISSIONS = "permissions";
    private static final String PARAMETERS = "parameters";
    private static final String RETURN_TYPE = "returnType";
    private static final String NODES = "nodes";
    private static final String FLOW = "flow";

    private static final String HOST_ONLY = "hostOnly";
    private static final String PLAYER_PARAM = "playerParam";
    private static final String ALLOWED_PLAYERS = "allowedPlayers";

    private static final String TYPE = "type";
    private static final String ID = "id";
    private static final String INPUTS = "inputs";

    private static final String FROM = "from";
    private static final String TO = "to";
    private static final String LABEL = "label";
    private static final String CONDITION = "condition";
    private static final String METADATA = "metadata";

    private static final String PATH = "path";
    private static final String OP = "op";
    private static final String FIELD = "field";

    private static final String SOURCE = "source";
    private static final String CONSTANT = "constant";

    // ==================== Serialization ====================

    @Override
    public void serialize(NodeGraph graph, JsonGenerator generator) throws IOException {
        generator.writeStartObject();
        generator.writeStringField(VERSION, graph.getVersion());
        generator.writeStringField(PACKAGE, graph.getPackageName());

        generator.writeArrayFieldStart(HANDLERS);
        for (EventHandler handler : graph.getHandlers()) {
            generator.writeStartObject();
            generator.writeStringField(NAME, handler.getName());
            generator.writeStringField(EVENT, handler.getEvent());
            Permissions permissions = handler.getPermissions();
            if (!permissions.isEmpty()) {
                generator.writeObjectFieldStart(PERMISSIONS);
                generator.writeBooleanField(HOST_ONLY, permissions.isHostOnly());
                if (permissions.getPlayerParam() != null) {
                    generator.writeStringField(PLAYER_PARAM, permissions.getPlayerParam());
                }
                generator.writeArrayFieldStart(ALLOWED_PLAYERS);
                for (String player : permissions.getAllowedPlayers()) {
                    generator.writeString(player);
                }
                generator.writeEndArray();
                generator.writeEndObject();
            }
            serializeFragmentBody(handler, generator);
            generator.writeEndObject();
        }
        generator.writeEndArray();

        generator.writeArrayFieldStart(FILTERS);
        for (FilterDefinition filter : graph.getFilters()) {
            generator.writeStartObject();
            generator.writeStringField(NAME, filter.getName());
            if (filter.getDescription() != null) {
                generator.writeStringField(DESCRIPTION, filter.getDescription());
            }
            serializeFragmentBody(filter, generator);
            generator.writeEndObject();
        }
        generator.writeEndArray();

        generator.writeArrayFieldStart(FUNCTIONS);
        for (FunctionDefinition function : graph.getFunctions()) {
            generator.writeStartObject();
            generator.writeStringField(NAME, function.getName());
            if (function.getDescription() != null) {
                generator.writeStringField(DESCRIPTION, function.getDescription());
            }
            if (function.getReturnType() != null) {
                generator.writeStringField(RETURN_TYPE, function.getReturnType());
            }
            serializeFragmentBody(function, generator);
            generator.writeEndObject();
        }
        generator.writeEndArray();

        if (!graph.getViews().isEmpty()) {
            generator.writeArrayFieldStart(VIEWS);
            for (ViewDefinition view : graph.getViews()) {
                generator.writeStartObject();
                generator.writeStringField(NAME, view.getName());
                generator.writeStringField(PATH, view.getPath());
                generator.writeStringField(OP, view.getOperation().getName());
                if (view.getField() != null) {
                    generator.writeStringField(FIELD, view.getField());
                }
                generator.writeEndObject();
            }
            generator.writeEndArray();
        }

        generator.writeEndObject();
    }

    private void serializeFragmentBody(GraphFragment fragment, JsonGenerator generator)
            throws IOException {
        generator.writeArrayFieldStart(PARAMETERS);
        for (Parameter parameter : fragment.getParameters()) {
            generator.writeStartObject();
            generator.writeStringField(NAME, parameter.getName());
            generator.writeStringField(TYPE, parameter.getType());
            generator.writeEndObject();
        }
        generator.writeEndArray();

        generator.writeArrayFieldStart(NODES);
        for (Node node : fragment.getNodes()) {
            generator.writeStartObject();
            generator.writeStringField(ID, node.getId());
            generator.writeStringField(TYPE, node.getType());
            generator.writeObjectFieldStart(INPUTS);
            for (Map.Entry<String, InputValue> input : node.getInputs().entrySet()) {
                generator.writeFieldName(input.getKey());
                serializeInput(input.getValue(), generator);
            }
            generator.writeEndObject();
            generator.writeEndObject();
        }
        generator.writeEndArray();

        generator.writeArrayFieldStart(FLOW);
        for (FlowEdge edge : fragment.getFlow()) {
            generator.writeStartObject();
            generator.writeStringField(FROM, edge.getFrom());
            generator.writeStringField(TO, edge.getTo());
            if (edge.getLabel() != null) {
                generator.writeStringField(LABEL, edge.getLabel());
            }
            if (edge.getCondition() != null) {
                generator.writeStringField(CONDITION, edge.getCondition());
            }
            if (!edge.getMetadata().isEmpty()) {
                generator.writeObjectFieldStart(METADATA);
                for (Map.Entry<String, String> entry : edge.getMetadata().entrySet()) {
                    generator.writeStringField(entry.getKey(), entry.getValue());
                }
                generator.writeEndObject();
            }
            generator.writeEndObject();
        }
        generator.writeEndArray();
    }

    private void serializeInput(InputValue value, JsonGenerator generator) throws IOException {
        switch (value.getKind()) {
            case LITERAL:
                Object literal = ((LiteralValue) value).getValue();
                if (literal instanceof String
                        && ReferenceValue.looksLikeReference((String) literal)) {
                    // keep the literal from being read back as a reference
                    generator.writeStartObject();
                    generator.writeStringField(CONSTANT, (String) literal);
                    generator.writeEndObject();
                } else {
                    generator.writeObject(literal);
                }
                break;
            case REFERENCE:
                generator.writeString(value.toString());
                break;
            case MAP:
                generator.writeStartObject();
                for (Map.Entry<String, InputValue> entry :
                        ((MapValue) value).getEntries().entrySet()) {
                    generator.writeFieldName(entry.getKey());
                    serializeInput(entry.getValue(), generator);
                }
                generator.writeEndObject();
                break;
            case LIST:
                generator.writeStartArray();
                for (InputValue element : ((ListValue) value).getElements()) {
                    serializeInput(element, generator);
                }
                generator.writeEndArray();
                break;
            default:
                throw new IllegalStateException("Unknown input kind " + value.getKind());
        }
    }

    // ==================== Deserialization ====================

    @Override
    public NodeGraph deserialize(JsonNode node) {
        if (!node.isObject()) {
            throw new GraphParseException("Graph document must be a JSON object.");
        }
        String version = optionalText(node, VERSION, "");
        String packageName = optionalText(node, PACKAGE, "");

        List<EventHandler> handlers = new ArrayList<>();
        for (JsonNode handlerJson : arrayElements(node, HANDLERS, "graph")) {
            handlers.add(deserializeHandler(handlerJson));
        }
        List<FilterDefinition> filters = new ArrayList<>();
        for (JsonNode filterJson : arrayElements(node, FILTERS, "graph")) {
            String name = requiredText(filterJson, NAME, "filter");
            String where = "filter '" + name + "'";
            filters.add(
                    new FilterDefinition(
                            name,
                            optionalText(filterJson, DESCRIPTION, null),
                            deserializeParameters(filterJson, where),
                            deserializeNodes(filterJson, where),
                            deserializeFlow(filterJson, where)));
        }
        List<FunctionDefinition> functions = new ArrayList<>();
        for (JsonNode functionJson : arrayElements(node, FUNCTIONS, "graph")) {
            String name = requiredText(functionJson, NAME, "function");
            String where = "function '" + name + "'";
            functions.add(
                    new FunctionDefinition(
                            name,
                            optionalText(functionJson, DESCRIPTION, null),
                            deserializeParameters(functionJson, where),
                            optionalText(functionJson, RETURN_TYPE, null),
                            deserializeNodes(functionJson, where),
                            deserializeFlow(functionJson, where)));
        }
        List<ViewDefinition> views = new ArrayList<>();
        for (JsonNode viewJson : arrayElements(node, VIEWS, "graph")) {
            views.add(deserializeView(viewJson));
        }
        return new NodeGraph(version, packageName, handlers, filters, functions, views);
    }

    private EventHandler deserializeHandler(JsonNode json) {
        String name = requiredText(json, NAME, "handler");
        String where = "handler '" + name + "'";
        String event = requiredText(json, EVENT, where);
        Permissions permissions = null;
        JsonNode permissionsJson = json.get(PERMISSIONS);
        if (permissionsJson != null && !permissionsJson.isNull()) {
            List<String> allowed = new ArrayList<>();
            for (JsonNode player : arrayElements(permissionsJson, ALLOWED_PLAYERS, where)) {
                allowed.add(player.asText());
            }
            permissions =
                    new Permissions(
                            permissionsJson.path(HOST_ONLY).asBoolean(false),
                            optionalText(permissionsJson, PLAYER_PARAM, null),
                            allowed);
        }
        return new EventHandler(
                name,
                event,
                permissions,
                deserializeParameters(json, where),
                deserializeNodes(json, where),
                deserializeFlow(json, where));
    }

    private List<Parameter> deserializeParameters(JsonNode json, String where) {
        List<Parameter> parameters = new ArrayList<>();
        for (JsonNode parameterJson : arrayElements(json, PARAMETERS, where)) {
            parameters.add(
                    new Parameter(
                            requiredText(parameterJson, NAME, where + " parameter"),
                            requiredText(parameterJson, TYPE, where + " parameter")));
        }
        return parameters;
    }

    private List<Node> deserializeNodes(JsonNode json, String where) {
        List<Node> nodes = new ArrayList<>();
        for (JsonNode nodeJson : arrayElements(json, NODES, where)) {
            String id = requiredText(nodeJson, ID, where + " node");
            String nodeWhere = where + ", node '" + id + "'";
            String type = requiredText(nodeJson, TYPE, nodeWhere);
            Map<String, InputValue> inputs = new LinkedHashMap<>();
            JsonNode inputsJson = nodeJson.get(INPUTS);
            if (inputsJson != null && !inputsJson.isNull()) {
                if (!inputsJson.isObject()) {
                    throw new GraphParseException(nodeWhere + ": 'inputs' must be an object.");
                }
                Iterator<Map.Entry<String, JsonNode>> fields = inputsJson.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    inputs.put(
                            field.getKey(),
                            deserializeInput(
                                    field.getValue(),
                                    false,
                                    nodeWhere + ", input '" + field.getKey() + "'"));
                }
            }
            nodes.add(new Node(id, type, inputs));
        }
        return nodes;
    }

    private List<FlowEdge> deserializeFlow(JsonNode json, String where) {
        List<FlowEdge> flow = new ArrayList<>();
        for (JsonNode edgeJson : arrayElements(json, FLOW, where)) {
            Map<String, String> metadata = new LinkedHashMap<>();
            JsonNode metadataJson = edgeJson.get(METADATA);
            if (metadataJson != null && metadataJson.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = metadataJson.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    metadata.put(field.getKey(), field.getValue().asText());
                }
            }
            flow.add(
                    new FlowEdge(
                            requiredText(edgeJson, FROM, where + " flow edge"),
                            requiredText(edgeJson, TO, where + " flow edge"),
                            optionalText(edgeJson, LABEL, null),
                            optionalText(edgeJson, CONDITION, null),
                            metadata));
        }
        return flow;
    }

    private ViewDefinition deserializeView(JsonNode json) {
        String name = requiredText(json, NAME, "view");
        String where = "view '" + name + "'";
        String opName = requiredText(json, OP, where);
        ViewOperation op = ViewOperation.fromName(opName);
        if (op == null) {
            throw new GraphParseException(where + ": unknown operation '" + opName + "'.");
        }
        return new ViewDefinition(
                name, requiredText(json, PATH, where), op, optionalText(json, FIELD, null));
    }

    /**
     * Converts one input. Strings carrying a known reference prefix are references unless they
     * sit inside a {@code constant} wrapper.
     */
    private InputValue deserializeInput(JsonNode json, boolean constant, String where) {
        if (json == null || json.isNull()) {
            return LiteralValue.NULL;
        }
        if (json.isTextual()) {
            String text = json.asText();
            if (!constant && ReferenceValue.looksLikeReference(text)) {
                return parseReference(text, where);
            }
            return LiteralValue.of(text);
        }
        if (json.isBoolean()) {
            return LiteralValue.of(json.booleanValue());
        }
        if (json.isIntegralNumber()) {
            if (!json.canConvertToLong()) {
                throw new GraphParseException(where + ": integer " + json + " is out of range.");
            }
            return LiteralValue.of(json.longValue());
        }
        if (json.isNumber()) {
            return LiteralValue.of(json.doubleValue());
        }
        if (json.isArray()) {
            List<InputValue> elements = new ArrayList<>();
            for (JsonNode element : json) {
                elements.add(deserializeInput(element, constant, where));
            }
            return new ListValue(elements);
        }
        if (json.isObject()) {
            if (!constant && json.size() == 1 && json.has(SOURCE)) {
                JsonNode source = json.get(SOURCE);
                if (!source.isTextual()) {
                    throw new GraphParseException(where + ": 'source' must be a string.");
                }
                return parseReference(source.asText(), where);
            }
            if (!constant && json.size() == 1 && json.has(CONSTANT)) {
                return deserializeInput(json.get(CONSTANT), true, where);
            }
            Map<String, InputValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), deserializeInput(field.getValue(), constant, where));
            }
            return new MapValue(entries);
        }
        throw new GraphParseException(where + ": unsupported value " + json + ".");
    }

    private static ReferenceValue parseReference(String text, String where) {
        try {
            return ReferenceValue.parse(text);
        } catch (IllegalArgumentException e) {
            throw new GraphParseException(where + ": " + e.getMessage(), e);
        }
    }

    // ==================== Helpers ====================

    private static String requiredText(JsonNode json, String field, String where) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull() || !value.isValueNode() || value.asText().isEmpty()) {
            throw new GraphParseException(where + ": missing mandatory field '" + field + "'.");
        }
        return value.asText();
    }

    @Nullable
    private static String optionalText(JsonNode json, String field, @Nullable String fallback) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return fallback;
        }
        return value.asText();
    }

    private static List<JsonNode> arrayElements(JsonNode json, String field, String where) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            return Collections.emptyList();
        }
        if (!value.isArray()) {
            throw new GraphParseException(where + ": '" + field + "' must be an array.");
        }
        List<JsonNode> elements = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            if (!element.isObject() && !ALLOWED_PLAYERS.equals(field)) {
                throw new GraphParseException(
                        where + ": elements of '" + field + "' must be objects.");
            }
            elements.add(element);
        }
        return elements;
    }
}

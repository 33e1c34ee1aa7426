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

import org.statesync.logicgen.utils.json.JsonSerdeUtils;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameGraph;

/** Tests for {@link NodeGraphJsonSerde}. */
public class NodeGraphJsonSerdeTest {

    /** Written in the serializer's field order, so it reads back and prints unchanged. */
    private static final String GRAPH_JSON =
            "{'version':'2','package':'com.example.game','handlers':[{'name':'OnScore',"
                    + "'event':'score','permissions':{'hostOnly':false,'playerParam':'playerId',"
                    + "'allowedPlayers':['p1']},'parameters':[{'name':'playerId','type':'string'},"
                    + "{'name':'points','type':'integer'}],'nodes':[{'id':'add','type':'Add',"
                    + "'inputs':{'a':'param:points','b':2}},{'id':'label','type':'Constant',"
                    + "'inputs':{'value':{'constant':'param:points'}}},{'id':'send',"
                    + "'type':'EmitToAll','inputs':{'eventType':'scored','payload':"
                    + "{'total':'node:add:result','tags':['a',1.5,true,null]}}}],"
                    + "'flow':[{'from':'start','to':'add'},{'from':'add','to':'label'},"
                    + "{'from':'label','to':'send','label':'next','condition':'always',"
                    + "'metadata':{'color':'red'}}]}],'filters':[{'name':'hide',"
                    + "'description':'Hides scores.','parameters':[],'nodes':[],'flow':[]}],"
                    + "'functions':[{'name':'bonus','returnType':'integer','parameters':[],"
                    + "'nodes':[],'flow':[]}],'views':[{'name':'total','path':'players',"
                    + "'op':'sum','field':'score'}]}";

    @Test
    public void testDeserialize() throws Exception {
        NodeGraph graph = read(json(GRAPH_JSON));

        EventHandler handler = graph.getHandlers().get(0);
        assertThat(handler.getPermissions())
                .isEqualTo(new Permissions(false, "playerId", Collections.singletonList("p1")));
        Node add = handler.getNodes().get(0);
        assertThat(add.getInput("a")).isInstanceOf(ReferenceValue.class);
        assertThat(add.getInput("b")).isEqualTo(LiteralValue.of(2L));
        assertThat(handler.getNodes().get(1).getInput("value"))
                .isEqualTo(LiteralValue.of("param:points"));
        assertThat(handler.getNodes().get(2).getInput("payload")).isInstanceOf(MapValue.class);
        FlowEdge last = handler.getFlow().get(2);
        assertThat(last.getLabel()).isEqualTo("next");
        assertThat(last.getCondition()).isEqualTo("always");
        assertThat(last.getMetadata()).containsEntry("color", "red");
        assertThat(graph.getFilters().get(0).getDescription()).isEqualTo("Hides scores.");
        assertThat(graph.getFunctions().get(0).getReturnType()).isEqualTo("integer");
        assertThat(graph.getViews().get(0).getOperation()).isEqualTo(ViewOperation.SUM);
    }

    @Test
    public void testSerializeWritesTheSameDocument() throws Exception {
        NodeGraph graph = read(json(GRAPH_JSON));

        assertThat(write(graph)).isEqualTo(json(GRAPH_JSON));
    }

    @Test
    public void testHandlerWithoutPermissions() throws Exception {
        String json =
                json(
                        "{'version':'1','package':'','handlers':[{'name':'OnPing',"
                                + "'event':'ping','parameters':[],'nodes':[],'flow':[]}],"
                                + "'filters':[],'functions':[]}");

        NodeGraph graph = read(json);

        assertThat(graph.getHandlers().get(0).getPermissions()).isSameAs(Permissions.NONE);
        assertThat(write(graph)).isEqualTo(json);
    }

    @Test
    public void testGameGraphSurvivesSerialization() throws Exception {
        String first = write(gameGraph());
        NodeGraph copy = read(first);

        assertThat(write(copy)).isEqualTo(first);
        assertThat(copy.getHandlers().get(2).getPermissions().isHostOnly()).isTrue();
        assertThat(copy.getHandlers().get(1).getNodes())
                .isEqualTo(gameGraph().getHandlers().get(1).getNodes());
    }

    private static String json(String singleQuoted) {
        return singleQuoted.replace('\'', '"');
    }

    private static NodeGraph read(String json) throws Exception {
        return JsonSerdeUtils.readValue(
                json.getBytes(StandardCharsets.UTF_8), NodeGraphJsonSerde.INSTANCE);
    }

    private static String write(NodeGraph graph) {
        return new String(
                JsonSerdeUtils.writeValueAsBytes(graph, NodeGraphJsonSerde.INSTANCE),
                StandardCharsets.UTF_8);
    }
}

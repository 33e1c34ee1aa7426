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

package org.statesync.logicgen.codegen.testutils;

import org.statesync.logicgen.codegen.compiler.GraphLoader;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.schema.SchemaDefinition;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/** Helpers to build graphs and schemas in tests. */
public final class GraphTestUtils {

    public static final String GAME_GRAPH = "graphs/game-logic.json";
    public static final String GAME_SCHEMA = "graphs/game-schema.json";

    private GraphTestUtils() {}

    /** Parses a graph written with single quotes instead of double quotes. */
    public static NodeGraph graph(String singleQuotedJson) {
        return GraphLoader.parseGraph(json(singleQuotedJson));
    }

    public static SchemaDefinition schema(String singleQuotedJson) {
        return GraphLoader.parseSchema(json(singleQuotedJson));
    }

    /** A graph with one handler named {@code OnTest} for the {@code test} event. */
    public static NodeGraph handler(String parameters, String nodes, String flow) {
        return graph(
                "{'version': '1', 'package': 'com.example.game', 'handlers': [{"
                        + "'name': 'OnTest', 'event': 'test', "
                        + "'parameters': ["
                        + parameters
                        + "], 'nodes': ["
                        + nodes
                        + "], 'flow': ["
                        + flow
                        + "]}]}");
    }

    public static NodeGraph gameGraph() {
        return GraphLoader.parseGraph(resource(GAME_GRAPH));
    }

    public static SchemaDefinition gameSchema() {
        return GraphLoader.parseSchema(resource(GAME_SCHEMA));
    }

    public static byte[] resource(String name) {
        try (InputStream in = GraphTestUtils.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + name);
            }
            byte[] buffer = new byte[8192];
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            int read;
            while ((read = in.read(buffer)) != -1) {
                out.write(buffer, 0, read);
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] json(String singleQuoted) {
        return singleQuoted.replace('\'', '"').getBytes(StandardCharsets.UTF_8);
    }
}

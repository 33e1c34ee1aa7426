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

package org.statesync.logicgen.codegen.compiler;

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.exception.GraphParseException;
import org.statesync.logicgen.codegen.exception.SchemaParseException;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.graph.NodeGraphJsonSerde;
import org.statesync.logicgen.codegen.schema.SchemaDefinition;
import org.statesync.logicgen.codegen.schema.SchemaJsonSerde;
import org.statesync.logicgen.utils.json.JsonSerdeUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/** Reads graph and schema documents. All failures surface as parse exceptions. */
@PublicEvolving
public final class GraphLoader {

    private GraphLoader() {}

    public static NodeGraph loadGraph(Path file) {
        return parseGraph(read(file, true));
    }

    public static NodeGraph parseGraph(byte[] json) {
        try {
            return JsonSerdeUtils.readValue(json, NodeGraphJsonSerde.INSTANCE);
        } catch (IOException e) {
            throw new GraphParseException("Malformed graph JSON: " + e.getMessage(), e);
        }
    }

    public static SchemaDefinition loadSchema(Path file) {
        return parseSchema(read(file, false));
    }

    public static SchemaDefinition parseSchema(byte[] json) {
        try {
            return JsonSerdeUtils.readValue(json, SchemaJsonSerde.INSTANCE);
        } catch (IOException e) {
            throw new SchemaParseException("Malformed schema JSON: " + e.getMessage(), e);
        }
    }

    private static byte[] read(Path file, boolean graph) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            String message = "Could not read " + (graph ? "graph" : "schema") + " file " + file;
            if (graph) {
                throw new GraphParseException(message, e);
            }
            throw new SchemaParseException(message, e);
        }
    }
}

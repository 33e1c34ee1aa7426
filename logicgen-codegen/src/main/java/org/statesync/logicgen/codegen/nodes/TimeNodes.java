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

import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/** Wall clock time in Unix seconds. */
final class TimeNodes {

    private static final String CATEGORY = "time";
    private static final String NOW_SECONDS = "System.currentTimeMillis() / 1000L";

    private TimeNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("GetCurrentTime")
                        .category(CATEGORY)
                        .description("The current Unix timestamp in seconds.")
                        .output("timestamp", "int64")
                        .emitter(TimeNodes::emitGetCurrentTime)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("TimeSince")
                        .category(CATEGORY)
                        .description("Seconds elapsed since a Unix timestamp.")
                        .input(required("startTime", "int64"))
                        .output("seconds", "int64")
                        .emitter(TimeNodes::emitTimeSince)
                        .build());
    }

    private static void emitGetCurrentTime(EmitContext context, Node node) {
        context.declareOutput(node, "timestamp", "long", NOW_SECONDS);
    }

    private static void emitTimeSince(EmitContext context, Node node) {
        String start = Coercions.toLong(context.resolveInput(node, "startTime"));
        context.declareOutput(
                node, "seconds", "long", NOW_SECONDS + " - " + NodeSupport.paren(start));
    }
}

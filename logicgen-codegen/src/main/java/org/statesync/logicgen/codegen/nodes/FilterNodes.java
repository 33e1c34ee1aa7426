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
import org.statesync.logicgen.codegen.generator.Names;
import org.statesync.logicgen.codegen.graph.FilterDefinition;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

import java.util.List;

import static org.statesync.logicgen.codegen.registry.PortDefinition.optional;
import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/**
 * Per-viewer state filters. Installed filters live in the {@code FILTER_REGISTRY} of the
 * generated class under the key {@code <sessionId>:<viewerId>}; after every change the session
 * receives the composition of the viewer's remaining filters, or {@code null} if none is left.
 */
final class FilterNodes {

    private static final String CATEGORY = "filter";

    private FilterNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("AddFilter")
                        .category(CATEGORY)
                        .description("Installs a filter for a viewer.")
                        .input(required("viewerID", "string"))
                        .input(required("filterID", "string"))
                        .input(required("filterName", "string"))
                        .input(optional("params", "map"))
                        .emitter(FilterNodes::emitAddFilter)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("RemoveFilter")
                        .category(CATEGORY)
                        .description("Removes an installed filter of a viewer.")
                        .input(required("viewerID", "string"))
                        .input(required("filterID", "string"))
                        .output("removed", "bool")
                        .emitter(FilterNodes::emitRemoveFilter)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("HasFilter")
                        .category(CATEGORY)
                        .description("Whether a viewer has a filter installed.")
                        .input(required("viewerID", "string"))
                        .input(required("filterID", "string"))
                        .output("exists", "bool")
                        .emitter(FilterNodes::emitHasFilter)
                        .build());
    }

    private static void emitAddFilter(EmitContext context, Node node) {
        String filterName = context.requireConstantString(node, "filterName");
        FilterDefinition filter = context.getGraph().findFilter(filterName);
        if (filter == null) {
            throw context.error(node, "adds unknown filter '" + filterName + "'");
        }
        List<String> arguments =
                NodeSupport.namedArguments(context, node, "params", filter.getParameters());
        Target target = Target.declare(context, node);
        String instance =
                "new " + Names.filterClass(filterName) + "(" + String.join(", ", arguments) + ")";
        context.code()
                .stmt(
                        Names.FILTER_REGISTRY
                                + ".add("
                                + target.key
                                + ", "
                                + target.filterId
                                + ", "
                                + instance
                                + ")")
                .stmt(target.refresh());
    }

    private static void emitRemoveFilter(EmitContext context, Node node) {
        Target target = Target.declare(context, node);
        String removed =
                context.declareOutput(
                        node,
                        "removed",
                        "boolean",
                        Names.FILTER_REGISTRY
                                + ".remove("
                                + target.key
                                + ", "
                                + target.filterId
                                + ")");
        context.code().beginIf(removed).stmt(target.refresh()).endIf();
    }

    private static void emitHasFilter(EmitContext context, Node node) {
        Target target = Target.declare(context, node);
        context.declareOutput(
                node,
                "exists",
                "boolean",
                Names.FILTER_REGISTRY + ".has(" + target.key + ", " + target.filterId + ")");
    }

    /** The viewer, its registry key and the filter id of one filter node. */
    private static final class Target {
        private final String session;
        private final String viewer;
        private final String key;
        private final String filterId;

        private Target(String session, String viewer, String key, String filterId) {
            this.session = session;
            this.viewer = viewer;
            this.key = key;
            this.filterId = filterId;
        }

        static Target declare(EmitContext context, Node node) {
            String session = context.requireSession(node);
            String viewer = context.newLocal(node.getId() + "_viewer");
            String key = context.newLocal(node.getId() + "_key");
            String viewerId = Coercions.toStringValue(context.resolveInput(node, "viewerID"));
            String filterId = Coercions.toStringValue(context.resolveInput(node, "filterID"));
            context.code()
                    .declare("String", viewer, viewerId)
                    .declare("String", key, session + ".getSessionId() + \":\" + " + viewer);
            return new Target(session, viewer, key, filterId);
        }

        /** Pushes the current composition of the viewer's filters to the session. */
        String refresh() {
            return session
                    + ".setFilter("
                    + viewer
                    + ", "
                    + Names.FILTER_REGISTRY
                    + ".getComposed("
                    + key
                    + "))";
        }
    }
}

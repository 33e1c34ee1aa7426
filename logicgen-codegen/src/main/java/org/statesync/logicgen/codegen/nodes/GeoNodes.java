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

/** GPS kinds, backed by the runtime {@code Geo} helpers. Distances are in meters. */
final class GeoNodes {

    private static final String CATEGORY = "geo";
    private static final String GEO = "org.statesync.logicgen.runtime.Geo";

    private GeoNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("GpsDistance")
                        .category(CATEGORY)
                        .description("Great circle distance between two points.")
                        .input(required("lat1", "float64"))
                        .input(required("lng1", "float64"))
                        .input(required("lat2", "float64"))
                        .input(required("lng2", "float64"))
                        .output("distance", "float64")
                        .emitter(GeoNodes::emitGpsDistance)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("GpsMoveToward")
                        .category(CATEGORY)
                        .description("Moves from a point toward another by a distance.")
                        .input(required("fromLat", "float64"))
                        .input(required("fromLng", "float64"))
                        .input(required("toLat", "float64"))
                        .input(required("toLng", "float64"))
                        .input(required("distance", "float64"))
                        .output("newLat", "float64")
                        .output("newLng", "float64")
                        .emitter(GeoNodes::emitGpsMoveToward)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("PointInCircle")
                        .category(CATEGORY)
                        .description("Whether a point lies within a radius of a center.")
                        .input(required("pointLat", "float64"))
                        .input(required("pointLng", "float64"))
                        .input(required("centerLat", "float64"))
                        .input(required("centerLng", "float64"))
                        .input(required("radiusMeters", "float64"))
                        .output("isInside", "bool")
                        .output("distance", "float64")
                        .emitter(GeoNodes::emitPointInCircle)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("PointInPolygon")
                        .category(CATEGORY)
                        .description("Whether a point lies inside a polygon of lat/lng vertices.")
                        .input(required("pointLat", "float64"))
                        .input(required("pointLng", "float64"))
                        .input(required("polygon", "[]GpsCoord"))
                        .output("isInside", "bool")
                        .emitter(GeoNodes::emitPointInPolygon)
                        .build());
    }

    private static void emitGpsDistance(EmitContext context, Node node) {
        context.addImport(GEO);
        String arguments = coordinates(context, node, "lat1", "lng1", "lat2", "lng2");
        context.declareOutput(node, "distance", "double", "Geo.distance(" + arguments + ")");
    }

    private static void emitGpsMoveToward(EmitContext context, Node node) {
        context.addImport(GEO);
        String arguments =
                coordinates(context, node, "fromLat", "fromLng", "toLat", "toLng", "distance");
        String position = context.newLocal(node.getId() + "_position");
        context.code().declare("double[]", position, "Geo.moveToward(" + arguments + ")");
        context.declareOutput(node, "newLat", "double", position + "[0]");
        context.declareOutput(node, "newLng", "double", position + "[1]");
    }

    private static void emitPointInCircle(EmitContext context, Node node) {
        context.addImport(GEO);
        String arguments =
                coordinates(context, node, "pointLat", "pointLng", "centerLat", "centerLng");
        String distance = "Geo.distance(" + arguments + ")";
        distance = context.declareOutput(node, "distance", "double", distance);
        String radius = Coercions.toDouble(context.resolveInput(node, "radiusMeters"));
        context.declareOutput(
                node, "isInside", "boolean", distance + " <= " + NodeSupport.paren(radius));
    }

    private static void emitPointInPolygon(EmitContext context, Node node) {
        context.addImport(GEO);
        String point = coordinates(context, node, "pointLat", "pointLng");
        String polygon = Coercions.toList(context.resolveInput(node, "polygon"));
        context.declareOutput(
                node, "isInside", "boolean", "Geo.pointInPolygon(" + point + ", " + polygon + ")");
    }

    /** The inputs as a comma separated list of doubles. */
    private static String coordinates(EmitContext context, Node node, String... ports) {
        StringBuilder sb = new StringBuilder();
        for (String port : ports) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(Coercions.toDouble(context.resolveInput(node, port)));
        }
        return sb.toString();
    }
}

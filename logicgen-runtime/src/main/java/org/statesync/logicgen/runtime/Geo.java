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

package org.statesync.logicgen.runtime;

import org.statesync.logicgen.annotation.PublicEvolving;

import java.util.List;

/** Spherical geometry used by the geospatial node kinds. Distances are in meters. */
@PublicEvolving
public final class Geo {

    /** Mean earth radius used by all calculations. */
    public static final double EARTH_RADIUS_METERS = 6371000.0;

    private Geo() {}

    /** Great-circle distance by the haversine formula. */
    public static double distance(double lat1, double lng1, double lat2, double lng2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = Math.toRadians(lat2 - lat1);
        double deltaLng = Math.toRadians(lng2 - lng1);
        double a =
                Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
                        + Math.cos(lat1Rad)
                                * Math.cos(lat2Rad)
                                * Math.sin(deltaLng / 2)
                                * Math.sin(deltaLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    /**
     * Moves from one point toward another along the initial bearing.
     *
     * @return {@code [lat, lng]} of the new position
     */
    public static double[] moveToward(
            double fromLat, double fromLng, double toLat, double toLng, double meters) {
        double fromLatRad = Math.toRadians(fromLat);
        double fromLngRad = Math.toRadians(fromLng);
        double toLatRad = Math.toRadians(toLat);
        double dLng = Math.toRadians(toLng) - fromLngRad;
        double x = Math.cos(toLatRad) * Math.sin(dLng);
        double y =
                Math.cos(fromLatRad) * Math.sin(toLatRad)
                        - Math.sin(fromLatRad) * Math.cos(toLatRad) * Math.cos(dLng);
        double bearing = Math.atan2(x, y);
        double angularDist = meters / EARTH_RADIUS_METERS;
        double newLatRad =
                Math.asin(
                        Math.sin(fromLatRad) * Math.cos(angularDist)
                                + Math.cos(fromLatRad)
                                        * Math.sin(angularDist)
                                        * Math.cos(bearing));
        double newLngRad =
                fromLngRad
                        + Math.atan2(
                                Math.sin(bearing) * Math.sin(angularDist) * Math.cos(fromLatRad),
                                Math.cos(angularDist)
                                        - Math.sin(fromLatRad) * Math.sin(newLatRad));
        return new double[] {Math.toDegrees(newLatRad), Math.toDegrees(newLngRad)};
    }

    /** Whether a point lies within {@code radiusMeters} of the center. */
    public static boolean pointInCircle(
            double lat, double lng, double centerLat, double centerLng, double radiusMeters) {
        return distance(lat, lng, centerLat, centerLng) <= radiusMeters;
    }

    /**
     * Ray casting test; the polygon is closed implicitly. Vertices are {@link GeoCoordinate}s or
     * objects with {@code lat} and {@code lng} properties.
     */
    public static boolean pointInPolygon(double lat, double lng, List<?> polygon) {
        int n = polygon.size();
        boolean inside = false;
        for (int i = 0, j = n - 1; i < n; j = i++) {
            Object vi = polygon.get(i);
            Object vj = polygon.get(j);
            double xi = lngOf(vi);
            double yi = latOf(vi);
            double xj = lngOf(vj);
            double yj = latOf(vj);
            if ((yi > lat) != (yj > lat) && lng < (xj - xi) * (lat - yi) / (yj - yi) + xi) {
                inside = !inside;
            }
        }
        return inside;
    }

    private static double latOf(Object vertex) {
        if (vertex instanceof GeoCoordinate) {
            return ((GeoCoordinate) vertex).getLat();
        }
        return Values.toDouble(Values.property(vertex, "lat"));
    }

    private static double lngOf(Object vertex) {
        if (vertex instanceof GeoCoordinate) {
            return ((GeoCoordinate) vertex).getLng();
        }
        return Values.toDouble(Values.property(vertex, "lng"));
    }
}

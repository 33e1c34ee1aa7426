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

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/** Tests for {@link Geo}. */
public class GeoTest {

    @Test
    public void testDistance() {
        assertThat(Geo.distance(47.0, 19.0, 47.0, 19.0)).isEqualTo(0.0);
        // one degree of latitude is roughly 111.2 km
        assertThat(Geo.distance(0.0, 0.0, 1.0, 0.0)).isCloseTo(111195.0, within(10.0));
    }

    @Test
    public void testMoveToward() {
        double[] moved = Geo.moveToward(0.0, 0.0, 1.0, 0.0, 1000.0);
        assertThat(Geo.distance(0.0, 0.0, moved[0], moved[1])).isCloseTo(1000.0, within(0.5));
        assertThat(moved[1]).isCloseTo(0.0, within(1e-9));
    }

    @Test
    public void testPointInCircle() {
        assertThat(Geo.pointInCircle(0.0, 0.0005, 0.0, 0.0, 100.0)).isTrue();
        assertThat(Geo.pointInCircle(0.0, 0.01, 0.0, 0.0, 100.0)).isFalse();
    }

    @Test
    public void testPointInPolygon() {
        List<Coord> square =
                Arrays.asList(
                        new Coord(0.0, 0.0),
                        new Coord(0.0, 1.0),
                        new Coord(1.0, 1.0),
                        new Coord(1.0, 0.0));
        assertThat(Geo.pointInPolygon(0.5, 0.5, square)).isTrue();
        assertThat(Geo.pointInPolygon(1.5, 0.5, square)).isFalse();
        assertThat(Geo.pointInPolygon(0.5, 0.5, Arrays.<Coord>asList())).isFalse();
    }

    @Test
    public void testPointInPolygonWithMapVertices() {
        List<Object> triangle =
                Values.listOf(
                        Values.mapOf("lat", 0.0, "lng", 0.0),
                        Values.mapOf("lat", 2.0, "lng", 0.0),
                        Values.mapOf("lat", 0.0, "lng", 2.0));
        assertThat(Geo.pointInPolygon(0.5, 0.5, triangle)).isTrue();
        assertThat(Geo.pointInPolygon(1.5, 1.5, triangle)).isFalse();
    }

    private static final class Coord implements GeoCoordinate {
        private final double lat;
        private final double lng;

        private Coord(double lat, double lng) {
            this.lat = lat;
            this.lng = lng;
        }

        @Override
        public double getLat() {
            return lat;
        }

        @Override
        public double getLng() {
            return lng;
        }
    }
}

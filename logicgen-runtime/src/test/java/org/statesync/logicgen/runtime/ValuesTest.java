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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Values}. */
public class ValuesTest {

    @Test
    public void testMapOfKeepsOrder() {
        Map<String, Object> map = Values.mapOf("b", 1, "a", "x");
        assertThat(map.keySet()).containsExactly("b", "a");
        assertThat(map).containsEntry("a", "x");
        assertThatThrownBy(() -> Values.mapOf("a"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testListOfIsMutable() {
        assertThat(Values.listOf(1, 2)).containsExactly(1, 2);
        Values.listOf().add("x");
    }

    @Test
    public void testEmptinessAndSize() {
        assertThat(Values.isEmpty(null)).isTrue();
        assertThat(Values.isEmpty("")).isTrue();
        assertThat(Values.isEmpty(Collections.emptyList())).isTrue();
        assertThat(Values.isEmpty(new int[0])).isTrue();
        assertThat(Values.isEmpty(0)).isFalse();
        assertThat(Values.sizeOf("abc")).isEqualTo(3);
        assertThat(Values.sizeOf(new String[] {"a", "b"})).isEqualTo(2);
        assertThat(Values.sizeOf(null)).isZero();
        assertThatThrownBy(() -> Values.sizeOf(42)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testAsList() {
        List<Object> list = Values.listOf("a");
        assertThat(Values.asList(list)).isSameAs(list);
        assertThat(Values.asList(new int[] {1, 2})).containsExactly(1, 2);
        assertThat(Values.asList(null)).isEmpty();
        assertThatThrownBy(() -> Values.asList("x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testPropertyOfMapAndBean() {
        assertThat(Values.property(Values.mapOf("score", 3L), "score")).isEqualTo(3L);
        assertThat(Values.property(new Player("p1", true), "id")).isEqualTo("p1");
        assertThat(Values.property(new Player("p1", true), "ready")).isEqualTo(true);
        assertThatThrownBy(() -> Values.property(new Player("p1", true), "missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing");
        assertThatThrownBy(() -> Values.property(null, "id"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testNumericConversionAndOrdering() {
        assertThat(Values.toDouble(3)).isEqualTo(3.0);
        assertThat(Values.toDouble("2.5")).isEqualTo(2.5);
        assertThat(Values.toLong(7.9)).isEqualTo(7L);
        assertThat(Values.compare(1, 2.5)).isNegative();
        assertThat(Values.compare("b", "a")).isPositive();
        assertThat(Values.looseEquals(1, 1L)).isTrue();
        assertThat(Values.looseEquals("1", 1)).isFalse();
        assertThatThrownBy(() -> Values.toDouble(true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testSetPropertyConvertsNumbers() {
        Map<String, Object> map = Values.mapOf();
        Values.setProperty(map, "hp", 10L);
        assertThat(map).containsEntry("hp", 10L);

        Counter counter = new Counter();
        Values.setProperty(counter, "count", 5L);
        assertThat(counter.getCount()).isEqualTo(5);
        assertThatThrownBy(() -> Values.setProperty(counter, "missing", 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /** Mutable bean used for property writes. */
    public static class Counter {
        private int count;

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }
    }

    /** Bean used for property access. */
    public static class Player {
        private final String id;
        private final boolean ready;

        Player(String id, boolean ready) {
            this.id = id;
            this.ready = ready;
        }

        public String getId() {
            return id;
        }

        public boolean isReady() {
            return ready;
        }
    }
}

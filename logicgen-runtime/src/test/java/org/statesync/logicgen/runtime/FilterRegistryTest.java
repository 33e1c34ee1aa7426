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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link FilterRegistry}. */
public class FilterRegistryTest {

    private FilterRegistry<List<String>> registry;

    @BeforeEach
    public void setUp() {
        registry = new FilterRegistry<>();
    }

    @Test
    public void testAddHasRemove() {
        registry.add("alice", "hide", new AppendFilter("h"));
        assertThat(registry.has("alice", "hide")).isTrue();
        assertThat(registry.has("bob", "hide")).isFalse();

        assertThat(registry.remove("alice", "hide")).isTrue();
        assertThat(registry.remove("alice", "hide")).isFalse();
        assertThat(registry.has("alice", "hide")).isFalse();
        assertThat(registry.getComposed("alice")).isNull();
    }

    @Test
    public void testComposedFilterAppliesInInsertionOrder() {
        registry.add("alice", "first", new AppendFilter("1"));
        registry.add("alice", "second", new AppendFilter("2"));
        registry.add("bob", "other", new AppendFilter("x"));

        StateFilter<List<String>> composed = registry.getComposed("alice");
        assertThat(composed).isNotNull();
        assertThat(composed.apply(new ArrayList<>())).containsExactly("1", "2");

        // replacing keeps the original position
        registry.add("alice", "first", new AppendFilter("one"));
        assertThat(registry.getComposed("alice").apply(new ArrayList<>()))
                .containsExactly("one", "2");
    }

    @Test
    public void testComposedFilterIsSnapshot() {
        registry.add("alice", "first", new AppendFilter("1"));
        StateFilter<List<String>> composed = registry.getComposed("alice");
        registry.add("alice", "second", new AppendFilter("2"));
        registry.clear("alice");

        assertThat(composed.apply(new ArrayList<>())).containsExactly("1");
        assertThat(registry.getComposed("alice")).isNull();
    }

    @Test
    public void testConcurrentAccess() throws Exception {
        int threads = 8;
        int perThread = 200;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                final String viewer = "viewer-" + t;
                executor.submit(
                        () -> {
                            start.await();
                            for (int i = 0; i < perThread; i++) {
                                registry.add(viewer, "f" + i, new AppendFilter("v"));
                                registry.getComposed(viewer);
                            }
                            return null;
                        });
            }
            start.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(30, TimeUnit.SECONDS)).isTrue();
        } finally {
            executor.shutdownNow();
        }

        for (int t = 0; t < threads; t++) {
            assertThat(registry.getComposed("viewer-" + t).apply(new ArrayList<>()))
                    .hasSize(perThread);
        }
    }

    private static final class AppendFilter implements StateFilter<List<String>> {
        private final String value;

        private AppendFilter(String value) {
            this.value = value;
        }

        @Override
        public List<String> apply(List<String> state) {
            state.add(value);
            return state;
        }
    }
}

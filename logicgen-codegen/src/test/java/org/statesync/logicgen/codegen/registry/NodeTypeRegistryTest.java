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

package org.statesync.logicgen.codegen.registry;

import org.statesync.logicgen.codegen.exception.DuplicateNodeTypeException;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/** Tests for {@link NodeTypeRegistry}. */
public class NodeTypeRegistryTest {

    @Test
    public void testTiers() {
        NodeTypeRegistry registry = NodeTypeRegistry.createDefault();
        registry.register(custom("Sparkle"));

        assertThat(registry.tierOf("If")).isEqualTo(RegistryTier.BUILT_IN);
        assertThat(registry.tierOf("SetField")).isEqualTo(RegistryTier.CORE);
        assertThat(registry.tierOf("Sparkle")).isEqualTo(RegistryTier.CUSTOM);
        assertThat(registry.tierOf("Teleport")).isNull();
        assertThat(registry.lookup("Teleport")).isNull();
        assertThat(registry.isRegistered("Sparkle")).isTrue();

        List<String> types = registry.listTypes();
        assertThat(types.indexOf("If")).isLessThan(types.indexOf("SetField"));
        assertThat(types.get(types.size() - 1)).isEqualTo("Sparkle");
    }

    @Test
    public void testBareRegistryHoldsOnlyBuiltins() {
        NodeTypeRegistry registry = new NodeTypeRegistry();

        assertThat(registry.listTypes()).hasSize(BuiltinNodeKind.values().length);
        assertThat(registry.isRegistered("SetField")).isFalse();
        assertThat(registry.lookup("Wait").getCategory()).isEqualTo("timing");
    }

    @Test
    public void testDuplicatesAreRejectedAcrossTiers() {
        NodeTypeRegistry registry = NodeTypeRegistry.createDefault();

        assertThatThrownBy(() -> registry.register(custom("If")))
                .isInstanceOf(DuplicateNodeTypeException.class)
                .hasMessage("Node type 'If' is already registered in the BUILT_IN tier.");
        assertThatThrownBy(() -> registry.register(custom("Add")))
                .isInstanceOf(DuplicateNodeTypeException.class)
                .hasMessageContaining("CORE");

        registry.register(custom("Sparkle"));
        assertThatThrownBy(() -> registry.register(custom("Sparkle")))
                .isInstanceOf(DuplicateNodeTypeException.class);
        assertThatThrownBy(() -> registry.registerCore(custom("Sparkle")))
                .isInstanceOf(DuplicateNodeTypeException.class);
    }

    @Test
    public void testClearCustom() {
        NodeTypeRegistry registry = NodeTypeRegistry.createDefault();
        int coreSize = registry.listTypes().size();
        registry.register(custom("Sparkle"));

        registry.clearCustom();

        assertThat(registry.isRegistered("Sparkle")).isFalse();
        assertThat(registry.listTypes()).hasSize(coreSize);
        registry.register(custom("Sparkle"));
        assertThat(registry.isRegistered("Sparkle")).isTrue();
    }

    @Test
    public void testListByCategory() {
        NodeTypeRegistry registry = NodeTypeRegistry.createDefault();
        registry.register(custom("Sparkle"));

        assertThat(registry.listByCategory().get("flow"))
                .contains("If", "ForEach", "While", "Return");
        assertThat(registry.listByCategory().get("math")).contains("Add", "Divide", "Clamp");
        assertThat(registry.listByCategory().get("effects")).containsExactly("Sparkle");
    }

    @Test
    public void testConcurrentRegistration() throws Exception {
        NodeTypeRegistry registry = NodeTypeRegistry.createDefault();
        int threads = 8;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(
                        executor.submit(
                                () -> {
                                    start.await();
                                    for (int i = 0; i < perThread; i++) {
                                        registry.register(custom("Kind_" + thread + "_" + i));
                                        // every thread also races for the same name
                                        try {
                                            registry.register(custom("Shared_" + i));
                                        } catch (DuplicateNodeTypeException e) {
                                            assertThat(e).hasMessageContaining("Shared_" + i);
                                        }
                                        assertThat(registry.lookup("Add")).isNotNull();
                                    }
                                    return null;
                                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(registry.listByCategory().get("effects"))
                .hasSize(threads * perThread + perThread);
    }

    private static NodeDefinition custom(String type) {
        return NodeDefinition.newBuilder(type)
                .category("effects")
                .description("Test kind " + type + ".")
                .input(required("target", "string"))
                .build();
    }
}

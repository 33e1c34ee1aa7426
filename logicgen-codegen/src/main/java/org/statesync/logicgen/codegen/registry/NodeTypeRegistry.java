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

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.exception.DuplicateNodeTypeException;
import org.statesync.logicgen.codegen.nodes.CoreNodeCatalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static org.statesync.logicgen.utils.Preconditions.checkArgument;
import static org.statesync.logicgen.utils.Preconditions.checkNotNull;
import static org.statesync.logicgen.utils.concurrent.LockUtils.inReadLock;
import static org.statesync.logicgen.utils.concurrent.LockUtils.inWriteLock;

/**
 * The node kinds known to a compilation, in three tiers consulted in the order built-in, core,
 * custom. A kind name is unique across all tiers.
 *
 * <p>The registry is an explicit value passed to the validator and the generator. Several
 * compilations may share one instance while custom kinds are registered concurrently.
 */
@PublicEvolving
@ThreadSafe
public class NodeTypeRegistry {

    private static final Logger LOG = LoggerFactory.getLogger(NodeTypeRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @GuardedBy("lock")
    private final Map<RegistryTier, Map<String, NodeDefinition>> tiers =
            new EnumMap<>(RegistryTier.class);

    /** Creates a registry holding only the built-in kinds. */
    public NodeTypeRegistry() {
        for (RegistryTier tier : RegistryTier.values()) {
            tiers.put(tier, new LinkedHashMap<>());
        }
        for (BuiltinNodeKind kind : BuiltinNodeKind.values()) {
            tiers.get(RegistryTier.BUILT_IN).put(kind.getTypeName(), kind.createDefinition());
        }
    }

    /** Creates a registry seeded with the built-in kinds and the core catalog. */
    public static NodeTypeRegistry createDefault() {
        NodeTypeRegistry registry = new NodeTypeRegistry();
        CoreNodeCatalog.registerAll(registry);
        return registry;
    }

    /**
     * Registers a custom kind.
     *
     * @throws DuplicateNodeTypeException if a kind of that name exists in any tier
     */
    public void register(NodeDefinition definition) {
        registerInTier(RegistryTier.CUSTOM, definition);
    }

    /** Registers a kind of the core catalog. */
    public void registerCore(NodeDefinition definition) {
        registerInTier(RegistryTier.CORE, definition);
    }

    private void registerInTier(RegistryTier tier, NodeDefinition definition) {
        checkNotNull(definition, "definition must not be null");
        String type = definition.getType();
        checkArgument(!type.trim().isEmpty(), "node type must not be empty");
        inWriteLock(
                lock,
                () -> {
                    RegistryTier existing = findTier(type);
                    if (existing != null) {
                        throw new DuplicateNodeTypeException(
                                "Node type '"
                                        + type
                                        + "' is already registered in the "
                                        + existing
                                        + " tier.");
                    }
                    tiers.get(tier).put(type, definition);
                });
        LOG.debug("Registered node type {} in tier {}.", type, tier);
    }

    /** The definition of a kind, or {@code null} if no tier knows it. */
    @Nullable
    public NodeDefinition lookup(String type) {
        return inReadLock(
                lock,
                () -> {
                    for (Map<String, NodeDefinition> definitions : tiers.values()) {
                        NodeDefinition definition = definitions.get(type);
                        if (definition != null) {
                            return definition;
                        }
                    }
                    return null;
                });
    }

    public boolean isRegistered(String type) {
        return lookup(type) != null;
    }

    /** The tier holding a kind, or {@code null}. */
    @Nullable
    public RegistryTier tierOf(String type) {
        return inReadLock(
                lock,
                () -> {
                    return findTier(type);
                });
    }

    /** All kind names, tier by tier in registration order. */
    public List<String> listTypes() {
        return inReadLock(
                lock,
                () -> {
                    List<String> types = new ArrayList<>();
                    for (Map<String, NodeDefinition> definitions : tiers.values()) {
                        types.addAll(definitions.keySet());
                    }
                    return types;
                });
    }

    /** Kind names grouped by category; categories and kinds in registration order. */
    public Map<String, List<String>> listByCategory() {
        return inReadLock(
                lock,
                () -> {
                    Map<String, List<String>> byCategory = new LinkedHashMap<>();
                    for (Map<String, NodeDefinition> definitions : tiers.values()) {
                        for (NodeDefinition definition : definitions.values()) {
                            byCategory
                                    .computeIfAbsent(
                                            definition.getCategory(), c -> new ArrayList<>())
                                    .add(definition.getType());
                        }
                    }
                    return byCategory;
                });
    }

    /** Removes every custom kind. Built-in and core kinds stay. */
    public void clearCustom() {
        inWriteLock(
                lock,
                () -> {
                    tiers.get(RegistryTier.CUSTOM).clear();
                });
    }

    @GuardedBy("lock")
    @Nullable
    private RegistryTier findTier(String type) {
        for (Map.Entry<RegistryTier, Map<String, NodeDefinition>> entry : tiers.entrySet()) {
            if (entry.getValue().containsKey(type)) {
                return entry.getKey();
            }
        }
        return null;
    }
}

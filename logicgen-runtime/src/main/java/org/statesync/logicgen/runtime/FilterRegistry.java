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

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;
import static org.statesync.logicgen.utils.concurrent.LockUtils.inReadLock;
import static org.statesync.logicgen.utils.concurrent.LockUtils.inWriteLock;

/**
 * Active view filters per viewer. Generated handlers add and remove filters while the session is
 * concurrently read for state broadcasts, so every access goes through one read/write lock.
 *
 * @param <S> the root state type
 */
@PublicEvolving
@ThreadSafe
public class FilterRegistry<S> {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @GuardedBy("lock")
    private final Map<String, Map<String, StateFilter<S>>> filters = new HashMap<>();

    /** Adds or replaces the filter registered under {@code filterId} for the viewer. */
    public void add(String viewerId, String filterId, StateFilter<S> filter) {
        checkNotNull(viewerId, "viewerId must not be null");
        checkNotNull(filterId, "filterId must not be null");
        checkNotNull(filter, "filter must not be null");
        inWriteLock(
                lock,
                () -> {
                    filters.computeIfAbsent(viewerId, k -> new LinkedHashMap<>())
                            .put(filterId, filter);
                });
    }

    /**
     * Removes a filter.
     *
     * @return {@code true} if the filter was registered
     */
    public boolean remove(String viewerId, String filterId) {
        return inWriteLock(
                lock,
                () -> {
                    Map<String, StateFilter<S>> viewerFilters = filters.get(viewerId);
                    if (viewerFilters == null) {
                        return false;
                    }
                    boolean removed = viewerFilters.remove(filterId) != null;
                    if (viewerFilters.isEmpty()) {
                        filters.remove(viewerId);
                    }
                    return removed;
                });
    }

    public boolean has(String viewerId, String filterId) {
        return inReadLock(
                lock,
                () -> {
                    Map<String, StateFilter<S>> viewerFilters = filters.get(viewerId);
                    return viewerFilters != null && viewerFilters.containsKey(filterId);
                });
    }

    /** Removes every filter of the viewer. */
    public void clear(String viewerId) {
        inWriteLock(
                lock,
                () -> {
                    filters.remove(viewerId);
                });
    }

    /**
     * Returns a filter applying all filters of the viewer in insertion order, or {@code null} when
     * the viewer has none. The returned filter works on a snapshot and is unaffected by later
     * registrations.
     */
    @Nullable
    public StateFilter<S> getComposed(String viewerId) {
        List<StateFilter<S>> snapshot =
                inReadLock(
                        lock,
                        () -> {
                            Map<String, StateFilter<S>> viewerFilters = filters.get(viewerId);
                            if (viewerFilters == null || viewerFilters.isEmpty()) {
                                return Collections.<StateFilter<S>>emptyList();
                            }
                            return new ArrayList<>(viewerFilters.values());
                        });
        if (snapshot.isEmpty()) {
            return null;
        }
        return new ComposedFilter<>(snapshot);
    }

    private static final class ComposedFilter<S> implements StateFilter<S> {

        private final List<StateFilter<S>> chain;

        private ComposedFilter(List<StateFilter<S>> chain) {
            this.chain = chain;
        }

        @Override
        public S apply(S state) {
            S current = state;
            for (StateFilter<S> filter : chain) {
                current = filter.apply(current);
            }
            return current;
        }
    }
}

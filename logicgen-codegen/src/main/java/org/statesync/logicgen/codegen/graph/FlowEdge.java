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

package org.statesync.logicgen.codegen.graph;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/** A directed execution edge between two nodes or the {@code start}/{@code end} sentinels. */
@PublicEvolving
public final class FlowEdge {

    public static final String START = "start";
    public static final String END = "end";

    public static final String LABEL_TRUE = "true";
    public static final String LABEL_FALSE = "false";
    public static final String LABEL_BODY = "body";
    public static final String LABEL_DONE = "done";
    public static final String LABEL_NEXT = "next";

    private final String from;
    private final String to;
    @Nullable private final String label;
    @Nullable private final String condition;
    private final Map<String, String> metadata;

    public FlowEdge(String from, String to) {
        this(from, to, null, null, Collections.<String, String>emptyMap());
    }

    public FlowEdge(String from, String to, @Nullable String label) {
        this(from, to, label, null, Collections.<String, String>emptyMap());
    }

    public FlowEdge(
            String from,
            String to,
            @Nullable String label,
            @Nullable String condition,
            Map<String, String> metadata) {
        this.from = checkNotNull(from, "edge source must not be null");
        this.to = checkNotNull(to, "edge target must not be null");
        this.label = label == null || label.isEmpty() ? null : label;
        this.condition = condition == null || condition.isEmpty() ? null : condition;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }

    @Nullable
    public String getLabel() {
        return label;
    }

    @Nullable
    public String getCondition() {
        return condition;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    /**
     * The label that decides how the edge is followed. Older graphs mark branch edges with
     * {@code condition} instead of {@code label}, so the condition is used when no label is set.
     */
    @Nullable
    public String getEffectiveLabel() {
        return label != null ? label : condition;
    }

    /** Whether the edge is a plain continuation: no label, or the explicit {@code next}. */
    public boolean isContinuation() {
        String effective = getEffectiveLabel();
        return effective == null || LABEL_NEXT.equals(effective);
    }

    public static boolean isSentinel(String id) {
        return START.equals(id) || END.equals(id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FlowEdge that = (FlowEdge) o;
        return from.equals(that.from)
                && to.equals(that.to)
                && Objects.equals(label, that.label)
                && Objects.equals(condition, that.condition)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to, label, condition, metadata);
    }

    @Override
    public String toString() {
        String effective = getEffectiveLabel();
        return from + " -> " + to + (effective == null ? "" : " [" + effective + "]");
    }
}

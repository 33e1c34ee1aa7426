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

import java.util.Objects;

/**
 * A reference to a value that exists at runtime, written as {@code prefix:name} or {@code
 * node:id:port}.
 */
@PublicEvolving
public final class ReferenceValue extends InputValue {

    /** The scope a reference is resolved in. */
    public enum ReferenceKind {
        PARAM("param"),
        NODE("node"),
        VIEW("view"),
        STATE("state"),
        VARIABLE("variable"),
        LOOP("loop");

        private final String prefix;

        ReferenceKind(String prefix) {
            this.prefix = prefix;
        }

        public String getPrefix() {
            return prefix;
        }

        @Nullable
        static ReferenceKind fromPrefix(String prefix) {
            for (ReferenceKind kind : values()) {
                if (kind.prefix.equals(prefix)) {
                    return kind;
                }
            }
            return null;
        }
    }

    private final ReferenceKind referenceKind;
    private final String name;
    @Nullable private final String port;

    private ReferenceValue(ReferenceKind referenceKind, String name, @Nullable String port) {
        this.referenceKind = referenceKind;
        this.name = name;
        this.port = port;
    }

    public static ReferenceValue of(ReferenceKind kind, String name) {
        return new ReferenceValue(kind, name, null);
    }

    public static ReferenceValue ofNode(String nodeId, String port) {
        return new ReferenceValue(ReferenceKind.NODE, nodeId, port);
    }

    /** Whether the text starts with one of the known reference prefixes. */
    public static boolean looksLikeReference(String text) {
        int colon = text.indexOf(':');
        return colon > 0 && ReferenceKind.fromPrefix(text.substring(0, colon)) != null;
    }

    /**
     * Parses a reference string.
     *
     * @throws IllegalArgumentException if the prefix is unknown or a part is missing
     */
    public static ReferenceValue parse(String text) {
        int colon = text.indexOf(':');
        ReferenceKind kind = colon > 0 ? ReferenceKind.fromPrefix(text.substring(0, colon)) : null;
        if (kind == null) {
            throw new IllegalArgumentException("Invalid reference '" + text + "'.");
        }
        String rest = text.substring(colon + 1);
        if (kind == ReferenceKind.NODE) {
            int portColon = rest.indexOf(':');
            if (portColon <= 0 || portColon == rest.length() - 1) {
                throw new IllegalArgumentException(
                        "Invalid node reference '" + text + "', expected node:<id>:<port>.");
            }
            return ofNode(rest.substring(0, portColon), rest.substring(portColon + 1));
        }
        if (rest.isEmpty()) {
            throw new IllegalArgumentException("Invalid reference '" + text + "', name is empty.");
        }
        return of(kind, rest);
    }

    @Override
    public Kind getKind() {
        return Kind.REFERENCE;
    }

    public ReferenceKind getReferenceKind() {
        return referenceKind;
    }

    /** The parameter, node id, view, state field, variable or loop slot name. */
    public String getName() {
        return name;
    }

    /** The output port for node references, {@code null} otherwise. */
    @Nullable
    public String getPort() {
        return port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ReferenceValue that = (ReferenceValue) o;
        return referenceKind == that.referenceKind
                && name.equals(that.name)
                && Objects.equals(port, that.port);
    }

    @Override
    public int hashCode() {
        return Objects.hash(referenceKind, name, port);
    }

    @Override
    public String toString() {
        return port == null
                ? referenceKind.getPrefix() + ":" + name
                : referenceKind.getPrefix() + ":" + name + ":" + port;
    }
}

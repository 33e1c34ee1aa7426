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

package org.statesync.logicgen.codegen.path;

import org.statesync.logicgen.annotation.PublicEvolving;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.statesync.logicgen.utils.Preconditions.checkArgument;

/**
 * A field path such as {@code players[pid:id].score}. {@link #toString()} returns the text the
 * path was parsed from, which parses back to an equal path.
 */
@PublicEvolving
public final class ParsedPath {

    private final List<PathSegment> segments;

    public ParsedPath(List<PathSegment> segments) {
        checkArgument(!segments.isEmpty(), "a path needs at least one segment");
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public List<PathSegment> getSegments() {
        return segments;
    }

    public int size() {
        return segments.size();
    }

    public PathSegment getFirst() {
        return segments.get(0);
    }

    public PathSegment getLast() {
        return segments.get(segments.size() - 1);
    }

    /** The path without its last segment; only valid for paths with two or more segments. */
    public ParsedPath getParent() {
        checkArgument(segments.size() > 1, "a single segment path has no parent");
        return new ParsedPath(segments.subList(0, segments.size() - 1));
    }

    /** Whether any segment looks an element up by key. */
    public boolean hasKeyLookup() {
        for (PathSegment segment : segments) {
            if (segment.getIndexKind() == IndexKind.KEY_LOOKUP) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return segments.equals(((ParsedPath) o).segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(segments.get(i));
        }
        return sb.toString();
    }
}

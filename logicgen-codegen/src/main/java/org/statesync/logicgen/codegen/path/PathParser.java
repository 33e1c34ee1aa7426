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
import org.statesync.logicgen.codegen.exception.PathParseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses field path expressions. Segments are separated by {@code .} outside brackets; a segment
 * is {@code name} or {@code name[index]} where the index is all ASCII digits, an identifier, or
 * {@code variable:keyField}.
 */
@PublicEvolving
public final class PathParser {

    private PathParser() {}

    public static ParsedPath parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new PathParseException("Path must not be empty.");
        }
        List<String> parts = split(text);
        List<PathSegment> segments = new ArrayList<>(parts.size());
        for (String part : parts) {
            segments.add(parseSegment(part, text));
        }
        return new ParsedPath(segments);
    }

    /** Splits on dots that are not inside brackets. */
    private static List<String> split(String text) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '[') {
                depth++;
                if (depth > 1) {
                    throw new PathParseException(
                            "Nested brackets at position " + i + " in path '" + text + "'.");
                }
            } else if (c == ']') {
                depth--;
                if (depth < 0) {
                    throw new PathParseException(
                            "Unbalanced ']' at position " + i + " in path '" + text + "'.");
                }
            } else if (c == '.' && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        if (depth != 0) {
            throw new PathParseException("Unclosed '[' in path '" + text + "'.");
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static PathSegment parseSegment(String part, String path) {
        if (part.isEmpty()) {
            throw new PathParseException("Empty segment in path '" + path + "'.");
        }
        int open = part.indexOf('[');
        if (open < 0) {
            return PathSegment.field(checkIdentifier(part, path));
        }
        int close = part.indexOf(']');
        if (close != part.length() - 1) {
            throw new PathParseException(
                    "Unexpected text after ']' in segment '" + part + "' of path '" + path + "'.");
        }
        String fieldName = checkIdentifier(part.substring(0, open), path);
        String index = part.substring(open + 1, close);
        if (index.isEmpty()) {
            throw new PathParseException(
                    "Empty index in segment '" + part + "' of path '" + path + "'.");
        }
        if (isDigits(index)) {
            try {
                return PathSegment.literalIndex(fieldName, Integer.parseInt(index), index);
            } catch (NumberFormatException e) {
                throw new PathParseException(
                        "Index " + index + " is out of range in path '" + path + "'.", e);
            }
        }
        int colon = index.indexOf(':');
        if (colon >= 0) {
            String variable = checkIdentifier(index.substring(0, colon), path);
            String keyField = checkIdentifier(index.substring(colon + 1), path);
            return PathSegment.keyLookup(fieldName, variable, keyField);
        }
        return PathSegment.variableIndex(fieldName, checkIdentifier(index, path));
    }

    private static String checkIdentifier(String name, String path) {
        if (name.isEmpty() || !Character.isJavaIdentifierStart(name.charAt(0))) {
            throw new PathParseException("Invalid name '" + name + "' in path '" + path + "'.");
        }
        for (int i = 1; i < name.length(); i++) {
            if (!Character.isJavaIdentifierPart(name.charAt(i))) {
                throw new PathParseException(
                        "Invalid name '" + name + "' in path '" + path + "'.");
            }
        }
        return name;
    }

    /** ASCII digits only; other Unicode digits are not positions. */
    private static boolean isDigits(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}

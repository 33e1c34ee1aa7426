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

package org.statesync.logicgen.codegen.generator;

import org.statesync.logicgen.annotation.Internal;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import static org.statesync.logicgen.utils.StringUtils.capitalize;
import static org.statesync.logicgen.utils.StringUtils.decapitalize;
import static org.statesync.logicgen.utils.StringUtils.toIdentifier;

/** Naming conventions of the generated Java class. */
@Internal
public final class Names {

    public static final String SESSION = "session";
    public static final String SENDER_ID = "senderId";
    public static final String STATE = "state";
    public static final String TRACE = "trace";
    public static final String CANCELLATION = "cancellation";
    public static final String FILTER_REGISTRY = "FILTER_REGISTRY";

    private static final Set<String> JAVA_KEYWORDS =
            new HashSet<>(
                    Arrays.asList(
                            "abstract", "assert", "boolean", "break", "byte", "case", "catch",
                            "char", "class", "const", "continue", "default", "do", "double",
                            "else", "enum", "extends", "final", "finally", "float", "for", "goto",
                            "if", "implements", "import", "instanceof", "int", "interface",
                            "long", "native", "new", "package", "private", "protected", "public",
                            "return", "short", "static", "strictfp", "super", "switch",
                            "synchronized", "this", "throw", "throws", "transient", "try",
                            "void", "volatile", "while", "true", "false", "null", "var", "_"));

    private Names() {}

    public static boolean isKeyword(String name) {
        return JAVA_KEYWORDS.contains(name);
    }

    /** {@code OnStartGame} becomes {@code onStartGame}. */
    public static String handlerMethod(String handlerName) {
        return escapeKeyword(decapitalize(toIdentifier(handlerName)));
    }

    public static String functionMethod(String functionName) {
        return escapeKeyword(decapitalize(toIdentifier(functionName)));
    }

    /** {@code hideEnemies} becomes {@code HideEnemiesFilter}. */
    public static String filterClass(String filterName) {
        String base = capitalize(toIdentifier(filterName));
        return base.endsWith("Filter") ? base : base + "Filter";
    }

    /** {@code alivePlayers} becomes {@code viewAlivePlayers}. */
    public static String viewMethod(String viewName) {
        return "view" + capitalize(toIdentifier(viewName));
    }

    /** {@code OnStartGame} becomes {@code ON_START_GAME_ALLOWED_PLAYERS}. */
    public static String allowedPlayersConstant(String handlerName) {
        return constantCase(handlerName) + "_ALLOWED_PLAYERS";
    }

    /** {@code OnStartGame} becomes {@code ON_START_GAME}. */
    public static String constantCase(String name) {
        String identifier = toIdentifier(name);
        StringBuilder sb = new StringBuilder(identifier.length() + 8);
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (i > 0
                    && Character.isUpperCase(c)
                    && Character.isLowerCase(identifier.charAt(i - 1))) {
                sb.append('_');
            }
            sb.append(c);
        }
        return sb.toString().toUpperCase(Locale.ROOT);
    }

    /** Preferred local name for an output port: {@code <nodeId>_<port>}. */
    public static String outputLocal(String nodeId, String port) {
        return toIdentifier(nodeId) + "_" + toIdentifier(port);
    }

    /** Java name of a graph parameter or variable. */
    public static String local(String name) {
        return escapeKeyword(toIdentifier(name));
    }

    private static String escapeKeyword(String name) {
        return isKeyword(name) ? name + "_" : name;
    }
}

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

package org.statesync.logicgen.codegen.nodes;

import org.statesync.logicgen.codegen.generator.Coercions;
import org.statesync.logicgen.codegen.generator.Comparisons;
import org.statesync.logicgen.codegen.generator.EmitContext;
import org.statesync.logicgen.codegen.generator.JavaExpression;
import org.statesync.logicgen.codegen.generator.ParameterTypes;
import org.statesync.logicgen.codegen.generator.RecordAccess;
import org.statesync.logicgen.codegen.graph.InputValue;
import org.statesync.logicgen.codegen.graph.MapValue;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.graph.Parameter;
import org.statesync.logicgen.codegen.schema.JavaTypes;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Helpers shared by the core emitters. */
final class NodeSupport {

    static final String ARRAY_LIST = "java.util.ArrayList";

    private NodeSupport() {}

    /** Declares {@code List<E> <nodeId>_list} holding the array input. */
    static JavaExpression declareList(EmitContext context, Node node, JavaExpression array) {
        String elementType = JavaTypes.boxed(Coercions.elementType(array));
        String listType = "List<" + elementType + ">";
        String local = context.newLocal(node.getId() + "_list");
        context.code().declare(listType, local, Coercions.toList(array));
        return JavaExpression.of(local, listType);
    }

    /**
     * The condition selecting an element: its {@code field} compared with {@code value} through
     * {@code op}, or the element itself when no field is given.
     */
    static String matchCondition(
            EmitContext context,
            Node node,
            JavaExpression item,
            @Nullable String field,
            String op,
            JavaExpression value) {
        if (!Comparisons.isSupported(op)) {
            throw context.error(node, "unsupported comparison operator '" + op + "'");
        }
        JavaExpression actual = field == null ? item : RecordAccess.read(context, item, field);
        return Comparisons.condition(op, actual, value);
    }

    /** A constant string input, {@code null} when absent. */
    @Nullable
    static String optionalConstantString(EmitContext context, Node node, String port) {
        if (!context.hasInput(node, port)) {
            return null;
        }
        return context.requireConstantString(node, port);
    }

    /**
     * Resolves the named arguments of a call in the order of the declared parameters, coerced to
     * the parameter types. Arguments that are not passed default to the zero value of their type.
     */
    static List<String> namedArguments(
            EmitContext context, Node node, String port, List<Parameter> parameters) {
        Map<String, InputValue> entries = Collections.emptyMap();
        InputValue input = node.getInput(port);
        if (input != null && input.getKind() == InputValue.Kind.MAP) {
            entries = ((MapValue) input).getEntries();
        } else if (node.isInputProvided(port)) {
            throw context.error(node, "input '" + port + "' must be a map of parameter values");
        }
        for (String name : entries.keySet()) {
            if (!hasParameter(parameters, name)) {
                throw context.error(node, "unknown parameter '" + name + "' in '" + port + "'");
            }
        }
        List<String> arguments = new ArrayList<>();
        for (Parameter parameter : parameters) {
            String javaType = ParameterTypes.toJavaType(context.getSchema(), parameter.getType());
            InputValue value = entries.get(parameter.getName());
            if (value == null) {
                arguments.add(zeroValue(javaType));
            } else {
                arguments.add(Coercions.coerceTo(javaType, context.resolveValue(node, value)));
            }
        }
        return arguments;
    }

    static String zeroValue(String javaType) {
        switch (javaType) {
            case "boolean":
                return "false";
            case "int":
            case "long":
                return "0";
            case "float":
            case "double":
                return "0.0";
            default:
                return "null";
        }
    }

    /** Wraps compound expressions in parentheses. */
    static String paren(String code) {
        for (int i = 0; i < code.length(); i++) {
            if (!Character.isJavaIdentifierPart(code.charAt(i)) && code.charAt(i) != '.') {
                return "(" + code + ")";
            }
        }
        return code;
    }

    private static boolean hasParameter(List<Parameter> parameters, String name) {
        for (Parameter parameter : parameters) {
            if (parameter.getName().equals(name)) {
                return true;
            }
        }
        return false;
    }
}

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
import org.statesync.logicgen.codegen.generator.EmitContext;
import org.statesync.logicgen.codegen.graph.InputValue;
import org.statesync.logicgen.codegen.graph.ListValue;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.registry.NodeDefinition;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;

import java.util.ArrayList;
import java.util.List;

import static org.statesync.logicgen.codegen.registry.PortDefinition.optional;
import static org.statesync.logicgen.codegen.registry.PortDefinition.required;

/** Text. Values are converted with {@code String.valueOf}, so null becomes "null". */
final class StringNodes {

    private static final String CATEGORY = "string";

    private StringNodes() {}

    static void register(NodeTypeRegistry registry) {
        registry.registerCore(
                NodeDefinition.newBuilder("Concat")
                        .category(CATEGORY)
                        .description("Joins a list of values, or a and b, into one string.")
                        .input(optional("strings", "[]any"))
                        .input(optional("a", "any"))
                        .input(optional("b", "any"))
                        .output("result", "string")
                        .emitter(StringNodes::emitConcat)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("Format")
                        .category(CATEGORY)
                        .description("Formats arguments with a java.util.Formatter pattern.")
                        .input(required("format", "string"))
                        .input(optional("args", "[]any"))
                        .output("result", "string")
                        .emitter(StringNodes::emitFormat)
                        .build());
        registry.registerCore(
                NodeDefinition.newBuilder("ToString")
                        .category(CATEGORY)
                        .description("The text form of a value.")
                        .input(required("value", "any"))
                        .output("result", "string")
                        .emitter(StringNodes::emitToString)
                        .build());
    }

    private static void emitConcat(EmitContext context, Node node) {
        InputValue strings = node.getInput("strings");
        if (strings == null) {
            if (!node.isInputProvided("a") || !node.isInputProvided("b")) {
                throw context.error(node, "Concat needs either 'strings' or both 'a' and 'b'");
            }
            String a = Coercions.toText(context.resolveInput(node, "a"));
            String b = Coercions.toText(context.resolveInput(node, "b"));
            context.declareOutput(node, "result", "String", a + " + " + b);
            return;
        }
        if (strings.getKind() == InputValue.Kind.LIST) {
            List<String> parts = new ArrayList<>();
            for (InputValue element : ((ListValue) strings).getElements()) {
                parts.add(Coercions.toText(context.resolveValue(node, element)));
            }
            String joined = parts.isEmpty() ? "\"\"" : String.join(" + ", parts);
            context.declareOutput(node, "result", "String", joined);
            return;
        }
        String list = Coercions.toList(context.resolveInput(node, "strings"));
        String builder = context.newLocal(node.getId() + "_builder");
        String part = context.newLocal(node.getId() + "_part");
        context.code()
                .declare("StringBuilder", builder, "new StringBuilder()")
                .beginForEach("Object", part, list)
                .stmt(builder + ".append(" + part + ")")
                .endFor();
        context.declareOutput(node, "result", "String", builder + ".toString()");
    }

    /** Formats with {@code Locale.ROOT} so that the output does not depend on the host. */
    private static void emitFormat(EmitContext context, Node node) {
        String format = Coercions.toStringValue(context.resolveInput(node, "format"));
        context.addImport("java.util.Locale");
        StringBuilder call = new StringBuilder("String.format(Locale.ROOT, ").append(format);
        InputValue args = node.getInput("args");
        if (args != null && args.getKind() == InputValue.Kind.LIST) {
            for (InputValue element : ((ListValue) args).getElements()) {
                call.append(", ").append(context.resolveValue(node, element).getCode());
            }
        } else if (args != null) {
            String list = Coercions.toList(context.resolveInput(node, "args"));
            call.append(", ").append(NodeSupport.paren(list)).append(".toArray()");
        }
        call.append(')');
        context.declareOutput(node, "result", "String", call.toString());
    }

    private static void emitToString(EmitContext context, Node node) {
        context.declareOutput(
                node, "result", "String", Coercions.toText(context.resolveInput(node, "value")));
    }
}

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

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.config.ConfigOption;

import static org.statesync.logicgen.config.ConfigOptions.key;

/** Config options of the code generator. */
@PublicEvolving
public class CodegenOptions {

    public static final ConfigOption<String> CLASS_NAME =
            key("codegen.class-name")
                    .stringType()
                    .defaultValue("GameLogic")
                    .withDescription("Simple name of the generated Java class.");

    public static final ConfigOption<String> STATE_TYPE =
            key("codegen.state-type")
                    .stringType()
                    .defaultValue("GameState")
                    .withDescription(
                            "Java type of the session state when no schema is given. With a "
                                    + "schema the root type is used.");

    public static final ConfigOption<Boolean> TRACE_ENABLED =
            key("codegen.trace.enabled")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether handlers take a TraceSink and report event and node "
                                    + "execution to it.");

    public static final ConfigOption<Boolean> VERIFY_ENABLED =
            key("codegen.verify.enabled")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether the generated Java source is parsed before it is returned.");

    public static final ConfigOption<Boolean> TYPESCRIPT_ENABLED =
            key("codegen.typescript.enabled")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription("Whether TypeScript client bindings are generated.");

    public static final ConfigOption<Boolean> VALIDATE_ENABLED =
            key("codegen.validate.enabled")
                    .booleanType()
                    .defaultValue(true)
                    .withDescription(
                            "Whether the graph is validated before generation. Disabling it "
                                    + "surfaces problems as generation errors instead.");

    private CodegenOptions() {}
}

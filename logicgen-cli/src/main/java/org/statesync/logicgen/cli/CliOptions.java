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

package org.statesync.logicgen.cli;

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.config.ConfigOption;

import static org.statesync.logicgen.config.ConfigOptions.key;

/**
 * Config options of the command line front end. The compiler options themselves live in {@link
 * org.statesync.logicgen.codegen.generator.CodegenOptions}.
 */
@PublicEvolving
public class CliOptions {

    public static final ConfigOption<String> INPUT_FILE =
            key("cli.input")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Path of the graph JSON file.");

    public static final ConfigOption<String> SCHEMA_FILE =
            key("cli.schema")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Path of the schema JSON file, optional.");

    public static final ConfigOption<String> OUTPUT_FILE =
            key("cli.output")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Path of the generated Java file.");

    public static final ConfigOption<String> TYPESCRIPT_FILE =
            key("cli.typescript-output")
                    .stringType()
                    .noDefaultValue()
                    .withDescription("Path of the generated TypeScript file, optional.");

    public static final ConfigOption<Boolean> VALIDATE_ONLY =
            key("cli.validate-only")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription("Only validate the graph and print the diagnostics.");

    private CliOptions() {}
}

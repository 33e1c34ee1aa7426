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

import org.statesync.logicgen.codegen.generator.CodegenOptions;
import org.statesync.logicgen.config.Configuration;
import org.statesync.logicgen.exception.IllegalConfigurationException;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link CliArgumentParser}. */
public class CliArgumentParserTest {

    @Test
    public void testAllFlags() {
        Configuration configuration =
                CliArgumentParser.parse(
                        new String[] {
                            "-input", "logic.json",
                            "-schema", "schema.json",
                            "-output", "out/PartyLogic.java",
                            "-ts", "out/party.ts",
                            "-class", "Party",
                            "-debug"
                        });

        assertThat(configuration.get(CliOptions.INPUT_FILE)).isEqualTo("logic.json");
        assertThat(configuration.get(CliOptions.SCHEMA_FILE)).isEqualTo("schema.json");
        assertThat(configuration.get(CliOptions.OUTPUT_FILE)).isEqualTo("out/PartyLogic.java");
        assertThat(configuration.get(CliOptions.TYPESCRIPT_FILE)).isEqualTo("out/party.ts");
        assertThat(configuration.get(CodegenOptions.CLASS_NAME)).isEqualTo("Party");
        assertThat(configuration.get(CodegenOptions.TRACE_ENABLED)).isTrue();
        assertThat(configuration.get(CodegenOptions.TYPESCRIPT_ENABLED)).isTrue();
        assertThat(configuration.get(CliOptions.VALIDATE_ONLY)).isFalse();
    }

    @Test
    public void testDefaults() {
        Configuration configuration =
                CliArgumentParser.parse(new String[] {"--input=logic.json", "--output=Game.java"});

        assertThat(configuration.get(CodegenOptions.CLASS_NAME)).isEqualTo("Game");
        assertThat(configuration.get(CodegenOptions.TRACE_ENABLED)).isFalse();
        assertThat(configuration.get(CodegenOptions.TYPESCRIPT_ENABLED)).isFalse();
        assertThat(configuration.contains(CliOptions.SCHEMA_FILE)).isFalse();
    }

    @Test
    public void testValidateNeedsNoOutput() {
        Configuration configuration =
                CliArgumentParser.parse(new String[] {"-validate", "-input", "logic.json"});

        assertThat(configuration.get(CliOptions.VALIDATE_ONLY)).isTrue();
        assertThat(configuration.contains(CliOptions.OUTPUT_FILE)).isFalse();
        assertThat(configuration.contains(CodegenOptions.CLASS_NAME)).isFalse();
    }

    @Test
    public void testInvalidArguments() {
        assertThatThrownBy(() -> CliArgumentParser.parse(new String[0]))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("Missing required flag -input.");
        assertThatThrownBy(() -> CliArgumentParser.parse(new String[] {"-input", "a.json"}))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageStartingWith("Missing required flag -output");
        assertThatThrownBy(() -> CliArgumentParser.parse(new String[] {"-input"}))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("Flag -input requires a value.");
        assertThatThrownBy(() -> CliArgumentParser.parse(new String[] {"-input", "a", "-fast"}))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("Unknown flag '-fast'.");
        assertThatThrownBy(() -> CliArgumentParser.parse(new String[] {"logic.json"}))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("Unexpected argument 'logic.json'.");
        assertThatThrownBy(() -> CliArgumentParser.parse(new String[] {"-debug=maybe"}))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessage("Flag -debug takes true or false, not 'maybe'.");
    }

    @Test
    public void testHelpAndClassName() {
        assertThat(CliArgumentParser.isHelp(new String[] {"-input", "x", "--help"})).isTrue();
        assertThat(CliArgumentParser.isHelp(new String[] {"-input", "x"})).isFalse();
        assertThat(CliArgumentParser.classNameOf(Paths.get("gen", "GameLogic.java")))
                .isEqualTo("GameLogic");
        assertThat(CliArgumentParser.classNameOf(Paths.get("Handlers"))).isEqualTo("Handlers");
    }
}

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

import org.statesync.logicgen.annotation.VisibleForTesting;
import org.statesync.logicgen.codegen.generator.CodegenOptions;
import org.statesync.logicgen.config.ConfigOption;
import org.statesync.logicgen.config.Configuration;
import org.statesync.logicgen.exception.IllegalConfigurationException;

import javax.annotation.Nullable;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Turns command line flags into a {@link Configuration}. Flags start with one or two dashes and
 * take their value either as the next argument or after an equals sign, {@code -class Foo} and
 * {@code --class=Foo} are the same.
 */
public final class CliArgumentParser {

    static final String USAGE =
            "Usage: logicgen -input <graph.json> [-schema <schema.json>] -output <File.java>\n"
                    + "                [-ts <file.ts>] [-class <Name>] [-validate] [-debug]\n"
                    + "\n"
                    + "  -input     graph JSON file (required)\n"
                    + "  -schema    schema JSON file\n"
                    + "  -output    generated Java file (required unless -validate)\n"
                    + "  -ts        also generate TypeScript client bindings to this file\n"
                    + "  -class     name of the generated class, defaults to the output file name\n"
                    + "  -validate  only validate the graph and print the diagnostics\n"
                    + "  -debug     generate handlers that report execution to a TraceSink\n"
                    + "  -help      print this message";

    private CliArgumentParser() {}

    /** Whether the arguments ask for the usage message. */
    public static boolean isHelp(String[] args) {
        for (String arg : args) {
            String flag = stripDashes(arg);
            if ("help".equals(flag) || "h".equals(flag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Parses the arguments.
     *
     * @throws IllegalConfigurationException for unknown flags, missing values or missing
     *     mandatory flags
     */
    public static Configuration parse(String[] args) {
        Configuration configuration = new Configuration();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("-") || arg.equals("-") || arg.equals("--")) {
                throw new IllegalConfigurationException("Unexpected argument '" + arg + "'.");
            }
            String flag = stripDashes(arg);
            String inlineValue = null;
            int equals = flag.indexOf('=');
            if (equals >= 0) {
                inlineValue = flag.substring(equals + 1);
                flag = flag.substring(0, equals);
            }
            switch (flag) {
                case "validate":
                    configuration.set(CliOptions.VALIDATE_ONLY, booleanFlag(flag, inlineValue));
                    break;
                case "debug":
                    configuration.set(CodegenOptions.TRACE_ENABLED, booleanFlag(flag, inlineValue));
                    break;
                case "input":
                case "schema":
                case "output":
                case "ts":
                case "class":
                    String value = inlineValue;
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            throw new IllegalConfigurationException(
                                    "Flag -" + flag + " requires a value.");
                        }
                        value = args[++i];
                    }
                    if (value.trim().isEmpty()) {
                        throw new IllegalConfigurationException(
                                "Flag -" + flag + " requires a non-empty value.");
                    }
                    configuration.set(valueOption(flag), value);
                    break;
                default:
                    throw new IllegalConfigurationException("Unknown flag '" + arg + "'.");
            }
        }
        return complete(configuration);
    }

    private static Configuration complete(Configuration configuration) {
        if (!configuration.contains(CliOptions.INPUT_FILE)) {
            throw new IllegalConfigurationException("Missing required flag -input.");
        }
        boolean validateOnly = configuration.get(CliOptions.VALIDATE_ONLY);
        if (!validateOnly && !configuration.contains(CliOptions.OUTPUT_FILE)) {
            throw new IllegalConfigurationException(
                    "Missing required flag -output, or pass -validate to only validate.");
        }
        if (configuration.contains(CliOptions.TYPESCRIPT_FILE)) {
            configuration.set(CodegenOptions.TYPESCRIPT_ENABLED, true);
        }
        if (!configuration.contains(CodegenOptions.CLASS_NAME)
                && configuration.contains(CliOptions.OUTPUT_FILE)) {
            // the public class has to match its file name
            configuration.set(
                    CodegenOptions.CLASS_NAME,
                    classNameOf(Paths.get(configuration.get(CliOptions.OUTPUT_FILE))));
        }
        return configuration;
    }

    @VisibleForTesting
    static String classNameOf(Path outputFile) {
        String fileName = outputFile.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static ConfigOption<String> valueOption(String flag) {
        switch (flag) {
            case "input":
                return CliOptions.INPUT_FILE;
            case "schema":
                return CliOptions.SCHEMA_FILE;
            case "output":
                return CliOptions.OUTPUT_FILE;
            case "ts":
                return CliOptions.TYPESCRIPT_FILE;
            case "class":
                return CodegenOptions.CLASS_NAME;
            default:
                throw new IllegalStateException("Not a value flag: " + flag);
        }
    }

    private static boolean booleanFlag(String flag, @Nullable String inlineValue) {
        if (inlineValue == null || "true".equalsIgnoreCase(inlineValue)) {
            return true;
        }
        if ("false".equalsIgnoreCase(inlineValue)) {
            return false;
        }
        throw new IllegalConfigurationException(
                "Flag -" + flag + " takes true or false, not '" + inlineValue + "'.");
    }

    private static String stripDashes(String arg) {
        if (arg.startsWith("--")) {
            return arg.substring(2);
        }
        return arg.startsWith("-") ? arg.substring(1) : arg;
    }
}

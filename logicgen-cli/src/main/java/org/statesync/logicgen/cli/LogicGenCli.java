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

import org.statesync.logicgen.codegen.compiler.CompilationResult;
import org.statesync.logicgen.codegen.compiler.GraphLoader;
import org.statesync.logicgen.codegen.compiler.LogicCompiler;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.schema.SchemaDefinition;
import org.statesync.logicgen.codegen.validate.ValidationIssue;
import org.statesync.logicgen.codegen.validate.ValidationResult;
import org.statesync.logicgen.config.ConfigOption;
import org.statesync.logicgen.config.Configuration;
import org.statesync.logicgen.exception.IllegalConfigurationException;
import org.statesync.logicgen.exception.LogicGenException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Command line entry point. Reads a graph and an optional schema, then either validates the graph
 * or writes the generated Java class and, when asked, the TypeScript bindings.
 *
 * <p>Exits with 0 on success and 1 on any error; diagnostics go to standard error.
 */
public class LogicGenCli {

    private static final Logger LOG = LoggerFactory.getLogger(LogicGenCli.class);

    static final int SUCCESS = 0;
    static final int FAILURE = 1;

    private final PrintStream out;
    private final PrintStream err;

    LogicGenCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new LogicGenCli(System.out, System.err).run(args));
    }

    /** Runs one invocation and returns the exit code. */
    int run(String[] args) {
        if (CliArgumentParser.isHelp(args)) {
            out.println(CliArgumentParser.USAGE);
            return SUCCESS;
        }
        Configuration configuration;
        try {
            configuration = CliArgumentParser.parse(args);
        } catch (IllegalConfigurationException e) {
            err.println("Error: " + e.getMessage());
            err.println(CliArgumentParser.USAGE);
            return FAILURE;
        }
        LOG.debug("Running with configuration {}.", configuration);

        try {
            NodeGraph graph = GraphLoader.loadGraph(path(configuration, CliOptions.INPUT_FILE));
            SchemaDefinition schema = null;
            if (configuration.contains(CliOptions.SCHEMA_FILE)) {
                schema = GraphLoader.loadSchema(path(configuration, CliOptions.SCHEMA_FILE));
            }
            LogicCompiler compiler =
                    new LogicCompiler(configuration, NodeTypeRegistry.createDefault());
            if (configuration.get(CliOptions.VALIDATE_ONLY)) {
                return validate(compiler, graph, schema);
            }
            return generate(configuration, compiler, graph, schema);
        } catch (LogicGenException e) {
            LOG.debug("Compilation failed.", e);
            err.println("Error: " + e.getMessage());
            return FAILURE;
        } catch (IOException e) {
            LOG.debug("Writing the output failed.", e);
            err.println("Error: could not write output: " + e.getMessage());
            return FAILURE;
        }
    }

    private int validate(
            LogicCompiler compiler, NodeGraph graph, @Nullable SchemaDefinition schema) {
        ValidationResult result = compiler.validate(graph, schema);
        for (ValidationIssue issue : result.getIssues()) {
            err.println(issue);
        }
        if (!result.isValid()) {
            err.println(
                    "Validation failed with "
                            + result.getErrors().size()
                            + " error(s) and "
                            + result.getWarnings().size()
                            + " warning(s).");
            return FAILURE;
        }
        out.println("Graph is valid, " + result.getWarnings().size() + " warning(s).");
        return SUCCESS;
    }

    private int generate(
            Configuration configuration,
            LogicCompiler compiler,
            NodeGraph graph,
            @Nullable SchemaDefinition schema)
            throws IOException {
        CompilationResult result = compiler.compile(graph, schema);
        for (ValidationIssue warning : result.getWarnings()) {
            err.println(warning);
        }

        Path javaFile = path(configuration, CliOptions.OUTPUT_FILE);
        write(javaFile, result.getJavaSource());
        out.println("Generated " + javaFile);

        Optional<String> typeScript = result.getTypeScriptSource();
        if (typeScript.isPresent()) {
            Path tsFile = path(configuration, CliOptions.TYPESCRIPT_FILE);
            write(tsFile, typeScript.get());
            out.println("Generated " + tsFile);
        }
        return SUCCESS;
    }

    private static Path path(Configuration configuration, ConfigOption<String> option) {
        return Paths.get(configuration.get(option));
    }

    private static void write(Path file, String content) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        LOG.info("Wrote {} ({} bytes).", file, content.length());
    }
}

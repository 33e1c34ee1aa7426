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

package org.statesync.logicgen.codegen.compiler;

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.generator.CodegenOptions;
import org.statesync.logicgen.codegen.generator.JavaSourceGenerator;
import org.statesync.logicgen.codegen.graph.NodeGraph;
import org.statesync.logicgen.codegen.registry.NodeTypeRegistry;
import org.statesync.logicgen.codegen.schema.SchemaContext;
import org.statesync.logicgen.codegen.schema.SchemaDefinition;
import org.statesync.logicgen.codegen.typescript.TypeScriptBindingsGenerator;
import org.statesync.logicgen.codegen.validate.GraphValidator;
import org.statesync.logicgen.codegen.validate.ValidationIssue;
import org.statesync.logicgen.codegen.validate.ValidationResult;
import org.statesync.logicgen.codegen.verify.SourceVerifier;
import org.statesync.logicgen.config.Configuration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.util.Collections;
import java.util.List;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * Entry point of the code generator. Runs validation, Java generation, source verification and
 * TypeScript generation for one graph, as configured by {@link CodegenOptions}.
 *
 * <p>A compiler holds no per-compilation state, so one instance may compile several graphs
 * concurrently as long as the registry is not modified meanwhile.
 */
@PublicEvolving
public class LogicCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(LogicCompiler.class);

    private final Configuration configuration;
    private final NodeTypeRegistry registry;

    public LogicCompiler(Configuration configuration, NodeTypeRegistry registry) {
        this.configuration = checkNotNull(configuration, "configuration must not be null");
        this.registry = checkNotNull(registry, "registry must not be null");
    }

    /** A compiler with default options and the core node catalog. */
    public static LogicCompiler createDefault() {
        return new LogicCompiler(new Configuration(), NodeTypeRegistry.createDefault());
    }

    /** Validates the graph without generating anything. */
    public ValidationResult validate(NodeGraph graph, @Nullable SchemaDefinition schema) {
        return GraphValidator.validate(graph, registry, schemaContext(schema));
    }

    /**
     * Compiles the graph.
     *
     * @throws org.statesync.logicgen.codegen.exception.GraphValidationException if validation
     *     is enabled and finds errors
     * @throws org.statesync.logicgen.codegen.exception.CodeGenException if generation fails
     */
    public CompilationResult compile(NodeGraph graph, @Nullable SchemaDefinition schema) {
        SchemaContext schemaContext = schemaContext(schema);
        String className = configuration.get(CodegenOptions.CLASS_NAME);

        List<ValidationIssue> warnings = Collections.emptyList();
        if (configuration.get(CodegenOptions.VALIDATE_ENABLED)) {
            ValidationResult result = GraphValidator.validate(graph, registry, schemaContext);
            result.throwIfInvalid();
            warnings = result.getWarnings();
        }

        String javaSource =
                new JavaSourceGenerator(
                                registry,
                                schemaContext,
                                className,
                                configuration.get(CodegenOptions.STATE_TYPE),
                                configuration.get(CodegenOptions.TRACE_ENABLED))
                        .generate(graph);
        if (configuration.get(CodegenOptions.VERIFY_ENABLED)) {
            SourceVerifier.verify(className + ".java", javaSource);
        }

        String typeScript = null;
        if (configuration.get(CodegenOptions.TYPESCRIPT_ENABLED)) {
            typeScript = new TypeScriptBindingsGenerator(schema).generate(graph);
        }

        LOG.info(
                "Compiled {} handlers, {} functions, {} filters and {} views into {} "
                        + "with {} warnings.",
                graph.getHandlers().size(),
                graph.getFunctions().size(),
                graph.getFilters().size(),
                graph.getViews().size(),
                className,
                warnings.size());
        return new CompilationResult(className, javaSource, typeScript, warnings);
    }

    @Nullable
    private static SchemaContext schemaContext(@Nullable SchemaDefinition schema) {
        return schema == null ? null : new SchemaContext(schema);
    }
}

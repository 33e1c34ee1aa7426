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

/**
 * Java source generation for logic graphs.
 *
 * <ul>
 *   <li>{@link org.statesync.logicgen.codegen.generator.JavaSourceGenerator} - Emits one final
 *       class with a static method per handler and function, and a nested class per filter
 *   <li>{@link org.statesync.logicgen.codegen.generator.ControlFlowEmitter} - Turns structured
 *       flow into nested Java statements
 *   <li>{@link org.statesync.logicgen.codegen.generator.JavaCodeBuilder} - Indentation aware
 *       builder for Java source code
 *   <li>{@link org.statesync.logicgen.codegen.generator.CodegenOptions} - Options controlling the
 *       generated class
 * </ul>
 *
 * <p>Node types contribute code through {@link
 * org.statesync.logicgen.codegen.registry.NodeEmitter} implementations, which receive an {@link
 * org.statesync.logicgen.codegen.generator.EmitContext} to resolve inputs and declare outputs.
 */
package org.statesync.logicgen.codegen.generator;

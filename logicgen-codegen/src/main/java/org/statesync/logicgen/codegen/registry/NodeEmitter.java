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

package org.statesync.logicgen.codegen.registry;

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.exception.CodeGenException;
import org.statesync.logicgen.codegen.generator.EmitContext;
import org.statesync.logicgen.codegen.graph.Node;

/**
 * Emits the statements of one node kind. The emitter resolves the node inputs through the
 * context, declares its outputs and writes code at the current indentation. Implementations must
 * be stateless: one instance serves concurrent compilations.
 */
@PublicEvolving
@FunctionalInterface
public interface NodeEmitter {

    void emit(EmitContext context, Node node) throws CodeGenException;
}

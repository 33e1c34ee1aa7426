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

package org.statesync.logicgen.codegen.path;

import org.statesync.logicgen.annotation.PublicEvolving;

/** How a path segment indexes into an array or map field. */
@PublicEvolving
public enum IndexKind {
    /** Plain field access, {@code players}. */
    NONE,
    /** Constant position, {@code players[0]}. */
    LITERAL,
    /** Position or key held by a variable or parameter, {@code players[idx]}. */
    VARIABLE,
    /** Element whose key field equals a variable, {@code players[pid:id]}. */
    KEY_LOOKUP
}

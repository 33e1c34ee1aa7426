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

package org.statesync.logicgen.codegen.graph;

import org.statesync.logicgen.annotation.PublicEvolving;

/**
 * The value bound to an input port of a {@link Node}. An input is either a literal constant, a
 * reference to a value produced elsewhere, or a nested map or list of inputs.
 */
@PublicEvolving
public abstract class InputValue {

    /** The shape of an input value. */
    public enum Kind {
        LITERAL,
        REFERENCE,
        MAP,
        LIST
    }

    public abstract Kind getKind();

    public boolean isLiteral() {
        return getKind() == Kind.LITERAL;
    }

    public boolean isReference() {
        return getKind() == Kind.REFERENCE;
    }
}

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

package org.statesync.logicgen.codegen.schema;

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.path.PathSegment;

import javax.annotation.Nullable;

/**
 * A path segment resolved against the schema: the accessor of the field it names and the type of
 * the value the segment yields after its index, if any, is applied.
 */
@PublicEvolving
public final class ResolvedSegment {

    private final PathSegment segment;
    private final FieldAccessInfo accessInfo;
    @Nullable private final FieldType valueType;

    public ResolvedSegment(
            PathSegment segment, FieldAccessInfo accessInfo, @Nullable FieldType valueType) {
        this.segment = segment;
        this.accessInfo = accessInfo;
        this.valueType = valueType;
    }

    public PathSegment getSegment() {
        return segment;
    }

    public FieldAccessInfo getAccessInfo() {
        return accessInfo;
    }

    /** Type of the value this segment yields, {@code null} when resolved without a schema. */
    @Nullable
    public FieldType getValueType() {
        return valueType;
    }

    @Nullable
    public String getValueJavaType() {
        return valueType == null ? null : JavaTypes.toJavaType(valueType);
    }
}

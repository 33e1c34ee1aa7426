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

package org.statesync.logicgen.codegen.generator;

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.codegen.schema.FieldDef;
import org.statesync.logicgen.codegen.schema.JavaTypes;
import org.statesync.logicgen.codegen.schema.SchemaContext;
import org.statesync.logicgen.codegen.schema.TypeDef;

import javax.annotation.Nullable;

import static org.statesync.logicgen.utils.StringUtils.capitalize;

/**
 * Field access on a value whose record type may or may not be known. Values of a schema record
 * type use the generated accessors; anything else goes through {@code Values.property}.
 */
@PublicEvolving
public final class RecordAccess {

    private RecordAccess() {}

    /** The schema record type of the expression, {@code null} if it is not one. */
    @Nullable
    public static TypeDef recordTypeOf(EmitContext context, JavaExpression target) {
        SchemaContext schema = context.getSchema();
        if (schema == null || target.getType() == null || !schema.hasType(target.getType())) {
            return null;
        }
        return schema.getType(target.getType());
    }

    /**
     * Reads a field.
     *
     * @throws org.statesync.logicgen.codegen.exception.SchemaResolutionException if the target
     *     is a record that has no such field
     */
    public static JavaExpression read(EmitContext context, JavaExpression target, String field) {
        TypeDef record = recordTypeOf(context, target);
        if (record != null) {
            FieldDef def = context.getSchema().getField(record.getName(), field);
            return JavaExpression.of(
                    target.getCode() + ".get" + capitalize(field) + "()",
                    JavaTypes.toJavaType(def.getType()));
        }
        return JavaExpression.untyped(
                "Values.property(" + target.getCode() + ", \"" + field + "\")");
    }

    /**
     * A statement, without semicolon, that writes a field. Schema records use their typed
     * setter, maps and other values are written through {@code Values.setProperty}.
     */
    public static String write(
            EmitContext context, JavaExpression target, String field, JavaExpression value) {
        TypeDef record = recordTypeOf(context, target);
        if (record != null) {
            FieldDef def = context.getSchema().getField(record.getName(), field);
            return target.getCode()
                    + ".set"
                    + capitalize(field)
                    + "("
                    + Coercions.coerceTo(JavaTypes.toJavaType(def.getType()), value)
                    + ")";
        }
        return "Values.setProperty("
                + target.getCode()
                + ", \""
                + field
                + "\", "
                + value.getCode()
                + ")";
    }
}

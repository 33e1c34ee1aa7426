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

import org.statesync.logicgen.codegen.exception.CodeGenException;
import org.statesync.logicgen.codegen.schema.SchemaContext;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.statesync.logicgen.codegen.generator.ParameterTypes.toJavaType;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameSchema;

/** Tests for {@link ParameterTypes}. */
public class ParameterTypesTest {

    @Test
    public void testLooseNames() {
        assertThat(toJavaType(null, null)).isEqualTo("Object");
        assertThat(toJavaType(null, "")).isEqualTo("Object");
        assertThat(toJavaType(null, "any")).isEqualTo("Object");
        assertThat(toJavaType(null, "number")).isEqualTo("double");
        assertThat(toJavaType(null, "float")).isEqualTo("double");
        assertThat(toJavaType(null, " integer ")).isEqualTo("int");
        assertThat(toJavaType(null, "long")).isEqualTo("long");
        assertThat(toJavaType(null, "boolean")).isEqualTo("boolean");
    }

    @Test
    public void testSchemaGrammar() {
        assertThat(toJavaType(null, "string")).isEqualTo("String");
        assertThat(toJavaType(null, "int64")).isEqualTo("long");
        assertThat(toJavaType(null, "bytes")).isEqualTo("byte[]");
        assertThat(toJavaType(null, "*int")).isEqualTo("Integer");
        assertThat(toJavaType(null, "[]string")).isEqualTo("List<String>");
        assertThat(toJavaType(null, "[]integer")).isEqualTo("List<Integer>");
        assertThat(toJavaType(null, "map[string]number")).isEqualTo("Map<String, Double>");
    }

    @Test
    public void testRecords() {
        SchemaContext schema = new SchemaContext(gameSchema());

        assertThat(toJavaType(schema, "Player")).isEqualTo("Player");
        assertThat(toJavaType(schema, "[]Player")).isEqualTo("List<Player>");
        assertThat(toJavaType(schema, "*Player")).isEqualTo("Player");
        assertThat(toJavaType(schema, "Team")).isEqualTo("Object");
        assertThat(toJavaType(null, "Player")).isEqualTo("Object");
        assertThat(toJavaType(null, "[]Player")).isEqualTo("List<Object>");
    }

    @Test
    public void testInvalidType() {
        assertThatThrownBy(() -> toJavaType(null, "[]"))
                .isInstanceOf(CodeGenException.class)
                .hasMessage("Invalid parameter type '[]'.");
        assertThatThrownBy(() -> toJavaType(null, "map[string"))
                .isInstanceOf(CodeGenException.class);
    }
}

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

import org.statesync.logicgen.codegen.exception.SchemaParseException;
import org.statesync.logicgen.codegen.exception.SchemaResolutionException;
import org.statesync.logicgen.codegen.path.PathParser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.statesync.logicgen.codegen.testutils.GraphTestUtils.gameSchema;

/** Tests for {@link SchemaContext}, {@link FieldType} and {@link JavaTypes}. */
public class SchemaContextTest {

    private final SchemaContext schema = new SchemaContext(gameSchema());

    // ==================== Resolution ====================

    @Test
    public void testResolveNestedPath() {
        List<ResolvedSegment> resolved =
                schema.resolve(PathParser.parse("players[pid:id].score"));

        assertThat(resolved).hasSize(2);
        assertThat(resolved.get(0).getValueJavaType()).isEqualTo("Player");
        assertThat(resolved.get(0).getAccessInfo().getGetAtName()).isEqualTo("getPlayersAt");
        assertThat(resolved.get(1).getValueJavaType()).isEqualTo("int");
        assertThat(resolved.get(1).getAccessInfo().getSetterName()).isEqualTo("setScore");
    }

    @Test
    public void testResolveMapAndOptional() {
        assertThat(schema.resolve(PathParser.parse("scores[name]")).get(0).getValueJavaType())
                .isEqualTo("long");
        assertThat(schema.resolve(PathParser.parse("winner")).get(0).getValueJavaType())
                .isEqualTo("String");
        assertThat(schema.getRootType().getName()).isEqualTo("GameState");
        assertThat(schema.getType("Player").getKeyField().getName()).isEqualTo("id");
    }

    @Test
    public void testResolutionErrors() {
        assertThatThrownBy(() -> schema.resolve(PathParser.parse("lives")))
                .isInstanceOf(SchemaResolutionException.class)
                .hasMessage("Type 'GameState' has no field 'lives'.");
        assertThatThrownBy(() -> schema.resolve(PathParser.parse("phase.length")))
                .isInstanceOf(SchemaResolutionException.class)
                .hasMessageContaining("Cannot access 'length'");
        assertThatThrownBy(() -> schema.resolve(PathParser.parse("players[pid:uuid]")))
                .isInstanceOf(SchemaResolutionException.class)
                .hasMessage("Type 'Player' has no field 'uuid'.");
        assertThatThrownBy(() -> schema.getType("Monster"))
                .isInstanceOf(SchemaResolutionException.class);
    }

    // ==================== Types ====================

    @Test
    public void testParseFieldTypes() {
        FieldType nested = FieldType.parse("map[string][]*Player");

        assertThat(nested.getCategory()).isEqualTo(FieldType.Category.MAP);
        assertThat(nested.getKeyType()).isEqualTo(FieldType.primitive("string"));
        assertThat(nested.getElementType())
                .isEqualTo(FieldType.arrayOf(FieldType.optional(FieldType.record("Player"))));
        assertThat(nested.toString()).isEqualTo("map[string][]*Player");
        assertThat(FieldType.parse("*int").unwrapOptional()).isEqualTo(FieldType.primitive("int"));
        assertThat(FieldType.parse("*[]int").isArray()).isTrue();
    }

    @Test
    public void testInvalidFieldTypes() {
        assertThatThrownBy(() -> FieldType.parse(" "))
                .isInstanceOf(SchemaParseException.class);
        assertThatThrownBy(() -> FieldType.parse("map[string"))
                .isInstanceOf(SchemaParseException.class)
                .hasMessageContaining("Unclosed map key");
        assertThatThrownBy(() -> FieldType.parse("map[]int"))
                .isInstanceOf(SchemaParseException.class);
        assertThatThrownBy(() -> FieldType.parse("my-type"))
                .isInstanceOf(SchemaParseException.class)
                .hasMessage("Invalid type name 'my-type'.");
    }

    @Test
    public void testJavaTypes() {
        assertThat(JavaTypes.toJavaType("int32")).isEqualTo("int");
        assertThat(JavaTypes.toJavaType("uint64")).isEqualTo("long");
        assertThat(JavaTypes.toJavaType("float32")).isEqualTo("float");
        assertThat(JavaTypes.toJavaType("bytes")).isEqualTo("byte[]");
        assertThat(JavaTypes.toJavaType("*bool")).isEqualTo("Boolean");
        assertThat(JavaTypes.toJavaType("[]int64")).isEqualTo("List<Long>");
        assertThat(JavaTypes.toJavaType("map[string]Player")).isEqualTo("Map<String, Player>");
        assertThat(JavaTypes.toJavaType("any")).isEqualTo(JavaTypes.OBJECT);
    }
}

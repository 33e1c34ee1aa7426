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

import org.statesync.logicgen.codegen.exception.PathParseException;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link PathParser}. */
public class PathParserTest {

    @Test
    public void testSegmentKinds() {
        ParsedPath path = PathParser.parse("teams[0].players[pid:id].scores[round]");

        assertThat(path.size()).isEqualTo(3);
        assertThat(path.getFirst()).isEqualTo(PathSegment.literalIndex("teams", 0));
        assertThat(path.getSegments().get(1))
                .isEqualTo(PathSegment.keyLookup("players", "pid", "id"));
        assertThat(path.getLast()).isEqualTo(PathSegment.variableIndex("scores", "round"));
        assertThat(path.getLast().getIndexKind()).isEqualTo(IndexKind.VARIABLE);
        assertThat(path.hasKeyLookup()).isTrue();
        assertThat(path.getParent().toString()).isEqualTo("teams[0].players[pid:id]");
    }

    @Test
    public void testPrintedPathParsesToTheSamePath() {
        String[] texts = {
            "phase",
            "players[3].name",
            "players[pid:id].inventory[slot]",
            "scores[player]",
            "items[007]",
            "items[0]",
            "items[2147483647]",
            "rows[_r].cells[$c]",
            "teams[x\u0663:id_2]",
            "a.b.c.d"
        };
        for (String text : texts) {
            ParsedPath path = PathParser.parse(text);
            assertThat(path.toString()).isEqualTo(text);
            assertThat(PathParser.parse(path.toString())).isEqualTo(path);
        }
    }

    @Test
    public void testLeadingZerosKeepThePosition() {
        ParsedPath path = PathParser.parse("items[007]");

        assertThat(path.getFirst()).isEqualTo(PathSegment.literalIndex("items", 7));
        assertThat(path.getFirst().getIndexValue()).isEqualTo("7");
        assertThat(path.toString()).isEqualTo("items[007]");
    }

    @Test
    public void testOnlyAsciiDigitsArePositions() {
        assertThatThrownBy(() -> PathParser.parse("items[\u0663]"))
                .isInstanceOf(PathParseException.class)
                .hasMessage("Invalid name '\u0663' in path 'items[\u0663]'.");
        assertThat(PathParser.parse("items[x\u0663]").getFirst().getIndexKind())
                .isEqualTo(IndexKind.VARIABLE);
    }

    @Test
    public void testDotsInsideBracketsDoNotSplit() {
        assertThatThrownBy(() -> PathParser.parse("players[a.b].name"))
                .isInstanceOf(PathParseException.class)
                .hasMessageContaining("a.b");
    }

    @Test
    public void testMalformedPaths() {
        assertThatThrownBy(() -> PathParser.parse(""))
                .isInstanceOf(PathParseException.class)
                .hasMessage("Path must not be empty.");
        assertThatThrownBy(() -> PathParser.parse("players[0"))
                .isInstanceOf(PathParseException.class)
                .hasMessage("Unclosed '[' in path 'players[0'.");
        assertThatThrownBy(() -> PathParser.parse("players]"))
                .isInstanceOf(PathParseException.class)
                .hasMessageContaining("Unbalanced ']'");
        assertThatThrownBy(() -> PathParser.parse("players..name"))
                .isInstanceOf(PathParseException.class)
                .hasMessage("Empty segment in path 'players..name'.");
        assertThatThrownBy(() -> PathParser.parse("players[]"))
                .isInstanceOf(PathParseException.class)
                .hasMessageContaining("Empty index");
        assertThatThrownBy(() -> PathParser.parse("players[[0]]"))
                .isInstanceOf(PathParseException.class)
                .hasMessageContaining("Nested brackets");
        assertThatThrownBy(() -> PathParser.parse("players[0]x"))
                .isInstanceOf(PathParseException.class)
                .hasMessageContaining("Unexpected text after ']'");
        assertThatThrownBy(() -> PathParser.parse("9lives"))
                .isInstanceOf(PathParseException.class)
                .hasMessage("Invalid name '9lives' in path '9lives'.");
        assertThatThrownBy(() -> PathParser.parse("players[99999999999]"))
                .isInstanceOf(PathParseException.class)
                .hasMessageContaining("out of range");
    }
}

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

package org.statesync.logicgen.utils;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link StringUtils}. */
public class StringUtilsTest {

    @Test
    public void testIsNullOrWhitespaceOnly() {
        assertThat(StringUtils.isNullOrWhitespaceOnly(null)).isTrue();
        assertThat(StringUtils.isNullOrWhitespaceOnly("")).isTrue();
        assertThat(StringUtils.isNullOrWhitespaceOnly(" \t\n")).isTrue();
        assertThat(StringUtils.isNullOrWhitespaceOnly(" a ")).isFalse();
    }

    @Test
    public void testCapitalization() {
        assertThat(StringUtils.capitalize("score")).isEqualTo("Score");
        assertThat(StringUtils.capitalize("ID")).isEqualTo("ID");
        assertThat(StringUtils.decapitalize("OnStartGame")).isEqualTo("onStartGame");
        assertThat(StringUtils.capitalize("")).isEmpty();
    }

    @Test
    public void testToIdentifier() {
        assertThat(StringUtils.toIdentifier("get-player")).isEqualTo("get_player");
        assertThat(StringUtils.toIdentifier("1st")).isEqualTo("_1st");
        assertThat(StringUtils.toIdentifier("ok_name")).isEqualTo("ok_name");
    }

    @Test
    public void testQuote() {
        assertThat(StringUtils.quote("say \"hi\"\n")).isEqualTo("\"say \\\"hi\\\"\\n\"");
        assertThat(StringUtils.quote("a\\b")).isEqualTo("\"a\\\\b\"");
    }
}

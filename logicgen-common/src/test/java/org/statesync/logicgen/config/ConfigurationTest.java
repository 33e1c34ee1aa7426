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

package org.statesync.logicgen.config;

import org.statesync.logicgen.exception.IllegalConfigurationException;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Configuration}. */
public class ConfigurationTest {

    private static final ConfigOption<Boolean> FLAG =
            ConfigOptions.key("test.flag").booleanType().defaultValue(false);

    private static final ConfigOption<Integer> COUNT =
            ConfigOptions.key("test.count").intType().defaultValue(3);

    private static final ConfigOption<String> NAME =
            ConfigOptions.key("test.name").stringType().noDefaultValue();

    @Test
    public void testDefaultValues() {
        Configuration conf = new Configuration();
        assertThat(conf.get(FLAG)).isFalse();
        assertThat(conf.get(COUNT)).isEqualTo(3);
        assertThat(conf.get(NAME)).isNull();
        assertThat(conf.getOptional(NAME)).isEmpty();
        assertThat(conf.contains(COUNT)).isFalse();
    }

    @Test
    public void testSetAndGet() {
        Configuration conf = new Configuration().set(FLAG, true).set(NAME, "Handlers");
        assertThat(conf.get(FLAG)).isTrue();
        assertThat(conf.get(NAME)).isEqualTo("Handlers");
        assertThat(conf.contains(FLAG)).isTrue();

        Configuration copy = new Configuration(conf);
        copy.set(FLAG, false);
        assertThat(conf.get(FLAG)).isTrue();
        assertThat(copy.get(FLAG)).isFalse();
    }

    @Test
    public void testStringValuesAreConverted() {
        Configuration conf =
                Configuration.fromMap(Collections.singletonMap("test.count", " 12 "));
        assertThat(conf.get(COUNT)).isEqualTo(12);
        conf.setString("test.flag", "TRUE");
        assertThat(conf.get(FLAG)).isTrue();
    }

    @Test
    public void testInvalidValues() {
        Configuration conf = new Configuration().setString("test.count", "many");
        assertThatThrownBy(() -> conf.get(COUNT))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("test.count");

        conf.setString("test.flag", "yes");
        assertThatThrownBy(() -> conf.get(FLAG))
                .isInstanceOf(IllegalConfigurationException.class)
                .hasMessageContaining("boolean");
    }
}

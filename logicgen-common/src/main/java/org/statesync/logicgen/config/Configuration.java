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

import org.statesync.logicgen.annotation.PublicEvolving;
import org.statesync.logicgen.exception.IllegalConfigurationException;

import javax.annotation.Nullable;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * Lightweight configuration object which stores key/value pairs. Values are kept as strings and
 * converted to the option type on read, so a configuration can be filled from command line flags
 * or property files alike.
 */
@PublicEvolving
public class Configuration {

    /** Stores the concrete key/value pairs of this configuration object. */
    private final HashMap<String, String> confData;

    /** Creates a new empty configuration. */
    public Configuration() {
        this.confData = new HashMap<>();
    }

    /** Creates a new configuration with the copy of the given configuration. */
    public Configuration(Configuration other) {
        this.confData = new HashMap<>(other.confData);
    }

    /** Creates a new configuration holding the given entries. */
    public static Configuration fromMap(Map<String, String> map) {
        Configuration configuration = new Configuration();
        configuration.confData.putAll(map);
        return configuration;
    }

    /**
     * Returns the value associated with the given config option, or the default value of the
     * option when no value is set.
     */
    public <T> T get(ConfigOption<T> option) {
        return getOptional(option).orElseGet(option::defaultValue);
    }

    /** Returns the value of the given option if it has been set explicitly. */
    public <T> Optional<T> getOptional(ConfigOption<T> option) {
        String raw = confData.get(option.key());
        if (raw == null) {
            return Optional.empty();
        }
        return Optional.of(convert(option, raw));
    }

    /** Whether the given option has been set explicitly. */
    public boolean contains(ConfigOption<?> option) {
        return confData.containsKey(option.key());
    }

    /** Sets the value of the given option. */
    public <T> Configuration set(ConfigOption<T> option, T value) {
        checkNotNull(value, "value must not be null");
        confData.put(option.key(), String.valueOf(value));
        return this;
    }

    /** Sets a raw string value, the value is converted when read through an option. */
    public Configuration setString(String key, String value) {
        confData.put(checkNotNull(key), checkNotNull(value));
        return this;
    }

    @Nullable
    public String getRawValue(String key) {
        return confData.get(key);
    }

    public Map<String, String> toMap() {
        return new HashMap<>(confData);
    }

    @SuppressWarnings("unchecked")
    private static <T> T convert(ConfigOption<T> option, String raw) {
        Class<T> clazz = option.getClazz();
        String value = raw.trim();
        try {
            if (clazz == String.class) {
                return (T) raw;
            } else if (clazz == Boolean.class) {
                if ("true".equalsIgnoreCase(value)) {
                    return (T) Boolean.TRUE;
                } else if ("false".equalsIgnoreCase(value)) {
                    return (T) Boolean.FALSE;
                }
                throw new IllegalConfigurationException(
                        String.format(
                                "Could not parse value '%s' for key '%s' as boolean.",
                                raw, option.key()));
            } else if (clazz == Integer.class) {
                return (T) Integer.valueOf(value);
            } else if (clazz == Long.class) {
                return (T) Long.valueOf(value);
            }
        } catch (NumberFormatException e) {
            throw new IllegalConfigurationException(
                    String.format(
                            "Could not parse value '%s' for key '%s' as %s.",
                            raw, option.key(), clazz.getSimpleName()),
                    e);
        }
        throw new IllegalConfigurationException("Unsupported option type " + clazz.getName());
    }

    @Override
    public String toString() {
        return confData.toString();
    }
}

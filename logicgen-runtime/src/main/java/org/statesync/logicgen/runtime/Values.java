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

package org.statesync.logicgen.runtime;

import org.statesync.logicgen.annotation.PublicEvolving;

import javax.annotation.Nullable;

import java.lang.reflect.Array;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Helpers generated code uses for literal collections and loosely typed checks. */
@PublicEvolving
public final class Values {

    private Values() {}

    /**
     * Builds an insertion-ordered map from alternating keys and values.
     *
     * @throws IllegalArgumentException if an odd number of arguments is given
     */
    public static Map<String, Object> mapOf(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException(
                    "Expected key/value pairs but got " + keysAndValues.length + " arguments.");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return map;
    }

    /** Builds a mutable list. */
    public static List<Object> listOf(Object... values) {
        return new ArrayList<>(Arrays.asList(values));
    }

    /** Null, empty strings, empty collections, empty maps and empty arrays are empty. */
    public static boolean isEmpty(@Nullable Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() == 0;
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) == 0;
        }
        return false;
    }

    /** Length of a string, collection, map or array; zero for {@code null}. */
    public static int sizeOf(@Nullable Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).size();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).size();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value);
        }
        throw new IllegalArgumentException("Value of " + value.getClass() + " has no size.");
    }

    /**
     * Views a loosely typed value as a list. Lists are returned as they are, arrays and other
     * collections are copied, {@code null} becomes an empty list.
     */
    @SuppressWarnings("unchecked")
    public static List<Object> asList(@Nullable Object value) {
        if (value == null) {
            return new ArrayList<>();
        }
        if (value instanceof List) {
            return (List<Object>) value;
        }
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<Object>) value);
        }
        if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        throw new IllegalArgumentException("Value of " + value.getClass() + " is not a list.");
    }

    /**
     * Reads a named property of a loosely typed value: a map entry, or the result of the {@code
     * getX()} or {@code isX()} accessor of a bean.
     */
    @Nullable
    public static Object property(@Nullable Object target, String name) {
        if (target == null) {
            throw new IllegalArgumentException("Cannot read '" + name + "' of null.");
        }
        if (target instanceof Map) {
            return ((Map<?, ?>) target).get(name);
        }
        String suffix = Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (String accessor : new String[] {"get" + suffix, "is" + suffix}) {
            try {
                Method method = target.getClass().getMethod(accessor);
                return method.invoke(target);
            } catch (NoSuchMethodException e) {
                continue;
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new IllegalStateException(
                        "Failed to read '" + name + "' of " + target.getClass().getName(), e);
            }
        }
        throw new IllegalArgumentException(
                target.getClass().getName() + " has no property '" + name + "'.");
    }

    /**
     * Writes a named property of a loosely typed value: a map entry, or through the {@code
     * setX(value)} method of a bean. Numbers are converted to the parameter type of the setter.
     */
    @SuppressWarnings("unchecked")
    public static void setProperty(@Nullable Object target, String name, @Nullable Object value) {
        if (target == null) {
            throw new IllegalArgumentException("Cannot write '" + name + "' of null.");
        }
        if (target instanceof Map) {
            ((Map<String, Object>) target).put(name, value);
            return;
        }
        String setter = "set" + Character.toUpperCase(name.charAt(0)) + name.substring(1);
        for (Method method : target.getClass().getMethods()) {
            if (method.getName().equals(setter) && method.getParameterCount() == 1) {
                try {
                    method.invoke(target, convert(value, method.getParameterTypes()[0]));
                    return;
                } catch (IllegalAccessException | InvocationTargetException e) {
                    throw new IllegalStateException(
                            "Failed to write '" + name + "' of " + target.getClass().getName(),
                            e);
                }
            }
        }
        throw new IllegalArgumentException(
                target.getClass().getName() + " has no writable property '" + name + "'.");
    }

    @Nullable
    private static Object convert(@Nullable Object value, Class<?> type) {
        if (!(value instanceof Number)) {
            return value;
        }
        Number number = (Number) value;
        if (type == int.class || type == Integer.class) {
            return number.intValue();
        }
        if (type == long.class || type == Long.class) {
            return number.longValue();
        }
        if (type == double.class || type == Double.class) {
            return number.doubleValue();
        }
        if (type == float.class || type == Float.class) {
            return number.floatValue();
        }
        return value;
    }

    /** Numeric value of a number, or of a numeric string. */
    public static double toDouble(@Nullable Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof CharSequence) {
            return Double.parseDouble(value.toString());
        }
        throw new IllegalArgumentException("Value " + value + " is not a number.");
    }

    /** Integral value of a number, or of a numeric string; fractions are truncated. */
    public static long toLong(@Nullable Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof CharSequence) {
            return (long) Double.parseDouble(value.toString());
        }
        throw new IllegalArgumentException("Value " + value + " is not a number.");
    }

    /**
     * Orders two loosely typed values. Numbers compare by value across types, other values must
     * be mutually {@link Comparable}.
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compare(@Nullable Object left, @Nullable Object right) {
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof Comparable && right != null) {
            return ((Comparable) left).compareTo(right);
        }
        throw new IllegalArgumentException("Cannot order " + left + " and " + right + ".");
    }

    /** Equality that treats numbers of different boxed types as equal when their values are. */
    public static boolean looseEquals(@Nullable Object left, @Nullable Object right) {
        if (left instanceof Number && right instanceof Number) {
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        return Objects.equals(left, right);
    }
}

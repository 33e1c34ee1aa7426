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

package org.statesync.logicgen.utils.json;

import org.statesync.logicgen.annotation.Internal;

import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/** A utility class that provide abilities for JSON serialization and deserialization. */
@Internal
public class JsonSerdeUtils {

    /**
     * Shared mapper. {@link ObjectMapper} is thread safe once configured, it is never
     * reconfigured after this point.
     */
    public static final ObjectMapper OBJECT_MAPPER_INSTANCE = new ObjectMapper();

    /**
     * Method that can be used to serialize any Java value as a JSON byte array using the given
     * {@link JsonSerializer}.
     */
    public static <T> byte[] writeValueAsBytes(T value, JsonSerializer<T> serializer) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (JsonGenerator generator =
                OBJECT_MAPPER_INSTANCE.getFactory().createGenerator(out, JsonEncoding.UTF8)) {
            serializer.serialize(value, generator);
        } catch (IOException e) {
            throw new UncheckedIOException(
                    String.format("Could not serialize value '%s'.", value), e);
        }
        return out.toByteArray();
    }

    /**
     * Method to deserialize JSON content into a Java value using the given {@link
     * JsonDeserializer}. Malformed content is reported as an {@link IOException}.
     */
    public static <T> T readValue(byte[] json, JsonDeserializer<T> deserializer)
            throws IOException {
        JsonNode node = OBJECT_MAPPER_INSTANCE.readTree(json);
        if (node == null || node.isMissingNode()) {
            throw new IOException("Empty JSON document.");
        }
        return deserializer.deserialize(node);
    }

    private JsonSerdeUtils() {}
}

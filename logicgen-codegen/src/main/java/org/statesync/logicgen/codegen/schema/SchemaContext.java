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
import org.statesync.logicgen.codegen.exception.SchemaResolutionException;
import org.statesync.logicgen.codegen.path.IndexKind;
import org.statesync.logicgen.codegen.path.ParsedPath;
import org.statesync.logicgen.codegen.path.PathSegment;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.statesync.logicgen.utils.Preconditions.checkNotNull;

/**
 * Type lookups against a {@link SchemaDefinition}. The root state type is the first type of the
 * schema. Instances are read-only after construction.
 */
@PublicEvolving
public class SchemaContext {

    private final SchemaDefinition schema;
    private final Map<String, TypeDef> typesByName;

    public SchemaContext(SchemaDefinition schema) {
        this.schema = checkNotNull(schema);
        this.typesByName = new LinkedHashMap<>();
        for (TypeDef type : schema.getTypes()) {
            typesByName.put(type.getName(), type);
        }
    }

    public SchemaDefinition getSchema() {
        return schema;
    }

    public TypeDef getRootType() {
        return schema.getRootType();
    }

    public boolean hasType(String typeName) {
        return typesByName.containsKey(typeName);
    }

    public TypeDef getType(String typeName) {
        TypeDef type = typesByName.get(typeName);
        if (type == null) {
            throw new SchemaResolutionException("Unknown schema type '" + typeName + "'.");
        }
        return type;
    }

    public FieldDef getField(String typeName, String fieldName) {
        FieldDef field = getType(typeName).findField(fieldName);
        if (field == null) {
            throw new SchemaResolutionException(
                    "Type '" + typeName + "' has no field '" + fieldName + "'.");
        }
        return field;
    }

    public FieldAccessInfo getFieldAccessInfo(String typeName, String fieldName) {
        return new FieldAccessInfo(
                typeName, fieldName, getField(typeName, fieldName).getType());
    }

    /** Resolves a path relative to the root state type. */
    public List<ResolvedSegment> resolve(ParsedPath path) {
        return resolve(getRootType().getName(), path);
    }

    /**
     * Walks a path starting at the given record type.
     *
     * @throws SchemaResolutionException if a type or field is unknown, a non-collection field is
     *     indexed, or a segment follows a field that is not a record
     */
    public List<ResolvedSegment> resolve(String rootTypeName, ParsedPath path) {
        List<ResolvedSegment> resolved = new ArrayList<>(path.size());
        String currentType = rootTypeName;
        List<PathSegment> segments = path.getSegments();
        for (int i = 0; i < segments.size(); i++) {
            PathSegment segment = segments.get(i);
            FieldAccessInfo info = getFieldAccessInfo(currentType, segment.getFieldName());
            FieldType valueType = info.getFieldType().unwrapOptional();
            if (segment.isIndexed()) {
                valueType = indexInto(info, valueType, segment, path);
            }
            resolved.add(new ResolvedSegment(segment, info, valueType));
            if (i < segments.size() - 1) {
                if (!valueType.isRecord()) {
                    throw new SchemaResolutionException(
                            "Cannot access '"
                                    + segments.get(i + 1).getFieldName()
                                    + "' on '"
                                    + segment
                                    + "' of type '"
                                    + valueType
                                    + "' in path '"
                                    + path
                                    + "'.");
                }
                currentType = valueType.getName();
            }
        }
        return resolved;
    }

    private FieldType indexInto(
            FieldAccessInfo info, FieldType fieldType, PathSegment segment, ParsedPath path) {
        if (fieldType.getCategory() == FieldType.Category.ARRAY) {
            FieldType element = fieldType.getElementType().unwrapOptional();
            if (segment.getIndexKind() == IndexKind.KEY_LOOKUP) {
                if (!element.isRecord()) {
                    throw new SchemaResolutionException(
                            "Key lookup on '"
                                    + segment
                                    + "' needs an array of records, found '"
                                    + fieldType
                                    + "' in path '"
                                    + path
                                    + "'.");
                }
                getField(element.getName(), segment.getKeyField());
            }
            return element;
        }
        if (fieldType.getCategory() == FieldType.Category.MAP
                && segment.getIndexKind() != IndexKind.KEY_LOOKUP) {
            return fieldType.getElementType().unwrapOptional();
        }
        throw new SchemaResolutionException(
                "Field '"
                        + info.getFieldName()
                        + "' of type '"
                        + fieldType
                        + "' cannot be indexed as '"
                        + segment
                        + "' in path '"
                        + path
                        + "'.");
    }
}

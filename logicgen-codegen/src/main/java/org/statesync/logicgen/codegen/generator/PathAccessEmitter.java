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

import org.statesync.logicgen.codegen.exception.PathParseException;
import org.statesync.logicgen.codegen.exception.SchemaResolutionException;
import org.statesync.logicgen.codegen.graph.Node;
import org.statesync.logicgen.codegen.path.IndexKind;
import org.statesync.logicgen.codegen.path.ParsedPath;
import org.statesync.logicgen.codegen.path.PathParser;
import org.statesync.logicgen.codegen.path.PathSegment;
import org.statesync.logicgen.codegen.schema.FieldAccessInfo;
import org.statesync.logicgen.codegen.schema.FieldType;
import org.statesync.logicgen.codegen.schema.JavaTypes;
import org.statesync.logicgen.codegen.schema.ResolvedSegment;
import org.statesync.logicgen.codegen.schema.SchemaContext;

import javax.annotation.Nullable;

import java.util.List;

import static org.statesync.logicgen.utils.StringUtils.capitalize;
import static org.statesync.logicgen.utils.StringUtils.quote;

/**
 * Turns state paths into accessor chains on the state local.
 *
 * <p>Plain segments become getter calls, indexed segments {@code getXAt(i)} on arrays and {@code
 * getXEntry(k)} on maps. A key lookup {@code players[pid:id]} emits a search loop for the index
 * of the element whose {@code id} equals {@code pid} and throws {@code NotFoundException} when
 * there is none. Without a schema the same accessor names are used, indexed segments are assumed
 * to be arrays and all values are untyped.
 */
final class PathAccessEmitter {

    private final FragmentEmitter context;

    PathAccessEmitter(FragmentEmitter context) {
        this.context = context;
    }

    JavaExpression read(Node node, String text) {
        Target target = resolve(node, text);
        return target.read();
    }

    void write(Node node, String text, JavaExpression value) {
        Target target = resolve(node, text);
        PathSegment last = target.segment;
        FieldAccessInfo info = target.info;
        String owner = target.owner.getCode();
        String coerced = Coercions.coerceTo(target.valueType, value);
        switch (last.getIndexKind()) {
            case NONE:
                context.code().stmt(owner + "." + info.getSetterName() + "(" + coerced + ")");
                break;
            case LITERAL:
            case VARIABLE:
                if (info.isMap()) {
                    context.code()
                            .stmt(
                                    owner
                                            + "."
                                            + info.getPutEntryName()
                                            + "("
                                            + mapKey(node, target)
                                            + ", "
                                            + coerced
                                            + ")");
                } else {
                    context.code()
                            .stmt(
                                    owner
                                            + "."
                                            + info.getUpdateAtName()
                                            + "("
                                            + arrayIndex(node, last)
                                            + ", "
                                            + coerced
                                            + ")");
                }
                break;
            case KEY_LOOKUP:
                String index = findByKey(node, target.owner, info, last);
                context.code()
                        .stmt(
                                owner
                                        + "."
                                        + info.getUpdateAtName()
                                        + "("
                                        + index
                                        + ", "
                                        + coerced
                                        + ")");
                break;
            default:
                throw new IllegalStateException("Unknown index kind " + last.getIndexKind());
        }
    }

    void append(Node node, String text, JavaExpression element) {
        Target target = requireCollection(node, text, false);
        context.code()
                .stmt(
                        target.owner.getCode()
                                + "."
                                + target.info.getAppendName()
                                + "("
                                + Coercions.coerceTo(target.info.getElementJavaType(), element)
                                + ")");
    }

    void removeAt(Node node, String text, JavaExpression index) {
        Target target = requireCollection(node, text, false);
        context.code()
                .stmt(
                        target.owner.getCode()
                                + "."
                                + target.info.getRemoveAtName()
                                + "("
                                + Coercions.toInt(index)
                                + ")");
    }

    void putEntry(Node node, String text, JavaExpression key, JavaExpression value) {
        Target target = requireCollection(node, text, true);
        context.code()
                .stmt(
                        target.owner.getCode()
                                + "."
                                + target.info.getPutEntryName()
                                + "("
                                + Coercions.coerceTo(mapKeyType(target.info), key)
                                + ", "
                                + Coercions.coerceTo(target.info.getElementJavaType(), value)
                                + ")");
    }

    void removeEntry(Node node, String text, JavaExpression key) {
        Target target = requireCollection(node, text, true);
        context.code()
                .stmt(
                        target.owner.getCode()
                                + "."
                                + target.info.getRemoveEntryName()
                                + "("
                                + Coercions.coerceTo(mapKeyType(target.info), key)
                                + ")");
    }

    // ==================== Resolution ====================

    private Target requireCollection(Node node, String text, boolean map) {
        Target target = resolve(node, text);
        if (target.segment.isIndexed()) {
            throw context.error(
                    node,
                    "path '"
                            + text
                            + "' must end at a"
                            + (map ? " map" : "n array")
                            + " field, not at an element");
        }
        if (target.info.isTyped() && (map ? !target.info.isMap() : !target.info.isArray())) {
            throw context.error(
                    node,
                    "path '"
                            + text
                            + "' is of type '"
                            + target.info.getFieldType()
                            + "', expected "
                            + (map ? "a map" : "an array"));
        }
        return target;
    }

    /** Resolves all segments but the last into an owner expression. */
    private Target resolve(Node node, String text) {
        ParsedPath path;
        try {
            path = PathParser.parse(text);
        } catch (PathParseException e) {
            throw new PathParseException(context.prefix(node) + e.getMessage(), e);
        }
        SchemaContext schema = context.getSchema();
        List<ResolvedSegment> resolved = null;
        if (schema != null) {
            try {
                resolved = schema.resolve(path);
            } catch (SchemaResolutionException e) {
                throw new SchemaResolutionException(context.prefix(node) + e.getMessage(), e);
            }
        }
        List<PathSegment> segments = path.getSegments();
        JavaExpression current =
                JavaExpression.of(context.stateVariable(), context.getStateType());
        for (int i = 0; i < segments.size() - 1; i++) {
            PathSegment segment = segments.get(i);
            FieldAccessInfo info = accessInfo(resolved, i, segment, current);
            String valueType = resolved == null ? null : resolved.get(i).getValueJavaType();
            current = JavaExpression.of(access(node, current, info, segment), valueType);
        }
        int last = segments.size() - 1;
        PathSegment segment = segments.get(last);
        return new Target(
                node,
                current,
                segment,
                accessInfo(resolved, last, segment, current),
                resolved == null ? null : resolved.get(last).getValueJavaType());
    }

    private FieldAccessInfo accessInfo(
            @Nullable List<ResolvedSegment> resolved,
            int position,
            PathSegment segment,
            JavaExpression owner) {
        if (resolved != null) {
            return resolved.get(position).getAccessInfo();
        }
        return FieldAccessInfo.untyped(owner.getDeclarationType(), segment.getFieldName());
    }

    /** Code reading one segment from its owner. */
    private String access(
            Node node, JavaExpression owner, FieldAccessInfo info, PathSegment segment) {
        String code = owner.getCode();
        switch (segment.getIndexKind()) {
            case NONE:
                return code + "." + info.getGetterName() + "()";
            case LITERAL:
            case VARIABLE:
                if (info.isMap()) {
                    return code
                            + "."
                            + info.getGetEntryName()
                            + "("
                            + mapKey(node, info, segment)
                            + ")";
                }
                return code + "." + info.getGetAtName() + "(" + arrayIndex(node, segment) + ")";
            case KEY_LOOKUP:
                String index = findByKey(node, owner, info, segment);
                return code + "." + info.getGetAtName() + "(" + index + ")";
            default:
                throw new IllegalStateException("Unknown index kind " + segment.getIndexKind());
        }
    }

    /**
     * Emits the search for the element whose key field equals the lookup variable and returns
     * the local holding its index.
     */
    private String findByKey(
            Node node, JavaExpression owner, FieldAccessInfo info, PathSegment segment) {
        JavaExpression key = resolveIndexVariable(node, segment.getIndexValue());
        String ownerCode = owner.getCode();
        String index = context.newLocal(segment.getFieldName() + "Index");
        String counter = context.newLocal("i");
        String keyGetter = "get" + capitalize(segment.getKeyField()) + "()";
        context.addImport("org.statesync.logicgen.runtime.NotFoundException");
        context.markThrowsChecked();
        context.code()
                .declare("int", index, "-1")
                .beginFor(
                        "int " + counter + " = 0",
                        counter + " < " + ownerCode + "." + info.getSizeName() + "()",
                        counter + "++")
                .beginIf(
                        "Values.looseEquals("
                                + ownerCode
                                + "."
                                + info.getGetAtName()
                                + "("
                                + counter
                                + ")."
                                + keyGetter
                                + ", "
                                + key.getCode()
                                + ")")
                .assign(index, counter)
                .breakStmt()
                .endIf()
                .endFor()
                .beginIf(index + " < 0")
                .throwStmt(
                        "new NotFoundException("
                                + quote(
                                        "no element of '"
                                                + segment.getFieldName()
                                                + "' with "
                                                + segment.getKeyField()
                                                + " ")
                                + " + "
                                + key.getCode()
                                + ")")
                .endIf();
        return index;
    }

    private String arrayIndex(Node node, PathSegment segment) {
        if (segment.getIndexKind() == IndexKind.LITERAL) {
            return segment.getIndexValue();
        }
        return Coercions.toInt(resolveIndexVariable(node, segment.getIndexValue()));
    }

    private String mapKey(Node node, Target target) {
        return mapKey(node, target.info, target.segment);
    }

    private String mapKey(Node node, FieldAccessInfo info, PathSegment segment) {
        String keyType = mapKeyType(info);
        if (segment.getIndexKind() == IndexKind.LITERAL) {
            return "String".equals(keyType)
                    ? quote(segment.getIndexValue())
                    : segment.getIndexValue();
        }
        return Coercions.coerceTo(keyType, resolveIndexVariable(node, segment.getIndexValue()));
    }

    @Nullable
    private static String mapKeyType(FieldAccessInfo info) {
        FieldType type = info.getFieldType();
        if (type == null || !type.unwrapOptional().isMap()) {
            return null;
        }
        return JavaTypes.boxed(JavaTypes.toJavaType(type.unwrapOptional().getKeyType()));
    }

    /**
     * The value of a variable used inside brackets: a parameter, the sender id, a graph variable
     * or a slot of the innermost loop, in that order.
     */
    private JavaExpression resolveIndexVariable(Node node, String name) {
        JavaExpression parameter = context.getFrame().getParameters().get(name);
        if (parameter != null) {
            return parameter;
        }
        String sender = context.senderVariable();
        if (sender != null && sender.equals(name)) {
            return JavaExpression.of(sender, "String");
        }
        if (context.isKnownVariable(name)) {
            return context.readVariable(node, name);
        }
        LoopScope loop = context.currentLoop();
        if (loop != null && "item".equals(name) && loop.getItem() != null) {
            return loop.getItem();
        }
        if (loop != null && "index".equals(name) && loop.getIndex() != null) {
            return loop.getIndex();
        }
        throw context.referenceError(
                node,
                "path variable '"
                        + name
                        + "' is not a parameter, the sender, a variable or a loop slot");
    }

    /** The last segment of a path and the expression owning it. */
    private final class Target {
        private final Node node;
        private final JavaExpression owner;
        private final PathSegment segment;
        private final FieldAccessInfo info;
        @Nullable private final String valueType;

        private Target(
                Node node,
                JavaExpression owner,
                PathSegment segment,
                FieldAccessInfo info,
                @Nullable String valueType) {
            this.node = node;
            this.owner = owner;
            this.segment = segment;
            this.info = info;
            this.valueType = valueType;
        }

        JavaExpression read() {
            return JavaExpression.of(access(node, owner, info, segment), valueType);
        }
    }
}

/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.apache.tessera.types;

import org.apache.tessera.annotation.Public;
import org.apache.tessera.data.columnar.BatchOptions;
import org.apache.tessera.data.columnar.ColumnVectorBatch;
import org.apache.tessera.data.columnar.Decimal128VectorBatch;
import org.apache.tessera.data.columnar.Decimal64VectorBatch;
import org.apache.tessera.data.columnar.DoubleVectorBatch;
import org.apache.tessera.data.columnar.EncodedStringVectorBatch;
import org.apache.tessera.data.columnar.ListVectorBatch;
import org.apache.tessera.data.columnar.LongVectorBatch;
import org.apache.tessera.data.columnar.MapVectorBatch;
import org.apache.tessera.data.columnar.StringVectorBatch;
import org.apache.tessera.data.columnar.StructVectorBatch;
import org.apache.tessera.data.columnar.TimestampVectorBatch;
import org.apache.tessera.data.columnar.UnionVectorBatch;
import org.apache.tessera.memory.MemoryPool;
import org.apache.tessera.options.Options;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkNotNull;
import static org.apache.tessera.utils.Preconditions.checkState;

/**
 * 列的类型形状,决定分配哪种列向量批次以及需要多少子批次。
 *
 * <p>类型形状由外部的类型描述系统提供,这里只关心形状本身,不负责它的序列化。
 *
 * <h2>类型到批次的映射</h2>
 * <ul>
 *   <li>BOOLEAN/BYTE/SHORT/INT/LONG/DATE → {@link LongVectorBatch}
 *   <li>FLOAT/DOUBLE → {@link DoubleVectorBatch}
 *   <li>STRING/VARCHAR/CHAR/BINARY → {@link StringVectorBatch},或编码模式下的
 *       {@link EncodedStringVectorBatch}
 *   <li>DECIMAL → 精度不超过 18 时为 {@link Decimal64VectorBatch},否则为 {@link Decimal128VectorBatch}
 *   <li>TIMESTAMP → {@link TimestampVectorBatch}
 *   <li>STRUCT/LIST/MAP/UNION → 对应的嵌套批次,子批次递归分配
 * </ul>
 *
 * <pre>{@code
 * TypeDescription schema =
 *         TypeDescription.createStruct()
 *                 .addField("id", TypeDescription.createLong())
 *                 .addField("tags", TypeDescription.createList(TypeDescription.createString()));
 * ColumnVectorBatch batch = schema.createRowBatch(1024, pool);
 * }</pre>
 */
@Public
public final class TypeDescription {

    public static final int DEFAULT_PRECISION = 38;
    public static final int DEFAULT_SCALE = 10;

    private final TypeKind kind;
    private final List<TypeDescription> children = new ArrayList<>();
    private final List<String> fieldNames = new ArrayList<>();
    private int precision = DEFAULT_PRECISION;
    private int scale = DEFAULT_SCALE;

    private TypeDescription(TypeKind kind) {
        this.kind = kind;
    }

    public static TypeDescription createBoolean() {
        return new TypeDescription(TypeKind.BOOLEAN);
    }

    public static TypeDescription createInt() {
        return new TypeDescription(TypeKind.INT);
    }

    public static TypeDescription createLong() {
        return new TypeDescription(TypeKind.LONG);
    }

    public static TypeDescription createDate() {
        return new TypeDescription(TypeKind.DATE);
    }

    public static TypeDescription createDouble() {
        return new TypeDescription(TypeKind.DOUBLE);
    }

    public static TypeDescription createString() {
        return new TypeDescription(TypeKind.STRING);
    }

    public static TypeDescription createBinary() {
        return new TypeDescription(TypeKind.BINARY);
    }

    public static TypeDescription createTimestamp() {
        return new TypeDescription(TypeKind.TIMESTAMP);
    }

    public static TypeDescription createDecimal() {
        return new TypeDescription(TypeKind.DECIMAL);
    }

    public static TypeDescription createPrimitive(TypeKind kind) {
        checkArgument(!kind.isNested(), "%s is not a primitive type", kind);
        return new TypeDescription(kind);
    }

    public static TypeDescription createStruct() {
        return new TypeDescription(TypeKind.STRUCT);
    }

    public static TypeDescription createList(TypeDescription elementType) {
        TypeDescription result = new TypeDescription(TypeKind.LIST);
        result.children.add(checkNotNull(elementType));
        return result;
    }

    public static TypeDescription createMap(TypeDescription keyType, TypeDescription valueType) {
        TypeDescription result = new TypeDescription(TypeKind.MAP);
        result.children.add(checkNotNull(keyType));
        result.children.add(checkNotNull(valueType));
        return result;
    }

    public static TypeDescription createUnion() {
        return new TypeDescription(TypeKind.UNION);
    }

    public TypeDescription withPrecision(int precision) {
        checkState(kind == TypeKind.DECIMAL, "precision is only allowed on decimal, not %s", kind);
        checkArgument(
                precision >= 1 && precision <= Decimal128VectorBatch.MAX_PRECISION,
                "precision %s is out of range [1, %s]",
                precision,
                Decimal128VectorBatch.MAX_PRECISION);
        checkArgument(scale <= precision, "precision %s is smaller than scale %s", precision, scale);
        this.precision = precision;
        return this;
    }

    public TypeDescription withScale(int scale) {
        checkState(kind == TypeKind.DECIMAL, "scale is only allowed on decimal, not %s", kind);
        checkArgument(
                scale >= 0 && scale <= precision,
                "scale %s is out of range [0, %s]",
                scale,
                precision);
        this.scale = scale;
        return this;
    }

    public TypeDescription addField(String name, TypeDescription fieldType) {
        checkState(kind == TypeKind.STRUCT, "Can only add fields to struct type, not %s", kind);
        fieldNames.add(checkNotNull(name));
        children.add(checkNotNull(fieldType));
        return this;
    }

    public TypeDescription addUnionChild(TypeDescription child) {
        checkState(kind == TypeKind.UNION, "Can only add union children to union, not %s", kind);
        children.add(checkNotNull(child));
        return this;
    }

    public TypeKind getKind() {
        return kind;
    }

    public List<TypeDescription> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<String> getFieldNames() {
        return Collections.unmodifiableList(fieldNames);
    }

    public int getPrecision() {
        return precision;
    }

    public int getScale() {
        return scale;
    }

    // ------------------------------------------------------------------------
    //  Batch allocation
    // ------------------------------------------------------------------------

    /** 按 {@link BatchOptions#READ_BATCH_SIZE} 分配批次。 */
    public ColumnVectorBatch createRowBatch(Options options, MemoryPool pool) {
        return createRowBatch(options.get(BatchOptions.READ_BATCH_SIZE), pool);
    }

    public ColumnVectorBatch createRowBatch(int capacity, MemoryPool pool) {
        return createRowBatch(capacity, pool, false);
    }

    /** 与 {@link #createRowBatch(int, MemoryPool)} 相同,但字符串列使用字典编码批次。 */
    public ColumnVectorBatch createEncodedRowBatch(int capacity, MemoryPool pool) {
        return createRowBatch(capacity, pool, true);
    }

    private ColumnVectorBatch createRowBatch(int capacity, MemoryPool pool, boolean encoded) {
        switch (kind) {
            case BOOLEAN:
            case BYTE:
            case SHORT:
            case INT:
            case LONG:
            case DATE:
                return LongVectorBatch.create(capacity, pool);
            case FLOAT:
            case DOUBLE:
                return DoubleVectorBatch.create(capacity, pool);
            case STRING:
            case VARCHAR:
            case CHAR:
            case BINARY:
                return encoded
                        ? EncodedStringVectorBatch.create(capacity, pool)
                        : StringVectorBatch.create(capacity, pool);
            case DECIMAL:
                return precision <= Decimal64VectorBatch.MAX_PRECISION
                        ? Decimal64VectorBatch.create(capacity, pool, precision, scale)
                        : Decimal128VectorBatch.create(capacity, pool, precision, scale);
            case TIMESTAMP:
                return TimestampVectorBatch.create(capacity, pool);
            case STRUCT:
            case LIST:
            case MAP:
            case UNION:
                List<ColumnVectorBatch> childBatches = createChildBatches(capacity, pool, encoded);
                try {
                    return createNestedBatch(capacity, pool, childBatches);
                } catch (RuntimeException e) {
                    closeAll(childBatches);
                    throw e;
                }
            default:
                throw new IllegalArgumentException("Unknown type " + kind);
        }
    }

    private ColumnVectorBatch createNestedBatch(
            int capacity, MemoryPool pool, List<ColumnVectorBatch> childBatches) {
        switch (kind) {
            case STRUCT:
                return StructVectorBatch.create(capacity, pool, childBatches);
            case LIST:
                return ListVectorBatch.create(capacity, pool, childBatches.get(0));
            case MAP:
                return MapVectorBatch.create(
                        capacity, pool, childBatches.get(0), childBatches.get(1));
            case UNION:
                return UnionVectorBatch.create(capacity, pool, childBatches);
            default:
                throw new IllegalStateException(kind + " is not a nested type");
        }
    }

    private List<ColumnVectorBatch> createChildBatches(
            int capacity, MemoryPool pool, boolean encoded) {
        List<ColumnVectorBatch> batches = new ArrayList<>(children.size());
        try {
            for (TypeDescription child : children) {
                batches.add(child.createRowBatch(capacity, pool, encoded));
            }
        } catch (RuntimeException e) {
            closeAll(batches);
            throw e;
        }
        return batches;
    }

    private static void closeAll(List<ColumnVectorBatch> batches) {
        for (ColumnVectorBatch batch : batches) {
            batch.close();
        }
    }

    // ------------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TypeDescription)) {
            return false;
        }
        TypeDescription that = (TypeDescription) o;
        return kind == that.kind
                && precision == that.precision
                && scale == that.scale
                && children.equals(that.children)
                && fieldNames.equals(that.fieldNames);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, children, fieldNames, precision, scale);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(kind.typeName());
        switch (kind) {
            case DECIMAL:
                builder.append('(').append(precision).append(',').append(scale).append(')');
                break;
            case STRUCT:
                builder.append('<');
                for (int i = 0; i < children.size(); i++) {
                    if (i != 0) {
                        builder.append(',');
                    }
                    builder.append(fieldNames.get(i)).append(':').append(children.get(i));
                }
                builder.append('>');
                break;
            case LIST:
            case MAP:
            case UNION:
                builder.append('<');
                for (int i = 0; i < children.size(); i++) {
                    if (i != 0) {
                        builder.append(',');
                    }
                    builder.append(children.get(i));
                }
                builder.append('>');
                break;
            default:
                break;
        }
        return builder.toString();
    }
}

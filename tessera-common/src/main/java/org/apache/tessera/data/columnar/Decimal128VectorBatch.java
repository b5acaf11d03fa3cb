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

package org.apache.tessera.data.columnar;

import org.apache.tessera.data.Decimal;
import org.apache.tessera.memory.Int128DataBuffer;
import org.apache.tessera.memory.LongDataBuffer;
import org.apache.tessera.memory.MemoryPool;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/** 精度不超过 38 位的定点小数列批次,未缩放值以 {@link org.apache.tessera.data.Int128} 保存。 */
public class Decimal128VectorBatch extends ColumnVectorBatch {

    public static final int MAX_PRECISION = 38;

    private final int precision;

    private final int scale;

    public final Int128DataBuffer values;

    /** Scales read from legacy files, only accessed through {@link DecimalReadScales}. */
    final LongDataBuffer readScales;

    Decimal128VectorBatch(int capacity, MemoryPool pool, int precision, int scale) {
        super(capacity, pool, false);
        this.precision = precision;
        this.scale = scale;
        this.values = allocateBuffer(() -> new Int128DataBuffer(pool, capacity));
        this.readScales = allocateBuffer(() -> new LongDataBuffer(pool, capacity), values);
    }

    public static Decimal128VectorBatch create(
            int capacity, MemoryPool pool, int precision, int scale) {
        checkArgument(
                precision > 0 && precision <= MAX_PRECISION,
                "Decimal128 precision must be in [1, %s], but is %s",
                MAX_PRECISION,
                precision);
        checkArgument(
                scale >= 0 && scale <= precision,
                "Scale %s must be in [0, precision %s]",
                scale,
                precision);
        return new Decimal128VectorBatch(capacity, pool, precision, scale);
    }

    @Override
    public BatchKind kind() {
        return BatchKind.DECIMAL128;
    }

    @Override
    public <R> R accept(ColumnVectorBatchVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public int getPrecision() {
        return precision;
    }

    public int getScale() {
        return scale;
    }

    public Decimal getDecimal(int i) {
        return new Decimal(values.get(i), scale);
    }

    @Override
    public void resize(int capacity) {
        if (getCapacity() < capacity) {
            super.resize(capacity);
            values.resize(capacity);
            readScales.resize(capacity);
        }
    }

    @Override
    public long getMemoryUsage() {
        return super.getMemoryUsage() + values.getMemoryUsage() + readScales.getMemoryUsage();
    }

    @Override
    protected void filterValues(boolean[] selection, int selectionLength, int trueCount) {
        values.compact(selection, selectionLength);
        readScales.compact(selection, selectionLength);
    }

    @Override
    protected void closeBuffers() {
        values.close();
        readScales.close();
    }

    @Override
    public String toString() {
        return "Decimal128(" + precision + ", " + scale + ") vector <" + sizeString() + ">";
    }
}

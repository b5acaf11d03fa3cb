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
import org.apache.tessera.memory.LongDataBuffer;
import org.apache.tessera.memory.MemoryPool;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 精度不超过 18 位的定点小数列批次。
 *
 * <p>每行的未缩放值保存在 {@link #values} 中,{@link #getPrecision()} 和 {@link #getScale()}
 * 对整个批次生效。
 */
public class Decimal64VectorBatch extends ColumnVectorBatch {

    public static final int MAX_PRECISION = 18;

    // total number of digits
    private final int precision;

    // the number of places after the decimal
    private final int scale;

    public final LongDataBuffer values;

    /** Scales read from legacy files, only accessed through {@link DecimalReadScales}. */
    final LongDataBuffer readScales;

    Decimal64VectorBatch(int capacity, MemoryPool pool, int precision, int scale) {
        super(capacity, pool, false);
        this.precision = precision;
        this.scale = scale;
        this.values = allocateBuffer(() -> new LongDataBuffer(pool, capacity));
        this.readScales = allocateBuffer(() -> new LongDataBuffer(pool, capacity), values);
    }

    public static Decimal64VectorBatch create(
            int capacity, MemoryPool pool, int precision, int scale) {
        checkArgument(
                precision > 0 && precision <= MAX_PRECISION,
                "Decimal64 precision must be in [1, %s], but is %s",
                MAX_PRECISION,
                precision);
        checkArgument(
                scale >= 0 && scale <= precision,
                "Scale %s must be in [0, precision %s]",
                scale,
                precision);
        return new Decimal64VectorBatch(capacity, pool, precision, scale);
    }

    @Override
    public BatchKind kind() {
        return BatchKind.DECIMAL64;
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
        return "Decimal64(" + precision + ", " + scale + ") vector <" + sizeString() + ">";
    }
}

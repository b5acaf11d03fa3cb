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

package org.apache.tessera.memory;

import java.util.Arrays;

/** double 缓冲区,用于浮点列的值。 */
public class DoubleDataBuffer extends DataBuffer {

    private double[] data;

    public DoubleDataBuffer(MemoryPool pool, int capacity) {
        super(pool, capacity);
    }

    @Override
    public int elementSize() {
        return Double.BYTES;
    }

    @Override
    protected void allocate(int newCapacity) {
        data = data == null ? new double[newCapacity] : Arrays.copyOf(data, newCapacity);
    }

    public double get(int i) {
        return data[i];
    }

    public void set(int i, double value) {
        data[i] = value;
    }

    /** 直接访问底层数组,数组在 {@link #resize(int)} 后会被替换。 */
    public double[] array() {
        return data;
    }

    public void fill(int fromIndex, int toIndex, double value) {
        Arrays.fill(data, fromIndex, toIndex, value);
    }

    /**
     * 按选择向量就地压缩前 {@code length} 个元素,被选中的元素保持原有相对顺序移到前部。
     *
     * @return 保留的元素个数
     */
    public int compact(boolean[] selection, int length) {
        int j = 0;
        for (int i = 0; i < length; i++) {
            if (selection[i]) {
                data[j++] = data[i];
            }
        }
        return j;
    }
}

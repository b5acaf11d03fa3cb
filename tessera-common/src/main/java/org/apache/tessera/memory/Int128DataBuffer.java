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

import org.apache.tessera.data.Int128;

import java.util.Arrays;

/**
 * {@link Int128} 缓冲区。
 *
 * <p>高 64 位和低 64 位分别存放在两个平行的 long 数组中,避免为每个元素创建对象。
 */
public class Int128DataBuffer extends DataBuffer {

    private long[] high;

    private long[] low;

    public Int128DataBuffer(MemoryPool pool, int capacity) {
        super(pool, capacity);
    }

    @Override
    public int elementSize() {
        return 2 * Long.BYTES;
    }

    @Override
    protected void allocate(int newCapacity) {
        if (high == null) {
            high = new long[newCapacity];
            low = new long[newCapacity];
        } else {
            high = Arrays.copyOf(high, newCapacity);
            low = Arrays.copyOf(low, newCapacity);
        }
    }

    public Int128 get(int i) {
        return new Int128(high[i], low[i]);
    }

    public void set(int i, Int128 value) {
        high[i] = value.getHighBits();
        low[i] = value.getLowBits();
    }

    public long getHighBits(int i) {
        return high[i];
    }

    public long getLowBits(int i) {
        return low[i];
    }

    /** 按选择向量就地压缩前 {@code length} 个元素。 */
    public int compact(boolean[] selection, int length) {
        int j = 0;
        for (int i = 0; i < length; i++) {
            if (selection[i]) {
                high[j] = high[i];
                low[j] = low[i];
                j++;
            }
        }
        return j;
    }
}

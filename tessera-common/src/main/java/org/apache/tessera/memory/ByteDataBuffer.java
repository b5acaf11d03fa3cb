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

/** 字节缓冲区,用于 notNull 位图、字符串 blob 和 union 标签。 */
public class ByteDataBuffer extends DataBuffer {

    private byte[] data;

    public ByteDataBuffer(MemoryPool pool, int capacity) {
        super(pool, capacity);
    }

    @Override
    public int elementSize() {
        return Byte.BYTES;
    }

    @Override
    protected void allocate(int newCapacity) {
        data = data == null ? new byte[newCapacity] : Arrays.copyOf(data, newCapacity);
    }

    public byte get(int i) {
        return data[i];
    }

    public void set(int i, byte value) {
        data[i] = value;
    }

    /** 直接访问底层数组,数组在 {@link #resize(int)} 后会被替换。 */
    public byte[] array() {
        return data;
    }

    /** 把 {@code src[srcOffset, srcOffset + length)} 复制到 {@code offset} 处。 */
    public void put(int offset, byte[] src, int srcOffset, int length) {
        System.arraycopy(src, srcOffset, data, offset, length);
    }

    public void fill(int fromIndex, int toIndex, byte value) {
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

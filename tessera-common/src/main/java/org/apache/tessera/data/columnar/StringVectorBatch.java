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

import org.apache.tessera.memory.ByteDataBuffer;
import org.apache.tessera.memory.LongDataBuffer;
import org.apache.tessera.memory.MemoryAllocationException;
import org.apache.tessera.memory.MemoryPool;

import java.nio.charset.StandardCharsets;

/**
 * 字符串和二进制列批次。
 *
 * <h2>内存布局</h2>
 * <pre>
 * ┌─────────────────────┐
 * │ notNull             │  每行是否有值
 * ├─────────────────────┤
 * │ start               │  每行在 blob 中的起始位置
 * │ [0, 5, 5, 12, ...]  │
 * ├─────────────────────┤
 * │ length              │  每行的字节数
 * │ [5, 0, 7, 3, ...]   │
 * ├─────────────────────┤
 * │ blob                │  所有取值首尾相接
 * │ [h,e,l,l,o,...]     │
 * └─────────────────────┘
 * </pre>
 *
 * <p>行选择只压缩 {@code start}/{@code length},不压缩 blob:未被选中的字节仍然留在
 * blob 里但不再被引用,以避免每次过滤都复制全部字节。
 *
 * <p>{@link #getBytes(int)} 返回的视图在 blob 扩容之前有效。
 */
public class StringVectorBatch extends ColumnVectorBatch {

    // the start of each value in the blob
    public final LongDataBuffer start;

    // the length of each value
    public final LongDataBuffer length;

    public final ByteDataBuffer blob;

    private int blobSize;

    StringVectorBatch(int capacity, MemoryPool pool) {
        this(capacity, pool, false);
    }

    StringVectorBatch(int capacity, MemoryPool pool, boolean isEncoded) {
        super(capacity, pool, isEncoded);
        this.start = allocateBuffer(() -> new LongDataBuffer(pool, capacity));
        this.length = allocateBuffer(() -> new LongDataBuffer(pool, capacity), start);
        this.blob = allocateBuffer(() -> new ByteDataBuffer(pool, 0), start, length);
    }

    public static StringVectorBatch create(int capacity, MemoryPool pool) {
        return new StringVectorBatch(capacity, pool);
    }

    @Override
    public BatchKind kind() {
        return BatchKind.STRING;
    }

    @Override
    public <R> R accept(ColumnVectorBatchVisitor<R> visitor) {
        return visitor.visit(this);
    }

    /** 把取值复制到 blob 末尾,并让第 {@code row} 行指向它。 */
    public void setValue(int row, byte[] value, int offset, int len) {
        reserveBytes((long) blobSize + len);
        blob.put(blobSize, value, offset, len);
        start.set(row, blobSize);
        length.set(row, len);
        blobSize += len;
    }

    public void setValue(int row, byte[] value) {
        setValue(row, value, 0, value.length);
    }

    public void setString(int row, String value) {
        setValue(row, value.getBytes(StandardCharsets.UTF_8));
    }

    public BytesView getBytes(int row) {
        return new BytesView(blob.array(), (int) start.get(row), (int) length.get(row));
    }

    public String getString(int row) {
        return getBytes(row).toString();
    }

    /** 已写入 blob 的字节数,包括过滤后不再被引用的字节。 */
    public int getBlobSize() {
        return blobSize;
    }

    private void reserveBytes(long required) {
        if (required > blob.capacity()) {
            long newCapacity = Math.max(required, blob.capacity() * 2L);
            if (required > Integer.MAX_VALUE - 8) {
                throw new MemoryAllocationException(
                        String.format(
                                "The string blob would grow to %s bytes which overflows a single "
                                        + "buffer. Try reduce `read.batch-size` to avoid this.",
                                required));
            }
            blob.resize((int) Math.min(newCapacity, Integer.MAX_VALUE - 8));
        }
    }

    @Override
    public void resize(int capacity) {
        if (getCapacity() < capacity) {
            super.resize(capacity);
            start.resize(capacity);
            length.resize(capacity);
        }
    }

    @Override
    public void clear() {
        super.clear();
        blobSize = 0;
    }

    @Override
    public long getMemoryUsage() {
        return super.getMemoryUsage()
                + start.getMemoryUsage()
                + length.getMemoryUsage()
                + blob.getMemoryUsage();
    }

    @Override
    public boolean hasVariableLength() {
        return true;
    }

    @Override
    protected void filterValues(boolean[] selection, int selectionLength, int trueCount) {
        start.compact(selection, selectionLength);
        length.compact(selection, selectionLength);
    }

    @Override
    protected void closeBuffers() {
        start.close();
        length.close();
        blob.close();
    }

    @Override
    public String toString() {
        return "String vector <" + sizeString() + ">";
    }
}

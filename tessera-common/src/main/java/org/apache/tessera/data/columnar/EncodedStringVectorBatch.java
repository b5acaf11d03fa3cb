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

import org.apache.tessera.memory.LongDataBuffer;
import org.apache.tessera.memory.MemoryPool;

import javax.annotation.Nullable;

import static org.apache.tessera.utils.Preconditions.checkNotNull;
import static org.apache.tessera.utils.Preconditions.checkState;

/**
 * 字典编码的字符串列批次。
 *
 * <p>每行只保存一个编码 {@link #index},取值通过共享的 {@link StringDictionary} 查出。
 * 继承自 {@link StringVectorBatch} 的 {@code start}/{@code length} 在编码模式下不再使用。
 *
 * <pre>
 * 实际数据: ["Beijing", "Shanghai", "Beijing", ...]
 * 字典:     0 -> "Beijing", 1 -> "Shanghai"
 * index:    [0, 1, 0, ...]
 * </pre>
 *
 * <p>行选择只压缩编码,字典可能被其他批次共享,保持不变。
 */
public class EncodedStringVectorBatch extends StringVectorBatch {

    @Nullable private StringDictionary dictionary;

    // index for dictionary entry
    public final LongDataBuffer index;

    EncodedStringVectorBatch(int capacity, MemoryPool pool) {
        super(capacity, pool, true);
        this.index = allocateBuffer(() -> new LongDataBuffer(pool, capacity));
    }

    public static EncodedStringVectorBatch create(int capacity, MemoryPool pool) {
        return new EncodedStringVectorBatch(capacity, pool);
    }

    @Override
    public BatchKind kind() {
        return BatchKind.ENCODED_STRING;
    }

    @Override
    public <R> R accept(ColumnVectorBatchVisitor<R> visitor) {
        return visitor.visit(this);
    }

    /** 引用新的字典并释放之前引用的字典。 */
    public void setDictionary(StringDictionary dictionary) {
        checkNotNull(dictionary, "dictionary");
        if (dictionary == this.dictionary) {
            return;
        }
        dictionary.retain();
        if (this.dictionary != null) {
            this.dictionary.release();
        }
        this.dictionary = dictionary;
    }

    @Nullable
    public StringDictionary getDictionary() {
        return dictionary;
    }

    public void setCode(int row, long code) {
        index.set(row, code);
    }

    /**
     * 通过字典解码第 {@code row} 行。
     *
     * @throws IndexOutOfBoundsException 如果该行的编码超出字典范围
     */
    @Override
    public BytesView getBytes(int row) {
        checkState(dictionary != null, "No dictionary is set on this batch.");
        return dictionary.getValueByIndex(index.get(row));
    }

    @Override
    public void resize(int capacity) {
        if (getCapacity() < capacity) {
            super.resize(capacity);
            index.resize(capacity);
        }
    }

    /** 字典由多个批次共享,不计入单个批次的内存用量。 */
    @Override
    public long getMemoryUsage() {
        return super.getMemoryUsage() + index.getMemoryUsage();
    }

    @Override
    protected void filterValues(boolean[] selection, int selectionLength, int trueCount) {
        index.compact(selection, selectionLength);
    }

    @Override
    protected void closeBuffers() {
        super.closeBuffers();
        index.close();
        if (dictionary != null) {
            dictionary.release();
            dictionary = null;
        }
    }

    @Override
    public String toString() {
        return "Encoded string vector <" + sizeString() + ">";
    }
}

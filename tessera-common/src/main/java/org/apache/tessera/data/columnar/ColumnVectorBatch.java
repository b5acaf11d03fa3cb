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

import org.apache.tessera.annotation.Public;
import org.apache.tessera.memory.ByteDataBuffer;
import org.apache.tessera.memory.DataBuffer;
import org.apache.tessera.memory.MemoryAllocationException;
import org.apache.tessera.memory.MemoryPool;

import javax.annotation.concurrent.NotThreadSafe;

import java.util.function.Supplier;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * 列向量批次基类,表示一列在一个行批次内的全部取值。
 *
 * <p>基类负责与类型无关的部分:容量、已占用行数、按行的非空标记 {@link #notNull}
 * 以及 {@code hasNulls} 缓存。具体种类在此基础上持有各自的值缓冲区,种类集合是封闭的
 * (见 {@link BatchKind}),外部不能继承。
 *
 * <h2>NULL 值处理</h2>
 * <ul>
 *   <li>{@code notNull[i] != 0} 表示第 i 行有值
 *   <li>{@code hasNulls == false} 时读取方可以忽略 {@code notNull}
 *   <li>{@code hasNulls == true} 只是保守标记,不保证一定存在 NULL
 * </ul>
 *
 * <h2>生命周期</h2>
 * <ul>
 *   <li>创建时按初始容量分配缓冲区,并向 {@link MemoryPool} 记账
 *   <li>{@link #resize(int)} 只扩容本层缓冲区,嵌套子批次需要由持有方显式扩容
 *   <li>{@link #clear()} 递归清空逻辑内容但保留容量,以便在扫描迭代之间复用
 *   <li>{@link #close()} 递归释放本批次及其独占的子批次
 * </ul>
 *
 * <h2>行选择</h2>
 * <p>{@link #filter(boolean[], int, int)} 按选择向量就地压缩批次。基类压缩 {@code notNull}
 * 并精确地重新计算 {@code hasNulls},各种类通过 {@link #filterValues} 压缩自己的缓冲区,
 * 嵌套种类还要把派生出的选择向量传给子批次。
 *
 * <p>该类不是线程安全的,一个批次同一时刻只能由一个生产者或消费者修改。
 */
@Public
@NotThreadSafe
public abstract class ColumnVectorBatch implements AutoCloseable {

    protected final MemoryPool memoryPool;

    /** 按行的非空标记,非 0 表示有值。容量始终不小于 {@link #getCapacity()}。 */
    public final ByteDataBuffer notNull;

    private final boolean isEncoded;

    // the number of slots available
    private int capacity;

    // the number of current occupied slots
    private int numElements;

    private boolean hasNulls;

    private boolean closed;

    ColumnVectorBatch(int capacity, MemoryPool memoryPool, boolean isEncoded) {
        checkArgument(capacity >= 0, "Capacity must be >= 0, but is %s", capacity);
        this.memoryPool = checkNotNull(memoryPool, "memoryPool");
        this.capacity = capacity;
        this.isEncoded = isEncoded;
        this.notNull = new ByteDataBuffer(memoryPool, capacity);
        notNull.fill(0, capacity, (byte) 1);
    }

    /**
     * 在子类构造函数中分配缓冲区。池拒绝分配时,归还 {@code notNull} 和构造函数此前分配的
     * {@code allocated},然后重新抛出异常。
     */
    final <T extends DataBuffer> T allocateBuffer(Supplier<T> allocator, DataBuffer... allocated) {
        try {
            return allocator.get();
        } catch (MemoryAllocationException e) {
            for (DataBuffer buffer : allocated) {
                buffer.close();
            }
            notNull.close();
            throw e;
        }
    }

    public abstract BatchKind kind();

    public abstract <R> R accept(ColumnVectorBatchVisitor<R> visitor);

    public int getCapacity() {
        return capacity;
    }

    public int getNumElements() {
        return numElements;
    }

    public void setNumElements(int numElements) {
        assert numElements >= 0 && numElements <= capacity
                : "numElements " + numElements + " exceeds capacity " + capacity;
        this.numElements = numElements;
    }

    public boolean hasNulls() {
        return hasNulls;
    }

    public void setHasNulls(boolean hasNulls) {
        this.hasNulls = hasNulls;
    }

    public boolean isEncoded() {
        return isEncoded;
    }

    public MemoryPool getMemoryPool() {
        return memoryPool;
    }

    public boolean isNullAt(int i) {
        return hasNulls && notNull.get(i) == 0;
    }

    /** 把第 i 行标记为 NULL,同时设置 {@code hasNulls}。 */
    public void setNullAt(int i) {
        notNull.set(i, (byte) 0);
        hasNulls = true;
    }

    /**
     * 把容量调整到至少 {@code capacity}。
     *
     * <p>不递归到子批次。新增的行默认标记为非空。
     */
    public void resize(int capacity) {
        if (this.capacity < capacity) {
            int oldCapacity = this.capacity;
            notNull.resize(capacity);
            notNull.fill(oldCapacity, capacity, (byte) 1);
            this.capacity = capacity;
        }
    }

    /** 清空全部逻辑内容,保留容量。嵌套种类会递归清空子批次。 */
    public void clear() {
        if (hasNulls) {
            notNull.fill(0, capacity, (byte) 1);
        }
        numElements = 0;
        hasNulls = false;
    }

    /** 本批次缓冲区以及所有独占子批次占用的堆内存字节数。 */
    public long getMemoryUsage() {
        return notNull.getMemoryUsage();
    }

    /** 每行占用的空间是否随数据变化。为 false 时消费方可以假设统一的行跨度。 */
    public boolean hasVariableLength() {
        return false;
    }

    /**
     * 按选择向量就地压缩批次,只保留被选中的行并保持原有相对顺序。
     *
     * @param selection 选择向量,第 i 项为 true 表示保留第 i 行
     * @param selectionLength 选择向量的有效长度,必须等于当前的 {@link #getNumElements()}
     * @param trueCount 选择向量中 true 的个数,压缩后成为新的 {@link #getNumElements()}
     */
    public final void filter(boolean[] selection, int selectionLength, int trueCount) {
        assert selectionLength == numElements
                : "Selection length " + selectionLength + " != numElements " + numElements;
        assert selection.length >= selectionLength
                : "Selection array shorter than " + selectionLength;
        assert SelectionUtils.countSelected(selection, selectionLength) == trueCount
                : "trueCount " + trueCount + " does not match the selection";

        filterValues(selection, selectionLength, trueCount);
        if (hasNulls) {
            notNull.compact(selection, selectionLength);
            hasNulls = hasNullsIn(trueCount);
        }
        numElements = trueCount;
    }

    /** 压缩各种类自己的值缓冲区,嵌套种类在这里把派生的选择向量传给子批次。 */
    protected abstract void filterValues(boolean[] selection, int selectionLength, int trueCount);

    /** 递归释放缓冲区,重复调用无副作用。 */
    @Override
    public void close() {
        if (!closed) {
            closed = true;
            notNull.close();
            closeBuffers();
        }
    }

    /** 释放各种类自己的缓冲区以及独占的子批次。 */
    protected abstract void closeBuffers();

    private boolean hasNullsIn(int length) {
        byte[] flags = notNull.array();
        for (int i = 0; i < length; i++) {
            if (flags[i] == 0) {
                return true;
            }
        }
        return false;
    }

    protected String sizeString() {
        return numElements + " of " + capacity;
    }
}

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

import javax.annotation.concurrent.NotThreadSafe;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkNotNull;
import static org.apache.tessera.utils.Preconditions.checkState;

/**
 * 由单个批次字段独占的定长元素缓冲区。
 *
 * <p>缓冲区只记录容量(已分配的元素个数),逻辑长度由持有它的批次维护,
 * 并且始终满足 逻辑长度 &lt;= 容量。
 *
 * <h2>内存记账</h2>
 * <ul>
 *   <li>构造时向 {@link MemoryPool} 申请 {@code capacity * elementSize} 字节
 *   <li>{@link #resize(int)} 只会增长,增长部分同样向池申请
 *   <li>{@link #close()} 把全部字节归还给池,重复调用无副作用
 * </ul>
 *
 * <p>池预算耗尽或 JVM 无法分配数组时抛出 {@link MemoryAllocationException},
 * 此时缓冲区保持调用前的状态,不会出现容量为负或部分扩容的情况。
 */
@NotThreadSafe
public abstract class DataBuffer implements AutoCloseable {

    private final MemoryPool pool;

    private int capacity;

    private boolean closed;

    protected DataBuffer(MemoryPool pool, int capacity) {
        checkArgument(capacity >= 0, "Capacity must be >= 0, but is %s", capacity);
        this.pool = checkNotNull(pool, "pool");
        pool.allocate(bytesOf(capacity));
        try {
            allocate(capacity);
        } catch (OutOfMemoryError e) {
            pool.release(bytesOf(capacity));
            throw new MemoryAllocationException(
                    "Failed to allocate buffer of " + capacity + " elements", e);
        }
        this.capacity = capacity;
    }

    /** 每个元素占用的字节数。 */
    public abstract int elementSize();

    /** 分配新的底层数组并保留前 {@code min(旧容量, newCapacity)} 个元素。 */
    protected abstract void allocate(int newCapacity);

    public int capacity() {
        return capacity;
    }

    /**
     * 保证容量至少为 {@code newCapacity}。
     *
     * <p>已有内容原样保留;请求的容量不大于当前容量时什么也不做。
     */
    public void resize(int newCapacity) {
        checkState(!closed, "Buffer is already closed.");
        checkArgument(newCapacity >= 0, "Capacity must be >= 0, but is %s", newCapacity);
        if (newCapacity <= capacity) {
            return;
        }
        long delta = bytesOf(newCapacity) - bytesOf(capacity);
        pool.allocate(delta);
        try {
            allocate(newCapacity);
        } catch (OutOfMemoryError e) {
            pool.release(delta);
            throw new MemoryAllocationException(
                    "Failed to resize buffer to " + newCapacity + " elements", e);
        }
        capacity = newCapacity;
    }

    /** 当前占用的字节数。 */
    public long getMemoryUsage() {
        return closed ? 0 : bytesOf(capacity);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            pool.release(bytesOf(capacity));
        }
    }

    private long bytesOf(int elements) {
        return (long) elements * elementSize();
    }
}

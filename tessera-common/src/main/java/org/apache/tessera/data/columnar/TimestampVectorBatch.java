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

import java.time.Instant;

/**
 * 时间戳列批次。
 *
 * <p>时间戳拆成两个平行缓冲区保存:{@link #data} 是自 1970-01-01 00:00:00 UTC 起的秒数,
 * {@link #nanoseconds} 是该秒内的纳秒数。数据始终按 UTC 保存,本地时区与 UTC 之间的转换
 * 由调用方负责,批次内部从不做时区转换。
 */
public class TimestampVectorBatch extends ColumnVectorBatch {

    // the number of seconds past 1 Jan 1970 00:00 UTC
    public final LongDataBuffer data;

    public final LongDataBuffer nanoseconds;

    TimestampVectorBatch(int capacity, MemoryPool pool) {
        super(capacity, pool, false);
        this.data = allocateBuffer(() -> new LongDataBuffer(pool, capacity));
        this.nanoseconds = allocateBuffer(() -> new LongDataBuffer(pool, capacity), data);
    }

    public static TimestampVectorBatch create(int capacity, MemoryPool pool) {
        return new TimestampVectorBatch(capacity, pool);
    }

    @Override
    public BatchKind kind() {
        return BatchKind.TIMESTAMP;
    }

    @Override
    public <R> R accept(ColumnVectorBatchVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public void set(int i, long epochSeconds, long nanos) {
        assert nanos >= 0 && nanos < 1_000_000_000L : "Nanoseconds out of range: " + nanos;
        data.set(i, epochSeconds);
        nanoseconds.set(i, nanos);
    }

    public Instant getInstant(int i) {
        return Instant.ofEpochSecond(data.get(i), nanoseconds.get(i));
    }

    @Override
    public void resize(int capacity) {
        if (getCapacity() < capacity) {
            super.resize(capacity);
            data.resize(capacity);
            nanoseconds.resize(capacity);
        }
    }

    @Override
    public long getMemoryUsage() {
        return super.getMemoryUsage() + data.getMemoryUsage() + nanoseconds.getMemoryUsage();
    }

    @Override
    protected void filterValues(boolean[] selection, int selectionLength, int trueCount) {
        data.compact(selection, selectionLength);
        nanoseconds.compact(selection, selectionLength);
    }

    @Override
    protected void closeBuffers() {
        data.close();
        nanoseconds.close();
    }

    @Override
    public String toString() {
        return "Timestamp vector <" + sizeString() + ">";
    }
}

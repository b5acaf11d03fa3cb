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

/**
 * 整数列批次。
 *
 * <p>所有整数类型(boolean、byte、short、int、long、date)都以 long 保存在同一个平坦缓冲区中。
 */
public class LongVectorBatch extends ColumnVectorBatch {

    public final LongDataBuffer data;

    LongVectorBatch(int capacity, MemoryPool pool) {
        super(capacity, pool, false);
        this.data = allocateBuffer(() -> new LongDataBuffer(pool, capacity));
    }

    public static LongVectorBatch create(int capacity, MemoryPool pool) {
        return new LongVectorBatch(capacity, pool);
    }

    @Override
    public BatchKind kind() {
        return BatchKind.LONG;
    }

    @Override
    public <R> R accept(ColumnVectorBatchVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public void resize(int capacity) {
        if (getCapacity() < capacity) {
            super.resize(capacity);
            data.resize(capacity);
        }
    }

    @Override
    public long getMemoryUsage() {
        return super.getMemoryUsage() + data.getMemoryUsage();
    }

    @Override
    protected void filterValues(boolean[] selection, int selectionLength, int trueCount) {
        data.compact(selection, selectionLength);
    }

    @Override
    protected void closeBuffers() {
        data.close();
    }

    @Override
    public String toString() {
        return "Long vector <" + sizeString() + ">";
    }
}

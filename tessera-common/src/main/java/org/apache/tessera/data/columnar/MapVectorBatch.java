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

import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * Map 列批次,布局与 {@link ListVectorBatch} 相同,只是有键和值两个子批次,
 * 第 i 行的条目是两个子批次中的 {@code [offsets[i], offsets[i + 1])}。
 */
public class MapVectorBatch extends ColumnVectorBatch {

    /** The offset of the first entry of each map. The size of map i is offsets[i+1] - offsets[i]. */
    public final LongDataBuffer offsets;

    // the concatenated keys
    private final ColumnVectorBatch keys;

    // the concatenated elements
    private final ColumnVectorBatch elements;

    MapVectorBatch(
            int capacity, MemoryPool pool, ColumnVectorBatch keys, ColumnVectorBatch elements) {
        super(capacity, pool, false);
        this.keys = checkNotNull(keys, "keys");
        this.elements = checkNotNull(elements, "elements");
        this.offsets = allocateBuffer(() -> new LongDataBuffer(pool, capacity + 1));
        offsets.set(0, 0);
    }

    public static MapVectorBatch create(
            int capacity, MemoryPool pool, ColumnVectorBatch keys, ColumnVectorBatch elements) {
        return new MapVectorBatch(capacity, pool, keys, elements);
    }

    @Override
    public BatchKind kind() {
        return BatchKind.MAP;
    }

    @Override
    public <R> R accept(ColumnVectorBatchVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public ColumnVectorBatch getKeys() {
        return keys;
    }

    public ColumnVectorBatch getElements() {
        return elements;
    }

    public int getSize(int row) {
        return (int) (offsets.get(row + 1) - offsets.get(row));
    }

    @Override
    public void resize(int capacity) {
        if (getCapacity() < capacity) {
            super.resize(capacity);
            offsets.resize(capacity + 1);
        }
    }

    @Override
    public void clear() {
        super.clear();
        offsets.set(0, 0);
        keys.clear();
        elements.clear();
    }

    @Override
    public long getMemoryUsage() {
        return super.getMemoryUsage()
                + offsets.getMemoryUsage()
                + keys.getMemoryUsage()
                + elements.getMemoryUsage();
    }

    @Override
    public boolean hasVariableLength() {
        return true;
    }

    @Override
    protected void filterValues(boolean[] selection, int selectionLength, int trueCount) {
        int entryCount = (int) offsets.get(selectionLength);
        assert entryCount == keys.getNumElements() && entryCount == elements.getNumElements()
                : "Map keys and elements are not aligned with offsets";
        boolean[] entrySelection = new boolean[entryCount];
        int retained =
                SelectionUtils.retainRanges(offsets, selection, selectionLength, entrySelection);
        keys.filter(entrySelection, entryCount, retained);
        elements.filter(entrySelection, entryCount, retained);
    }

    @Override
    protected void closeBuffers() {
        offsets.close();
        keys.close();
        elements.close();
    }

    @Override
    public String toString() {
        return "Map vector <" + keys + ", " + elements + " with " + sizeString() + ">";
    }
}

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
 * 数组列批次。
 *
 * <p>所有行的元素首尾相接地保存在子批次 {@link #getElements()} 中,第 i 行的元素是
 * {@code [offsets[i], offsets[i + 1])}。{@code offsets} 有 {@code numElements + 1} 项,
 * 单调不减,且 {@code offsets[numElements]} 等于子批次的元素个数。
 *
 * <pre>
 * 行:      [[1, 2], [], [3, 4, 5]]
 * offsets: [0, 2, 2, 5]
 * 元素:    [1, 2, 3, 4, 5]
 * </pre>
 *
 * <p>子批次的行数与父批次不同,行选择先把行级选择转换为元素级选择再传给子批次。
 */
public class ListVectorBatch extends ColumnVectorBatch {

    /**
     * The offset of the first element of each list. The length of list i is offsets[i+1] -
     * offsets[i].
     */
    public final LongDataBuffer offsets;

    // the concatenated elements
    private final ColumnVectorBatch elements;

    ListVectorBatch(int capacity, MemoryPool pool, ColumnVectorBatch elements) {
        super(capacity, pool, false);
        this.elements = checkNotNull(elements, "elements");
        this.offsets = allocateBuffer(() -> new LongDataBuffer(pool, capacity + 1));
        offsets.set(0, 0);
    }

    public static ListVectorBatch create(
            int capacity, MemoryPool pool, ColumnVectorBatch elements) {
        return new ListVectorBatch(capacity, pool, elements);
    }

    @Override
    public BatchKind kind() {
        return BatchKind.LIST;
    }

    @Override
    public <R> R accept(ColumnVectorBatchVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public ColumnVectorBatch getElements() {
        return elements;
    }

    /** 第 {@code row} 行的元素个数。 */
    public int getLength(int row) {
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
        elements.clear();
    }

    @Override
    public long getMemoryUsage() {
        return super.getMemoryUsage() + offsets.getMemoryUsage() + elements.getMemoryUsage();
    }

    @Override
    public boolean hasVariableLength() {
        return true;
    }

    @Override
    protected void filterValues(boolean[] selection, int selectionLength, int trueCount) {
        int elementCount = (int) offsets.get(selectionLength);
        assert elementCount == elements.getNumElements()
                : "offsets[" + selectionLength + "] = " + elementCount
                        + " but the child holds " + elements.getNumElements();
        boolean[] elementSelection = new boolean[elementCount];
        int retained =
                SelectionUtils.retainRanges(offsets, selection, selectionLength, elementSelection);
        elements.filter(elementSelection, elementCount, retained);
    }

    @Override
    protected void closeBuffers() {
        offsets.close();
        elements.close();
    }

    @Override
    public String toString() {
        return "List vector <" + elements + " with " + sizeString() + ">";
    }
}

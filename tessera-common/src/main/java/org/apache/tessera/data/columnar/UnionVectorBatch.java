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
import org.apache.tessera.memory.MemoryPool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * Union 列批次。
 *
 * <p>第 i 行的值保存在 {@code children[tags[i]]} 的第 {@code offsets[i]} 个位置,
 * 各子批次的行数互不相同,且满足 {@code offsets[i] < children[tags[i]].numElements}。
 *
 * <p>行选择为每个子批次单独派生选择向量:被选中的非空行在
 * {@code (tags[i], offsets[i])} 处标记为 true。子批次各自压缩后,{@code offsets}
 * 被重映射到子批次中压缩后的新位置。
 */
public class UnionVectorBatch extends ColumnVectorBatch {

    /** For each value, which element of children has the value. */
    public final ByteDataBuffer tags;

    /** For each value, the index inside of the child batch. */
    public final LongDataBuffer offsets;

    // the sub-columns
    private final List<ColumnVectorBatch> children;

    UnionVectorBatch(int capacity, MemoryPool pool, List<ColumnVectorBatch> children) {
        super(capacity, pool, false);
        this.children = new ArrayList<>(children);
        this.tags = allocateBuffer(() -> new ByteDataBuffer(pool, capacity));
        this.offsets = allocateBuffer(() -> new LongDataBuffer(pool, capacity), tags);
    }

    public static UnionVectorBatch create(
            int capacity, MemoryPool pool, List<ColumnVectorBatch> children) {
        checkNotNull(children, "children");
        checkArgument(
                children.size() <= 256, "A union supports at most 256 children: %s", children);
        return new UnionVectorBatch(capacity, pool, children);
    }

    @Override
    public BatchKind kind() {
        return BatchKind.UNION;
    }

    @Override
    public <R> R accept(ColumnVectorBatchVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public List<ColumnVectorBatch> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public ColumnVectorBatch getChild(int tag) {
        return children.get(tag);
    }

    public int getTag(int row) {
        return tags.get(row) & 0xFF;
    }

    public void set(int row, int tag, long offset) {
        tags.set(row, (byte) tag);
        offsets.set(row, offset);
    }

    @Override
    public void resize(int capacity) {
        if (getCapacity() < capacity) {
            super.resize(capacity);
            tags.resize(capacity);
            offsets.resize(capacity);
        }
    }

    @Override
    public void clear() {
        super.clear();
        for (ColumnVectorBatch child : children) {
            child.clear();
        }
    }

    @Override
    public long getMemoryUsage() {
        long memory = super.getMemoryUsage() + tags.getMemoryUsage() + offsets.getMemoryUsage();
        for (ColumnVectorBatch child : children) {
            memory += child.getMemoryUsage();
        }
        return memory;
    }

    @Override
    public boolean hasVariableLength() {
        return true;
    }

    @Override
    protected void filterValues(boolean[] selection, int selectionLength, int trueCount) {
        int numChildren = children.size();
        boolean[][] childSelections = new boolean[numChildren][];
        int[] childTrueCounts = new int[numChildren];
        for (int c = 0; c < numChildren; c++) {
            childSelections[c] = new boolean[children.get(c).getNumElements()];
        }

        long[] off = offsets.array();
        for (int i = 0; i < selectionLength; i++) {
            if (selection[i] && !isNullAt(i)) {
                int tag = getTag(i);
                assert tag < numChildren : "Tag " + tag + " out of range at row " + i;
                assert off[i] < childSelections[tag].length
                        : "Offset " + off[i] + " out of range for child " + tag;
                if (!childSelections[tag][(int) off[i]]) {
                    childSelections[tag][(int) off[i]] = true;
                    childTrueCounts[tag]++;
                }
            }
        }

        // new position of every retained child element
        int[][] remapped = new int[numChildren][];
        for (int c = 0; c < numChildren; c++) {
            boolean[] childSelection = childSelections[c];
            int[] positions = new int[childSelection.length];
            int next = 0;
            for (int k = 0; k < childSelection.length; k++) {
                positions[k] = next;
                if (childSelection[k]) {
                    next++;
                }
            }
            remapped[c] = positions;
        }

        byte[] tagArray = tags.array();
        int j = 0;
        for (int i = 0; i < selectionLength; i++) {
            if (selection[i]) {
                tagArray[j] = tagArray[i];
                off[j] = isNullAt(i) ? 0 : remapped[getTag(i)][(int) off[i]];
                j++;
            }
        }

        for (int c = 0; c < numChildren; c++) {
            ColumnVectorBatch child = children.get(c);
            child.filter(childSelections[c], child.getNumElements(), childTrueCounts[c]);
        }
    }

    @Override
    protected void closeBuffers() {
        tags.close();
        offsets.close();
        for (ColumnVectorBatch child : children) {
            child.close();
        }
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner("; ", "Union vector <", "; with " + sizeString() + ">");
        for (ColumnVectorBatch child : children) {
            joiner.add(child.toString());
        }
        return joiner.toString();
    }
}

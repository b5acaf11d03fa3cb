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

import org.apache.tessera.memory.MemoryPool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * 结构体列批次,每个字段对应一个独占的子批次。
 *
 * <p>所有字段与父批次共享行号,因此行选择把同一个选择向量原样传给每个字段。
 * {@link #resize(int)} 不会扩容字段,持有方需要逐个扩容。
 */
public class StructVectorBatch extends ColumnVectorBatch {

    private final List<ColumnVectorBatch> fields;

    StructVectorBatch(int capacity, MemoryPool pool, List<ColumnVectorBatch> fields) {
        super(capacity, pool, false);
        this.fields = new ArrayList<>(checkNotNull(fields, "fields"));
    }

    public static StructVectorBatch create(
            int capacity, MemoryPool pool, List<ColumnVectorBatch> fields) {
        return new StructVectorBatch(capacity, pool, fields);
    }

    @Override
    public BatchKind kind() {
        return BatchKind.STRUCT;
    }

    @Override
    public <R> R accept(ColumnVectorBatchVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public List<ColumnVectorBatch> getFields() {
        return Collections.unmodifiableList(fields);
    }

    public ColumnVectorBatch getField(int i) {
        return fields.get(i);
    }

    public int getFieldCount() {
        return fields.size();
    }

    @Override
    public void clear() {
        super.clear();
        for (ColumnVectorBatch field : fields) {
            field.clear();
        }
    }

    @Override
    public long getMemoryUsage() {
        long memory = super.getMemoryUsage();
        for (ColumnVectorBatch field : fields) {
            memory += field.getMemoryUsage();
        }
        return memory;
    }

    @Override
    public boolean hasVariableLength() {
        for (ColumnVectorBatch field : fields) {
            if (field.hasVariableLength()) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected void filterValues(boolean[] selection, int selectionLength, int trueCount) {
        for (ColumnVectorBatch field : fields) {
            assert field.getNumElements() == selectionLength
                    : "Field " + field + " is not aligned with its struct";
            field.filter(selection, selectionLength, trueCount);
        }
    }

    @Override
    protected void closeBuffers() {
        for (ColumnVectorBatch field : fields) {
            field.close();
        }
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner("; ", "Struct vector <" + sizeString() + "; ", ">");
        for (ColumnVectorBatch field : fields) {
            joiner.add(field.toString());
        }
        return joiner.toString();
    }
}

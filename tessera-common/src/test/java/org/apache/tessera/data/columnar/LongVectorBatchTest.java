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

import org.apache.tessera.memory.HeapMemoryPool;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link LongVectorBatch} and the behavior shared through {@link ColumnVectorBatch}. */
class LongVectorBatchTest {

    private HeapMemoryPool pool;

    @BeforeEach
    void before() {
        pool = new HeapMemoryPool(1024 * 1024);
    }

    @AfterEach
    void after() {
        assertThat(pool.usedBytes()).isZero();
    }

    @Test
    void testNewBatch() {
        try (LongVectorBatch batch = LongVectorBatch.create(8, pool)) {
            assertThat(batch.kind()).isEqualTo(BatchKind.LONG);
            assertThat(batch.getCapacity()).isEqualTo(8);
            assertThat(batch.getNumElements()).isZero();
            assertThat(batch.hasNulls()).isFalse();
            assertThat(batch.isEncoded()).isFalse();
            assertThat(batch.hasVariableLength()).isFalse();
            assertThat(batch.notNull.array()).containsOnly((byte) 1);
            // notNull + data
            assertThat(batch.getMemoryUsage()).isEqualTo(8 + 8 * 8);
            assertThat(pool.usedBytes()).isEqualTo(batch.getMemoryUsage());
            assertThat(batch.toString()).isEqualTo("Long vector <0 of 8>");
        }
    }

    @Test
    void testNulls() {
        try (LongVectorBatch batch = LongVectorBatch.create(4, pool)) {
            fill(batch, 10, 20, 30, 40);
            assertThat(batch.isNullAt(1)).isFalse();
            batch.setNullAt(1);
            assertThat(batch.hasNulls()).isTrue();
            assertThat(batch.isNullAt(1)).isTrue();
            assertThat(batch.isNullAt(2)).isFalse();
        }
    }

    @Test
    void testFilter() {
        try (LongVectorBatch batch = LongVectorBatch.create(5, pool)) {
            fill(batch, 1, 2, 3, 4, 5);
            batch.setNullAt(1);

            batch.filter(new boolean[] {true, false, true, false, true}, 5, 3);

            assertThat(batch.getNumElements()).isEqualTo(3);
            assertThat(batch.data.array()).startsWith(1L, 3L, 5L);
            // the only null row was dropped
            assertThat(batch.hasNulls()).isFalse();
            assertThat(batch.getCapacity()).isEqualTo(5);
        }
    }

    @Test
    void testFilterKeepsNulls() {
        try (LongVectorBatch batch = LongVectorBatch.create(4, pool)) {
            fill(batch, 1, 2, 3, 4);
            batch.setNullAt(2);

            batch.filter(new boolean[] {false, true, true, true}, 4, 3);

            assertThat(batch.data.array()).startsWith(2L, 3L, 4L);
            assertThat(batch.hasNulls()).isTrue();
            assertThat(batch.isNullAt(0)).isFalse();
            assertThat(batch.isNullAt(1)).isTrue();
            assertThat(batch.isNullAt(2)).isFalse();
        }
    }

    @Test
    void testFilterAllSelectedIsNoop() {
        try (LongVectorBatch batch = LongVectorBatch.create(3, pool)) {
            fill(batch, 7, 8, 9);
            batch.setNullAt(0);
            boolean[] all = {true, true, true};

            batch.filter(all, 3, 3);
            batch.filter(all, 3, 3);

            assertThat(batch.getNumElements()).isEqualTo(3);
            assertThat(batch.data.array()).startsWith(7L, 8L, 9L);
            assertThat(batch.isNullAt(0)).isTrue();
        }
    }

    @Test
    void testFilterNothingSelected() {
        try (LongVectorBatch batch = LongVectorBatch.create(3, pool)) {
            fill(batch, 7, 8, 9);
            batch.setNullAt(2);
            batch.filter(new boolean[3], 3, 0);
            assertThat(batch.getNumElements()).isZero();
            assertThat(batch.hasNulls()).isFalse();
        }
    }

    @Test
    void testFilterMismatchedLength() {
        try (LongVectorBatch batch = LongVectorBatch.create(3, pool)) {
            fill(batch, 7, 8, 9);
            assertThatThrownBy(() -> batch.filter(new boolean[] {true, true}, 2, 2))
                    .isInstanceOf(AssertionError.class);
            assertThatThrownBy(() -> batch.filter(new boolean[] {true, true, false}, 3, 3))
                    .isInstanceOf(AssertionError.class);
        }
    }

    @Test
    void testResize() {
        try (LongVectorBatch batch = LongVectorBatch.create(2, pool)) {
            fill(batch, 5, 6);
            batch.setNullAt(1);
            batch.resize(6);

            assertThat(batch.getCapacity()).isEqualTo(6);
            assertThat(batch.data.capacity()).isEqualTo(6);
            assertThat(batch.data.get(0)).isEqualTo(5L);
            assertThat(batch.isNullAt(1)).isTrue();
            for (int i = 2; i < 6; i++) {
                assertThat(batch.isNullAt(i)).isFalse();
            }
            assertThat(pool.usedBytes()).isEqualTo(6 + 6 * 8);

            batch.resize(3);
            assertThat(batch.getCapacity()).isEqualTo(6);
        }
    }

    @Test
    void testClear() {
        try (LongVectorBatch batch = LongVectorBatch.create(3, pool)) {
            fill(batch, 1, 2, 3);
            batch.setNullAt(0);
            batch.clear();

            assertThat(batch.getNumElements()).isZero();
            assertThat(batch.hasNulls()).isFalse();
            assertThat(batch.getCapacity()).isEqualTo(3);

            // stale null flags must not come back
            batch.setNumElements(3);
            batch.setNullAt(2);
            assertThat(batch.isNullAt(0)).isFalse();
            assertThat(batch.isNullAt(2)).isTrue();
        }
    }

    @Test
    void testCloseReleasesMemory() {
        LongVectorBatch batch = LongVectorBatch.create(16, pool);
        assertThat(pool.usedBytes()).isPositive();
        batch.close();
        batch.close();
        assertThat(pool.usedBytes()).isZero();
        assertThat(batch.getMemoryUsage()).isZero();
    }

    @Test
    void testSetNumElementsBeyondCapacity() {
        try (LongVectorBatch batch = LongVectorBatch.create(2, pool)) {
            assertThatThrownBy(() -> batch.setNumElements(3)).isInstanceOf(AssertionError.class);
        }
    }

    static void fill(LongVectorBatch batch, long... values) {
        for (int i = 0; i < values.length; i++) {
            batch.data.set(i, values[i]);
        }
        batch.setNumElements(values.length);
    }
}

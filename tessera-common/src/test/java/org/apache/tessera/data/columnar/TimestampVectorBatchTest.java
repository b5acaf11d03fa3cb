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
import org.apache.tessera.memory.MemoryAllocationException;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link TimestampVectorBatch}. */
class TimestampVectorBatchTest {

    private final HeapMemoryPool pool = new HeapMemoryPool(1024 * 1024);

    @Test
    void testSetAndFilter() {
        try (TimestampVectorBatch batch = TimestampVectorBatch.create(3, pool)) {
            batch.set(0, 0, 0);
            batch.set(1, 1_700_000_000L, 123_456_789);
            batch.set(2, -1, 999_999_999);
            batch.setNumElements(3);

            assertThat(batch.getInstant(1)).isEqualTo(Instant.parse("2023-11-14T22:13:20.123456789Z"));
            assertThat(batch.getInstant(2)).isEqualTo(Instant.parse("1969-12-31T23:59:59.999999999Z"));

            batch.filter(new boolean[] {false, true, true}, 3, 2);
            assertThat(batch.data.array()).startsWith(1_700_000_000L, -1L);
            assertThat(batch.nanoseconds.array()).startsWith(123_456_789L, 999_999_999L);
            // notNull + seconds + nanos
            assertThat(batch.getMemoryUsage()).isEqualTo(3 + 2 * 3 * 8);
        }
        assertThat(pool.usedBytes()).isZero();
    }

    @Test
    void testNanosOutOfRange() {
        try (TimestampVectorBatch batch = TimestampVectorBatch.create(1, pool)) {
            assertThatThrownBy(() -> batch.set(0, 0, 1_000_000_000L))
                    .isInstanceOf(AssertionError.class);
        }
    }

    @Test
    void testFailedConstructionReturnsEarlierBuffers() {
        // notNull (10) and seconds (80) fit, nanos (80) does not
        HeapMemoryPool small = new HeapMemoryPool(100);
        assertThatThrownBy(() -> TimestampVectorBatch.create(10, small))
                .isInstanceOf(MemoryAllocationException.class);
        assertThat(small.usedBytes()).isZero();

        try (TimestampVectorBatch batch = TimestampVectorBatch.create(5, small)) {
            assertThat(small.usedBytes()).isEqualTo(5 + 2 * 5 * 8);
        }
        assertThat(small.usedBytes()).isZero();
    }
}

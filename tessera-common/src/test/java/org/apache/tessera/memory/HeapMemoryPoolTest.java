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

import org.apache.tessera.options.MemorySize;
import org.apache.tessera.options.Options;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link HeapMemoryPool} and {@link MemoryPool#create(Options)}. */
class HeapMemoryPoolTest {

    @Test
    void testAllocateAndRelease() {
        HeapMemoryPool pool = new HeapMemoryPool(100);
        pool.allocate(60);
        pool.allocate(40);
        assertThat(pool.usedBytes()).isEqualTo(100);
        assertThatThrownBy(() -> pool.allocate(1))
                .isInstanceOf(MemoryAllocationException.class)
                .hasMessageContaining("100");

        pool.release(100);
        assertThat(pool.usedBytes()).isZero();
        assertThatThrownBy(() -> pool.release(1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testNegativeArguments() {
        HeapMemoryPool pool = new HeapMemoryPool(100);
        assertThatThrownBy(() -> pool.allocate(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HeapMemoryPool(-1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testCreateFromOptions() {
        assertThat(MemoryPool.create(new Options()).maxBytes()).isEqualTo(Long.MAX_VALUE);

        Options options = new Options();
        options.set(MemoryPoolOptions.POOL_SIZE, MemorySize.ofMebiBytes(4));
        MemoryPool pool = MemoryPool.create(options);
        assertThat(pool).isInstanceOf(HeapMemoryPool.class);
        assertThat(pool.maxBytes()).isEqualTo(4L * 1024 * 1024);
    }

    @Test
    void testConcurrentAccounting() throws Exception {
        HeapMemoryPool pool = new HeapMemoryPool(Long.MAX_VALUE);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(
                        executor.submit(
                                () -> {
                                    for (int i = 0; i < 10_000; i++) {
                                        pool.allocate(8);
                                        pool.release(8);
                                    }
                                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }
        assertThat(pool.usedBytes()).isZero();
    }
}

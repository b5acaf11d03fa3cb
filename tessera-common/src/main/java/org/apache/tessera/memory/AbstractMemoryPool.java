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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkState;

/**
 * 内存池的公共记账逻辑。
 *
 * <p>同一次扫描中的多个批次可能共享一个池,所以计数使用原子变量。
 */
public abstract class AbstractMemoryPool implements MemoryPool {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractMemoryPool.class);

    private final AtomicLong usedBytes = new AtomicLong();

    private final long maxBytes;

    protected AbstractMemoryPool(long maxBytes) {
        checkArgument(maxBytes >= 0, "maxBytes must be >= 0, but is %s", maxBytes);
        this.maxBytes = maxBytes;
        LOG.debug("Created {} with a budget of {} bytes", getClass().getSimpleName(), maxBytes);
    }

    @Override
    public void allocate(long bytes) {
        checkArgument(bytes >= 0, "Cannot allocate negative bytes: %s", bytes);
        while (true) {
            long current = usedBytes.get();
            long next = current + bytes;
            if (next < 0 || next > maxBytes) {
                throw new MemoryAllocationException(
                        String.format(
                                "Cannot allocate %d bytes, %d of %d bytes already in use.",
                                bytes, current, maxBytes));
            }
            if (usedBytes.compareAndSet(current, next)) {
                return;
            }
        }
    }

    @Override
    public void release(long bytes) {
        checkArgument(bytes >= 0, "Cannot release negative bytes: %s", bytes);
        long remaining = usedBytes.addAndGet(-bytes);
        checkState(remaining >= 0, "Released more memory than allocated, remaining %s", remaining);
    }

    @Override
    public long usedBytes() {
        return usedBytes.get();
    }

    @Override
    public long maxBytes() {
        return maxBytes;
    }
}

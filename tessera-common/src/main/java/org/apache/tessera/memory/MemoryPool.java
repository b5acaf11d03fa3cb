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

import org.apache.tessera.annotation.Public;
import org.apache.tessera.options.MemorySize;
import org.apache.tessera.options.Options;

/**
 * 内存记账池。
 *
 * <p>所有 {@link DataBuffer} 在分配和扩容时向池申请字节数,在释放时归还。池本身不持有内存,
 * 只负责统计与预算控制,使查询级别的内存用量可以在不挂钩全局分配器的情况下被观察。
 *
 * <ul>
 *   <li>{@link HeapMemoryPool}: 有上限的池,超出预算时抛出 {@link MemoryAllocationException}
 *   <li>{@link UnlimitedMemoryPool}: 只统计不限制
 * </ul>
 *
 * <pre>{@code
 * Options options = new Options();
 * options.set(MemoryPoolOptions.POOL_SIZE, MemorySize.ofMebiBytes(64));
 * MemoryPool pool = MemoryPool.create(options);
 * }</pre>
 */
@Public
public interface MemoryPool {

    /**
     * 申请指定字节数。
     *
     * @throws MemoryAllocationException 如果超出池的预算
     */
    void allocate(long bytes);

    /** 归还之前申请的字节数。 */
    void release(long bytes);

    /** 当前已申请且未归还的字节数。 */
    long usedBytes();

    /** 池的预算上限,无上限时为 {@link Long#MAX_VALUE}。 */
    long maxBytes();

    static MemoryPool create(Options options) {
        MemorySize poolSize = options.get(MemoryPoolOptions.POOL_SIZE);
        return poolSize == null
                ? new UnlimitedMemoryPool()
                : new HeapMemoryPool(poolSize.getBytes());
    }
}

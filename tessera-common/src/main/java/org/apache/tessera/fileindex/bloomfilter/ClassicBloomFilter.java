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

package org.apache.tessera.fileindex.bloomfilter;

/**
 * 经典布隆过滤器,在整个位数组上做双重哈希。
 *
 * <p>第 i 次探测位置为 {@code h1 + i * h2},其中 h1 为哈希低 32 位,h2 为高 32 位。探测次数固定为
 * {@link #NUM_HASH_FUNCTIONS},因此从序列化字节恢复时不需要额外的元数据。探测次数不随误报率变化,
 * 位数组大小按 5 次探测的误报率估算,小误报率下会比最优位数更大。
 */
public class ClassicBloomFilter extends BloomFilter {

    /** 约对应 5% 误报率下的最优探测次数。 */
    public static final int NUM_HASH_FUNCTIONS = 5;

    ClassicBloomFilter() {}

    @Override
    public void addHash(long hash) {
        int hash1 = (int) hash;
        int hash2 = (int) (hash >>> 32);
        int mask = numBytes * Byte.SIZE - 1;
        for (int i = 1; i <= NUM_HASH_FUNCTIONS; i++) {
            int pos = (hash1 + i * hash2) & mask;
            data[pos >>> 3] |= (byte) (1 << (pos & 7));
        }
    }

    @Override
    public boolean testHash(long hash) {
        int hash1 = (int) hash;
        int hash2 = (int) (hash >>> 32);
        int mask = numBytes * Byte.SIZE - 1;
        for (int i = 1; i <= NUM_HASH_FUNCTIONS; i++) {
            int pos = (hash1 + i * hash2) & mask;
            if ((data[pos >>> 3] & (1 << (pos & 7))) == 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected double estimatedFpp(long expectedCount, long numBits) {
        double fill = 1 - Math.exp(-(double) NUM_HASH_FUNCTIONS * expectedCount / numBits);
        return Math.pow(fill, NUM_HASH_FUNCTIONS);
    }

    @Override
    public BloomFilterAlgorithm algorithm() {
        return BloomFilterAlgorithm.CLASSIC;
    }
}

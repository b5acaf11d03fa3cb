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

import java.util.Arrays;
import java.util.Objects;

import static org.apache.tessera.utils.Preconditions.checkNotNull;

/** 一个区域的序列化 Bloom Filter,以及恢复它所需的算法和哈希策略。 */
public final class BloomFilterIndex {

    private final BloomFilterAlgorithm algorithm;
    private final HashStrategy hashStrategy;
    private final byte[] bytes;

    public BloomFilterIndex(BloomFilterAlgorithm algorithm, HashStrategy hashStrategy, byte[] bytes) {
        this.algorithm = checkNotNull(algorithm);
        this.hashStrategy = checkNotNull(hashStrategy);
        this.bytes = checkNotNull(bytes).clone();
    }

    public BloomFilterAlgorithm algorithm() {
        return algorithm;
    }

    public HashStrategy hashStrategy() {
        return hashStrategy;
    }

    /** 序列化的过滤器,格式见 {@link BloomFilter#serialize()}。 */
    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        BloomFilterIndex that = (BloomFilterIndex) o;
        return algorithm == that.algorithm
                && hashStrategy == that.hashStrategy
                && Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(algorithm, hashStrategy) * 31 + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "BloomFilterIndex{algorithm="
                + algorithm
                + ", hashStrategy="
                + hashStrategy
                + ", size="
                + bytes.length
                + '}';
    }
}

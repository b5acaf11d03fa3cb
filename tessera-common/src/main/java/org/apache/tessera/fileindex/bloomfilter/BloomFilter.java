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

import org.apache.tessera.annotation.VisibleForTesting;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

import java.util.Arrays;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkNotNull;
import static org.apache.tessera.utils.Preconditions.checkState;

/**
 * 固定大小的布隆过滤器,用于区域(zone)级别的等值过滤。
 *
 * <p>基类只负责位数组的生命周期、哈希计算以及字节级的添加/测试封装;一个 64 位哈希值如何折算为位数组中
 * 的探测位置由子类通过 {@link #addHash(long)} 和 {@link #testHash(long)} 决定。
 *
 * <h2>两条初始化路径</h2>
 * <ul>
 *   <li>写入: {@link #init(long, double, HashStrategy)},按期望的不同值个数和误报率计算位数组大小
 *   <li>读取: {@link #init(byte[], int, HashStrategy)},深拷贝一份已序列化的过滤器
 * </ul>
 *
 * <h2>序列化格式</h2>
 * <pre>
 * +------------------------+-----------------+
 * | bit array (numBytes)   | has null (1B)   |
 * +------------------------+-----------------+
 * </pre>
 *
 * <p>位数组字节数总是 2 的幂,并位于 [{@link #MINIMUM_BYTES}, {@link #MAXIMUM_BYTES}] 之间。
 *
 * <h2>使用示例</h2>
 * <pre>{@code
 * BloomFilter filter = BloomFilter.create(BloomFilterAlgorithm.BLOCK);
 * filter.init(1000, 0.05, HashStrategy.MURMUR3_X64_64);
 * filter.addBytes("hello".getBytes(StandardCharsets.UTF_8));
 * byte[] bytes = filter.serialize();
 *
 * BloomFilter restored = BloomFilter.create(BloomFilterAlgorithm.BLOCK);
 * restored.init(bytes, bytes.length, HashStrategy.MURMUR3_X64_64);
 * restored.testBytes("hello".getBytes(StandardCharsets.UTF_8)); // true
 * }</pre>
 */
@NotThreadSafe
public abstract class BloomFilter {

    /** 哈希种子,已写出的过滤器依赖该值,不可修改。 */
    public static final long DEFAULT_SEED = 1575457558L;

    /** 最小的位数组字节数,即一个分块的大小。 */
    public static final int MINIMUM_BYTES = 32;

    public static final int MAXIMUM_BYTES = 128 * 1024 * 1024;

    private static final double LN2_SQUARED = Math.log(2) * Math.log(2);

    /** 位数组,未初始化时为 null。 */
    protected byte[] data;

    protected int numBytes;

    private boolean hasNull;

    @Nullable private HashStrategy hashStrategy;

    public static BloomFilter create(BloomFilterAlgorithm algorithm) {
        checkNotNull(algorithm, "Bloom filter algorithm must not be null");
        switch (algorithm) {
            case BLOCK:
                return new BlockSplitBloomFilter();
            case CLASSIC:
                return new ClassicBloomFilter();
            default:
                throw new IllegalArgumentException("Unsupported bloom filter algorithm " + algorithm);
        }
    }

    /**
     * 写入路径的初始化,位数组清零。
     *
     * @param expectedCount 期望写入的不同值个数
     * @param fpp 期望的误报率,取值范围 (0, 1)
     */
    public void init(long expectedCount, double fpp, @Nullable HashStrategy strategy) {
        checkArgument(strategy != null, "Invalid hash strategy: null");
        checkArgument(expectedCount >= 1, "Invalid expected count: %s", expectedCount);
        checkArgument(fpp > 0 && fpp < 1, "Invalid false positive probability: %s", fpp);
        this.numBytes = (int) (numBitsFor(expectedCount, fpp) / Byte.SIZE);
        this.data = new byte[numBytes];
        this.hasNull = false;
        this.hashStrategy = strategy;
    }

    /**
     * 读取路径的初始化,拷贝 {@code buf} 的前 {@code size} 个字节,其中最后一个字节是 null 标记。
     */
    public void init(byte[] buf, int size, @Nullable HashStrategy strategy) {
        checkArgument(strategy != null, "Invalid hash strategy: null");
        checkNotNull(buf);
        checkArgument(size >= 2, "Invalid bloom filter size: %s", size);
        checkArgument(
                buf.length >= size,
                "Buffer of %s bytes is shorter than bloom filter size %s",
                buf.length,
                size);
        checkNumBytes(size - 1);
        this.numBytes = size - 1;
        this.data = Arrays.copyOf(buf, numBytes);
        this.hasNull = buf[numBytes] != 0;
        this.hashStrategy = strategy;
    }

    /**
     * 计算位数组的位数: m = ceil(-n * ln(fpp) / (ln 2)^2),限制在允许范围内后向上取整为 2 的幂。
     */
    @VisibleForTesting
    static long optimalNumOfBits(long expectedCount, double fpp) {
        double bits = Math.ceil(-expectedCount * Math.log(fpp) / LN2_SQUARED);
        long minBits = (long) MINIMUM_BYTES * Byte.SIZE;
        long maxBits = (long) MAXIMUM_BYTES * Byte.SIZE;
        long numBits = (long) Math.max(minBits, Math.min(maxBits, bits));
        if ((numBits & (numBits - 1)) != 0) {
            numBits = Long.highestOneBit(numBits) << 1;
        }
        return numBits;
    }

    /**
     * 从 {@link #optimalNumOfBits} 出发不断翻倍,直到当前探测算法的估算误报率不超过 {@code fpp},
     * 或者到达 {@link #MAXIMUM_BYTES}。
     */
    @VisibleForTesting
    long numBitsFor(long expectedCount, double fpp) {
        long numBits = optimalNumOfBits(expectedCount, fpp);
        long maxBits = (long) MAXIMUM_BYTES * Byte.SIZE;
        while (numBits < maxBits && estimatedFpp(expectedCount, numBits) > fpp) {
            numBits <<= 1;
        }
        return numBits;
    }

    /** 写入 {@code expectedCount} 个不同值后,{@code numBits} 位的过滤器的理论误报率。 */
    protected abstract double estimatedFpp(long expectedCount, long numBits);

    public long hash(byte[] bytes, int offset, int length) {
        checkState(hashStrategy != null, "Bloom filter is not initialized");
        return hashStrategy.hash(bytes, offset, length, DEFAULT_SEED);
    }

    public void addBytes(@Nullable byte[] bytes) {
        if (bytes == null) {
            addBytes(null, 0, 0);
        } else {
            addBytes(bytes, 0, bytes.length);
        }
    }

    /** 添加一个值,{@code bytes} 为 null 时只记录 null 标记。 */
    public void addBytes(@Nullable byte[] bytes, int offset, int length) {
        checkInitialized();
        if (bytes == null) {
            hasNull = true;
            return;
        }
        addHash(hash(bytes, offset, length));
    }

    public boolean testBytes(@Nullable byte[] bytes) {
        if (bytes == null) {
            return testBytes(null, 0, 0);
        }
        return testBytes(bytes, 0, bytes.length);
    }

    /**
     * 测试一个值是否可能存在。返回 false 表示一定不存在。
     */
    public boolean testBytes(@Nullable byte[] bytes, int offset, int length) {
        checkInitialized();
        if (bytes == null) {
            return hasNull;
        }
        return testHash(hash(bytes, offset, length));
    }

    /** 校验读取路径得到的位数组字节数是否适用于当前探测算法。 */
    protected void checkNumBytes(int numBytes) {}

    public abstract void addHash(long hash);

    public abstract boolean testHash(long hash);

    public abstract BloomFilterAlgorithm algorithm();

    /** 清空位数组和 null 标记,大小不变。 */
    public void reset() {
        checkInitialized();
        Arrays.fill(data, (byte) 0);
        hasNull = false;
    }

    public byte[] serialize() {
        checkInitialized();
        byte[] bytes = Arrays.copyOf(data, numBytes + 1);
        bytes[numBytes] = (byte) (hasNull ? 1 : 0);
        return bytes;
    }

    public int numBytes() {
        return numBytes;
    }

    /** 序列化后的字节数,即位数组字节数加一个 null 标记字节。 */
    public int size() {
        return numBytes + 1;
    }

    public boolean hasNull() {
        return hasNull;
    }

    public void setHasNull(boolean hasNull) {
        this.hasNull = hasNull;
    }

    @Nullable
    public HashStrategy hashStrategy() {
        return hashStrategy;
    }

    private void checkInitialized() {
        checkState(data != null, "Bloom filter is not initialized");
    }

    @Override
    public String toString() {
        return String.format(
                "%s{algorithm=%s, numBytes=%d, hasNull=%s}",
                getClass().getSimpleName(), algorithm(), numBytes, hasNull);
    }
}

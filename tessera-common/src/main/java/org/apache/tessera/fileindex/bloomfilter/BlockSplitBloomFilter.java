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

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 分块布隆过滤器。
 *
 * <p>位数组被切分为 32 字节的桶,每个桶由 8 个 32 位小端字组成。64 位哈希的高 32 位选择桶,
 * 低 32 位与 8 个盐值分别相乘,乘积的高 5 位决定在对应字中置位的位置。一个值的所有探测都落在
 * 同一个桶中,因此只需访问一条缓存行。
 */
public class BlockSplitBloomFilter extends BloomFilter {

    private static final int BYTES_PER_BUCKET = 32;
    private static final int BITS_SET_PER_BLOCK = 8;

    private static final int[] SALT = {
        0x47b6137b, 0x44974d91, 0x8824ad5b, 0xa2b7289d,
        0x705495c7, 0x2df1424b, 0x9efc4947, 0x5c6bfb31
    };

    BlockSplitBloomFilter() {}

    @Override
    protected void checkNumBytes(int numBytes) {
        checkArgument(
                numBytes >= BYTES_PER_BUCKET && (numBytes & (numBytes - 1)) == 0,
                "Block split bloom filter needs a power of two of at least %s bytes, got %s",
                BYTES_PER_BUCKET,
                numBytes);
    }

    @Override
    public void addHash(long hash) {
        int bucketOffset = bucketOffset(hash);
        int key = (int) hash;
        for (int i = 0; i < BITS_SET_PER_BLOCK; i++) {
            int bit = (key * SALT[i]) >>> 27;
            // little-endian word i of the bucket
            int index = bucketOffset + i * Integer.BYTES + (bit >>> 3);
            data[index] |= (byte) (1 << (bit & 7));
        }
    }

    @Override
    public boolean testHash(long hash) {
        int bucketOffset = bucketOffset(hash);
        int key = (int) hash;
        for (int i = 0; i < BITS_SET_PER_BLOCK; i++) {
            int bit = (key * SALT[i]) >>> 27;
            int index = bucketOffset + i * Integer.BYTES + (bit >>> 3);
            if ((data[index] & (1 << (bit & 7))) == 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * 每个桶接收的值个数近似服从泊松分布,桶内 8 个字各置 1 位。对桶负载求和得到整体误报率。
     */
    @Override
    protected double estimatedFpp(long expectedCount, long numBits) {
        double lambda = (double) expectedCount * BYTES_PER_BUCKET * Byte.SIZE / numBits;
        long upper = (long) (lambda + 12 * Math.sqrt(lambda)) + 20;
        double logLambda = Math.log(lambda);
        double logProbability = -lambda;
        double fpp = 0;
        for (long j = 0; j <= upper; j++) {
            if (j > 0) {
                logProbability += logLambda - Math.log(j);
            }
            double wordFill = 1 - Math.pow(1 - 1.0 / Integer.SIZE, j);
            fpp += Math.exp(logProbability) * Math.pow(wordFill, BITS_SET_PER_BLOCK);
        }
        return fpp;
    }

    private int bucketOffset(long hash) {
        int numBuckets = numBytes / BYTES_PER_BUCKET;
        int bucket = (int) (hash >>> 32) & (numBuckets - 1);
        return bucket * BYTES_PER_BUCKET;
    }

    @Override
    public BloomFilterAlgorithm algorithm() {
        return BloomFilterAlgorithm.BLOCK;
    }
}

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

package org.apache.tessera.utils;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * MurmurHash3 64 位哈希工具类。
 *
 * <p>实现 MurmurHash3 x64 变体的单 64 位输出版本:按 8 字节小端块处理数据,只维护一条哈希链
 * {@code h1},尾部不足 8 字节的数据折叠为一个块混入,最后与长度异或并经过 {@link #fmix(long)}
 * 完成雪崩。该输出与按同一种子写入的 Bloom Filter 字节格式保持兼容,算法中的常量不可修改。
 *
 * <h2>核心常量</h2>
 * <ul>
 *   <li>C1 = 0x87c37b91114253d5, C2 = 0x4cf5ad432745937f
 *   <li>块混合: {@code k1 *= C1; k1 = rotl(k1, 31); k1 *= C2}
 *   <li>链混合: {@code h1 = rotl(h1, 27) * 5 + 0x52dce729}
 * </ul>
 */
public final class MurmurHashUtils {

    private static final long C1 = 0x87c37b91114253d5L;
    private static final long C2 = 0x4cf5ad432745937fL;

    private MurmurHashUtils() {}

    public static long hash64(byte[] bytes, long seed) {
        return hash64(bytes, 0, bytes.length, seed);
    }

    /**
     * 计算 {@code bytes[offset, offset + length)} 的 64 位哈希值。
     *
     * @param seed 种子,按无符号 32 位值使用
     */
    public static long hash64(byte[] bytes, int offset, int length, long seed) {
        checkArgument(
                offset >= 0 && length >= 0 && offset + length <= bytes.length,
                "Range [%s, %s) is out of bounds for length %s",
                offset,
                offset + length,
                bytes.length);
        int numBlocks = length / 8;
        long h1 = seed;

        for (int i = 0; i < numBlocks; i++) {
            long k1 = getLongLittleEndian(bytes, offset + i * 8);
            h1 ^= mixK1(k1);
            h1 = Long.rotateLeft(h1, 27);
            h1 = h1 * 5 + 0x52dce729;
        }

        int tail = offset + numBlocks * 8;
        long k1 = 0;
        // fold the remaining bytes, highest first
        for (int i = (length & 7) - 1; i >= 0; i--) {
            k1 ^= (bytes[tail + i] & 0xFFL) << (i * 8);
        }
        if ((length & 7) != 0) {
            h1 ^= mixK1(k1);
        }

        h1 ^= length;
        return fmix(h1);
    }

    private static long mixK1(long k1) {
        k1 *= C1;
        k1 = Long.rotateLeft(k1, 31);
        k1 *= C2;
        return k1;
    }

    private static long getLongLittleEndian(byte[] bytes, int offset) {
        return (bytes[offset] & 0xFFL)
                | (bytes[offset + 1] & 0xFFL) << 8
                | (bytes[offset + 2] & 0xFFL) << 16
                | (bytes[offset + 3] & 0xFFL) << 24
                | (bytes[offset + 4] & 0xFFL) << 32
                | (bytes[offset + 5] & 0xFFL) << 40
                | (bytes[offset + 6] & 0xFFL) << 48
                | (bytes[offset + 7] & 0xFFL) << 56;
    }

    /** 64 位最终混合。 */
    public static long fmix(long h) {
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }
}

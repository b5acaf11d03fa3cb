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

import org.apache.tessera.data.Decimal;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 值到哈希输入字节的规范编码。写入端和读取端共用同一套编码,保证对同一个值得到相同的哈希。
 *
 * <ul>
 *   <li>long / decimal64 未缩放值: 8 字节小端,{@link Decimal} 按其未缩放值编码
 *   <li>double: {@link Double#doubleToLongBits(double)} 后按 long 编码,所有 NaN 归一
 *   <li>timestamp: 秒数 8 字节小端 + 纳秒数 8 字节小端
 *   <li>字符串: UTF-8 字节;二进制: 原始字节
 * </ul>
 */
final class BloomFilterValues {

    private BloomFilterValues() {}

    static byte[] ofLong(long value) {
        byte[] bytes = new byte[Long.BYTES];
        putLong(bytes, 0, value);
        return bytes;
    }

    static byte[] ofDouble(double value) {
        return ofLong(Double.doubleToLongBits(value));
    }

    static byte[] ofTimestamp(long epochSeconds, long nanos) {
        byte[] bytes = new byte[2 * Long.BYTES];
        putLong(bytes, 0, epochSeconds);
        putLong(bytes, Long.BYTES, nanos);
        return bytes;
    }

    /** 把查询值转换为规范字节,{@code null} 保持为 {@code null}。 */
    static byte[] of(Object value) {
        if (value == null) {
            return null;
        } else if (value instanceof Long
                || value instanceof Integer
                || value instanceof Short
                || value instanceof Byte) {
            return ofLong(((Number) value).longValue());
        } else if (value instanceof Boolean) {
            return ofLong((Boolean) value ? 1 : 0);
        } else if (value instanceof Double || value instanceof Float) {
            return ofDouble(((Number) value).doubleValue());
        } else if (value instanceof String) {
            return ((String) value).getBytes(StandardCharsets.UTF_8);
        } else if (value instanceof byte[]) {
            return (byte[]) value;
        } else if (value instanceof Decimal) {
            return ofDecimal((Decimal) value);
        } else if (value instanceof Instant) {
            Instant instant = (Instant) value;
            return ofTimestamp(instant.getEpochSecond(), instant.getNano());
        }
        throw new IllegalArgumentException(
                "Unsupported bloom filter value type: " + value.getClass().getName());
    }

    static byte[] ofDecimal(Decimal value) {
        checkArgument(
                value.getValue().bitLength() < Long.SIZE,
                "Decimal %s does not fit into a decimal64 column",
                value);
        return ofLong(value.getValue().longValue());
    }

    private static void putLong(byte[] bytes, int offset, long value) {
        for (int i = 0; i < Long.BYTES; i++) {
            bytes[offset + i] = (byte) (value >>> (i * 8));
        }
    }
}

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

import javax.annotation.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 读取一个区域的 Bloom Filter 并回答等值查询。
 *
 * <p>{@link #mightContain(Object)} 返回 false 时该区域一定不包含这个值,可以跳过;返回 true 时需要扫描。
 * 查询值支持 {@link Long}/{@link Integer} 等整数、{@link Double}/{@link Float}、{@link String}、
 * {@code byte[]}、{@link java.time.Instant}、{@link Decimal} 以及 {@code null}。
 *
 * <p>decimal64 列按未缩放值建索引,直接传入的 {@link Decimal} 必须已经是列的 scale;
 * scale 不同时使用 {@link #mightContain(Decimal, int)}。
 */
public class BloomFilterIndexReader {

    private final BloomFilter filter;

    public BloomFilterIndexReader(BloomFilterIndex index) {
        byte[] bytes = index.bytes();
        this.filter = BloomFilter.create(index.algorithm());
        filter.init(bytes, bytes.length, index.hashStrategy());
    }

    public boolean mightContain(@Nullable Object value) {
        return filter.testBytes(BloomFilterValues.of(value));
    }

    /** 把 {@code value} 精确转换到列的 {@code scale} 后查询;无法精确表示的值一定不在该列中。 */
    public boolean mightContain(Decimal value, int scale) {
        checkArgument(scale >= 0, "Scale must be >= 0, but is %s", scale);
        BigDecimal stripped = new BigDecimal(value.getValue(), value.getScale()).stripTrailingZeros();
        if (stripped.scale() > scale) {
            return false;
        }
        BigInteger unscaled = stripped.setScale(scale).unscaledValue();
        if (unscaled.bitLength() >= Long.SIZE) {
            return false;
        }
        return filter.testBytes(BloomFilterValues.ofDecimal(new Decimal(unscaled, scale)));
    }

    public boolean hasNull() {
        return filter.hasNull();
    }
}

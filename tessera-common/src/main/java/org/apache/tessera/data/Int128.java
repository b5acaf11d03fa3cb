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

package org.apache.tessera.data;

import org.apache.tessera.annotation.Public;

import java.io.Serializable;
import java.math.BigInteger;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 128 位有符号整数,以补码形式拆分为高 64 位和低 64 位保存。
 *
 * <p>用于 {@code Decimal128VectorBatch} 的定点数值,精度最高为 38 位十进制数字。
 * 实例不可变。
 */
@Public
public final class Int128 implements Comparable<Int128>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final BigInteger MIN_VALUE = BigInteger.ONE.shiftLeft(127).negate();
    private static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(127).subtract(BigInteger.ONE);
    private static final BigInteger LOW_MASK = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    public static final Int128 ZERO = new Int128(0L, 0L);

    private final long high;
    private final long low;

    public Int128(long high, long low) {
        this.high = high;
        this.low = low;
    }

    public static Int128 valueOf(long value) {
        return new Int128(value < 0 ? -1L : 0L, value);
    }

    public static Int128 fromBigInteger(BigInteger value) {
        checkArgument(
                value.compareTo(MIN_VALUE) >= 0 && value.compareTo(MAX_VALUE) <= 0,
                "Value %s does not fit into 128 bits",
                value);
        return new Int128(value.shiftRight(64).longValue(), value.and(LOW_MASK).longValue());
    }

    public long getHighBits() {
        return high;
    }

    public long getLowBits() {
        return low;
    }

    public boolean isNegative() {
        return high < 0;
    }

    public BigInteger toBigInteger() {
        BigInteger lowPart = BigInteger.valueOf(low).and(LOW_MASK);
        return BigInteger.valueOf(high).shiftLeft(64).or(lowPart);
    }

    @Override
    public int compareTo(Int128 that) {
        int cmp = Long.compare(high, that.high);
        return cmp != 0 ? cmp : Long.compareUnsigned(low, that.low);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Int128)) {
            return false;
        }
        Int128 that = (Int128) o;
        return high == that.high && low == that.low;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(high) + Long.hashCode(low);
    }

    @Override
    public String toString() {
        return toBigInteger().toString();
    }
}

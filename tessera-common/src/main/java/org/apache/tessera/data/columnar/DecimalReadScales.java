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

package org.apache.tessera.data.columnar;

import org.apache.tessera.data.Int128;

import java.math.BigInteger;

/**
 * 旧版文件中按行记录 scale 的小数解码辅助类。
 *
 * <p>某些旧版文件为每一行单独记录 scale。解码时先通过 {@link #setReadScale} 记下每行读到的
 * scale,整批读完后调用 {@code rescale} 把所有非空行的值统一换算到批次的 scale。
 * 这是唯一可以访问小数批次 {@code readScales} 缓冲区的地方,批次的公共接口不暴露它。
 *
 * <p>scale 变小时按截断(向零取整)处理。
 */
public final class DecimalReadScales {

    private static final long[] POWERS_OF_TEN = new long[Decimal64VectorBatch.MAX_PRECISION + 1];

    static {
        POWERS_OF_TEN[0] = 1;
        for (int i = 1; i < POWERS_OF_TEN.length; i++) {
            POWERS_OF_TEN[i] = POWERS_OF_TEN[i - 1] * 10;
        }
    }

    private DecimalReadScales() {}

    public static void setReadScale(Decimal64VectorBatch batch, int row, int readScale) {
        batch.readScales.set(row, readScale);
    }

    public static void setReadScale(Decimal128VectorBatch batch, int row, int readScale) {
        batch.readScales.set(row, readScale);
    }

    public static int getReadScale(Decimal64VectorBatch batch, int row) {
        return (int) batch.readScales.get(row);
    }

    public static int getReadScale(Decimal128VectorBatch batch, int row) {
        return (int) batch.readScales.get(row);
    }

    /** 把前 {@code numElements} 行的值从各自的读取 scale 换算到批次 scale。 */
    public static void rescale(Decimal64VectorBatch batch) {
        long[] values = batch.values.array();
        for (int i = 0; i < batch.getNumElements(); i++) {
            if (batch.isNullAt(i)) {
                continue;
            }
            int diff = batch.getScale() - (int) batch.readScales.get(i);
            if (diff > 0) {
                values[i] = Math.multiplyExact(values[i], pow10(diff));
            } else if (diff < 0) {
                values[i] = values[i] / pow10(-diff);
            }
        }
    }

    public static void rescale(Decimal128VectorBatch batch) {
        for (int i = 0; i < batch.getNumElements(); i++) {
            if (batch.isNullAt(i)) {
                continue;
            }
            int diff = batch.getScale() - (int) batch.readScales.get(i);
            if (diff == 0) {
                continue;
            }
            BigInteger value = batch.values.get(i).toBigInteger();
            BigInteger factor = BigInteger.TEN.pow(Math.abs(diff));
            value = diff > 0 ? value.multiply(factor) : value.divide(factor);
            batch.values.set(i, Int128.fromBigInteger(value));
        }
    }

    private static long pow10(int exponent) {
        if (exponent >= POWERS_OF_TEN.length) {
            throw new ArithmeticException("Scale difference too large: " + exponent);
        }
        return POWERS_OF_TEN[exponent];
    }
}

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
import java.util.Objects;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * 不可变的定点小数:任意精度的有符号整数值加上显式的 scale。
 *
 * <p>数值等于 {@code unscaledValue * 10^-scale}。例如 {@code 12345} 与 scale {@code 2}
 * 表示 {@code 123.45}。
 *
 * <pre>{@code
 * Decimal d = new Decimal("12.300");
 * d.toString();      // "12.300"
 * d.toString(true);  // "12.3"
 * }</pre>
 */
@Public
public final class Decimal implements Serializable {

    private static final long serialVersionUID = 1L;

    private final BigInteger value;

    private final int scale;

    public Decimal(BigInteger value, int scale) {
        checkArgument(scale >= 0, "Scale must be >= 0, but is %s", scale);
        this.value = checkNotNull(value, "value");
        this.scale = scale;
    }

    public Decimal(Int128 value, int scale) {
        this(value.toBigInteger(), scale);
    }

    public Decimal(long value, int scale) {
        this(BigInteger.valueOf(value), scale);
    }

    /**
     * 从十进制文本解析,例如 {@code "-3.1400"}。scale 等于小数点后的位数。
     *
     * @throws NumberFormatException 如果文本不是合法的十进制数
     */
    public Decimal(String text) {
        checkNotNull(text, "text");
        String trimmed = text.trim();
        int dot = trimmed.indexOf('.');
        if (dot < 0) {
            this.value = new BigInteger(trimmed);
            this.scale = 0;
        } else {
            String integral = trimmed.substring(0, dot);
            String fraction = trimmed.substring(dot + 1);
            if (fraction.isEmpty() || fraction.charAt(0) == '-' || fraction.charAt(0) == '+') {
                throw new NumberFormatException("Invalid decimal: " + text);
            }
            if (integral.isEmpty() || integral.equals("-") || integral.equals("+")) {
                integral = integral + "0";
            }
            this.value = new BigInteger(integral + fraction);
            this.scale = fraction.length();
        }
    }

    public BigInteger getValue() {
        return value;
    }

    public int getScale() {
        return scale;
    }

    @Override
    public String toString() {
        return toString(false);
    }

    /**
     * 渲染为十进制文本。
     *
     * @param trimTrailingZeros 是否去掉小数部分末尾的 0;小数部分全为 0 时连同小数点一起去掉
     */
    public String toString(boolean trimTrailingZeros) {
        String digits = value.abs().toString();
        StringBuilder builder = new StringBuilder();
        if (value.signum() < 0) {
            builder.append('-');
        }
        if (scale == 0) {
            return builder.append(digits).toString();
        }
        if (digits.length() <= scale) {
            builder.append("0.");
            for (int i = digits.length(); i < scale; i++) {
                builder.append('0');
            }
            builder.append(digits);
        } else {
            int split = digits.length() - scale;
            builder.append(digits, 0, split).append('.').append(digits, split, digits.length());
        }
        if (trimTrailingZeros) {
            int end = builder.length();
            while (builder.charAt(end - 1) == '0') {
                end--;
            }
            if (builder.charAt(end - 1) == '.') {
                end--;
            }
            builder.setLength(end);
        }
        return builder.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Decimal)) {
            return false;
        }
        Decimal that = (Decimal) o;
        return scale == that.scale && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, scale);
    }
}

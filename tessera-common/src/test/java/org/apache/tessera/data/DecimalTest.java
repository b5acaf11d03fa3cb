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

import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link Decimal}. */
class DecimalTest {

    @Test
    void testToString() {
        assertThat(new Decimal(31400, 4).toString()).isEqualTo("3.1400");
        assertThat(new Decimal(-5, 3).toString()).isEqualTo("-0.005");
        assertThat(new Decimal(42, 0).toString()).isEqualTo("42");
        assertThat(new Decimal(0, 2).toString()).isEqualTo("0.00");
    }

    @Test
    void testTrimTrailingZeros() {
        assertThat(new Decimal(31400, 4).toString(true)).isEqualTo("3.14");
        assertThat(new Decimal(2000, 3).toString(true)).isEqualTo("2");
        assertThat(new Decimal(0, 2).toString(true)).isEqualTo("0");
        assertThat(new Decimal(-1200, 2).toString(true)).isEqualTo("-12");
        assertThat(new Decimal(100, 0).toString(true)).isEqualTo("100");
    }

    @Test
    void testParse() {
        Decimal decimal = new Decimal("-3.1400");
        assertThat(decimal.getValue()).isEqualTo(BigInteger.valueOf(-31400));
        assertThat(decimal.getScale()).isEqualTo(4);

        assertThat(new Decimal(".5")).isEqualTo(new Decimal(5, 1));
        assertThat(new Decimal("-.5").toString()).isEqualTo("-0.5");
        assertThat(new Decimal("17")).isEqualTo(new Decimal(17, 0));
        assertThat(new Decimal("123456789012345678901234567890.12").toString())
                .isEqualTo("123456789012345678901234567890.12");

        assertThatThrownBy(() -> new Decimal("1."))
                .isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> new Decimal("1.-2"))
                .isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> new Decimal("abc"))
                .isInstanceOf(NumberFormatException.class);
    }

    @Test
    void testFromInt128() {
        Int128 value = Int128.fromBigInteger(new BigInteger("-170141183460469231731687303715884105728"));
        assertThat(new Decimal(value, 38).toString(true))
                .isEqualTo("-1.70141183460469231731687303715884105728");
    }
}

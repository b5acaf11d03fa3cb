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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link BloomFilter} and its probe algorithms. */
class BloomFilterTest {

    private static byte[] key(long value) {
        return BloomFilterValues.ofLong(value);
    }

    @Test
    void testOptimalNumOfBits() {
        assertThat(BloomFilter.optimalNumOfBits(1, 0.05)).isEqualTo(32 * 8);
        assertThat(BloomFilter.optimalNumOfBits(1000, 0.05)).isEqualTo(1024 * 8);
        assertThat(BloomFilter.optimalNumOfBits(100_000, 0.05)).isEqualTo(131072 * 8);
        assertThat(BloomFilter.optimalNumOfBits(1_000_000_000L, 0.01))
                .isEqualTo((long) BloomFilter.MAXIMUM_BYTES * 8);
        for (long n = 1; n < 1_000_000; n *= 7) {
            long bits = BloomFilter.optimalNumOfBits(n, 0.05);
            assertThat(Long.bitCount(bits)).isEqualTo(1);
            assertThat(bits / 8).isBetween((long) BloomFilter.MINIMUM_BYTES, (long) BloomFilter.MAXIMUM_BYTES);
        }
    }

    @ParameterizedTest
    @EnumSource(BloomFilterAlgorithm.class)
    void testNoFalseNegatives(BloomFilterAlgorithm algorithm) {
        BloomFilter filter = BloomFilter.create(algorithm);
        filter.init(1000, 0.05, HashStrategy.MURMUR3_X64_64);
        assertThat(filter.numBytes()).isEqualTo(1024);
        assertThat(filter.size()).isEqualTo(1025);
        assertThat(filter.algorithm()).isEqualTo(algorithm);

        for (long i = 0; i < 1000; i++) {
            filter.addBytes(key(i));
        }
        for (long i = 0; i < 1000; i++) {
            assertThat(filter.testBytes(key(i))).isTrue();
        }

        int falsePositives = 0;
        for (long i = 1000; i < 11000; i++) {
            if (filter.testBytes(key(i))) {
                falsePositives++;
            }
        }
        assertThat(falsePositives / 10000.0).isLessThan(0.06);
    }

    static Stream<Arguments> fppCases() {
        // algorithm, expected count, fpp, queried absent keys, expected bytes
        return Stream.of(BloomFilterAlgorithm.values())
                .flatMap(
                        algorithm ->
                                Stream.of(
                                        Arguments.of(algorithm, 1_000, 0.05, 20_000, 1024),
                                        Arguments.of(algorithm, 10_000, 0.01, 50_000, 16384),
                                        Arguments.of(algorithm, 5_000, 1e-3, 200_000, 16384),
                                        Arguments.of(algorithm, 54_000, 1e-4, 300_000, 262144)));
    }

    @ParameterizedTest(name = "{0} n={1} fpp={2}")
    @MethodSource("fppCases")
    void testFalsePositiveRateWithinTarget(
            BloomFilterAlgorithm algorithm, int expectedCount, double fpp, int queries, int numBytes) {
        BloomFilter filter = BloomFilter.create(algorithm);
        filter.init(expectedCount, fpp, HashStrategy.MURMUR3_X64_64);
        assertThat(filter.numBytes()).isEqualTo(numBytes);
        assertThat(filter.estimatedFpp(expectedCount, (long) numBytes * 8)).isLessThanOrEqualTo(fpp);

        for (long i = 0; i < expectedCount; i++) {
            filter.addBytes(key(i));
        }
        int falsePositives = 0;
        for (long i = expectedCount; i < expectedCount + queries; i++) {
            if (filter.testBytes(key(i))) {
                falsePositives++;
            }
        }
        assertThat((double) falsePositives / queries).isLessThanOrEqualTo(fpp);
    }

    @Test
    void testSizingAccountsForProbeCount() {
        // five probes need twice the optimal bit count at fpp 1e-4
        BloomFilter classic = BloomFilter.create(BloomFilterAlgorithm.CLASSIC);
        assertThat(BloomFilter.optimalNumOfBits(54_000, 1e-4)).isEqualTo(131072L * 8);
        assertThat(classic.numBitsFor(54_000, 1e-4)).isEqualTo(262144L * 8);
        assertThat(classic.estimatedFpp(54_000, 131072L * 8)).isGreaterThan(1e-4);

        // sizing never grows past the maximum
        assertThat(classic.numBitsFor(1_000_000_000L, 1e-6))
                .isEqualTo((long) BloomFilter.MAXIMUM_BYTES * 8);
        assertThat(BloomFilter.create(BloomFilterAlgorithm.BLOCK).numBitsFor(1000, 0.05))
                .isEqualTo(1024L * 8);
    }

    @ParameterizedTest
    @EnumSource(BloomFilterAlgorithm.class)
    void testSerializeRoundTrip(BloomFilterAlgorithm algorithm) {
        BloomFilter filter = BloomFilter.create(algorithm);
        filter.init(100, 0.01, HashStrategy.MURMUR3_X64_64);
        byte[] hello = "hello".getBytes(StandardCharsets.UTF_8);
        filter.addBytes(hello);
        filter.addBytes(null);

        byte[] bytes = filter.serialize();
        assertThat(bytes).hasSize(filter.size());
        assertThat(bytes[bytes.length - 1]).isEqualTo((byte) 1);

        BloomFilter restored = BloomFilter.create(algorithm);
        restored.init(bytes, bytes.length, HashStrategy.MURMUR3_X64_64);
        assertThat(restored.numBytes()).isEqualTo(filter.numBytes());
        assertThat(restored.hasNull()).isTrue();
        assertThat(restored.testBytes(hello)).isTrue();
        assertThat(restored.testBytes(null)).isTrue();
        assertThat(restored.serialize()).isEqualTo(bytes);

        // the restored filter owns a copy
        bytes[0] = (byte) ~bytes[0];
        assertThat(restored.testBytes(hello)).isTrue();
    }

    @Test
    void testNullFlag() {
        BloomFilter filter = BloomFilter.create(BloomFilterAlgorithm.BLOCK);
        filter.init(10, 0.05, HashStrategy.MURMUR3_X64_64);
        assertThat(filter.testBytes(null)).isFalse();
        assertThat(filter.serialize()[filter.numBytes()]).isZero();

        filter.addBytes(null, 0, 0);
        assertThat(filter.hasNull()).isTrue();
        assertThat(filter.testBytes(null)).isTrue();

        filter.setHasNull(false);
        assertThat(filter.testBytes(null)).isFalse();
    }

    @Test
    void testRangeHashing() {
        BloomFilter filter = BloomFilter.create(BloomFilterAlgorithm.CLASSIC);
        filter.init(10, 0.05, HashStrategy.MURMUR3_X64_64);
        byte[] padded = "xxkeyxx".getBytes(StandardCharsets.UTF_8);
        filter.addBytes(padded, 2, 3);
        assertThat(filter.testBytes("key".getBytes(StandardCharsets.UTF_8))).isTrue();
        assertThat(filter.hash(padded, 2, 3))
                .isEqualTo(filter.hash("key".getBytes(StandardCharsets.UTF_8), 0, 3));
    }

    @Test
    void testReset() {
        BloomFilter filter = BloomFilter.create(BloomFilterAlgorithm.BLOCK);
        filter.init(10, 0.05, HashStrategy.MURMUR3_X64_64);
        filter.addBytes(key(42));
        filter.addBytes(null);
        filter.reset();
        assertThat(filter.hasNull()).isFalse();
        assertThat(filter.testBytes(key(42))).isFalse();
        assertThat(filter.numBytes()).isEqualTo(32);
    }

    @Test
    void testInvalidArguments() {
        BloomFilter filter = BloomFilter.create(BloomFilterAlgorithm.BLOCK);
        assertThatThrownBy(() -> filter.init(0, 0.05, HashStrategy.MURMUR3_X64_64))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter.init(10, 0, HashStrategy.MURMUR3_X64_64))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter.init(10, 1.0, HashStrategy.MURMUR3_X64_64))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter.init(10, 0.05, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter.init(new byte[] {0}, 1, HashStrategy.MURMUR3_X64_64))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter.init(new byte[4], 8, HashStrategy.MURMUR3_X64_64))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> filter.init(new byte[33], 33, null))
                .isInstanceOf(IllegalArgumentException.class);
        // a block split filter needs whole 32 byte buckets
        assertThatThrownBy(() -> filter.init(new byte[17], 17, HashStrategy.MURMUR3_X64_64))
                .isInstanceOf(IllegalArgumentException.class);

        // still uninitialized
        assertThat(filter.numBytes()).isZero();
        assertThatThrownBy(() -> filter.addBytes(key(1))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> BloomFilter.create(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testClassicAcceptsAnySize() {
        BloomFilter filter = BloomFilter.create(BloomFilterAlgorithm.CLASSIC);
        filter.init(new byte[] {(byte) 0xFF, 0}, 2, HashStrategy.MURMUR3_X64_64);
        assertThat(filter.numBytes()).isEqualTo(1);
        assertThat(filter.hasNull()).isFalse();
        assertThat(filter.testBytes(key(7))).isTrue();
    }
}

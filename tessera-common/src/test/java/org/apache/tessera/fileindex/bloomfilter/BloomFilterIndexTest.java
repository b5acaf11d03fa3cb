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
import org.apache.tessera.data.columnar.ColumnVectorBatch;
import org.apache.tessera.data.columnar.Decimal64VectorBatch;
import org.apache.tessera.data.columnar.DoubleVectorBatch;
import org.apache.tessera.data.columnar.EncodedStringVectorBatch;
import org.apache.tessera.data.columnar.LongVectorBatch;
import org.apache.tessera.data.columnar.StringDictionary;
import org.apache.tessera.data.columnar.StringVectorBatch;
import org.apache.tessera.data.columnar.TimestampVectorBatch;
import org.apache.tessera.memory.HeapMemoryPool;
import org.apache.tessera.options.Options;
import org.apache.tessera.types.TypeDescription;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link BloomFilterIndexWriter} and {@link BloomFilterIndexReader}. */
class BloomFilterIndexTest {

    private final HeapMemoryPool pool = new HeapMemoryPool(1024 * 1024);

    @AfterEach
    void after() {
        assertThat(pool.usedBytes()).isZero();
    }

    @Test
    void testLongZone() {
        BloomFilterIndexWriter writer = new BloomFilterIndexWriter(new Options());
        try (LongVectorBatch batch = LongVectorBatch.create(4, pool)) {
            batch.data.set(0, 7);
            batch.data.set(1, 7);
            batch.data.set(2, -3);
            batch.setNumElements(4);
            batch.setNullAt(3);
            writer.write(batch);
        }
        assertThat(writer.distinctCount()).isEqualTo(2);

        BloomFilterIndex index = writer.finish();
        assertThat(index.algorithm()).isEqualTo(BloomFilterAlgorithm.BLOCK);
        assertThat(index.hashStrategy()).isEqualTo(HashStrategy.MURMUR3_X64_64);
        assertThat(index.size()).isEqualTo(BloomFilter.MINIMUM_BYTES + 1);

        BloomFilterIndexReader reader = new BloomFilterIndexReader(index);
        assertThat(reader.mightContain(7L)).isTrue();
        assertThat(reader.mightContain(-3)).isTrue();
        assertThat(reader.mightContain(null)).isTrue();
        assertThat(reader.hasNull()).isTrue();
        assertThat(writer.distinctCount()).isZero();
    }

    @Test
    void testZonesAreIndependent() {
        Options options = new Options();
        options.set(BloomFilterOptions.ALGORITHM, BloomFilterAlgorithm.CLASSIC);
        options.set(BloomFilterOptions.FPP, 0.01);
        BloomFilterIndexWriter writer = new BloomFilterIndexWriter(options);

        writer.write("first".getBytes(StandardCharsets.UTF_8));
        BloomFilterIndex first = writer.finish();
        writer.write("second".getBytes(StandardCharsets.UTF_8));
        BloomFilterIndex second = writer.finish();

        assertThat(first.algorithm()).isEqualTo(BloomFilterAlgorithm.CLASSIC);
        assertThat(new BloomFilterIndexReader(first).mightContain("first")).isTrue();
        assertThat(new BloomFilterIndexReader(second).mightContain("second")).isTrue();
        assertThat(new BloomFilterIndexReader(second).hasNull()).isFalse();
    }

    @Test
    void testManyDistinctValues() {
        BloomFilterIndexWriter writer =
                new BloomFilterIndexWriter(
                        BloomFilterAlgorithm.BLOCK, HashStrategy.MURMUR3_X64_64, 0.05);
        try (DoubleVectorBatch batch = DoubleVectorBatch.create(1000, pool)) {
            for (int i = 0; i < 1000; i++) {
                batch.data.set(i, i * 0.25);
            }
            batch.setNumElements(1000);
            writer.write(batch);
            writer.write(batch);
        }
        BloomFilterIndex index = writer.finish();
        assertThat(index.size()).isEqualTo(1024 + 1);

        BloomFilterIndexReader reader = new BloomFilterIndexReader(index);
        for (int i = 0; i < 1000; i++) {
            assertThat(reader.mightContain(i * 0.25)).isTrue();
        }
        assertThat(reader.mightContain(null)).isFalse();
    }

    @Test
    void testStringsMatchAcrossEncodings() {
        StringDictionary.Builder builder = StringDictionary.builder(pool);
        builder.add("north");
        builder.add("south");
        StringDictionary dictionary = builder.build();

        BloomFilterIndexWriter plainWriter = new BloomFilterIndexWriter(new Options());
        BloomFilterIndexWriter encodedWriter = new BloomFilterIndexWriter(new Options());
        try (StringVectorBatch plain = StringVectorBatch.create(2, pool);
                EncodedStringVectorBatch encoded = EncodedStringVectorBatch.create(2, pool)) {
            plain.setString(0, "north");
            plain.setString(1, "south");
            plain.setNumElements(2);

            encoded.setDictionary(dictionary);
            encoded.setCode(0, 0);
            encoded.setCode(1, 1);
            encoded.setNumElements(2);

            plainWriter.write(plain);
            encodedWriter.write(encoded);
        }
        dictionary.release();

        BloomFilterIndex plainIndex = plainWriter.finish();
        assertThat(encodedWriter.finish()).isEqualTo(plainIndex);

        BloomFilterIndexReader reader = new BloomFilterIndexReader(plainIndex);
        assertThat(reader.mightContain("south")).isTrue();
        assertThat(reader.mightContain("south".getBytes(StandardCharsets.UTF_8))).isTrue();
    }

    @Test
    void testDecimalAndTimestamp() {
        BloomFilterIndexWriter writer = new BloomFilterIndexWriter(new Options());
        try (Decimal64VectorBatch decimals = Decimal64VectorBatch.create(1, pool, 10, 2);
                TimestampVectorBatch timestamps = TimestampVectorBatch.create(1, pool)) {
            decimals.values.set(0, 12345);
            decimals.setNumElements(1);
            timestamps.set(0, 1_700_000_000L, 500);
            timestamps.setNumElements(1);
            writer.write(decimals);
            writer.write(timestamps);
        }
        BloomFilterIndexReader reader = new BloomFilterIndexReader(writer.finish());
        // decimals are probed by their unscaled value
        assertThat(reader.mightContain(12345L)).isTrue();
        assertThat(reader.mightContain(Instant.ofEpochSecond(1_700_000_000L, 500))).isTrue();

        assertThat(reader.mightContain(new Decimal("123.45"))).isTrue();
        assertThat(reader.mightContain(new Decimal("123.450"), 2)).isTrue();
        assertThat(reader.mightContain(new Decimal(12345, 2), 2)).isTrue();
        // 123.455 has no exact representation at scale 2
        assertThat(reader.mightContain(new Decimal("123.455"), 2)).isFalse();
        assertThat(reader.mightContain(new Decimal(BigInteger.TEN.pow(20), 0), 2)).isFalse();
        assertThatThrownBy(() -> reader.mightContain(new Decimal(BigInteger.TEN.pow(20), 0)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> reader.mightContain(new Decimal("1.5"), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testUnsupportedBatch() {
        BloomFilterIndexWriter writer = new BloomFilterIndexWriter(new Options());
        try (ColumnVectorBatch batch =
                TypeDescription.createList(TypeDescription.createLong()).createRowBatch(1, pool)) {
            assertThatThrownBy(() -> writer.write(batch))
                    .isInstanceOf(UnsupportedOperationException.class)
                    .hasMessageContaining("LIST");
        }
        BloomFilterIndexReader reader = new BloomFilterIndexReader(writer.finish());
        assertThatThrownBy(() -> reader.mightContain(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testIndexIsImmutable() {
        byte[] bytes = new byte[33];
        BloomFilterIndex index =
                new BloomFilterIndex(BloomFilterAlgorithm.BLOCK, HashStrategy.MURMUR3_X64_64, bytes);
        bytes[32] = 1;
        assertThat(index.bytes()[32]).isZero();
        index.bytes()[32] = 1;
        assertThat(new BloomFilterIndexReader(index).hasNull()).isFalse();
    }
}

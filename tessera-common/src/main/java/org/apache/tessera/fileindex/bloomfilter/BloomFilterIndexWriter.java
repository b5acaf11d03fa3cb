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

import org.apache.tessera.data.columnar.BytesView;
import org.apache.tessera.data.columnar.ColumnVectorBatch;
import org.apache.tessera.data.columnar.ColumnVectorBatchVisitor;
import org.apache.tessera.data.columnar.Decimal128VectorBatch;
import org.apache.tessera.data.columnar.Decimal64VectorBatch;
import org.apache.tessera.data.columnar.DoubleVectorBatch;
import org.apache.tessera.data.columnar.EncodedStringVectorBatch;
import org.apache.tessera.data.columnar.ListVectorBatch;
import org.apache.tessera.data.columnar.LongVectorBatch;
import org.apache.tessera.data.columnar.MapVectorBatch;
import org.apache.tessera.data.columnar.StringVectorBatch;
import org.apache.tessera.data.columnar.StructVectorBatch;
import org.apache.tessera.data.columnar.TimestampVectorBatch;
import org.apache.tessera.data.columnar.UnionVectorBatch;
import org.apache.tessera.options.Options;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

import static org.apache.tessera.utils.Preconditions.checkArgument;

/**
 * 按区域(zone)构建 Bloom Filter 的写入器。
 *
 * <p>一个区域内的值先去重收集,{@link #finish()} 时按不同值个数确定过滤器大小,再把所有值写入过滤器并
 * 序列化。写入器在 {@link #finish()} 之后被重置,可以继续用于下一个区域。
 *
 * <p>支持 long、double、decimal64、timestamp、字符串及字典编码字符串批次;嵌套批次和 decimal128
 * 批次没有对应的规范编码,会抛出 {@link UnsupportedOperationException}。
 *
 * <pre>{@code
 * BloomFilterIndexWriter writer = new BloomFilterIndexWriter(options);
 * writer.write(batch);
 * BloomFilterIndex index = writer.finish();
 * }</pre>
 */
@NotThreadSafe
public class BloomFilterIndexWriter {

    private static final Logger LOG = LoggerFactory.getLogger(BloomFilterIndexWriter.class);

    private final BloomFilterAlgorithm algorithm;
    private final HashStrategy hashStrategy;
    private final double fpp;

    private final ValueCollector collector = new ValueCollector();
    private final Set<ByteBuffer> values = new LinkedHashSet<>();
    private boolean hasNull;
    private long numRows;

    public BloomFilterIndexWriter(Options options) {
        this(
                options.get(BloomFilterOptions.ALGORITHM),
                options.get(BloomFilterOptions.HASH_STRATEGY),
                options.get(BloomFilterOptions.FPP));
    }

    public BloomFilterIndexWriter(
            BloomFilterAlgorithm algorithm, HashStrategy hashStrategy, double fpp) {
        checkArgument(fpp > 0 && fpp < 1, "Invalid false positive probability: %s", fpp);
        this.algorithm = algorithm;
        this.hashStrategy = hashStrategy;
        this.fpp = fpp;
    }

    /** 写入批次中前 {@code numElements} 行的值,null 行只记录 null 标记。 */
    public void write(ColumnVectorBatch batch) {
        batch.accept(collector);
        numRows += batch.getNumElements();
    }

    public void writeNull() {
        hasNull = true;
        numRows++;
    }

    public void write(byte[] bytes) {
        if (bytes == null) {
            writeNull();
            return;
        }
        values.add(ByteBuffer.wrap(bytes.clone()));
        numRows++;
    }

    public int distinctCount() {
        return values.size();
    }

    /** 结束当前区域,返回它的过滤器并重置写入器。 */
    public BloomFilterIndex finish() {
        BloomFilter filter = BloomFilter.create(algorithm);
        filter.init(Math.max(1, values.size()), fpp, hashStrategy);
        for (ByteBuffer value : values) {
            filter.addBytes(value.array(), value.arrayOffset(), value.remaining());
        }
        filter.setHasNull(hasNull);

        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "Finished bloom filter zone: {} rows, {} distinct values, hasNull={}, {} bytes.",
                    numRows,
                    values.size(),
                    hasNull,
                    filter.size());
        }

        BloomFilterIndex index = new BloomFilterIndex(algorithm, hashStrategy, filter.serialize());
        values.clear();
        hasNull = false;
        numRows = 0;
        return index;
    }

    private void addValue(byte[] bytes) {
        values.add(ByteBuffer.wrap(bytes));
    }

    private void addValue(BytesView view) {
        values.add(ByteBuffer.wrap(Arrays.copyOfRange(view.data, view.offset, view.offset + view.len)));
    }

    /** 把批次中的每个非 null 值转换为规范字节并收集。 */
    private class ValueCollector implements ColumnVectorBatchVisitor<Void> {

        @Override
        public Void visit(LongVectorBatch batch) {
            for (int i = 0; i < batch.getNumElements(); i++) {
                if (batch.isNullAt(i)) {
                    hasNull = true;
                } else {
                    addValue(BloomFilterValues.ofLong(batch.data.get(i)));
                }
            }
            return null;
        }

        @Override
        public Void visit(DoubleVectorBatch batch) {
            for (int i = 0; i < batch.getNumElements(); i++) {
                if (batch.isNullAt(i)) {
                    hasNull = true;
                } else {
                    addValue(BloomFilterValues.ofDouble(batch.data.get(i)));
                }
            }
            return null;
        }

        @Override
        public Void visit(StringVectorBatch batch) {
            for (int i = 0; i < batch.getNumElements(); i++) {
                if (batch.isNullAt(i)) {
                    hasNull = true;
                } else {
                    addValue(batch.getBytes(i));
                }
            }
            return null;
        }

        @Override
        public Void visit(EncodedStringVectorBatch batch) {
            // decodes through the dictionary, so the filter matches a plain string column
            return visit((StringVectorBatch) batch);
        }

        @Override
        public Void visit(Decimal64VectorBatch batch) {
            for (int i = 0; i < batch.getNumElements(); i++) {
                if (batch.isNullAt(i)) {
                    hasNull = true;
                } else {
                    addValue(BloomFilterValues.ofLong(batch.values.get(i)));
                }
            }
            return null;
        }

        @Override
        public Void visit(TimestampVectorBatch batch) {
            for (int i = 0; i < batch.getNumElements(); i++) {
                if (batch.isNullAt(i)) {
                    hasNull = true;
                } else {
                    addValue(
                            BloomFilterValues.ofTimestamp(
                                    batch.data.get(i), batch.nanoseconds.get(i)));
                }
            }
            return null;
        }

        @Override
        public Void visit(Decimal128VectorBatch batch) {
            throw unsupported(batch);
        }

        @Override
        public Void visit(StructVectorBatch batch) {
            throw unsupported(batch);
        }

        @Override
        public Void visit(ListVectorBatch batch) {
            throw unsupported(batch);
        }

        @Override
        public Void visit(MapVectorBatch batch) {
            throw unsupported(batch);
        }

        @Override
        public Void visit(UnionVectorBatch batch) {
            throw unsupported(batch);
        }

        private UnsupportedOperationException unsupported(ColumnVectorBatch batch) {
            return new UnsupportedOperationException(
                    "Bloom filter index does not support " + batch.kind() + " batches.");
        }
    }
}

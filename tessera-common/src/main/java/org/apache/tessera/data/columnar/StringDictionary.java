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

import org.apache.tessera.annotation.Public;
import org.apache.tessera.memory.ByteDataBuffer;
import org.apache.tessera.memory.LongDataBuffer;
import org.apache.tessera.memory.MemoryPool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.ThreadSafe;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.apache.tessera.utils.Preconditions.checkNotNull;
import static org.apache.tessera.utils.Preconditions.checkState;

/**
 * 字典编码字符串列共享的字典。
 *
 * <p>所有取值首尾相接地保存在 {@link #dictionaryBlob} 中,{@link #dictionaryOffset} 有
 * {@code keyCount + 1} 项,编码为 {@code code} 的取值占据
 * {@code [offset[code], offset[code + 1])}。
 *
 * <pre>
 * 取值:   ["Beijing", "Shanghai"]
 * blob:   BeijingShanghai
 * offset: [0, 7, 15]
 * </pre>
 *
 * <h2>共享与生命周期</h2>
 * <p>字典由 {@link Builder} 构建并发布,发布后只读,可以被多个 {@link EncodedStringVectorBatch}
 * 同时引用。字典使用引用计数:{@link Builder#build()} 返回的字典持有一个引用,每个批次在
 * {@link EncodedStringVectorBatch#setDictionary} 时再持有一个。最后一个引用
 * {@link #release()} 后缓冲区归还给内存池,此前取得的 {@link BytesView} 也随之失效。
 */
@Public
@ThreadSafe
public final class StringDictionary {

    private static final Logger LOG = LoggerFactory.getLogger(StringDictionary.class);

    public final ByteDataBuffer dictionaryBlob;

    // offset for each dictionary key entry
    public final LongDataBuffer dictionaryOffset;

    private final int offsetCount;

    private final AtomicInteger refCount = new AtomicInteger(1);

    private StringDictionary(ByteDataBuffer blob, LongDataBuffer offsets, int offsetCount) {
        this.dictionaryBlob = blob;
        this.dictionaryOffset = offsets;
        this.offsetCount = offsetCount;
    }

    public static Builder builder(MemoryPool pool) {
        return new Builder(pool);
    }

    public int keyCount() {
        return offsetCount - 1;
    }

    /**
     * 按编码查找取值。
     *
     * @return 指向字典 blob 的视图,在字典释放之前有效
     * @throws IndexOutOfBoundsException 如果 {@code index < 0} 或 {@code index >= keyCount()}
     */
    public BytesView getValueByIndex(long index) {
        if (index < 0 || index + 1 >= offsetCount) {
            throw new IndexOutOfBoundsException(
                    "Dictionary index " + index + " out of range [0, " + keyCount() + ")");
        }
        checkState(refCount.get() > 0, "Dictionary is already released.");
        long[] offsets = dictionaryOffset.array();
        int start = (int) offsets[(int) index];
        int end = (int) offsets[(int) index + 1];
        return new BytesView(dictionaryBlob.array(), start, end - start);
    }

    public String getString(long index) {
        return getValueByIndex(index).toString();
    }

    public long getMemoryUsage() {
        return dictionaryBlob.getMemoryUsage() + dictionaryOffset.getMemoryUsage();
    }

    /** 增加一个引用。 */
    public StringDictionary retain() {
        while (true) {
            int current = refCount.get();
            checkState(current > 0, "Cannot retain a released dictionary.");
            if (refCount.compareAndSet(current, current + 1)) {
                return this;
            }
        }
    }

    /** 释放一个引用,最后一个引用释放时归还缓冲区。 */
    public void release() {
        int remaining = refCount.decrementAndGet();
        checkState(remaining >= 0, "Dictionary released more often than retained.");
        if (remaining == 0) {
            LOG.debug("Releasing dictionary with {} keys", keyCount());
            dictionaryBlob.close();
            dictionaryOffset.close();
        }
    }

    public int refCount() {
        return refCount.get();
    }

    // ------------------------------------------------------------------------

    /**
     * 字典构建器。相同的取值只会保存一次,重复添加返回已有的编码。
     *
     * <p>构建器不是线程安全的,字典必须在任何读者看到它之前构建完成。
     */
    public static final class Builder {

        private final MemoryPool pool;
        private final Map<ByteBuffer, Integer> codes = new HashMap<>();
        private final ByteDataBuffer blob;
        private final LongDataBuffer offsets;
        private int blobSize;
        private boolean built;

        private Builder(MemoryPool pool) {
            this.pool = checkNotNull(pool, "pool");
            this.blob = new ByteDataBuffer(pool, 0);
            this.offsets = new LongDataBuffer(pool, 16);
            offsets.set(0, 0);
        }

        public int add(String value) {
            return add(value.getBytes(StandardCharsets.UTF_8));
        }

        /** 添加一个取值并返回它的编码。 */
        public int add(byte[] value) {
            checkState(!built, "Dictionary is already built.");
            checkNotNull(value, "Dictionary values must not be null");
            Integer existing = codes.get(ByteBuffer.wrap(value));
            if (existing != null) {
                return existing;
            }
            int code = codes.size();
            if (blobSize + value.length > blob.capacity()) {
                blob.resize(Math.max(blobSize + value.length, blob.capacity() * 2));
            }
            if (code + 2 > offsets.capacity()) {
                offsets.resize(offsets.capacity() * 2);
            }
            blob.put(blobSize, value, 0, value.length);
            blobSize += value.length;
            offsets.set(code + 1, blobSize);
            codes.put(ByteBuffer.wrap(value.clone()), code);
            return code;
        }

        public int size() {
            return codes.size();
        }

        /** 发布字典,返回的字典持有一个引用。 */
        public StringDictionary build() {
            checkState(!built, "Dictionary is already built.");
            built = true;
            int keyCount = codes.size();
            codes.clear();
            return new StringDictionary(blob, offsets, keyCount + 1);
        }

        @Override
        public String toString() {
            return "StringDictionary.Builder{keys=" + codes.size() + ", pool=" + pool + '}';
        }
    }
}

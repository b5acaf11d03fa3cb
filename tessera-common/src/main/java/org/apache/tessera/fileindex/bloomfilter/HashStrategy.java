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

import org.apache.tessera.utils.MurmurHashUtils;

/** Bloom Filter 使用的 64 位哈希策略,写入端与读取端必须一致。 */
public enum HashStrategy {
    MURMUR3_X64_64 {
        @Override
        public long hash(byte[] bytes, int offset, int length, long seed) {
            return MurmurHashUtils.hash64(bytes, offset, length, seed);
        }
    };

    public abstract long hash(byte[] bytes, int offset, int length, long seed);
}

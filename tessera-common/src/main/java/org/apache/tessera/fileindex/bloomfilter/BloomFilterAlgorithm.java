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

/** Bloom Filter 的探测算法,由 {@link BloomFilter#create(BloomFilterAlgorithm)} 选择具体实现。 */
public enum BloomFilterAlgorithm {

    /** 分块布隆过滤器:每个值只落在一个 32 字节的桶中,桶内 8 次加盐探测。 */
    BLOCK,

    /** 经典布隆过滤器:在整个位数组上做双重哈希探测。 */
    CLASSIC
}

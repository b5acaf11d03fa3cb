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

import org.apache.tessera.options.ConfigOption;
import org.apache.tessera.options.ConfigOptions;

/** Bloom Filter 区域索引的配置项。 */
public class BloomFilterOptions {

    /** Expected false positive probability of each zone bloom filter. */
    public static final ConfigOption<Double> FPP =
            ConfigOptions.key("bloom-filter.fpp")
                    .doubleType()
                    .defaultValue(0.05);

    /** Probe algorithm of the zone bloom filters. */
    public static final ConfigOption<BloomFilterAlgorithm> ALGORITHM =
            ConfigOptions.key("bloom-filter.algorithm")
                    .enumType(BloomFilterAlgorithm.class)
                    .defaultValue(BloomFilterAlgorithm.BLOCK);

    /** Hash function applied to the value bytes before probing. */
    public static final ConfigOption<HashStrategy> HASH_STRATEGY =
            ConfigOptions.key("bloom-filter.hash-strategy")
                    .enumType(HashStrategy.class)
                    .defaultValue(HashStrategy.MURMUR3_X64_64);

    private BloomFilterOptions() {}
}

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

import org.apache.tessera.memory.LongDataBuffer;

/** 行选择相关的工具方法。 */
final class SelectionUtils {

    private SelectionUtils() {}

    static int countSelected(boolean[] selection, int length) {
        int count = 0;
        for (int i = 0; i < length; i++) {
            if (selection[i]) {
                count++;
            }
        }
        return count;
    }

    /**
     * 把行级选择转换为元素级选择,并就地重建偏移量。
     *
     * <p>被选中的行 {@code i} 的区间 {@code [offsets[i], offsets[i+1])} 整体保留;
     * 新偏移量是保留区间长度的前缀和。{@code elementSelection} 在保留区间内为 true,其余为 false。
     *
     * @return 保留的元素个数
     */
    static int retainRanges(
            LongDataBuffer offsets, boolean[] selection, int length, boolean[] elementSelection) {
        long[] off = offsets.array();
        long newOffset = 0;
        int retained = 0;
        int j = 0;
        for (int i = 0; i < length; i++) {
            long start = off[i];
            long end = off[i + 1];
            assert start <= end : "Offsets must be non-decreasing at row " + i;
            if (selection[i]) {
                for (long k = start; k < end; k++) {
                    elementSelection[(int) k] = true;
                }
                off[j++] = newOffset;
                newOffset += end - start;
                retained += (int) (end - start);
            }
        }
        off[j] = newOffset;
        return retained;
    }
}

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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 指向某个字节数组片段的只读视图,不复制数据。
 *
 * <p>视图只在底层数组没有被替换时有效:字符串批次的 blob 扩容、
 * 或者字典被释放之后,调用方不应再持有视图。
 */
public final class BytesView {

    public final byte[] data;
    public final int offset;
    public final int len;

    public BytesView(byte[] data, int offset, int len) {
        this.data = data;
        this.offset = offset;
        this.len = len;
    }

    /** 返回片段内容的拷贝,修改返回值不影响底层数组。 */
    public byte[] getBytes() {
        return Arrays.copyOfRange(data, offset, offset + len);
    }

    @Override
    public String toString() {
        return new String(data, offset, len, StandardCharsets.UTF_8);
    }
}

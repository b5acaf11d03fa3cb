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

/**
 * 列向量批次的访问者。
 *
 * <p>批次的种类是封闭的,每个具体批次对应一个 {@code visit} 方法,
 * 实现方在编译期就必须覆盖所有种类。
 *
 * @param <R> 访问结果类型
 */
@Public
public interface ColumnVectorBatchVisitor<R> {

    R visit(LongVectorBatch batch);

    R visit(DoubleVectorBatch batch);

    R visit(StringVectorBatch batch);

    R visit(EncodedStringVectorBatch batch);

    R visit(StructVectorBatch batch);

    R visit(ListVectorBatch batch);

    R visit(MapVectorBatch batch);

    R visit(UnionVectorBatch batch);

    R visit(Decimal64VectorBatch batch);

    R visit(Decimal128VectorBatch batch);

    R visit(TimestampVectorBatch batch);
}

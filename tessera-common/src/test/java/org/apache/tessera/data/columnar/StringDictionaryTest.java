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

import org.apache.tessera.memory.HeapMemoryPool;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link StringDictionary}. */
class StringDictionaryTest {

    private final HeapMemoryPool pool = new HeapMemoryPool(1024 * 1024);

    @Test
    void testBuildAndLookup() {
        StringDictionary.Builder builder = StringDictionary.builder(pool);
        assertThat(builder.add("red")).isEqualTo(0);
        assertThat(builder.add("green")).isEqualTo(1);
        assertThat(builder.add("red")).isEqualTo(0);
        assertThat(builder.add("")).isEqualTo(2);
        assertThat(builder.size()).isEqualTo(3);

        StringDictionary dictionary = builder.build();
        assertThat(dictionary.keyCount()).isEqualTo(3);
        assertThat(dictionary.getString(0)).isEqualTo("red");
        assertThat(dictionary.getString(1)).isEqualTo("green");
        assertThat(dictionary.getValueByIndex(2).len).isZero();
        assertThat(dictionary.dictionaryOffset.get(0)).isZero();
        assertThat(dictionary.dictionaryOffset.get(3)).isEqualTo(8L);
        assertThat(dictionary.refCount()).isEqualTo(1);

        dictionary.release();
        assertThat(pool.usedBytes()).isZero();
    }

    @Test
    void testIndexOutOfRange() {
        StringDictionary.Builder builder = StringDictionary.builder(pool);
        builder.add("a");
        builder.add("b");
        StringDictionary dictionary = builder.build();

        assertThatThrownBy(() -> dictionary.getValueByIndex(-1))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> dictionary.getValueByIndex(2))
                .isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(dictionary.getString(1)).isEqualTo("b");
        dictionary.release();
    }

    @Test
    void testEmptyDictionary() {
        StringDictionary dictionary = StringDictionary.builder(pool).build();
        assertThat(dictionary.keyCount()).isZero();
        assertThatThrownBy(() -> dictionary.getValueByIndex(0))
                .isInstanceOf(IndexOutOfBoundsException.class);
        dictionary.release();
        assertThat(pool.usedBytes()).isZero();
    }

    @Test
    void testRetainAndRelease() {
        StringDictionary.Builder builder = StringDictionary.builder(pool);
        builder.add("x");
        StringDictionary dictionary = builder.build();

        dictionary.retain();
        dictionary.release();
        assertThat(dictionary.getString(0)).isEqualTo("x");
        assertThat(pool.usedBytes()).isPositive();

        dictionary.release();
        assertThat(pool.usedBytes()).isZero();
        assertThatThrownBy(dictionary::retain).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> dictionary.getValueByIndex(0))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testValueBytesAreCopied() {
        StringDictionary.Builder builder = StringDictionary.builder(pool);
        builder.add("abc");
        StringDictionary dictionary = builder.build();

        BytesView view = dictionary.getValueByIndex(0);
        byte[] bytes = view.getBytes();
        assertThat(bytes).containsExactly('a', 'b', 'c');
        bytes[0] = 'X';
        assertThat(dictionary.getString(0)).isEqualTo("abc");
        assertThat(view.getBytes()).isNotSameAs(bytes);
        dictionary.release();
    }

    @Test
    void testBuilderIsSingleUse() {
        StringDictionary.Builder builder = StringDictionary.builder(pool);
        StringDictionary dictionary = builder.build();
        assertThatThrownBy(() -> builder.add("late")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        dictionary.release();
    }
}

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

package org.apache.tessera.options;

import org.apache.tessera.annotation.Public;

import javax.annotation.Nullable;

import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * 描述一个配置项的键、值类型和默认值。
 *
 * <p>配置项通过 {@link ConfigOptions} 的构建器创建,创建后不可变:
 *
 * <pre>{@code
 * public static final ConfigOption<Double> FPP =
 *         ConfigOptions.key("bloom-filter.fpp").doubleType().defaultValue(0.05);
 * }</pre>
 *
 * @param <T> 配置值的类型
 */
@Public
public class ConfigOption<T> {

    private final String key;

    @Nullable private final T defaultValue;

    private final Class<?> clazz;

    ConfigOption(String key, Class<?> clazz, @Nullable T defaultValue) {
        this.key = checkNotNull(key);
        this.defaultValue = defaultValue;
        this.clazz = checkNotNull(clazz);
    }

    Class<?> getClazz() {
        return clazz;
    }

    public String key() {
        return key;
    }

    /** 未设置时的取值,没有默认值的配置项返回 null。 */
    @Nullable
    public T defaultValue() {
        return defaultValue;
    }
}

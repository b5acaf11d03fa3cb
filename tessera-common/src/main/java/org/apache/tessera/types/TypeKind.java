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

package org.apache.tessera.types;

/** 逻辑类型的种类。 */
public enum TypeKind {
    BOOLEAN("boolean", false),
    BYTE("tinyint", false),
    SHORT("smallint", false),
    INT("int", false),
    LONG("bigint", false),
    DATE("date", false),
    FLOAT("float", false),
    DOUBLE("double", false),
    STRING("string", false),
    VARCHAR("varchar", false),
    CHAR("char", false),
    BINARY("binary", false),
    DECIMAL("decimal", false),
    TIMESTAMP("timestamp", false),
    STRUCT("struct", true),
    LIST("array", true),
    MAP("map", true),
    UNION("uniontype", true);

    private final String typeName;
    private final boolean nested;

    TypeKind(String typeName, boolean nested) {
        this.typeName = typeName;
        this.nested = nested;
    }

    public String typeName() {
        return typeName;
    }

    public boolean isNested() {
        return nested;
    }
}

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

import java.util.Locale;
import java.util.Optional;

import static org.apache.tessera.utils.Preconditions.checkArgument;
import static org.apache.tessera.utils.Preconditions.checkNotNull;

/**
 * 以字节为单位的内存大小。
 *
 * <p>可以从 {@code "64 mb"}、{@code "512k"}、{@code "1073741824"} 这样的文本解析,
 * 单位不区分大小写:
 * <ul>
 *   <li>1b 或 1bytes (字节)
 *   <li>1k、1kb、1kibibytes (千字节)
 *   <li>1m、1mb、1mebibytes (兆字节)
 *   <li>1g、1gb、1gibibytes (吉字节)
 *   <li>1t、1tb、1tebibytes (太字节)
 * </ul>
 */
@Public
public class MemorySize implements java.io.Serializable {

    private static final long serialVersionUID = 1L;

    private final long bytes;

    public MemorySize(long bytes) {
        checkArgument(bytes >= 0, "bytes must be >= 0");
        this.bytes = bytes;
    }

    public static MemorySize ofMebiBytes(long mebiBytes) {
        return new MemorySize(mebiBytes << 20);
    }

    public long getBytes() {
        return bytes;
    }

    @Override
    public int hashCode() {
        return (int) (bytes ^ (bytes >>> 32));
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this
                || (obj != null
                        && obj.getClass() == this.getClass()
                        && ((MemorySize) obj).bytes == this.bytes);
    }

    @Override
    public String toString() {
        MemoryUnit unit = MemoryUnit.BYTES;
        if (bytes == 0) {
            return "0 " + unit.getUnits()[1];
        }
        for (MemoryUnit candidate : MemoryUnit.values()) {
            if (bytes % candidate.getMultiplier() == 0) {
                unit = candidate;
            }
        }
        return String.format("%d %s", bytes / unit.getMultiplier(), unit.getUnits()[1]);
    }

    // ------------------------------------------------------------------------
    //  解析
    // ------------------------------------------------------------------------

    public static MemorySize parse(String text) throws IllegalArgumentException {
        return new MemorySize(parseBytes(text));
    }

    private static long parseBytes(String text) throws IllegalArgumentException {
        checkNotNull(text, "text");

        final String trimmed = text.trim();
        checkArgument(!trimmed.isEmpty(), "argument is an empty- or whitespace-only string");

        final int len = trimmed.length();
        int pos = 0;

        char current;
        while (pos < len && (current = trimmed.charAt(pos)) >= '0' && current <= '9') {
            pos++;
        }

        final String number = trimmed.substring(0, pos);
        final String unit = trimmed.substring(pos).trim().toLowerCase(Locale.US);

        if (number.isEmpty()) {
            throw new NumberFormatException("text does not start with a number");
        }

        final long value;
        try {
            value = Long.parseLong(number); // throws a NumberFormatException on overflow
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "The value '"
                            + number
                            + "' cannot be re represented as 64bit number (numeric overflow).");
        }

        final long multiplier = parseUnit(unit).map(MemoryUnit::getMultiplier).orElse(1L);
        final long result = value * multiplier;

        // check for overflow
        if (result / multiplier != value) {
            throw new IllegalArgumentException(
                    "The value '"
                            + text
                            + "' cannot be re represented as 64bit number of bytes (numeric overflow).");
        }

        return result;
    }

    private static Optional<MemoryUnit> parseUnit(String unit) {
        if (unit.isEmpty()) {
            return Optional.empty();
        }
        for (MemoryUnit candidate : MemoryUnit.values()) {
            for (String name : candidate.getUnits()) {
                if (name.equals(unit)) {
                    return Optional.of(candidate);
                }
            }
        }
        throw new IllegalArgumentException(
                "Memory size unit '"
                        + unit
                        + "' does not match any of the recognized units: "
                        + MemoryUnit.getAllUnits());
    }

    /** 支持的内存单位,按从小到大排列。 */
    private enum MemoryUnit {
        BYTES(new String[] {"b", "bytes"}, 1L),
        KILO_BYTES(new String[] {"k", "kb", "kibibytes"}, 1024L),
        MEGA_BYTES(new String[] {"m", "mb", "mebibytes"}, 1024L * 1024L),
        GIGA_BYTES(new String[] {"g", "gb", "gibibytes"}, 1024L * 1024L * 1024L),
        TERA_BYTES(new String[] {"t", "tb", "tebibytes"}, 1024L * 1024L * 1024L * 1024L);

        private final String[] units;

        private final long multiplier;

        MemoryUnit(String[] units, long multiplier) {
            this.units = units;
            this.multiplier = multiplier;
        }

        String[] getUnits() {
            return units;
        }

        long getMultiplier() {
            return multiplier;
        }

        static String getAllUnits() {
            StringBuilder builder = new StringBuilder();
            for (MemoryUnit unit : values()) {
                if (builder.length() > 0) {
                    builder.append(" | ");
                }
                builder.append(String.join(" | ", unit.getUnits()));
            }
            return "(" + builder + ")";
        }
    }
}

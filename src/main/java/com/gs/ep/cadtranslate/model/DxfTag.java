/*
 *   Copyright 2020 Goldman Sachs.
 *   Licensed under the Apache License, Version 2.0 (the "License");
 *   you may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing,
 *   software distributed under the License is distributed on an
 *   "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 *   KIND, either express or implied.  See the License for the
 *   specific language governing permissions and limitations
 *   under the License.
 */

package com.gs.ep.cadtranslate.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One group code / value pair of a DXF tag stream.
 */
public final class DxfTag {

    private final int code;
    private final String value;

    public DxfTag(int code, String value) {
        this.code = code;
        this.value = value == null ? "" : value;
    }

    public static DxfTag of(int code, String value) {
        return new DxfTag(code, value);
    }

    public static DxfTag of(int code, double value) {
        return new DxfTag(code, formatDouble(value));
    }

    public static DxfTag of(int code, int value) {
        return new DxfTag(code, Integer.toString(value));
    }

    public int getCode() {
        return this.code;
    }

    public String getValue() {
        return this.value;
    }

    /**
     * Structure tags (group code 0) start entities, table entries, sections and blocks.
     */
    public boolean isStructure() {
        return this.code == 0;
    }

    public boolean isStructure(String name) {
        return this.code == 0 && this.value.trim().equalsIgnoreCase(name);
    }

    public static String formatDouble(double value) {
        if (value == 0.0) {
            return "0.0";
        }
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.contains(".") ? plain : plain + ".0";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DxfTag)) {
            return false;
        }
        DxfTag other = (DxfTag) o;
        return this.code == other.code && this.value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.code, this.value);
    }

    @Override
    public String toString() {
        return "(" + this.code + ", " + this.value + ")";
    }
}

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

/**
 * Entities referencing a text style by name (group code 7).
 */
public interface HasStyle {

    int STYLE = 7;
    String DEFAULT_STYLE = "Standard";

    default String getStyle() {
        String style = ((CadEntity) this).getString(STYLE);
        return style == null ? "" : style.trim();
    }

    default void setStyle(String style) {
        ((CadEntity) this).setString(STYLE, style);
    }
}

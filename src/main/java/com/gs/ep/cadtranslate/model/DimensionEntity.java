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

import java.util.List;

/**
 * DIMENSION entity. Only the user text override (group code 1) is exposed; an empty
 * value or {@code <>} means the measured value is displayed.
 */
public class DimensionEntity extends CadEntity implements HasText {

    public static final String TYPE_NAME = "DIMENSION";
    public static final String MEASUREMENT_PLACEHOLDER = "<>";
    public static final int DIMSTYLE = 3;

    public DimensionEntity(List<DxfTag> tags) {
        super(tags);
    }

    public boolean hasTextOverride() {
        String text = this.getText().trim();
        return !text.isEmpty() && !MEASUREMENT_PLACEHOLDER.equals(text);
    }

    public String getDimensionStyle() {
        String style = this.getString(DIMSTYLE);
        return style == null ? "" : style.trim();
    }
}

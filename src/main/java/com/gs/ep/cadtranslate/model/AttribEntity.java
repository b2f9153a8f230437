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
 * ATTRIB value attached to one block insertion.
 */
public class AttribEntity extends CadEntity implements HasText, HasHeight, HasRotation, HasStyle, HasInsertionPoint {

    public static final String TYPE_NAME = "ATTRIB";

    public AttribEntity(List<DxfTag> tags) {
        super(tags);
    }

    public String getTag() {
        String tag = this.getString(NAME);
        return tag == null ? "" : tag.trim();
    }
}

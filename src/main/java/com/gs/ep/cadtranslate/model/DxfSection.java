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

import org.eclipse.collections.api.list.MutableList;

/**
 * One {@code SECTION ... ENDSEC} block of a DXF file.
 */
public interface DxfSection {

    String HEADER = "HEADER";
    String CLASSES = "CLASSES";
    String TABLES = "TABLES";
    String BLOCKS = "BLOCKS";
    String ENTITIES = "ENTITIES";
    String OBJECTS = "OBJECTS";

    String getName();

    /**
     * Content tags between the section name and ENDSEC.
     */
    MutableList<DxfTag> contentTags();

    default MutableList<DxfTag> toTags() {
        MutableList<DxfTag> tags = this.contentTags();
        tags.add(0, DxfTag.of(0, "SECTION"));
        tags.add(1, DxfTag.of(2, this.getName()));
        tags.add(DxfTag.of(0, "ENDSEC"));
        return tags;
    }
}

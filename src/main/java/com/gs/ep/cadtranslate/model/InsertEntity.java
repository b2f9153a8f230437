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

import java.util.List;

/**
 * Block reference (INSERT). Attribute values follow the insert as ATTRIB children,
 * closed by a SEQEND.
 */
public class InsertEntity extends CadEntity implements HasInsertionPoint, HasRotation {

    public static final String TYPE_NAME = "INSERT";
    public static final int ATTRIBS_FOLLOW = 66;

    public InsertEntity(List<DxfTag> tags) {
        super(tags);
    }

    public boolean hasAttribs() {
        String flag = this.getString(ATTRIBS_FOLLOW);
        return flag != null && "1".equals(flag.trim());
    }

    public MutableList<AttribEntity> getAttribs() {
        return this.getChildren().selectInstancesOf(AttribEntity.class);
    }
}

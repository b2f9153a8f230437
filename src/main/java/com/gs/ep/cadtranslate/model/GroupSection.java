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
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * Section kept as opaque tag groups (CLASSES, OBJECTS and anything unknown).
 */
public class GroupSection implements DxfSection {

    private final String name;
    private final MutableList<DxfTag> leadingTags;
    private final MutableList<CadEntity> groups;

    public GroupSection(String name, List<DxfTag> leadingTags, List<CadEntity> groups) {
        this.name = name;
        this.leadingTags = Lists.mutable.withAll(leadingTags);
        this.groups = Lists.mutable.withAll(groups);
    }

    @Override
    public String getName() {
        return this.name;
    }

    public MutableList<CadEntity> getGroups() {
        return this.groups;
    }

    @Override
    public MutableList<DxfTag> contentTags() {
        MutableList<DxfTag> out = Lists.mutable.withAll(this.leadingTags);
        for (CadEntity group : this.groups) {
            out.addAll(group.toTags());
        }
        return out;
    }
}

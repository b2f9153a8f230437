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
 * HEADER section. Variables are a group code 9 name followed by one or more value tags.
 */
public class HeaderSection implements DxfSection {

    public static final int VARIABLE = 9;

    private final MutableList<DxfTag> tags;

    public HeaderSection(List<DxfTag> tags) {
        this.tags = Lists.mutable.withAll(tags);
    }

    @Override
    public String getName() {
        return HEADER;
    }

    public String getVariable(String name) {
        int index = this.indexOfVariable(name);
        if (index < 0 || index + 1 >= this.tags.size() || this.tags.get(index + 1).getCode() == VARIABLE) {
            return null;
        }
        return this.tags.get(index + 1).getValue().trim();
    }

    public void setVariable(String name, int code, String value) {
        int index = this.indexOfVariable(name);
        if (index < 0) {
            this.tags.add(DxfTag.of(VARIABLE, name));
            this.tags.add(DxfTag.of(code, value));
        } else if (index + 1 < this.tags.size() && this.tags.get(index + 1).getCode() != VARIABLE) {
            this.tags.set(index + 1, DxfTag.of(code, value));
        } else {
            this.tags.add(index + 1, DxfTag.of(code, value));
        }
    }

    private int indexOfVariable(String name) {
        for (int i = 0; i < this.tags.size(); i++) {
            DxfTag tag = this.tags.get(i);
            if (tag.getCode() == VARIABLE && tag.getValue().trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public MutableList<DxfTag> contentTags() {
        return Lists.mutable.withAll(this.tags);
    }
}

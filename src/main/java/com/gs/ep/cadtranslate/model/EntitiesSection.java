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

public class EntitiesSection implements DxfSection {

    private final MutableList<CadEntity> entities;

    public EntitiesSection(List<CadEntity> entities) {
        this.entities = Lists.mutable.withAll(entities);
    }

    @Override
    public String getName() {
        return ENTITIES;
    }

    public MutableList<CadEntity> getEntities() {
        return this.entities;
    }

    @Override
    public MutableList<DxfTag> contentTags() {
        MutableList<DxfTag> out = Lists.mutable.empty();
        for (CadEntity entity : this.entities) {
            out.addAll(entity.toTags());
        }
        return out;
    }
}

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
import java.util.Locale;

/**
 * Creates the typed entity for a tag group based on its group code 0 value. Types without
 * text stay plain {@link CadEntity} instances and are carried through unchanged.
 */
public final class EntityFactory {

    private EntityFactory() {
    }

    public static CadEntity create(List<DxfTag> tags) {
        String type = tags.isEmpty() ? "" : tags.get(0).getValue().trim().toUpperCase(Locale.ROOT);
        switch (type) {
            case TextEntity.TYPE_NAME:
                return new TextEntity(tags);
            case MTextEntity.TYPE_NAME:
                return new MTextEntity(tags);
            case AttribEntity.TYPE_NAME:
                return new AttribEntity(tags);
            case AttDefEntity.TYPE_NAME:
                return new AttDefEntity(tags);
            case DimensionEntity.TYPE_NAME:
                return new DimensionEntity(tags);
            case InsertEntity.TYPE_NAME:
                return new InsertEntity(tags);
            default:
                return new CadEntity(tags);
        }
    }
}

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
 * A named region of a drawing holding entities: model space, a paper space layout or a
 * block definition.
 */
public interface EntityContainer {

    String getName();

    /**
     * Top level entities of this region. Attribute values stay attached to their INSERT.
     */
    MutableList<CadEntity> getEntities();

    default <T> MutableList<T> query(Class<T> type) {
        return this.getEntities().selectInstancesOf(type);
    }

    TextEntity addText(String text, Point3 insert, double height, double rotation, String layer, String style);

    void deleteEntity(CadEntity entity);

    CadDocument getDocument();
}

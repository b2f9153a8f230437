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
 * A named paper space layout. The entities live either in the ENTITIES section (the
 * active layout) or in a {@code *Paper_SpaceN} block.
 */
public class Layout implements EntityContainer {

    public static final String MODEL_LAYOUT = "Model";

    private final String name;
    private final EntityContainer delegate;

    public Layout(String name, EntityContainer delegate) {
        this.name = name;
        this.delegate = delegate;
    }

    @Override
    public String getName() {
        return this.name;
    }

    public EntityContainer getDelegate() {
        return this.delegate;
    }

    @Override
    public MutableList<CadEntity> getEntities() {
        return this.delegate.getEntities();
    }

    @Override
    public TextEntity addText(String text, Point3 insert, double height, double rotation, String layer, String style) {
        return this.delegate.addText(text, insert, height, rotation, layer, style);
    }

    @Override
    public void deleteEntity(CadEntity entity) {
        this.delegate.deleteEntity(entity);
    }

    @Override
    public CadDocument getDocument() {
        return this.delegate.getDocument();
    }

    @Override
    public String toString() {
        return "LAYOUT " + this.name;
    }
}

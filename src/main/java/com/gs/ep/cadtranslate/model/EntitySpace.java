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
 * View over the ENTITIES section selecting either the model space or the active paper
 * space entities (group code 67).
 */
public class EntitySpace implements EntityContainer {

    public static final String MODEL_SPACE_BLOCK = "*Model_Space";
    public static final String PAPER_SPACE_BLOCK = "*Paper_Space";

    private final CadDocument document;
    private final String name;
    private final boolean paperSpace;

    EntitySpace(CadDocument document, String name, boolean paperSpace) {
        this.document = document;
        this.name = name;
        this.paperSpace = paperSpace;
    }

    @Override
    public String getName() {
        return this.name;
    }

    public boolean isPaperSpace() {
        return this.paperSpace;
    }

    @Override
    public MutableList<CadEntity> getEntities() {
        return this.document.getEntitiesSection().getEntities().select(e -> e.isPaperSpace() == this.paperSpace);
    }

    @Override
    public TextEntity addText(String text, Point3 insert, double height, double rotation, String layer, String style) {
        String owner = this.document.getBlockRecordHandle(this.paperSpace ? PAPER_SPACE_BLOCK : MODEL_SPACE_BLOCK);
        TextEntity entity = this.document.newTextEntity(text, insert, height, rotation, layer, style, owner, this.paperSpace);
        this.document.getEntitiesSection().getEntities().add(entity);
        return entity;
    }

    @Override
    public void deleteEntity(CadEntity entity) {
        this.document.getEntitiesSection().getEntities().remove(entity);
    }

    @Override
    public CadDocument getDocument() {
        return this.document;
    }

    @Override
    public String toString() {
        return this.name;
    }
}

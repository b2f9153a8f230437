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

/**
 * A block definition: the BLOCK header, its entities and the closing ENDBLK.
 */
public class BlockDefinition implements EntityContainer {

    private CadDocument document;
    private final CadEntity block;
    private final MutableList<CadEntity> entities;
    private final CadEntity endBlock;

    public BlockDefinition(CadEntity block, MutableList<CadEntity> entities, CadEntity endBlock) {
        this.block = block;
        this.entities = entities;
        this.endBlock = endBlock;
    }

    @Override
    public String getName() {
        String name = this.block.getString(CadEntity.NAME);
        return name == null ? "" : name.trim();
    }

    /**
     * Anonymous blocks (names starting with {@code *}) are generated by the CAD application
     * for layouts, dimensions and hatches.
     */
    public boolean isAnonymous() {
        return this.getName().startsWith("*");
    }

    public boolean isPaperSpaceBlock() {
        return this.getName().toLowerCase().startsWith(EntitySpace.PAPER_SPACE_BLOCK.toLowerCase());
    }

    @Override
    public MutableList<CadEntity> getEntities() {
        return this.entities;
    }

    @Override
    public TextEntity addText(String text, Point3 insert, double height, double rotation, String layer, String style) {
        String owner = this.block.getOwnerHandle();
        if (owner == null) {
            owner = this.document.getBlockRecordHandle(this.getName());
        }
        TextEntity entity = this.document.newTextEntity(text, insert, height, rotation, layer, style, owner, this.isPaperSpaceBlock());
        this.entities.add(entity);
        return entity;
    }

    @Override
    public void deleteEntity(CadEntity entity) {
        this.entities.remove(entity);
    }

    @Override
    public CadDocument getDocument() {
        return this.document;
    }

    void attach(CadDocument document) {
        this.document = document;
    }

    public MutableList<DxfTag> toTags() {
        MutableList<DxfTag> out = Lists.mutable.withAll(this.block.toTags());
        for (CadEntity entity : this.entities) {
            out.addAll(entity.toTags());
        }
        if (this.endBlock != null) {
            out.addAll(this.endBlock.toTags());
        }
        return out;
    }

    @Override
    public String toString() {
        return "BLOCK " + this.getName();
    }
}

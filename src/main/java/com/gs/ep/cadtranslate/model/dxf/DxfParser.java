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

package com.gs.ep.cadtranslate.model.dxf;

import com.gs.ep.cadtranslate.model.BlockDefinition;
import com.gs.ep.cadtranslate.model.BlocksSection;
import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.CadEntity;
import com.gs.ep.cadtranslate.model.DxfSection;
import com.gs.ep.cadtranslate.model.DxfTag;
import com.gs.ep.cadtranslate.model.EntitiesSection;
import com.gs.ep.cadtranslate.model.EntityFactory;
import com.gs.ep.cadtranslate.model.GroupSection;
import com.gs.ep.cadtranslate.model.HeaderSection;
import com.gs.ep.cadtranslate.model.InsertEntity;
import com.gs.ep.cadtranslate.model.SymbolTable;
import com.gs.ep.cadtranslate.model.TablesSection;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Parses an ASCII DXF file into a {@link CadDocument}.
 */
public class DxfParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(DxfParser.class);

    public CadDocument parse(Path path) throws IOException {
        LOGGER.debug("Parsing {}", path);
        return this.parse(Files.readAllBytes(path));
    }

    public CadDocument parse(InputStream inputStream) throws IOException {
        return this.parse(inputStream.readAllBytes());
    }

    public CadDocument parse(byte[] data) throws DxfStructureException {
        DxfTagReader reader = new DxfTagReader(data);
        MutableList<DxfTag> tags = reader.readTags();
        MutableList<DxfSection> sections = this.parseSections(tags);
        return new CadDocument(sections, DxfEncodings.outputCharset(reader.getVersion(), reader.getCodePage()));
    }

    private MutableList<DxfSection> parseSections(MutableList<DxfTag> tags) throws DxfStructureException {
        MutableList<DxfSection> sections = Lists.mutable.empty();
        int i = 0;
        while (i < tags.size()) {
            DxfTag tag = tags.get(i);
            if (tag.isStructure("EOF")) {
                break;
            }
            if (!tag.isStructure("SECTION")) {
                throw new DxfStructureException("Unexpected tag " + tag + " outside of a section");
            }
            if (i + 1 >= tags.size() || tags.get(i + 1).getCode() != 2) {
                throw new DxfStructureException("Section without a name");
            }
            String name = tags.get(i + 1).getValue().trim();
            int end = i + 2;
            while (end < tags.size() && !tags.get(end).isStructure("ENDSEC")) {
                end++;
            }
            if (end >= tags.size()) {
                throw new DxfStructureException("Section " + name + " is missing ENDSEC");
            }
            sections.add(this.buildSection(name, tags.subList(i + 2, end)));
            i = end + 1;
        }
        if (sections.isEmpty()) {
            throw new DxfStructureException("No sections found");
        }
        return sections;
    }

    private DxfSection buildSection(String name, List<DxfTag> content) throws DxfStructureException {
        switch (name.toUpperCase()) {
            case DxfSection.HEADER:
                return new HeaderSection(content);
            case DxfSection.TABLES:
                return this.buildTables(content);
            case DxfSection.BLOCKS:
                return this.buildBlocks(content);
            case DxfSection.ENTITIES:
                return new EntitiesSection(assemble(this.split(content, Lists.mutable.empty())));
            default:
                MutableList<DxfTag> leading = Lists.mutable.empty();
                MutableList<CadEntity> groups = this.split(content, leading);
                return new GroupSection(name, leading, groups);
        }
    }

    private TablesSection buildTables(List<DxfTag> content) throws DxfStructureException {
        TablesSection tables = new TablesSection();
        MutableList<CadEntity> groups = this.split(content, Lists.mutable.empty());
        CadEntity head = null;
        MutableList<CadEntity> entries = null;
        for (CadEntity group : groups) {
            if ("TABLE".equalsIgnoreCase(group.getType())) {
                head = group;
                entries = Lists.mutable.empty();
            } else if ("ENDTAB".equalsIgnoreCase(group.getType())) {
                if (head == null) {
                    throw new DxfStructureException("ENDTAB without TABLE");
                }
                tables.add(new SymbolTable(head, entries, group));
                head = null;
            } else if (head == null) {
                throw new DxfStructureException("Table entry " + group + " outside of a table");
            } else {
                entries.add(group);
            }
        }
        if (head != null) {
            throw new DxfStructureException("Table is missing ENDTAB");
        }
        return tables;
    }

    private BlocksSection buildBlocks(List<DxfTag> content) throws DxfStructureException {
        BlocksSection blocks = new BlocksSection();
        MutableList<CadEntity> groups = this.split(content, Lists.mutable.empty());
        CadEntity block = null;
        MutableList<CadEntity> entities = null;
        for (CadEntity group : groups) {
            if ("BLOCK".equalsIgnoreCase(group.getType())) {
                if (block != null) {
                    throw new DxfStructureException("Nested BLOCK in block definition");
                }
                block = group;
                entities = Lists.mutable.empty();
            } else if ("ENDBLK".equalsIgnoreCase(group.getType())) {
                if (block == null) {
                    throw new DxfStructureException("ENDBLK without BLOCK");
                }
                blocks.add(new BlockDefinition(block, assemble(entities), group));
                block = null;
            } else if (block == null) {
                throw new DxfStructureException("Entity " + group + " outside of a block definition");
            } else {
                entities.add(group);
            }
        }
        if (block != null) {
            throw new DxfStructureException("Block definition is missing ENDBLK");
        }
        return blocks;
    }

    /**
     * Splits a tag run into groups at each group code 0 tag. Tags before the first group
     * are collected into {@code leading}.
     */
    private MutableList<CadEntity> split(List<DxfTag> content, MutableList<DxfTag> leading) {
        MutableList<CadEntity> groups = Lists.mutable.empty();
        MutableList<DxfTag> current = null;
        for (DxfTag tag : content) {
            if (tag.isStructure()) {
                if (current != null) {
                    groups.add(EntityFactory.create(current));
                }
                current = Lists.mutable.with(tag);
            } else if (current == null) {
                leading.add(tag);
            } else {
                current.add(tag);
            }
        }
        if (current != null) {
            groups.add(EntityFactory.create(current));
        }
        return groups;
    }

    /**
     * Attaches ATTRIB followers to their INSERT and VERTEX followers to their POLYLINE,
     * together with the closing SEQEND.
     */
    private static MutableList<CadEntity> assemble(MutableList<CadEntity> flat) {
        MutableList<CadEntity> out = Lists.mutable.empty();
        int i = 0;
        while (i < flat.size()) {
            CadEntity entity = flat.get(i++);
            out.add(entity);
            boolean hasFollowers = (entity instanceof InsertEntity && ((InsertEntity) entity).hasAttribs())
                    || "POLYLINE".equalsIgnoreCase(entity.getType());
            if (!hasFollowers) {
                continue;
            }
            while (i < flat.size()) {
                CadEntity next = flat.get(i);
                String type = next.getType().toUpperCase();
                if ("ATTRIB".equals(type) || "VERTEX".equals(type)) {
                    entity.addChild(next);
                    i++;
                } else if ("SEQEND".equals(type)) {
                    entity.setSequenceEnd(next);
                    i++;
                    break;
                } else {
                    LOGGER.debug("{} is missing its SEQEND", entity);
                    break;
                }
            }
        }
        return out;
    }
}

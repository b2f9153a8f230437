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
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;

import java.nio.charset.Charset;
import java.util.regex.Pattern;

/**
 * In-memory DXF drawing: the ordered sections plus typed access to model space, paper
 * space layouts, block definitions and the style table.
 */
public class CadDocument {

    public static final String VERSION_VARIABLE = "$ACADVER";
    public static final String HANDSEED_VARIABLE = "$HANDSEED";
    public static final String CODEPAGE_VARIABLE = "$DWGCODEPAGE";
    /** AutoCAD 2000, the first version with subclass markers and owner handles. */
    public static final String AC1015 = "AC1015";
    /** AutoCAD 2007, the first version written as UTF-8. */
    public static final String AC1021 = "AC1021";

    private static final String LAYOUT_SUBCLASS = "AcDbLayout";
    private static final int LAYOUT_TAB_ORDER = 71;
    private static final Pattern PAPER_SPACE_BLOCK = Pattern.compile("(?i)\\*Paper_Space\\d+");

    private final MutableList<DxfSection> sections;
    private final Charset encoding;
    private HeaderSection header;
    private TablesSection tables;
    private BlocksSection blocks;
    private EntitiesSection entities;
    private GroupSection objects;
    private long handleSeed;

    private final EntitySpace modelSpace;
    private final EntitySpace paperSpace;
    private StyleTable styleTable;

    public CadDocument(MutableList<DxfSection> sections, Charset encoding) {
        this.sections = sections;
        this.encoding = encoding;
        for (DxfSection section : sections) {
            switch (section.getName().toUpperCase()) {
                case DxfSection.HEADER:
                    this.header = (HeaderSection) section;
                    break;
                case DxfSection.TABLES:
                    this.tables = (TablesSection) section;
                    break;
                case DxfSection.BLOCKS:
                    this.blocks = (BlocksSection) section;
                    break;
                case DxfSection.ENTITIES:
                    this.entities = (EntitiesSection) section;
                    break;
                case DxfSection.OBJECTS:
                    this.objects = section instanceof GroupSection ? (GroupSection) section : null;
                    break;
                default:
                    break;
            }
        }
        if (this.entities == null) {
            this.entities = new EntitiesSection(Lists.mutable.empty());
            this.sections.add(this.entities);
        }
        if (this.blocks != null) {
            this.blocks.getBlocks().each(block -> block.attach(this));
        }
        this.handleSeed = this.findHighestHandle();
        this.modelSpace = new EntitySpace(this, Layout.MODEL_LAYOUT, false);
        this.paperSpace = new EntitySpace(this, EntitySpace.PAPER_SPACE_BLOCK, true);
    }

    public MutableList<DxfSection> getSections() {
        return this.sections;
    }

    public HeaderSection getHeader() {
        return this.header;
    }

    EntitiesSection getEntitiesSection() {
        return this.entities;
    }

    /**
     * @return the $ACADVER value, or null for files without a version (pre R12 or minimal)
     */
    public String getDxfVersion() {
        return this.header == null ? null : this.header.getVariable(VERSION_VARIABLE);
    }

    /**
     * Files older than AutoCAD 2000 carry no subclass markers or owner handles.
     */
    public boolean isLegacy() {
        String version = this.getDxfVersion();
        return version == null || version.compareToIgnoreCase(AC1015) < 0;
    }

    /**
     * Charset used when writing: UTF-8 from AutoCAD 2007, the drawing code page before.
     */
    public Charset getEncoding() {
        return this.encoding;
    }

    public EntitySpace modelSpace() {
        return this.modelSpace;
    }

    /**
     * Named paper space layouts in tab order, without the model layout.
     */
    public MutableList<Layout> paperSpaceLayouts() {
        MutableList<CadEntity> layoutObjects = this.objects == null
                ? Lists.mutable.empty()
                : this.objects.getGroups().select(group -> "LAYOUT".equalsIgnoreCase(group.getType()));
        MutableList<Layout> layouts = Lists.mutable.empty();
        if (layoutObjects.isEmpty()) {
            layouts.add(new Layout("Layout1", this.paperSpace));
            for (BlockDefinition block : this.blocks()) {
                if (PAPER_SPACE_BLOCK.matcher(block.getName()).matches()) {
                    layouts.add(new Layout(block.getName(), block));
                }
            }
            return layouts;
        }
        MutableMap<String, String> blockRecordNames = this.blockRecordNamesByHandle();
        layoutObjects.sortThisByInt(layout -> parseInt(layout.getStringInSubclass(LAYOUT_SUBCLASS, LAYOUT_TAB_ORDER)));
        for (CadEntity layout : layoutObjects) {
            String name = trimmed(layout.getStringInSubclass(LAYOUT_SUBCLASS, CadEntity.TEXT_VALUE));
            if (name.isEmpty() || Layout.MODEL_LAYOUT.equalsIgnoreCase(name)) {
                continue;
            }
            String recordHandle = trimmed(layout.getStringInSubclass(LAYOUT_SUBCLASS, CadEntity.OWNER));
            String blockName = blockRecordNames.get(recordHandle.toUpperCase());
            if (blockName == null || EntitySpace.MODEL_SPACE_BLOCK.equalsIgnoreCase(blockName)) {
                continue;
            }
            if (EntitySpace.PAPER_SPACE_BLOCK.equalsIgnoreCase(blockName)) {
                layouts.add(new Layout(name, this.paperSpace));
            } else {
                BlockDefinition block = this.getBlock(blockName);
                if (block != null) {
                    layouts.add(new Layout(name, block));
                }
            }
        }
        return layouts;
    }

    public MutableList<BlockDefinition> blocks() {
        return this.blocks == null ? Lists.mutable.empty() : this.blocks.getBlocks();
    }

    public BlockDefinition getBlock(String name) {
        return this.blocks == null ? null : this.blocks.get(name);
    }

    public StyleTable styles() {
        if (this.styleTable == null) {
            this.styleTable = new StyleTable(this, this.getOrCreateTable(TablesSection.STYLE));
        }
        return this.styleTable;
    }

    /**
     * Handle of the BLOCK_RECORD entry owning entities of the named block, or null.
     */
    public String getBlockRecordHandle(String blockName) {
        if (this.tables == null || this.isLegacy()) {
            return null;
        }
        SymbolTable records = this.tables.get(TablesSection.BLOCK_RECORD);
        CadEntity record = records == null ? null : records.find(blockName);
        return record == null ? null : record.getHandle();
    }

    public String nextHandle() {
        this.handleSeed++;
        return Long.toHexString(this.handleSeed).toUpperCase();
    }

    /**
     * Value for $HANDSEED: one above the highest handle in use.
     */
    public String getHandleSeed() {
        return Long.toHexString(this.handleSeed + 1).toUpperCase();
    }

    public TextEntity newTextEntity(String text, Point3 insert, double height, double rotation,
                                    String layer, String style, String ownerHandle, boolean paperSpace) {
        boolean legacy = this.isLegacy();
        MutableList<DxfTag> tags = Lists.mutable.with(DxfTag.of(0, TextEntity.TYPE_NAME), DxfTag.of(CadEntity.HANDLE, this.nextHandle()));
        if (!legacy) {
            if (ownerHandle != null) {
                tags.add(DxfTag.of(CadEntity.OWNER, ownerHandle));
            }
            tags.add(DxfTag.of(CadEntity.SUBCLASS, "AcDbEntity"));
        }
        if (paperSpace) {
            tags.add(DxfTag.of(CadEntity.PAPER_SPACE, 1));
        }
        tags.add(DxfTag.of(CadEntity.LAYER, layer == null || layer.trim().isEmpty() ? HasLayer.DEFAULT_LAYER : layer));
        if (!legacy) {
            tags.add(DxfTag.of(CadEntity.SUBCLASS, "AcDbText"));
        }
        Point3 point = insert == null ? Point3.ORIGIN : insert;
        tags.add(DxfTag.of(HasInsertionPoint.X, point.getX()));
        tags.add(DxfTag.of(HasInsertionPoint.Y, point.getY()));
        tags.add(DxfTag.of(HasInsertionPoint.Z, point.getZ()));
        tags.add(DxfTag.of(HasHeight.HEIGHT, height));
        tags.add(DxfTag.of(CadEntity.TEXT_VALUE, text));
        tags.add(DxfTag.of(HasRotation.ROTATION, rotation));
        tags.add(DxfTag.of(HasStyle.STYLE, style == null || style.isEmpty() ? HasStyle.DEFAULT_STYLE : style));
        if (!legacy) {
            tags.add(DxfTag.of(CadEntity.SUBCLASS, "AcDbText"));
        }
        return new TextEntity(tags);
    }

    private SymbolTable getOrCreateTable(String name) {
        if (this.tables == null) {
            this.tables = new TablesSection();
            int index = this.sections.detectIndex(section -> {
                String sectionName = section.getName().toUpperCase();
                return DxfSection.BLOCKS.equals(sectionName) || DxfSection.ENTITIES.equals(sectionName);
            });
            this.sections.add(index < 0 ? this.sections.size() : index, this.tables);
        }
        SymbolTable table = this.tables.get(name);
        if (table == null) {
            MutableList<DxfTag> head = Lists.mutable.with(DxfTag.of(0, "TABLE"), DxfTag.of(CadEntity.NAME, name),
                    DxfTag.of(CadEntity.HANDLE, this.nextHandle()));
            if (!this.isLegacy()) {
                head.add(DxfTag.of(CadEntity.OWNER, "0"));
                head.add(DxfTag.of(CadEntity.SUBCLASS, "AcDbSymbolTable"));
            }
            head.add(DxfTag.of(SymbolTable.ENTRY_COUNT, 0));
            table = new SymbolTable(new CadEntity(head), Lists.mutable.empty(), new CadEntity(Lists.mutable.with(DxfTag.of(0, "ENDTAB"))));
            this.tables.add(table);
        }
        return table;
    }

    private MutableMap<String, String> blockRecordNamesByHandle() {
        MutableMap<String, String> names = Maps.mutable.empty();
        SymbolTable records = this.tables == null ? null : this.tables.get(TablesSection.BLOCK_RECORD);
        if (records != null) {
            for (CadEntity record : records.getEntries()) {
                String handle = record.getHandle();
                String name = record.getString(CadEntity.NAME);
                if (handle != null && name != null) {
                    names.put(handle.trim().toUpperCase(), name.trim());
                }
            }
        }
        return names;
    }

    private long findHighestHandle() {
        long highest = 0L;
        if (this.header != null) {
            highest = Math.max(highest, parseHex(this.header.getVariable(HANDSEED_VARIABLE)) - 1);
        }
        for (DxfSection section : this.sections) {
            if (section == this.header) {
                continue;
            }
            for (DxfTag tag : section.contentTags()) {
                if (tag.getCode() == CadEntity.HANDLE || tag.getCode() == 105) {
                    highest = Math.max(highest, parseHex(tag.getValue()));
                }
            }
        }
        return highest;
    }

    private static long parseHex(String value) {
        if (value == null || value.trim().isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseUnsignedLong(value.trim(), 16);
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    private static int parseInt(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String trimmed(String value) {
        return value == null ? "" : value.trim();
    }
}

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
 * Text styles of a document (the STYLE symbol table). Lookups ignore case like the CAD
 * application does.
 */
public class StyleTable {

    public static final int FONT = 3;
    public static final int BIG_FONT = 4;
    public static final int WIDTH_FACTOR = 41;
    private static final int FIXED_HEIGHT = 40;
    private static final int LAST_HEIGHT = 42;
    private static final int FLAGS = 70;
    private static final int OBLIQUE = 50;
    private static final int GENERATION = 71;

    private final CadDocument document;
    private final SymbolTable table;

    StyleTable(CadDocument document, SymbolTable table) {
        this.document = document;
        this.table = table;
    }

    public boolean contains(String name) {
        return this.table.find(name) != null;
    }

    public CadEntity get(String name) {
        return this.table.find(name);
    }

    public MutableList<String> names() {
        return this.table.getEntries().collect(entry -> {
            String name = entry.getString(CadEntity.NAME);
            return name == null ? "" : name.trim();
        });
    }

    public int size() {
        return this.table.getEntries().size();
    }

    public String getFont(String name) {
        CadEntity style = this.get(name);
        return style == null ? null : style.getString(FONT);
    }

    public double getWidthFactor(String name) {
        CadEntity style = this.get(name);
        Double factor = style == null ? null : style.getDouble(WIDTH_FACTOR);
        return factor == null ? 1.0 : factor;
    }

    /**
     * Creates a style unconditionally. Callers wanting at most one style per name use
     * {@link #ensureStyle}.
     */
    public CadEntity newStyle(String name, String font, double widthFactor) {
        MutableList<DxfTag> tags = Lists.mutable.with(DxfTag.of(0, "STYLE"), DxfTag.of(CadEntity.HANDLE, this.document.nextHandle()));
        if (!this.document.isLegacy()) {
            if (this.table.getHandle() != null) {
                tags.add(DxfTag.of(CadEntity.OWNER, this.table.getHandle()));
            }
            tags.add(DxfTag.of(CadEntity.SUBCLASS, "AcDbSymbolTableRecord"));
            tags.add(DxfTag.of(CadEntity.SUBCLASS, "AcDbTextStyleTableRecord"));
        }
        tags.add(DxfTag.of(CadEntity.NAME, name));
        tags.add(DxfTag.of(FLAGS, 0));
        tags.add(DxfTag.of(FIXED_HEIGHT, 0.0));
        tags.add(DxfTag.of(WIDTH_FACTOR, widthFactor));
        tags.add(DxfTag.of(OBLIQUE, 0.0));
        tags.add(DxfTag.of(GENERATION, 0));
        tags.add(DxfTag.of(LAST_HEIGHT, 2.5));
        tags.add(DxfTag.of(FONT, font));
        tags.add(DxfTag.of(BIG_FONT, ""));
        CadEntity style = new CadEntity(tags);
        this.table.add(style);
        return style;
    }

    /**
     * Returns the existing style with this name, creating it first when absent.
     */
    public CadEntity ensureStyle(String name, String font, double widthFactor) {
        CadEntity existing = this.get(name);
        if (existing != null) {
            return existing;
        }
        return this.newStyle(name, font, widthFactor);
    }
}

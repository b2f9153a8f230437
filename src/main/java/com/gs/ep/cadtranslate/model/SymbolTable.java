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
 * One table of the TABLES section (LAYER, STYLE, BLOCK_RECORD...) with its head record,
 * its entries and the closing ENDTAB.
 */
public class SymbolTable {

    public static final int ENTRY_COUNT = 70;

    private final CadEntity head;
    private final MutableList<CadEntity> entries;
    private final CadEntity end;

    public SymbolTable(CadEntity head, MutableList<CadEntity> entries, CadEntity end) {
        this.head = head;
        this.entries = entries;
        this.end = end;
    }

    public String getName() {
        String name = this.head.getString(CadEntity.NAME);
        return name == null ? "" : name.trim();
    }

    public String getHandle() {
        return this.head.getHandle();
    }

    public MutableList<CadEntity> getEntries() {
        return this.entries;
    }

    public CadEntity find(String entryName) {
        return this.entries.detect(entry -> {
            String name = entry.getString(CadEntity.NAME);
            return name != null && name.trim().equalsIgnoreCase(entryName);
        });
    }

    public void add(CadEntity entry) {
        this.entries.add(entry);
        this.head.setString(ENTRY_COUNT, Integer.toString(this.entries.size()));
    }

    public MutableList<DxfTag> toTags() {
        MutableList<DxfTag> out = Lists.mutable.withAll(this.head.toTags());
        for (CadEntity entry : this.entries) {
            out.addAll(entry.toTags());
        }
        if (this.end != null) {
            out.addAll(this.end.toTags());
        }
        return out;
    }
}

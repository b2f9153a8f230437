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

public class TablesSection implements DxfSection {

    public static final String STYLE = "STYLE";
    public static final String BLOCK_RECORD = "BLOCK_RECORD";

    private final MutableList<SymbolTable> tables = Lists.mutable.empty();

    @Override
    public String getName() {
        return TABLES;
    }

    public MutableList<SymbolTable> getTables() {
        return this.tables;
    }

    public void add(SymbolTable table) {
        this.tables.add(table);
    }

    public SymbolTable get(String name) {
        return this.tables.detect(table -> table.getName().equalsIgnoreCase(name));
    }

    @Override
    public MutableList<DxfTag> contentTags() {
        MutableList<DxfTag> out = Lists.mutable.empty();
        for (SymbolTable table : this.tables) {
            out.addAll(table.toTags());
        }
        return out;
    }
}

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

import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * A DXF object (entity, table entry, block marker or object) backed by its own tag list.
 * Tags the model does not interpret are carried through unchanged, so writing the
 * entity back reproduces its original structure apart from the edited values.
 */
public class CadEntity implements HasLayer {

    public static final int TYPE = 0;
    public static final int TEXT_VALUE = 1;
    public static final int NAME = 2;
    public static final int HANDLE = 5;
    public static final int LAYER = 8;
    public static final int PAPER_SPACE = 67;
    public static final int SUBCLASS = 100;
    public static final int EMBEDDED_OBJECT = 101;
    public static final int APP_GROUP = 102;
    public static final int OWNER = 330;
    public static final int XDATA_APP = 1001;

    protected final MutableList<DxfTag> tags;
    private final MutableList<CadEntity> children = Lists.mutable.empty();
    private CadEntity sequenceEnd;

    public CadEntity(List<DxfTag> tags) {
        if (tags == null || tags.isEmpty() || !tags.get(0).isStructure()) {
            throw new IllegalArgumentException("Entity tags must start with a group code 0 tag");
        }
        this.tags = Lists.mutable.withAll(tags);
    }

    public String getType() {
        return this.tags.get(0).getValue().trim();
    }

    public String getHandle() {
        return this.getString(HANDLE);
    }

    public String getOwnerHandle() {
        return this.getString(OWNER);
    }

    public boolean isPaperSpace() {
        String flag = this.getString(PAPER_SPACE);
        return flag != null && "1".equals(flag.trim());
    }

    /**
     * Followers that belong to this entity (ATTRIB after INSERT, VERTEX after POLYLINE).
     */
    public MutableList<CadEntity> getChildren() {
        return this.children;
    }

    public void addChild(CadEntity child) {
        this.children.add(child);
    }

    public CadEntity getSequenceEnd() {
        return this.sequenceEnd;
    }

    public void setSequenceEnd(CadEntity sequenceEnd) {
        this.sequenceEnd = sequenceEnd;
    }

    public ListIterable<DxfTag> getTags() {
        return this.tags.asUnmodifiable();
    }

    public MutableList<DxfTag> toTags() {
        MutableList<DxfTag> out = Lists.mutable.withAll(this.tags);
        for (CadEntity child : this.children) {
            out.addAll(child.toTags());
        }
        if (this.sequenceEnd != null) {
            out.addAll(this.sequenceEnd.toTags());
        }
        return out;
    }

    // ==================== tag access ====================

    /**
     * Index of the first tag with the given code in the entity's own data, skipping
     * application groups (102) and stopping at embedded objects and extended data.
     */
    int indexOf(int code) {
        boolean inAppGroup = false;
        for (int i = 1; i < this.tags.size(); i++) {
            DxfTag tag = this.tags.get(i);
            if (tag.getCode() == APP_GROUP) {
                inAppGroup = tag.getValue().startsWith("{");
                continue;
            }
            if (inAppGroup) {
                continue;
            }
            if (tag.getCode() == EMBEDDED_OBJECT || tag.getCode() >= XDATA_APP) {
                return -1;
            }
            if (tag.getCode() == code) {
                return i;
            }
        }
        return -1;
    }

    /**
     * All values of {@code code} in the entity's own data, in tag order.
     */
    MutableList<String> valuesOf(int code) {
        MutableList<String> values = Lists.mutable.empty();
        boolean inAppGroup = false;
        for (int i = 1; i < this.tags.size(); i++) {
            DxfTag tag = this.tags.get(i);
            if (tag.getCode() == APP_GROUP) {
                inAppGroup = tag.getValue().startsWith("{");
                continue;
            }
            if (inAppGroup) {
                continue;
            }
            if (tag.getCode() == EMBEDDED_OBJECT || tag.getCode() >= XDATA_APP) {
                break;
            }
            if (tag.getCode() == code) {
                values.add(tag.getValue());
            }
        }
        return values;
    }

    boolean has(int code) {
        return this.indexOf(code) >= 0;
    }

    String getString(int code) {
        int index = this.indexOf(code);
        return index < 0 ? null : this.tags.get(index).getValue();
    }

    Double getDouble(int code) {
        String value = this.getString(code);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return Double.valueOf(value.trim());
    }

    /**
     * Value of {@code code} inside the named subclass section ({@code 100 <subclass>}).
     */
    public String getStringInSubclass(String subclass, int code) {
        boolean inSubclass = false;
        for (int i = 1; i < this.tags.size(); i++) {
            DxfTag tag = this.tags.get(i);
            if (tag.getCode() == SUBCLASS) {
                inSubclass = subclass.equals(tag.getValue().trim());
            } else if (inSubclass && tag.getCode() == code) {
                return tag.getValue();
            }
        }
        return null;
    }

    void setString(int code, String value) {
        int index = this.indexOf(code);
        if (index >= 0) {
            this.tags.set(index, DxfTag.of(code, value));
        } else {
            this.tags.add(this.insertionIndex(), DxfTag.of(code, value));
        }
    }

    void insertAt(int index, DxfTag tag) {
        this.tags.add(index, tag);
    }

    void setDouble(int code, double value) {
        this.setString(code, DxfTag.formatDouble(value));
    }

    void removeAll(int code) {
        int index;
        while ((index = this.indexOf(code)) >= 0) {
            this.tags.remove(index);
        }
    }

    /**
     * Where a missing tag is inserted: right after the text value when the entity has one,
     * which keeps it inside the text subclass, otherwise before any extended data.
     */
    int insertionIndex() {
        int textIndex = this.indexOf(TEXT_VALUE);
        if (textIndex >= 0) {
            return textIndex + 1;
        }
        for (int i = 1; i < this.tags.size(); i++) {
            int code = this.tags.get(i).getCode();
            if (code == EMBEDDED_OBJECT || code >= XDATA_APP) {
                return i;
            }
        }
        return this.tags.size();
    }

    @Override
    public String toString() {
        return this.getType() + "(" + this.getHandle() + ")";
    }
}

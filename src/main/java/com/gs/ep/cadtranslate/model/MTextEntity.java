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

import java.util.List;

/**
 * Paragraph text (MTEXT). Long contents are stored as 250 character chunks in group
 * code 3 followed by the final chunk in group code 1.
 */
public class MTextEntity extends CadEntity implements HasText, HasHeight, HasRotation, HasStyle, HasInsertionPoint {

    public static final String TYPE_NAME = "MTEXT";
    public static final int TEXT_CHUNK = 3;
    public static final int CHUNK_SIZE = 250;
    private static final int DIRECTION_X = 11;
    private static final int DIRECTION_Y = 21;
    private static final int DIRECTION_Z = 31;

    public MTextEntity(List<DxfTag> tags) {
        super(tags);
    }

    @Override
    public String getText() {
        StringBuilder text = new StringBuilder();
        for (String chunk : this.valuesOf(TEXT_CHUNK)) {
            text.append(chunk);
        }
        String last = this.getString(TEXT_VALUE);
        if (last != null) {
            text.append(last);
        }
        return text.toString();
    }

    @Override
    public void setText(String text) {
        this.removeAll(TEXT_CHUNK);
        MutableList<String> chunks = split(text == null ? "" : text);
        this.setString(TEXT_VALUE, chunks.getLast());
        int index = this.indexOf(TEXT_VALUE);
        for (int i = 0; i < chunks.size() - 1; i++) {
            this.insertAt(index + i, DxfTag.of(TEXT_CHUNK, chunks.get(i)));
        }
    }

    /**
     * Rotation in degrees, taken from group code 50 or derived from the x-axis direction
     * vector when only that is stored.
     */
    @Override
    public double getRotation() {
        Double rotation = this.getDouble(ROTATION);
        if (rotation != null) {
            return rotation;
        }
        Double dx = this.getDouble(DIRECTION_X);
        Double dy = this.getDouble(DIRECTION_Y);
        if (dx == null || dy == null) {
            return 0.0;
        }
        return Math.toDegrees(Math.atan2(dy, dx));
    }

    @Override
    public void setRotation(double degrees) {
        this.removeAll(DIRECTION_X);
        this.removeAll(DIRECTION_Y);
        this.removeAll(DIRECTION_Z);
        this.setDouble(ROTATION, degrees);
    }

    static MutableList<String> split(String text) {
        MutableList<String> chunks = Lists.mutable.empty();
        int start = 0;
        while (text.length() - start > CHUNK_SIZE) {
            int end = start + CHUNK_SIZE;
            if (Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            chunks.add(text.substring(start, end));
            start = end;
        }
        chunks.add(text.substring(start));
        return chunks;
    }
}

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

/**
 * Entities carrying a human readable text value.
 */
public interface HasText {

    default String getText() {
        String text = ((CadEntity) this).getString(CadEntity.TEXT_VALUE);
        return text == null ? "" : text;
    }

    default void setText(String text) {
        ((CadEntity) this).setString(CadEntity.TEXT_VALUE, text);
    }
}

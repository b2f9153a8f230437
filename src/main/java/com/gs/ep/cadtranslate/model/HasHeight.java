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
 * Entities with a text height (group code 40).
 */
public interface HasHeight {

    int HEIGHT = 40;

    default boolean hasHeight() {
        return ((CadEntity) this).has(HEIGHT);
    }

    default double getHeight() {
        Double height = ((CadEntity) this).getDouble(HEIGHT);
        return height == null ? 0.0 : height;
    }

    default void setHeight(double height) {
        ((CadEntity) this).setDouble(HEIGHT, height);
    }
}

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
 * Entities with a rotation angle in degrees (group code 50).
 */
public interface HasRotation {

    int ROTATION = 50;

    default double getRotation() {
        Double rotation = ((CadEntity) this).getDouble(ROTATION);
        return rotation == null ? 0.0 : rotation;
    }

    default void setRotation(double degrees) {
        ((CadEntity) this).setDouble(ROTATION, degrees);
    }
}

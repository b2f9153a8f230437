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
 * Entities placed at an insertion point (group codes 10/20/30).
 */
public interface HasInsertionPoint {

    int X = 10;
    int Y = 20;
    int Z = 30;

    /**
     * @return the insertion point, or null when the entity does not store one
     */
    default Point3 getInsertionPoint() {
        CadEntity entity = (CadEntity) this;
        Double x = entity.getDouble(X);
        if (x == null) {
            return null;
        }
        Double y = entity.getDouble(Y);
        Double z = entity.getDouble(Z);
        return new Point3(x, y == null ? 0.0 : y, z == null ? 0.0 : z);
    }
}

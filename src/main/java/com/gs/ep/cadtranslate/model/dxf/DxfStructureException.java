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

package com.gs.ep.cadtranslate.model.dxf;

import java.io.IOException;

/**
 * Thrown when a DXF tag stream is malformed or its sections are not well formed.
 */
public class DxfStructureException extends IOException {

    private static final long serialVersionUID = 1L;

    public DxfStructureException(String message) {
        super(message);
    }

    public DxfStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}

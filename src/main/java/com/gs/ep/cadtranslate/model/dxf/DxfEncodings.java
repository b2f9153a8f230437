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

import com.gs.ep.cadtranslate.model.CadDocument;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Charset rules of ASCII DXF: UTF-8 from AutoCAD 2007 (AC1021), the drawing code page
 * ($DWGCODEPAGE) before. Characters outside a code page are written as {@code \U+XXXX}.
 */
final class DxfEncodings {

    private static final Pattern UNICODE_ESCAPE = Pattern.compile("\\\\U\\+([0-9A-Fa-f]{4})");

    private static final ImmutableMap<String, String> CODE_PAGES = Maps.immutable.<String, String>empty()
            .newWithKeyValue("ANSI_874", "x-windows-874")
            .newWithKeyValue("ANSI_932", "Shift_JIS")
            .newWithKeyValue("ANSI_936", "GBK")
            .newWithKeyValue("ANSI_949", "x-windows-949")
            .newWithKeyValue("ANSI_950", "Big5")
            .newWithKeyValue("ANSI_1250", "windows-1250")
            .newWithKeyValue("ANSI_1251", "windows-1251")
            .newWithKeyValue("ANSI_1252", "windows-1252")
            .newWithKeyValue("ANSI_1253", "windows-1253")
            .newWithKeyValue("ANSI_1254", "windows-1254")
            .newWithKeyValue("ANSI_1255", "windows-1255")
            .newWithKeyValue("ANSI_1256", "windows-1256")
            .newWithKeyValue("ANSI_1257", "windows-1257")
            .newWithKeyValue("ANSI_1258", "windows-1258");

    private static final Charset DEFAULT_CODE_PAGE = Charset.forName("windows-1252");

    private DxfEncodings() {
    }

    static boolean isUnicodeVersion(String version) {
        return version != null && version.compareToIgnoreCase(CadDocument.AC1021) >= 0;
    }

    static Charset forCodePage(String codePage) {
        if (codePage == null) {
            return DEFAULT_CODE_PAGE;
        }
        String name = CODE_PAGES.get(codePage.trim().toUpperCase(Locale.ROOT));
        if (name == null || !Charset.isSupported(name)) {
            return DEFAULT_CODE_PAGE;
        }
        return Charset.forName(name);
    }

    static Charset outputCharset(String version, String codePage) {
        return isUnicodeVersion(version) ? StandardCharsets.UTF_8 : forCodePage(codePage);
    }

    static String decodeUnicodeEscapes(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        Matcher matcher = UNICODE_ESCAPE.matcher(value);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            char decoded = (char) Integer.parseInt(matcher.group(1), 16);
            matcher.appendReplacement(out, Matcher.quoteReplacement(String.valueOf(decoded)));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}

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
import com.gs.ep.cadtranslate.model.DxfTag;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Splits the bytes of an ASCII DXF file into group code / value tags.
 *
 * <p>{@link #readTags()} is strict and fails on any malformed group code. {@link #readRawTags()}
 * is the tolerant line pair scan used to salvage text from damaged files: undecodable bytes
 * are dropped and pairs with a non-numeric code are skipped.</p>
 */
public class DxfTagReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(DxfTagReader.class);
    private static final String BINARY_SENTINEL = "AutoCAD Binary DXF";

    private final byte[] data;
    private Charset charset = StandardCharsets.UTF_8;
    private String version;
    private String codePage;

    public DxfTagReader(byte[] data) {
        this.data = data;
    }

    /**
     * Charset the last {@link #readTags()} call decoded the file with.
     */
    public Charset getCharset() {
        return this.charset;
    }

    public String getVersion() {
        return this.version;
    }

    public String getCodePage() {
        return this.codePage;
    }

    public MutableList<DxfTag> readTags() throws DxfStructureException {
        if (this.isBinary()) {
            throw new DxfStructureException("Binary DXF is not supported");
        }
        this.sniffHeader();
        String text = this.decode();
        String[] lines = splitLines(text);
        int count = lines.length;
        while (count > 0 && lines[count - 1].trim().isEmpty()) {
            count--;
        }
        if (count % 2 != 0) {
            throw new DxfStructureException("Incomplete tag at line " + count);
        }
        boolean unescape = !StandardCharsets.UTF_8.equals(this.charset) || !DxfEncodings.isUnicodeVersion(this.version);
        MutableList<DxfTag> tags = Lists.mutable.empty();
        for (int i = 0; i < count; i += 2) {
            int code;
            try {
                code = Integer.parseInt(lines[i].trim());
            } catch (NumberFormatException e) {
                throw new DxfStructureException("Invalid group code '" + lines[i].trim() + "' at line " + (i + 1), e);
            }
            String value = lines[i + 1];
            tags.add(DxfTag.of(code, unescape ? DxfEncodings.decodeUnicodeEscapes(value) : value));
        }
        LOGGER.debug("Read {} tags ({}, version {})", tags.size(), this.charset.name(), this.version);
        return tags;
    }

    public MutableList<DxfTag> readRawTags() {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(this.data))
                    .toString();
        } catch (CharacterCodingException e) {
            // IGNORE never reports, kept for the checked signature
            throw new IllegalStateException(e);
        }
        String[] lines = splitLines(text);
        MutableList<DxfTag> tags = Lists.mutable.empty();
        for (int i = 0; i + 1 < lines.length; i += 2) {
            int code;
            try {
                code = Integer.parseInt(lines[i].trim());
            } catch (NumberFormatException e) {
                LOGGER.trace("Skipping pair with group code '{}'", lines[i]);
                continue;
            }
            tags.add(DxfTag.of(code, lines[i + 1].trim()));
        }
        return tags;
    }

    private boolean isBinary() {
        if (this.data.length < BINARY_SENTINEL.length()) {
            return false;
        }
        String head = new String(this.data, 0, BINARY_SENTINEL.length(), StandardCharsets.ISO_8859_1);
        return BINARY_SENTINEL.equals(head);
    }

    /**
     * Reads $ACADVER and $DWGCODEPAGE before choosing a charset. Both are plain ASCII.
     */
    private void sniffHeader() {
        String[] lines = splitLines(new String(this.data, StandardCharsets.ISO_8859_1));
        for (int i = 0; i + 2 < lines.length; i++) {
            String line = lines[i].trim();
            if (CadDocument.VERSION_VARIABLE.equalsIgnoreCase(line)) {
                this.version = lines[i + 2].trim();
            } else if (CadDocument.CODEPAGE_VARIABLE.equalsIgnoreCase(line)) {
                this.codePage = lines[i + 2].trim();
            } else if ("ENDSEC".equals(line)) {
                break;
            }
        }
    }

    private String decode() {
        if (DxfEncodings.isUnicodeVersion(this.version)) {
            this.charset = StandardCharsets.UTF_8;
            return new String(this.data, StandardCharsets.UTF_8);
        }
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(this.data))
                    .toString();
            this.charset = StandardCharsets.UTF_8;
            return text;
        } catch (CharacterCodingException e) {
            this.charset = DxfEncodings.forCodePage(this.codePage);
            LOGGER.debug("Not valid UTF-8, decoding with code page {}", this.charset.name());
            return new String(this.data, this.charset);
        }
    }

    private static String[] splitLines(String text) {
        String body = text.startsWith("\uFEFF") ? text.substring(1) : text;
        return body.split("\\r?\\n", -1);
    }
}

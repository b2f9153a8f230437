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
import com.gs.ep.cadtranslate.model.DxfSection;
import com.gs.ep.cadtranslate.model.DxfTag;
import com.gs.ep.cadtranslate.model.HeaderSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link CadDocument} back to ASCII DXF in the document's charset.
 */
public class DxfWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DxfWriter.class);
    private static final String NEWLINE = "\n";

    public void save(CadDocument document, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            this.write(document, out);
        }
        LOGGER.debug("Saved {}", path);
    }

    public byte[] render(CadDocument document) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        this.write(document, out);
        return out.toByteArray();
    }

    public void write(CadDocument document, OutputStream outputStream) throws IOException {
        HeaderSection header = document.getHeader();
        if (header != null && header.getVariable(CadDocument.HANDSEED_VARIABLE) != null) {
            header.setVariable(CadDocument.HANDSEED_VARIABLE, 5, document.getHandleSeed());
        }
        Charset charset = document.getEncoding();
        CharsetEncoder encoder = StandardCharsets.UTF_8.equals(charset) ? null : charset.newEncoder();
        Writer writer = new BufferedWriter(new OutputStreamWriter(outputStream, charset));
        for (DxfSection section : document.getSections()) {
            for (DxfTag tag : section.toTags()) {
                writer.write(String.format("%3d", tag.getCode()));
                writer.write(NEWLINE);
                writer.write(encoder == null ? tag.getValue() : escape(tag.getValue(), encoder));
                writer.write(NEWLINE);
            }
        }
        writer.write("  0");
        writer.write(NEWLINE);
        writer.write("EOF");
        writer.write(NEWLINE);
        writer.flush();
    }

    private static String escape(String value, CharsetEncoder encoder) {
        StringBuilder out = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x80 || encoder.canEncode(c)) {
                if (out != null) {
                    out.append(c);
                }
                continue;
            }
            if (out == null) {
                out = new StringBuilder(value.substring(0, i));
            }
            out.append(String.format("\\U+%04X", (int) c));
        }
        return out == null ? value : out.toString();
    }
}

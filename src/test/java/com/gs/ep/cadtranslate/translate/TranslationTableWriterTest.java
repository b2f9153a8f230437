package com.gs.ep.cadtranslate.translate;

import com.gs.ep.cadtranslate.DxfFixture;
import com.gs.ep.cadtranslate.extract.ExtractedTexts;
import com.gs.ep.cadtranslate.extract.TextExtractionEngine;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class TranslationTableWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void write_extractedTexts_shouldProduceNumberedTableWithProvenance() throws Exception {
        Path drawing = DxfFixture.r2000()
                .text("2A", "Hello World", 10.0, "Notes")
                .mtext("3A", "\\A1;Paragraph text", 2.5)
                .write(tempDir, "plan.dxf");
        ExtractedTexts texts = new TextExtractionEngine().extract(drawing);
        Path output = tempDir.resolve("out").resolve("table.xlsx");

        int written = new TranslationTableWriter().write(texts, output);

        assertEquals(2, written);
        try (InputStream in = Files.newInputStream(output); Workbook workbook = WorkbookFactory.create(in)) {
            Sheet sheet = workbook.getSheetAt(0);
            Row header = sheet.getRow(0);
            for (int i = 0; i < TranslationTableWriter.COLUMNS.size(); i++) {
                assertEquals(TranslationTableWriter.COLUMNS.get(i), header.getCell(i).getStringCellValue());
            }
            Row first = sheet.getRow(1);
            assertEquals(1.0, first.getCell(0).getNumericCellValue());
            assertEquals("Hello World", first.getCell(1).getStringCellValue());
            assertEquals("", first.getCell(2).getStringCellValue());
            assertEquals("单行文字", first.getCell(3).getStringCellValue());
            assertEquals("2A", first.getCell(4).getStringCellValue());
            assertEquals("Notes", first.getCell(5).getStringCellValue());
            assertEquals("Paragraph text", sheet.getRow(2).getCell(1).getStringCellValue());
            assertEquals(2, sheet.getLastRowNum());
        }
    }

    @Test
    void write_thenFillTranslations_shouldLoadBackAsMap() throws Exception {
        Path drawing = DxfFixture.r2000().text("2A", "Hello World", 10.0).write(tempDir, "plan.dxf");
        Path table = tempDir.resolve("table.xlsx");
        new TranslationTableWriter().write(new TextExtractionEngine().extract(drawing), table);

        assertTrue(new TranslationTableLoader().load(table).isEmpty());

        try (InputStream in = Files.newInputStream(table); Workbook workbook = WorkbookFactory.create(in)) {
            workbook.getSheetAt(0).getRow(1).getCell(2).setCellValue("Bonjour le monde");
            try (OutputStream out = Files.newOutputStream(table)) {
                workbook.write(out);
            }
        }

        TranslationMap map = new TranslationTableLoader().load(table);
        assertEquals("Bonjour le monde", map.get("Hello World"));
    }
}

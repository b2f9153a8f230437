package com.gs.ep.cadtranslate.translate;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TranslationTableLoaderTest {

    @TempDir
    Path tempDir;

    private final TranslationTableLoader loader = new TranslationTableLoader();

    static Path writeWorkbook(Path file, Object[]... rows) throws Exception {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("texts");
            for (int r = 0; r < rows.length; r++) {
                Row row = sheet.createRow(r);
                for (int c = 0; c < rows[r].length; c++) {
                    Object value = rows[r][c];
                    if (value instanceof Number) {
                        row.createCell(c).setCellValue(((Number) value).doubleValue());
                    } else if (value != null) {
                        row.createCell(c).setCellValue(value.toString());
                    }
                }
            }
            try (OutputStream out = Files.newOutputStream(file)) {
                workbook.write(out);
            }
        }
        return file;
    }

    @Test
    void load_threeColumnRows_shouldUseSecondAndThirdColumns() {
        List<List<?>> rows = Arrays.asList(
                Arrays.asList(1, "Hello", "Bonjour"),
                Arrays.asList(2, "Skip", "N/A"),
                Arrays.asList(3, "Zero", "0"),
                Arrays.asList(4, "  Spaced  ", "  Espacé  "),
                Arrays.asList(5, "Hello", "Salut"),
                Arrays.asList(6, "", "orphan"),
                Arrays.asList(7, "Nothing", null),
                Arrays.asList(8, "Missing", "NaN"));

        TranslationMap map = loader.load(rows);

        assertEquals(3, map.size());
        assertEquals("Salut", map.get("Hello"));
        assertEquals("0", map.get("Zero"));
        assertEquals("Espacé", map.get("Spaced"));
        assertFalse(map.containsKey("Skip"));
    }

    @Test
    void load_noBreakSpacePadding_shouldBeTrimmedFromCells() {
        TranslationMap map = loader.load(Arrays.asList(
                Arrays.asList(1, "\u00A0Door\u00A0", "Porte\u00A0"),
                Arrays.asList(2, "Window", "\u00A0")));

        assertEquals(1, map.size());
        assertEquals("Porte", map.get("Door"));
    }

    @Test
    void load_twoColumnRows_shouldUseFirstAndSecondColumns() {
        TranslationMap map = loader.load(Arrays.asList(
                Arrays.asList("Door", "Porte"),
                Collections.singletonList("Lonely")));

        assertEquals(1, map.size());
        assertEquals("Porte", map.get("Door"));
    }

    @Test
    void load_workbook_shouldReadFirstSheetBelowHeader() throws Exception {
        Path file = writeWorkbook(tempDir.resolve("table.xlsx"),
                new Object[]{"序号", "原文", "译文"},
                new Object[]{1, "Hello World", "Bonjour le monde"},
                new Object[]{2, "Stair", ""},
                new Object[]{3, "Count", 42},
                new Object[]{4, "Lonely"});

        TranslationMap map = loader.load(file);

        assertEquals(2, map.size());
        assertEquals("Bonjour le monde", map.get("Hello World"));
        assertEquals("42", map.get("Count"));
    }

    @Test
    void load_missingFile_shouldReturnEmptyMap() {
        assertTrue(loader.load(tempDir.resolve("missing.xlsx")).isEmpty());
    }

    @Test
    void load_fileThatIsNotAWorkbook_shouldReturnEmptyMap() throws Exception {
        Path file = tempDir.resolve("table.xlsx");
        Files.write(file, "not a workbook".getBytes(StandardCharsets.UTF_8));

        assertTrue(loader.load(file).isEmpty());
    }
}

package com.gs.ep.cadtranslate.app;

import com.gs.ep.cadtranslate.DxfFixture;
import com.gs.ep.cadtranslate.translate.CadTranslateConfig;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class CadTranslatorCliTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream outBuffer;
    private ByteArrayOutputStream errBuffer;
    private CadTranslatorCli cli;

    @BeforeEach
    void setUp() {
        outBuffer = new ByteArrayOutputStream();
        errBuffer = new ByteArrayOutputStream();
        cli = new CadTranslatorCli(new CadTranslateConfig(new Properties()),
                new PrintStream(outBuffer, true, StandardCharsets.UTF_8),
                new PrintStream(errBuffer, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return outBuffer.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBuffer.toString(StandardCharsets.UTF_8);
    }

    private void writeTable(Path file, String source, String target) throws Exception {
        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("texts");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("序号");
            header.createCell(1).setCellValue("原文");
            header.createCell(2).setCellValue("译文");
            Row row = sheet.createRow(1);
            row.createCell(0).setCellValue(1);
            row.createCell(1).setCellValue(source);
            row.createCell(2).setCellValue(target);
            try (OutputStream stream = Files.newOutputStream(file)) {
                workbook.write(stream);
            }
        }
    }

    @Test
    void run_noArguments_shouldPrintUsage() {
        assertEquals(CadTranslatorCli.EXIT_USAGE, cli.run(new String[0]));
        assertTrue(err().contains("Usage:"));
    }

    @Test
    void run_unknownCommand_shouldPrintUsage() {
        assertEquals(CadTranslatorCli.EXIT_USAGE, cli.run(new String[]{"translate"}));
        assertTrue(err().contains("Unknown command: translate"));
    }

    @Test
    void run_extractWithoutInput_shouldPrintUsage() {
        assertEquals(CadTranslatorCli.EXIT_USAGE, cli.run(new String[]{"extract", "-o"}));
    }

    @Test
    void extract_drawing_shouldWriteTable() throws Exception {
        Path drawing = DxfFixture.r2000().text("2A", "Hello World", 10.0).write(tempDir, "plan.dxf");
        Path table = tempDir.resolve("texts.xlsx");

        int code = cli.run(new String[]{"extract", drawing.toString(), "-o", table.toString()});

        assertEquals(CadTranslatorCli.EXIT_OK, code);
        assertTrue(Files.exists(table));
        assertTrue(out().contains("文本提取完成"));
    }

    @Test
    void extract_excludeLayers_shouldSkipLayerAndPrintStatistics() throws Exception {
        Path drawing = DxfFixture.r2000()
                .text("2A", "Hidden note", 10.0, "Hidden")
                .text("2B", "Hello World", 10.0, "Notes")
                .mtext("3A", "Paragraph text", 2.5)
                .write(tempDir, "plan.dxf");
        Path table = tempDir.resolve("texts.xlsx");

        int code = cli.run(new String[]{"extract", drawing.toString(), "-o", table.toString(),
                "--exclude-layers", "Hidden,Dims"});

        assertEquals(CadTranslatorCli.EXIT_OK, code);
        assertTrue(out().contains("(2 条)"));
        assertTrue(out().contains("总计文本数量: 2"));
        assertTrue(out().contains("单行文字: 1 (50.0%)"));
        assertTrue(out().contains("多行文字: 1 (50.0%)"));
        assertFalse(out().contains("属性:"));
    }

    @Test
    void extract_drawingWithoutText_shouldFail() throws Exception {
        Path drawing = DxfFixture.r2000().text("2A", "123", 10.0).write(tempDir, "plan.dxf");
        Path table = tempDir.resolve("texts.xlsx");

        int code = cli.run(new String[]{"extract", drawing.toString(), "-o", table.toString()});

        assertEquals(CadTranslatorCli.EXIT_FAILURE, code);
        assertFalse(Files.exists(table));
    }

    @Test
    void backfill_directoryWithTable_shouldTranslateAndReport() throws Exception {
        DxfFixture.r2000().text("2A", "Hello World", 10.0).write(tempDir, "plan.dxf");
        writeTable(tempDir.resolve("table.xlsx"), "Hello World", "Bonjour le monde");

        int code = cli.run(new String[]{"backfill", tempDir.toString(), "-e", "table.xlsx", "-r", "--threads", "2"});

        assertEquals(CadTranslatorCli.EXIT_OK, code);
        assertTrue(Files.exists(tempDir.resolve("translated").resolve("plan_translated.dxf")));
        assertTrue(Files.exists(tempDir.resolve("translated").resolve("translation_report.json")));
        assertTrue(out().contains("加载了 1 条翻译"));
        assertTrue(out().contains("翻译文本: 1"));
    }

    @Test
    void backfill_missingTable_shouldFail() {
        int code = cli.run(new String[]{"backfill", tempDir.toString(), "-e", "missing.xlsx"});

        assertEquals(CadTranslatorCli.EXIT_FAILURE, code);
        assertTrue(err().contains("no translations loaded"));
    }

    @Test
    void backfill_invalidNumber_shouldPrintUsage() {
        assertEquals(CadTranslatorCli.EXIT_USAGE,
                cli.run(new String[]{"backfill", tempDir.toString(), "--threads", "many"}));
    }
}

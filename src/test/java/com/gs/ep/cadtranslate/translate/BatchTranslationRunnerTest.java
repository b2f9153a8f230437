package com.gs.ep.cadtranslate.translate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gs.ep.cadtranslate.DxfFixture;
import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.TextEntity;
import com.gs.ep.cadtranslate.model.dxf.DxfParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class BatchTranslationRunnerTest {

    @TempDir
    Path tempDir;

    private Path outputDir;
    private final TranslationMap map = TranslationMap.builder().put("Hello World", "Bonjour le monde").build();

    @BeforeEach
    void setUp() throws Exception {
        DxfFixture.r2000().text("2A", "Hello World", 10.0).write(tempDir, "good.dxf");
        Files.write(tempDir.resolve("broken.dxf"), "not a drawing\n".getBytes(StandardCharsets.UTF_8));
        Files.createDirectories(tempDir.resolve("sub"));
        DxfFixture.r2000().text("2A", "Hello World", 10.0).text("2B", "Unknown", 10.0).write(tempDir.resolve("sub"), "c.DXF");
        Files.write(tempDir.resolve("notes.txt"), "Hello World".getBytes(StandardCharsets.UTF_8));
        outputDir = tempDir.resolve("translated");
        Files.createDirectories(outputDir);
        DxfFixture.r2000().text("2A", "Hello World", 10.0).write(outputDir, "old_translated.dxf");
    }

    private static DocumentTranslator translator() {
        return new DocumentTranslator(new TextSubstitutionEngine(SubstitutionOptions.defaults()));
    }

    @Test
    void run_mixedDirectory_shouldTranslateEachDrawingAndCountFailures() throws Exception {
        BatchSummary summary = new BatchTranslationRunner(translator(), 1).run(tempDir, outputDir, map);

        assertEquals(3, summary.getFileCount());
        assertEquals(2, summary.getSuccessfulFiles());
        assertEquals(1, summary.getFailedFiles());
        assertEquals(0, summary.getCancelledFiles());
        assertEquals(new SubstitutionStats(3, 2, 1, 0), summary.getTotals());
        assertTrue(Files.exists(outputDir.resolve("good_translated.dxf")));
        assertTrue(Files.exists(outputDir.resolve("sub").resolve("c_translated.dxf")));
        assertFalse(Files.exists(outputDir.resolve("old_translated_translated.dxf")));
    }

    @Test
    void run_shouldWriteJsonReport() throws Exception {
        new BatchTranslationRunner(translator(), 1).run(tempDir, outputDir, map);

        JsonNode report = new ObjectMapper().readTree(outputDir.resolve("translation_report.json").toFile());
        assertEquals(3, report.get("fileCount").asInt());
        assertEquals(3, report.get("documents").size());
        assertEquals(2, report.get("totals").get("translated").asInt());
        assertEquals("FAILED", report.get("documents").get(0).get("status").asText());
    }

    @Test
    void run_severalThreads_shouldProduceSameSummary() throws Exception {
        BatchSummary summary = new BatchTranslationRunner(translator(), 2).run(tempDir, outputDir, map);

        assertEquals(2, summary.getSuccessfulFiles());
        assertEquals(new SubstitutionStats(3, 2, 1, 0), summary.getTotals());
    }

    @Test
    void run_cancelledToken_shouldMarkEveryDocumentCancelled() throws Exception {
        CancellationToken token = new CancellationToken();
        token.cancel();

        BatchSummary summary = new BatchTranslationRunner(translator(), 1).run(tempDir, outputDir, map, token);

        assertEquals(3, summary.getCancelledFiles());
        assertFalse(Files.exists(outputDir.resolve("good_translated.dxf")));
    }

    @Test
    void run_sameFileNameInTwoFolders_shouldKeepBothOutputs() throws Exception {
        Path input = tempDir.resolve("drawings");
        Files.createDirectories(input.resolve("a"));
        Files.createDirectories(input.resolve("b"));
        DxfFixture.r2000().text("2A", "Hello World", 10.0).write(input.resolve("a"), "plan.dxf");
        DxfFixture.r2000().text("2A", "Ground floor", 10.0).write(input.resolve("b"), "plan.dxf");
        Path output = tempDir.resolve("out");
        TranslationMap twoEntries = TranslationMap.builder()
                .put("Hello World", "Bonjour le monde")
                .put("Ground floor", "Rez de chaussee")
                .build();

        BatchSummary summary = new BatchTranslationRunner(translator(), 2).run(input, output, twoEntries);

        assertEquals(2, summary.getSuccessfulFiles());
        Path first = output.resolve("a").resolve("plan_translated.dxf");
        Path second = output.resolve("b").resolve("plan_translated.dxf");
        assertEquals("Bonjour le monde", firstText(first));
        assertEquals("Rez de chaussee", firstText(second));
        assertNotEquals(summary.getDocuments().get(0).getOutput(), summary.getDocuments().get(1).getOutput());
    }

    @Test
    void targetDirectory_shouldMirrorRelativeFolder() {
        Path input = tempDir.resolve("in");

        assertEquals(outputDir, BatchTranslationRunner.targetDirectory(input, outputDir, input.resolve("x.dxf")));
        assertEquals(outputDir.resolve("p").resolve("q"),
                BatchTranslationRunner.targetDirectory(input, outputDir, input.resolve("p").resolve("q").resolve("x.dxf")));
    }

    private static String firstText(Path drawing) throws Exception {
        CadDocument document = new DxfParser().parse(drawing);
        return document.modelSpace().query(TextEntity.class).getOnly().getText();
    }

    @Test
    void run_missingDirectory_shouldFail() {
        BatchTranslationRunner runner = new BatchTranslationRunner(translator(), 1);

        assertThrows(TranslationException.class,
                () -> runner.run(tempDir.resolve("missing"), outputDir, map));
    }
}

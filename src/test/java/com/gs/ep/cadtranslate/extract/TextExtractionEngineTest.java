package com.gs.ep.cadtranslate.extract;

import com.gs.ep.cadtranslate.DxfFixture;
import com.gs.ep.cadtranslate.model.Point3;
import org.eclipse.collections.api.bag.ImmutableBag;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class TextExtractionEngineTest {

    @TempDir
    Path tempDir;

    private final TextExtractionEngine engine = new TextExtractionEngine();

    private static DxfFixture fullDrawing() {
        return DxfFixture.r2000()
                .text("2A", "Hello World", 10.0, "Notes")
                .text("2B", "123", 2.5)
                .mtext("2C", "\\A1;Paragraph text", 3.5)
                .insertWithAttrib("2D", "TAG_BLOCK", "2E", "ROOM", "Room 101")
                .dimension("2F", "Approx. 5m")
                .line("30")
                .paperText("31", "Sheet note", 2.5)
                .blockWithText("TITLE", "40", "41", "Block label")
                .blockWithAttdef("TAG_BLOCK", "50", "51", "DRAWNBY", "J. Smith")
                .blockWithText("*U1", "60", "61", "Anonymous text");
    }

    @Test
    void extractFromFile_fullDrawing_shouldCollectEveryRegionInOrder() throws Exception {
        Path file = fullDrawing().write(tempDir, "plan.dxf");

        ExtractedTexts texts = engine.extractFromFile(file);

        assertEquals(Lists.immutable.with("Hello World", "Paragraph text", "Room 101", "Approx. 5m",
                "Sheet note", "Block label", "J. Smith", "DRAWNBY"), texts.getTexts());
    }

    @Test
    void extractFromFile_textEntity_shouldCarryProvenance() throws Exception {
        Path file = fullDrawing().write(tempDir, "plan.dxf");

        ExtractedTexts texts = engine.extractFromFile(file);

        TextRecord hello = texts.getRecords().detect(record -> "Hello World".equals(record.getRawText()));
        assertEquals(SourceRegion.MODEL_SPACE, hello.getSourceRegion());
        assertEquals("2A", hello.getEntityHandle());
        assertEquals("Notes", hello.getLayer());
        assertEquals(10.0, hello.getHeight(), 1e-9);
        assertEquals(new Point3(10.0, 20.0, 0.0), hello.getPosition());
        assertEquals(EntityKind.TEXT, hello.getEntityKind());
        assertEquals("Model", hello.getContainerName());

        TextRecord attrib = texts.getRecords().detect(record -> "Room 101".equals(record.getRawText()));
        assertEquals(EntityKind.ATTRIB, attrib.getEntityKind());
        assertEquals("ROOM", attrib.getAttributeTag());
        assertEquals("2E", attrib.getEntityHandle());

        TextRecord tagName = texts.getRecords().detect(record -> "DRAWNBY".equals(record.getRawText()));
        assertEquals(SourceRegion.BLOCK_DEFINITION, tagName.getSourceRegion());
        assertFalse(tagName.hasHandle());
        assertEquals("TAG_BLOCK", tagName.getContainerName());
    }

    @Test
    void extractFromFile_runTwice_shouldReturnSameTexts() throws Exception {
        Path file = fullDrawing().write(tempDir, "plan.dxf");

        assertEquals(engine.extractFromFile(file).getTexts(), engine.extractFromFile(file).getTexts());
    }

    @Test
    void extractFromFile_repeatedValue_shouldKeepRecordsButListTextOnce() throws Exception {
        Path file = DxfFixture.legacy()
                .text("2A", "Same label", 2.5)
                .text("2B", "Same label", 2.5)
                .write(tempDir, "plan.dxf");

        ExtractedTexts texts = engine.extractFromFile(file);

        assertEquals(2, texts.getRecords().size());
        assertEquals(Lists.immutable.with("Same label"), texts.getTexts());
    }

    @Test
    void extractFromFile_repeatedHandle_shouldKeepFirstRecord() throws Exception {
        Path file = DxfFixture.legacy()
                .text("2A", "First value", 2.5)
                .text("2A", "Second value", 2.5)
                .write(tempDir, "plan.dxf");

        ExtractedTexts texts = engine.extractFromFile(file);

        assertEquals(Lists.immutable.with("First value"), texts.getTexts());
    }

    @Test
    void extractFromFile_surroundingAndInnerWhitespace_shouldBeCleaned() throws Exception {
        Path file = DxfFixture.legacy().text("2A", "  Multiple   spaces  ", 2.5).write(tempDir, "plan.dxf");

        assertEquals(Lists.immutable.with("Multiple spaces"), engine.extractFromFile(file).getTexts());
    }

    @Test
    void results_malformedFile_shouldFallBackToTagScan() throws Exception {
        String content = DxfFixture.legacy().text("2A", "Hello World", 2.5).build()
                .replace("  0\nENDSEC\n", "xyz\nGarbage\n  0\nENDSEC\n");
        Path file = tempDir.resolve("broken.dxf");
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));

        MutableList<ExtractionResult> results = engine.results(file);

        ExtractionResult result = results.getOnly();
        assertEquals(ExtractionMethod.DXF_TAGS, result.getMethod());
        assertTrue(result.isSuccess());
        assertTrue(result.getRecords().allSatisfy(record -> record.getSourceRegion() == SourceRegion.RAW_RECORD && !record.hasHandle()));
        ExtractedTexts texts = engine.extractFromFile(file);
        assertTrue(texts.getTexts().contains("Hello World"));
        assertFalse(texts.getTexts().contains("Garbage"));
    }

    @Test
    void results_wellFormedFile_shouldRunStructuredSources() throws Exception {
        Path file = fullDrawing().write(tempDir, "plan.dxf");

        MutableList<ExtractionResult> results = engine.results(file);

        assertEquals(Lists.mutable.with(ExtractionMethod.MODEL_SPACE, ExtractionMethod.PAPER_SPACE, ExtractionMethod.BLOCK_DEFINITIONS),
                results.collect(ExtractionResult::getMethod));
        assertTrue(results.allSatisfy(ExtractionResult::isSuccess));
    }

    @Test
    void extractFromDirectory_sameHandleInTwoFiles_shouldKeepBoth() throws Exception {
        DxfFixture.legacy().text("2A", "Alpha text", 2.5).write(tempDir, "a.dxf");
        Path sub = Files.createDirectories(tempDir.resolve("sub"));
        DxfFixture.legacy().text("2A", "Beta text", 2.5).write(sub, "b.DXF");
        Files.write(tempDir.resolve("notes.txt"), "Gamma text".getBytes(StandardCharsets.UTF_8));

        ExtractedTexts texts = engine.extract(tempDir);

        assertEquals(Lists.immutable.with("Alpha text", "Beta text"), texts.getTexts());
    }

    @Test
    void extract_missingPath_shouldFail() {
        assertThrows(IOException.class, () -> engine.extract(tempDir.resolve("missing.dxf")));
    }

    @Test
    void extractFromFile_chineseOnlyFilter_shouldDropLatinText() throws Exception {
        Path file = DxfFixture.r2007()
                .text("2A", "Hello World", 2.5)
                .text("2B", "技术要求", 2.5)
                .write(tempDir, "plan.dxf");
        TextExtractionEngine chinese = new TextExtractionEngine(new TextAggregator(new NoiseFilter(), new TextFilter().chineseOnly()));

        assertEquals(Lists.immutable.with("技术要求"), chinese.extractFromFile(file).getTexts());
    }

    @Test
    void extractFromFile_excludedLayer_shouldDropTextOnThatLayer() throws Exception {
        Path file = DxfFixture.r2000()
                .text("2A", "Hidden note", 2.5, "Hidden")
                .text("2B", "Visible note", 2.5, "Notes")
                .write(tempDir, "plan.dxf");
        TextFilter filter = new TextFilter().withExcludedLayers(Lists.immutable.with("Hidden"));
        TextExtractionEngine layered = new TextExtractionEngine(new TextAggregator(new NoiseFilter(), filter));

        ExtractedTexts texts = layered.extractFromFile(file);

        assertEquals(Lists.immutable.with("Visible note"), texts.getTexts());
        assertEquals("Notes", texts.getRecords().getOnly().getLayer());
    }

    @Test
    void countByKind_shouldGroupRecordsByEntityType() throws Exception {
        Path file = DxfFixture.r2000()
                .text("2A", "Hello World", 2.5)
                .text("2B", "Second line", 2.5)
                .mtext("3A", "Paragraph text", 2.5)
                .insertWithAttrib("40", "TAG_BLOCK", "41", "ROOM", "Room 101")
                .write(tempDir, "plan.dxf");

        ImmutableBag<EntityKind> counts = engine.extractFromFile(file).countByKind();

        assertEquals(2, counts.occurrencesOf(EntityKind.TEXT));
        assertEquals(1, counts.occurrencesOf(EntityKind.MTEXT));
        assertEquals(1, counts.occurrencesOf(EntityKind.ATTRIB));
        assertEquals(0, counts.occurrencesOf(EntityKind.DIMENSION));
        assertEquals(4, counts.size());
    }
}

package com.gs.ep.cadtranslate.model;

import com.gs.ep.cadtranslate.DxfFixture;
import com.gs.ep.cadtranslate.model.dxf.DxfParser;
import com.gs.ep.cadtranslate.model.dxf.DxfWriter;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CadDocumentTest {

    private final DxfParser parser = new DxfParser();

    @Test
    void modelSpace_withPaperSpaceEntities_shouldSelectByPaperSpaceFlag() throws Exception {
        CadDocument document = parser.parse(DxfFixture.legacy()
                .text("2A", "Model note", 2.5)
                .paperText("2B", "Sheet note", 2.5)
                .bytes());

        assertEquals(1, document.modelSpace().getEntities().size());
        MutableList<Layout> layouts = document.paperSpaceLayouts();
        assertEquals(1, layouts.size());
        assertEquals("Layout1", layouts.getFirst().getName());
        TextEntity paperText = layouts.getFirst().query(TextEntity.class).getOnly();
        assertEquals("Sheet note", paperText.getText());
    }

    @Test
    void paperSpaceLayouts_withLayoutObjects_shouldFollowTabOrder() throws Exception {
        CadDocument document = parser.parse(DxfFixture.r2000()
                .paperLayout("Sheet B", "*Paper_Space1", "3A", 2, "3B", "Second sheet")
                .paperLayout("Sheet A", "*Paper_Space0", "2A", 1, "2B", "First sheet")
                .bytes());

        MutableList<Layout> layouts = document.paperSpaceLayouts();

        assertEquals("[Sheet A, Sheet B]", layouts.collect(Layout::getName).toString());
        assertEquals("First sheet", layouts.get(0).query(TextEntity.class).getOnly().getText());
        assertEquals("Second sheet", layouts.get(1).query(TextEntity.class).getOnly().getText());
    }

    @Test
    void styles_missingTablesSection_shouldCreateTableBeforeEntities() throws Exception {
        CadDocument document = parser.parse(DxfFixture.legacy().text("2A", "Note", 2.5).bytes());

        document.styles().ensureStyle("TranslatedStyle_Arial", "Arial", 0.8);
        CadDocument reloaded = parser.parse(new DxfWriter().render(document));

        assertTrue(reloaded.styles().contains("translatedstyle_arial"));
        assertEquals("Arial", reloaded.styles().getFont("TranslatedStyle_Arial"));
        assertEquals(0.8, reloaded.styles().getWidthFactor("TranslatedStyle_Arial"), 1e-9);
        MutableList<String> sectionNames = reloaded.getSections().collect(DxfSection::getName);
        assertTrue(sectionNames.indexOf(DxfSection.TABLES) < sectionNames.indexOf(DxfSection.ENTITIES));
    }

    @Test
    void ensureStyle_calledTwice_shouldCreateOneStyle() throws Exception {
        CadDocument document = parser.parse(DxfFixture.r2000().text("2A", "Note", 2.5).bytes());
        int before = document.styles().size();

        document.styles().ensureStyle("TranslatedStyle_Arial", "Arial", 0.8);
        document.styles().ensureStyle("TranslatedStyle_Arial", "Arial", 0.8);

        assertEquals(before + 1, document.styles().size());
    }

    @Test
    void addText_modernDocument_shouldCarryOwnerAndSubclassMarkers() throws Exception {
        CadDocument document = parser.parse(DxfFixture.r2000().text("2A", "Note", 2.5).bytes());

        TextEntity created = document.modelSpace().addText("New", new Point3(1.0, 2.0, 0.0), 3.0, 15.0, "Notes", "Standard");

        assertEquals(DxfFixture.MODEL_SPACE_RECORD, created.getOwnerHandle());
        assertTrue(created.getTags().anySatisfy(tag -> tag.getCode() == CadEntity.SUBCLASS && "AcDbText".equals(tag.getValue())));
        assertNotEquals("2A", created.getHandle());
        assertEquals(new Point3(1.0, 2.0, 0.0), created.getInsertionPoint());
        assertEquals(15.0, created.getRotation(), 1e-9);
        assertEquals("Notes", created.getLayer());
        assertEquals(2, document.modelSpace().getEntities().size());
    }

    @Test
    void addText_legacyDocument_shouldOmitSubclassMarkers() throws Exception {
        CadDocument document = parser.parse(DxfFixture.legacy().text("2A", "Note", 2.5).bytes());

        TextEntity created = document.modelSpace().addText("New", Point3.ORIGIN, 2.5, 0.0, null, null);

        assertTrue(document.isLegacy());
        assertTrue(created.getTags().noneSatisfy(tag -> tag.getCode() == CadEntity.SUBCLASS));
        assertNull(created.getOwnerHandle());
        assertEquals(HasLayer.DEFAULT_LAYER, created.getLayer());
        assertEquals(HasStyle.DEFAULT_STYLE, created.getStyle());
    }

    @Test
    void nextHandle_shouldStartAboveHandseed() throws Exception {
        CadDocument document = parser.parse(DxfFixture.r2000().text("2A", "Note", 2.5).bytes());

        assertEquals("FFF", document.getHandleSeed());
        assertEquals("FFF", document.nextHandle());
        assertEquals("1000", document.nextHandle());
        assertEquals("1001", document.getHandleSeed());
    }

    @Test
    void blocks_shouldExposeDefinitionsByName() throws Exception {
        CadDocument document = parser.parse(DxfFixture.r2000()
                .blockWithText("TITLE", "40", "41", "Block label")
                .blockWithText("*U1", "50", "51", "Anonymous")
                .bytes());

        assertEquals(2, document.blocks().size());
        assertFalse(document.getBlock("title").isAnonymous());
        assertTrue(document.getBlock("*U1").isAnonymous());
        assertSame(document, document.getBlock("TITLE").getDocument());
    }
}

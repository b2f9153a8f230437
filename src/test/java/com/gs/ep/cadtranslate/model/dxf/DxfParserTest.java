package com.gs.ep.cadtranslate.model.dxf;

import com.gs.ep.cadtranslate.DxfFixture;
import com.gs.ep.cadtranslate.model.AttribEntity;
import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.CadEntity;
import com.gs.ep.cadtranslate.model.DimensionEntity;
import com.gs.ep.cadtranslate.model.InsertEntity;
import com.gs.ep.cadtranslate.model.MTextEntity;
import com.gs.ep.cadtranslate.model.Point3;
import com.gs.ep.cadtranslate.model.TextEntity;
import org.eclipse.collections.api.list.MutableList;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class DxfParserTest {

    private final DxfParser parser = new DxfParser();

    @Test
    void parse_r2000Drawing_shouldCreateTypedEntities() throws Exception {
        CadDocument document = parser.parse(DxfFixture.r2000()
                .text("2A", "Hello World", 10.0)
                .mtext("2B", "\\A1;Paragraph text", 3.5)
                .insertWithAttrib("2C", "TAG_BLOCK", "2D", "ROOM", "Room 101")
                .dimension("2E", "Approx. 5m")
                .line("2F")
                .bytes());

        assertEquals("AC1015", document.getDxfVersion());
        assertFalse(document.isLegacy());
        MutableList<CadEntity> entities = document.modelSpace().getEntities();
        assertEquals(5, entities.size());

        TextEntity text = (TextEntity) entities.get(0);
        assertEquals("Hello World", text.getText());
        assertEquals(10.0, text.getHeight(), 1e-9);
        assertEquals(new Point3(10.0, 20.0, 0.0), text.getInsertionPoint());
        assertEquals("Standard", text.getStyle());

        assertEquals("\\A1;Paragraph text", ((MTextEntity) entities.get(1)).getText());

        InsertEntity insert = (InsertEntity) entities.get(2);
        AttribEntity attrib = insert.getAttribs().getOnly();
        assertEquals("ROOM", attrib.getTag());
        assertEquals("Room 101", attrib.getText());
        assertNotNull(insert.getSequenceEnd());

        DimensionEntity dimension = (DimensionEntity) entities.get(3);
        assertTrue(dimension.hasTextOverride());
        assertEquals("Standard", dimension.getDimensionStyle());

        assertEquals("LINE", entities.get(4).getType());
    }

    @Test
    void parse_crlfLineEndsAndByteOrderMark_shouldParse() throws Exception {
        String content = "\uFEFF" + DxfFixture.legacy().text("2A", "Hello", 2.5).build().replace("\n", "\r\n");

        CadDocument document = parser.parse(content.getBytes(StandardCharsets.UTF_8));

        assertEquals("Hello", document.modelSpace().query(TextEntity.class).getOnly().getText());
    }

    @Test
    void parse_dimensionWithMeasuredValue_shouldReportNoOverride() throws Exception {
        CadDocument document = parser.parse(DxfFixture.legacy().dimension("2A", "<>").bytes());

        assertFalse(document.modelSpace().query(DimensionEntity.class).getOnly().hasTextOverride());
    }

    @Test
    void parse_oddNumberOfLines_shouldFail() {
        byte[] data = "  0\nSECTION\n  2\n".getBytes(StandardCharsets.US_ASCII);

        assertThrows(DxfStructureException.class, () -> parser.parse(data));
    }

    @Test
    void parse_invalidGroupCode_shouldFail() {
        byte[] data = "  0\nSECTION\nabc\nENTITIES\n  0\nENDSEC\n  0\nEOF\n".getBytes(StandardCharsets.US_ASCII);

        DxfStructureException e = assertThrows(DxfStructureException.class, () -> parser.parse(data));
        assertTrue(e.getMessage().contains("abc"));
    }

    @Test
    void parse_missingEndsec_shouldFail() {
        byte[] data = "  0\nSECTION\n  2\nENTITIES\n  0\nEOF\n".getBytes(StandardCharsets.US_ASCII);

        assertThrows(DxfStructureException.class, () -> parser.parse(data));
    }

    @Test
    void parse_tagOutsideSection_shouldFail() {
        byte[] data = "  1\nstray\n  0\nEOF\n".getBytes(StandardCharsets.US_ASCII);

        assertThrows(DxfStructureException.class, () -> parser.parse(data));
    }

    @Test
    void parse_blockWithoutEndblk_shouldFail() {
        byte[] data = ("  0\nSECTION\n  2\nBLOCKS\n  0\nBLOCK\n  2\nTITLE\n  0\nTEXT\n  1\nHi\n"
                + "  0\nENDSEC\n  0\nEOF\n").getBytes(StandardCharsets.US_ASCII);

        assertThrows(DxfStructureException.class, () -> parser.parse(data));
    }

    @Test
    void parse_binaryDxf_shouldFail() {
        byte[] data = "AutoCAD Binary DXF\r\n\u001a\u0000".getBytes(StandardCharsets.ISO_8859_1);

        assertThrows(DxfStructureException.class, () -> parser.parse(data));
    }
}

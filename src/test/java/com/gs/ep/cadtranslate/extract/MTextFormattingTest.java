package com.gs.ep.cadtranslate.extract;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MTextFormattingTest {

    @Test
    void strip_controlSequences_shouldBeRemoved() {
        assertEquals("Title text", MTextFormatting.strip("\\A1;Title text"));
        assertEquals("Bold", MTextFormatting.strip("\\fArial|b1|i0|c0|p34;Bold"));
    }

    @Test
    void strip_braceGroups_shouldBeRemovedWhole() {
        assertEquals("Note  end", MTextFormatting.strip("Note {\\C1;red} end"));
    }

    @Test
    void strip_plainOrEmptyText_shouldBeUnchanged() {
        assertEquals("Plain text", MTextFormatting.strip("Plain text"));
        assertEquals("", MTextFormatting.strip(""));
        assertEquals("", MTextFormatting.strip(null));
    }
}

package com.gs.ep.cadtranslate.model;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class MTextEntityTest {

    private static MTextEntity newMText(DxfTag... extra) {
        MutableList<DxfTag> tags = Lists.mutable.with(
                DxfTag.of(0, "MTEXT"),
                DxfTag.of(5, "2A"),
                DxfTag.of(8, "0"),
                DxfTag.of(10, 0.0),
                DxfTag.of(20, 0.0),
                DxfTag.of(30, 0.0),
                DxfTag.of(40, 2.5));
        tags.addAll(Lists.mutable.with(extra));
        tags.add(DxfTag.of(1, "short"));
        tags.add(DxfTag.of(7, "Standard"));
        return new MTextEntity(tags);
    }

    private static String repeat(char c, int count) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < count; i++) {
            builder.append(c);
        }
        return builder.toString();
    }

    @Test
    void split_longText_shouldProduce250CharacterChunks() {
        MutableList<String> chunks = MTextEntity.split(repeat('a', 600));
        assertEquals(Lists.mutable.with(250, 250, 100), chunks.collect(String::length));
    }

    @Test
    void split_surrogatePairOnBoundary_shouldKeepPairTogether() {
        String text = repeat('a', 249) + "😀" + "b";
        MutableList<String> chunks = MTextEntity.split(text);
        assertEquals(2, chunks.size());
        assertEquals(249, chunks.get(0).length());
        assertEquals("😀b", chunks.get(1));
    }

    @Test
    void setText_longText_shouldWriteChunksBeforeFinalValue() {
        MTextEntity mtext = newMText();
        String text = repeat('x', 300) + repeat('y', 300);
        mtext.setText(text);

        assertEquals(text, mtext.getText());
        MutableList<Integer> codes = Lists.mutable.withAll(mtext.getTags().collect(DxfTag::getCode));
        int first = codes.indexOf(3);
        assertEquals(Lists.mutable.with(3, 3, 1, 7), codes.subList(first, first + 4));
    }

    @Test
    void setText_shortTextAfterLongText_shouldRemoveOldChunks() {
        MTextEntity mtext = newMText(DxfTag.of(3, repeat('z', 250)));
        assertEquals(repeat('z', 250) + "short", mtext.getText());

        mtext.setText("done");

        assertEquals("done", mtext.getText());
        assertTrue(mtext.getTags().noneSatisfy(tag -> tag.getCode() == 3));
    }

    @Test
    void getRotation_directionVectorOnly_shouldDeriveAngle() {
        MTextEntity mtext = newMText(DxfTag.of(11, 0.0), DxfTag.of(21, 1.0), DxfTag.of(31, 0.0));
        assertEquals(90.0, mtext.getRotation(), 1e-9);

        mtext.setRotation(45.0);

        assertEquals(45.0, mtext.getRotation(), 1e-9);
        assertTrue(mtext.getTags().noneSatisfy(tag -> tag.getCode() == 11 || tag.getCode() == 21));
    }
}

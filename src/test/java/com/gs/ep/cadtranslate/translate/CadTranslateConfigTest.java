package com.gs.ep.cadtranslate.translate;

import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class CadTranslateConfigTest {

    @Test
    void getters_emptyProperties_shouldReturnDefaults() {
        CadTranslateConfig config = new CadTranslateConfig(new Properties());

        assertEquals("Times New Roman", config.getFontName());
        assertEquals(4.0, config.getHeightReduction());
        assertEquals(1.0, config.getMinHeight());
        assertEquals(0.8, config.getWidthFactor());
        assertEquals(SubstitutionMode.NEW_ENTITY, config.getSubstitutionMode());
        assertEquals("translated", config.getOutputDirName());
        assertEquals("_translated", config.getOutputSuffix());
        assertEquals(1, config.getBatchThreads());
        assertEquals("extracted_texts.xlsx", config.getExtractOutput());
        assertFalse(config.isExtractChineseOnly());
    }

    @Test
    void set_overridesValue_shouldFlowIntoSubstitutionOptions() {
        CadTranslateConfig config = new CadTranslateConfig(new Properties());
        config.set(CadTranslateConfig.FONT_NAME, "SimSun");
        config.set(CadTranslateConfig.HEIGHT_REDUCTION, "1.5");
        config.set(CadTranslateConfig.SUBSTITUTION_MODE, "replace");
        config.set(CadTranslateConfig.BATCH_THREADS, "0");

        SubstitutionOptions options = SubstitutionOptions.fromConfig(config);

        assertEquals("TranslatedStyle_SimSun", options.getStyleName());
        assertEquals(3.5, options.reduceHeight(5.0));
        assertEquals(SubstitutionMode.REPLACE, options.getMode());
        assertEquals(1, config.getBatchThreads());
    }

    @Test
    void getExtractExcludeLayers_commaSeparated_shouldSplitAndTrim() {
        CadTranslateConfig config = new CadTranslateConfig(new Properties());
        assertTrue(config.getExtractExcludeLayers().isEmpty());

        config.set(CadTranslateConfig.EXTRACT_EXCLUDE_LAYERS, " Hidden , ,Dims");

        assertEquals(Lists.immutable.with("Hidden", "Dims"), config.getExtractExcludeLayers());
    }

    @Test
    void constructor_classpathResource_shouldLoadBundledConfig() {
        CadTranslateConfig config = new CadTranslateConfig();

        assertEquals("Times New Roman", config.getFontName());
        assertEquals("translation_report.json", config.getReportFileName());
    }

    @Test
    void getSubstitutionMode_unknownName_shouldFail() {
        CadTranslateConfig config = new CadTranslateConfig(new Properties());
        config.set(CadTranslateConfig.SUBSTITUTION_MODE, "rewrite");

        assertThrows(IllegalArgumentException.class, config::getSubstitutionMode);
        assertEquals(SubstitutionMode.NEW_ENTITY, SubstitutionMode.fromName("NEW_ENTITY"));
    }
}

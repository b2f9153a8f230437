package com.gs.ep.cadtranslate.translate;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Loads translator settings from config.properties on the classpath. Every getter has a
 * default, so a missing file only changes nothing. Command line flags override single
 * values through {@link #set(String, String)}.
 */
public class CadTranslateConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(CadTranslateConfig.class);
    private static final String DEFAULT_CONFIG = "config.properties";

    public static final String FONT_NAME = "font.name";
    public static final String HEIGHT_REDUCTION = "text.height.reduction";
    public static final String MIN_HEIGHT = "text.height.min";
    public static final String WIDTH_FACTOR = "style.width.factor";
    public static final String SUBSTITUTION_MODE = "substitution.mode";
    public static final String OUTPUT_DIR_NAME = "output.dir.name";
    public static final String OUTPUT_SUFFIX = "output.suffix";
    public static final String REPORT_FILE = "report.file";
    public static final String BATCH_THREADS = "batch.threads";
    public static final String EXTRACT_MIN_LENGTH = "extract.min.length";
    public static final String EXTRACT_MAX_LENGTH = "extract.max.length";
    public static final String EXTRACT_CHINESE_ONLY = "extract.chinese.only";
    public static final String EXTRACT_OUTPUT = "extract.output";
    public static final String EXTRACT_EXCLUDE_LAYERS = "extract.exclude.layers";

    private final Properties properties = new Properties();

    public CadTranslateConfig() {
        this(DEFAULT_CONFIG);
    }

    public CadTranslateConfig(String configPath) {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(configPath)) {
            if (input == null) {
                LOGGER.warn("Unable to find {}. Using defaults.", configPath);
                return;
            }
            properties.load(input);
        } catch (IOException ex) {
            LOGGER.warn("Failed to read {}. Using defaults.", configPath, ex);
        }
    }

    public CadTranslateConfig(Properties properties) {
        this.properties.putAll(properties);
    }

    public void set(String key, String value) {
        properties.setProperty(key, value);
    }

    public String getFontName() {
        return properties.getProperty(FONT_NAME, "Times New Roman");
    }

    public double getHeightReduction() {
        return Double.parseDouble(properties.getProperty(HEIGHT_REDUCTION, "4"));
    }

    public double getMinHeight() {
        return Double.parseDouble(properties.getProperty(MIN_HEIGHT, "1.0"));
    }

    public double getWidthFactor() {
        return Double.parseDouble(properties.getProperty(WIDTH_FACTOR, "0.8"));
    }

    public SubstitutionMode getSubstitutionMode() {
        return SubstitutionMode.fromName(properties.getProperty(SUBSTITUTION_MODE, SubstitutionMode.NEW_ENTITY.getName()));
    }

    public String getOutputDirName() {
        return properties.getProperty(OUTPUT_DIR_NAME, "translated");
    }

    public String getOutputSuffix() {
        return properties.getProperty(OUTPUT_SUFFIX, "_translated");
    }

    public String getReportFileName() {
        return properties.getProperty(REPORT_FILE, "translation_report.json");
    }

    public int getBatchThreads() {
        return Math.max(1, Integer.parseInt(properties.getProperty(BATCH_THREADS, "1")));
    }

    public int getExtractMinLength() {
        return Integer.parseInt(properties.getProperty(EXTRACT_MIN_LENGTH, "1"));
    }

    public int getExtractMaxLength() {
        return Integer.parseInt(properties.getProperty(EXTRACT_MAX_LENGTH, "1000"));
    }

    public boolean isExtractChineseOnly() {
        return Boolean.parseBoolean(properties.getProperty(EXTRACT_CHINESE_ONLY, "false"));
    }

    public String getExtractOutput() {
        return properties.getProperty(EXTRACT_OUTPUT, "extracted_texts.xlsx");
    }

    /**
     * Comma separated layer names whose text is never extracted. Empty by default.
     */
    public ImmutableList<String> getExtractExcludeLayers() {
        return splitList(properties.getProperty(EXTRACT_EXCLUDE_LAYERS, ""));
    }

    public static ImmutableList<String> splitList(String value) {
        return Lists.immutable.with(value.split(","))
                .collect(String::trim)
                .reject(String::isEmpty);
    }
}

package com.gs.ep.cadtranslate.extract;

/**
 * 文本所在的图纸区域
 */
public enum SourceRegion {
    MODEL_SPACE,
    PAPER_SPACE_LAYOUT,
    BLOCK_DEFINITION,
    RAW_RECORD
}

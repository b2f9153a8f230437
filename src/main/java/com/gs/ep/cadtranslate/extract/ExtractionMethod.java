package com.gs.ep.cadtranslate.extract;

/**
 * 文本提取方法枚举
 * 每种方法对应图纸中的一个结构区域，DXF_TAGS 为结构解析失败时的降级方案
 */
public enum ExtractionMethod {

    /**
     * 模型空间：主绘图区域
     */
    MODEL_SPACE("模型空间", SourceRegion.MODEL_SPACE),

    /**
     * 图纸空间：除 Model 以外的所有布局
     */
    PAPER_SPACE("图纸空间", SourceRegion.PAPER_SPACE_LAYOUT),

    /**
     * 块定义：所有非匿名块
     */
    BLOCK_DEFINITIONS("块定义", SourceRegion.BLOCK_DEFINITION),

    /**
     * DXF标签：直接扫描组码/值行对
     */
    DXF_TAGS("DXF标签", SourceRegion.RAW_RECORD);

    private final String displayName;
    private final SourceRegion region;

    ExtractionMethod(String displayName, SourceRegion region) {
        this.displayName = displayName;
        this.region = region;
    }

    public String getDisplayName() {
        return displayName;
    }

    public SourceRegion getRegion() {
        return region;
    }

    @Override
    public String toString() {
        return displayName;
    }
}

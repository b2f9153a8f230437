package com.gs.ep.cadtranslate.extract;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * 提取策略工厂
 *
 * 结构化策略按固定顺序注册：模型空间 → 图纸空间 → 块定义。
 * 策略类无状态，使用缓存实例。
 */
public class TextSourceFactory {

    private static final ModelSpaceTextSource MODEL_SPACE_SOURCE = new ModelSpaceTextSource();
    private static final PaperSpaceTextSource PAPER_SPACE_SOURCE = new PaperSpaceTextSource();
    private static final BlockDefinitionTextSource BLOCK_DEFINITION_SOURCE = new BlockDefinitionTextSource();
    private static final DxfTagTextSource DXF_TAG_SOURCE = new DxfTagTextSource();

    /**
     * 根据提取方法获取对应的策略实例
     */
    public TextSource getSource(ExtractionMethod method) {
        switch (method) {
            case PAPER_SPACE:
                return PAPER_SPACE_SOURCE;
            case BLOCK_DEFINITIONS:
                return BLOCK_DEFINITION_SOURCE;
            case DXF_TAGS:
                return DXF_TAG_SOURCE;
            case MODEL_SPACE:
            default:
                return MODEL_SPACE_SOURCE;
        }
    }

    /**
     * 结构化解析成功时依次执行的策略
     */
    public ImmutableList<TextSource> structuredSources() {
        return Lists.immutable.with(MODEL_SPACE_SOURCE, PAPER_SPACE_SOURCE, BLOCK_DEFINITION_SOURCE);
    }

    /**
     * 结构化解析失败时的降级策略
     */
    public TextSource fallbackSource() {
        return DXF_TAG_SOURCE;
    }
}

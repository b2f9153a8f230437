package com.gs.ep.cadtranslate.extract;

import com.gs.ep.cadtranslate.model.BlockDefinition;
import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.EntityContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 块定义文本提取
 *
 * 跳过匿名块（名称以 * 开头）。除 TEXT、MTEXT 外，属性定义的默认值和标签名也作为可翻译文字。
 */
public class BlockDefinitionTextSource extends AbstractEntityTextSource {

    public BlockDefinitionTextSource() {
        this(LoggerFactory.getLogger(BlockDefinitionTextSource.class));
    }

    public BlockDefinitionTextSource(Logger logger) {
        super(logger);
    }

    @Override
    public ExtractionMethod getMethod() {
        return ExtractionMethod.BLOCK_DEFINITIONS;
    }

    @Override
    protected Iterable<? extends EntityContainer> containers(CadDocument document) {
        return document.blocks().reject(BlockDefinition::isAnonymous);
    }

    @Override
    protected boolean readsInsertsAndDimensions() {
        return false;
    }

    @Override
    protected boolean readsAttributeDefinitions() {
        return true;
    }
}

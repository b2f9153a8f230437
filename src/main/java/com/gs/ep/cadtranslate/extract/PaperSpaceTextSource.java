package com.gs.ep.cadtranslate.extract;

import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.EntityContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 图纸空间文本提取：逐个遍历 Model 以外的布局，实体种类与模型空间相同
 */
public class PaperSpaceTextSource extends AbstractEntityTextSource {

    public PaperSpaceTextSource() {
        this(LoggerFactory.getLogger(PaperSpaceTextSource.class));
    }

    public PaperSpaceTextSource(Logger logger) {
        super(logger);
    }

    @Override
    public ExtractionMethod getMethod() {
        return ExtractionMethod.PAPER_SPACE;
    }

    @Override
    protected Iterable<? extends EntityContainer> containers(CadDocument document) {
        return document.paperSpaceLayouts();
    }
}

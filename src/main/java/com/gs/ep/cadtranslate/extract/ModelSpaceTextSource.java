package com.gs.ep.cadtranslate.extract;

import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.EntityContainer;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 模型空间文本提取：TEXT、MTEXT、块参照属性值、标注替代文字
 */
public class ModelSpaceTextSource extends AbstractEntityTextSource {

    public ModelSpaceTextSource() {
        this(LoggerFactory.getLogger(ModelSpaceTextSource.class));
    }

    public ModelSpaceTextSource(Logger logger) {
        super(logger);
    }

    @Override
    public ExtractionMethod getMethod() {
        return ExtractionMethod.MODEL_SPACE;
    }

    @Override
    protected Iterable<? extends EntityContainer> containers(CadDocument document) {
        return Lists.immutable.with(document.modelSpace());
    }
}

package com.gs.ep.cadtranslate.extract;

import com.gs.ep.cadtranslate.model.AttDefEntity;
import com.gs.ep.cadtranslate.model.AttribEntity;
import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.CadEntity;
import com.gs.ep.cadtranslate.model.DimensionEntity;
import com.gs.ep.cadtranslate.model.EntityContainer;
import com.gs.ep.cadtranslate.model.HasHeight;
import com.gs.ep.cadtranslate.model.HasInsertionPoint;
import com.gs.ep.cadtranslate.model.HasRotation;
import com.gs.ep.cadtranslate.model.HasStyle;
import com.gs.ep.cadtranslate.model.InsertEntity;
import com.gs.ep.cadtranslate.model.MTextEntity;
import com.gs.ep.cadtranslate.model.TextEntity;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;

import java.nio.file.Path;

/**
 * 结构化提取策略的抽象基类
 *
 * 模板方法：遍历区域 → 遍历实体 → 读取文字。
 * 单个实体读取失败只记录警告；整个策略失败时返回 success=false 的结果。
 */
public abstract class AbstractEntityTextSource implements TextSource {

    protected final Logger logger;

    protected AbstractEntityTextSource(Logger logger) {
        this.logger = logger;
    }

    // ==================== 模板方法 ====================

    @Override
    public ExtractionResult extract(CadDocument document, Path filePath) {
        try {
            MutableList<TextRecord> records = Lists.mutable.empty();
            for (EntityContainer container : containers(document)) {
                collect(container, records);
            }
            logger.debug("{} 提取到 {} 条文本", getMethod(), records.size());
            return ExtractionResult.success(getMethod(), filePath, records);
        } catch (RuntimeException e) {
            logger.error("{} 文本提取失败: {}", getMethod(), e.getMessage(), e);
            return ExtractionResult.failure(getMethod(), filePath, String.valueOf(e.getMessage()));
        }
    }

    /**
     * 该策略遍历的区域，按固定顺序返回
     */
    protected abstract Iterable<? extends EntityContainer> containers(CadDocument document);

    /**
     * 是否读取块参照上的属性值（ATTRIB）和标注替代文字
     */
    protected boolean readsInsertsAndDimensions() {
        return true;
    }

    /**
     * 是否读取属性定义（ATTDEF）的默认值和标签
     */
    protected boolean readsAttributeDefinitions() {
        return false;
    }

    protected void collect(EntityContainer container, MutableList<TextRecord> out) {
        for (CadEntity entity : container.getEntities()) {
            try {
                readEntity(entity, container, out);
            } catch (RuntimeException e) {
                logger.warn("读取实体 {} 失败 ({}): {}", entity, container.getName(), e.getMessage());
            }
        }
    }

    // ==================== 实体读取 ====================

    protected void readEntity(CadEntity entity, EntityContainer container, MutableList<TextRecord> out) {
        if (entity instanceof TextEntity) {
            add(out, entity, ((TextEntity) entity).getText(), EntityKind.TEXT, container, null);
        } else if (entity instanceof MTextEntity) {
            add(out, entity, MTextFormatting.strip(((MTextEntity) entity).getText()), EntityKind.MTEXT, container, null);
        } else if (entity instanceof InsertEntity && readsInsertsAndDimensions()) {
            for (AttribEntity attrib : ((InsertEntity) entity).getAttribs()) {
                add(out, attrib, attrib.getText(), EntityKind.ATTRIB, container, attrib.getTag());
            }
        } else if (entity instanceof DimensionEntity && readsInsertsAndDimensions()) {
            DimensionEntity dimension = (DimensionEntity) entity;
            if (dimension.hasTextOverride()) {
                add(out, dimension, MTextFormatting.strip(dimension.getText()), EntityKind.DIMENSION, container, null);
            }
        } else if (entity instanceof AttDefEntity && readsAttributeDefinitions()) {
            AttDefEntity attdef = (AttDefEntity) entity;
            add(out, attdef, attdef.getText(), EntityKind.ATTDEF, container, attdef.getTag());
            String tag = attdef.getTag();
            if (!tag.isEmpty()) {
                // 标签名不是实体本身的文字，不占用句柄，按文本去重
                out.add(TextRecord.builder(getMethod().getRegion(), tag)
                        .layer(attdef.getLayer())
                        .entityKind(EntityKind.ATTDEF)
                        .containerName(container.getName())
                        .attributeTag(tag)
                        .build());
            }
        }
    }

    /**
     * 生成一条记录；去空白后为空的文字直接丢弃
     */
    protected void add(MutableList<TextRecord> out, CadEntity entity, String text, EntityKind kind,
                       EntityContainer container, String attributeTag) {
        if (text == null || text.isBlank()) {
            return;
        }
        TextRecord.Builder builder = TextRecord.builder(getMethod().getRegion(), text.strip())
                .entityHandle(entity.getHandle())
                .layer(entity.getLayer())
                .entityKind(kind)
                .containerName(container.getName())
                .attributeTag(attributeTag);
        if (entity instanceof HasInsertionPoint) {
            builder.position(((HasInsertionPoint) entity).getInsertionPoint());
        }
        if (entity instanceof HasHeight) {
            builder.height(((HasHeight) entity).getHeight());
        }
        if (entity instanceof HasRotation) {
            builder.rotation(((HasRotation) entity).getRotation());
        }
        if (entity instanceof HasStyle) {
            builder.style(((HasStyle) entity).getStyle());
        }
        out.add(builder.build());
    }
}

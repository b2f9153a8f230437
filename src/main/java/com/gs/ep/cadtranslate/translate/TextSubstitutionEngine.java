package com.gs.ep.cadtranslate.translate;

import com.gs.ep.cadtranslate.extract.MTextFormatting;
import com.gs.ep.cadtranslate.model.AttDefEntity;
import com.gs.ep.cadtranslate.model.AttribEntity;
import com.gs.ep.cadtranslate.model.BlockDefinition;
import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.CadEntity;
import com.gs.ep.cadtranslate.model.DimensionEntity;
import com.gs.ep.cadtranslate.model.EntityContainer;
import com.gs.ep.cadtranslate.model.HasHeight;
import com.gs.ep.cadtranslate.model.HasInsertionPoint;
import com.gs.ep.cadtranslate.model.HasRotation;
import com.gs.ep.cadtranslate.model.HasStyle;
import com.gs.ep.cadtranslate.model.HasText;
import com.gs.ep.cadtranslate.model.InsertEntity;
import com.gs.ep.cadtranslate.model.Layout;
import com.gs.ep.cadtranslate.model.MTextEntity;
import com.gs.ep.cadtranslate.model.Point3;
import com.gs.ep.cadtranslate.model.TextEntity;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 译文写回引擎
 *
 * 处理顺序：模型空间 → 各个非 Model 布局 → 各个非匿名块定义，每个区域单独计数后汇总到文档。
 *
 * TEXT 和 MTEXT 按配置的方式写回：
 * - 替换模式：原地改文字，能设样式的设为译文样式，有字高的按缩减量降低（不低于最小字高）
 * - 新建模式：按原实体的位置、字高、旋转、图层新建 TEXT，再删除原实体
 * 属性值（ATTRIB）、属性定义默认值（ATTDEF）和标注替代文字总是原地替换，删除它们会破坏所属对象。
 *
 * 单个实体出错只计数，不影响其他实体和整个文档。
 */
public class TextSubstitutionEngine {

    private final SmartMatcher matcher;
    private final SubstitutionOptions options;
    private final Logger logger;

    public TextSubstitutionEngine(SubstitutionOptions options) {
        this(new SmartMatcher(), options, LoggerFactory.getLogger(TextSubstitutionEngine.class));
    }

    public TextSubstitutionEngine(SmartMatcher matcher, SubstitutionOptions options, Logger logger) {
        this.matcher = matcher;
        this.options = options;
        this.logger = logger;
    }

    public SubstitutionOptions getOptions() {
        return options;
    }

    public SubstitutionStats substitute(CadDocument document, TranslationMap map) {
        return substitute(document, map, new CancellationToken());
    }

    // ==================== 文档级 ====================

    public SubstitutionStats substitute(CadDocument document, TranslationMap map, CancellationToken token) {
        SubstitutionStats total = new SubstitutionStats();

        logger.info("开始处理模型空间");
        total.add(substituteRegion(document.modelSpace(), map));

        for (Layout layout : document.paperSpaceLayouts()) {
            if (token.isCancelled()) {
                logger.warn("已取消，停止处理剩余区域");
                return total;
            }
            logger.info("开始处理图纸空间: {}", layout.getName());
            total.add(substituteRegion(layout, map));
        }

        logger.info("开始处理块定义");
        for (BlockDefinition block : document.blocks()) {
            if (block.isAnonymous()) {
                continue;
            }
            if (token.isCancelled()) {
                logger.warn("已取消，停止处理剩余区域");
                return total;
            }
            total.add(substituteRegion(block, map));
        }
        return total;
    }

    // ==================== 区域级 ====================

    public SubstitutionStats substituteRegion(EntityContainer container, TranslationMap map) {
        SubstitutionStats stats = new SubstitutionStats();
        MutableList<CadEntity> snapshot = Lists.mutable.withAll(container.getEntities());
        for (CadEntity entity : snapshot) {
            if (entity instanceof TextEntity || entity instanceof MTextEntity) {
                stats.record(substituteText(container, entity, map));
            } else if (entity instanceof InsertEntity) {
                for (AttribEntity attrib : ((InsertEntity) entity).getAttribs()) {
                    stats.record(substituteInPlace(container, attrib, map));
                }
            } else if (entity instanceof AttDefEntity) {
                stats.record(substituteInPlace(container, entity, map));
            } else if (entity instanceof DimensionEntity && ((DimensionEntity) entity).hasTextOverride()) {
                stats.record(substituteInPlace(container, entity, map));
            }
        }
        if (stats.getProcessed() > 0) {
            logger.info("{}: {}", container.getName(), stats);
        }
        return stats;
    }

    // ==================== 实体级 ====================

    /**
     * TEXT / MTEXT：按配置的写回方式处理
     */
    SubstitutionOutcome substituteText(EntityContainer container, CadEntity entity, TranslationMap map) {
        return substitute(container, entity, map, options.getMode());
    }

    SubstitutionOutcome substituteInPlace(EntityContainer container, CadEntity entity, TranslationMap map) {
        return substitute(container, entity, map, SubstitutionMode.REPLACE);
    }

    private SubstitutionOutcome substitute(EntityContainer container, CadEntity entity, TranslationMap map,
                                           SubstitutionMode mode) {
        String label = entity.toString();
        try {
            String original = ((HasText) entity).getText();
            if (original.isBlank()) {
                return SubstitutionOutcome.skipped(label, null);
            }
            MatchResult match = match(entity, original, map);
            if (!match.isMatched()) {
                logger.debug("跳过文本 '{}': {}", original, match.getMethod());
                return SubstitutionOutcome.skipped(label, match.getMethod());
            }
            String translation = match.getTranslation();
            logger.debug("翻译文本: '{}' -> '{}' ({})", original, translation, match.getMethod());
            if (mode == SubstitutionMode.REPLACE) {
                replace(container.getDocument(), entity, translation);
            } else {
                recreate(container, entity, translation);
            }
            return SubstitutionOutcome.translated(label, match.getMethod());
        } catch (RuntimeException e) {
            logger.error("翻译文本实体 {} 时出错: {}", label, e.getMessage(), e);
            return SubstitutionOutcome.errored(label, String.valueOf(e.getMessage()));
        }
    }

    /**
     * 多行文字先按原始内容匹配，再按去掉格式代码后的内容匹配
     */
    private MatchResult match(CadEntity entity, String original, TranslationMap map) {
        MatchResult result = matcher.match(original, map);
        if (result.isMatched() || result.getMethod() == MatchMethod.EMPTY_TRANSLATION
                || !(entity instanceof MTextEntity || entity instanceof DimensionEntity)) {
            return result;
        }
        String plain = MTextFormatting.strip(original);
        if (plain.isBlank() || plain.equals(original)) {
            return result;
        }
        return matcher.match(plain, map);
    }

    private void replace(CadDocument document, CadEntity entity, String translation) {
        ((HasText) entity).setText(translation);
        if (entity instanceof HasStyle) {
            String styleName = ensureStyle(document);
            ((HasStyle) entity).setStyle(styleName);
        }
        if (entity instanceof HasHeight) {
            HasHeight sized = (HasHeight) entity;
            double height = sized.hasHeight() ? sized.getHeight() : SubstitutionOptions.DEFAULT_TEXT_HEIGHT;
            double reduced = options.reduceHeight(height);
            sized.setHeight(reduced);
            logger.trace("字体大小调整: {} -> {}", height, reduced);
        }
    }

    private void recreate(EntityContainer container, CadEntity entity, String translation) {
        Point3 insert = entity instanceof HasInsertionPoint ? ((HasInsertionPoint) entity).getInsertionPoint() : null;
        double height = entity instanceof HasHeight && ((HasHeight) entity).hasHeight()
                ? ((HasHeight) entity).getHeight()
                : SubstitutionOptions.DEFAULT_TEXT_HEIGHT;
        double rotation = entity instanceof HasRotation ? ((HasRotation) entity).getRotation() : 0.0;
        String styleName = ensureStyle(container.getDocument());
        TextEntity created = container.addText(translation, insert == null ? Point3.ORIGIN : insert,
                options.reduceHeight(height), rotation, entity.getLayer(), styleName);
        container.deleteEntity(entity);
        logger.trace("创建新文本实体 {} at {}", created, created.getInsertionPoint());
    }

    private String ensureStyle(CadDocument document) {
        String styleName = options.getStyleName();
        document.styles().ensureStyle(styleName, options.getFontName(), options.getWidthFactor());
        return styleName;
    }
}

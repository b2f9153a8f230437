package com.gs.ep.cadtranslate.extract;

import org.eclipse.collections.api.bag.ImmutableBag;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * 汇总后的提取结果：去重后的记录（保留来源信息）和去重后的清理文本
 */
public final class ExtractedTexts {

    private final ImmutableList<TextRecord> records;
    private final ImmutableList<String> texts;

    public ExtractedTexts(ImmutableList<TextRecord> records, ImmutableList<String> texts) {
        this.records = records;
        this.texts = texts;
    }

    /**
     * 按首次出现顺序排列的记录，文本已清理
     */
    public ImmutableList<TextRecord> getRecords() {
        return records;
    }

    /**
     * 不重复的清理后文本
     */
    public ImmutableList<String> getTexts() {
        return texts;
    }

    /**
     * 按实体类型统计记录数，原始标签记录没有类型，不计入
     */
    public ImmutableBag<EntityKind> countByKind() {
        return records.select(record -> record.getEntityKind() != null).countBy(TextRecord::getEntityKind);
    }

    public int size() {
        return texts.size();
    }

    public boolean isEmpty() {
        return texts.isEmpty();
    }
}

package com.gs.ep.cadtranslate.extract;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 去重与汇总
 *
 * 只有成功的提取结果参与汇总。有句柄的记录按（文件, 句柄）去重，先到先得；
 * 没有句柄的记录按清理后的文本去重。每个值在接收前再经过一次噪声过滤和文本过滤（含排除图层）。
 */
public class TextAggregator {

    private final NoiseFilter noiseFilter;
    private final TextFilter textFilter;
    private final Logger logger;

    public TextAggregator() {
        this(new NoiseFilter(), new TextFilter());
    }

    public TextAggregator(NoiseFilter noiseFilter, TextFilter textFilter) {
        this(noiseFilter, textFilter, LoggerFactory.getLogger(TextAggregator.class));
    }

    public TextAggregator(NoiseFilter noiseFilter, TextFilter textFilter, Logger logger) {
        this.noiseFilter = noiseFilter;
        this.textFilter = textFilter;
        this.logger = logger;
    }

    public ExtractedTexts aggregate(Iterable<ExtractionResult> results) {
        MutableSet<String> seenHandles = Sets.mutable.empty();
        MutableSet<String> seenValues = Sets.mutable.empty();
        MutableSet<String> seenTexts = Sets.mutable.empty();
        MutableList<TextRecord> records = Lists.mutable.empty();
        MutableList<String> texts = Lists.mutable.empty();
        int rejected = 0;

        for (ExtractionResult result : results) {
            if (!result.isSuccess()) {
                logger.warn("{} 提取失败，不参与汇总: {}", result.getMethod(), result.getErrorMessage());
                continue;
            }
            for (TextRecord record : result.getRecords()) {
                String cleaned = TextFilter.clean(record.getRawText());
                if (!noiseFilter.isMeaningful(cleaned) || !textFilter.isValid(cleaned, record.getLayer())) {
                    rejected++;
                    continue;
                }
                boolean fresh = record.hasHandle()
                        ? seenHandles.add(result.getFilePath() + "#" + record.getEntityHandle())
                        : seenValues.add(cleaned);
                if (!fresh) {
                    continue;
                }
                records.add(record.withRawText(cleaned));
                if (seenTexts.add(cleaned)) {
                    texts.add(cleaned);
                }
            }
        }
        logger.debug("汇总完成: {} 条记录, {} 条文本, 过滤 {} 条", records.size(), texts.size(), rejected);
        return new ExtractedTexts(records.toImmutable(), texts.toImmutable());
    }
}

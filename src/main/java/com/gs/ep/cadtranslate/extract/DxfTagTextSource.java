package com.gs.ep.cadtranslate.extract;

import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.DxfTag;
import com.gs.ep.cadtranslate.model.dxf.DxfTagReader;
import org.eclipse.collections.api.set.primitive.ImmutableIntSet;
import org.eclipse.collections.api.set.MutableSet;
import org.eclipse.collections.impl.factory.Sets;
import org.eclipse.collections.impl.factory.primitive.IntSets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * DXF标签文本提取（降级方案）
 *
 * 不解析文档结构，直接把文件当作"组码/值"行对读取。
 * 只看文字、附加文字、样式名、图层名四个组码，值经噪声过滤后按文本去重。
 * 结果没有句柄等来源信息。
 */
public class DxfTagTextSource implements TextSource {

    public static final ImmutableIntSet TEXT_CODES = IntSets.immutable.with(1, 3, 7, 8);

    private final Logger logger;
    private final NoiseFilter noiseFilter;

    public DxfTagTextSource() {
        this(new NoiseFilter(), LoggerFactory.getLogger(DxfTagTextSource.class));
    }

    public DxfTagTextSource(NoiseFilter noiseFilter, Logger logger) {
        this.noiseFilter = noiseFilter;
        this.logger = logger;
    }

    @Override
    public ExtractionMethod getMethod() {
        return ExtractionMethod.DXF_TAGS;
    }

    @Override
    public ExtractionResult extract(CadDocument document, Path filePath) {
        try {
            byte[] data = Files.readAllBytes(filePath);
            MutableSet<String> texts = Sets.mutable.empty();
            for (DxfTag tag : new DxfTagReader(data).readRawTags()) {
                String value = tag.getValue();
                if (TEXT_CODES.contains(tag.getCode()) && !value.isEmpty() && noiseFilter.isMeaningful(value)) {
                    texts.add(value);
                }
            }
            logger.debug("{} 提取到 {} 条文本", getMethod(), texts.size());
            return ExtractionResult.success(getMethod(), filePath,
                    texts.collect(text -> TextRecord.builder(SourceRegion.RAW_RECORD, text).build()).toList());
        } catch (IOException | RuntimeException e) {
            logger.error("{} 文本提取失败: {}", getMethod(), e.getMessage(), e);
            return ExtractionResult.failure(getMethod(), filePath, String.valueOf(e.getMessage()));
        }
    }
}

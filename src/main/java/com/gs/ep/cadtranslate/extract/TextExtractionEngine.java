package com.gs.ep.cadtranslate.extract;

import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.dxf.DxfParser;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 文本提取引擎
 *
 * 先做结构化解析；成功则依次执行模型空间、图纸空间、块定义三个策略，
 * 失败则记录警告并降级为原始标签扫描。结果交给 {@link TextAggregator} 去重汇总。
 */
public class TextExtractionEngine {

    private final DxfParser parser;
    private final TextSourceFactory sourceFactory;
    private final TextAggregator aggregator;
    private final Logger logger;

    public TextExtractionEngine() {
        this(new TextAggregator());
    }

    public TextExtractionEngine(TextAggregator aggregator) {
        this(new DxfParser(), new TextSourceFactory(), aggregator, LoggerFactory.getLogger(TextExtractionEngine.class));
    }

    public TextExtractionEngine(DxfParser parser, TextSourceFactory sourceFactory, TextAggregator aggregator, Logger logger) {
        this.parser = parser;
        this.sourceFactory = sourceFactory;
        this.aggregator = aggregator;
        this.logger = logger;
    }

    // ==================== 单文件 ====================

    /**
     * 对单个文件执行提取链，返回每个策略的原始结果
     */
    public MutableList<ExtractionResult> results(Path file) {
        CadDocument document;
        try {
            document = parser.parse(file);
        } catch (IOException | RuntimeException e) {
            logger.warn("结构化解析失败，使用DXF标签提取: {} ({})", file, e.getMessage());
            return Lists.mutable.with(sourceFactory.fallbackSource().extract(null, file));
        }
        MutableList<ExtractionResult> results = Lists.mutable.empty();
        for (TextSource source : sourceFactory.structuredSources()) {
            results.add(source.extract(document, file));
        }
        return results;
    }

    public ExtractedTexts extractFromFile(Path file) {
        logger.info("开始提取文件: {}", file);
        ExtractedTexts texts = aggregator.aggregate(results(file));
        logger.info("文件 {} 提取到 {} 条文本", file, texts.size());
        return texts;
    }

    // ==================== 目录 ====================

    /**
     * 递归处理目录下所有 .dxf 文件，跨文件统一去重
     */
    public ExtractedTexts extractFromDirectory(Path directory) throws IOException {
        MutableList<Path> files;
        try (Stream<Path> stream = Files.walk(directory)) {
            files = Lists.mutable.withAll(stream
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".dxf"))
                    .sorted()
                    .collect(Collectors.toList()));
        }
        logger.info("找到 {} 个DXF文件", files.size());
        MutableList<ExtractionResult> all = Lists.mutable.empty();
        for (Path file : files) {
            all.addAll(results(file));
        }
        ExtractedTexts texts = aggregator.aggregate(all);
        logger.info("目录 {} 共提取到 {} 条文本", directory, texts.size());
        return texts;
    }

    /**
     * 根据路径类型选择单文件或目录提取
     */
    public ExtractedTexts extract(Path input) throws IOException {
        if (Files.isDirectory(input)) {
            return extractFromDirectory(input);
        }
        if (!Files.isRegularFile(input)) {
            throw new IOException("输入路径不存在: " + input);
        }
        return extractFromFile(input);
    }
}

package com.gs.ep.cadtranslate.translate;

import com.gs.ep.cadtranslate.model.CadDocument;
import com.gs.ep.cadtranslate.model.dxf.DxfParser;
import com.gs.ep.cadtranslate.model.dxf.DxfWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * 单个文档的写回流程：打开 → 替换 → 另存为 {@code <name>_translated.dxf}
 * 没有保存的文档（取消或保存失败）计数为零，汇总只统计真正写出的翻译。
 */
public class DocumentTranslator {

    private static final String DXF_EXTENSION = ".dxf";

    private final DxfParser parser;
    private final DxfWriter writer;
    private final TextSubstitutionEngine engine;
    private final String outputSuffix;
    private final Logger logger;

    public DocumentTranslator(TextSubstitutionEngine engine) {
        this(engine, "_translated");
    }

    public DocumentTranslator(TextSubstitutionEngine engine, String outputSuffix) {
        this(new DxfParser(), new DxfWriter(), engine, outputSuffix, LoggerFactory.getLogger(DocumentTranslator.class));
    }

    public DocumentTranslator(DxfParser parser, DxfWriter writer, TextSubstitutionEngine engine,
                              String outputSuffix, Logger logger) {
        this.parser = parser;
        this.writer = writer;
        this.engine = engine;
        this.outputSuffix = outputSuffix;
        this.logger = logger;
    }

    public DocumentTranslationResult translate(Path input, Path outputDir, TranslationMap map) {
        return translate(input, outputDir, map, new CancellationToken());
    }

    public DocumentTranslationResult translate(Path input, Path outputDir, TranslationMap map, CancellationToken token) {
        logger.info("开始处理文件: {}", input);
        if (token.isCancelled()) {
            return DocumentTranslationResult.cancelled(input, new SubstitutionStats());
        }

        CadDocument document;
        try {
            document = parser.parse(input);
        } catch (IOException | RuntimeException e) {
            logger.error("打开文件 {} 时出错: {}", input, e.getMessage(), e);
            return DocumentTranslationResult.failed(input, "open failed: " + e.getMessage(), new SubstitutionStats());
        }

        SubstitutionStats stats = engine.substitute(document, map, token);
        if (token.isCancelled()) {
            logger.warn("已取消，不保存 {}，丢弃的部分结果: {}", input, stats);
            return DocumentTranslationResult.cancelled(input, new SubstitutionStats());
        }

        Path output = outputDir.resolve(outputName(input));
        try {
            writer.save(document, output);
        } catch (IOException | RuntimeException e) {
            logger.error("保存文件 {} 时出错: {}，丢弃的结果: {}", output, e.getMessage(), stats, e);
            return DocumentTranslationResult.failed(input, "save failed: " + e.getMessage(), new SubstitutionStats());
        }
        logger.info("翻译完成，已保存到: {} ({})", output, stats);
        return DocumentTranslationResult.succeeded(input, output, stats);
    }

    String outputName(Path input) {
        String name = input.getFileName().toString();
        if (name.toLowerCase(Locale.ROOT).endsWith(DXF_EXTENSION)) {
            name = name.substring(0, name.length() - DXF_EXTENSION.length());
        }
        return name + outputSuffix + DXF_EXTENSION;
    }
}

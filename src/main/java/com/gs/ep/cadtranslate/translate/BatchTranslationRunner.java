package com.gs.ep.cadtranslate.translate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 目录批处理
 *
 * 每个文档由一个工作线程从头到尾独占处理，文档之间没有共享的可变状态。
 * 取消标志在开始每个文档前检查。输出保留输入的子目录结构。结束后在输出目录写出 JSON 报告。
 */
public class BatchTranslationRunner {

    public static final String MDC_DOCUMENT = "document";

    private final DocumentTranslator translator;
    private final int threads;
    private final String reportFileName;
    private final ObjectMapper objectMapper;
    private final Logger logger;

    public BatchTranslationRunner(DocumentTranslator translator, int threads) {
        this(translator, threads, "translation_report.json", LoggerFactory.getLogger(BatchTranslationRunner.class));
    }

    public BatchTranslationRunner(DocumentTranslator translator, int threads, String reportFileName, Logger logger) {
        this.translator = translator;
        this.threads = Math.max(1, threads);
        this.reportFileName = reportFileName;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.logger = logger;
    }

    public BatchSummary run(Path inputDir, Path outputDir, TranslationMap map) throws TranslationException {
        return run(inputDir, outputDir, map, new CancellationToken());
    }

    public BatchSummary run(Path inputDir, Path outputDir, TranslationMap map, CancellationToken token)
            throws TranslationException {
        if (!Files.isDirectory(inputDir)) {
            throw new TranslationException("目录不存在: " + inputDir);
        }
        MutableList<Path> files = findDxfFiles(inputDir, outputDir);
        logger.info("找到 {} 个DXF文件", files.size());
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new TranslationException("无法创建输出目录: " + outputDir, e);
        }

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        MutableList<DocumentTranslationResult> results = Lists.mutable.empty();
        try {
            MutableList<Future<DocumentTranslationResult>> futures = Lists.mutable.empty();
            for (Path file : files) {
                Path targetDir = targetDirectory(inputDir, outputDir, file);
                futures.add(pool.submit(() -> translateOne(file, targetDir, map, token)));
            }
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    logger.error("处理文件 {} 时出错", files.get(i), e.getCause());
                    results.add(DocumentTranslationResult.failed(files.get(i), String.valueOf(e.getCause()), new SubstitutionStats()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new TranslationException("批处理被中断", e);
        } finally {
            pool.shutdownNow();
        }

        BatchSummary summary = new BatchSummary(results);
        logger.info("处理完成 - {}", summary);
        writeReport(summary, outputDir.resolve(reportFileName));
        return summary;
    }

    private DocumentTranslationResult translateOne(Path file, Path outputDir, TranslationMap map, CancellationToken token) {
        MDC.put(MDC_DOCUMENT, file.getFileName().toString());
        try {
            return translator.translate(file, outputDir, map, token);
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    /**
     * 输出目录下按输入文件的相对目录建立同样的子目录，不同子目录中的同名文件互不覆盖
     */
    static Path targetDirectory(Path inputDir, Path outputDir, Path file) {
        Path relativeParent = inputDir.relativize(file).getParent();
        return relativeParent == null ? outputDir : outputDir.resolve(relativeParent.toString());
    }

    /**
     * 递归查找 .dxf 文件（不区分大小写），跳过输出目录中的文件，按路径排序
     */
    MutableList<Path> findDxfFiles(Path inputDir, Path outputDir) throws TranslationException {
        Path excluded = outputDir.toAbsolutePath().normalize();
        try (Stream<Path> stream = Files.walk(inputDir)) {
            return Lists.mutable.withAll(stream
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".dxf"))
                    .filter(path -> !path.toAbsolutePath().normalize().startsWith(excluded))
                    .sorted()
                    .collect(Collectors.toList()));
        } catch (IOException e) {
            throw new TranslationException("无法遍历目录: " + inputDir, e);
        }
    }

    private void writeReport(BatchSummary summary, Path reportPath) {
        try {
            objectMapper.writeValue(reportPath.toFile(), summary);
            logger.info("报告已写入 {}", reportPath);
        } catch (IOException e) {
            logger.error("写入报告 {} 失败: {}", reportPath, e.getMessage(), e);
        }
    }
}

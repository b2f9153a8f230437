package com.gs.ep.cadtranslate.app;

import ch.qos.logback.classic.Level;
import com.gs.ep.cadtranslate.extract.EntityKind;
import com.gs.ep.cadtranslate.extract.ExtractedTexts;
import com.gs.ep.cadtranslate.extract.TextAggregator;
import com.gs.ep.cadtranslate.extract.NoiseFilter;
import com.gs.ep.cadtranslate.extract.TextExtractionEngine;
import com.gs.ep.cadtranslate.extract.TextFilter;
import com.gs.ep.cadtranslate.translate.BatchSummary;
import com.gs.ep.cadtranslate.translate.BatchTranslationRunner;
import com.gs.ep.cadtranslate.translate.CadTranslateConfig;
import com.gs.ep.cadtranslate.translate.DocumentTranslator;
import com.gs.ep.cadtranslate.translate.SubstitutionMode;
import com.gs.ep.cadtranslate.translate.SubstitutionOptions;
import com.gs.ep.cadtranslate.translate.SubstitutionStats;
import com.gs.ep.cadtranslate.translate.TextSubstitutionEngine;
import com.gs.ep.cadtranslate.translate.TranslationException;
import com.gs.ep.cadtranslate.translate.TranslationMap;
import com.gs.ep.cadtranslate.translate.TranslationTableLoader;
import com.gs.ep.cadtranslate.translate.TranslationTableWriter;
import org.eclipse.collections.api.bag.ImmutableBag;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Command line entry point.
 *
 * <pre>
 *   extract &lt;input&gt; [-o out.xlsx] [-v] [--chinese-only] [--min-length N] [--max-length N] [--exclude-layers A,B]
 *   backfill [dir] [-e table.xlsx] [-f font] [-o outdir] [-r] [--font-reduction N] [--threads N] [-v]
 * </pre>
 */
public class CadTranslatorCli {

    private static final Logger LOGGER = LoggerFactory.getLogger(CadTranslatorCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "Usage:",
            "  CadTranslatorCli extract <input> [-o out.xlsx] [-v] [--chinese-only] [--min-length N] [--max-length N] [--exclude-layers A,B]",
            "  CadTranslatorCli backfill [dir] [-e table.xlsx] [-f font] [-o outdir] [-r] [--font-reduction N] [--threads N] [-v]");

    private final CadTranslateConfig config;
    private final PrintStream out;
    private final PrintStream err;

    public CadTranslatorCli(CadTranslateConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new CadTranslatorCli(new CadTranslateConfig(), System.out, System.err).run(args);
        System.exit(code);
    }

    public int run(String[] args) {
        if (args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        MutableList<String> rest = Lists.mutable.with(args).subList(1, args.length);
        try {
            switch (args[0]) {
                case "extract":
                    return extract(rest);
                case "backfill":
                    return backfill(rest);
                default:
                    throw new IllegalArgumentException("Unknown command: " + args[0]);
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
    }

    // ==================== extract ====================

    private int extract(MutableList<String> args) {
        String input = null;
        String output = config.getExtractOutput();
        int minLength = config.getExtractMinLength();
        int maxLength = config.getExtractMaxLength();
        boolean chineseOnly = config.isExtractChineseOnly();
        MutableList<String> excludeLayers = Lists.mutable.withAll(config.getExtractExcludeLayers());

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "-o":
                case "--output":
                    output = valueOf(args, ++i, arg);
                    break;
                case "-v":
                case "--verbose":
                    enableVerboseLogging();
                    break;
                case "--chinese-only":
                    chineseOnly = true;
                    break;
                case "--min-length":
                    minLength = intValueOf(args, ++i, arg);
                    break;
                case "--max-length":
                    maxLength = intValueOf(args, ++i, arg);
                    break;
                case "--exclude-layers":
                    excludeLayers.addAllIterable(CadTranslateConfig.splitList(valueOf(args, ++i, arg)));
                    break;
                default:
                    input = positional(arg, input);
            }
        }
        if (input == null) {
            throw new IllegalArgumentException("extract requires an input file or directory");
        }

        TextFilter textFilter = new TextFilter(minLength, maxLength, TextFilter.DEFAULT_EXCLUDE_PATTERNS, chineseOnly,
                excludeLayers);
        TextExtractionEngine engine = new TextExtractionEngine(new TextAggregator(new NoiseFilter(), textFilter));
        Path outputPath = Paths.get(output);
        try {
            ExtractedTexts texts = engine.extract(Paths.get(input));
            if (texts.isEmpty()) {
                LOGGER.warn("No text extracted from {}", input);
                out.println("文本提取失败: 未提取到任何文本");
                return EXIT_FAILURE;
            }
            int rows = new TranslationTableWriter().write(texts, outputPath);
            out.println("文本提取完成，结果已保存到: " + outputPath + " (" + rows + " 条)");
            printStatistics(texts);
            return EXIT_OK;
        } catch (IOException e) {
            LOGGER.error("Extraction failed for {}", input, e);
            out.println("文本提取失败: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    // ==================== backfill ====================

    private int backfill(MutableList<String> args) {
        String directory = null;
        String excel = null;
        String outputDir = null;
        boolean verbose = false;

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            switch (arg) {
                case "-e":
                case "--excel":
                    excel = valueOf(args, ++i, arg);
                    break;
                case "-f":
                case "--font":
                    config.set(CadTranslateConfig.FONT_NAME, valueOf(args, ++i, arg));
                    break;
                case "-o":
                case "--output":
                    outputDir = valueOf(args, ++i, arg);
                    break;
                case "-r":
                case "--replace":
                    config.set(CadTranslateConfig.SUBSTITUTION_MODE, SubstitutionMode.REPLACE.getName());
                    break;
                case "--font-reduction":
                    config.set(CadTranslateConfig.HEIGHT_REDUCTION, String.valueOf(doubleValueOf(args, ++i, arg)));
                    break;
                case "--threads":
                    config.set(CadTranslateConfig.BATCH_THREADS, String.valueOf(intValueOf(args, ++i, arg)));
                    break;
                case "-v":
                case "--verbose":
                    verbose = true;
                    break;
                default:
                    directory = positional(arg, directory);
            }
        }
        if (verbose) {
            enableVerboseLogging();
        }

        Path workDir = Paths.get(directory == null ? "." : directory);
        Path excelPath = workDir.resolve(excel == null ? config.getExtractOutput() : excel);
        Path outputPath = outputDir == null ? workDir.resolve(config.getOutputDirName()) : Paths.get(outputDir);

        TranslationMap map = new TranslationTableLoader().load(excelPath);
        if (map.isEmpty()) {
            err.println("Error: no translations loaded from " + excelPath);
            return EXIT_FAILURE;
        }
        out.println("加载了 " + map.size() + " 条翻译");

        SubstitutionOptions options = SubstitutionOptions.fromConfig(config);
        LOGGER.info("Backfill {} -> {} with {}", workDir, outputPath, options);
        DocumentTranslator translator = new DocumentTranslator(new TextSubstitutionEngine(options), config.getOutputSuffix());
        BatchTranslationRunner runner = new BatchTranslationRunner(translator, config.getBatchThreads(),
                config.getReportFileName(), LoggerFactory.getLogger(BatchTranslationRunner.class));
        try {
            BatchSummary summary = runner.run(workDir, outputPath, map);
            printSummary(summary);
            boolean clean = summary.getTotals().getErrors() == 0 && summary.getFailedFiles() == 0;
            return clean ? EXIT_OK : EXIT_FAILURE;
        } catch (TranslationException e) {
            LOGGER.error("Backfill failed", e);
            err.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private void printStatistics(ExtractedTexts texts) {
        ImmutableBag<EntityKind> counts = texts.countByKind();
        int total = counts.size();
        out.println("提取统计:");
        out.println("  总计文本数量: " + total);
        for (EntityKind kind : EntityKind.values()) {
            int count = counts.occurrencesOf(kind);
            if (count > 0) {
                out.println(String.format(Locale.ROOT, "  %s: %d (%.1f%%)", kind.getDisplayName(), count, count * 100.0 / total));
            }
        }
    }

    private void printSummary(BatchSummary summary) {
        SubstitutionStats totals = summary.getTotals();
        out.println("处理完成:");
        out.println("  文件总数: " + summary.getFileCount());
        out.println("  成功文件: " + summary.getSuccessfulFiles());
        out.println("  处理文本: " + totals.getProcessed());
        out.println("  翻译文本: " + totals.getTranslated());
        out.println("  跳过文本: " + totals.getSkipped());
        out.println("  错误数量: " + totals.getErrors());
    }

    // ==================== 参数解析 ====================

    private static String positional(String arg, String current) {
        if (arg.startsWith("-")) {
            throw new IllegalArgumentException("Unknown option: " + arg);
        }
        if (current != null) {
            throw new IllegalArgumentException("Unexpected argument: " + arg);
        }
        return arg;
    }

    private static String valueOf(MutableList<String> args, int index, String option) {
        if (index >= args.size()) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args.get(index);
    }

    private static int intValueOf(MutableList<String> args, int index, String option) {
        String value = valueOf(args, index, option);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value, e);
        }
    }

    private static double doubleValueOf(MutableList<String> args, int index, String option) {
        String value = valueOf(args, index, option);
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + value, e);
        }
    }

    private static void enableVerboseLogging() {
        org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}

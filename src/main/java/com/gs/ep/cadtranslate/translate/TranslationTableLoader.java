package com.gs.ep.cadtranslate.translate;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 译文表加载器
 *
 * 列布局按行宽推断：3 列及以上时第 2 列为原文、第 3 列为译文（序号, 原文, 译文）；
 * 2 列时第 1 列为原文、第 2 列为译文；不足 2 列的行跳过。
 * 译文为空或为占位符（nan、none、null、n/a、na）的行跳过；同一原文以最后一行为准。
 */
public class TranslationTableLoader {

    private final Logger logger;

    public TranslationTableLoader() {
        this(LoggerFactory.getLogger(TranslationTableLoader.class));
    }

    public TranslationTableLoader(Logger logger) {
        this.logger = logger;
    }

    /**
     * 从内存中的行加载，任何“有序单元格行”的数据源都可以
     */
    public TranslationMap load(Iterable<? extends List<?>> rows) {
        TranslationMap.Builder builder = TranslationMap.builder();
        int rowIndex = 0;
        int accepted = 0;
        for (List<?> row : rows) {
            rowIndex++;
            if (row == null || row.size() < 2) {
                logger.warn("跳过格式不正确的行 {}: {}", rowIndex, row);
                continue;
            }
            Object sourceCell = row.size() >= 3 ? row.get(1) : row.get(0);
            Object targetCell = row.size() >= 3 ? row.get(2) : row.get(1);
            String source = sourceCell == null ? "" : MatchMethod.trim(String.valueOf(sourceCell));
            if (source.isEmpty()) {
                logger.debug("跳过原文为空的行 {}", rowIndex);
                continue;
            }
            String target = targetCell == null ? null : MatchMethod.trim(String.valueOf(targetCell));
            if (TranslationMap.isPlaceholder(target)) {
                logger.debug("跳过无效翻译: '{}' -> '{}'", source, targetCell);
                continue;
            }
            builder.put(source, target);
            accepted++;
        }
        TranslationMap map = builder.build();
        logger.info("译文表加载完成: {} 行, {} 条有效, {} 条映射", rowIndex, accepted, map.size());
        return map;
    }

    /**
     * 读取 Excel 工作簿（.xlsx / .xls）的第一个工作表，首行为表头。
     * 单元格按显示值转为字符串，行宽以表头为准。
     * 文件不存在或无法读取时记录错误并返回空映射。
     */
    public TranslationMap load(Path excelPath) {
        logger.info("开始加载译文表: {}", excelPath);
        if (!Files.isRegularFile(excelPath)) {
            logger.error("译文文件 '{}' 未找到", excelPath);
            return TranslationMap.empty();
        }
        try {
            return load(readRows(excelPath));
        } catch (IOException | RuntimeException e) {
            logger.error("读取译文文件 '{}' 时出错: {}", excelPath, e.getMessage(), e);
            return TranslationMap.empty();
        }
    }

    private MutableList<List<String>> readRows(Path excelPath) throws IOException {
        MutableList<List<String>> rows = Lists.mutable.empty();
        try (Workbook workbook = WorkbookFactory.create(excelPath.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                return rows;
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();
            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null) {
                return rows;
            }
            int width = Math.max(header.getLastCellNum(), 0);
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                MutableList<String> cells = Lists.mutable.empty();
                for (int c = 0; c < width; c++) {
                    Cell cell = row.getCell(c);
                    cells.add(cell == null ? null : formatter.formatCellValue(cell, evaluator));
                }
                rows.add(cells);
            }
        }
        logger.debug("读取 {} 行数据: {}", rows.size(), excelPath);
        return rows;
    }
}

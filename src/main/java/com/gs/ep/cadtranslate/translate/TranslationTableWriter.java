package com.gs.ep.cadtranslate.translate;

import com.gs.ep.cadtranslate.extract.ExtractedTexts;
import com.gs.ep.cadtranslate.extract.TextRecord;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 把提取结果写成待翻译的 Excel 表。
 * 前三列为 序号、原文、译文（空），与加载器的 3 列规则对应；其后是来源信息列。
 */
public class TranslationTableWriter {

    public static final ImmutableList<String> COLUMNS = Lists.immutable.with(
            "序号", "原文", "译文", "类型", "句柄", "图层", "位置", "高度", "旋转角度", "样式", "容器", "属性标签");

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationTableWriter.class);

    /**
     * @return 写入的文本行数
     */
    public int write(ExtractedTexts texts, Path output) throws IOException {
        MutableMap<String, TextRecord> firstRecord = Maps.mutable.empty();
        for (TextRecord record : texts.getRecords()) {
            firstRecord.putIfAbsent(record.getRawText(), record);
        }

        try (Workbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("texts");
            writeHeader(workbook, sheet);
            int index = 0;
            for (String text : texts.getTexts()) {
                index++;
                Row row = sheet.createRow(index);
                row.createCell(0).setCellValue(index);
                row.createCell(1).setCellValue(text);
                row.createCell(2).setCellValue("");
                TextRecord record = firstRecord.get(text);
                if (record != null) {
                    writeProvenance(row, record);
                }
            }
            sheet.setColumnWidth(1, 60 * 256);
            sheet.setColumnWidth(2, 60 * 256);
            sheet.createFreezePane(0, 1);

            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(output)) {
                workbook.write(out);
            }
            LOGGER.info("成功导出 {} 条文本到 {}", index, output);
            return index;
        }
    }

    private static void writeHeader(Workbook workbook, Sheet sheet) {
        Font bold = workbook.createFont();
        bold.setBold(true);
        CellStyle headerStyle = workbook.createCellStyle();
        headerStyle.setFont(bold);
        Row header = sheet.createRow(0);
        for (int i = 0; i < COLUMNS.size(); i++) {
            header.createCell(i).setCellValue(COLUMNS.get(i));
            header.getCell(i).setCellStyle(headerStyle);
        }
    }

    private static void writeProvenance(Row row, TextRecord record) {
        row.createCell(3).setCellValue(record.getEntityKind() == null ? "" : record.getEntityKind().getDisplayName());
        row.createCell(4).setCellValue(nullToEmpty(record.getEntityHandle()));
        row.createCell(5).setCellValue(nullToEmpty(record.getLayer()));
        row.createCell(6).setCellValue(record.getPosition() == null ? "" : record.getPosition().toString());
        if (record.hasHandle()) {
            row.createCell(7).setCellValue(record.getHeight());
            row.createCell(8).setCellValue(record.getRotation());
        }
        row.createCell(9).setCellValue(record.getStyle());
        row.createCell(10).setCellValue(nullToEmpty(record.getContainerName()));
        row.createCell(11).setCellValue(nullToEmpty(record.getAttributeTag()));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

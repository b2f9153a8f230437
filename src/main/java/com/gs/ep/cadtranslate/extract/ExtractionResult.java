package com.gs.ep.cadtranslate.extract;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.nio.file.Path;
import java.util.List;

/**
 * 单个提取策略的执行结果
 */
public final class ExtractionResult {

    private final ExtractionMethod method;
    private final ImmutableList<TextRecord> records;
    private final boolean success;
    private final String errorMessage;
    private final Path filePath;

    private ExtractionResult(ExtractionMethod method, ImmutableList<TextRecord> records, boolean success,
                             String errorMessage, Path filePath) {
        this.method = method;
        this.records = records;
        this.success = success;
        this.errorMessage = errorMessage;
        this.filePath = filePath;
    }

    public static ExtractionResult success(ExtractionMethod method, Path filePath, List<TextRecord> records) {
        return new ExtractionResult(method, Lists.immutable.withAll(records), true, null, filePath);
    }

    public static ExtractionResult failure(ExtractionMethod method, Path filePath, String errorMessage) {
        return new ExtractionResult(method, Lists.immutable.empty(), false, errorMessage, filePath);
    }

    public ExtractionMethod getMethod() {
        return method;
    }

    public ImmutableList<TextRecord> getRecords() {
        return records;
    }

    public boolean isSuccess() {
        return success;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Path getFilePath() {
        return filePath;
    }

    @Override
    public String toString() {
        return success
                ? String.format("%s: %d 条文本", method, records.size())
                : String.format("%s: 失败 (%s)", method, errorMessage);
    }
}

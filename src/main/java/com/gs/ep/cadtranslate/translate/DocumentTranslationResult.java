package com.gs.ep.cadtranslate.translate;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.nio.file.Path;

/**
 * 单个文档的写回结果。打开或保存失败的文档标记为失败，与“没有文字”区分开。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DocumentTranslationResult {

    public enum Status {
        SUCCESS,
        FAILED,
        CANCELLED
    }

    private final String input;
    private final String output;
    private final Status status;
    private final String message;
    private final SubstitutionStats stats;

    private DocumentTranslationResult(Path input, Path output, Status status, String message, SubstitutionStats stats) {
        this.input = input.toString();
        this.output = output == null ? null : output.toString();
        this.status = status;
        this.message = message;
        this.stats = stats;
    }

    public static DocumentTranslationResult succeeded(Path input, Path output, SubstitutionStats stats) {
        return new DocumentTranslationResult(input, output, Status.SUCCESS, null, stats);
    }

    public static DocumentTranslationResult failed(Path input, String message, SubstitutionStats stats) {
        return new DocumentTranslationResult(input, null, Status.FAILED, message, stats);
    }

    public static DocumentTranslationResult cancelled(Path input, SubstitutionStats stats) {
        return new DocumentTranslationResult(input, null, Status.CANCELLED, "cancelled", stats);
    }

    public String getInput() {
        return input;
    }

    public String getOutput() {
        return output;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public String getMessage() {
        return message;
    }

    public SubstitutionStats getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? String.format("成功 - %s (%s)", input, stats)
                : String.format("%s - %s: %s", status, input, message);
    }
}

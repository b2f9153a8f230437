package com.gs.ep.cadtranslate.translate;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.List;

/**
 * 批处理汇总。即使部分文档失败，各项计数仍完整给出。
 */
public class BatchSummary {

    private final MutableList<DocumentTranslationResult> documents;
    private final SubstitutionStats totals = new SubstitutionStats();

    public BatchSummary(List<DocumentTranslationResult> documents) {
        this.documents = Lists.mutable.withAll(documents);
        this.documents.each(result -> totals.add(result.getStats()));
    }

    public List<DocumentTranslationResult> getDocuments() {
        return documents.asUnmodifiable();
    }

    public SubstitutionStats getTotals() {
        return totals;
    }

    public int getFileCount() {
        return documents.size();
    }

    public int getSuccessfulFiles() {
        return documents.count(result -> result.getStatus() == DocumentTranslationResult.Status.SUCCESS);
    }

    public int getFailedFiles() {
        return documents.count(result -> result.getStatus() == DocumentTranslationResult.Status.FAILED);
    }

    public int getCancelledFiles() {
        return documents.count(result -> result.getStatus() == DocumentTranslationResult.Status.CANCELLED);
    }

    @Override
    public String toString() {
        return String.format("文件总数: %d, 成功: %d, 失败: %d, 取消: %d, %s",
                getFileCount(), getSuccessfulFiles(), getFailedFiles(), getCancelledFiles(), totals);
    }
}

package com.gs.ep.cadtranslate.translate;

import java.util.Objects;

/**
 * 处理 / 翻译 / 跳过 / 出错计数，按区域、文档、批次逐级累加。
 * 实例只在单个线程内累加。
 */
public class SubstitutionStats {

    private int processed;
    private int translated;
    private int skipped;
    private int errors;

    public SubstitutionStats() {
    }

    public SubstitutionStats(int processed, int translated, int skipped, int errors) {
        this.processed = processed;
        this.translated = translated;
        this.skipped = skipped;
        this.errors = errors;
    }

    public void record(SubstitutionOutcome outcome) {
        processed++;
        switch (outcome.getState()) {
            case TRANSLATED:
                translated++;
                break;
            case SKIPPED:
                skipped++;
                break;
            case ERRORED:
            default:
                errors++;
                break;
        }
    }

    public SubstitutionStats add(SubstitutionStats other) {
        processed += other.processed;
        translated += other.translated;
        skipped += other.skipped;
        errors += other.errors;
        return this;
    }

    public int getProcessed() {
        return processed;
    }

    public int getTranslated() {
        return translated;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getErrors() {
        return errors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubstitutionStats)) {
            return false;
        }
        SubstitutionStats other = (SubstitutionStats) o;
        return processed == other.processed && translated == other.translated
                && skipped == other.skipped && errors == other.errors;
    }

    @Override
    public int hashCode() {
        return Objects.hash(processed, translated, skipped, errors);
    }

    @Override
    public String toString() {
        return String.format("处理: %d, 翻译: %d, 跳过: %d, 错误: %d", processed, translated, skipped, errors);
    }
}

package com.gs.ep.cadtranslate.translate;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 原文 → 译文映射，不可变，可在多个线程间共享。
 *
 * 键保持首次出现的表格顺序，重复键的译文以最后一行为准。
 * 每种归一化方法的索引（归一化结果 → 表格顺序中第一个键）在构建时一次算好。
 */
public final class TranslationMap {

    public static final ImmutableSet<String> PLACEHOLDERS = Sets.immutable.with("", "nan", "none", "null", "n/a", "na");

    private static final TranslationMap EMPTY = new TranslationMap(new LinkedHashMap<>());

    private final Map<String, String> entries;
    private final Map<MatchMethod, Map<String, String>> indexes = new EnumMap<>(MatchMethod.class);

    private TranslationMap(LinkedHashMap<String, String> entries) {
        this.entries = Collections.unmodifiableMap(entries);
        for (MatchMethod method : MatchMethod.values()) {
            if (!method.isNormalization()) {
                continue;
            }
            Map<String, String> index = new HashMap<>();
            for (String key : entries.keySet()) {
                index.putIfAbsent(method.normalize(key), key);
            }
            indexes.put(method, Collections.unmodifiableMap(index));
        }
    }

    public static TranslationMap empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 译文是否为空或占位符（不区分大小写）
     */
    public static boolean isPlaceholder(String target) {
        return target == null || PLACEHOLDERS.contains(target.strip().toLowerCase(Locale.ROOT));
    }

    public String get(String source) {
        return entries.get(source);
    }

    public boolean containsKey(String source) {
        return entries.containsKey(source);
    }

    /**
     * 按指定归一化方法查找第一个归一化后相等的键
     */
    public String findKey(MatchMethod method, String normalizedText) {
        Map<String, String> index = indexes.get(method);
        if (index == null) {
            throw new IllegalArgumentException(method + " is not a normalization method");
        }
        return index.get(normalizedText);
    }

    public ImmutableList<String> keys() {
        return Lists.immutable.withAll(entries.keySet());
    }

    public Map<String, String> asMap() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "TranslationMap{" + entries.size() + " entries}";
    }

    public static final class Builder {
        private final LinkedHashMap<String, String> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 加入一条映射，已有的原文会被覆盖
         *
         * @throws IllegalArgumentException 原文为空白或译文为空/占位符
         */
        public Builder put(String source, String target) {
            if (source == null || source.isBlank()) {
                throw new IllegalArgumentException("Blank source text");
            }
            if (isPlaceholder(target)) {
                throw new IllegalArgumentException("Placeholder translation for '" + source + "': '" + target + "'");
            }
            entries.put(source, target);
            return this;
        }

        public Builder putAll(Map<String, String> values) {
            values.forEach(this::put);
            return this;
        }

        public TranslationMap build() {
            return new TranslationMap(new LinkedHashMap<>(entries));
        }
    }
}

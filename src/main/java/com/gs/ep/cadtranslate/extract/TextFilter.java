package com.gs.ep.cadtranslate.extract;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.regex.Pattern;

/**
 * 最终汇总阶段使用的文本过滤器：长度窗口 + 排除正则 + 排除图层。
 * 默认排除：纯空白、纯数字/符号、纯分隔符、单个字母、十六进制串。
 * 图层名区分大小写。
 */
public class TextFilter {

    public static final int DEFAULT_MIN_LENGTH = 1;
    public static final int DEFAULT_MAX_LENGTH = 1000;
    public static final ImmutableList<Pattern> DEFAULT_EXCLUDE_PATTERNS = Lists.immutable.with(
            Pattern.compile("^\\s*$", Pattern.UNICODE_CHARACTER_CLASS),
            Pattern.compile("^[\\d\\.\\-\\+\\s]*$"),
            Pattern.compile("^[\\s\\-_\\.]+$"),
            Pattern.compile("^[A-Za-z]$"),
            Pattern.compile("^[A-Fa-f0-9]+$"));

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern CJK = Pattern.compile("\\p{IsHan}");

    private final int minLength;
    private final int maxLength;
    private final ImmutableList<Pattern> excludePatterns;
    private final boolean cjkOnly;
    private final ImmutableSet<String> excludeLayers;

    public TextFilter() {
        this(DEFAULT_MIN_LENGTH, DEFAULT_MAX_LENGTH);
    }

    public TextFilter(int minLength, int maxLength) {
        this(minLength, maxLength, DEFAULT_EXCLUDE_PATTERNS, false);
    }

    public TextFilter(int minLength, int maxLength, Iterable<Pattern> excludePatterns, boolean cjkOnly) {
        this(minLength, maxLength, excludePatterns, cjkOnly, Sets.immutable.empty());
    }

    public TextFilter(int minLength, int maxLength, Iterable<Pattern> excludePatterns, boolean cjkOnly,
                      Iterable<String> excludeLayers) {
        if (minLength < 0 || maxLength < minLength) {
            throw new IllegalArgumentException("Invalid length window [" + minLength + ", " + maxLength + "]");
        }
        this.minLength = minLength;
        this.maxLength = maxLength;
        this.excludePatterns = Lists.immutable.withAll(excludePatterns);
        this.cjkOnly = cjkOnly;
        this.excludeLayers = Sets.immutable.withAll(excludeLayers);
    }

    /**
     * 在默认排除规则基础上追加正则
     */
    public TextFilter withAdditionalPatterns(String... regexes) {
        ImmutableList<Pattern> extra = Lists.immutable.with(regexes).collect(Pattern::compile);
        return new TextFilter(this.minLength, this.maxLength, this.excludePatterns.newWithAll(extra), this.cjkOnly,
                this.excludeLayers);
    }

    /**
     * 只保留包含中文字符的文本
     */
    public TextFilter chineseOnly() {
        return new TextFilter(this.minLength, this.maxLength, this.excludePatterns, true, this.excludeLayers);
    }

    /**
     * 追加排除图层，这些图层上的文本一律丢弃
     */
    public TextFilter withExcludedLayers(Iterable<String> layers) {
        return new TextFilter(this.minLength, this.maxLength, this.excludePatterns, this.cjkOnly,
                this.excludeLayers.newWithAll(layers));
    }

    /**
     * 带图层的校验；图层为 null 时（原始标签记录）只校验文本
     */
    public boolean isValid(String text, String layer) {
        if (layer != null && this.excludeLayers.contains(layer)) {
            return false;
        }
        return this.isValid(text);
    }

    public boolean isValid(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.strip();
        if (trimmed.length() < this.minLength || trimmed.length() > this.maxLength) {
            return false;
        }
        if (this.excludePatterns.anySatisfy(pattern -> pattern.matcher(trimmed).find())) {
            return false;
        }
        return !this.cjkOnly || CJK.matcher(trimmed).find();
    }

    /**
     * 将连续空白压缩为一个空格并去掉首尾空白
     */
    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    public int getMinLength() {
        return minLength;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public ImmutableList<Pattern> getExcludePatterns() {
        return excludePatterns;
    }

    public ImmutableSet<String> getExcludeLayers() {
        return excludeLayers;
    }
}

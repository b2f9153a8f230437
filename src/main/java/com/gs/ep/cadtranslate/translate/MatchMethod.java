package com.gs.ep.cadtranslate.translate;

import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

/**
 * 匹配方法标签。前三种为归一化方法，按声明顺序依次尝试。
 */
public enum MatchMethod {

    DIRECT("direct", null),
    STRIP_ALL_WHITESPACE("strip-all-whitespace", text -> Patterns.WHITESPACE.matcher(text).replaceAll("")),
    SINGLE_SPACE("single-space", text -> trim(Patterns.WHITESPACE.matcher(text).replaceAll(" "))),
    TRIM_ONLY("trim-only", MatchMethod::trim),
    EMPTY_TRANSLATION("empty translation", null),
    NO_MATCH("no match", null),
    INVALID_TEXT("invalid text", null);

    private final String tag;
    private final UnaryOperator<String> normalizer;

    MatchMethod(String tag, UnaryOperator<String> normalizer) {
        this.tag = tag;
        this.normalizer = normalizer;
    }

    public String getTag() {
        return tag;
    }

    public boolean isNormalization() {
        return normalizer != null;
    }

    public String normalize(String text) {
        if (normalizer == null) {
            throw new UnsupportedOperationException(tag + " is not a normalization method");
        }
        return normalizer.apply(text);
    }

    /**
     * 去掉首尾的 Unicode 空白，包括 {@link String#strip()} 不处理的不换行空格（U+00A0、U+202F 等）
     */
    public static String trim(String text) {
        return Patterns.EDGE_WHITESPACE.matcher(text).replaceAll("");
    }

    @Override
    public String toString() {
        return tag;
    }

    private static final class Patterns {
        private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
        private static final Pattern EDGE_WHITESPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);
    }
}

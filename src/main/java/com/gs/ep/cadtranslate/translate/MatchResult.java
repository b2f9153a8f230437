package com.gs.ep.cadtranslate.translate;

/**
 * 匹配结果：译文（未命中时为 null）、匹配方法和命中的原文键
 */
public final class MatchResult {

    private final String translation;
    private final MatchMethod method;
    private final String matchedKey;

    private MatchResult(String translation, MatchMethod method, String matchedKey) {
        this.translation = translation;
        this.method = method;
        this.matchedKey = matchedKey;
    }

    public static MatchResult matched(String translation, MatchMethod method, String matchedKey) {
        return new MatchResult(translation, method, matchedKey);
    }

    public static MatchResult unmatched(MatchMethod method, String matchedKey) {
        return new MatchResult(null, method, matchedKey);
    }

    public boolean isMatched() {
        return translation != null;
    }

    public String getTranslation() {
        return translation;
    }

    public MatchMethod getMethod() {
        return method;
    }

    public String getMatchedKey() {
        return matchedKey;
    }

    @Override
    public String toString() {
        return isMatched() ? method + " -> " + translation : method.toString();
    }
}

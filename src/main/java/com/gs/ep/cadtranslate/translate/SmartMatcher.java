package com.gs.ep.cadtranslate.translate;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * 智能匹配器
 *
 * 匹配顺序：
 * 1. 精确匹配，命中即返回 direct；命中但译文为空时返回 empty translation，不再继续
 * 2. 依次尝试 strip-all-whitespace、single-space、trim-only 三种归一化；
 *    每种方法先对整张表做完再换下一种方法，取表格顺序中第一个归一化后相等的键
 * 3. 都不命中则返回 no match
 *
 * 手工编辑的译文表常会多出或丢掉空白，精确匹配优先保留有意为之的空白差异。
 */
public class SmartMatcher {

    public static final ImmutableList<MatchMethod> NORMALIZATION_ORDER = Lists.immutable.with(
            MatchMethod.STRIP_ALL_WHITESPACE, MatchMethod.SINGLE_SPACE, MatchMethod.TRIM_ONLY);

    public MatchResult match(String text, TranslationMap map) {
        if (text == null || text.isBlank()) {
            return MatchResult.unmatched(MatchMethod.INVALID_TEXT, null);
        }
        if (map.containsKey(text)) {
            return resolve(text, map.get(text), MatchMethod.DIRECT);
        }
        for (MatchMethod method : NORMALIZATION_ORDER) {
            String key = map.findKey(method, method.normalize(text));
            if (key != null) {
                return resolve(key, map.get(key), method);
            }
        }
        return MatchResult.unmatched(MatchMethod.NO_MATCH, null);
    }

    private static MatchResult resolve(String key, String target, MatchMethod method) {
        if (target == null || target.isBlank()) {
            return MatchResult.unmatched(MatchMethod.EMPTY_TRANSLATION, key);
        }
        return MatchResult.matched(MatchMethod.trim(target), method, key);
    }
}

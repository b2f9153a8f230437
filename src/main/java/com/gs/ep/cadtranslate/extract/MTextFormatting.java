package com.gs.ep.cadtranslate.extract;

import java.util.regex.Pattern;

/**
 * 多行文字格式代码处理。
 * 内联控制序列（反斜杠 + 字母 + 参数 + 分号，如 {@code \fArial|b0;}）和花括号分组整体删除，不做解释。
 */
public final class MTextFormatting {

    private static final Pattern CONTROL_SEQUENCE = Pattern.compile("\\\\[A-Za-z][^;]*;");
    private static final Pattern BRACE_GROUP = Pattern.compile("\\{[^}]*\\}");

    private MTextFormatting() {
    }

    public static String strip(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String withoutControls = CONTROL_SEQUENCE.matcher(text).replaceAll("");
        return BRACE_GROUP.matcher(withoutControls).replaceAll("");
    }
}

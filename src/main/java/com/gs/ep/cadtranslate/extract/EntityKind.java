package com.gs.ep.cadtranslate.extract;

/**
 * 承载文字的实体种类
 */
public enum EntityKind {

    TEXT("单行文字"),
    MTEXT("多行文字"),
    ATTRIB("属性"),
    DIMENSION("标注文字"),
    ATTDEF("属性定义");

    private final String displayName;

    EntityKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}

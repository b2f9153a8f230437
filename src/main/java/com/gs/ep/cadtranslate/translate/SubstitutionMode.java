package com.gs.ep.cadtranslate.translate;

/**
 * 译文写回方式
 */
public enum SubstitutionMode {

    /**
     * 原地修改实体文字
     */
    REPLACE("replace", "原地替换"),

    /**
     * 新建单行文字实体并删除原实体
     */
    NEW_ENTITY("new-entity", "新建实体");

    private final String name;
    private final String displayName;

    SubstitutionMode(String name, String displayName) {
        this.name = name;
        this.displayName = displayName;
    }

    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static SubstitutionMode fromName(String name) {
        for (SubstitutionMode mode : values()) {
            if (mode.name.equalsIgnoreCase(name.trim()) || mode.name().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown substitution mode: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}

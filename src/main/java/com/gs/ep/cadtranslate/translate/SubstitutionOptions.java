package com.gs.ep.cadtranslate.translate;

/**
 * 替换参数：目标字体、字高缩减量、最小字高、样式宽度因子和写回方式
 */
public final class SubstitutionOptions {

    public static final String STYLE_PREFIX = "TranslatedStyle_";
    public static final double DEFAULT_TEXT_HEIGHT = 2.5;

    private final String fontName;
    private final double heightReduction;
    private final double minHeight;
    private final double widthFactor;
    private final SubstitutionMode mode;

    private SubstitutionOptions(Builder builder) {
        this.fontName = builder.fontName;
        this.heightReduction = builder.heightReduction;
        this.minHeight = builder.minHeight;
        this.widthFactor = builder.widthFactor;
        this.mode = builder.mode;
    }

    public static SubstitutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SubstitutionOptions fromConfig(CadTranslateConfig config) {
        return builder()
                .fontName(config.getFontName())
                .heightReduction(config.getHeightReduction())
                .minHeight(config.getMinHeight())
                .widthFactor(config.getWidthFactor())
                .mode(config.getSubstitutionMode())
                .build();
    }

    public String getFontName() {
        return fontName;
    }

    public double getHeightReduction() {
        return heightReduction;
    }

    public double getMinHeight() {
        return minHeight;
    }

    public double getWidthFactor() {
        return widthFactor;
    }

    public SubstitutionMode getMode() {
        return mode;
    }

    /**
     * 由字体名确定的样式名，空格替换为下划线
     */
    public String getStyleName() {
        return STYLE_PREFIX + fontName.replace(' ', '_');
    }

    public double reduceHeight(double height) {
        return Math.max(height - heightReduction, minHeight);
    }

    @Override
    public String toString() {
        return String.format("SubstitutionOptions{font=%s, reduction=%s, mode=%s}", fontName, heightReduction, mode);
    }

    public static final class Builder {
        private String fontName = "Times New Roman";
        private double heightReduction = 4;
        private double minHeight = 1.0;
        private double widthFactor = 0.8;
        private SubstitutionMode mode = SubstitutionMode.NEW_ENTITY;

        private Builder() {
        }

        public Builder fontName(String fontName) {
            this.fontName = fontName;
            return this;
        }

        public Builder heightReduction(double heightReduction) {
            this.heightReduction = heightReduction;
            return this;
        }

        public Builder minHeight(double minHeight) {
            this.minHeight = minHeight;
            return this;
        }

        public Builder widthFactor(double widthFactor) {
            this.widthFactor = widthFactor;
            return this;
        }

        public Builder mode(SubstitutionMode mode) {
            this.mode = mode;
            return this;
        }

        public SubstitutionOptions build() {
            if (fontName == null || fontName.isBlank()) {
                throw new IllegalArgumentException("Font name must not be blank");
            }
            return new SubstitutionOptions(this);
        }
    }
}

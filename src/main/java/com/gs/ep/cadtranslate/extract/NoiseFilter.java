package com.gs.ep.cadtranslate.extract;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 噪声过滤器：判断一个字符串是有意义的文字还是 DXF 技术值。
 *
 * 规则按顺序执行，命中任一条即判定为噪声：
 * 1. 去空白后为空
 * 2. 完整的数值
 * 3. 坐标格式（逗号分隔的数字组）
 * 4. 长度不超过 8 的十六进制串（句柄）
 * 5. 保留图层名或图层名前缀
 * 6. 长度不超过 4 的十六进制串
 * 7. 结构关键字（不区分大小写）
 * 8. 去空白后不足 2 个字符
 *
 * 无状态，线程安全。
 */
public class NoiseFilter {

    public static final ImmutableSet<String> DEFAULT_LAYER_TOKENS =
            Sets.immutable.with("0", "DEFPOINTS", "TEXT", "DIM", "HATCH");
    public static final ImmutableList<String> DEFAULT_LAYER_PREFIXES =
            Lists.immutable.with("LAYER_", "L_", "LAY_");
    public static final ImmutableSet<String> DEFAULT_KEYWORDS = Sets.immutable.with(
            "SECTION", "ENDSEC", "HEADER", "CLASSES", "TABLES", "BLOCKS", "ENTITIES",
            "OBJECTS", "EOF", "LINE", "CIRCLE", "ARC", "TEXT", "MTEXT", "INSERT",
            "POLYLINE", "LWPOLYLINE", "POINT", "ELLIPSE", "SPLINE", "HATCH",
            "DIMENSION", "LEADER", "VIEWPORT", "ACDBTEXT", "ACDBMTEXT");

    private static final Pattern NUMBER = Pattern.compile(
            "[+-]?((\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?|(?i:nan|inf|infinity))");
    private static final Pattern COORDINATES = Pattern.compile(
            "-?(\\d+\\.?\\d*|\\.\\d+)(,-?(\\d+\\.?\\d*|\\.\\d+))+");
    private static final Pattern HEX = Pattern.compile("[0-9A-Fa-f]+");

    private final ImmutableSet<String> layerTokens;
    private final ImmutableList<String> layerPrefixes;
    private final ImmutableSet<String> keywords;
    private final int handleLength;
    private final int shortHexLength;
    private final int minLength;

    public NoiseFilter() {
        this(builder());
    }

    private NoiseFilter(Builder builder) {
        this.layerTokens = builder.layerTokens;
        this.layerPrefixes = builder.layerPrefixes;
        this.keywords = builder.keywords.collect(k -> k.toUpperCase(Locale.ROOT));
        this.handleLength = builder.handleLength;
        this.shortHexLength = builder.shortHexLength;
        this.minLength = builder.minLength;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isMeaningful(String value) {
        if (value == null) {
            return false;
        }
        String text = value.strip();
        if (text.isEmpty()) {
            return false;
        }
        if (isNumeric(text) || isCoordinate(text)) {
            return false;
        }
        if (isHex(text, this.handleLength)) {
            return false;
        }
        if (this.isLayerName(text)) {
            return false;
        }
        if (isHex(text, this.shortHexLength)) {
            return false;
        }
        if (this.keywords.contains(text.toUpperCase(Locale.ROOT))) {
            return false;
        }
        return text.length() >= this.minLength;
    }

    static boolean isNumeric(String text) {
        return NUMBER.matcher(text).matches();
    }

    static boolean isCoordinate(String text) {
        return COORDINATES.matcher(text).matches();
    }

    static boolean isHex(String text, int maxLength) {
        return text.length() <= maxLength && HEX.matcher(text).matches();
    }

    private boolean isLayerName(String text) {
        if (this.layerTokens.contains(text)) {
            return true;
        }
        return this.layerPrefixes.anySatisfy(text::startsWith);
    }

    public static final class Builder {
        private ImmutableSet<String> layerTokens = DEFAULT_LAYER_TOKENS;
        private ImmutableList<String> layerPrefixes = DEFAULT_LAYER_PREFIXES;
        private ImmutableSet<String> keywords = DEFAULT_KEYWORDS;
        private int handleLength = 8;
        private int shortHexLength = 4;
        private int minLength = 2;

        private Builder() {
        }

        public Builder layerTokens(Iterable<String> tokens) {
            this.layerTokens = Sets.immutable.withAll(tokens);
            return this;
        }

        public Builder addLayerTokens(String... tokens) {
            this.layerTokens = this.layerTokens.newWithAll(Lists.immutable.with(tokens));
            return this;
        }

        public Builder layerPrefixes(Iterable<String> prefixes) {
            this.layerPrefixes = Lists.immutable.withAll(prefixes);
            return this;
        }

        public Builder addLayerPrefixes(String... prefixes) {
            this.layerPrefixes = this.layerPrefixes.newWithAll(Lists.immutable.with(prefixes));
            return this;
        }

        public Builder keywords(Iterable<String> keywords) {
            this.keywords = Sets.immutable.withAll(keywords);
            return this;
        }

        public Builder addKeywords(String... keywords) {
            this.keywords = this.keywords.newWithAll(Lists.immutable.with(keywords));
            return this;
        }

        public Builder handleLength(int handleLength) {
            this.handleLength = handleLength;
            return this;
        }

        public Builder shortHexLength(int shortHexLength) {
            this.shortHexLength = shortHexLength;
            return this;
        }

        public Builder minLength(int minLength) {
            this.minLength = minLength;
            return this;
        }

        public NoiseFilter build() {
            return new NoiseFilter(this);
        }
    }
}

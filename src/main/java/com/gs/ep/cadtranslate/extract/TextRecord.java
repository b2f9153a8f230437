package com.gs.ep.cadtranslate.extract;

import com.gs.ep.cadtranslate.model.Point3;

/**
 * 一条提取出的文本及其来源信息，不可变。
 * 原始标签扫描得到的记录没有句柄、位置等来源信息。
 */
public final class TextRecord {

    private final SourceRegion sourceRegion;
    private final String entityHandle;
    private final String rawText;
    private final String layer;
    private final Point3 position;
    private final double height;
    private final double rotation;
    private final String style;
    private final EntityKind entityKind;
    private final String containerName;
    private final String attributeTag;

    private TextRecord(Builder builder) {
        this.sourceRegion = builder.sourceRegion;
        this.entityHandle = builder.entityHandle;
        this.rawText = builder.rawText;
        this.layer = builder.layer;
        this.position = builder.position;
        this.height = Math.max(0.0, builder.height);
        this.rotation = builder.rotation;
        this.style = builder.style == null ? "" : builder.style;
        this.entityKind = builder.entityKind;
        this.containerName = builder.containerName;
        this.attributeTag = builder.attributeTag;
    }

    public static Builder builder(SourceRegion region, String rawText) {
        return new Builder(region, rawText);
    }

    public SourceRegion getSourceRegion() {
        return sourceRegion;
    }

    public String getEntityHandle() {
        return entityHandle;
    }

    public boolean hasHandle() {
        return entityHandle != null && !entityHandle.isEmpty();
    }

    public String getRawText() {
        return rawText;
    }

    public String getLayer() {
        return layer;
    }

    public Point3 getPosition() {
        return position;
    }

    public double getHeight() {
        return height;
    }

    public double getRotation() {
        return rotation;
    }

    public String getStyle() {
        return style;
    }

    public EntityKind getEntityKind() {
        return entityKind;
    }

    public String getContainerName() {
        return containerName;
    }

    public String getAttributeTag() {
        return attributeTag;
    }

    /**
     * 返回文本替换为 {@code text} 的副本，其余来源信息不变
     */
    public TextRecord withRawText(String text) {
        return new Builder(this).rawText(text).build();
    }

    @Override
    public String toString() {
        return String.format("TextRecord{%s, handle=%s, kind=%s, text='%s'}", sourceRegion, entityHandle, entityKind, rawText);
    }

    public static final class Builder {
        private final SourceRegion sourceRegion;
        private String rawText;
        private String entityHandle;
        private String layer;
        private Point3 position;
        private double height;
        private double rotation;
        private String style;
        private EntityKind entityKind;
        private String containerName;
        private String attributeTag;

        private Builder(SourceRegion sourceRegion, String rawText) {
            this.sourceRegion = sourceRegion;
            this.rawText = rawText;
        }

        private Builder(TextRecord record) {
            this.sourceRegion = record.sourceRegion;
            this.rawText = record.rawText;
            this.entityHandle = record.entityHandle;
            this.layer = record.layer;
            this.position = record.position;
            this.height = record.height;
            this.rotation = record.rotation;
            this.style = record.style;
            this.entityKind = record.entityKind;
            this.containerName = record.containerName;
            this.attributeTag = record.attributeTag;
        }

        public Builder rawText(String rawText) {
            this.rawText = rawText;
            return this;
        }

        public Builder entityHandle(String entityHandle) {
            this.entityHandle = entityHandle;
            return this;
        }

        public Builder layer(String layer) {
            this.layer = layer;
            return this;
        }

        public Builder position(Point3 position) {
            this.position = position;
            return this;
        }

        public Builder height(double height) {
            this.height = height;
            return this;
        }

        public Builder rotation(double rotation) {
            this.rotation = rotation;
            return this;
        }

        public Builder style(String style) {
            this.style = style;
            return this;
        }

        public Builder entityKind(EntityKind entityKind) {
            this.entityKind = entityKind;
            return this;
        }

        public Builder containerName(String containerName) {
            this.containerName = containerName;
            return this;
        }

        public Builder attributeTag(String attributeTag) {
            this.attributeTag = attributeTag;
            return this;
        }

        public TextRecord build() {
            return new TextRecord(this);
        }
    }
}

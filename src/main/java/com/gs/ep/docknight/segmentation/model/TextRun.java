package com.gs.ep.docknight.segmentation.model;

import java.util.Objects;

/**
 * 页面上的一个文本片段（glyph run），由上游解析器产生，本引擎只读不写。
 *
 * <p>坐标系：原点在左下角，Y 轴向上。{@code y} 是字形框的下边缘，
 * {@code height} 是完整字形框高度 (ascender - descender) * fontSize / 1000。</p>
 */
public final class TextRun {

    /** Descender in 1/1000 em used when the parser did not supply font metrics. */
    public static final double DEFAULT_DESCENDER = -200;

    private final String text;
    private final double x;
    private final double y;
    private final double width;
    private final double height;
    private final String fontName;
    private final double fontSize;
    private final double charSpacing;
    private final double wordSpacing;
    private final double horizontalScaling;
    private final FillColor fillColor;
    private final FontMetrics fontMetrics;

    private TextRun(Builder builder) {
        this.text = Objects.requireNonNull(builder.text, "text");
        this.x = builder.x;
        this.y = builder.y;
        this.width = builder.width;
        this.height = builder.height;
        this.fontName = Objects.requireNonNull(builder.fontName, "fontName");
        this.fontSize = builder.fontSize;
        this.charSpacing = builder.charSpacing;
        this.wordSpacing = builder.wordSpacing;
        this.horizontalScaling = builder.horizontalScaling;
        this.fillColor = builder.fillColor == null ? FillColor.BLACK : builder.fillColor;
        this.fontMetrics = builder.fontMetrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getText() {
        return text;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public String getFontName() {
        return fontName;
    }

    public double getFontSize() {
        return fontSize;
    }

    /** PDF Tc operator value. */
    public double getCharSpacing() {
        return charSpacing;
    }

    /** PDF Tw operator value. */
    public double getWordSpacing() {
        return wordSpacing;
    }

    /** PDF Tz operator value, in percent (100 = unscaled). */
    public double getHorizontalScaling() {
        return horizontalScaling;
    }

    public FillColor getFillColor() {
        return fillColor;
    }

    /**
     * @return font metrics, or {@code null} when the parser could not resolve them
     */
    public FontMetrics getFontMetrics() {
        return fontMetrics;
    }

    public double getRight() {
        return x + width;
    }

    public double getTop() {
        return y + height;
    }

    public double getCenterX() {
        return x + width / 2;
    }

    public double getCenterY() {
        return y + height / 2;
    }

    /**
     * 基线位置：y - descender * fontSize / 1000。
     * 对混排字号的行，基线比字形框下边缘稳定得多。
     */
    public double getBaselineY() {
        double descender = fontMetrics != null ? fontMetrics.getDescender() : DEFAULT_DESCENDER;
        return y - (descender * fontSize) / 1000;
    }

    public TextBounds getBounds() {
        return new TextBounds(x, y, width, height);
    }

    public Builder toBuilder() {
        return new Builder()
                .text(text)
                .x(x)
                .y(y)
                .width(width)
                .height(height)
                .fontName(fontName)
                .fontSize(fontSize)
                .charSpacing(charSpacing)
                .wordSpacing(wordSpacing)
                .horizontalScaling(horizontalScaling)
                .fillColor(fillColor)
                .fontMetrics(fontMetrics);
    }

    @Override
    public String toString() {
        return "TextRun{'" + text + "' x=" + x + " y=" + y + " w=" + width + " h=" + height
                + " font=" + fontName + "@" + fontSize + "}";
    }

    public static final class Builder {
        private String text = "";
        private double x;
        private double y;
        private double width;
        private double height;
        private String fontName = "";
        private double fontSize = 12;
        private double charSpacing;
        private double wordSpacing;
        private double horizontalScaling = 100;
        private FillColor fillColor;
        private FontMetrics fontMetrics;

        private Builder() {
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder x(double x) {
            this.x = x;
            return this;
        }

        public Builder y(double y) {
            this.y = y;
            return this;
        }

        public Builder width(double width) {
            this.width = width;
            return this;
        }

        public Builder height(double height) {
            this.height = height;
            return this;
        }

        public Builder fontName(String fontName) {
            this.fontName = fontName;
            return this;
        }

        public Builder fontSize(double fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder charSpacing(double charSpacing) {
            this.charSpacing = charSpacing;
            return this;
        }

        public Builder wordSpacing(double wordSpacing) {
            this.wordSpacing = wordSpacing;
            return this;
        }

        public Builder horizontalScaling(double horizontalScaling) {
            this.horizontalScaling = horizontalScaling;
            return this;
        }

        public Builder fillColor(FillColor fillColor) {
            this.fillColor = fillColor;
            return this;
        }

        public Builder fontMetrics(FontMetrics fontMetrics) {
            this.fontMetrics = fontMetrics;
            return this;
        }

        public TextRun build() {
            return new TextRun(this);
        }
    }
}

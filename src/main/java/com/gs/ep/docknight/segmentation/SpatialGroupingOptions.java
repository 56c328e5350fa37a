package com.gs.ep.docknight.segmentation;

import java.util.Objects;

/**
 * 空间分组参数
 *
 * <p>所有阈值均为经验值，修改任何一个都属于调参，需要在样本集上重新验证。</p>
 */
public final class SpatialGroupingOptions {

    // ==================== 默认值 ====================

    public static final double DEFAULT_LINE_TOLERANCE_RATIO = 0.1;
    public static final double DEFAULT_HORIZONTAL_GAP_RATIO = 1.5;
    public static final double DEFAULT_VERTICAL_GAP_RATIO = 1.2;
    public static final double DEFAULT_FONT_SIZE_TOLERANCE_RATIO = 0.1;
    public static final double DEFAULT_COLUMN_GAP_RATIO = 3.0;
    public static final int DEFAULT_MAX_PAGE_COLUMNS = 3;
    public static final double DEFAULT_FULL_WIDTH_RATIO = 0.85;

    private static final SpatialGroupingOptions DEFAULTS = builder().build();

    private final double lineToleranceRatio;
    private final double horizontalGapRatio;
    private final double verticalGapRatio;
    private final ColorMatchingMode colorMatching;
    private final double fontSizeToleranceRatio;
    private final boolean enableColumnSeparation;
    private final double columnGapRatio;
    private final boolean enablePageColumnDetection;
    private final int maxPageColumns;
    private final double fullWidthRatio;
    private final WritingModeOption writingMode;
    private final VerticalColumnOrder verticalColumnOrder;
    private final InlineDirectionMode inlineDirection;

    private SpatialGroupingOptions(Builder builder) {
        this.lineToleranceRatio = builder.lineToleranceRatio;
        this.horizontalGapRatio = builder.horizontalGapRatio;
        this.verticalGapRatio = builder.verticalGapRatio;
        this.colorMatching = builder.colorMatching;
        this.fontSizeToleranceRatio = builder.fontSizeToleranceRatio;
        this.enableColumnSeparation = builder.enableColumnSeparation;
        this.columnGapRatio = builder.columnGapRatio;
        this.enablePageColumnDetection = builder.enablePageColumnDetection;
        this.maxPageColumns = builder.maxPageColumns;
        this.fullWidthRatio = builder.fullWidthRatio;
        this.writingMode = builder.writingMode;
        this.verticalColumnOrder = builder.verticalColumnOrder;
        this.inlineDirection = builder.inlineDirection;
    }

    public static SpatialGroupingOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .lineToleranceRatio(lineToleranceRatio)
                .horizontalGapRatio(horizontalGapRatio)
                .verticalGapRatio(verticalGapRatio)
                .colorMatching(colorMatching)
                .fontSizeToleranceRatio(fontSizeToleranceRatio)
                .enableColumnSeparation(enableColumnSeparation)
                .columnGapRatio(columnGapRatio)
                .enablePageColumnDetection(enablePageColumnDetection)
                .maxPageColumns(maxPageColumns)
                .fullWidthRatio(fullWidthRatio)
                .writingMode(writingMode)
                .verticalColumnOrder(verticalColumnOrder)
                .inlineDirection(inlineDirection);
    }

    /** Baseline tolerance for line clustering, as a fraction of font size. */
    public double getLineToleranceRatio() {
        return lineToleranceRatio;
    }

    /** Max horizontal gap between adjacent runs, as a multiple of the expected gap. */
    public double getHorizontalGapRatio() {
        return horizontalGapRatio;
    }

    /** Max vertical gap between lines, as a multiple of line height. */
    public double getVerticalGapRatio() {
        return verticalGapRatio;
    }

    public ColorMatchingMode getColorMatching() {
        return colorMatching;
    }

    public double getFontSizeToleranceRatio() {
        return fontSizeToleranceRatio;
    }

    public boolean isEnableColumnSeparation() {
        return enableColumnSeparation;
    }

    /** Column gap threshold, as a multiple of the average character width. */
    public double getColumnGapRatio() {
        return columnGapRatio;
    }

    public boolean isEnablePageColumnDetection() {
        return enablePageColumnDetection;
    }

    public int getMaxPageColumns() {
        return maxPageColumns;
    }

    /** Ranges at least this fraction of the page width are treated as full-width. */
    public double getFullWidthRatio() {
        return fullWidthRatio;
    }

    public WritingModeOption getWritingMode() {
        return writingMode;
    }

    public VerticalColumnOrder getVerticalColumnOrder() {
        return verticalColumnOrder;
    }

    public InlineDirectionMode getInlineDirection() {
        return inlineDirection;
    }

    @Override
    public String toString() {
        return "SpatialGroupingOptions{lineToleranceRatio=" + lineToleranceRatio
                + ", horizontalGapRatio=" + horizontalGapRatio
                + ", verticalGapRatio=" + verticalGapRatio
                + ", colorMatching=" + colorMatching.getValue()
                + ", fontSizeToleranceRatio=" + fontSizeToleranceRatio
                + ", enableColumnSeparation=" + enableColumnSeparation
                + ", columnGapRatio=" + columnGapRatio
                + ", enablePageColumnDetection=" + enablePageColumnDetection
                + ", maxPageColumns=" + maxPageColumns
                + ", fullWidthRatio=" + fullWidthRatio
                + ", writingMode=" + writingMode.getValue()
                + ", verticalColumnOrder=" + verticalColumnOrder.getValue()
                + ", inlineDirection=" + inlineDirection.getValue() + "}";
    }

    public static final class Builder {
        private double lineToleranceRatio = DEFAULT_LINE_TOLERANCE_RATIO;
        private double horizontalGapRatio = DEFAULT_HORIZONTAL_GAP_RATIO;
        private double verticalGapRatio = DEFAULT_VERTICAL_GAP_RATIO;
        private ColorMatchingMode colorMatching = ColorMatchingMode.NONE;
        private double fontSizeToleranceRatio = DEFAULT_FONT_SIZE_TOLERANCE_RATIO;
        private boolean enableColumnSeparation = true;
        private double columnGapRatio = DEFAULT_COLUMN_GAP_RATIO;
        private boolean enablePageColumnDetection = true;
        private int maxPageColumns = DEFAULT_MAX_PAGE_COLUMNS;
        private double fullWidthRatio = DEFAULT_FULL_WIDTH_RATIO;
        private WritingModeOption writingMode = WritingModeOption.AUTO;
        private VerticalColumnOrder verticalColumnOrder = VerticalColumnOrder.RIGHT_TO_LEFT;
        private InlineDirectionMode inlineDirection = InlineDirectionMode.AUTO;

        private Builder() {
        }

        public Builder lineToleranceRatio(double lineToleranceRatio) {
            this.lineToleranceRatio = lineToleranceRatio;
            return this;
        }

        public Builder horizontalGapRatio(double horizontalGapRatio) {
            this.horizontalGapRatio = horizontalGapRatio;
            return this;
        }

        public Builder verticalGapRatio(double verticalGapRatio) {
            this.verticalGapRatio = verticalGapRatio;
            return this;
        }

        public Builder colorMatching(ColorMatchingMode colorMatching) {
            this.colorMatching = Objects.requireNonNull(colorMatching, "colorMatching");
            return this;
        }

        public Builder fontSizeToleranceRatio(double fontSizeToleranceRatio) {
            this.fontSizeToleranceRatio = fontSizeToleranceRatio;
            return this;
        }

        public Builder enableColumnSeparation(boolean enableColumnSeparation) {
            this.enableColumnSeparation = enableColumnSeparation;
            return this;
        }

        public Builder columnGapRatio(double columnGapRatio) {
            this.columnGapRatio = columnGapRatio;
            return this;
        }

        public Builder enablePageColumnDetection(boolean enablePageColumnDetection) {
            this.enablePageColumnDetection = enablePageColumnDetection;
            return this;
        }

        public Builder maxPageColumns(int maxPageColumns) {
            this.maxPageColumns = maxPageColumns;
            return this;
        }

        public Builder fullWidthRatio(double fullWidthRatio) {
            this.fullWidthRatio = fullWidthRatio;
            return this;
        }

        public Builder writingMode(WritingModeOption writingMode) {
            this.writingMode = Objects.requireNonNull(writingMode, "writingMode");
            return this;
        }

        public Builder verticalColumnOrder(VerticalColumnOrder verticalColumnOrder) {
            this.verticalColumnOrder = Objects.requireNonNull(verticalColumnOrder, "verticalColumnOrder");
            return this;
        }

        public Builder inlineDirection(InlineDirectionMode inlineDirection) {
            this.inlineDirection = Objects.requireNonNull(inlineDirection, "inlineDirection");
            return this;
        }

        /**
         * @throws IllegalArgumentException if a ratio is negative or not finite, or maxPageColumns < 1
         */
        public SpatialGroupingOptions build() {
            requireNonNegative("lineToleranceRatio", lineToleranceRatio);
            requireNonNegative("horizontalGapRatio", horizontalGapRatio);
            requireNonNegative("verticalGapRatio", verticalGapRatio);
            requireNonNegative("fontSizeToleranceRatio", fontSizeToleranceRatio);
            requireNonNegative("columnGapRatio", columnGapRatio);
            requireNonNegative("fullWidthRatio", fullWidthRatio);
            if (maxPageColumns < 1) {
                throw new IllegalArgumentException("maxPageColumns must be >= 1, got " + maxPageColumns);
            }
            return new SpatialGroupingOptions(this);
        }

        private static void requireNonNegative(String name, double value) {
            if (!Double.isFinite(value) || value < 0) {
                throw new IllegalArgumentException(name + " must be a finite non-negative number, got " + value);
            }
        }
    }
}

package com.gs.ep.docknight.segmentation.context;

/**
 * 上下文（NCD）分段参数
 *
 * <p>阈值相互约束：合并阈值截断到 [0, 1]，强合并阈值截断到 [0, 合并阈值]，
 * 边界上下文至少 32 个字符。</p>
 */
public final class ContextualSegmentationOptions {

    // ==================== 默认值 ====================

    public static final int DEFAULT_WINDOW_SIZE = 1;
    public static final double DEFAULT_MERGE_THRESHOLD = 0.22;
    public static final double DEFAULT_STRONG_MERGE_THRESHOLD = 0.10;
    public static final int DEFAULT_MIN_COMBINED_CHARS = 48;
    public static final int DEFAULT_BOUNDARY_CONTEXT_CHARS = 220;
    public static final double DEFAULT_SUFFIX_PREFIX_MERGE_RATIO = 0.75;
    public static final int DEFAULT_SUFFIX_PREFIX_MERGE_MIN_CHARS = 10;

    static final int MIN_BOUNDARY_CONTEXT_CHARS = 32;

    private static final ContextualSegmentationOptions DEFAULTS = builder().build();

    private final int windowSize;
    private final double mergeThreshold;
    private final double strongMergeThreshold;
    private final int minCombinedChars;
    private final int boundaryContextChars;
    private final double suffixPrefixMergeRatio;
    private final int suffixPrefixMergeMinChars;
    private final double adaptiveMergePercentile;

    private ContextualSegmentationOptions(Builder builder) {
        this.windowSize = builder.windowSize;
        this.mergeThreshold = clamp(builder.mergeThreshold, 0, 1);
        this.strongMergeThreshold = clamp(builder.strongMergeThreshold, 0, this.mergeThreshold);
        this.minCombinedChars = builder.minCombinedChars;
        this.boundaryContextChars = Math.max(MIN_BOUNDARY_CONTEXT_CHARS, builder.boundaryContextChars);
        this.suffixPrefixMergeRatio = clamp(builder.suffixPrefixMergeRatio, 0, 1);
        this.suffixPrefixMergeMinChars = builder.suffixPrefixMergeMinChars;
        this.adaptiveMergePercentile = builder.adaptiveMergePercentile;
    }

    public static ContextualSegmentationOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .windowSize(windowSize)
                .mergeThreshold(mergeThreshold)
                .strongMergeThreshold(strongMergeThreshold)
                .minCombinedChars(minCombinedChars)
                .boundaryContextChars(boundaryContextChars)
                .suffixPrefixMergeRatio(suffixPrefixMergeRatio)
                .suffixPrefixMergeMinChars(suffixPrefixMergeMinChars)
                .adaptiveMergePercentile(adaptiveMergePercentile);
    }

    /** Units per side in a boundary context window. */
    public int getWindowSize() {
        return windowSize;
    }

    public double getMergeThreshold() {
        return mergeThreshold;
    }

    public double getStrongMergeThreshold() {
        return strongMergeThreshold;
    }

    public int getMinCombinedChars() {
        return minCombinedChars;
    }

    /** Code points kept on each side of a boundary. */
    public int getBoundaryContextChars() {
        return boundaryContextChars;
    }

    public double getSuffixPrefixMergeRatio() {
        return suffixPrefixMergeRatio;
    }

    public int getSuffixPrefixMergeMinChars() {
        return suffixPrefixMergeMinChars;
    }

    /**
     * @return quantile of observed boundary NCDs used to tighten the merge threshold, 0 when disabled
     */
    public double getAdaptiveMergePercentile() {
        return adaptiveMergePercentile;
    }

    @Override
    public String toString() {
        return "ContextualSegmentationOptions{windowSize=" + windowSize
                + ", mergeThreshold=" + mergeThreshold
                + ", strongMergeThreshold=" + strongMergeThreshold
                + ", minCombinedChars=" + minCombinedChars
                + ", boundaryContextChars=" + boundaryContextChars
                + ", suffixPrefixMergeRatio=" + suffixPrefixMergeRatio
                + ", suffixPrefixMergeMinChars=" + suffixPrefixMergeMinChars
                + ", adaptiveMergePercentile=" + adaptiveMergePercentile + "}";
    }

    private static double clamp(double value, double min, double max) {
        return Math.min(max, Math.max(min, value));
    }

    public static final class Builder {
        private int windowSize = DEFAULT_WINDOW_SIZE;
        private double mergeThreshold = DEFAULT_MERGE_THRESHOLD;
        private double strongMergeThreshold = DEFAULT_STRONG_MERGE_THRESHOLD;
        private int minCombinedChars = DEFAULT_MIN_COMBINED_CHARS;
        private int boundaryContextChars = DEFAULT_BOUNDARY_CONTEXT_CHARS;
        private double suffixPrefixMergeRatio = DEFAULT_SUFFIX_PREFIX_MERGE_RATIO;
        private int suffixPrefixMergeMinChars = DEFAULT_SUFFIX_PREFIX_MERGE_MIN_CHARS;
        private double adaptiveMergePercentile = 0;

        private Builder() {
        }

        public Builder windowSize(int windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder mergeThreshold(double mergeThreshold) {
            this.mergeThreshold = mergeThreshold;
            return this;
        }

        public Builder strongMergeThreshold(double strongMergeThreshold) {
            this.strongMergeThreshold = strongMergeThreshold;
            return this;
        }

        public Builder minCombinedChars(int minCombinedChars) {
            this.minCombinedChars = minCombinedChars;
            return this;
        }

        public Builder boundaryContextChars(int boundaryContextChars) {
            this.boundaryContextChars = boundaryContextChars;
            return this;
        }

        public Builder suffixPrefixMergeRatio(double suffixPrefixMergeRatio) {
            this.suffixPrefixMergeRatio = suffixPrefixMergeRatio;
            return this;
        }

        public Builder suffixPrefixMergeMinChars(int suffixPrefixMergeMinChars) {
            this.suffixPrefixMergeMinChars = suffixPrefixMergeMinChars;
            return this;
        }

        public Builder adaptiveMergePercentile(double adaptiveMergePercentile) {
            this.adaptiveMergePercentile = adaptiveMergePercentile;
            return this;
        }

        /**
         * Out-of-range thresholds are clamped; counts below their minimum and non-finite numbers are rejected.
         *
         * @throws IllegalArgumentException for a malformed value
         */
        public ContextualSegmentationOptions build() {
            requireAtLeastOne("windowSize", windowSize);
            requireAtLeastOne("minCombinedChars", minCombinedChars);
            requireAtLeastOne("suffixPrefixMergeMinChars", suffixPrefixMergeMinChars);
            requireFinite("mergeThreshold", mergeThreshold);
            requireFinite("strongMergeThreshold", strongMergeThreshold);
            requireFinite("suffixPrefixMergeRatio", suffixPrefixMergeRatio);
            if (!(adaptiveMergePercentile >= 0 && adaptiveMergePercentile <= 1)) {
                throw new IllegalArgumentException(
                        "adaptiveMergePercentile must be within [0, 1], got " + adaptiveMergePercentile);
            }
            return new ContextualSegmentationOptions(this);
        }

        private static void requireAtLeastOne(String name, int value) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got " + value);
            }
        }

        private static void requireFinite(String name, double value) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException(name + " must be a finite number, got " + value);
            }
        }
    }
}

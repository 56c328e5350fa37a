package com.gs.ep.docknight.segmentation.context;

import java.util.Objects;

/**
 * 文本块上下文分段参数：NCD 参数加上空间守卫与块签名的配置。
 */
public final class GroupedContextSegmentationOptions {

    public static final double DEFAULT_MIN_X_AXIS_OVERLAP_RATIO = 0.30;
    public static final int DEFAULT_CONTEXT_PARAGRAPH_EDGE_COUNT = 2;

    private static final GroupedContextSegmentationOptions DEFAULTS = builder().build();

    private final ContextualSegmentationOptions contextual;
    private final double minXAxisOverlapRatio;
    private final int contextParagraphEdgeCount;

    private GroupedContextSegmentationOptions(Builder builder) {
        this.contextual = builder.contextual;
        this.minXAxisOverlapRatio = builder.minXAxisOverlapRatio;
        this.contextParagraphEdgeCount = builder.contextParagraphEdgeCount;
    }

    public static GroupedContextSegmentationOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ContextualSegmentationOptions getContextual() {
        return contextual;
    }

    /** Two blocks merge only when their x overlap over the narrower width reaches this ratio. */
    public double getMinXAxisOverlapRatio() {
        return minXAxisOverlapRatio;
    }

    /** Paragraphs taken from each end of a block to build its text signature. */
    public int getContextParagraphEdgeCount() {
        return contextParagraphEdgeCount;
    }

    @Override
    public String toString() {
        return "GroupedContextSegmentationOptions{" + contextual
                + ", minXAxisOverlapRatio=" + minXAxisOverlapRatio
                + ", contextParagraphEdgeCount=" + contextParagraphEdgeCount + "}";
    }

    public static final class Builder {
        private ContextualSegmentationOptions contextual = ContextualSegmentationOptions.defaults();
        private double minXAxisOverlapRatio = DEFAULT_MIN_X_AXIS_OVERLAP_RATIO;
        private int contextParagraphEdgeCount = DEFAULT_CONTEXT_PARAGRAPH_EDGE_COUNT;

        private Builder() {
        }

        public Builder contextual(ContextualSegmentationOptions contextual) {
            this.contextual = Objects.requireNonNull(contextual, "contextual");
            return this;
        }

        public Builder minXAxisOverlapRatio(double minXAxisOverlapRatio) {
            this.minXAxisOverlapRatio = minXAxisOverlapRatio;
            return this;
        }

        public Builder contextParagraphEdgeCount(int contextParagraphEdgeCount) {
            this.contextParagraphEdgeCount = contextParagraphEdgeCount;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the overlap ratio is not finite or the edge count is below 1
         */
        public GroupedContextSegmentationOptions build() {
            if (!Double.isFinite(minXAxisOverlapRatio)) {
                throw new IllegalArgumentException(
                        "minXAxisOverlapRatio must be a finite number, got " + minXAxisOverlapRatio);
            }
            if (contextParagraphEdgeCount < 1) {
                throw new IllegalArgumentException(
                        "contextParagraphEdgeCount must be >= 1, got " + contextParagraphEdgeCount);
            }
            return new GroupedContextSegmentationOptions(this);
        }
    }
}

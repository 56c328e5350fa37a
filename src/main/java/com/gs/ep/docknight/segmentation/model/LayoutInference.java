package com.gs.ep.docknight.segmentation.model;

import java.util.Objects;

/**
 * 块级版式推断结果：对齐方式、置信度、估计的完整文本框以及起止内边距。
 *
 * <p>Paddings are semantic: for {@link InlineDirection#RTL} blocks the start
 * padding is measured from the right edge.</p>
 */
public final class LayoutInference {

    private final InlineDirection inlineDirection;
    private final ParagraphAlignment alignment;
    private final double confidence;
    private final TextBounds estimatedBounds;
    private final double startPadding;
    private final double endPadding;

    public LayoutInference(InlineDirection inlineDirection, ParagraphAlignment alignment, double confidence,
                           TextBounds estimatedBounds, double startPadding, double endPadding) {
        this.inlineDirection = Objects.requireNonNull(inlineDirection, "inlineDirection");
        this.alignment = Objects.requireNonNull(alignment, "alignment");
        this.confidence = confidence;
        this.estimatedBounds = Objects.requireNonNull(estimatedBounds, "estimatedBounds");
        this.startPadding = startPadding;
        this.endPadding = endPadding;
    }

    public InlineDirection getInlineDirection() {
        return inlineDirection;
    }

    public ParagraphAlignment getAlignment() {
        return alignment;
    }

    /** In [0, 1]. */
    public double getConfidence() {
        return confidence;
    }

    public TextBounds getEstimatedBounds() {
        return estimatedBounds;
    }

    public double getStartPadding() {
        return startPadding;
    }

    public double getEndPadding() {
        return endPadding;
    }

    @Override
    public String toString() {
        return "LayoutInference{" + inlineDirection + ", " + alignment + ", confidence=" + confidence
                + ", start=" + startPadding + ", end=" + endPadding + "}";
    }
}

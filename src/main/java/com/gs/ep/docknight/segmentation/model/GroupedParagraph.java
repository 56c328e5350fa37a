package com.gs.ep.docknight.segmentation.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * 一个物理行（横排）或一段竖排列片段。
 *
 * <p>Runs are already ordered by {@link #getInlineDirection()}.</p>
 */
public final class GroupedParagraph {

    private final ImmutableList<TextRun> runs;
    private final double baselineY;
    private final InlineDirection inlineDirection;
    private final LineSpacing lineSpacing;

    public GroupedParagraph(ListIterable<TextRun> runs, double baselineY, InlineDirection inlineDirection) {
        this(runs, baselineY, inlineDirection, null);
    }

    /**
     * @throws IllegalArgumentException if {@code runs} is empty
     */
    public GroupedParagraph(ListIterable<TextRun> runs, double baselineY, InlineDirection inlineDirection,
                            LineSpacing lineSpacing) {
        if (runs.isEmpty()) {
            throw new IllegalArgumentException("Cannot create paragraph from empty runs");
        }
        this.runs = Lists.immutable.withAll(runs);
        this.baselineY = baselineY;
        this.inlineDirection = Objects.requireNonNull(inlineDirection, "inlineDirection");
        this.lineSpacing = lineSpacing;
    }

    public ImmutableList<TextRun> getRuns() {
        return runs;
    }

    public TextRun getFirstRun() {
        return runs.getFirst();
    }

    public double getBaselineY() {
        return baselineY;
    }

    public InlineDirection getInlineDirection() {
        return inlineDirection;
    }

    /**
     * @return spacing to the next paragraph of the block, or {@code null} for the last paragraph
     */
    public LineSpacing getLineSpacing() {
        return lineSpacing;
    }

    public GroupedParagraph withLineSpacing(LineSpacing spacing) {
        return new GroupedParagraph(runs, baselineY, inlineDirection, spacing);
    }

    public TextBounds getBounds() {
        return TextBounds.union(runs.collect(TextRun::getBounds));
    }

    public String getText() {
        return runs.collect(TextRun::getText).makeString("");
    }

    @Override
    public String toString() {
        return "GroupedParagraph{'" + getText() + "' baseline=" + baselineY + " " + inlineDirection + "}";
    }
}

package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.InlineDirection;
import com.gs.ep.docknight.segmentation.model.TextRun;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Builds paragraphs with runs ordered by their inline direction.
 */
public final class ParagraphFactory {

    private ParagraphFactory() {
    }

    /**
     * 横排段落：行内方向由本段文本自身判定（或由配置强制），基线取排序后的第一个片段。
     *
     * @throws IllegalArgumentException if {@code runs} is empty
     */
    public static GroupedParagraph createParagraph(ListIterable<TextRun> runs, SpatialGroupingOptions options) {
        if (runs.isEmpty()) {
            throw new IllegalArgumentException("createParagraph requires at least one run");
        }
        InlineDirection direction = DirectionResolver.resolveInlineDirection(runs, options);
        MutableList<TextRun> ordered = sortByInlineDirection(runs, direction);
        return new GroupedParagraph(ordered, ordered.getFirst().getBaselineY(), direction);
    }

    /**
     * 竖排段落：按中心 y 从上到下排列。
     *
     * @throws IllegalArgumentException if {@code runs} is empty
     */
    public static GroupedParagraph createVerticalParagraph(ListIterable<TextRun> runs) {
        if (runs.isEmpty()) {
            throw new IllegalArgumentException("createVerticalParagraph requires at least one run");
        }
        MutableList<TextRun> ordered = Lists.mutable.withAll(runs)
                .sortThis((a, b) -> Double.compare(b.getCenterY(), a.getCenterY()));
        return new GroupedParagraph(ordered, ordered.getFirst().getBaselineY(), InlineDirection.TTB);
    }

    public static MutableList<TextRun> sortByInlineDirection(ListIterable<TextRun> runs, InlineDirection direction) {
        MutableList<TextRun> sorted = Lists.mutable.withAll(runs);
        switch (direction) {
            case RTL:
                return sorted.sortThis((a, b) -> Double.compare(b.getX(), a.getX()));
            case TTB:
                return sorted.sortThis((a, b) -> Double.compare(b.getCenterY(), a.getCenterY()));
            case LTR:
            default:
                return sorted.sortThis((a, b) -> Double.compare(a.getX(), b.getX()));
        }
    }
}

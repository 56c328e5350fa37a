package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.InlineDirection;
import com.gs.ep.docknight.segmentation.model.LayoutInference;
import com.gs.ep.docknight.segmentation.model.ParagraphAlignment;
import com.gs.ep.docknight.segmentation.model.TextBounds;
import com.gs.ep.docknight.segmentation.model.TextRun;
import com.gs.ep.docknight.segmentation.model.WritingMode;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableDoubleList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;

/**
 * 块级版式推断
 *
 * 比较段落左边缘、中心、右边缘的四分位距，离散度最小者即为对齐方式；
 * 再据此估计完整文本框和起止内边距。
 */
public final class LayoutInferrer {

    private static final double DEFAULT_FONT_SIZE = 12;
    private static final double MIN_ALIGNMENT_TOLERANCE = 0.8;
    private static final double ALIGNMENT_TOLERANCE_FONT_RATIO = 0.35;
    private static final double IMPLAUSIBLE_CONFIDENCE_FACTOR = 0.35;

    private LayoutInferrer() {
    }

    /**
     * 单个段落的外包框与首个片段字号
     */
    static final class ParagraphEdges {
        final double minX;
        final double maxX;
        final double minY;
        final double maxY;
        final double centerX;
        final double fontSize;
        final InlineDirection inlineDirection;

        ParagraphEdges(GroupedParagraph paragraph) {
            double x0 = Double.POSITIVE_INFINITY;
            double x1 = Double.NEGATIVE_INFINITY;
            double y0 = Double.POSITIVE_INFINITY;
            double y1 = Double.NEGATIVE_INFINITY;
            for (TextRun run : paragraph.getRuns()) {
                x0 = Math.min(x0, run.getX());
                x1 = Math.max(x1, run.getRight());
                y0 = Math.min(y0, run.getY());
                y1 = Math.max(y1, run.getTop());
            }
            this.minX = x0;
            this.maxX = x1;
            this.minY = y0;
            this.maxY = y1;
            this.centerX = (x0 + x1) / 2;
            this.fontSize = paragraph.getFirstRun().getFontSize();
            this.inlineDirection = paragraph.getInlineDirection();
        }
    }

    private static final class AlignmentSpread {
        final ParagraphAlignment alignment;
        final double spread;

        AlignmentSpread(ParagraphAlignment alignment, double spread) {
            this.alignment = alignment;
            this.spread = spread;
        }
    }

    /**
     * @return the inferred layout, or {@code null} when there are no paragraphs
     */
    public static LayoutInference inferLayout(ListIterable<GroupedParagraph> paragraphs, TextBounds contentBounds,
                                              WritingMode writingMode) {
        if (paragraphs.isEmpty()) {
            return null;
        }
        if (writingMode == WritingMode.VERTICAL) {
            return new LayoutInference(InlineDirection.TTB, ParagraphAlignment.UNKNOWN, 0, contentBounds, 0, 0);
        }

        MutableList<ParagraphEdges> edges = Lists.mutable.empty();
        for (GroupedParagraph paragraph : paragraphs) {
            edges.add(new ParagraphEdges(paragraph));
        }
        InlineDirection direction = resolveGroupInlineDirection(edges);
        LayoutInference inferred = inferHorizontalAlignment(edges, direction);

        // 起止内边距是语义上的：rtl 块的"起始"在右侧
        if (direction == InlineDirection.RTL) {
            return new LayoutInference(direction, inferred.getAlignment(), inferred.getConfidence(),
                    inferred.getEstimatedBounds(), inferred.getEndPadding(), inferred.getStartPadding());
        }
        return inferred;
    }

    /**
     * ttb 占严格多数且多于 rtl 时为 ttb；rtl 至少占一半（向上取整）时为 rtl；否则 ltr。
     */
    static InlineDirection resolveGroupInlineDirection(ListIterable<ParagraphEdges> edges) {
        if (edges.isEmpty()) {
            return InlineDirection.LTR;
        }
        int rtlCount = edges.count(e -> e.inlineDirection == InlineDirection.RTL);
        int ttbCount = edges.count(e -> e.inlineDirection == InlineDirection.TTB);
        if (ttbCount > rtlCount && ttbCount > edges.size() / 2.0) {
            return InlineDirection.TTB;
        }
        if (rtlCount >= (int) Math.ceil(edges.size() / 2.0)) {
            return InlineDirection.RTL;
        }
        return InlineDirection.LTR;
    }

    /**
     * Paddings in the result are physical (start = left, end = right).
     */
    static LayoutInference inferHorizontalAlignment(ListIterable<ParagraphEdges> edges, InlineDirection direction) {
        MutableDoubleList lefts = new DoubleArrayList();
        MutableDoubleList rights = new DoubleArrayList();
        MutableDoubleList centers = new DoubleArrayList();
        MutableDoubleList fontSizes = new DoubleArrayList();
        double minY = Double.POSITIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (ParagraphEdges e : edges) {
            lefts.add(e.minX);
            rights.add(e.maxX);
            centers.add(e.centerX);
            fontSizes.add(e.fontSize);
            minY = Math.min(minY, e.minY);
            maxY = Math.max(maxY, e.maxY);
        }
        double fontRef = GeometryUtils.quantile(fontSizes, 0.5);
        if (fontRef == 0) {
            fontRef = DEFAULT_FONT_SIZE;
        }

        MutableList<AlignmentSpread> spreads = Lists.mutable.of(
                new AlignmentSpread(ParagraphAlignment.LEFT, GeometryUtils.interQuartileRange(lefts)),
                new AlignmentSpread(ParagraphAlignment.CENTER, GeometryUtils.interQuartileRange(centers)),
                new AlignmentSpread(ParagraphAlignment.RIGHT, GeometryUtils.interQuartileRange(rights)));
        spreads.sortThis((a, b) -> Double.compare(a.spread, b.spread));

        AlignmentSpread best = spreads.get(0);
        AlignmentSpread second = spreads.get(1);
        double dominantScore = second.spread <= 0
                ? 0
                : GeometryUtils.clamp((second.spread - best.spread) / second.spread, 0, 1);
        double tolerance = Math.max(MIN_ALIGNMENT_TOLERANCE, fontRef * ALIGNMENT_TOLERANCE_FONT_RATIO);
        boolean plausible = best.spread <= tolerance * 2 || edges.size() <= 2;
        double confidence = plausible ? dominantScore : dominantScore * IMPLAUSIBLE_CONFIDENCE_FACTOR;

        if (!plausible && edges.size() >= 3) {
            double minX = lefts.min();
            double maxX = rights.max();
            return new LayoutInference(direction, ParagraphAlignment.UNKNOWN, confidence,
                    new TextBounds(minX, minY, maxX - minX, maxY - minY), 0, 0);
        }

        TextBounds estimated;
        switch (best.alignment) {
            case LEFT: {
                double x = Math.min(lefts.min(), GeometryUtils.quantile(lefts, 0.5));
                estimated = new TextBounds(x, minY, rights.max() - x, maxY - minY);
                break;
            }
            case CENTER: {
                double anchor = GeometryUtils.quantile(centers, 0.5);
                double half = 0;
                for (ParagraphEdges e : edges) {
                    half = Math.max(half, Math.max(Math.abs(e.maxX - anchor), Math.abs(anchor - e.minX)));
                }
                double x = anchor - half;
                estimated = new TextBounds(x, minY, (anchor + half) - x, maxY - minY);
                break;
            }
            default: {
                double x = lefts.min();
                double right = Math.max(GeometryUtils.quantile(rights, 0.5), rights.max());
                estimated = new TextBounds(x, minY, right - x, maxY - minY);
                break;
            }
        }

        double rightEdge = estimated.getRight();
        MutableDoubleList leftGaps = new DoubleArrayList();
        MutableDoubleList rightGaps = new DoubleArrayList();
        for (ParagraphEdges e : edges) {
            leftGaps.add(Math.max(0, e.minX - estimated.getX()));
            rightGaps.add(Math.max(0, rightEdge - e.maxX));
        }
        return new LayoutInference(direction, best.alignment, confidence, estimated,
                GeometryUtils.quantile(leftGaps, 0.5), GeometryUtils.quantile(rightGaps, 0.5));
    }
}

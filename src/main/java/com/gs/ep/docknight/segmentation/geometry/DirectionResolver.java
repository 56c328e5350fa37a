package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.model.InlineDirection;
import com.gs.ep.docknight.segmentation.model.TextRun;
import com.gs.ep.docknight.segmentation.model.WritingMode;
import org.eclipse.collections.api.list.ListIterable;

import java.util.PrimitiveIterator;

/**
 * 书写方向判定
 *
 * 1. 书写模式（横排 / 竖排）：基于片段宽高比与最近邻方向
 * 2. 行内方向（ltr / rtl）：基于 Unicode 码位所属的文字区块
 */
public final class DirectionResolver {

    private static final int WRITING_MODE_SAMPLE_SIZE = 240;
    private static final int NEIGHBOR_SAMPLE_SIZE = 180;
    private static final int SCRIPT_SAMPLE_SIZE = 180;

    private static final double VERTICAL_LIKE_ASPECT = 0.55;
    private static final double HORIZONTAL_LIKE_ASPECT = 0.9;
    private static final double RTL_RATIO_THRESHOLD = 0.25;
    private static final int RTL_MIN_COUNT = 2;

    private DirectionResolver() {
    }

    // ==================== 书写模式 ====================

    /**
     * Neighbour-flow counts: for each sampled run, whether its nearest neighbour lies
     * more horizontally or more vertically.
     */
    public static final class NeighborFlow {
        public final int horizontal;
        public final int vertical;

        NeighborFlow(int horizontal, int vertical) {
            this.horizontal = horizontal;
            this.vertical = vertical;
        }
    }

    public static NeighborFlow scoreNeighborDirections(ListIterable<TextRun> runs) {
        if (runs.size() < 2) {
            return new NeighborFlow(0, 0);
        }
        ListIterable<TextRun> capped = GeometryUtils.head(runs, NEIGHBOR_SAMPLE_SIZE);
        int horizontal = 0;
        int vertical = 0;

        for (int i = 0; i < capped.size(); i++) {
            TextRun a = capped.get(i);
            double ax = a.getCenterX();
            double ay = a.getCenterY();

            TextRun nearest = null;
            double nearestDist = Double.POSITIVE_INFINITY;
            for (int j = 0; j < capped.size(); j++) {
                if (i == j) {
                    continue;
                }
                TextRun b = capped.get(j);
                double dx = b.getCenterX() - ax;
                double dy = b.getCenterY() - ay;
                double dist2 = dx * dx + dy * dy;
                if (dist2 < nearestDist) {
                    nearestDist = dist2;
                    nearest = b;
                }
            }
            if (nearest == null) {
                continue;
            }

            double dx = Math.abs(nearest.getCenterX() - ax);
            double dy = Math.abs(nearest.getCenterY() - ay);
            if (dx >= dy) {
                horizontal++;
            } else {
                vertical++;
            }
        }
        return new NeighborFlow(horizontal, vertical);
    }

    /**
     * 检测页面的主导书写模式；无法判断时返回横排。
     */
    public static WritingMode detectDominantWritingMode(ListIterable<TextRun> runs) {
        if (runs.isEmpty()) {
            return WritingMode.HORIZONTAL;
        }

        ListIterable<TextRun> sample = GeometryUtils.head(runs, WRITING_MODE_SAMPLE_SIZE);
        int verticalLike = sample.count(t -> t.getWidth() <= t.getHeight() * VERTICAL_LIKE_ASPECT);
        int horizontalLike = sample.count(t -> t.getWidth() >= t.getHeight() * HORIZONTAL_LIKE_ASPECT);
        NeighborFlow flow = scoreNeighborDirections(sample);

        int verticalScore = verticalLike * 2 + flow.vertical;
        int horizontalScore = horizontalLike * 2 + flow.horizontal;

        // 阿拉伯文/希伯来文的字形框可能窄而高，几何上像竖排，但这里不会竖排
        if (detectInlineDirection(sample) == InlineDirection.RTL) {
            return WritingMode.HORIZONTAL;
        }

        boolean strongVerticalFlow = flow.vertical >= flow.horizontal * 2.5
                && flow.vertical >= sample.size() * 0.75
                && verticalLike > 0;
        if (strongVerticalFlow) {
            return WritingMode.VERTICAL;
        }
        if (verticalScore > horizontalScore * 1.1 && verticalLike > 0) {
            return WritingMode.VERTICAL;
        }
        return WritingMode.HORIZONTAL;
    }

    public static WritingMode resolveWritingMode(ListIterable<TextRun> runs, SpatialGroupingOptions options) {
        WritingMode forced = options.getWritingMode().forcedMode();
        return forced != null ? forced : detectDominantWritingMode(runs);
    }

    // ==================== 行内方向 ====================

    public static boolean isRtlCodePoint(int cp) {
        return (cp >= 0x0590 && cp <= 0x08FF)     // Hebrew + Arabic
                || (cp >= 0xFB1D && cp <= 0xFDFF) // presentation forms
                || (cp >= 0xFE70 && cp <= 0xFEFF) // Arabic presentation forms-B
                || (cp >= 0x10800 && cp <= 0x10FFF);
    }

    /**
     * Whitespace, control characters and ASCII digits carry no direction.
     */
    public static boolean isStrongCodePoint(int cp) {
        if (cp <= 0x20) {
            return false;
        }
        return cp < 0x30 || cp > 0x39;
    }

    /**
     * @return {@link InlineDirection#RTL} if at least a quarter (and at least two) of the
     * strong code points are right-to-left, else {@link InlineDirection#LTR}
     */
    public static InlineDirection detectInlineDirection(ListIterable<TextRun> runs) {
        if (runs.isEmpty()) {
            return InlineDirection.LTR;
        }

        int strongCount = 0;
        int rtlCount = 0;
        for (TextRun run : GeometryUtils.head(runs, SCRIPT_SAMPLE_SIZE)) {
            PrimitiveIterator.OfInt codePoints = run.getText().codePoints().iterator();
            while (codePoints.hasNext()) {
                int cp = codePoints.nextInt();
                if (!isStrongCodePoint(cp)) {
                    continue;
                }
                strongCount++;
                if (isRtlCodePoint(cp)) {
                    rtlCount++;
                }
            }
        }

        if (strongCount == 0) {
            return InlineDirection.LTR;
        }
        double rtlRatio = (double) rtlCount / strongCount;
        if (rtlRatio >= RTL_RATIO_THRESHOLD && rtlCount >= RTL_MIN_COUNT) {
            return InlineDirection.RTL;
        }
        return InlineDirection.LTR;
    }

    public static InlineDirection resolveInlineDirection(ListIterable<TextRun> runs, SpatialGroupingOptions options) {
        InlineDirection forced = options.getInlineDirection().forcedDirection();
        return forced != null ? forced : detectInlineDirection(runs);
    }
}

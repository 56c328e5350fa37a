package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.model.TextRun;

/**
 * Per-run spacing estimates used by the horizontal splitters.
 */
public final class RunMetrics {

    /** Fallback glyph advance in 1/1000 em. */
    private static final double DEFAULT_CHAR_WIDTH_EM = 500;
    private static final double MIN_CHAR_WIDTH_RATIO = 0.3;

    private RunMetrics() {
    }

    /**
     * 估算单个字符宽度：width / 字符数，下限 0.3 * fontSize；
     * 宽度不可用时回退到 0.5 * fontSize。
     */
    public static double estimateCharWidth(TextRun run) {
        int length = Math.max(run.getText().length(), 1);
        double estimated = run.getWidth() / length;
        double fallback = (DEFAULT_CHAR_WIDTH_EM * run.getFontSize()) / 1000;
        double minWidth = run.getFontSize() * MIN_CHAR_WIDTH_RATIO;

        if (!Double.isFinite(estimated) || estimated <= 0) {
            return Math.max(fallback, minWidth);
        }
        return Math.max(estimated, minWidth);
    }

    /**
     * 两个相邻片段之间的期望间距。
     *
     * <p>平均字符宽度 + 前一片段的 Tc；前一片段以空格结尾时再加 Tw；
     * 整体乘以前一片段的水平缩放 Tz。</p>
     */
    public static double expectedGap(TextRun prev, TextRun curr) {
        double baseCharWidth = (estimateCharWidth(prev) + estimateCharWidth(curr)) / 2;
        double hScale = prev.getHorizontalScaling() / 100;
        double wordSpacing = prev.getText().endsWith(" ") ? prev.getWordSpacing() : 0;
        return (baseCharWidth + prev.getCharSpacing() + wordSpacing) * hScale;
    }

    /** Horizontal gap from the right edge of {@code prev} to the left edge of {@code curr}. */
    public static double gapBetween(TextRun prev, TextRun curr) {
        return curr.getX() - prev.getRight();
    }
}

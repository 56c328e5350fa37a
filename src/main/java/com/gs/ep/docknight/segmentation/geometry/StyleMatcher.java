package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.ColorMatchingMode;
import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.model.FillColor;
import com.gs.ep.docknight.segmentation.model.TextRun;

/**
 * 文本样式比较：字体名（忽略子集前缀）、字号容差、可选的颜色匹配。
 */
public final class StyleMatcher {

    private static final double LOOSE_COLOR_TOLERANCE = 0.05;

    private StyleMatcher() {
    }

    /**
     * Strips a subset prefix such as {@code ABCDEF+Helvetica}.
     */
    public static String normalizeFontName(String name) {
        int plusIndex = name.indexOf('+');
        return plusIndex > 0 ? name.substring(plusIndex + 1) : name;
    }

    public static boolean hasSameColor(FillColor c1, FillColor c2, ColorMatchingMode mode) {
        if (!c1.getColorSpace().equals(c2.getColorSpace())) {
            return false;
        }
        if (c1.getComponentCount() != c2.getComponentCount()) {
            return false;
        }
        for (int i = 0; i < c1.getComponentCount(); i++) {
            double diff = Math.abs(c1.getComponent(i) - c2.getComponent(i));
            if (mode == ColorMatchingMode.STRICT ? diff != 0 : diff > LOOSE_COLOR_TOLERANCE) {
                return false;
            }
        }
        return true;
    }

    /**
     * 字号容差以第一个片段的字号为基准，因此该比较不对称。
     */
    public static boolean hasSameStyle(TextRun t1, TextRun t2, SpatialGroupingOptions options) {
        if (!normalizeFontName(t1.getFontName()).equals(normalizeFontName(t2.getFontName()))) {
            return false;
        }

        double sizeDiff = Math.abs(t1.getFontSize() - t2.getFontSize());
        if (sizeDiff > t1.getFontSize() * options.getFontSizeToleranceRatio()) {
            return false;
        }

        if (options.getColorMatching() != ColorMatchingMode.NONE) {
            return hasSameColor(t1.getFillColor(), t2.getFillColor(), options.getColorMatching());
        }
        return true;
    }
}

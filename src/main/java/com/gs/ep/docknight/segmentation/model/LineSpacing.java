package com.gs.ep.docknight.segmentation.model;

/**
 * 段落与下一段落之间的行距信息，供下游导出器还原行高。
 */
public final class LineSpacing {

    private final double baselineDistance;
    private final double fontSize;

    public LineSpacing(double baselineDistance, double fontSize) {
        this.baselineDistance = baselineDistance;
        this.fontSize = fontSize;
    }

    /** Distance from this paragraph's baseline down to the next paragraph's baseline. */
    public double getBaselineDistance() {
        return baselineDistance;
    }

    public double getFontSize() {
        return fontSize;
    }

    /** Line height expressed as a multiple of the font size. */
    public double getRatio() {
        return baselineDistance / fontSize;
    }

    @Override
    public String toString() {
        return "LineSpacing{baselineDistance=" + baselineDistance + ", fontSize=" + fontSize + "}";
    }
}

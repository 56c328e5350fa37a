package com.gs.ep.docknight.segmentation.model;

/**
 * Vertical font metrics in 1/1000 em units.
 */
public final class FontMetrics {

    private final double ascender;
    private final double descender;

    public FontMetrics(double ascender, double descender) {
        this.ascender = ascender;
        this.descender = descender;
    }

    public double getAscender() {
        return ascender;
    }

    /** Usually negative (below the baseline). */
    public double getDescender() {
        return descender;
    }

    @Override
    public String toString() {
        return "FontMetrics{ascender=" + ascender + ", descender=" + descender + "}";
    }
}

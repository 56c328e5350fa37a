package com.gs.ep.docknight.segmentation.model;

import org.eclipse.collections.api.list.ListIterable;

/**
 * Axis-aligned rectangle in page space (bottom-left origin, Y up).
 */
public final class TextBounds {

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public TextBounds(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    /**
     * 合并多个矩形的外包框。
     *
     * @throws IllegalArgumentException if the list is empty
     */
    public static TextBounds union(ListIterable<TextBounds> boundsList) {
        if (boundsList.isEmpty()) {
            throw new IllegalArgumentException("union requires at least one bounds");
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        for (TextBounds b : boundsList) {
            minX = Math.min(minX, b.x);
            minY = Math.min(minY, b.y);
            maxX = Math.max(maxX, b.getRight());
            maxY = Math.max(maxY, b.getTop());
        }
        return new TextBounds(minX, minY, maxX - minX, maxY - minY);
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getRight() {
        return x + width;
    }

    public double getTop() {
        return y + height;
    }

    public double getCenterX() {
        return x + width / 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TextBounds)) {
            return false;
        }
        TextBounds that = (TextBounds) o;
        return Double.compare(x, that.x) == 0
                && Double.compare(y, that.y) == 0
                && Double.compare(width, that.width) == 0
                && Double.compare(height, that.height) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(x);
        result = 31 * result + Double.hashCode(y);
        result = 31 * result + Double.hashCode(width);
        result = 31 * result + Double.hashCode(height);
        return result;
    }

    @Override
    public String toString() {
        return "TextBounds{x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "}";
    }
}

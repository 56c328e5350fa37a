package com.gs.ep.docknight.segmentation.model;

/**
 * 阻断区域：来自页面矢量图形（矩形、分隔线、图片）的轴对齐矩形。
 *
 * <p>A zone lying strictly between two candidates separates them. A zone that
 * encloses both candidates is a container (a background panel) and never blocks.</p>
 */
public final class BlockingZone {

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public BlockingZone(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
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

    @Override
    public String toString() {
        return "BlockingZone{x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "}";
    }
}

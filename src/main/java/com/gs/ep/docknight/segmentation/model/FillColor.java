package com.gs.ep.docknight.segmentation.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * 文本填充色：颜色空间名 + 分量值（0..1）。
 */
public final class FillColor {

    public static final FillColor BLACK = new FillColor("DeviceGray", 0.0);

    private final String colorSpace;
    private final double[] components;

    public FillColor(String colorSpace, double... components) {
        this.colorSpace = Objects.requireNonNull(colorSpace, "colorSpace");
        this.components = components.clone();
    }

    public static FillColor rgb(double r, double g, double b) {
        return new FillColor("DeviceRGB", r, g, b);
    }

    public String getColorSpace() {
        return colorSpace;
    }

    public int getComponentCount() {
        return components.length;
    }

    public double getComponent(int index) {
        return components[index];
    }

    public double[] getComponents() {
        return components.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FillColor)) {
            return false;
        }
        FillColor that = (FillColor) o;
        return colorSpace.equals(that.colorSpace) && Arrays.equals(components, that.components);
    }

    @Override
    public int hashCode() {
        return 31 * colorSpace.hashCode() + Arrays.hashCode(components);
    }

    @Override
    public String toString() {
        return colorSpace + Arrays.toString(components);
    }
}

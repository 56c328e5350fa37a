package com.gs.ep.docknight.segmentation;

/**
 * 颜色匹配方式
 */
public enum ColorMatchingMode {

    /**
     * 忽略颜色
     */
    NONE("none"),

    /**
     * 每个分量允许 0.05 的误差
     */
    LOOSE("loose"),

    /**
     * 分量必须完全相同
     */
    STRICT("strict");

    private final String value;

    ColorMatchingMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ColorMatchingMode fromValue(String value) {
        for (ColorMatchingMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown color matching mode: " + value);
    }
}

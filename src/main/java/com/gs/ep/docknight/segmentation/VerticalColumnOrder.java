package com.gs.ep.docknight.segmentation;

/**
 * Reading order of columns in vertical writing mode.
 */
public enum VerticalColumnOrder {
    RIGHT_TO_LEFT("right-to-left"),
    LEFT_TO_RIGHT("left-to-right");

    private final String value;

    VerticalColumnOrder(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static VerticalColumnOrder fromValue(String value) {
        for (VerticalColumnOrder order : values()) {
            if (order.value.equalsIgnoreCase(value.trim())) {
                return order;
            }
        }
        throw new IllegalArgumentException("Unknown vertical column order: " + value);
    }
}

package com.gs.ep.docknight.segmentation;

import com.gs.ep.docknight.segmentation.model.InlineDirection;

/**
 * Inline direction setting for horizontal mode: detect from script, or force one.
 */
public enum InlineDirectionMode {
    AUTO("auto"),
    LTR("ltr"),
    RTL("rtl");

    private final String value;

    InlineDirectionMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return the forced direction, or {@code null} for {@link #AUTO}
     */
    public InlineDirection forcedDirection() {
        switch (this) {
            case LTR:
                return InlineDirection.LTR;
            case RTL:
                return InlineDirection.RTL;
            case AUTO:
            default:
                return null;
        }
    }

    public static InlineDirectionMode fromValue(String value) {
        for (InlineDirectionMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown inline direction: " + value);
    }
}

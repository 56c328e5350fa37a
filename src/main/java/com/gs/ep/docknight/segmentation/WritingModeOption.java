package com.gs.ep.docknight.segmentation;

import com.gs.ep.docknight.segmentation.model.WritingMode;

/**
 * 书写模式配置：自动检测或强制指定
 */
public enum WritingModeOption {
    AUTO("auto"),
    HORIZONTAL("horizontal"),
    VERTICAL("vertical");

    private final String value;

    WritingModeOption(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return the forced mode, or {@code null} for {@link #AUTO}
     */
    public WritingMode forcedMode() {
        switch (this) {
            case HORIZONTAL:
                return WritingMode.HORIZONTAL;
            case VERTICAL:
                return WritingMode.VERTICAL;
            case AUTO:
            default:
                return null;
        }
    }

    public static WritingModeOption fromValue(String value) {
        for (WritingModeOption option : values()) {
            if (option.value.equalsIgnoreCase(value.trim())) {
                return option;
            }
        }
        throw new IllegalArgumentException("Unknown writing mode: " + value);
    }
}

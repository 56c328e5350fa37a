package com.gs.ep.docknight.segmentation.model;

/**
 * Horizontal alignment inferred for a block from its paragraph edges.
 */
public enum ParagraphAlignment {
    LEFT("left"),
    CENTER("center"),
    RIGHT("right"),
    UNKNOWN("unknown");

    private final String value;

    ParagraphAlignment(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}

package com.gs.ep.docknight.segmentation.context;

import java.util.Objects;

/**
 * 参与上下文分段的单元：一段文本及其携带的任意载荷。
 *
 * @param <T> payload type
 */
public final class SegmentationUnit<T> {

    private final String text;
    private final T value;

    public SegmentationUnit(String text, T value) {
        this.text = Objects.requireNonNull(text, "text");
        this.value = value;
    }

    public static <T> SegmentationUnit<T> of(String text, T value) {
        return new SegmentationUnit<>(text, value);
    }

    public String getText() {
        return text;
    }

    public T getValue() {
        return value;
    }

    SegmentationUnit<T> withText(String newText) {
        return new SegmentationUnit<>(newText, value);
    }

    @Override
    public String toString() {
        return "SegmentationUnit{text='" + text + "'}";
    }
}

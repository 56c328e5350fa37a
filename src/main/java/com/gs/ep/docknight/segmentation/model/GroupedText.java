package com.gs.ep.docknight.segmentation.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * 文本块：一个或多个段落组成的语义单元，是空间分组的输出单位。
 */
public final class GroupedText {

    private final TextBounds bounds;
    private final ImmutableList<GroupedParagraph> paragraphs;
    private final LayoutInference layoutInference;

    /**
     * @throws IllegalArgumentException if {@code paragraphs} is empty
     */
    public GroupedText(TextBounds bounds, ListIterable<GroupedParagraph> paragraphs, LayoutInference layoutInference) {
        if (paragraphs.isEmpty()) {
            throw new IllegalArgumentException("Cannot create block from empty paragraphs");
        }
        this.bounds = Objects.requireNonNull(bounds, "bounds");
        this.paragraphs = Lists.immutable.withAll(paragraphs);
        this.layoutInference = layoutInference;
    }

    public TextBounds getBounds() {
        return bounds;
    }

    public ImmutableList<GroupedParagraph> getParagraphs() {
        return paragraphs;
    }

    /**
     * @return inferred layout, or {@code null} when none was computed
     */
    public LayoutInference getLayoutInference() {
        return layoutInference;
    }

    public ImmutableList<TextRun> getRuns() {
        return paragraphs.flatCollect(GroupedParagraph::getRuns);
    }

    public String getText() {
        return paragraphs.collect(GroupedParagraph::getText).makeString("\n");
    }

    @Override
    public String toString() {
        return "GroupedText{bounds=" + bounds + ", paragraphs=" + paragraphs.size() + "}";
    }
}

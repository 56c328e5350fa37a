package com.gs.ep.docknight.segmentation.context;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

/**
 * 一段连续合并的单元。单元文本已规整，{@code text} 以换行连接。
 */
public final class ContextualSegment<T> {

    private final int startIndex;
    private final int endIndex;
    private final ImmutableList<SegmentationUnit<T>> units;
    private final String text;

    public ContextualSegment(int startIndex, int endIndex, ListIterable<SegmentationUnit<T>> units) {
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.units = Lists.immutable.withAll(units);
        this.text = this.units.collect(SegmentationUnit::getText).makeString("\n");
    }

    /**
     * @return input index of the first unit (inclusive)
     */
    public int getStartIndex() {
        return startIndex;
    }

    /**
     * @return input index of the last unit (inclusive)
     */
    public int getEndIndex() {
        return endIndex;
    }

    public ImmutableList<SegmentationUnit<T>> getUnits() {
        return units;
    }

    public ImmutableList<T> getValues() {
        return units.collect(SegmentationUnit::getValue);
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "ContextualSegment{" + startIndex + ".." + endIndex + ", units=" + units.size() + "}";
    }
}

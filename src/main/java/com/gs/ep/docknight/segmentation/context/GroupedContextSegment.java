package com.gs.ep.docknight.segmentation.context;

import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.TextBounds;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

/**
 * 由若干相邻文本块合并而成的上下文段落
 */
public final class GroupedContextSegment {

    private final int startGroupIndex;
    private final int endGroupIndex;
    private final ImmutableList<GroupedText> groups;
    private final String text;
    private final TextBounds bounds;

    public GroupedContextSegment(int startGroupIndex, int endGroupIndex, ListIterable<GroupedText> groups,
                                 String text, TextBounds bounds) {
        this.startGroupIndex = startGroupIndex;
        this.endGroupIndex = endGroupIndex;
        this.groups = Lists.immutable.withAll(groups);
        this.text = text;
        this.bounds = bounds;
    }

    public int getStartGroupIndex() {
        return startGroupIndex;
    }

    public int getEndGroupIndex() {
        return endGroupIndex;
    }

    public ImmutableList<GroupedText> getGroups() {
        return groups;
    }

    /**
     * 每个块的规整文本，以换行连接
     */
    public String getText() {
        return text;
    }

    /**
     * @return union of the member blocks' bounds
     */
    public TextBounds getBounds() {
        return bounds;
    }

    @Override
    public String toString() {
        return "GroupedContextSegment{" + startGroupIndex + ".." + endGroupIndex + ", bounds=" + bounds + "}";
    }
}

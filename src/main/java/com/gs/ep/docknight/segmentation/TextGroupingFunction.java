package com.gs.ep.docknight.segmentation;

import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.GroupingContext;
import com.gs.ep.docknight.segmentation.model.TextRun;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;

/**
 * 文本分组函数：一页的文本片段 → 有序文本块列表。
 *
 * <p>Implementations must be pure: identical input yields identical output, and
 * no state is shared between calls.</p>
 */
@FunctionalInterface
public interface TextGroupingFunction {

    ImmutableList<GroupedText> group(ListIterable<TextRun> runs, GroupingContext context);
}

package com.gs.ep.docknight.segmentation;

import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.GroupingContext;
import com.gs.ep.docknight.segmentation.model.TextRun;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 文本分组策略的抽象基类
 *
 * 遵循模板方法模式：空输入处理与从上到下的初始排序在这里完成，
 * 具体的聚类步骤延迟到子类实现。
 */
public abstract class AbstractTextGroupingStrategy implements TextGroupingStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractTextGroupingStrategy.class);

    protected final SpatialGroupingOptions options;

    protected AbstractTextGroupingStrategy(SpatialGroupingOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    // ==================== 模板方法 ====================

    @Override
    public ImmutableList<GroupedText> group(ListIterable<TextRun> runs, GroupingContext context) {
        Objects.requireNonNull(runs, "runs");
        if (runs.isEmpty()) {
            return Lists.immutable.empty();
        }
        GroupingContext ctx = context == null ? GroupingContext.EMPTY : context;

        // 1. 从上到下排序（PDF 坐标 y 向上，降序即从上到下）
        MutableList<TextRun> sorted = sortTopToBottom(runs);

        // 2. 聚类成块（子类实现）
        MutableList<GroupedText> blocks = groupSortedRuns(sorted, ctx);

        LOGGER.debug("{} strategy grouped {} runs into {} blocks",
                getWritingMode().name().toLowerCase(), runs.size(), blocks.size());
        return blocks.toImmutable();
    }

    /**
     * @param sorted runs ordered by descending {@code y}
     */
    protected abstract MutableList<GroupedText> groupSortedRuns(MutableList<TextRun> sorted, GroupingContext context);

    @Override
    public SpatialGroupingOptions getOptions() {
        return options;
    }

    // ==================== 公共工具方法 ====================

    static MutableList<TextRun> sortTopToBottom(ListIterable<TextRun> runs) {
        return Lists.mutable.withAll(runs).sortThis((a, b) -> Double.compare(b.getY(), a.getY()));
    }
}

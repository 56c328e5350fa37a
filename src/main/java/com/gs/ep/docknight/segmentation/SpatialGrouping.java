package com.gs.ep.docknight.segmentation;

import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.GroupingContext;
import com.gs.ep.docknight.segmentation.model.TextRun;
import com.gs.ep.docknight.segmentation.model.WritingMode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 空间分组入口
 *
 * 用法：
 * <pre>
 * SpatialGrouping grouping = SpatialGrouping.create(SpatialGroupingOptions.builder()
 *         .verticalGapRatio(1.0)
 *         .build());
 * ImmutableList&lt;GroupedText&gt; blocks = grouping.group(runs, GroupingContext.ofPage(612, 792));
 * </pre>
 */
public final class SpatialGrouping implements TextGroupingFunction {

    private static final Logger LOGGER = LoggerFactory.getLogger(SpatialGrouping.class);

    private static final SpatialGrouping DEFAULT = new SpatialGrouping(SpatialGroupingOptions.defaults());

    private final SpatialGroupingOptions options;
    private final TextGroupingStrategyFactory strategyFactory;

    private SpatialGrouping(SpatialGroupingOptions options) {
        this.options = options;
        this.strategyFactory = new TextGroupingStrategyFactory(options);
    }

    public static SpatialGrouping create(SpatialGroupingOptions options) {
        return new SpatialGrouping(options);
    }

    public static SpatialGrouping withDefaults() {
        return DEFAULT;
    }

    public SpatialGroupingOptions getOptions() {
        return options;
    }

    public ImmutableList<GroupedText> group(ListIterable<TextRun> runs) {
        return group(runs, GroupingContext.EMPTY);
    }

    @Override
    public ImmutableList<GroupedText> group(ListIterable<TextRun> runs, GroupingContext context) {
        if (runs.isEmpty()) {
            return Lists.immutable.empty();
        }
        TextGroupingStrategy strategy = strategyFactory.createStrategy(runs);
        LOGGER.debug("Resolved writing mode {} for {} runs", strategy.getWritingMode(), runs.size());
        return strategy.group(runs, context);
    }

    public WritingMode detectWritingMode(ListIterable<TextRun> runs) {
        return strategyFactory.detectWritingMode(runs);
    }
}

package com.gs.ep.docknight.segmentation.strategy;

import com.gs.ep.docknight.segmentation.AbstractTextGroupingStrategy;
import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.geometry.VerticalClusterer;
import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.GroupingContext;
import com.gs.ep.docknight.segmentation.model.TextRun;
import com.gs.ep.docknight.segmentation.model.WritingMode;
import org.eclipse.collections.api.list.MutableList;

/**
 * 竖排策略
 *
 * 特点：
 * - 按中心 x 聚成列，列的顺序默认从右到左（可配置）
 * - 列内按垂直间距、样式、阻断区域拆分段落
 * - 每列一个块，不再跨列合并
 */
public class VerticalGroupingStrategy extends AbstractTextGroupingStrategy {

    public VerticalGroupingStrategy(SpatialGroupingOptions options) {
        super(options);
    }

    @Override
    public WritingMode getWritingMode() {
        return WritingMode.VERTICAL;
    }

    @Override
    protected MutableList<GroupedText> groupSortedRuns(MutableList<TextRun> sorted, GroupingContext context) {
        return VerticalClusterer.groupVerticalRuns(sorted, options, context.getBlockingZones());
    }
}

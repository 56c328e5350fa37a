package com.gs.ep.docknight.segmentation.strategy;

import com.gs.ep.docknight.segmentation.AbstractTextGroupingStrategy;
import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.geometry.BlockMerger;
import com.gs.ep.docknight.segmentation.geometry.LineClusterer;
import com.gs.ep.docknight.segmentation.model.BlockingZone;
import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.GroupingContext;
import com.gs.ep.docknight.segmentation.model.TextRun;
import com.gs.ep.docknight.segmentation.model.WritingMode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

/**
 * 横排策略
 *
 * 特点：
 * - 按基线聚类成行，行内按间距（及可选的页面分栏）切分段落
 * - 段落按垂直间距、样式、阻断区域合并成块
 * - 启用分栏时各栏独立合并，避免并排的两栏被合成一块
 */
public class HorizontalGroupingStrategy extends AbstractTextGroupingStrategy {

    public HorizontalGroupingStrategy(SpatialGroupingOptions options) {
        super(options);
    }

    @Override
    public WritingMode getWritingMode() {
        return WritingMode.HORIZONTAL;
    }

    @Override
    protected MutableList<GroupedText> groupSortedRuns(MutableList<TextRun> sorted, GroupingContext context) {
        ImmutableList<BlockingZone> zones = context.getBlockingZones();
        Double pageWidth = context.getPageWidth();

        if (options.isEnableColumnSeparation()) {
            MutableList<GroupedParagraph> lines = LineClusterer.groupIntoLinesWithColumns(sorted, options, zones, pageWidth);
            return BlockMerger.mergeAdjacentLinesWithColumns(lines, options, zones, pageWidth);
        }
        MutableList<GroupedParagraph> lines = LineClusterer.groupIntoLines(sorted, options, zones);
        return BlockMerger.mergeAdjacentLines(lines, options, zones);
    }
}

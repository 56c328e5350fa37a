package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.VerticalColumnOrder;
import com.gs.ep.docknight.segmentation.model.BlockingZone;
import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.TextRun;
import com.gs.ep.docknight.segmentation.model.WritingMode;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * 竖排聚类：按中心 x 聚成列，列内按垂直间距、样式与阻断区域拆分段落。
 * 每一列输出一个文本块。
 */
public final class VerticalClusterer {

    private static final double MIN_COLUMN_TOLERANCE = 2;
    private static final double FONT_SIZE_TOLERANCE_FACTOR = 0.9;

    private VerticalClusterer() {
    }

    private static final class VerticalColumn {
        final MutableList<TextRun> runs = Lists.mutable.empty();
        double meanX;
        double meanWidth;
        double meanFontSize;

        VerticalColumn(TextRun first) {
            runs.add(first);
            meanX = first.getCenterX();
            meanWidth = first.getWidth();
            meanFontSize = first.getFontSize();
        }

        double tolerance(TextRun run) {
            return Math.max(MIN_COLUMN_TOLERANCE,
                    Math.max(meanWidth, Math.max(run.getWidth(), meanFontSize * FONT_SIZE_TOLERANCE_FACTOR)));
        }

        void add(TextRun run) {
            runs.add(run);
            int n = runs.size();
            meanX += (run.getCenterX() - meanX) / n;
            meanWidth += (run.getWidth() - meanWidth) / n;
            meanFontSize += (run.getFontSize() - meanFontSize) / n;
        }
    }

    /**
     * 最近列搜索：片段加入中心距离在容差内且最近的列，否则新建一列。
     */
    public static MutableList<MutableList<TextRun>> clusterIntoColumns(ListIterable<TextRun> runs,
                                                                       SpatialGroupingOptions options) {
        MutableList<VerticalColumn> columns = Lists.mutable.empty();
        MutableList<TextRun> sorted = Lists.mutable.withAll(runs)
                .sortThis((a, b) -> Double.compare(b.getCenterX(), a.getCenterX()));

        for (TextRun run : sorted) {
            double cx = run.getCenterX();
            VerticalColumn target = null;
            double targetDist = Double.POSITIVE_INFINITY;
            for (VerticalColumn column : columns) {
                double distance = Math.abs(cx - column.meanX);
                if (distance > column.tolerance(run) || distance >= targetDist) {
                    continue;
                }
                targetDist = distance;
                target = column;
            }
            if (target == null) {
                columns.add(new VerticalColumn(run));
            } else {
                target.add(run);
            }
        }

        if (options.getVerticalColumnOrder() == VerticalColumnOrder.LEFT_TO_RIGHT) {
            columns.sortThis((a, b) -> Double.compare(a.meanX, b.meanX));
        } else {
            columns.sortThis((a, b) -> Double.compare(b.meanX, a.meanX));
        }
        return columns.collect(c -> c.runs);
    }

    /**
     * 列内从上到下扫描，间距过大、样式不同或被阻断时开始新段落。
     */
    public static MutableList<GroupedParagraph> splitColumnIntoParagraphs(ListIterable<TextRun> columnRuns,
                                                                          SpatialGroupingOptions options,
                                                                          ListIterable<BlockingZone> zones) {
        MutableList<GroupedParagraph> paragraphs = Lists.mutable.empty();
        if (columnRuns.isEmpty()) {
            return paragraphs;
        }
        MutableList<TextRun> sorted = Lists.mutable.withAll(columnRuns)
                .sortThis((a, b) -> Double.compare(b.getCenterY(), a.getCenterY()));
        MutableList<TextRun> current = Lists.mutable.of(sorted.getFirst());

        for (int i = 1; i < sorted.size(); i++) {
            TextRun prev = sorted.get(i - 1);
            TextRun curr = sorted.get(i);
            double gap = prev.getY() - curr.getTop();
            double maxGap = Math.max(prev.getHeight(), curr.getHeight()) * options.getVerticalGapRatio();
            boolean sameParagraph = !BlockingZones.isBlockedBetweenVerticalRuns(prev, curr, zones)
                    && StyleMatcher.hasSameStyle(prev, curr, options)
                    && gap <= maxGap;
            if (sameParagraph) {
                current.add(curr);
            } else {
                paragraphs.add(ParagraphFactory.createVerticalParagraph(current));
                current = Lists.mutable.of(curr);
            }
        }
        paragraphs.add(ParagraphFactory.createVerticalParagraph(current));
        return paragraphs;
    }

    /**
     * 竖排分组入口：每列一个块，保持列顺序。
     */
    public static MutableList<GroupedText> groupVerticalRuns(ListIterable<TextRun> runs,
                                                             SpatialGroupingOptions options,
                                                             ListIterable<BlockingZone> zones) {
        MutableList<GroupedText> blocks = Lists.mutable.empty();
        for (MutableList<TextRun> column : clusterIntoColumns(runs, options)) {
            MutableList<GroupedParagraph> paragraphs = splitColumnIntoParagraphs(column, options, zones);
            if (!paragraphs.isEmpty()) {
                blocks.add(BlockFactory.createGroupedText(paragraphs, WritingMode.VERTICAL));
            }
        }
        return blocks;
    }
}

package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.model.BlockingZone;
import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.TextRun;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableDoubleList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * 横排行聚类与行内切分
 *
 * 1. 按基线把片段聚成物理行
 * 2. 行内按间距切分：相邻切分（期望字距）或分栏切分（自适应阈值）
 * 3. 可选：按页面级分栏把宽行拆到各栏
 */
public final class LineClusterer {

    private static final Logger LOGGER = LoggerFactory.getLogger(LineClusterer.class);

    private static final double MIN_BASELINE_TOLERANCE = 0.5;
    private static final double MIN_VERTICAL_OVERLAP_RATIO = 0.15;
    private static final double ADAPTIVE_SPACE_MULTIPLIER = 3.5;
    private static final double STRONG_GUTTER_THRESHOLD_FACTOR = 1.8;
    private static final double STRONG_GUTTER_FONT_FACTOR = 6.0;
    private static final double PAGE_COLUMN_MIN_LINE_WIDTH_RATIO = 0.25;
    private static final double DEFAULT_FONT_SIZE = 12;

    private LineClusterer() {
    }

    // ==================== 行聚类 ====================

    /**
     * 基线聚类状态：当前行的成员与各项滑动均值
     */
    private static final class LineCluster {
        final MutableList<TextRun> runs = Lists.mutable.empty();
        double meanBaseline;
        double meanFontSize;
        double meanBottom;
        double meanTop;

        LineCluster(TextRun first, double baseline) {
            runs.add(first);
            meanBaseline = baseline;
            meanFontSize = first.getFontSize();
            meanBottom = first.getY();
            meanTop = first.getTop();
        }

        boolean accepts(TextRun run, double baseline, double lineToleranceRatio) {
            double refSize = Math.max(meanFontSize, run.getFontSize());
            double tolerance = Math.max(MIN_BASELINE_TOLERANCE, refSize * lineToleranceRatio);
            boolean baselineNear = Math.abs(baseline - meanBaseline) <= tolerance;

            // 仅靠基线容易把相邻但不同的行合并（如拉丁字母与 CJK 交错），额外要求字形框有足够的垂直重叠
            double overlap = GeometryUtils.overlap1D(run.getY(), run.getTop(), meanBottom, meanTop);
            double denom = Math.min(Math.max(1e-6, run.getHeight()), Math.max(1e-6, meanTop - meanBottom));
            return baselineNear && overlap / denom >= MIN_VERTICAL_OVERLAP_RATIO;
        }

        void add(TextRun run, double baseline) {
            runs.add(run);
            int n = runs.size();
            meanBaseline += (baseline - meanBaseline) / n;
            meanFontSize += (run.getFontSize() - meanFontSize) / n;
            meanBottom += (run.getY() - meanBottom) / n;
            meanTop += (run.getTop() - meanTop) / n;
        }
    }

    /**
     * 按基线从上到下聚类成行。
     */
    public static MutableList<MutableList<TextRun>> clusterIntoLines(ListIterable<TextRun> runs,
                                                                     SpatialGroupingOptions options) {
        MutableList<MutableList<TextRun>> clusters = Lists.mutable.empty();
        if (runs.isEmpty()) {
            return clusters;
        }

        MutableList<TextRun> byBaseline = Lists.mutable.withAll(runs)
                .sortThis((a, b) -> Double.compare(b.getBaselineY(), a.getBaselineY()));

        LineCluster current = null;
        for (TextRun run : byBaseline) {
            double baseline = run.getBaselineY();
            if (current == null) {
                current = new LineCluster(run, baseline);
            } else if (current.accepts(run, baseline, options.getLineToleranceRatio())) {
                current.add(run, baseline);
            } else {
                clusters.add(current.runs);
                current = new LineCluster(run, baseline);
            }
        }
        clusters.add(current.runs);
        return clusters;
    }

    // ==================== 行内切分 ====================

    /**
     * 从行内正间距分布估算"空格级"间距阈值。
     */
    public static double estimateSpaceGapThreshold(MutableDoubleList gaps, double fontSize) {
        MutableDoubleList positive = gaps.select(g -> g > 0);
        if (positive.size() < 3) {
            return fontSize * 0.33;
        }
        double q25 = GeometryUtils.quantile(positive, 0.25);
        double q50 = GeometryUtils.quantile(positive, 0.5);
        double q75 = GeometryUtils.quantile(positive, 0.75);

        if (q75 > q25 * 2.5) {
            return (q25 + q75) / 2;
        }
        return Math.max(q50 * 1.7, Math.max(q75 * 0.9, fontSize * 0.33));
    }

    /**
     * 相邻切分：间距超过期望字距 * horizontalGapRatio，或被阻断区域隔开时切开。
     * 行内的样式变化不切分。
     */
    public static MutableList<MutableList<TextRun>> splitIntoAdjacentGroups(ListIterable<TextRun> runs,
                                                                            SpatialGroupingOptions options,
                                                                            ListIterable<BlockingZone> zones) {
        MutableList<MutableList<TextRun>> groups = Lists.mutable.empty();
        if (runs.isEmpty()) {
            return groups;
        }

        MutableList<TextRun> sorted = Lists.mutable.withAll(runs)
                .sortThis((a, b) -> Double.compare(a.getX(), b.getX()));
        MutableList<TextRun> current = Lists.mutable.of(sorted.getFirst());

        for (int i = 1; i < sorted.size(); i++) {
            TextRun prev = current.getLast();
            TextRun curr = sorted.get(i);
            double gap = RunMetrics.gapBetween(prev, curr);
            double maxGap = RunMetrics.expectedGap(prev, curr) * options.getHorizontalGapRatio();
            boolean blocked = BlockingZones.isBlockedBetweenRuns(prev, curr, zones);

            if (blocked || gap > maxGap) {
                groups.add(current);
                current = Lists.mutable.of(curr);
            } else {
                current.add(curr);
            }
        }
        groups.add(current);
        return groups;
    }

    /**
     * 分栏切分：混合阈值 max(平均字宽 * columnGapRatio, 3.5 * 自适应空格阈值)。
     *
     * <p>只有两个片段的行默认不切分，除非被阻断或间距明显是栏间距。</p>
     */
    public static MutableList<MutableList<TextRun>> splitIntoColumnGroups(ListIterable<TextRun> runs,
                                                                          SpatialGroupingOptions options,
                                                                          ListIterable<BlockingZone> zones) {
        MutableList<MutableList<TextRun>> groups = Lists.mutable.empty();
        if (runs.isEmpty()) {
            return groups;
        }
        MutableList<TextRun> sorted = Lists.mutable.withAll(runs)
                .sortThis((a, b) -> Double.compare(a.getX(), b.getX()));
        if (sorted.size() == 1) {
            groups.add(sorted);
            return groups;
        }

        double fontSize = GeometryUtils.median(sorted.collectDouble(TextRun::getFontSize));
        if (fontSize == 0) {
            fontSize = DEFAULT_FONT_SIZE;
        }

        MutableDoubleList gaps = new DoubleArrayList();
        MutableDoubleList charWidths = new DoubleArrayList();
        for (int i = 1; i < sorted.size(); i++) {
            TextRun prev = sorted.get(i - 1);
            TextRun curr = sorted.get(i);
            gaps.add(RunMetrics.gapBetween(prev, curr));
            charWidths.add((RunMetrics.estimateCharWidth(prev) + RunMetrics.estimateCharWidth(curr)) / 2);
        }

        double avgCharWidth = GeometryUtils.median(charWidths);
        if (avgCharWidth == 0) {
            avgCharWidth = fontSize * 0.5;
        }
        double fixedThreshold = avgCharWidth * options.getColumnGapRatio();
        double adaptiveThreshold = estimateSpaceGapThreshold(gaps, fontSize) * ADAPTIVE_SPACE_MULTIPLIER;
        double columnGapThreshold = Math.max(fixedThreshold, adaptiveThreshold);

        if (sorted.size() == 2) {
            TextRun prev = sorted.get(0);
            TextRun curr = sorted.get(1);
            boolean blocked = BlockingZones.isBlockedBetweenRuns(prev, curr, zones);
            double strongGutter = Math.max(columnGapThreshold * STRONG_GUTTER_THRESHOLD_FACTOR,
                    fontSize * STRONG_GUTTER_FONT_FACTOR);
            if (!blocked && RunMetrics.gapBetween(prev, curr) <= strongGutter) {
                groups.add(sorted);
                return groups;
            }
        }

        MutableList<TextRun> current = Lists.mutable.of(sorted.getFirst());
        for (int i = 1; i < sorted.size(); i++) {
            TextRun prev = sorted.get(i - 1);
            TextRun curr = sorted.get(i);
            double gap = RunMetrics.gapBetween(prev, curr);
            if (gap > columnGapThreshold || BlockingZones.isBlockedBetweenRuns(prev, curr, zones)) {
                groups.add(current);
                current = Lists.mutable.of(curr);
            } else {
                current.add(curr);
            }
        }
        groups.add(current);
        return groups;
    }

    // ==================== 行 → 段落 ====================

    /**
     * 行聚类 + 分栏切分。页面宽度已知且启用页面分栏检测时，足够宽的行先按栏分桶。
     */
    public static MutableList<GroupedParagraph> groupIntoLinesWithColumns(ListIterable<TextRun> runs,
                                                                          SpatialGroupingOptions options,
                                                                          ListIterable<BlockingZone> zones,
                                                                          Double pageWidth) {
        MutableList<MutableList<TextRun>> lines = clusterIntoLines(runs, options);
        MutableList<GroupedParagraph> paragraphs = Lists.mutable.empty();

        MutableList<PageColumnDetector.ColumnInterval> pageIntervals = Lists.mutable.empty();
        if (options.isEnablePageColumnDetection() && pageWidth != null && pageWidth > 0) {
            MutableList<PageColumnDetector.XRange> ranges = Lists.mutable.empty();
            for (TextRun run : runs) {
                ranges.add(new PageColumnDetector.XRange(run.getX(), run.getRight(), run.getHeight()));
            }
            pageIntervals = PageColumnDetector.detectPageColumns(ranges, pageWidth, options);
        }

        for (MutableList<TextRun> line : lines) {
            if (!shouldUsePageIntervals(line, pageIntervals, pageWidth)) {
                for (MutableList<TextRun> group : splitIntoColumnGroups(line, options, zones)) {
                    paragraphs.add(ParagraphFactory.createParagraph(group, options));
                }
                continue;
            }

            Map<Integer, MutableList<TextRun>> byColumn = new TreeMap<>();
            for (TextRun run : line) {
                int column = PageColumnDetector.assignToColumn(run.getX(), run.getRight(), pageIntervals,
                        pageWidth, options);
                byColumn.computeIfAbsent(column, k -> Lists.mutable.empty()).add(run);
            }
            for (MutableList<TextRun> columnRuns : byColumn.values()) {
                for (MutableList<TextRun> group : splitIntoColumnGroups(columnRuns, options, zones)) {
                    for (MutableList<TextRun> segment : splitIntoAdjacentGroups(group, options, zones)) {
                        paragraphs.add(ParagraphFactory.createParagraph(segment, options));
                    }
                }
            }
        }

        LOGGER.debug("Grouped {} runs into {} lines / {} paragraphs (page columns: {})",
                runs.size(), lines.size(), paragraphs.size(), pageIntervals.size());
        return paragraphs;
    }

    /**
     * 行聚类 + 相邻切分，不推断分栏，但仍遵守阻断区域。
     */
    public static MutableList<GroupedParagraph> groupIntoLines(ListIterable<TextRun> runs,
                                                               SpatialGroupingOptions options,
                                                               ListIterable<BlockingZone> zones) {
        MutableList<GroupedParagraph> paragraphs = Lists.mutable.empty();
        for (MutableList<TextRun> line : clusterIntoLines(runs, options)) {
            for (MutableList<TextRun> group : splitIntoAdjacentGroups(line, options, zones)) {
                paragraphs.add(ParagraphFactory.createParagraph(group, options));
            }
        }
        return paragraphs;
    }

    /**
     * 窄行（如跨栏的图注小标签）不按页面分栏拆分。
     */
    private static boolean shouldUsePageIntervals(ListIterable<TextRun> line,
                                                  ListIterable<PageColumnDetector.ColumnInterval> pageIntervals,
                                                  Double pageWidth) {
        if (pageIntervals.isEmpty() || pageWidth == null || pageWidth <= 0) {
            return false;
        }
        double minX = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        for (TextRun run : line) {
            minX = Math.min(minX, run.getX());
            maxX = Math.max(maxX, run.getRight());
        }
        return maxX - minX >= pageWidth * PAGE_COLUMN_MIN_LINE_WIDTH_RATIO;
    }
}

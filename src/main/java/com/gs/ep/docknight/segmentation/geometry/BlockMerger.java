package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.model.BlockingZone;
import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.TextBounds;
import com.gs.ep.docknight.segmentation.model.TextRun;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * 行合并成块
 *
 * 相邻两行满足以下条件时合并：
 * 1. 基线严格下降
 * 2. 没有阻断区域隔开（容器区域除外）
 * 3. 垂直间距不超过 lineHeight * verticalGapRatio
 * 4. 样式相同，或满足"样式切换"例外（正文行宽度相近、对齐、间距紧凑）
 */
public final class BlockMerger {

    private static final Logger LOGGER = LoggerFactory.getLogger(BlockMerger.class);

    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");

    private static final double MIN_COLUMN_OVERLAP_RATIO = 0.05;
    private static final double STYLE_SHIFT_MIN_WIDTH_RATIO = 0.55;
    private static final double STYLE_SHIFT_MIN_OVERLAP_RATIO = 0.18;
    private static final double STYLE_SHIFT_TIGHT_GAP_RATIO = 0.55;
    private static final double BODY_LINE_MIN_EXTENT_RATIO = 6.5;
    private static final int BODY_LINE_MIN_CHARS = 10;
    private static final double MIN_ANCHOR_TOLERANCE = 0.8;
    private static final double ANCHOR_TOLERANCE_RATIO = 0.85;
    private static final double CENTER_ANCHOR_FACTOR = 0.75;
    private static final double SAME_ROW_TOLERANCE = 1;

    private BlockMerger() {
    }

    // ==================== 行几何 ====================

    /**
     * 一行的外包框与去空白后的字符数
     */
    static final class LineGeometry {
        final double minX;
        final double maxX;
        final double width;
        final double height;
        final double centerX;
        final int charCount;

        LineGeometry(GroupedParagraph line) {
            TextBounds box = line.getBounds();
            this.minX = box.getX();
            this.maxX = box.getRight();
            this.width = Math.max(1e-6, box.getWidth());
            this.height = Math.max(1e-6, box.getHeight());
            this.centerX = (minX + maxX) / 2;
            String compact = WHITESPACE.matcher(line.getText()).replaceAll("");
            this.charCount = compact.codePointCount(0, compact.length());
        }
    }

    static double horizontalOverlapRatio(LineGeometry line1, LineGeometry line2) {
        double overlap = GeometryUtils.overlap1D(line1.minX, line1.maxX, line2.minX, line2.maxX);
        return overlap / Math.max(1e-6, Math.min(line1.width, line2.width));
    }

    static boolean hasAlignedAnchors(LineGeometry line1, LineGeometry line2, double referenceSize) {
        double tolerance = Math.max(MIN_ANCHOR_TOLERANCE, referenceSize * ANCHOR_TOLERANCE_RATIO);
        if (Math.abs(line1.minX - line2.minX) <= tolerance) {
            return true;
        }
        if (Math.abs(line1.maxX - line2.maxX) <= tolerance) {
            return true;
        }
        return Math.abs(line1.centerX - line2.centerX) <= tolerance * CENTER_ANCHOR_FACTOR;
    }

    /**
     * 粗略判断"像正文"的行：足够宽，或去空白后至少 10 个字符。
     */
    static boolean isBodyLikeLine(LineGeometry line, double referenceSize) {
        return line.width >= referenceSize * BODY_LINE_MIN_EXTENT_RATIO || line.charCount >= BODY_LINE_MIN_CHARS;
    }

    static boolean canMergeAcrossStyleShift(LineGeometry line1, LineGeometry line2, double referenceSize,
                                            double verticalGap, double lineHeight) {
        double widthRatio = Math.min(line1.width, line2.width) / Math.max(line1.width, line2.width);
        if (widthRatio < STYLE_SHIFT_MIN_WIDTH_RATIO) {
            return false;
        }
        if (!hasAlignedAnchors(line1, line2, referenceSize)
                && horizontalOverlapRatio(line1, line2) < STYLE_SHIFT_MIN_OVERLAP_RATIO) {
            return false;
        }
        if (!isBodyLikeLine(line1, referenceSize) || !isBodyLikeLine(line2, referenceSize)) {
            return false;
        }
        return verticalGap <= lineHeight * STYLE_SHIFT_TIGHT_GAP_RATIO;
    }

    // ==================== 合并判定 ====================

    /**
     * 假定 {@code line1} 在上、{@code line2} 在下。阻断区域由调用方单独检查。
     */
    public static boolean shouldMergeLines(GroupedParagraph line1, GroupedParagraph line2,
                                           SpatialGroupingOptions options) {
        double baselineDelta = line1.getBaselineY() - line2.getBaselineY();
        if (baselineDelta <= 0) {
            return false;
        }
        TextRun text1 = line1.getFirstRun();
        TextRun text2 = line2.getFirstRun();
        LineGeometry geometry1 = new LineGeometry(line1);
        LineGeometry geometry2 = new LineGeometry(line2);
        double referenceSize = Math.max(text1.getFontSize(), text2.getFontSize());

        // 几乎没有水平重叠且没有对齐锚点：大概率是相邻的另一栏
        if (options.isEnableColumnSeparation()
                && horizontalOverlapRatio(geometry1, geometry2) < MIN_COLUMN_OVERLAP_RATIO
                && !hasAlignedAnchors(geometry1, geometry2, referenceSize)) {
            return false;
        }

        double lineHeight = Math.max(geometry1.height, geometry2.height);
        double verticalGap = baselineDelta - lineHeight;
        if (verticalGap > lineHeight * options.getVerticalGapRatio()) {
            return false;
        }
        if (StyleMatcher.hasSameStyle(text1, text2, options)) {
            return true;
        }
        return canMergeAcrossStyleShift(geometry1, geometry2, referenceSize, verticalGap, lineHeight);
    }

    // ==================== 合并流程 ====================

    /**
     * 不分栏：按基线从上到下顺序合并。
     */
    public static MutableList<GroupedText> mergeAdjacentLines(ListIterable<GroupedParagraph> lines,
                                                              SpatialGroupingOptions options,
                                                              ListIterable<BlockingZone> zones) {
        MutableList<GroupedParagraph> sorted = Lists.mutable.withAll(lines)
                .sortThis((a, b) -> Double.compare(b.getBaselineY(), a.getBaselineY()));
        return mergeSequentially(sorted, options, zones);
    }

    /**
     * 分栏合并。页面宽度未知或关闭页面分栏检测时退化为顺序合并；
     * 否则按段落外包框检测分栏，每栏（及通栏 -1）独立合并，最后按从上到下、从左到右排序。
     */
    public static MutableList<GroupedText> mergeAdjacentLinesWithColumns(ListIterable<GroupedParagraph> paragraphs,
                                                                         SpatialGroupingOptions options,
                                                                         ListIterable<BlockingZone> zones,
                                                                         Double pageWidth) {
        if (paragraphs.isEmpty()) {
            return Lists.mutable.empty();
        }

        if (pageWidth == null || pageWidth <= 0 || !options.isEnablePageColumnDetection()) {
            MutableList<GroupedParagraph> sorted = GeometryUtils.sortWithTolerance(
                    Lists.mutable.withAll(paragraphs), (a, b) -> {
                        double yDiff = b.getBaselineY() - a.getBaselineY();
                        if (Math.abs(yDiff) > SAME_ROW_TOLERANCE) {
                            return Double.compare(yDiff, 0);
                        }
                        return Double.compare(a.getFirstRun().getX(), b.getFirstRun().getX());
                    });
            return mergeSequentially(sorted, options, zones);
        }

        MutableList<PageColumnDetector.XRange> ranges = Lists.mutable.empty();
        MutableList<TextBounds> boxes = Lists.mutable.empty();
        for (GroupedParagraph paragraph : paragraphs) {
            TextBounds box = paragraph.getBounds();
            boxes.add(box);
            ranges.add(new PageColumnDetector.XRange(box.getX(), box.getRight(), Math.max(1, box.getHeight())));
        }
        MutableList<PageColumnDetector.ColumnInterval> intervals = PageColumnDetector.buildColumnIntervals(
                pageWidth, PageColumnDetector.detectGutters(ranges, pageWidth, options));

        Map<Integer, MutableList<GroupedParagraph>> columns = new TreeMap<>();
        for (int i = 0; i < paragraphs.size(); i++) {
            TextBounds box = boxes.get(i);
            int column = PageColumnDetector.assignToColumn(box.getX(), box.getRight(), intervals, pageWidth, options);
            columns.computeIfAbsent(column, k -> Lists.mutable.empty()).add(paragraphs.get(i));
        }

        MutableList<GroupedText> blocks = Lists.mutable.empty();
        for (MutableList<GroupedParagraph> column : columns.values()) {
            GeometryUtils.sortWithTolerance(column, (a, b) -> {
                double yDiff = b.getBaselineY() - a.getBaselineY();
                if (Math.abs(yDiff) > SAME_ROW_TOLERANCE) {
                    return Double.compare(yDiff, 0);
                }
                return Double.compare(a.getBounds().getX(), b.getBounds().getX());
            });
            blocks.addAll(mergeSequentially(column, options, zones));
        }

        GeometryUtils.sortWithTolerance(blocks, (a, b) -> {
            double yDiff = b.getBounds().getTop() - a.getBounds().getTop();
            if (Math.abs(yDiff) > SAME_ROW_TOLERANCE) {
                return Double.compare(yDiff, 0);
            }
            return Double.compare(a.getBounds().getX(), b.getBounds().getX());
        });
        LOGGER.debug("Merged {} paragraphs into {} blocks across {} column bucket(s)",
                paragraphs.size(), blocks.size(), columns.size());
        return blocks;
    }

    private static MutableList<GroupedText> mergeSequentially(ListIterable<GroupedParagraph> sorted,
                                                              SpatialGroupingOptions options,
                                                              ListIterable<BlockingZone> zones) {
        MutableList<GroupedText> blocks = Lists.mutable.empty();
        MutableList<GroupedParagraph> current = Lists.mutable.empty();
        for (GroupedParagraph paragraph : sorted) {
            if (current.isEmpty()) {
                current.add(paragraph);
                continue;
            }
            GroupedParagraph prev = current.getLast();
            boolean blocked = BlockingZones.isBlockedBetweenLines(prev, paragraph, zones);
            if (!blocked && shouldMergeLines(prev, paragraph, options)) {
                current.add(paragraph);
            } else {
                LOGGER.trace("Block break before {} (blocked={})", paragraph, blocked);
                blocks.add(BlockFactory.createGroupedText(current));
                current = Lists.mutable.of(paragraph);
            }
        }
        if (!current.isEmpty()) {
            blocks.add(BlockFactory.createGroupedText(current));
        }
        return blocks;
    }
}

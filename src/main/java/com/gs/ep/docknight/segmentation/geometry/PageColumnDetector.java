package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableDoubleList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;

/**
 * 页面级分栏检测
 *
 * 将所有文本的 x 区间投影到一维占用直方图上，连续的低占用区间即为栏间空白（gutter），
 * 再由 gutter 推导出各栏的 x 区间。
 */
public final class PageColumnDetector {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageColumnDetector.class);

    // 检测阈值配置
    private static final double GUTTER_OCCUPANCY_THRESHOLD = 0.08;
    private static final double MIN_GUTTER_WIDTH_RATIO = 0.018;
    private static final double GUTTER_MAX_CROSSING_RATIO = 0.18;
    private static final double COLUMN_EDGE_MARGIN_RATIO = 0.06;
    private static final double MIN_COLUMN_WIDTH_RATIO = 0.08;
    private static final double WIDTH_CAP_QUANTILE = 0.9;
    private static final double WIDTH_CAP_FACTOR = 1.15;
    private static final int MIN_USABLE_RANGES = 8;
    private static final int MIN_BINS = 200;
    private static final int MAX_BINS = 600;

    /** Column index for ranges wide enough to span every column. */
    public static final int FULL_WIDTH_COLUMN = -1;

    private PageColumnDetector() {
    }

    /**
     * 一个水平区间及其权重（通常为高度）
     */
    public static final class XRange {
        public final double x0;
        public final double x1;
        public final double weight;

        public XRange(double x0, double x1, double weight) {
            this.x0 = x0;
            this.x1 = x1;
            this.weight = weight;
        }

        public double width() {
            return x1 - x0;
        }
    }

    /**
     * 栏间空白
     */
    public static final class Gutter {
        public final double x0;
        public final double x1;
        public final double xMid;
        public final double score;

        Gutter(double x0, double x1, double score) {
            this.x0 = x0;
            this.x1 = x1;
            this.xMid = (x0 + x1) / 2;
            this.score = score;
        }

        @Override
        public String toString() {
            return String.format("Gutter[%.1f, %.1f] score=%.2f", x0, x1, score);
        }
    }

    /**
     * 一栏的 x 区间
     */
    public static final class ColumnInterval {
        public final double x0;
        public final double x1;

        public ColumnInterval(double x0, double x1) {
            this.x0 = x0;
            this.x1 = x1;
        }

        public double width() {
            return x1 - x0;
        }

        @Override
        public String toString() {
            return String.format("Column[%.1f, %.1f]", x0, x1);
        }
    }

    // ==================== Gutter 检测 ====================

    /**
     * 从 x 区间集合中检测栏间空白，最多返回 {@code maxPageColumns - 1} 个，按 x 升序。
     */
    public static MutableList<Gutter> detectGutters(ListIterable<XRange> ranges, double pageWidth,
                                                    SpatialGroupingOptions options) {
        MutableList<XRange> usable = Lists.mutable.empty();
        for (XRange r : ranges) {
            if (r.width() < pageWidth * options.getFullWidthRatio()) {
                usable.add(r);
            }
        }
        if (usable.size() < MIN_USABLE_RANGES) {
            return Lists.mutable.empty();
        }

        // 部分 PDF 的文本框过宽，会渗入栏间空白；按页面典型宽度截断
        MutableDoubleList widths = new DoubleArrayList();
        for (XRange r : usable) {
            double w = r.width();
            if (Double.isFinite(w) && w > 0) {
                widths.add(w);
            }
        }
        double widthCap = widths.isEmpty()
                ? pageWidth
                : Math.max(1, GeometryUtils.quantile(widths, WIDTH_CAP_QUANTILE) * WIDTH_CAP_FACTOR);

        int bins = GeometryUtils.clamp((int) Math.round(pageWidth / 2), MIN_BINS, MAX_BINS);
        double binSize = pageWidth / bins;
        double[] occupancy = new double[bins];

        for (XRange r : usable) {
            double x0 = GeometryUtils.clamp(r.x0, 0, pageWidth);
            double x1 = GeometryUtils.clamp(Math.min(r.x1, r.x0 + widthCap), 0, pageWidth);
            int b0 = GeometryUtils.clamp((int) Math.floor(x0 / binSize), 0, bins - 1);
            int b1 = GeometryUtils.clamp((int) Math.ceil(x1 / binSize), 0, bins);
            double w = Math.max(1, r.weight);
            for (int i = b0; i < b1; i++) {
                occupancy[i] += w;
            }
        }

        double maxOcc = 1;
        for (double v : occupancy) {
            maxOcc = Math.max(maxOcc, v);
        }
        double[] normalized = new double[bins];
        for (int i = 0; i < bins; i++) {
            normalized[i] = occupancy[i] / maxOcc;
        }

        int edgeMarginBins = (int) Math.round(bins * COLUMN_EDGE_MARGIN_RATIO);
        int minGutterBins = Math.max(2, (int) Math.round((pageWidth * MIN_GUTTER_WIDTH_RATIO) / binSize));

        MutableList<Gutter> gutters = Lists.mutable.empty();
        int start = -1;
        double sum = 0;
        int count = 0;
        for (int i = edgeMarginBins; i < bins - edgeMarginBins; i++) {
            if (normalized[i] <= GUTTER_OCCUPANCY_THRESHOLD) {
                if (start < 0) {
                    start = i;
                    sum = normalized[i];
                    count = 1;
                } else {
                    sum += normalized[i];
                    count++;
                }
            } else if (start >= 0) {
                addGutterIfValid(gutters, start, i, sum / Math.max(1, count), minGutterBins, binSize, usable);
                start = -1;
            }
        }
        if (start >= 0) {
            addGutterIfValid(gutters, start, bins - edgeMarginBins, sum / Math.max(1, count),
                    minGutterBins, binSize, usable);
        }

        gutters.sortThis((a, b) -> Double.compare(b.score, a.score));
        MutableList<Gutter> picked = Lists.mutable.withAll(
                gutters.subList(0, Math.min(gutters.size(), Math.max(0, options.getMaxPageColumns() - 1))));
        picked.sortThis(Comparator.comparingDouble(g -> g.x0));

        if (!picked.isEmpty()) {
            LOGGER.debug("Detected {} gutter(s) on page width {}: {}", picked.size(), pageWidth, picked);
        }
        return picked;
    }

    private static void addGutterIfValid(MutableList<Gutter> gutters, int startBin, int endBin, double meanOcc,
                                         int minGutterBins, double binSize, MutableList<XRange> usable) {
        if (endBin - startBin < minGutterBins) {
            return;
        }
        double x0 = startBin * binSize;
        double x1 = endBin * binSize;
        double xMid = (x0 + x1) / 2;

        // 被大量文本横跨的空白不是真正的栏间距
        int crossing = usable.count(r -> r.x0 <= xMid && xMid <= r.x1);
        double crossingRatio = (double) crossing / usable.size();
        if (crossingRatio > GUTTER_MAX_CROSSING_RATIO) {
            LOGGER.trace("Rejected gutter [{}, {}]: crossing ratio {}", x0, x1, crossingRatio);
            return;
        }
        gutters.add(new Gutter(x0, x1, (x1 - x0) * (1 - meanOcc)));
    }

    // ==================== 栏区间 ====================

    /**
     * 由 gutter 推导各栏区间；过窄（小于页宽 8%）的区间会被丢弃。
     */
    public static MutableList<ColumnInterval> buildColumnIntervals(double pageWidth, ListIterable<Gutter> gutters) {
        if (gutters.isEmpty()) {
            return Lists.mutable.of(new ColumnInterval(0, pageWidth));
        }
        MutableList<ColumnInterval> intervals = Lists.mutable.empty();
        double cur = 0;
        for (Gutter g : gutters) {
            double leftEnd = Math.max(cur, g.x0);
            if (leftEnd - cur > 1) {
                intervals.add(new ColumnInterval(cur, leftEnd));
            }
            cur = Math.min(pageWidth, g.x1);
        }
        if (pageWidth - cur > 1) {
            intervals.add(new ColumnInterval(cur, pageWidth));
        }
        return intervals.select(iv -> iv.width() > pageWidth * MIN_COLUMN_WIDTH_RATIO);
    }

    /**
     * @return the column intervals for the page, or an empty list when fewer than two columns are found
     */
    public static MutableList<ColumnInterval> detectPageColumns(ListIterable<XRange> ranges, double pageWidth,
                                                                SpatialGroupingOptions options) {
        MutableList<ColumnInterval> intervals = buildColumnIntervals(pageWidth, detectGutters(ranges, pageWidth, options));
        return intervals.size() >= 2 ? intervals : Lists.mutable.empty();
    }

    /**
     * 将一个 x 区间分配到重叠度最大的栏；足够宽的区间归入 {@link #FULL_WIDTH_COLUMN}。
     * 重叠度按两者中较窄一方的宽度归一化。
     */
    public static int assignToColumn(double x0, double x1, ListIterable<ColumnInterval> intervals,
                                     double pageWidth, SpatialGroupingOptions options) {
        double w = x1 - x0;
        if (w >= pageWidth * options.getFullWidthRatio()) {
            return FULL_WIDTH_COLUMN;
        }
        int best = 0;
        double bestOverlap = -1;
        for (int i = 0; i < intervals.size(); i++) {
            ColumnInterval iv = intervals.get(i);
            double ov = GeometryUtils.overlap1D(x0, x1, iv.x0, iv.x1) / Math.max(1e-6, Math.min(w, iv.width()));
            if (ov > bestOverlap) {
                bestOverlap = ov;
                best = i;
            }
        }
        return best;
    }
}

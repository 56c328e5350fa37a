package com.gs.ep.docknight.segmentation.context;

import com.gs.ep.docknight.segmentation.geometry.GeometryUtils;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.MutableDoubleList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 基于上下文相似度（NCD）的通用分段
 *
 * 对每个相邻边界，取左右各 windowSize 个单元作为上下文，计算压缩距离，按以下顺序判定：
 * 1. 合并守卫拒绝：不合并
 * 2. NCD 不超过强合并阈值：合并
 * 3. 左尾与右首大段重合：合并
 * 4. 合计字符数不足：不合并
 * 5. NCD 不超过合并阈值则合并，否则不合并
 *
 * 分段即不合并边界之间的最大连续区间。
 */
public final class ContextualNcdSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContextualNcdSegmenter.class);

    private static final Pattern WHITESPACE = Pattern.compile("(?U)\\s+");
    private static final String UNIT_SEPARATOR = "\n";

    private ContextualNcdSegmenter() {
    }

    /**
     * 规整后的单元，保留它在调用方列表中的下标
     */
    private static final class IndexedUnit<T> {
        final int inputIndex;
        final SegmentationUnit<T> unit;
        final int[] codePoints;

        IndexedUnit(int inputIndex, SegmentationUnit<T> unit) {
            this.inputIndex = inputIndex;
            this.unit = unit;
            this.codePoints = unit.getText().codePoints().toArray();
        }
    }

    // ==================== 入口 ====================

    public static <T> ContextualSegmentationResult<T> segmentTextUnitsByContext(
            ListIterable<SegmentationUnit<T>> units) {
        return segmentTextUnitsByContext(units, ContextualSegmentationOptions.defaults(), BoundaryMergeGuard.allowAll());
    }

    public static <T> ContextualSegmentationResult<T> segmentTextUnitsByContext(
            ListIterable<SegmentationUnit<T>> units, ContextualSegmentationOptions options) {
        return segmentTextUnitsByContext(units, options, BoundaryMergeGuard.allowAll());
    }

    /**
     * 对任意文本单元序列做上下文分段。
     *
     * <p>单元文本先规整（连续空白折叠为一个空格并去掉首尾空白），规整后为空的单元被丢弃。
     * 结果中的下标均指向调用方传入的 {@code units}。</p>
     *
     * @param units 有序单元
     * @param options NCD 参数
     * @param guard 领域相关的合并守卫，只对真正参与评分的相邻单元调用
     */
    public static <T> ContextualSegmentationResult<T> segmentTextUnitsByContext(
            ListIterable<SegmentationUnit<T>> units,
            ContextualSegmentationOptions options,
            BoundaryMergeGuard<T> guard) {
        Objects.requireNonNull(units, "units");
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(guard, "guard");

        MutableList<IndexedUnit<T>> normalized = Lists.mutable.empty();
        for (int i = 0; i < units.size(); i++) {
            SegmentationUnit<T> unit = units.get(i);
            String text = normalizeText(unit.getText());
            if (!text.isEmpty()) {
                normalized.add(new IndexedUnit<>(i, unit.withText(text)));
            }
        }

        if (normalized.size() <= 1) {
            MutableList<ContextualSegment<T>> segments = Lists.mutable.empty();
            if (normalized.size() == 1) {
                IndexedUnit<T> only = normalized.getFirst();
                segments.add(new ContextualSegment<>(only.inputIndex, only.inputIndex, Lists.mutable.of(only.unit)));
            }
            return new ContextualSegmentationResult<>(options.getMergeThreshold(), Lists.mutable.empty(), segments);
        }

        // 1. 每个边界的 NCD（压缩长度缓存只在本次调用内有效）
        CompressionDistance compression = new CompressionDistance();
        MutableDoubleList ncds = new DoubleArrayList(normalized.size() - 1);
        for (int i = 0; i + 1 < normalized.size(); i++) {
            String left = takeTail(joinTexts(normalized, Math.max(0, i - options.getWindowSize() + 1), i + 1),
                    options.getBoundaryContextChars());
            String right = takeHead(joinTexts(normalized, i + 1,
                    Math.min(normalized.size(), i + 1 + options.getWindowSize())), options.getBoundaryContextChars());
            ncds.add(compression.distance(left, right));
        }

        // 2. 实际合并阈值
        double threshold = chooseMergeThreshold(options.getMergeThreshold(), options.getAdaptiveMergePercentile(), ncds);

        // 3. 逐个边界判定
        MutableList<BoundaryScore> boundaries = Lists.mutable.empty();
        for (int i = 0; i < ncds.size(); i++) {
            BoundaryScore score = decideBoundary(i, normalized.get(i), normalized.get(i + 1), ncds.get(i),
                    threshold, options, guard);
            LOGGER.trace("{}", score);
            boundaries.add(score);
        }

        // 4. 在不合并的边界处切分
        MutableList<ContextualSegment<T>> segments = Lists.mutable.empty();
        int start = 0;
        for (int i = 0; i < boundaries.size(); i++) {
            if (!boundaries.get(i).isMerge()) {
                segments.add(createSegment(normalized, start, i));
                start = i + 1;
            }
        }
        segments.add(createSegment(normalized, start, normalized.size() - 1));

        LOGGER.debug("Contextual segmentation: {} units, threshold {}, {} segments",
                normalized.size(), threshold, segments.size());
        return new ContextualSegmentationResult<>(threshold, boundaries, segments);
    }

    // ==================== 判定 ====================

    private static <T> BoundaryScore decideBoundary(int position, IndexedUnit<T> left, IndexedUnit<T> right,
                                                    double ncd, double mergeThreshold,
                                                    ContextualSegmentationOptions options, BoundaryMergeGuard<T> guard) {
        int leftLength = left.codePoints.length;
        int rightLength = right.codePoints.length;
        BoundaryDecisionReason reason;

        if (!guard.canMerge(new BoundaryDecisionInput<>(position, left.unit, right.unit, ncd))) {
            reason = BoundaryDecisionReason.BLOCKED_BY_CALLBACK;
        } else if (ncd <= options.getStrongMergeThreshold()) {
            reason = BoundaryDecisionReason.STRONG_NCD;
        } else if (hasSuffixPrefixOverlap(left.codePoints, right.codePoints, options)) {
            reason = BoundaryDecisionReason.SUFFIX_PREFIX_OVERLAP;
        } else if (leftLength + rightLength < options.getMinCombinedChars()) {
            reason = BoundaryDecisionReason.INSUFFICIENT_LENGTH;
        } else if (ncd <= mergeThreshold) {
            reason = BoundaryDecisionReason.THRESHOLD_NCD;
        } else {
            reason = BoundaryDecisionReason.NCD_TOO_HIGH;
        }
        return new BoundaryScore(left.inputIndex, right.inputIndex, ncd, leftLength, rightLength, reason);
    }

    private static boolean hasSuffixPrefixOverlap(int[] left, int[] right, ContextualSegmentationOptions options) {
        int smaller = Math.min(left.length, right.length);
        if (smaller == 0) {
            return false;
        }
        int overlap = suffixPrefixOverlapChars(left, right, options.getSuffixPrefixMergeMinChars());
        return (double) overlap / smaller >= options.getSuffixPrefixMergeRatio();
    }

    /**
     * 左侧后缀与右侧前缀相同的最长长度（按码点），不足 minChars 时为 0。
     */
    static int suffixPrefixOverlapChars(int[] left, int[] right, int minChars) {
        int maxOverlap = Math.min(left.length, right.length);
        for (int length = maxOverlap; length >= minChars; length--) {
            if (Arrays.equals(left, left.length - length, left.length, right, 0, length)) {
                return length;
            }
        }
        return 0;
    }

    static double chooseMergeThreshold(double baseThreshold, double adaptivePercentile, MutableDoubleList ncds) {
        if (adaptivePercentile <= 0 || ncds.isEmpty()) {
            return baseThreshold;
        }
        return Math.min(baseThreshold, GeometryUtils.quantile(ncds, adaptivePercentile));
    }

    // ==================== 文本工具 ====================

    static String normalizeText(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    static String takeHead(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
    }

    static String takeTail(String text, int maxCodePoints) {
        if (text.codePointCount(0, text.length()) <= maxCodePoints) {
            return text;
        }
        return text.substring(text.offsetByCodePoints(text.length(), -maxCodePoints));
    }

    private static <T> String joinTexts(ListIterable<IndexedUnit<T>> units, int from, int toExclusive) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < toExclusive; i++) {
            if (i > from) {
                sb.append(UNIT_SEPARATOR);
            }
            sb.append(units.get(i).unit.getText());
        }
        return sb.toString();
    }

    private static <T> ContextualSegment<T> createSegment(MutableList<IndexedUnit<T>> units, int from, int to) {
        MutableList<SegmentationUnit<T>> slice = Lists.mutable.empty();
        for (int i = from; i <= to; i++) {
            slice.add(units.get(i).unit);
        }
        return new ContextualSegment<>(units.get(from).inputIndex, units.get(to).inputIndex, slice);
    }
}

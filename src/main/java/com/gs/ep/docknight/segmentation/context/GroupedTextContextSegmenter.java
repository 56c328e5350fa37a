package com.gs.ep.docknight.segmentation.context;

import com.gs.ep.docknight.segmentation.geometry.GeometryUtils;
import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.TextBounds;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 文本块级的上下文分段
 *
 * 在通用 NCD 分段之上增加两点：
 * - 块签名：只取首尾各 contextParagraphEdgeCount 个段落，长块的中段不参与比较
 * - 空间守卫：水平重叠不足 minXAxisOverlapRatio 的两块（并排的两栏）永不合并
 */
public final class GroupedTextContextSegmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(GroupedTextContextSegmenter.class);

    private GroupedTextContextSegmenter() {
    }

    public static GroupedContextSegmentationResult segmentGroupedTextByContext(ListIterable<GroupedText> groups) {
        return segmentGroupedTextByContext(groups, GroupedContextSegmentationOptions.defaults());
    }

    public static GroupedContextSegmentationResult segmentGroupedTextByContext(
            ListIterable<GroupedText> groups, GroupedContextSegmentationOptions options) {
        Objects.requireNonNull(groups, "groups");
        Objects.requireNonNull(options, "options");

        MutableList<SegmentationUnit<GroupedText>> units = Lists.mutable.empty();
        for (GroupedText group : groups) {
            units.add(SegmentationUnit.of(contextSignature(group, options.getContextParagraphEdgeCount()), group));
        }

        double minOverlap = options.getMinXAxisOverlapRatio();
        BoundaryMergeGuard<GroupedText> spatialGuard = input -> xAxisOverlapRatio(
                input.getLeftUnit().getValue().getBounds(),
                input.getRightUnit().getValue().getBounds()) >= minOverlap;

        ContextualSegmentationResult<GroupedText> base = ContextualNcdSegmenter.segmentTextUnitsByContext(
                units, options.getContextual(), spatialGuard);

        MutableList<GroupedContextBoundaryScore> boundaries = Lists.mutable.empty();
        for (BoundaryScore score : base.getBoundaries()) {
            double overlap = xAxisOverlapRatio(groups.get(score.getIndex()).getBounds(),
                    groups.get(score.getNextIndex()).getBounds());
            boundaries.add(new GroupedContextBoundaryScore(score, overlap));
        }

        MutableList<GroupedContextSegment> segments = Lists.mutable.empty();
        for (ContextualSegment<GroupedText> segment : base.getSegments()) {
            ImmutableList<GroupedText> members = segment.getValues();
            segments.add(new GroupedContextSegment(
                    segment.getStartIndex(),
                    segment.getEndIndex(),
                    members,
                    members.collect(GroupedTextContextSegmenter::groupText).makeString("\n"),
                    TextBounds.union(members.collect(GroupedText::getBounds))));
        }

        LOGGER.debug("Grouped context segmentation: {} blocks -> {} segments", groups.size(), segments.size());
        return new GroupedContextSegmentationResult(base.getThreshold(), boundaries, segments);
    }

    // ==================== 块签名 ====================

    /**
     * 规整后非空的段落文本；段落数不超过 2 * edgeCount 时全部保留，否则取首尾各 edgeCount 个。
     */
    static String contextSignature(GroupedText group, int edgeCount) {
        MutableList<String> paragraphs = Lists.mutable.empty();
        for (GroupedParagraph paragraph : group.getParagraphs()) {
            String text = ContextualNcdSegmenter.normalizeText(paragraph.getText());
            if (!text.isEmpty()) {
                paragraphs.add(text);
            }
        }
        if (paragraphs.size() <= edgeCount * 2) {
            return paragraphs.makeString("\n");
        }
        MutableList<String> edges = GeometryUtils.head(paragraphs, edgeCount);
        edges.addAll(paragraphs.subList(paragraphs.size() - edgeCount, paragraphs.size()));
        return edges.makeString("\n");
    }

    static String groupText(GroupedText group) {
        return ContextualNcdSegmenter.normalizeText(group.getText());
    }

    /**
     * 水平重叠长度除以较窄一块的宽度
     */
    static double xAxisOverlapRatio(TextBounds left, TextBounds right) {
        double denominator = Math.min(left.getWidth(), right.getWidth());
        if (denominator <= 0) {
            return 0;
        }
        double overlap = Math.max(0, Math.min(left.getRight(), right.getRight()) - Math.max(left.getX(), right.getX()));
        return overlap / denominator;
    }
}

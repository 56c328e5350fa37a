package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.LayoutInference;
import com.gs.ep.docknight.segmentation.model.LineSpacing;
import com.gs.ep.docknight.segmentation.model.TextBounds;
import com.gs.ep.docknight.segmentation.model.TextRun;
import com.gs.ep.docknight.segmentation.model.WritingMode;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * 由段落构造文本块：外包框（含宽度缓冲）、行距信息、版式推断。
 */
public final class BlockFactory {

    /**
     * 宽度缓冲：下游替换字体后字符可能略宽，预留 5% 防止意外换行
     */
    private static final double WIDTH_BUFFER_RATIO = 0.05;

    private BlockFactory() {
    }

    /**
     * @throws IllegalArgumentException if {@code paragraphs} is empty
     */
    public static GroupedText createGroupedText(ListIterable<GroupedParagraph> paragraphs, WritingMode writingMode) {
        if (paragraphs.isEmpty()) {
            throw new IllegalArgumentException("createGroupedText requires at least one paragraph");
        }
        MutableList<TextRun> allRuns = Lists.mutable.empty();
        for (GroupedParagraph paragraph : paragraphs) {
            allRuns.addAllIterable(paragraph.getRuns());
        }
        TextBounds runBounds = TextBounds.union(allRuns.collect(TextRun::getBounds));

        double baseWidth = runBounds.getWidth();
        double buffer = Math.max(calculateSpacingWidthAdjustment(allRuns), baseWidth * WIDTH_BUFFER_RATIO);
        TextBounds contentBounds = new TextBounds(runBounds.getX(), runBounds.getY(), baseWidth + buffer,
                runBounds.getHeight());

        MutableList<GroupedParagraph> withSpacing = addLineSpacing(paragraphs);
        LayoutInference layout = LayoutInferrer.inferLayout(withSpacing, contentBounds, writingMode);
        return new GroupedText(contentBounds, withSpacing, layout);
    }

    public static GroupedText createGroupedText(ListIterable<GroupedParagraph> paragraphs) {
        return createGroupedText(paragraphs, WritingMode.HORIZONTAL);
    }

    /**
     * 字间距 Tc 在下游可能被再次施加：额外宽度 = Tc * (字符数 - 1) * 水平缩放，取所有片段中的最大值。
     */
    static double calculateSpacingWidthAdjustment(ListIterable<TextRun> runs) {
        double max = 0;
        for (TextRun run : runs) {
            if (run.getCharSpacing() > 0) {
                int gaps = Math.max(run.getText().length() - 1, 0);
                max = Math.max(max, run.getCharSpacing() * gaps * (run.getHorizontalScaling() / 100));
            }
        }
        return max;
    }

    /**
     * 除最后一个段落外，记录到下一段落的基线距离与本段首个片段字号。
     */
    static MutableList<GroupedParagraph> addLineSpacing(ListIterable<GroupedParagraph> paragraphs) {
        MutableList<GroupedParagraph> result = Lists.mutable.empty();
        for (int i = 0; i < paragraphs.size(); i++) {
            GroupedParagraph current = paragraphs.get(i);
            if (i + 1 >= paragraphs.size()) {
                result.add(current);
                continue;
            }
            double baselineDistance = current.getBaselineY() - paragraphs.get(i + 1).getBaselineY();
            double fontSize = current.getFirstRun().getFontSize();
            if (baselineDistance > 0 && fontSize > 0) {
                result.add(current.withLineSpacing(new LineSpacing(baselineDistance, fontSize)));
            } else {
                result.add(current);
            }
        }
        return result;
    }
}

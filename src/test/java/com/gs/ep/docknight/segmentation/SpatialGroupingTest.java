package com.gs.ep.docknight.segmentation;

import com.gs.ep.docknight.segmentation.model.BlockingZone;
import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.GroupingContext;
import com.gs.ep.docknight.segmentation.model.InlineDirection;
import com.gs.ep.docknight.segmentation.model.LayoutInference;
import com.gs.ep.docknight.segmentation.model.ParagraphAlignment;
import com.gs.ep.docknight.segmentation.model.TextBounds;
import com.gs.ep.docknight.segmentation.model.TextRun;
import com.gs.ep.docknight.segmentation.model.WritingMode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static com.gs.ep.docknight.segmentation.RunFixtures.run;
import static org.junit.jupiter.api.Assertions.*;

public class SpatialGroupingTest {

    private static ImmutableList<GroupedText> group(MutableList<TextRun> runs) {
        return SpatialGrouping.withDefaults().group(runs);
    }

    // ==================== 基本行为 ====================

    @Test
    void group_emptyInput_returnsNoBlocks() {
        assertTrue(group(Lists.mutable.empty()).isEmpty());
    }

    @Test
    void group_twoCloseRunsOnOneLine_formOneParagraphOrderedLeftToRight() {
        TextRun world = run("World", 60, 100, 50);
        TextRun hello = run("Hello", 0, 100, 50);

        ImmutableList<GroupedText> blocks = group(Lists.mutable.of(world, hello));

        assertEquals(1, blocks.size());
        assertEquals(1, blocks.get(0).getParagraphs().size());
        GroupedParagraph paragraph = blocks.get(0).getParagraphs().get(0);
        assertSame(hello, paragraph.getRuns().get(0));
        assertSame(world, paragraph.getRuns().get(1));
        assertEquals(InlineDirection.LTR, paragraph.getInlineDirection());
        assertEquals("HelloWorld", blocks.get(0).getText());
    }

    @Test
    void group_singleRun_boundsIncludeWidthBuffer() {
        GroupedText block = group(Lists.mutable.of(run("Single", 10, 100, 50))).get(0);

        assertEquals(new TextBounds(10, 100, 52.5, 12), block.getBounds());
    }

    @Test
    void group_linesFurtherApartThanVerticalGapRatio_splitIntoTwoBlocks() {
        MutableList<TextRun> runs = Lists.mutable.of(run("Upper line", 0, 100, 50), run("Lower line", 0, 80, 50));

        assertEquals(1, group(runs).size(), "gap 8 is within 1.2 * line height");

        SpatialGrouping tight = SpatialGrouping.create(SpatialGroupingOptions.builder().verticalGapRatio(0.5).build());
        assertEquals(2, tight.group(runs).size(), "gap 8 exceeds 0.5 * line height");
    }

    @Test
    void group_distantLinesWithTightRatio_splitIntoTwoBlocks() {
        SpatialGrouping tight = SpatialGrouping.create(SpatialGroupingOptions.builder().verticalGapRatio(0.5).build());

        ImmutableList<GroupedText> blocks = tight.group(
                Lists.mutable.of(run("Top", 0, 100, 50), run("Bottom", 0, 50, 50)));

        assertEquals(2, blocks.size());
        assertEquals("Top", blocks.get(0).getText());
        assertEquals("Bottom", blocks.get(1).getText());
    }

    @Test
    void group_stackedLinesWithSameStyle_mergeIntoOneBlockWithLineSpacing() {
        ImmutableList<GroupedText> blocks = group(Lists.mutable.of(
                run("First line", 0, 100, 84),
                run("Second line", 0, 85, 84)));

        assertEquals(1, blocks.size());
        GroupedText block = blocks.get(0);
        assertEquals(2, block.getParagraphs().size());
        assertEquals("First line\nSecond line", block.getText());
        assertNotNull(block.getParagraphs().get(0).getLineSpacing());
        assertEquals(15, block.getParagraphs().get(0).getLineSpacing().getBaselineDistance(), 1e-9);
        assertNull(block.getParagraphs().get(1).getLineSpacing());

        TextBounds runUnion = TextBounds.union(block.getRuns().collect(TextRun::getBounds));
        assertEquals(new TextBounds(0, 85, 84, 27), runUnion);
        assertEquals(88.2, block.getBounds().getWidth(), 1e-9);
    }

    // ==================== 阻断区域 ====================

    @Test
    void group_zoneBetweenRunsOnOneLine_forcesTwoBlocks() {
        MutableList<TextRun> runs = Lists.mutable.of(run("Left", 0, 100, 40), run("Right", 100, 100, 40));
        assertEquals(1, group(runs).size(), "without a zone the two runs stay together");

        GroupingContext blocker = GroupingContext.of(Lists.mutable.of(new BlockingZone(50, 90, 30, 30)));
        assertEquals(2, SpatialGrouping.withDefaults().group(runs, blocker).size());
    }

    @Test
    void group_containerZoneAroundBothRuns_doesNotBlock() {
        MutableList<TextRun> runs = Lists.mutable.of(run("Left", 0, 100, 40), run("Right", 100, 100, 40));
        GroupingContext container = GroupingContext.of(Lists.mutable.of(new BlockingZone(0, 80, 200, 50)));

        assertEquals(1, SpatialGrouping.withDefaults().group(runs, container).size());
    }

    @Test
    void group_zoneBetweenLines_splitsBlock() {
        MutableList<TextRun> runs = Lists.mutable.of(run("First line", 0, 100, 84), run("Second line", 0, 85, 84));
        GroupingContext between = GroupingContext.of(Lists.mutable.of(new BlockingZone(0, 95, 200, 10)));

        assertEquals(2, SpatialGrouping.withDefaults().group(runs, between).size());
    }

    @Test
    void group_containerZoneAroundLines_keepsOneBlock() {
        MutableList<TextRun> runs = Lists.mutable.of(run("First line", 0, 100, 84), run("Second line", 0, 85, 84));
        GroupingContext container = GroupingContext.of(Lists.mutable.of(new BlockingZone(0, 70, 200, 60)));

        ImmutableList<GroupedText> blocks = SpatialGrouping.withDefaults().group(runs, container);

        assertEquals(1, blocks.size());
        assertEquals(2, blocks.get(0).getParagraphs().size());
    }

    // ==================== 样式 ====================

    @Test
    void group_shortLinesWithDifferentFonts_splitIntoTwoBlocks() {
        assertEquals(2, group(Lists.mutable.of(
                run("Title", 0, 100, 40, "Times-Roman"),
                run("Body", 0, 85, 40, "Helvetica"))).size());
    }

    @Test
    void group_longBodyLinesAcrossFontChange_mergeIntoOneBlock() {
        ImmutableList<GroupedText> blocks = group(Lists.mutable.of(
                run("The first sentence of a paragraph set in a serif face", 0, 100, 320, "Times-Roman"),
                run("continues here after the renderer switched the font", 0, 85, 318, "Helvetica")));

        assertEquals(1, blocks.size());
    }

    @Test
    void group_headingAboveSmallerText_splitIntoTwoBlocks() {
        assertEquals(2, group(Lists.mutable.of(
                run("Big title", 0, 100, 100, 24, 24, "Helvetica"),
                run("small text", 0, 80, 100, 12, 12, "Helvetica"))).size());
    }

    @Test
    void group_subsetFontPrefix_isIgnoredWhenComparingStyle() {
        assertEquals(1, group(Lists.mutable.of(
                run("Alpha", 0, 100, 40, "ABCDEF+Helvetica"),
                run("Beta", 0, 85, 40, "Helvetica"))).size());
    }

    @Test
    void group_fontSizeWithinTolerance_mergesLines() {
        assertEquals(1, group(Lists.mutable.of(
                run("Alpha", 0, 100, 40, 12, 12, "Helvetica"),
                run("Beta", 0, 85, 40, 12, 12.5, "Helvetica"))).size());
    }

    // ==================== 行内方向 ====================

    @Test
    void group_hebrewRuns_detectedAsRtlAndOrderedRightToLeft() {
        TextRun shalom = run("שלום", 120, 100, 50);
        TextRun olam = run("עולם", 60, 100, 50);

        GroupedText block = group(Lists.mutable.of(olam, shalom)).get(0);
        GroupedParagraph paragraph = block.getParagraphs().get(0);

        assertEquals(InlineDirection.RTL, paragraph.getInlineDirection());
        assertSame(shalom, paragraph.getRuns().get(0));
        assertSame(olam, paragraph.getRuns().get(1));
        assertEquals("שלום" + "עולם", paragraph.getText());
        assertEquals(InlineDirection.RTL, block.getLayoutInference().getInlineDirection());
    }

    @Test
    void group_forcedRtlDirection_reversesLatinRunOrder() {
        SpatialGrouping rtl = SpatialGrouping.create(SpatialGroupingOptions.builder()
                .inlineDirection(InlineDirectionMode.RTL)
                .build());

        GroupedText block = rtl.group(Lists.mutable.of(run("A", 0, 100, 10), run("B", 15, 100, 10))).get(0);

        assertEquals("BA", block.getText());
    }

    // ==================== 版式推断 ====================

    @Test
    void group_centeredLines_inferCenterAlignment() {
        GroupedText block = group(Lists.mutable.of(
                run("Centered heading", 100, 100, 100),
                run("middle", 120, 85, 60),
                run("tail line", 110, 70, 80))).get(0);

        LayoutInference layout = block.getLayoutInference();
        assertEquals(ParagraphAlignment.CENTER, layout.getAlignment());
        assertEquals(1.0, layout.getConfidence(), 1e-9);
        assertEquals(100, layout.getEstimatedBounds().getX(), 1e-9);
        assertEquals(100, layout.getEstimatedBounds().getWidth(), 1e-9);
    }

    @Test
    void group_rightAlignedHebrewLines_inferRightAlignmentWithLogicalPaddings() {
        GroupedText block = group(Lists.mutable.of(
                run("שלום עולם טוב", 200, 100, 100),
                run("ערב טוב", 240, 85, 60),
                run("בוקר טוב לכם", 220, 70, 80))).get(0);

        LayoutInference layout = block.getLayoutInference();
        assertEquals(InlineDirection.RTL, layout.getInlineDirection());
        assertEquals(ParagraphAlignment.RIGHT, layout.getAlignment());
        assertEquals(0, layout.getStartPadding(), 1e-9, "start is the right edge for rtl");
        assertEquals(20, layout.getEndPadding(), 1e-9);
    }

    // ==================== 分栏 ====================

    private static MutableList<TextRun> twoColumnPage() {
        MutableList<TextRun> runs = Lists.mutable.empty();
        for (int row = 0; row < 5; row++) {
            double y = 700 - row * 15;
            double leftWidth = row == 1 ? 320 : 240;
            runs.add(run("Left column text row " + row, 0, y, leftWidth));
            runs.add(run("Right column row " + row, 300, y, 180));
        }
        return runs;
    }

    @Test
    void group_twoPageColumns_yieldOneBlockPerColumnLeftFirst() {
        SpatialGrouping grouping = SpatialGrouping.create(SpatialGroupingOptions.builder().maxPageColumns(2).build());

        ImmutableList<GroupedText> blocks = grouping.group(twoColumnPage(), GroupingContext.ofPage(500, 800));

        assertEquals(2, blocks.size());
        assertEquals(5, blocks.get(0).getParagraphs().size());
        assertEquals(5, blocks.get(1).getParagraphs().size());
        assertTrue(blocks.get(0).getRuns().allSatisfy(r -> r.getX() == 0));
        assertTrue(blocks.get(1).getRuns().allSatisfy(r -> r.getX() == 300));
    }

    @Test
    void group_anyPage_outputRunsPartitionInput() {
        MutableList<TextRun> input = twoColumnPage();
        input.add(run("Footer", 200, 40, 60));

        ImmutableList<GroupedText> blocks = SpatialGrouping.withDefaults().group(input, GroupingContext.ofPage(500, 800));

        MutableList<TextRun> output = Lists.mutable.empty();
        for (GroupedText block : blocks) {
            output.addAllIterable(block.getRuns());
            TextBounds union = TextBounds.union(block.getRuns().collect(TextRun::getBounds));
            assertEquals(union.getX(), block.getBounds().getX(), 1e-9);
            assertEquals(union.getY(), block.getBounds().getY(), 1e-9);
            assertEquals(union.getHeight(), block.getBounds().getHeight(), 1e-9);
            assertTrue(block.getBounds().getWidth() >= union.getWidth());
        }
        assertEquals(input.size(), output.size());
        assertTrue(output.containsAll(input));
    }

    @Test
    void group_sameInputTwice_isDeterministic() {
        GroupingContext context = GroupingContext.ofPage(500, 800);
        ImmutableList<GroupedText> first = SpatialGrouping.withDefaults().group(twoColumnPage(), context);
        ImmutableList<GroupedText> second = SpatialGrouping.withDefaults().group(twoColumnPage(), context);

        assertEquals(first.size(), second.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getText(), second.get(i).getText());
            assertEquals(first.get(i).getBounds(), second.get(i).getBounds());
        }
    }

    @Test
    void group_blockOwnRuns_reproduceSameBlock() {
        ImmutableList<GroupedText> blocks = group(Lists.mutable.of(
                run("Title", 0, 100, 40, "Times-Roman"),
                run("First body line", 0, 85, 84),
                run("Second body line", 0, 70, 84)));
        assertEquals(2, blocks.size());

        for (GroupedText block : blocks) {
            ImmutableList<GroupedText> regrouped = SpatialGrouping.withDefaults().group(block.getRuns());
            assertEquals(1, regrouped.size());
            assertEquals(block.getBounds(), regrouped.get(0).getBounds());
            assertEquals(block.getText(), regrouped.get(0).getText());
        }
    }

    // ==================== 竖排 ====================

    private static MutableList<TextRun> twoVerticalColumns() {
        MutableList<TextRun> runs = Lists.mutable.empty();
        double[] ys = {700, 636, 572, 508};
        for (double x : new double[]{300, 200}) {
            for (double y : ys) {
                runs.add(run("縦書きの文", x, y, 12, 60, 12, "MS-Mincho"));
            }
        }
        return runs;
    }

    @Test
    void group_twoVerticalColumns_yieldTwoBlocksRightToLeft() {
        SpatialGrouping grouping = SpatialGrouping.withDefaults();
        MutableList<TextRun> runs = twoVerticalColumns();

        assertEquals(WritingMode.VERTICAL, grouping.detectWritingMode(runs));
        ImmutableList<GroupedText> blocks = grouping.group(runs);

        assertEquals(2, blocks.size());
        assertEquals(300, blocks.get(0).getBounds().getX(), 1e-9);
        assertEquals(200, blocks.get(1).getBounds().getX(), 1e-9);
        assertEquals(InlineDirection.TTB, blocks.get(0).getLayoutInference().getInlineDirection());
        assertEquals(ParagraphAlignment.UNKNOWN, blocks.get(0).getLayoutInference().getAlignment());
        assertEquals(4, blocks.get(0).getRuns().size());
    }

    @Test
    void group_verticalColumnsLeftToRight_reversesBlockOrder() {
        SpatialGrouping grouping = SpatialGrouping.create(SpatialGroupingOptions.builder()
                .verticalColumnOrder(VerticalColumnOrder.LEFT_TO_RIGHT)
                .build());

        ImmutableList<GroupedText> blocks = grouping.group(twoVerticalColumns());

        assertEquals(2, blocks.size());
        assertEquals(200, blocks.get(0).getBounds().getX(), 1e-9);
    }

    @Test
    void group_forcedHorizontalModeOnVerticalPage_usesLineClustering() {
        SpatialGrouping grouping = SpatialGrouping.create(SpatialGroupingOptions.builder()
                .writingMode(WritingModeOption.HORIZONTAL)
                .build());

        assertEquals(WritingMode.HORIZONTAL, grouping.detectWritingMode(twoVerticalColumns()));
        for (GroupedText block : grouping.group(twoVerticalColumns())) {
            assertNotEquals(InlineDirection.TTB, block.getLayoutInference().getInlineDirection());
        }
    }
}

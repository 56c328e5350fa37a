package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.model.BlockingZone;
import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.TextRun;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static com.gs.ep.docknight.segmentation.RunFixtures.run;
import static org.junit.jupiter.api.Assertions.*;

public class BlockMergerTest {

    private final SpatialGroupingOptions options = SpatialGroupingOptions.defaults();

    private GroupedParagraph line(TextRun run) {
        return ParagraphFactory.createParagraph(Lists.mutable.of(run), options);
    }

    @Test
    void shouldMergeLines_consecutiveLinesSameStyle_true() {
        assertTrue(BlockMerger.shouldMergeLines(
                line(run("Hello world", 0, 100, 100)),
                line(run("Next line", 0, 85, 90)), options));
    }

    @Test
    void shouldMergeLines_baselineNotDescending_false() {
        assertFalse(BlockMerger.shouldMergeLines(
                line(run("Next line", 0, 85, 90)),
                line(run("Hello world", 0, 100, 100)), options));
    }

    @Test
    void shouldMergeLines_gapTooLarge_false() {
        assertFalse(BlockMerger.shouldMergeLines(
                line(run("Hello world", 0, 100, 100)),
                line(run("Far below", 0, 50, 90)), options));
    }

    @Test
    void shouldMergeLines_neighbouringColumn_onlyWhenSeparationDisabled() {
        GroupedParagraph upper = line(run("Left column", 0, 100, 100));
        GroupedParagraph lower = line(run("Right column", 300, 85, 100));

        assertFalse(BlockMerger.shouldMergeLines(upper, lower, options));
        assertTrue(BlockMerger.shouldMergeLines(upper, lower,
                SpatialGroupingOptions.builder().enableColumnSeparation(false).build()));
    }

    @Test
    void shouldMergeLines_bodyLinesWithFontSwitch_mergeAcrossStyleShift() {
        GroupedParagraph upper = line(run("The quick brown fox jumps", 0, 100, 300, "Helvetica"));
        GroupedParagraph lower = line(run("over the lazy dog again here", 0, 85, 290, "Times-Roman"));

        assertTrue(BlockMerger.shouldMergeLines(upper, lower, options));
    }

    @Test
    void isBodyLikeLine_countsNonWhitespaceCharacters() {
        assertTrue(BlockMerger.isBodyLikeLine(
                new BlockMerger.LineGeometry(line(run("abc def ghi jk", 0, 0, 30))), 12));
        assertFalse(BlockMerger.isBodyLikeLine(
                new BlockMerger.LineGeometry(line(run("Title", 0, 0, 30))), 12));
    }

    @Test
    void mergeAdjacentLines_gapSplitsBlocks() {
        MutableList<GroupedText> blocks = BlockMerger.mergeAdjacentLines(Lists.mutable.of(
                line(run("Paragraph two", 0, 40, 100)),
                line(run("First line", 0, 100, 100)),
                line(run("Second line", 0, 85, 100))), options, Lists.mutable.empty());

        assertEquals(2, blocks.size());
        assertEquals("First line\nSecond line", blocks.get(0).getText());
        assertEquals("Paragraph two", blocks.get(1).getText());
    }

    @Test
    void mergeAdjacentLines_zoneBetweenLines_blocksMerge() {
        MutableList<GroupedText> blocks = BlockMerger.mergeAdjacentLines(Lists.mutable.of(
                line(run("First line", 0, 100, 100)),
                line(run("Second line", 0, 85, 100))),
                options, Lists.mutable.of(new BlockingZone(0, 95, 200, 2)));

        assertEquals(2, blocks.size());
    }

    @Test
    void mergeAdjacentLinesWithColumns_noPageWidth_sequentialMerge() {
        MutableList<GroupedText> blocks = BlockMerger.mergeAdjacentLinesWithColumns(Lists.mutable.of(
                line(run("First line", 0, 100, 100)),
                line(run("Second line", 0, 85, 100))), options, Lists.mutable.empty(), null);

        assertEquals(1, blocks.size());
        assertEquals(2, blocks.get(0).getParagraphs().size());
    }

    @Test
    void mergeAdjacentLinesWithColumns_empty_noBlocks() {
        assertTrue(BlockMerger.mergeAdjacentLinesWithColumns(Lists.mutable.empty(), options,
                Lists.mutable.empty(), 500.0).isEmpty());
    }
}

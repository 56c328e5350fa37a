package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.VerticalColumnOrder;
import com.gs.ep.docknight.segmentation.model.BlockingZone;
import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.InlineDirection;
import com.gs.ep.docknight.segmentation.model.TextRun;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;

import static com.gs.ep.docknight.segmentation.RunFixtures.run;
import static org.junit.jupiter.api.Assertions.*;

public class VerticalClustererTest {

    private static TextRun cell(String text, double x, double y) {
        return run(text, x, y, 12, 60, 12, "MS-Mincho");
    }

    private static MutableList<TextRun> twoColumns() {
        return Lists.mutable.of(
                cell("左一", 200, 700),
                cell("右一", 300, 700),
                cell("右二", 300, 636),
                cell("左二", 200, 636));
    }

    @Test
    void clusterIntoColumns_defaultOrder_rightColumnFirst() {
        MutableList<MutableList<TextRun>> columns =
                VerticalClusterer.clusterIntoColumns(twoColumns(), SpatialGroupingOptions.defaults());

        assertEquals(2, columns.size());
        assertTrue(columns.get(0).allSatisfy(r -> r.getX() == 300));
    }

    @Test
    void clusterIntoColumns_leftToRight_leftColumnFirst() {
        SpatialGroupingOptions options = SpatialGroupingOptions.builder()
                .verticalColumnOrder(VerticalColumnOrder.LEFT_TO_RIGHT)
                .build();

        assertTrue(VerticalClusterer.clusterIntoColumns(twoColumns(), options).get(0)
                .allSatisfy(r -> r.getX() == 200));
    }

    @Test
    void splitColumnIntoParagraphs_largeGap_newParagraph() {
        MutableList<GroupedParagraph> paragraphs = VerticalClusterer.splitColumnIntoParagraphs(Lists.mutable.of(
                cell("三", 0, 400),
                cell("一", 0, 700),
                cell("二", 0, 636)), SpatialGroupingOptions.defaults(), Lists.mutable.empty());

        assertEquals(2, paragraphs.size());
        assertEquals("一二", paragraphs.get(0).getText());
        assertEquals(InlineDirection.TTB, paragraphs.get(0).getInlineDirection());
    }

    @Test
    void splitColumnIntoParagraphs_zoneInGap_newParagraph() {
        MutableList<GroupedParagraph> paragraphs = VerticalClusterer.splitColumnIntoParagraphs(Lists.mutable.of(
                cell("一", 0, 700),
                cell("二", 0, 636)), SpatialGroupingOptions.defaults(),
                Lists.mutable.of(new BlockingZone(0, 697, 20, 2)));

        assertEquals(2, paragraphs.size());
    }

    @Test
    void groupVerticalRuns_oneBlockPerColumn() {
        MutableList<GroupedText> blocks = VerticalClusterer.groupVerticalRuns(
                twoColumns(), SpatialGroupingOptions.defaults(), Lists.mutable.empty());

        assertEquals(2, blocks.size());
        assertEquals("右一右二", blocks.get(0).getText());
        assertEquals(InlineDirection.TTB, blocks.get(0).getLayoutInference().getInlineDirection());
    }
}

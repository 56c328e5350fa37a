package com.gs.ep.docknight.segmentation.context;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ContextualNcdSegmenterTest {

    private static final String CAT_1 = "The cat sat on the mat with another cat.";
    private static final String CAT_2 = "Another cat sat on the mat near the cat.";
    private static final String PHYSICS_1 = "Quantum physics explains particle spin states.";
    private static final String PHYSICS_2 = "Particle spin states in quantum physics experiments.";
    private static final String FOX = "The quick brown fox jumps over the lazy dog today.";

    /** 两个话题、每个两句，阈值放宽到足以合并同话题句子 */
    private static final ContextualSegmentationOptions TOPICS = ContextualSegmentationOptions.builder()
            .mergeThreshold(0.56)
            .strongMergeThreshold(0.2)
            .minCombinedChars(20)
            .build();

    private static MutableList<SegmentationUnit<Integer>> units(String... texts) {
        MutableList<SegmentationUnit<Integer>> units = Lists.mutable.empty();
        for (int i = 0; i < texts.length; i++) {
            units.add(SegmentationUnit.of(texts[i], i));
        }
        return units;
    }

    // ==================== 基本分段 ====================

    @Test
    void segment_twoTopics_splitBetweenThem() {
        ContextualSegmentationResult<Integer> result = ContextualNcdSegmenter.segmentTextUnitsByContext(
                units(CAT_1, CAT_2, PHYSICS_1, PHYSICS_2), TOPICS);

        assertEquals(0.56, result.getThreshold(), 1e-9);
        ImmutableList<BoundaryScore> boundaries = result.getBoundaries();
        assertEquals(3, boundaries.size());
        assertEquals(BoundaryDecisionReason.THRESHOLD_NCD, boundaries.get(0).getReason());
        assertEquals(BoundaryDecisionReason.NCD_TOO_HIGH, boundaries.get(1).getReason());
        assertEquals(BoundaryDecisionReason.THRESHOLD_NCD, boundaries.get(2).getReason());
        assertEquals(0.8125, boundaries.get(1).getNcd(), 1e-9);

        ImmutableList<ContextualSegment<Integer>> segments = result.getSegments();
        assertEquals(2, segments.size());
        assertEquals(0, segments.get(0).getStartIndex());
        assertEquals(1, segments.get(0).getEndIndex());
        assertEquals(Lists.immutable.of(2, 3), segments.get(1).getValues());
        assertEquals(CAT_1 + "\n" + CAT_2, segments.get(0).getText());
    }

    @Test
    void segment_identicalLongUnits_strongMerge() {
        ContextualSegmentationResult<Integer> result =
                ContextualNcdSegmenter.segmentTextUnitsByContext(units(FOX, FOX));

        BoundaryScore boundary = result.getBoundaries().getOnly();
        assertEquals(BoundaryDecisionReason.STRONG_NCD, boundary.getReason());
        assertTrue(boundary.isMerge());
        assertEquals(1, result.getSegments().size());
    }

    @Test
    void segment_captionContinuedByItsTail_suffixPrefixMerge() {
        ContextualSegmentationResult<Integer> result = ContextualNcdSegmenter.segmentTextUnitsByContext(
                units("Figure 3 shows the results of the experiment", "the results of the experiment"));

        assertEquals(BoundaryDecisionReason.SUFFIX_PREFIX_OVERLAP, result.getBoundaries().getOnly().getReason());
        assertEquals(1, result.getSegments().size());
    }

    @Test
    void segment_shortUnits_insufficientLength() {
        ContextualSegmentationResult<Integer> result =
                ContextualNcdSegmenter.segmentTextUnitsByContext(units("Short note", "Other words"));

        BoundaryScore boundary = result.getBoundaries().getOnly();
        assertEquals(BoundaryDecisionReason.INSUFFICIENT_LENGTH, boundary.getReason());
        assertEquals(10, boundary.getLeftTextLength());
        assertEquals(11, boundary.getRightTextLength());
        assertEquals(2, result.getSegments().size());
    }

    @Test
    void segment_unrelatedSentences_ncdTooHigh() {
        ContextualSegmentationResult<Integer> result = ContextualNcdSegmenter.segmentTextUnitsByContext(units(
                "Shipping address must include the postal code.",
                "Whisk two eggs with sugar until the mixture is pale."));

        assertEquals(BoundaryDecisionReason.NCD_TOO_HIGH, result.getBoundaries().getOnly().getReason());
        assertEquals(2, result.getSegments().size());
    }

    // ==================== 边界情况 ====================

    @Test
    void segment_emptyInput_noSegments() {
        ContextualSegmentationResult<Integer> result =
                ContextualNcdSegmenter.segmentTextUnitsByContext(Lists.mutable.<SegmentationUnit<Integer>>empty());

        assertTrue(result.getBoundaries().isEmpty());
        assertTrue(result.getSegments().isEmpty());
        assertEquals(ContextualSegmentationOptions.DEFAULT_MERGE_THRESHOLD, result.getThreshold(), 1e-9);
    }

    @Test
    void segment_singleUnit_oneSegmentWithNormalizedText() {
        ContextualSegmentationResult<Integer> result =
                ContextualNcdSegmenter.segmentTextUnitsByContext(units("   ", "  lone \t unit \n"));

        assertTrue(result.getBoundaries().isEmpty());
        ContextualSegment<Integer> segment = result.getSegments().getOnly();
        assertEquals(1, segment.getStartIndex());
        assertEquals(1, segment.getEndIndex());
        assertEquals("lone unit", segment.getText());
    }

    @Test
    void segment_blankUnit_droppedButIndicesReferToInput() {
        ContextualSegmentationResult<Integer> result = ContextualNcdSegmenter.segmentTextUnitsByContext(
                units(CAT_1, "   ", CAT_2, PHYSICS_1, PHYSICS_2), TOPICS);

        ImmutableList<BoundaryScore> boundaries = result.getBoundaries();
        assertEquals(3, boundaries.size());
        assertEquals(0, boundaries.get(0).getIndex());
        assertEquals(2, boundaries.get(0).getNextIndex());
        assertEquals(2, boundaries.get(1).getIndex());
        assertEquals(3, boundaries.get(1).getNextIndex());

        ImmutableList<ContextualSegment<Integer>> segments = result.getSegments();
        assertEquals(2, segments.size());
        assertEquals(0, segments.get(0).getStartIndex());
        assertEquals(2, segments.get(0).getEndIndex());
        assertEquals(Lists.immutable.of(0, 2), segments.get(0).getValues());
        assertEquals(3, segments.get(1).getStartIndex());
        assertEquals(4, segments.get(1).getEndIndex());
    }

    @Test
    void segment_everySegmentCoversItsUnitsInOrder() {
        ContextualSegmentationResult<Integer> result = ContextualNcdSegmenter.segmentTextUnitsByContext(
                units(CAT_1, CAT_2, PHYSICS_1, PHYSICS_2, FOX), TOPICS);

        MutableList<Integer> values = Lists.mutable.empty();
        for (ContextualSegment<Integer> segment : result.getSegments()) {
            values.addAllIterable(segment.getValues());
        }
        assertEquals(Lists.mutable.of(0, 1, 2, 3, 4), values);
        assertEquals(result.getBoundaries().count(b -> !b.isMerge()) + 1, result.getSegments().size());
    }

    // ==================== 自适应阈值 ====================

    @Test
    void segment_adaptiveMedian_thresholdLowered() {
        ContextualSegmentationOptions options = TOPICS.toBuilder().adaptiveMergePercentile(0.5).build();

        ContextualSegmentationResult<Integer> result = ContextualNcdSegmenter.segmentTextUnitsByContext(
                units(CAT_1, CAT_2, PHYSICS_1, PHYSICS_2), options);

        assertEquals(result.getBoundaries().get(0).getNcd(), result.getThreshold(), 1e-12);
        assertTrue(result.getBoundaries().get(0).isMerge());
        assertEquals(2, result.getSegments().size());
    }

    @Test
    void segment_adaptiveLowerQuartile_splitsFirstTopic() {
        ContextualSegmentationOptions options = TOPICS.toBuilder().adaptiveMergePercentile(0.25).build();

        ContextualSegmentationResult<Integer> result = ContextualNcdSegmenter.segmentTextUnitsByContext(
                units(CAT_1, CAT_2, PHYSICS_1, PHYSICS_2), options);

        assertTrue(result.getThreshold() < 0.4);
        assertEquals(BoundaryDecisionReason.NCD_TOO_HIGH, result.getBoundaries().get(0).getReason());
        assertEquals(3, result.getSegments().size());
    }

    @Test
    void chooseMergeThreshold_neverAboveBase() {
        assertEquals(0.22, ContextualNcdSegmenter.chooseMergeThreshold(0.22, 0.5,
                DoubleArrayList.newListWith(0.5, 0.9)), 1e-9);
        assertEquals(0.22, ContextualNcdSegmenter.chooseMergeThreshold(0.22, 0, DoubleArrayList.newListWith(0.1)),
                1e-9);
    }

    // ==================== 合并守卫 ====================

    @Test
    void segment_guardRejects_blockedByCallbackBeforeStrongMerge() {
        MutableList<Integer> seen = Lists.mutable.empty();
        BoundaryMergeGuard<Integer> guard = input -> {
            seen.add(input.getIndex());
            return false;
        };

        ContextualSegmentationResult<Integer> result = ContextualNcdSegmenter.segmentTextUnitsByContext(
                units(FOX, " ", FOX), ContextualSegmentationOptions.defaults(), guard);

        BoundaryScore boundary = result.getBoundaries().getOnly();
        assertEquals(BoundaryDecisionReason.BLOCKED_BY_CALLBACK, boundary.getReason());
        assertFalse(boundary.isMerge());
        assertEquals(Lists.mutable.of(0), seen);
        assertEquals(2, result.getSegments().size());
    }

    // ==================== 文本工具 ====================

    @Test
    void normalizeText_collapsesUnicodeWhitespace() {
        assertEquals("a b c", ContextualNcdSegmenter.normalizeText("  a  b\n\tc "));
        assertEquals("", ContextualNcdSegmenter.normalizeText(" \n "));
    }

    @Test
    void takeHeadAndTail_countCodePoints() {
        String text = "ab😀cd";

        assertEquals("ab😀", ContextualNcdSegmenter.takeHead(text, 3));
        assertEquals("😀cd", ContextualNcdSegmenter.takeTail(text, 3));
        assertEquals(text, ContextualNcdSegmenter.takeTail(text, 10));
    }

    @Test
    void suffixPrefixOverlapChars_belowMinimum_zero() {
        int[] left = "xxhello".codePoints().toArray();
        int[] right = "helloyy".codePoints().toArray();

        assertEquals(5, ContextualNcdSegmenter.suffixPrefixOverlapChars(left, right, 3));
        assertEquals(0, ContextualNcdSegmenter.suffixPrefixOverlapChars(left, right, 6));
    }
}

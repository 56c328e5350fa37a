package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.ColorMatchingMode;
import com.gs.ep.docknight.segmentation.SpatialGroupingOptions;
import com.gs.ep.docknight.segmentation.model.FillColor;
import com.gs.ep.docknight.segmentation.model.TextRun;
import org.junit.jupiter.api.Test;

import static com.gs.ep.docknight.segmentation.RunFixtures.run;
import static org.junit.jupiter.api.Assertions.*;

public class StyleMatcherTest {

    @Test
    void normalizeFontName_stripsSubsetPrefixOnly() {
        assertEquals("Helvetica", StyleMatcher.normalizeFontName("ABCDEF+Helvetica"));
        assertEquals("+Leading", StyleMatcher.normalizeFontName("+Leading"));
        assertEquals("Times", StyleMatcher.normalizeFontName("Times"));
    }

    @Test
    void hasSameColor_looseToleratesSmallDifferences() {
        FillColor black = FillColor.rgb(0, 0, 0);
        FillColor almostBlack = FillColor.rgb(0.04, 0, 0);

        assertTrue(StyleMatcher.hasSameColor(black, almostBlack, ColorMatchingMode.LOOSE));
        assertFalse(StyleMatcher.hasSameColor(black, almostBlack, ColorMatchingMode.STRICT));
        assertFalse(StyleMatcher.hasSameColor(black, FillColor.rgb(0.2, 0, 0), ColorMatchingMode.LOOSE));
    }

    @Test
    void hasSameColor_differentColorSpace_neverMatches() {
        assertFalse(StyleMatcher.hasSameColor(FillColor.BLACK, FillColor.rgb(0, 0, 0), ColorMatchingMode.LOOSE));
    }

    @Test
    void hasSameStyle_colorIgnoredWhenMatchingDisabled() {
        TextRun black = run("a", 0, 0, 10);
        TextRun red = black.toBuilder().fillColor(FillColor.rgb(1, 0, 0)).build();

        assertTrue(StyleMatcher.hasSameStyle(black, red, SpatialGroupingOptions.defaults()));
        assertFalse(StyleMatcher.hasSameStyle(black, red,
                SpatialGroupingOptions.builder().colorMatching(ColorMatchingMode.STRICT).build()));
    }

    @Test
    void hasSameStyle_sizeToleranceRelativeToFirstRun() {
        TextRun small = run("a", 0, 0, 10, 12, 10, "Helvetica");
        TextRun larger = run("b", 0, 0, 10, 12, 11.05, "Helvetica");
        SpatialGroupingOptions options = SpatialGroupingOptions.defaults();

        assertFalse(StyleMatcher.hasSameStyle(small, larger, options));
        assertTrue(StyleMatcher.hasSameStyle(larger, small, options));
    }
}

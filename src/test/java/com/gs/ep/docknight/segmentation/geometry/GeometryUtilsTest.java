package com.gs.ep.docknight.segmentation.geometry;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.list.mutable.primitive.DoubleArrayList;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GeometryUtilsTest {

    @Test
    void median_oddAndEvenCounts() {
        assertEquals(2, GeometryUtils.median(DoubleArrayList.newListWith(3, 1, 2)), 1e-9);
        assertEquals(2.5, GeometryUtils.median(DoubleArrayList.newListWith(4, 1, 3, 2)), 1e-9);
        assertEquals(0, GeometryUtils.median(new DoubleArrayList()), 1e-9);
    }

    @Test
    void quantile_interpolatesBetweenNeighbours() {
        DoubleArrayList values = DoubleArrayList.newListWith(1, 2, 3, 4);

        assertEquals(1.75, GeometryUtils.quantile(values, 0.25), 1e-9);
        assertEquals(3.25, GeometryUtils.quantile(values, 0.75), 1e-9);
        assertEquals(4, GeometryUtils.quantile(values, 1.5), 1e-9, "q is clamped to [0, 1]");
    }

    @Test
    void interQuartileRange_singleValueIsZero() {
        assertEquals(0, GeometryUtils.interQuartileRange(DoubleArrayList.newListWith(7)), 1e-9);
        assertEquals(1.5, GeometryUtils.interQuartileRange(DoubleArrayList.newListWith(1, 2, 3, 4)), 1e-9);
    }

    @Test
    void overlap1D_ignoresEndpointOrder() {
        assertEquals(5, GeometryUtils.overlap1D(0, 10, 5, 20), 1e-9);
        assertEquals(5, GeometryUtils.overlap1D(10, 0, 20, 5), 1e-9);
        assertEquals(0, GeometryUtils.overlap1D(0, 10, 15, 20), 1e-9);
    }

    @Test
    void clamp_boundsBothSides() {
        assertEquals(1.0, GeometryUtils.clamp(3.0, 0.0, 1.0));
        assertEquals(0, GeometryUtils.clamp(-4, 0, 9));
    }

    @Test
    void head_limitLargerThanList_returnsCopyOfAll() {
        MutableList<String> source = Lists.mutable.of("a", "b", "c");

        assertEquals(Lists.mutable.of("a", "b"), GeometryUtils.head(source, 2));
        MutableList<String> all = GeometryUtils.head(source, 10);
        assertEquals(source, all);
        assertNotSame(source, all);
    }

    @Test
    void sortWithTolerance_keepsNearEqualElementsInInputOrder() {
        MutableList<Double> values = Lists.mutable.of(5.0, 5.5, 3.0);

        GeometryUtils.sortWithTolerance(values, (a, b) -> Math.abs(a - b) <= 1 ? 0 : Double.compare(a, b));

        assertEquals(Lists.mutable.of(3.0, 5.0, 5.5), values);
    }
}

package com.gs.ep.docknight.segmentation.geometry;

import org.eclipse.collections.api.DoubleIterable;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Comparator;

/**
 * 几何与统计基础工具
 */
public final class GeometryUtils {

    private GeometryUtils() {
    }

    public static double clamp(double x, double lo, double hi) {
        return Math.max(lo, Math.min(hi, x));
    }

    public static int clamp(int x, int lo, int hi) {
        return Math.max(lo, Math.min(hi, x));
    }

    /**
     * 两个一维区间的重叠长度，端点顺序无关。
     */
    public static double overlap1D(double a0, double a1, double b0, double b1) {
        double lo = Math.max(Math.min(a0, a1), Math.min(b0, b1));
        double hi = Math.min(Math.max(a0, a1), Math.max(b0, b1));
        return Math.max(0, hi - lo);
    }

    /**
     * @return the median, or 0 for an empty input
     */
    public static double median(DoubleIterable values) {
        if (values.isEmpty()) {
            return 0;
        }
        double[] sorted = values.toSortedArray();
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2;
    }

    /**
     * 线性插值分位数，位置为 (n - 1) * q。
     *
     * @return the quantile, or 0 for an empty input
     */
    public static double quantile(DoubleIterable values, double q) {
        if (values.isEmpty()) {
            return 0;
        }
        double[] sorted = values.toSortedArray();
        double qq = clamp(q, 0, 1);
        double pos = (sorted.length - 1) * qq;
        int base = (int) Math.floor(pos);
        double rest = pos - base;
        if (base + 1 >= sorted.length) {
            return sorted[base];
        }
        return sorted[base] + rest * (sorted[base + 1] - sorted[base]);
    }

    public static double interQuartileRange(DoubleIterable values) {
        if (values.size() <= 1) {
            return 0;
        }
        return Math.max(0, quantile(values, 0.75) - quantile(values, 0.25));
    }

    /**
     * @return a new list with the first {@code limit} elements (or all, if fewer)
     */
    public static <T> MutableList<T> head(ListIterable<T> list, int limit) {
        int n = Math.min(limit, list.size());
        MutableList<T> result = Lists.mutable.empty();
        for (int i = 0; i < n; i++) {
            result.add(list.get(i));
        }
        return result;
    }

    /**
     * Stable in-place insertion sort.
     *
     * <p>Used for orderings with a positional tolerance ("same row if within 1pt"),
     * which are not transitive and therefore unsafe for {@link java.util.List#sort}.</p>
     */
    public static <T> MutableList<T> sortWithTolerance(MutableList<T> list, Comparator<? super T> comparator) {
        for (int i = 1; i < list.size(); i++) {
            T item = list.get(i);
            int j = i - 1;
            while (j >= 0 && comparator.compare(list.get(j), item) > 0) {
                list.set(j + 1, list.get(j));
                j--;
            }
            list.set(j + 1, item);
        }
        return list;
    }
}

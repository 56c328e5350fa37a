package com.gs.ep.docknight.segmentation.context;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

/**
 * 上下文分段结果：实际使用的合并阈值、每个边界的评分、以及分段。
 */
public final class ContextualSegmentationResult<T> {

    private final double threshold;
    private final ImmutableList<BoundaryScore> boundaries;
    private final ImmutableList<ContextualSegment<T>> segments;

    public ContextualSegmentationResult(double threshold, ListIterable<BoundaryScore> boundaries,
                                        ListIterable<ContextualSegment<T>> segments) {
        this.threshold = threshold;
        this.boundaries = Lists.immutable.withAll(boundaries);
        this.segments = Lists.immutable.withAll(segments);
    }

    /**
     * @return the merge threshold applied to {@code threshold-ncd} decisions
     */
    public double getThreshold() {
        return threshold;
    }

    public ImmutableList<BoundaryScore> getBoundaries() {
        return boundaries;
    }

    public ImmutableList<ContextualSegment<T>> getSegments() {
        return segments;
    }
}

package com.gs.ep.docknight.segmentation.context;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

public final class GroupedContextSegmentationResult {

    private final double threshold;
    private final ImmutableList<GroupedContextBoundaryScore> boundaries;
    private final ImmutableList<GroupedContextSegment> segments;

    public GroupedContextSegmentationResult(double threshold, ListIterable<GroupedContextBoundaryScore> boundaries,
                                            ListIterable<GroupedContextSegment> segments) {
        this.threshold = threshold;
        this.boundaries = Lists.immutable.withAll(boundaries);
        this.segments = Lists.immutable.withAll(segments);
    }

    public double getThreshold() {
        return threshold;
    }

    public ImmutableList<GroupedContextBoundaryScore> getBoundaries() {
        return boundaries;
    }

    public ImmutableList<GroupedContextSegment> getSegments() {
        return segments;
    }
}

package com.gs.ep.docknight.segmentation.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

/**
 * 页面级上下文：阻断区域与可选的页面尺寸。
 */
public final class GroupingContext {

    public static final GroupingContext EMPTY = new GroupingContext(Lists.immutable.empty(), null, null);

    private final ImmutableList<BlockingZone> blockingZones;
    private final Double pageWidth;
    private final Double pageHeight;

    public GroupingContext(ListIterable<BlockingZone> blockingZones, Double pageWidth, Double pageHeight) {
        this.blockingZones = blockingZones == null ? Lists.immutable.empty() : Lists.immutable.withAll(blockingZones);
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
    }

    public static GroupingContext of(ListIterable<BlockingZone> blockingZones) {
        return new GroupingContext(blockingZones, null, null);
    }

    public static GroupingContext ofPage(double pageWidth, double pageHeight) {
        return new GroupingContext(null, pageWidth, pageHeight);
    }

    public ImmutableList<BlockingZone> getBlockingZones() {
        return blockingZones;
    }

    /**
     * @return page width, or {@code null} when unknown (page-column detection is then skipped)
     */
    public Double getPageWidth() {
        return pageWidth;
    }

    public Double getPageHeight() {
        return pageHeight;
    }

    public boolean hasPageWidth() {
        return pageWidth != null && pageWidth > 0;
    }

    public GroupingContext withBlockingZones(ListIterable<BlockingZone> zones) {
        return new GroupingContext(zones, pageWidth, pageHeight);
    }
}

package com.gs.ep.docknight.segmentation.context;

/**
 * 传给 {@link BoundaryMergeGuard} 的边界信息。
 */
public final class BoundaryDecisionInput<T> {

    private final int index;
    private final SegmentationUnit<T> leftUnit;
    private final SegmentationUnit<T> rightUnit;
    private final double ncd;

    public BoundaryDecisionInput(int index, SegmentationUnit<T> leftUnit, SegmentationUnit<T> rightUnit, double ncd) {
        this.index = index;
        this.leftUnit = leftUnit;
        this.rightUnit = rightUnit;
        this.ncd = ncd;
    }

    public int getIndex() {
        return index;
    }

    public SegmentationUnit<T> getLeftUnit() {
        return leftUnit;
    }

    public SegmentationUnit<T> getRightUnit() {
        return rightUnit;
    }

    public double getNcd() {
        return ncd;
    }
}

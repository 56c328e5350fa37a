package com.gs.ep.docknight.segmentation.context;

/**
 * 相邻两个单元之间的边界评分与判定结果。
 *
 * <p>{@code index} 与 {@code nextIndex} 都是调用方输入列表中的下标。文本被规整为空的单元不参与评分，
 * 因此两者之差可能大于 1。</p>
 */
public class BoundaryScore {

    private final int index;
    private final int nextIndex;
    private final double ncd;
    private final int leftTextLength;
    private final int rightTextLength;
    private final BoundaryDecisionReason reason;

    public BoundaryScore(int index, int nextIndex, double ncd, int leftTextLength, int rightTextLength,
                         BoundaryDecisionReason reason) {
        this.index = index;
        this.nextIndex = nextIndex;
        this.ncd = ncd;
        this.leftTextLength = leftTextLength;
        this.rightTextLength = rightTextLength;
        this.reason = reason;
    }

    /**
     * @return input index of the unit left of (before) this boundary
     */
    public int getIndex() {
        return index;
    }

    /**
     * @return input index of the unit right of (after) this boundary
     */
    public int getNextIndex() {
        return nextIndex;
    }

    public double getNcd() {
        return ncd;
    }

    /** Code point count of the normalized left unit. */
    public int getLeftTextLength() {
        return leftTextLength;
    }

    public int getRightTextLength() {
        return rightTextLength;
    }

    public boolean isMerge() {
        return reason.isMerge();
    }

    public BoundaryDecisionReason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return String.format("BoundaryScore{%d|%d, ncd=%.3f, %s}", index, nextIndex, ncd, reason);
    }
}

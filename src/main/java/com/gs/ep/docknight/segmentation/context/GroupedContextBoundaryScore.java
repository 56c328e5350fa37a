package com.gs.ep.docknight.segmentation.context;

/**
 * 文本块之间的边界评分，附带两块的水平重叠比例。
 */
public final class GroupedContextBoundaryScore extends BoundaryScore {

    private final double xAxisOverlapRatio;

    public GroupedContextBoundaryScore(BoundaryScore score, double xAxisOverlapRatio) {
        super(score.getIndex(), score.getNextIndex(), score.getNcd(), score.getLeftTextLength(),
                score.getRightTextLength(), score.getReason());
        this.xAxisOverlapRatio = xAxisOverlapRatio;
    }

    /**
     * @return x overlap divided by the narrower block width, 0 when that width is not positive
     */
    public double getXAxisOverlapRatio() {
        return xAxisOverlapRatio;
    }

    @Override
    public String toString() {
        return String.format("GroupedContextBoundaryScore{%d|%d, ncd=%.3f, overlap=%.2f, %s}",
                getIndex(), getNextIndex(), getNcd(), xAxisOverlapRatio, getReason());
    }
}

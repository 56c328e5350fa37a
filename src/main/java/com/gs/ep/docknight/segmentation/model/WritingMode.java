package com.gs.ep.docknight.segmentation.model;

/**
 * 页面主导书写模式
 */
public enum WritingMode {

    /**
     * 横排：按基线聚类成行，再合并成块
     */
    HORIZONTAL("横排"),

    /**
     * 竖排：按中心 x 聚类成列，列内按间距拆分段落
     */
    VERTICAL("竖排");

    private final String displayName;

    WritingMode(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}

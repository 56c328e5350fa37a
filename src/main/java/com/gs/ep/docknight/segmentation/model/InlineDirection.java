package com.gs.ep.docknight.segmentation.model;

/**
 * 行内书写方向
 * 决定段落内文本片段的排列顺序以及左右内边距的语义映射
 */
public enum InlineDirection {

    /**
     * 从左到右：按 x 升序
     */
    LTR("ltr"),

    /**
     * 从右到左（希伯来文、阿拉伯文）：按 x 降序
     */
    RTL("rtl"),

    /**
     * 从上到下（竖排）：按中心 y 降序
     */
    TTB("ttb");

    private final String value;

    InlineDirection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}

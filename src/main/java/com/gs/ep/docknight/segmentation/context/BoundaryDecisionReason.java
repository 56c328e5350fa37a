package com.gs.ep.docknight.segmentation.context;

/**
 * 边界判定原因
 */
public enum BoundaryDecisionReason {

    /** NCD 低于强合并阈值，不看长度直接合并 */
    STRONG_NCD("strong-ncd", true),

    /** 左侧后缀与右侧前缀大段重合，视为跨页/跨栏重复的同一行 */
    SUFFIX_PREFIX_OVERLAP("suffix-prefix-overlap", true),

    /** NCD 不超过（可能经自适应收紧的）合并阈值 */
    THRESHOLD_NCD("threshold-ncd", true),

    NCD_TOO_HIGH("ncd-too-high", false),

    /** 两侧合计字符数不足，相似度不可信 */
    INSUFFICIENT_LENGTH("insufficient-length", false),

    /** 调用方的合并守卫拒绝 */
    BLOCKED_BY_CALLBACK("blocked-by-callback", false);

    private final String value;
    private final boolean merge;

    BoundaryDecisionReason(String value, boolean merge) {
        this.value = value;
        this.merge = merge;
    }

    public String getValue() {
        return value;
    }

    /**
     * @return whether a boundary decided for this reason is merged
     */
    public boolean isMerge() {
        return merge;
    }

    @Override
    public String toString() {
        return value;
    }
}

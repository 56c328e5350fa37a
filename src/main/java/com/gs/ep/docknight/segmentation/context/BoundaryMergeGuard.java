package com.gs.ep.docknight.segmentation.context;

/**
 * 领域相关的合并守卫。返回 false 的边界一律不合并（{@link BoundaryDecisionReason#BLOCKED_BY_CALLBACK}）。
 *
 * @param <T> payload type of the units
 */
@FunctionalInterface
public interface BoundaryMergeGuard<T> {

    boolean canMerge(BoundaryDecisionInput<T> input);

    static <T> BoundaryMergeGuard<T> allowAll() {
        return input -> true;
    }
}

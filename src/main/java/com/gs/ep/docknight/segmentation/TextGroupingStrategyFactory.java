package com.gs.ep.docknight.segmentation;

import com.gs.ep.docknight.segmentation.geometry.DirectionResolver;
import com.gs.ep.docknight.segmentation.model.TextRun;
import com.gs.ep.docknight.segmentation.model.WritingMode;
import com.gs.ep.docknight.segmentation.strategy.HorizontalGroupingStrategy;
import com.gs.ep.docknight.segmentation.strategy.VerticalGroupingStrategy;
import org.eclipse.collections.api.list.ListIterable;

import java.util.Objects;

/**
 * 文本分组策略工厂
 *
 * 负责：
 * 1. 检测页面的书写模式（或使用配置强制的模式）
 * 2. 根据模式返回对应的策略
 *
 * 策略实例是无状态的，按参数缓存复用。
 */
public class TextGroupingStrategyFactory {

    private final HorizontalGroupingStrategy horizontalStrategy;
    private final VerticalGroupingStrategy verticalStrategy;
    private final SpatialGroupingOptions options;

    public TextGroupingStrategyFactory(SpatialGroupingOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        this.horizontalStrategy = new HorizontalGroupingStrategy(options);
        this.verticalStrategy = new VerticalGroupingStrategy(options);
    }

    /**
     * 根据页面内容检测书写模式并返回策略
     *
     * @param runs 页面上的文本片段
     * @return 适合该页面的分组策略
     */
    public TextGroupingStrategy createStrategy(ListIterable<TextRun> runs) {
        return getStrategy(detectWritingMode(runs));
    }

    /**
     * 根据书写模式获取对应的策略实例
     */
    public TextGroupingStrategy getStrategy(WritingMode writingMode) {
        switch (writingMode) {
            case VERTICAL:
                return verticalStrategy;
            case HORIZONTAL:
            default:
                return horizontalStrategy;
        }
    }

    /**
     * 检测书写模式。采样基于从上到下排序后的前若干个片段。
     */
    public WritingMode detectWritingMode(ListIterable<TextRun> runs) {
        return DirectionResolver.resolveWritingMode(AbstractTextGroupingStrategy.sortTopToBottom(runs), options);
    }
}

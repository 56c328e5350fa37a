package com.gs.ep.docknight.segmentation;

import com.gs.ep.docknight.segmentation.model.GroupedText;
import com.gs.ep.docknight.segmentation.model.GroupingContext;
import com.gs.ep.docknight.segmentation.model.TextRun;
import com.gs.ep.docknight.segmentation.model.WritingMode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;

/**
 * 文本分组策略接口
 *
 * 横排与竖排页面使用不同的聚类路径，由 {@link TextGroupingStrategyFactory} 根据书写模式选择。
 */
public interface TextGroupingStrategy extends TextGroupingFunction {

    /**
     * 获取该策略适用的书写模式
     */
    WritingMode getWritingMode();

    /**
     * 将一页的文本片段分组为文本块
     *
     * @param runs 页面上的文本片段，可以为空
     * @param context 阻断区域与页面尺寸
     * @return 按阅读顺序排列的文本块
     */
    @Override
    ImmutableList<GroupedText> group(ListIterable<TextRun> runs, GroupingContext context);

    /**
     * 获取策略使用的参数
     */
    SpatialGroupingOptions getOptions();
}

package com.gs.ep.docknight.segmentation.geometry;

import com.gs.ep.docknight.segmentation.model.BlockingZone;
import com.gs.ep.docknight.segmentation.model.GroupedParagraph;
import com.gs.ep.docknight.segmentation.model.TextBounds;
import com.gs.ep.docknight.segmentation.model.TextRun;
import org.eclipse.collections.api.list.ListIterable;

/**
 * 阻断区域检测
 *
 * <p>每个检测都区分两种情况：位于两个候选之间的区域会阻断合并；
 * 同时包含两个候选的区域是背景容器（例如底色面板），不阻断。</p>
 */
public final class BlockingZones {

    private BlockingZones() {
    }

    // ==================== 同一行内的两个片段 ====================

    /**
     * @return true if a zone sits in the horizontal gap between the two runs
     */
    public static boolean isBlockedBetweenRuns(TextRun text1, TextRun text2, ListIterable<BlockingZone> zones) {
        if (zones == null || zones.isEmpty()) {
            return false;
        }

        TextRun left = text1.getX() < text2.getX() ? text1 : text2;
        TextRun right = left == text1 ? text2 : text1;

        double gapLeft = left.getRight();
        double gapRight = right.getX();
        double gapY = Math.min(left.getY(), right.getY());
        double gapTop = Math.max(left.getTop(), right.getTop());

        // 两个片段重叠，没有间隙
        if (gapLeft >= gapRight) {
            return false;
        }

        for (BlockingZone zone : zones) {
            boolean horizontalOverlap = zone.getX() < gapRight && zone.getRight() > gapLeft;
            boolean verticalOverlap = zone.getY() < gapTop && zone.getTop() > gapY;
            if (!horizontalOverlap || !verticalOverlap) {
                continue;
            }

            boolean containsLeft = zone.getX() <= left.getX() && zone.getRight() >= gapLeft;
            boolean containsRight = zone.getX() <= gapRight && zone.getRight() >= right.getRight();
            if (containsLeft && containsRight) {
                continue;
            }
            return true;
        }
        return false;
    }

    // ==================== 上下相邻的两行 ====================

    /**
     * @return true if a zone lies vertically between the two lines' baselines and overlaps their x-span
     */
    public static boolean isBlockedBetweenLines(GroupedParagraph line1, GroupedParagraph line2,
                                                ListIterable<BlockingZone> zones) {
        if (zones == null || zones.isEmpty()) {
            return false;
        }

        boolean firstIsUpper = line1.getBaselineY() > line2.getBaselineY();
        GroupedParagraph upper = firstIsUpper ? line1 : line2;
        GroupedParagraph lower = firstIsUpper ? line2 : line1;
        TextBounds upperBox = upper.getBounds();
        TextBounds lowerBox = lower.getBounds();

        double lineMinX = Math.min(upperBox.getX(), lowerBox.getX());
        double lineMaxX = Math.max(upperBox.getRight(), lowerBox.getRight());

        for (BlockingZone zone : zones) {
            boolean verticalBetween = zone.getY() < upper.getBaselineY() && zone.getTop() > lower.getBaselineY();
            boolean horizontalOverlap = zone.getX() < lineMaxX && zone.getRight() > lineMinX;
            if (!verticalBetween || !horizontalOverlap) {
                continue;
            }
            if (contains(zone, upperBox) && contains(zone, lowerBox)) {
                continue;
            }
            return true;
        }
        return false;
    }

    // ==================== 竖排列内的两个片段 ====================

    /**
     * @return true if a zone sits in the vertical gap between two runs of one vertical column
     */
    public static boolean isBlockedBetweenVerticalRuns(TextRun text1, TextRun text2,
                                                       ListIterable<BlockingZone> zones) {
        if (zones == null || zones.isEmpty()) {
            return false;
        }

        TextRun first = text1.getCenterY() >= text2.getCenterY() ? text1 : text2;
        TextRun second = first == text1 ? text2 : text1;

        double gapStart = second.getTop();
        double gapEnd = first.getY();
        if (gapEnd <= gapStart) {
            return false;
        }

        double bandLeft = Math.min(first.getX(), second.getX());
        double bandRight = Math.max(first.getRight(), second.getRight());

        for (BlockingZone zone : zones) {
            boolean verticalBetween = zone.getY() < gapEnd && zone.getTop() > gapStart;
            boolean horizontalOverlap = zone.getX() < bandRight && zone.getRight() > bandLeft;
            if (!verticalBetween || !horizontalOverlap) {
                continue;
            }
            if (contains(zone, first.getBounds()) && contains(zone, second.getBounds())) {
                continue;
            }
            return true;
        }
        return false;
    }

    private static boolean contains(BlockingZone zone, TextBounds box) {
        return zone.getY() <= box.getY()
                && zone.getTop() >= box.getTop()
                && zone.getX() <= box.getX()
                && zone.getRight() >= box.getRight();
    }
}

package com.gs.ep.docknight.segmentation;

/**
 * 显式指定的配置资源不存在、无法读取或包含非法值时抛出。
 */
public class SegmentationConfigException extends Exception {

    public SegmentationConfigException(String message) {
        super(message);
    }

    public SegmentationConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}

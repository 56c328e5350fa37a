package com.gs.ep.docknight.segmentation.context;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.zip.Deflater;

/**
 * 归一化压缩距离（NCD）
 *
 * <pre>
 * NCD(A, B) = (C(A + B) - min(C(A), C(B))) / max(C(A), C(B))
 * </pre>
 * C 为 UTF-8 字节经 raw deflate（级别 6）压缩后的长度。
 *
 * <p>压缩长度按文本缓存。一个实例只服务于一次分段调用，不是线程安全的。</p>
 */
final class CompressionDistance {

    private static final int COMPRESSION_LEVEL = 6;
    private static final int BUFFER_SIZE = 512;

    private final Map<String, Integer> sizeCache = new HashMap<>();

    /**
     * @return 0 when both sides are empty, 1 when exactly one is
     */
    double distance(String left, String right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 1;
        }
        int cLeft = compressedSize(left);
        int cRight = compressedSize(right);
        int cBoth = compressedSize(left + right);
        int maxSide = Math.max(cLeft, cRight);
        if (maxSide == 0) {
            return 0;
        }
        return (double) (cBoth - Math.min(cLeft, cRight)) / maxSide;
    }

    int compressedSize(String text) {
        return sizeCache.computeIfAbsent(text, CompressionDistance::deflatedLength);
    }

    int cacheSize() {
        return sizeCache.size();
    }

    private static int deflatedLength(String text) {
        byte[] input = text.getBytes(StandardCharsets.UTF_8);
        Deflater deflater = new Deflater(COMPRESSION_LEVEL, true);
        try {
            deflater.setInput(input);
            deflater.finish();
            byte[] buffer = new byte[BUFFER_SIZE];
            int total = 0;
            while (!deflater.finished()) {
                total += deflater.deflate(buffer);
            }
            return total;
        } finally {
            deflater.end();
        }
    }
}

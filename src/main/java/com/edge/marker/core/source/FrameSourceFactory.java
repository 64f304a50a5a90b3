package com.edge.marker.core.source;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class FrameSourceFactory {

    private FrameSourceFactory() {
    }

    /**
     * 创建帧来源
     * @param src 来源标识
     *            - 目录：图像序列
     *            - 文件：视频文件
     * @return 帧来源实例（未打开）
     * @throws IllegalArgumentException 路径为空或不存在
     */
    public static FrameSource create(String src) {
        if (src == null || src.isBlank()) {
            throw new IllegalArgumentException("Frame source cannot be empty");
        }
        Path path = Paths.get(src.trim());
        if (Files.isDirectory(path)) {
            return new ImageSequenceSource(path);
        }
        if (Files.isRegularFile(path)) {
            return new VideoFileSource(path.toString());
        }
        throw new IllegalArgumentException("Frame source not found: " + src);
    }
}

package com.edge.marker.core.detect;

/**
 * 输入帧无效（null、空图像或尺寸异常），该帧不写入任何记录
 */
public class InvalidFrameException extends RuntimeException {
    private final int frameIndex;

    public InvalidFrameException(int frameIndex, String message) {
        super("Frame " + frameIndex + ": " + message);
        this.frameIndex = frameIndex;
    }

    public int getFrameIndex() {
        return frameIndex;
    }
}

package com.edge.marker.core.source;

/**
 * 帧来源
 */
public interface FrameSource extends AutoCloseable {
    /**
     * 打开帧来源
     * @return 是否成功打开
     */
    boolean open();

    /**
     * 按序号读取一帧（序号从 0 开始，不是帧号）
     * @param position 序号
     * @return 帧，序列结束时返回 null；文件无法解码时返回空图像的帧
     */
    Frame getFrame(int position);

    /**
     * 帧总数
     * @return 总数，未知时返回 -1
     */
    int size();

    /**
     * 关闭帧来源
     */
    @Override
    void close();

    /**
     * 检查是否已打开
     */
    boolean isOpened();
}

package com.edge.marker.core.detect;

import org.opencv.core.Mat;

import java.util.List;

/**
 * 标记检测器
 * <p>
 * 对字典解码细节不透明：给定图像和参数，返回候选标记 ID 与角点。
 * 相同输入必须得到相同输出。
 */
public interface MarkerDetector {
    /**
     * 检测图像中的标记
     *
     * @param image  输入图像（灰度或 BGR）
     * @param params 检测参数，包含字典类型
     * @return 候选列表，未检测到时为空列表
     */
    List<MarkerCandidate> detect(Mat image, DetectionParams params);
}

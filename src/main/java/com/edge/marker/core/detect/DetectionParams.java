package com.edge.marker.core.detect;

import lombok.Builder;
import lombok.Value;

/**
 * 单次检测尝试的参数组合
 * <p>
 * 对应 ArUco DetectorParameters 中影响候选提取的字段，
 * 与 dictionary 一起构成一个 DetectionStage 的完整配置。
 */
@Value
@Builder(toBuilder = true)
public class DetectionParams {
    /** 标记字典 */
    @Builder.Default
    MarkerDictionary dictionary = MarkerDictionary.DICT_4X4_50;
    /** 自适应阈值窗口（最小/最大/步长，像素） */
    @Builder.Default
    int winSizeMin = 3;
    @Builder.Default
    int winSizeMax = 23;
    @Builder.Default
    int winSizeStep = 10;
    /** 自适应阈值常数 */
    @Builder.Default
    double thresholdConstant = 7;
    /** 最小标记周长（相对图像最大边的比例） */
    @Builder.Default
    double minPerimeterRate = 0.03;
    /** 多边形近似精度 */
    @Builder.Default
    double approxAccuracyRate = 0.03;
    /** 角点间最小距离（相对标记周长） */
    @Builder.Default
    double minCornerDistanceRate = 0.05;
    /** 标记间最小距离（相对标记周长） */
    @Builder.Default
    double minMarkerDistanceRate = 0.05;

    public static DetectionParams defaults() {
        return DetectionParams.builder().build();
    }

    @Override
    public String toString() {
        return String.format("%s win=%d..%d/%d C=%.1f perim=%.3f approx=%.3f corner=%.3f marker=%.3f",
            dictionary, winSizeMin, winSizeMax, winSizeStep, thresholdConstant,
            minPerimeterRate, approxAccuracyRate, minCornerDistanceRate, minMarkerDistanceRate);
    }
}

package com.edge.marker.core.detect;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 检测流水线的不可变配置
 * <p>
 * 由 application.yml 转换而来，通过构造函数传入 {@link DetectionPipeline}，
 * 不持有任何全局可变状态，可在多个工作线程间共享。
 */
@Value
@Builder(toBuilder = true)
public class DetectionSettings {
    /** 期望标记数量，找齐即视为完整 */
    @Builder.Default
    int expectedMarkers = 4;
    /** 默认阶段参数 */
    @Builder.Default
    DetectionParams baseline = DetectionParams.defaults();
    /** 快速扫描阶段参数 */
    @Builder.Default
    DetectionParams quickScan = quickScanDefaults();
    /** 精细搜索阶段的候选参数，按顺序尝试 */
    @Singular
    List<DetectionParams> detailedCandidates;
    /** 精细搜索阶段的对比度等级，从低到高 */
    @Singular
    List<Integer> contrastLevels;
    /** 精细搜索阶段最多尝试次数，限制单帧最坏耗时 */
    @Builder.Default
    int maxDetailedAttempts = 200;
    /** CLAHE 基础分块大小 */
    @Builder.Default
    int claheTileSize = 8;

    public static DetectionParams quickScanDefaults() {
        return DetectionParams.builder()
            .winSizeMin(3)
            .winSizeMax(33)
            .winSizeStep(6)
            .thresholdConstant(5)
            .minPerimeterRate(0.01)
            .approxAccuracyRate(0.05)
            .minCornerDistanceRate(0.02)
            .minMarkerDistanceRate(0.02)
            .build();
    }

    /**
     * 精细搜索候选：窗口大小 × 阈值常数 × 字典 的笛卡尔积
     */
    public static List<DetectionParams> sweep(List<MarkerDictionary> dictionaries, List<Integer> windowSizes,
                                              List<Double> thresholdConstants, DetectionParams template) {
        List<DetectionParams> candidates = new ArrayList<>();
        for (MarkerDictionary dictionary : dictionaries) {
            for (int window : windowSizes) {
                for (double constant : thresholdConstants) {
                    candidates.add(template.toBuilder()
                        .dictionary(dictionary)
                        .winSizeMin(window)
                        .winSizeMax(window)
                        .winSizeStep(1)
                        .thresholdConstant(constant)
                        .build());
                }
            }
        }
        return candidates;
    }

    public static DetectionSettings defaults() {
        DetectionParams template = quickScanDefaults();
        return DetectionSettings.builder()
            .detailedCandidates(sweep(List.of(MarkerDictionary.DICT_4X4_50),
                List.of(3, 7, 15, 23, 33), List.of(3.0, 7.0, 11.0), template))
            .contrastLevels(ContrastEnhancer.levels(0, 100, 25))
            .build();
    }
}

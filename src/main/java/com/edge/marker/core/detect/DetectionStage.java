package com.edge.marker.core.detect;

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 单次检测尝试：一组参数作用于一个图像变体
 * <p>
 * 只保留 ID 在 [0, expectedMarkers) 内的候选；同一 ID 出现多次时保留包围面积更大的那个。
 * 检测器对某组参数抛出的异常视为"未找到"。
 */
public class DetectionStage {
    private static final Logger logger = LoggerFactory.getLogger(DetectionStage.class);

    private final MarkerDetector detector;
    private final int expectedMarkers;

    public DetectionStage(MarkerDetector detector, int expectedMarkers) {
        if (detector == null) {
            throw new IllegalArgumentException("Detector cannot be null");
        }
        this.detector = detector;
        this.expectedMarkers = expectedMarkers;
    }

    /**
     * 执行检测
     *
     * @param variant 图像变体
     * @param params  参数组合
     * @return ID → 候选，按 ID 排序
     */
    public Map<Integer, MarkerCandidate> run(Mat variant, DetectionParams params) {
        List<MarkerCandidate> raw;
        try {
            raw = detector.detect(variant, params);
        } catch (RuntimeException e) {
            logger.debug("Detector failed with {}: {}", params, e.getMessage());
            return Collections.emptyMap();
        }
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<Integer, MarkerCandidate> byId = new TreeMap<>();
        for (MarkerCandidate candidate : raw) {
            int id = candidate.getMarkerId();
            if (id < 0 || id >= expectedMarkers) {
                continue;
            }
            MarkerCandidate existing = byId.get(id);
            if (existing == null || candidate.getCorners().area() > existing.getCorners().area()) {
                byId.put(id, candidate);
            }
        }
        return byId;
    }
}

package com.edge.marker.core.geometry;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 多帧长宽比统计（仅统计几何可用的帧）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GeometrySummary {
    private int totalFrames;
    private int availableFrames;
    private double meanAspectRatio;
    private double minAspectRatio;
    private double maxAspectRatio;
    private double stdDevAspectRatio;
    private double maxCenterDeviation;
}

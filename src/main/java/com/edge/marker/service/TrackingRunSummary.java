package com.edge.marker.service;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 一次检测运行的汇总
 */
@Data
public class TrackingRunSummary {
    private String source;
    private int workers;
    private int processedFrames;
    private int completeFrames;
    private int partialFrames;
    private int emptyFrames;
    // 输入无效被跳过的帧号
    private List<Integer> failedFrames = new ArrayList<>();
    private long durationMs;
}

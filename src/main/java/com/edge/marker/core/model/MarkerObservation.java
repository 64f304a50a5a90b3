package com.edge.marker.core.model;

import com.edge.marker.core.detect.DetectionParams;
import com.edge.marker.core.detect.PipelineState;

import java.util.Objects;

/**
 * 某帧中单个标记的观测结果（不可变）
 * <p>
 * 除几何信息外，记录产生它的阶段、参数和对比度等级，用于排查检测失败。
 */
public final class MarkerObservation {
    private final int markerId;
    private final CornerSet corners;
    private final Point center;
    private final double angle;
    private final PipelineState stage;
    private final DetectionParams params;
    private final int contrastLevel;

    public MarkerObservation(int markerId, CornerSet corners, PipelineState stage,
                             DetectionParams params, int contrastLevel) {
        if (corners == null) {
            throw new IllegalArgumentException("corners cannot be null");
        }
        this.markerId = markerId;
        this.corners = corners;
        this.center = corners.center();
        this.angle = corners.angle();
        this.stage = stage;
        this.params = params;
        this.contrastLevel = contrastLevel;
    }

    public int getMarkerId() {
        return markerId;
    }

    public CornerSet getCorners() {
        return corners;
    }

    public Point getCenter() {
        return center;
    }

    /** 朝向角（度） */
    public double getAngle() {
        return angle;
    }

    public PipelineState getStage() {
        return stage;
    }

    public DetectionParams getParams() {
        return params;
    }

    public int getContrastLevel() {
        return contrastLevel;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarkerObservation)) return false;
        MarkerObservation that = (MarkerObservation) o;
        return markerId == that.markerId
            && contrastLevel == that.contrastLevel
            && corners.equals(that.corners)
            && stage == that.stage
            && Objects.equals(params, that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(markerId, corners, stage, params, contrastLevel);
    }

    @Override
    public String toString() {
        return String.format("ID%d center=%s angle=%.1f stage=%s contrast=%d",
            markerId, center, angle, stage, contrastLevel);
    }
}

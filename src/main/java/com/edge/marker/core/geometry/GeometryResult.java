package com.edge.marker.core.geometry;

import com.edge.marker.core.model.Point;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 单帧几何分析结果
 * <p>
 * 帧不完整时 available=false，各数值字段为 NaN / null，不提供估算值。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GeometryResult {
    private final int frameIndex;
    private final boolean available;
    private final String reason;
    private final double outerAspectRatio;
    private final double innerAspectRatio;
    private final double averageAspectRatio;
    private final Point relativeCenter;
    private final Point centroid;

    private GeometryResult(int frameIndex, boolean available, String reason,
                           double outerAspectRatio, double innerAspectRatio,
                           Point relativeCenter, Point centroid) {
        this.frameIndex = frameIndex;
        this.available = available;
        this.reason = reason;
        this.outerAspectRatio = outerAspectRatio;
        this.innerAspectRatio = innerAspectRatio;
        this.averageAspectRatio = (outerAspectRatio + innerAspectRatio) / 2.0;
        this.relativeCenter = relativeCenter;
        this.centroid = centroid;
    }

    public static GeometryResult of(int frameIndex, double outerAspectRatio, double innerAspectRatio,
                                    Point relativeCenter, Point centroid) {
        return new GeometryResult(frameIndex, true, null, outerAspectRatio, innerAspectRatio,
            relativeCenter, centroid);
    }

    public static GeometryResult unavailable(int frameIndex, String reason) {
        return new GeometryResult(frameIndex, false, reason, Double.NaN, Double.NaN, null, null);
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    public boolean isAvailable() {
        return available;
    }

    public String getReason() {
        return reason;
    }

    /** 外角长宽比（长边/短边，≥1） */
    public double getOuterAspectRatio() {
        return outerAspectRatio;
    }

    /** 内角长宽比（长边/短边，≥1） */
    public double getInnerAspectRatio() {
        return innerAspectRatio;
    }

    /** 内外角长宽比的平均值，抵消单个标记角点检测的偏差 */
    public double getAverageAspectRatio() {
        return averageAspectRatio;
    }

    /** 对角线交点（TL↔BR 与 TR↔BL 中心连线） */
    public Point getRelativeCenter() {
        return relativeCenter;
    }

    /** 四个标记中心的质心 */
    public Point getCentroid() {
        return centroid;
    }

    /** 对角线交点与质心的距离，两种中心估计的一致性检查 */
    public double getCenterDeviation() {
        if (relativeCenter == null || centroid == null) {
            return Double.NaN;
        }
        return relativeCenter.distanceTo(centroid);
    }

    @Override
    public String toString() {
        if (!available) {
            return "GeometryResult{frame=" + frameIndex + ", unavailable: " + reason + "}";
        }
        return String.format("GeometryResult{frame=%d, outer=%.4f, inner=%.4f, avg=%.4f, center=%s}",
            frameIndex, outerAspectRatio, innerAspectRatio, averageAspectRatio, relativeCenter);
    }
}

package com.edge.marker.core.export;

import com.edge.marker.core.model.MarkerRole;
import com.edge.marker.core.model.Point;

/**
 * 导出轨迹中的一个点（消费方坐标系）
 */
public class ExportPoint {

    /**
     * 点的来源，用于质量审计
     */
    public enum FillStatus {
        /** 该帧实际检测到 */
        OBSERVED,
        /** 前后均有观测，线性插值 */
        INTERPOLATED,
        /** 序列首尾缺失，取最近观测值 */
        CLAMPED
    }

    private final int frameIndex;
    private final MarkerRole role;
    private final Point point;
    private final FillStatus status;

    public ExportPoint(int frameIndex, MarkerRole role, Point point, FillStatus status) {
        this.frameIndex = frameIndex;
        this.role = role;
        this.point = point;
        this.status = status;
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    public MarkerRole getRole() {
        return role;
    }

    public Point getPoint() {
        return point;
    }

    public FillStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return frameIndex + ":" + role + point + "[" + status + "]";
    }
}

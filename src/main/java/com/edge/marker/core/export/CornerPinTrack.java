package com.edge.marker.core.export;

import com.edge.marker.core.model.MarkerRole;
import com.edge.marker.core.model.Point;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 连续的四点轨迹：每帧每个角色一个点，覆盖 [firstFrame, lastFrame] 全部帧
 * <p>
 * 坐标已转换为消费方坐标系（原点左下角，Y 向上）。
 */
public class CornerPinTrack {
    private final ExportPointType pointType;
    private final int firstFrame;
    private final int lastFrame;
    private final int imageWidth;
    private final int imageHeight;
    private final List<MarkerRole> pinOrder;
    private final Map<MarkerRole, List<ExportPoint>> series;

    public CornerPinTrack(ExportPointType pointType, int firstFrame, int lastFrame, int imageWidth, int imageHeight,
                          List<MarkerRole> pinOrder, Map<MarkerRole, List<ExportPoint>> series) {
        this.pointType = pointType;
        this.firstFrame = firstFrame;
        this.lastFrame = lastFrame;
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
        this.pinOrder = List.copyOf(pinOrder);
        Map<MarkerRole, List<ExportPoint>> copy = new EnumMap<>(MarkerRole.class);
        for (Map.Entry<MarkerRole, List<ExportPoint>> e : series.entrySet()) {
            copy.put(e.getKey(), List.copyOf(e.getValue()));
        }
        this.series = Collections.unmodifiableMap(copy);
    }

    public ExportPointType getPointType() {
        return pointType;
    }

    public int getFirstFrame() {
        return firstFrame;
    }

    public int getLastFrame() {
        return lastFrame;
    }

    public int getFrameCount() {
        return Math.toIntExact((long) lastFrame - firstFrame + 1);
    }

    public int getImageWidth() {
        return imageWidth;
    }

    public int getImageHeight() {
        return imageHeight;
    }

    /** 输出顺序：第 i 个元素对应 to{i+1} */
    public List<MarkerRole> getPinOrder() {
        return pinOrder;
    }

    public Map<MarkerRole, List<ExportPoint>> getSeries() {
        return series;
    }

    public List<ExportPoint> getSeries(MarkerRole role) {
        List<ExportPoint> points = series.get(role);
        return points == null ? Collections.emptyList() : points;
    }

    public ExportPoint getPoint(MarkerRole role, int frameIndex) {
        if (frameIndex < firstFrame || frameIndex > lastFrame) {
            throw new IndexOutOfBoundsException("Frame " + frameIndex + " outside " + firstFrame + ".." + lastFrame);
        }
        return getSeries(role).get(frameIndex - firstFrame);
    }

    /**
     * 某角色中指定状态的帧号
     */
    public List<Integer> framesWithStatus(MarkerRole role, ExportPoint.FillStatus status) {
        List<Integer> frames = new ArrayList<>();
        for (ExportPoint p : getSeries(role)) {
            if (p.getStatus() == status) {
                frames.add(p.getFrameIndex());
            }
        }
        return frames;
    }

    public int count(ExportPoint.FillStatus status) {
        int count = 0;
        for (List<ExportPoint> points : series.values()) {
            for (ExportPoint p : points) {
                if (p.getStatus() == status) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * 消费方坐标系下的源矩形角点（整幅图像），与 pin 角色对应
     */
    public Point sourceCorner(MarkerRole role) {
        switch (role) {
            case BOTTOM_LEFT:
                return new Point(0, 0);
            case BOTTOM_RIGHT:
                return new Point(imageWidth, 0);
            case TOP_RIGHT:
                return new Point(imageWidth, imageHeight);
            default:
                return new Point(0, imageHeight);
        }
    }
}

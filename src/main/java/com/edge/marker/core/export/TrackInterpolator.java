package com.edge.marker.core.export;

import com.edge.marker.core.model.FrameRecord;
import com.edge.marker.core.model.MarkerObservation;
import com.edge.marker.core.model.MarkerRole;
import com.edge.marker.core.model.Point;
import com.edge.marker.core.store.DataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 跨帧轨迹补全
 * <p>
 * 对每个角色按帧号遍历：
 * - 有观测：直接输出
 * - 缺失且前后都有观测：按帧号在 X/Y 上分别线性插值
 * - 序列首尾缺失：取最近的观测值（不外推），标记为 CLAMPED
 * <p>
 * 输出覆盖整个帧号区间，并把像素坐标（原点左上，Y 向下）翻转为
 * 消费方坐标（原点左下，Y 向上）：y' = imageHeight - y。
 */
public class TrackInterpolator {
    private static final Logger logger = LoggerFactory.getLogger(TrackInterpolator.class);

    /** 默认输出顺序：to1←ID3, to2←ID2, to3←ID1, to4←ID0 */
    public static final List<MarkerRole> DEFAULT_PIN_ORDER = List.of(
        MarkerRole.BOTTOM_LEFT, MarkerRole.BOTTOM_RIGHT, MarkerRole.TOP_RIGHT, MarkerRole.TOP_LEFT);

    public CornerPinTrack build(DataStore store, ExportPointType pointType) {
        return build(store, pointType, DEFAULT_PIN_ORDER);
    }

    public CornerPinTrack build(DataStore store, ExportPointType pointType, List<MarkerRole> pinOrder) {
        if (store.isEmpty()) {
            throw new IllegalStateException("No data to export");
        }
        return build(store, pointType, pinOrder, store.getFirstFrame(), store.getLastFrame());
    }

    /**
     * 生成指定帧区间的轨迹，插值锚点可以来自区间外的观测
     * <p>
     * 区间先与数据表的帧号范围取交集，没有交集时抛出 {@link IllegalArgumentException}
     *
     * @param store      已完成检测的数据表
     * @param pointType  导出点类型
     * @param pinOrder   输出顺序（4 个不重复的角色）
     * @param fromFrame  起始帧（含）
     * @param toFrame    结束帧（含）
     */
    public CornerPinTrack build(DataStore store, ExportPointType pointType, List<MarkerRole> pinOrder,
                                int fromFrame, int toFrame) {
        if (store.isEmpty()) {
            throw new IllegalStateException("No data to export");
        }
        if (pointType == null) {
            throw new IllegalArgumentException("Point type cannot be null");
        }
        if (pinOrder.size() != MarkerRole.values().length || new HashSet<>(pinOrder).size() != pinOrder.size()) {
            throw new IllegalArgumentException("Pin order must list each of the 4 roles once: " + pinOrder);
        }
        if (fromFrame > toFrame) {
            throw new IllegalArgumentException("Invalid frame range " + fromFrame + ".." + toFrame);
        }
        int firstStored = store.getFirstFrame();
        int lastStored = store.getLastFrame();
        if (toFrame < firstStored || fromFrame > lastStored) {
            throw new IllegalArgumentException("Frame range " + fromFrame + ".." + toFrame
                + " does not overlap stored frames " + firstStored + ".." + lastStored);
        }
        if (fromFrame < firstStored || toFrame > lastStored) {
            logger.info("Frame range {}..{} narrowed to stored frames {}..{}",
                fromFrame, toFrame, Math.max(fromFrame, firstStored), Math.min(toFrame, lastStored));
            fromFrame = Math.max(fromFrame, firstStored);
            toFrame = Math.min(toFrame, lastStored);
        }
        int imageHeight = store.getImageHeight();
        if (imageHeight <= 0) {
            throw new IllegalStateException("Image size unknown, cannot convert coordinates");
        }

        Map<MarkerRole, List<ExportPoint>> series = new EnumMap<>(MarkerRole.class);
        for (MarkerRole role : pinOrder) {
            NavigableMap<Integer, Point> observed = collect(store, role, pointType);
            if (observed.isEmpty()) {
                throw new IllegalStateException("Marker ID" + role.getMarkerId() + " (" + role
                    + ") was never detected, cannot build track");
            }
            series.put(role, fill(role, observed, fromFrame, toFrame, imageHeight));
        }

        CornerPinTrack track = new CornerPinTrack(pointType, fromFrame, toFrame, store.getImageWidth(), imageHeight,
            pinOrder, series);
        logger.info("Track built: type={}, frames={}..{}, interpolated={}, clamped={}",
            pointType, fromFrame, toFrame,
            track.count(ExportPoint.FillStatus.INTERPOLATED), track.count(ExportPoint.FillStatus.CLAMPED));
        return track;
    }

    /**
     * 收集某角色所有观测帧的像素坐标
     */
    NavigableMap<Integer, Point> collect(DataStore store, MarkerRole role, ExportPointType pointType) {
        NavigableMap<Integer, Point> observed = new TreeMap<>();
        for (FrameRecord record : store.getRecords()) {
            Optional<MarkerObservation> obs = record.get(role);
            obs.ifPresent(o -> observed.put(record.getFrameIndex(), select(o, role, pointType)));
        }
        return observed;
    }

    /**
     * 按导出类型选取标记上的点
     */
    static Point select(MarkerObservation obs, MarkerRole role, ExportPointType pointType) {
        switch (pointType) {
            case OUTER:
                return obs.getCorners().get(role.getOuterCorner());
            case INNER:
                return obs.getCorners().get(role.getInnerCorner());
            default:
                return obs.getCenter();
        }
    }

    private List<ExportPoint> fill(MarkerRole role, NavigableMap<Integer, Point> observed,
                                   int fromFrame, int toFrame, int imageHeight) {
        long span = (long) toFrame - fromFrame + 1;
        List<ExportPoint> points = new ArrayList<>((int) Math.min(span, observed.size() * 2L + 16));
        for (long f = fromFrame; f <= toFrame; f++) {
            int frame = (int) f;
            Point exact = observed.get(frame);
            if (exact != null) {
                points.add(new ExportPoint(frame, role, flip(exact, imageHeight), ExportPoint.FillStatus.OBSERVED));
                continue;
            }
            Map.Entry<Integer, Point> before = observed.lowerEntry(frame);
            Map.Entry<Integer, Point> after = observed.higherEntry(frame);
            if (before != null && after != null) {
                double t = (double) (frame - before.getKey()) / (after.getKey() - before.getKey());
                Point p = before.getValue().interpolate(after.getValue(), t);
                points.add(new ExportPoint(frame, role, flip(p, imageHeight), ExportPoint.FillStatus.INTERPOLATED));
            } else {
                Point nearest = before != null ? before.getValue() : after.getValue();
                points.add(new ExportPoint(frame, role, flip(nearest, imageHeight), ExportPoint.FillStatus.CLAMPED));
            }
        }
        return points;
    }

    static Point flip(Point p, int imageHeight) {
        return new Point(p.x, imageHeight - p.y);
    }
}

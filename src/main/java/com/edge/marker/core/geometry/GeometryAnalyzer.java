package com.edge.marker.core.geometry;

import com.edge.marker.core.model.FrameRecord;
import com.edge.marker.core.model.MarkerObservation;
import com.edge.marker.core.model.MarkerRole;
import com.edge.marker.core.model.Point;
import com.edge.marker.core.store.DataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 四标记矩形几何分析
 * <p>
 * 仅对四个角色都存在的帧计算：
 * 1. 外角长宽比：每个标记离矩形中心最远的角点组成的矩形
 * 2. 内角长宽比：每个标记离矩形中心最近的角点组成的矩形
 * 3. 平均长宽比：两者的算术平均
 * 4. 相对中心：TL↔BR 与 TR↔BL 两条中心连线的交点
 * <p>
 * 不完整的帧返回 unavailable，不做部分估算。
 */
public class GeometryAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(GeometryAnalyzer.class);

    private static final double EPSILON = 1e-9;

    /**
     * 分析数据表中的某一帧
     */
    public GeometryResult analyze(DataStore store, int frameIndex) {
        Optional<FrameRecord> record = store.get(frameIndex);
        if (record.isEmpty()) {
            return GeometryResult.unavailable(frameIndex, "no record for frame");
        }
        return analyze(record.get());
    }

    /**
     * 分析单帧记录
     */
    public GeometryResult analyze(FrameRecord record) {
        int frameIndex = record.getFrameIndex();

        Map<MarkerRole, MarkerObservation> byRole = new EnumMap<>(MarkerRole.class);
        List<MarkerRole> missing = new ArrayList<>();
        for (MarkerRole role : MarkerRole.values()) {
            Optional<MarkerObservation> obs = record.get(role);
            if (obs.isPresent()) {
                byRole.put(role, obs.get());
            } else {
                missing.add(role);
            }
        }
        if (!missing.isEmpty()) {
            return GeometryResult.unavailable(frameIndex, "missing markers " + missing);
        }

        Map<MarkerRole, Point> centers = new EnumMap<>(MarkerRole.class);
        for (Map.Entry<MarkerRole, MarkerObservation> e : byRole.entrySet()) {
            centers.put(e.getKey(), e.getValue().getCenter());
        }
        Point centroid = Point.centroid(centers.values().toArray(new Point[0]));

        Map<MarkerRole, Point> outer = new EnumMap<>(MarkerRole.class);
        Map<MarkerRole, Point> inner = new EnumMap<>(MarkerRole.class);
        for (Map.Entry<MarkerRole, MarkerObservation> e : byRole.entrySet()) {
            outer.put(e.getKey(), e.getValue().getCorners().farthestFrom(centroid));
            inner.put(e.getKey(), e.getValue().getCorners().nearestTo(centroid));
        }

        double outerRatio = aspectRatio(outer);
        double innerRatio = aspectRatio(inner);
        if (Double.isNaN(outerRatio) || Double.isNaN(innerRatio)) {
            return GeometryResult.unavailable(frameIndex, "degenerate rectangle");
        }

        Point relativeCenter = intersect(
            centers.get(MarkerRole.TOP_LEFT), centers.get(MarkerRole.BOTTOM_RIGHT),
            centers.get(MarkerRole.TOP_RIGHT), centers.get(MarkerRole.BOTTOM_LEFT));
        if (relativeCenter == null) {
            return GeometryResult.unavailable(frameIndex, "diagonals are parallel");
        }
        if (!insideBounds(relativeCenter, centers.values())) {
            logger.warn("Frame {}: relative center {} is outside marker bounding box", frameIndex, relativeCenter);
        }

        return GeometryResult.of(frameIndex, outerRatio, innerRatio, relativeCenter, centroid);
    }

    /**
     * 分析所有帧
     */
    public List<GeometryResult> analyzeAll(DataStore store) {
        List<GeometryResult> results = new ArrayList<>();
        for (FrameRecord record : store.getRecords()) {
            results.add(analyze(record));
        }
        return results;
    }

    /**
     * 统计可用帧的平均长宽比
     */
    public GeometrySummary summarize(List<GeometryResult> results) {
        GeometrySummary summary = new GeometrySummary();
        summary.setTotalFrames(results.size());

        double sum = 0, sumSq = 0, min = Double.NaN, max = Double.NaN, maxDeviation = 0;
        int n = 0;
        for (GeometryResult r : results) {
            if (!r.isAvailable()) {
                continue;
            }
            double v = r.getAverageAspectRatio();
            sum += v;
            sumSq += v * v;
            min = n == 0 ? v : Math.min(min, v);
            max = n == 0 ? v : Math.max(max, v);
            maxDeviation = Math.max(maxDeviation, r.getCenterDeviation());
            n++;
        }
        summary.setAvailableFrames(n);
        if (n == 0) {
            summary.setMeanAspectRatio(Double.NaN);
            summary.setMinAspectRatio(Double.NaN);
            summary.setMaxAspectRatio(Double.NaN);
            summary.setStdDevAspectRatio(Double.NaN);
            summary.setMaxCenterDeviation(Double.NaN);
            return summary;
        }
        double mean = sum / n;
        summary.setMeanAspectRatio(mean);
        summary.setMinAspectRatio(min);
        summary.setMaxAspectRatio(max);
        summary.setStdDevAspectRatio(Math.sqrt(Math.max(0, sumSq / n - mean * mean)));
        summary.setMaxCenterDeviation(maxDeviation);
        return summary;
    }

    /**
     * 长边/短边，边长取对边平均
     */
    static double aspectRatio(Map<MarkerRole, Point> pts) {
        Point tl = pts.get(MarkerRole.TOP_LEFT);
        Point tr = pts.get(MarkerRole.TOP_RIGHT);
        Point br = pts.get(MarkerRole.BOTTOM_RIGHT);
        Point bl = pts.get(MarkerRole.BOTTOM_LEFT);

        double width = (tl.distanceTo(tr) + bl.distanceTo(br)) / 2.0;
        double height = (tl.distanceTo(bl) + tr.distanceTo(br)) / 2.0;
        double shortSide = Math.min(width, height);
        if (shortSide < EPSILON) {
            return Double.NaN;
        }
        return Math.max(width, height) / shortSide;
    }

    /**
     * 直线 p1p2 与 p3p4 的交点，平行时返回 null
     */
    static Point intersect(Point p1, Point p2, Point p3, Point p4) {
        double denominator = (p1.x - p2.x) * (p3.y - p4.y) - (p1.y - p2.y) * (p3.x - p4.x);
        if (Math.abs(denominator) < EPSILON) {
            return null;
        }
        double a = p1.x * p2.y - p1.y * p2.x;
        double b = p3.x * p4.y - p3.y * p4.x;
        double x = (a * (p3.x - p4.x) - (p1.x - p2.x) * b) / denominator;
        double y = (a * (p3.y - p4.y) - (p1.y - p2.y) * b) / denominator;
        return new Point(x, y);
    }

    private static boolean insideBounds(Point p, Iterable<Point> points) {
        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (Point q : points) {
            minX = Math.min(minX, q.x);
            minY = Math.min(minY, q.y);
            maxX = Math.max(maxX, q.x);
            maxY = Math.max(maxY, q.y);
        }
        return p.x >= minX && p.x <= maxX && p.y >= minY && p.y <= maxY;
    }
}

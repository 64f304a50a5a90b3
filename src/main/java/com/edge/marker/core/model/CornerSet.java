package com.edge.marker.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 单个标记的四个角点
 * <p>
 * 顺序与检测器输出的绕序一致，所有标记的 corner 0 指同一几何角。
 */
public final class CornerSet {
    public static final int SIZE = 4;

    private final Point[] corners;

    @JsonCreator
    public CornerSet(@JsonProperty("corners") List<Point> corners) {
        this(corners.toArray(new Point[0]));
    }

    public CornerSet(Point... corners) {
        if (corners == null || corners.length != SIZE) {
            throw new IllegalArgumentException("A marker needs exactly 4 corners, got "
                + (corners == null ? 0 : corners.length));
        }
        for (Point p : corners) {
            if (p == null || Double.isNaN(p.x) || Double.isNaN(p.y)) {
                throw new IllegalArgumentException("Corner coordinates must be defined");
            }
        }
        this.corners = corners.clone();
    }

    /**
     * 由 [x0, y0, x1, y1, ...] 形式的数组构造（OpenCV 角点 Mat 的存储格式）
     */
    public static CornerSet fromXy(float[] xy) {
        if (xy.length < SIZE * 2) {
            throw new IllegalArgumentException("Expected 8 values, got " + xy.length);
        }
        Point[] pts = new Point[SIZE];
        for (int i = 0; i < SIZE; i++) {
            pts[i] = new Point(xy[i * 2], xy[i * 2 + 1]);
        }
        return new CornerSet(pts);
    }

    public Point get(int index) {
        return corners[index];
    }

    public List<Point> getCorners() {
        return Collections.unmodifiableList(Arrays.asList(corners));
    }

    /**
     * 中心点（4个角点的平均值）
     */
    @JsonIgnore
    public Point center() {
        return Point.centroid(corners);
    }

    /**
     * 朝向角（度），corner 0 → corner 1 向量的 atan2
     */
    @JsonIgnore
    public double angle() {
        double dx = corners[1].x - corners[0].x;
        double dy = corners[1].y - corners[0].y;
        return Math.toDegrees(Math.atan2(dy, dx));
    }

    /**
     * 包围面积（鞋带公式）
     */
    @JsonIgnore
    public double area() {
        double sum = 0;
        for (int i = 0; i < SIZE; i++) {
            Point a = corners[i];
            Point b = corners[(i + 1) % SIZE];
            sum += a.x * b.y - b.x * a.y;
        }
        return Math.abs(sum) / 2.0;
    }

    @JsonIgnore
    public double perimeter() {
        double sum = 0;
        for (int i = 0; i < SIZE; i++) {
            sum += corners[i].distanceTo(corners[(i + 1) % SIZE]);
        }
        return sum;
    }

    /**
     * 离参考点最远的角点
     */
    public Point farthestFrom(Point ref) {
        Point best = corners[0];
        for (int i = 1; i < SIZE; i++) {
            if (corners[i].distanceTo(ref) > best.distanceTo(ref)) {
                best = corners[i];
            }
        }
        return best;
    }

    /**
     * 离参考点最近的角点
     */
    public Point nearestTo(Point ref) {
        Point best = corners[0];
        for (int i = 1; i < SIZE; i++) {
            if (corners[i].distanceTo(ref) < best.distanceTo(ref)) {
                best = corners[i];
            }
        }
        return best;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CornerSet)) return false;
        return Arrays.equals(corners, ((CornerSet) o).corners);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(corners);
    }

    @Override
    public String toString() {
        return Arrays.toString(corners);
    }
}

package com.edge.marker.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PointTest {

    @Test
    void interpolatesEachAxisIndependently() {
        Point a = new Point(0, 100);
        Point b = new Point(10, 200);

        assertThat(a.interpolate(b, 0)).isEqualTo(a);
        assertThat(a.interpolate(b, 1)).isEqualTo(b);
        assertThat(a.interpolate(b, 0.5)).isEqualTo(new Point(5, 150));
    }

    @Test
    void distance() {
        assertThat(new Point(0, 0).distanceTo(new Point(3, 4))).isEqualTo(5.0);
    }

    @Test
    void centroid() {
        Point c = Point.centroid(new Point(0, 0), new Point(4, 0), new Point(4, 2), new Point(0, 2));

        assertThat(c).isEqualTo(new Point(2, 1));
        assertThatThrownBy(() -> Point.centroid()).isInstanceOf(IllegalArgumentException.class);
    }
}

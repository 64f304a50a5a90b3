package com.edge.marker.core.export;

import com.edge.marker.core.MarkerFixtures;
import com.edge.marker.core.geometry.GeometryAnalyzer;
import com.edge.marker.core.geometry.GeometryResult;
import com.edge.marker.core.model.FrameRecord;
import com.edge.marker.core.model.MarkerRole;
import com.edge.marker.core.model.Point;
import com.edge.marker.core.store.DataStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackInterpolatorTest {

    private final TrackInterpolator interpolator = new TrackInterpolator();
    private DataStore store;

    /**
     * 帧 1..10，1920x1080：
     * ID1（右上）中心 x = 1000 + 10 * frame，帧 5 缺失；
     * ID3（左下）帧 1、2 缺失
     */
    static DataStore tenFrames() {
        DataStore store = new DataStore(4);
        for (int frame = 1; frame <= 10; frame++) {
            FrameRecord record = new FrameRecord(frame, 1920, 1080);
            record.put(MarkerFixtures.observation(0, new Point(100, 100)));
            if (frame != 5) {
                record.put(MarkerFixtures.observation(1, new Point(1000 + 10 * frame, 200)));
            }
            record.put(MarkerFixtures.observation(2, new Point(1100, 300)));
            if (frame > 2) {
                record.put(MarkerFixtures.observation(3, new Point(100, 300)));
            }
            store.put(record);
        }
        store.seal();
        return store;
    }

    @BeforeEach
    void setUp() {
        store = tenFrames();
    }

    @Test
    void everyFrameHasAValue() {
        CornerPinTrack track = interpolator.build(store, ExportPointType.CENTER);

        assertThat(track.getFirstFrame()).isEqualTo(1);
        assertThat(track.getLastFrame()).isEqualTo(10);
        for (MarkerRole role : MarkerRole.values()) {
            assertThat(track.getSeries(role)).hasSize(10);
        }
    }

    @Test
    void gapIsLinearlyInterpolatedAndFlipped() {
        CornerPinTrack track = interpolator.build(store, ExportPointType.CENTER);

        ExportPoint gap = track.getPoint(MarkerRole.TOP_RIGHT, 5);
        assertThat(gap.getStatus()).isEqualTo(ExportPoint.FillStatus.INTERPOLATED);
        assertThat(gap.getPoint()).isEqualTo(new Point(1050, 1080 - 200));

        ExportPoint observed = track.getPoint(MarkerRole.TOP_RIGHT, 4);
        assertThat(observed.getStatus()).isEqualTo(ExportPoint.FillStatus.OBSERVED);
        assertThat(observed.getPoint()).isEqualTo(new Point(1040, 880));
        assertThat(track.framesWithStatus(MarkerRole.TOP_RIGHT, ExportPoint.FillStatus.INTERPOLATED))
            .containsExactly(5);
    }

    @Test
    void leadingGapIsClampedToFirstObservation() {
        CornerPinTrack track = interpolator.build(store, ExportPointType.CENTER);

        Point first = track.getPoint(MarkerRole.BOTTOM_LEFT, 3).getPoint();
        assertThat(track.getPoint(MarkerRole.BOTTOM_LEFT, 1).getPoint()).isEqualTo(first);
        assertThat(track.getPoint(MarkerRole.BOTTOM_LEFT, 2).getPoint()).isEqualTo(first);
        assertThat(track.framesWithStatus(MarkerRole.BOTTOM_LEFT, ExportPoint.FillStatus.CLAMPED))
            .containsExactly(1, 2);
        assertThat(track.count(ExportPoint.FillStatus.CLAMPED)).isEqualTo(2);
        assertThat(track.count(ExportPoint.FillStatus.INTERPOLATED)).isEqualTo(1);
    }

    @Test
    void outerAndInnerUseRoleCorners() {
        CornerPinTrack outer = interpolator.build(store, ExportPointType.OUTER);
        CornerPinTrack inner = interpolator.build(store, ExportPointType.INNER);

        // 右上标记：外角 = 右上角点，内角 = 左下角点
        assertThat(outer.getPoint(MarkerRole.TOP_RIGHT, 4).getPoint()).isEqualTo(new Point(1060, 1080 - 180));
        assertThat(inner.getPoint(MarkerRole.TOP_RIGHT, 4).getPoint()).isEqualTo(new Point(1020, 1080 - 220));
        // 左上标记：外角 = 左上角点
        assertThat(outer.getPoint(MarkerRole.TOP_LEFT, 1).getPoint()).isEqualTo(new Point(80, 1080 - 80));
    }

    @Test
    void staticRectangleWithMissingTopRight() {
        DataStore s = new DataStore(4);
        for (int frame = 1; frame <= 10; frame++) {
            s.put(frame == 5 ? MarkerFixtures.record(frame, 0, 2, 3) : MarkerFixtures.record(frame, 0, 1, 2, 3));
        }
        s.seal();
        GeometryAnalyzer analyzer = new GeometryAnalyzer();

        CornerPinTrack track = interpolator.build(s, ExportPointType.OUTER);

        ExportPoint filled = track.getPoint(MarkerRole.TOP_RIGHT, 5);
        assertThat(filled.getStatus()).isEqualTo(ExportPoint.FillStatus.INTERPOLATED);
        assertThat(filled.getPoint()).isEqualTo(track.getPoint(MarkerRole.TOP_RIGHT, 4).getPoint());
        assertThat(filled.getPoint()).isEqualTo(track.getPoint(MarkerRole.TOP_RIGHT, 6).getPoint());

        double ratio = analyzer.analyze(s, 1).getAverageAspectRatio();
        for (GeometryResult result : analyzer.analyzeAll(s)) {
            if (result.getFrameIndex() == 5) {
                assertThat(result.isAvailable()).isFalse();
            } else {
                assertThat(result.getAverageAspectRatio()).isEqualTo(ratio);
            }
        }
    }

    @Test
    void subRangeStillUsesAnchorsOutsideRange() {
        CornerPinTrack track = interpolator.build(store, ExportPointType.CENTER,
            TrackInterpolator.DEFAULT_PIN_ORDER, 5, 5);

        assertThat(track.getFrameCount()).isEqualTo(1);
        assertThat(track.getPoint(MarkerRole.TOP_RIGHT, 5).getStatus())
            .isEqualTo(ExportPoint.FillStatus.INTERPOLATED);
    }

    @Test
    void rangeBeyondStoredFramesIsNarrowed() {
        CornerPinTrack track = interpolator.build(store, ExportPointType.CENTER,
            TrackInterpolator.DEFAULT_PIN_ORDER, -5, 1000);

        assertThat(track.getFirstFrame()).isEqualTo(1);
        assertThat(track.getLastFrame()).isEqualTo(10);
        assertThat(track.getFrameCount()).isEqualTo(10);
        assertThat(track.count(ExportPoint.FillStatus.CLAMPED)).isEqualTo(2);
    }

    @Test
    void hugeRangeIsNarrowedWithoutOverflow() {
        CornerPinTrack track = interpolator.build(store, ExportPointType.CENTER,
            TrackInterpolator.DEFAULT_PIN_ORDER, Integer.MIN_VALUE, Integer.MAX_VALUE);

        assertThat(track.getFrameCount()).isEqualTo(10);
        assertThat(track.getSeries(MarkerRole.TOP_LEFT)).hasSize(10);
    }

    @Test
    void rangeWithoutStoredFramesFails() {
        assertThatThrownBy(() -> interpolator.build(store, ExportPointType.CENTER,
            TrackInterpolator.DEFAULT_PIN_ORDER, 11, 20))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not overlap");
        assertThatThrownBy(() -> interpolator.build(store, ExportPointType.CENTER,
            TrackInterpolator.DEFAULT_PIN_ORDER, Integer.MIN_VALUE, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void trailingGapIsClampedToLastObservation() {
        DataStore s = new DataStore(4);
        for (int frame = 1; frame <= 4; frame++) {
            s.put(MarkerFixtures.record(frame, frame <= 2 ? new int[]{0, 1, 2, 3} : new int[]{0, 1, 2}));
        }

        CornerPinTrack track = interpolator.build(s, ExportPointType.CENTER);

        assertThat(track.framesWithStatus(MarkerRole.BOTTOM_LEFT, ExportPoint.FillStatus.CLAMPED))
            .containsExactly(3, 4);
        assertThat(track.getPoint(MarkerRole.BOTTOM_LEFT, 4).getPoint())
            .isEqualTo(track.getPoint(MarkerRole.BOTTOM_LEFT, 2).getPoint());
    }

    @Test
    void neverObservedRoleFails() {
        DataStore s = new DataStore(4);
        s.put(MarkerFixtures.record(1, 0, 1, 2));
        s.put(MarkerFixtures.record(2, 0, 1, 2));

        assertThatThrownBy(() -> interpolator.build(s, ExportPointType.CENTER))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ID3");
    }

    @Test
    void invalidArguments() {
        assertThatThrownBy(() -> interpolator.build(new DataStore(4), ExportPointType.CENTER))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> interpolator.build(store, ExportPointType.CENTER,
            List.of(MarkerRole.TOP_LEFT, MarkerRole.TOP_LEFT, MarkerRole.TOP_RIGHT, MarkerRole.BOTTOM_LEFT)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> interpolator.build(store, ExportPointType.CENTER,
            TrackInterpolator.DEFAULT_PIN_ORDER, 8, 3))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void flipMirrorsAroundImageHeight() {
        assertThat(TrackInterpolator.flip(new Point(10, 0), 1080)).isEqualTo(new Point(10, 1080));
        assertThat(TrackInterpolator.flip(new Point(10, 1080), 1080)).isEqualTo(new Point(10, 0));
    }
}

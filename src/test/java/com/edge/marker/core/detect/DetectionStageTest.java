package com.edge.marker.core.detect;

import com.edge.marker.core.MarkerFixtures;
import com.edge.marker.core.model.Point;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 检测器由 lambda 替代，不需要真实图像
 */
class DetectionStageTest {

    @Test
    void idsOutsideExpectedRangeAreDropped() {
        List<MarkerCandidate> raw = new ArrayList<>(MarkerFixtures.candidates(0, 2));
        raw.add(MarkerFixtures.candidate(7, new Point(300, 300), 20));
        raw.add(MarkerFixtures.candidate(-1, new Point(300, 300), 20));
        DetectionStage stage = new DetectionStage((image, params) -> raw, 4);

        Map<Integer, MarkerCandidate> found = stage.run(null, DetectionParams.defaults());

        assertThat(found).containsOnlyKeys(0, 2);
    }

    @Test
    void duplicateIdKeepsLargerMarker() {
        MarkerCandidate small = MarkerFixtures.candidate(1, new Point(100, 100), 10);
        MarkerCandidate large = MarkerFixtures.candidate(1, new Point(400, 100), 25);
        DetectionStage stage = new DetectionStage((image, params) -> List.of(small, large), 4);

        Map<Integer, MarkerCandidate> found = stage.run(null, DetectionParams.defaults());

        assertThat(found).hasSize(1);
        assertThat(found.get(1)).isSameAs(large);
    }

    @Test
    void duplicateOrderDoesNotMatter() {
        MarkerCandidate small = MarkerFixtures.candidate(1, new Point(100, 100), 10);
        MarkerCandidate large = MarkerFixtures.candidate(1, new Point(400, 100), 25);
        DetectionStage stage = new DetectionStage((image, params) -> List.of(large, small), 4);

        assertThat(stage.run(null, DetectionParams.defaults()).get(1)).isSameAs(large);
    }

    @Test
    void detectorFailureCountsAsNothingFound() {
        DetectionStage stage = new DetectionStage((image, params) -> {
            throw new IllegalStateException("bad parameter combination");
        }, 4);

        assertThat(stage.run(null, DetectionParams.defaults())).isEmpty();
    }

    @Test
    void nullResultCountsAsNothingFound() {
        DetectionStage stage = new DetectionStage((image, params) -> null, 4);

        assertThat(stage.run(null, DetectionParams.defaults())).isEmpty();
    }
}

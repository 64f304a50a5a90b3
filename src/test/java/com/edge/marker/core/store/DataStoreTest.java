package com.edge.marker.core.store;

import com.edge.marker.core.MarkerFixtures;
import com.edge.marker.core.model.FrameRecord;
import com.edge.marker.core.model.Point;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataStoreTest {

    @Test
    void recordsAreOrderedByFrame() {
        DataStore store = new DataStore(4);
        store.put(MarkerFixtures.record(7, 0, 1, 2, 3));
        store.put(MarkerFixtures.record(2, 0));
        store.put(MarkerFixtures.record(5, 1, 2));

        assertThat(store.getRecords()).extracting(FrameRecord::getFrameIndex).containsExactly(2, 5, 7);
        assertThat(store.getFirstFrame()).isEqualTo(2);
        assertThat(store.getLastFrame()).isEqualTo(7);
        assertThat(store.getRecords(3, 7)).extracting(FrameRecord::getFrameIndex).containsExactly(5, 7);
        assertThat(store.getCompleteCount()).isEqualTo(1);
        assertThat(store.isComplete(7)).isTrue();
        assertThat(store.isComplete(5)).isFalse();
        assertThat(store.isComplete(6)).isFalse();
    }

    @Test
    void reprocessedFrameReplacesOldRecord() {
        DataStore store = new DataStore(4);
        store.put(MarkerFixtures.record(3, 0, 1));
        store.put(MarkerFixtures.record(3, 2));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get(3).get().getObservations()).containsOnlyKeys(2);
    }

    @Test
    void rejectsUnexpectedMarkerId() {
        DataStore store = new DataStore(2);
        FrameRecord record = MarkerFixtures.record(1, 0, 3);

        assertThatThrownBy(() -> store.put(record))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("marker id 3");
        assertThat(store.isEmpty()).isTrue();
    }

    @Test
    void sealedStoreIsReadOnly() {
        DataStore store = new DataStore(4);
        store.put(MarkerFixtures.record(1, 0));
        store.seal();

        assertThat(store.isSealed()).isTrue();
        assertThatThrownBy(() -> store.put(MarkerFixtures.record(2, 0)))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.get(1)).isPresent();
    }

    @Test
    void recordsReadFromSealedStoreCannotBeChanged() {
        DataStore store = new DataStore(4);
        store.put(MarkerFixtures.record(1, 0, 2, 3));
        store.seal();

        FrameRecord stored = store.get(1).get();
        assertThatThrownBy(() -> stored.put(MarkerFixtures.observation(1, new Point(500, 100))))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> store.getRecords().get(0).put(MarkerFixtures.observation(9, new Point(0, 0))))
            .isInstanceOf(IllegalStateException.class);
        assertThat(store.get(1).get().getObservations()).containsOnlyKeys(0, 2, 3);
        assertThat(store.isComplete(1)).isFalse();
    }

    @Test
    void laterChangesToPutRecordDoNotReachStore() {
        DataStore store = new DataStore(4);
        FrameRecord record = MarkerFixtures.record(1, 0);
        store.put(record);

        record.put(MarkerFixtures.observation(7, new Point(0, 0)));

        assertThat(store.get(1).get().getObservations()).containsOnlyKeys(0);
        assertThat(store.get(1).get().isFrozen()).isTrue();
    }

    @Test
    void mergeCombinesPartitions() {
        DataStore a = new DataStore(4);
        a.put(MarkerFixtures.record(1, 0, 1, 2, 3));
        a.put(MarkerFixtures.record(3, 0));
        DataStore b = new DataStore(4);
        b.put(MarkerFixtures.record(2, 1));
        b.put(MarkerFixtures.record(4, 2, 3));

        DataStore merged = new DataStore(4);
        merged.merge(a);
        merged.merge(b);

        assertThat(merged.getRecords()).extracting(FrameRecord::getFrameIndex).containsExactly(1, 2, 3, 4);
        assertThat(merged.get(4).get()).isEqualTo(b.get(4).get());
        assertThatThrownBy(() -> merged.merge(new DataStore(3))).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyStore() {
        DataStore store = new DataStore(4);

        assertThat(store.get(1)).isEmpty();
        assertThat(store.getImageHeight()).isZero();
        assertThatThrownBy(store::getFirstFrame).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> new DataStore(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void imageSizeComesFromRecords() {
        DataStore store = new DataStore(4);
        FrameRecord record = new FrameRecord(1, 1280, 720);
        record.put(MarkerFixtures.observation(0, new Point(10, 10)));
        store.put(record);

        assertThat(store.getImageWidth()).isEqualTo(1280);
        assertThat(store.getImageHeight()).isEqualTo(720);
    }
}

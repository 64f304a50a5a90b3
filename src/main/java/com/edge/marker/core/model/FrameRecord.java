package com.edge.marker.core.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 单帧检测记录
 * <p>
 * 每个标记 ID 最多一条观测，同一 ID 再次写入时覆盖。
 * 缺失的 ID 表示该帧未检测到此标记。
 * 写入 {@link com.edge.marker.core.store.DataStore} 的是冻结副本，冻结后不能再写入。
 */
public class FrameRecord {
    private final int frameIndex;
    private final int imageWidth;
    private final int imageHeight;
    private final Map<Integer, MarkerObservation> observations = new TreeMap<>();
    private boolean frozen;

    public FrameRecord(int frameIndex, int imageWidth, int imageHeight) {
        this.frameIndex = frameIndex;
        this.imageWidth = imageWidth;
        this.imageHeight = imageHeight;
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    public int getImageWidth() {
        return imageWidth;
    }

    public int getImageHeight() {
        return imageHeight;
    }

    /**
     * 写入观测，已存在同 ID 时覆盖
     */
    public void put(MarkerObservation observation) {
        if (frozen) {
            throw new IllegalStateException("Frame " + frameIndex + " is frozen, marker ID"
                + observation.getMarkerId() + " rejected");
        }
        if (observation.getMarkerId() < 0) {
            throw new IllegalArgumentException("Negative marker id " + observation.getMarkerId()
                + " in frame " + frameIndex);
        }
        observations.put(observation.getMarkerId(), observation);
    }

    /**
     * 只读副本
     */
    public FrameRecord frozenCopy() {
        FrameRecord copy = new FrameRecord(frameIndex, imageWidth, imageHeight);
        copy.observations.putAll(observations);
        copy.frozen = true;
        return copy;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean has(int markerId) {
        return observations.containsKey(markerId);
    }

    public Optional<MarkerObservation> get(int markerId) {
        return Optional.ofNullable(observations.get(markerId));
    }

    public Optional<MarkerObservation> get(MarkerRole role) {
        return get(role.getMarkerId());
    }

    public Map<Integer, MarkerObservation> getObservations() {
        return Collections.unmodifiableMap(observations);
    }

    public int size() {
        return observations.size();
    }

    public boolean isComplete(int expectedMarkers) {
        for (int id = 0; id < expectedMarkers; id++) {
            if (!observations.containsKey(id)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrameRecord)) return false;
        FrameRecord that = (FrameRecord) o;
        return frameIndex == that.frameIndex
            && imageWidth == that.imageWidth
            && imageHeight == that.imageHeight
            && observations.equals(that.observations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frameIndex, imageWidth, imageHeight, observations);
    }

    @Override
    public String toString() {
        return "FrameRecord{frame=" + frameIndex + ", markers=" + observations.keySet() + "}";
    }
}

package com.edge.marker.core.store;

import com.edge.marker.core.model.FrameRecord;
import com.edge.marker.core.model.MarkerObservation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 按帧号排序的检测记录表，几何分析与导出的唯一数据来源
 * <p>
 * 只增不删；同一帧重复写入时整条覆盖。
 * 写入时保存记录的冻结副本，调用方之后对原记录的修改不影响数据表，取出的记录也不能修改。
 * 检测阶段由单个写入方填充，{@link #seal()} 之后只读，供几何分析和导出并发读取。
 * 非线程安全：并行检测时每个工作线程写入自己的分区，结束后 {@link #merge(DataStore)}。
 */
public class DataStore {
    private final int expectedMarkers;
    private final NavigableMap<Integer, FrameRecord> records = new TreeMap<>();
    private volatile boolean sealed;

    public DataStore(int expectedMarkers) {
        if (expectedMarkers <= 0) {
            throw new IllegalArgumentException("expectedMarkers must be positive: " + expectedMarkers);
        }
        this.expectedMarkers = expectedMarkers;
    }

    public int getExpectedMarkers() {
        return expectedMarkers;
    }

    /**
     * 写入一帧记录，已存在时覆盖
     */
    public void put(FrameRecord record) {
        if (sealed) {
            throw new IllegalStateException("DataStore is sealed, frame " + record.getFrameIndex() + " rejected");
        }
        for (MarkerObservation obs : record.getObservations().values()) {
            if (obs.getMarkerId() < 0 || obs.getMarkerId() >= expectedMarkers) {
                throw new IllegalArgumentException("Unexpected marker id " + obs.getMarkerId()
                    + " in frame " + record.getFrameIndex());
            }
        }
        records.put(record.getFrameIndex(), record.isFrozen() ? record : record.frozenCopy());
    }

    /**
     * 合并另一个分区（帧号冲突时以 other 为准）
     */
    public void merge(DataStore other) {
        if (other.expectedMarkers != expectedMarkers) {
            throw new IllegalArgumentException("Cannot merge stores with different expected markers: "
                + expectedMarkers + " vs " + other.expectedMarkers);
        }
        for (FrameRecord record : other.records.values()) {
            put(record);
        }
    }

    /**
     * 标记为只读
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public Optional<FrameRecord> get(int frameIndex) {
        return Optional.ofNullable(records.get(frameIndex));
    }

    public boolean isComplete(int frameIndex) {
        FrameRecord record = records.get(frameIndex);
        return record != null && record.isComplete(expectedMarkers);
    }

    public List<FrameRecord> getRecords() {
        return Collections.unmodifiableList(new ArrayList<>(records.values()));
    }

    public List<FrameRecord> getRecords(int fromFrame, int toFrame) {
        return Collections.unmodifiableList(new ArrayList<>(records.subMap(fromFrame, true, toFrame, true).values()));
    }

    public int getFirstFrame() {
        requireNotEmpty();
        return records.firstKey();
    }

    public int getLastFrame() {
        requireNotEmpty();
        return records.lastKey();
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int getCompleteCount() {
        int count = 0;
        for (FrameRecord record : records.values()) {
            if (record.isComplete(expectedMarkers)) {
                count++;
            }
        }
        return count;
    }

    /**
     * 图像宽度（取第一条带尺寸的记录）
     */
    public int getImageWidth() {
        for (FrameRecord record : records.values()) {
            if (record.getImageWidth() > 0) {
                return record.getImageWidth();
            }
        }
        return 0;
    }

    /**
     * 图像高度（取第一条带尺寸的记录）
     */
    public int getImageHeight() {
        for (FrameRecord record : records.values()) {
            if (record.getImageHeight() > 0) {
                return record.getImageHeight();
            }
        }
        return 0;
    }

    private void requireNotEmpty() {
        if (records.isEmpty()) {
            throw new IllegalStateException("DataStore is empty");
        }
    }
}

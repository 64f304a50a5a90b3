package com.edge.marker.core.detect;

import com.edge.marker.core.model.FrameRecord;

import java.util.Collections;
import java.util.List;

/**
 * 单帧检测结果：帧记录 + 是否找齐 + 经过的阶段
 */
public class DetectionOutcome {
    private final FrameRecord record;
    private final boolean complete;
    private final List<PipelineState> visitedStates;
    private final int attempts;

    public DetectionOutcome(FrameRecord record, boolean complete, List<PipelineState> visitedStates, int attempts) {
        this.record = record;
        this.complete = complete;
        this.visitedStates = Collections.unmodifiableList(visitedStates);
        this.attempts = attempts;
    }

    public FrameRecord getRecord() {
        return record;
    }

    public boolean isComplete() {
        return complete;
    }

    /** 实际执行过的检测阶段（不含 NOT_STARTED / DONE） */
    public List<PipelineState> getVisitedStates() {
        return visitedStates;
    }

    /** 检测器调用次数 */
    public int getAttempts() {
        return attempts;
    }
}

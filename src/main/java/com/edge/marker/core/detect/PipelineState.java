package com.edge.marker.core.detect;

/**
 * 检测流水线状态
 * <p>
 * NOT_STARTED → DEFAULT_PASS → QUICK_SCAN_PASS → DETAILED_SEARCH_PASS → DONE，
 * 任一阶段找齐所有标记即直接进入 DONE。
 */
public enum PipelineState {
    NOT_STARTED,
    DEFAULT_PASS,
    QUICK_SCAN_PASS,
    DETAILED_SEARCH_PASS,
    DONE;

    /**
     * 本阶段未找齐时的下一状态
     */
    public PipelineState next() {
        switch (this) {
            case NOT_STARTED:
                return DEFAULT_PASS;
            case DEFAULT_PASS:
                return QUICK_SCAN_PASS;
            case QUICK_SCAN_PASS:
                return DETAILED_SEARCH_PASS;
            default:
                return DONE;
        }
    }
}

package com.edge.marker.core.detect;

import com.edge.marker.core.model.CornerSet;

/**
 * 检测器返回的原始候选：标记 ID + 角点
 */
public final class MarkerCandidate {
    private final int markerId;
    private final CornerSet corners;

    public MarkerCandidate(int markerId, CornerSet corners) {
        if (corners == null) {
            throw new IllegalArgumentException("corners cannot be null");
        }
        this.markerId = markerId;
        this.corners = corners;
    }

    public int getMarkerId() {
        return markerId;
    }

    public CornerSet getCorners() {
        return corners;
    }

    @Override
    public String toString() {
        return "MarkerCandidate{id=" + markerId + ", corners=" + corners + "}";
    }
}

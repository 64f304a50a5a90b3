package com.edge.marker.dto;

import com.edge.marker.core.model.FrameRecord;
import com.edge.marker.core.model.MarkerObservation;
import com.edge.marker.core.model.Point;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 单帧检测信息（用于 /frames 列表）
 */
@Data
public class FrameDetectionInfo {
    private int frameIndex;
    private boolean complete;
    private int markerCount;
    private List<MarkerInfo> markers = new ArrayList<>();

    @Data
    public static class MarkerInfo {
        private int id;
        private Point center;
        private double angle;
        private List<Point> corners;
        private String stage;
        private String params;
        private int contrastLevel;
    }

    public static FrameDetectionInfo from(FrameRecord record, int expectedMarkers) {
        FrameDetectionInfo info = new FrameDetectionInfo();
        info.frameIndex = record.getFrameIndex();
        info.complete = record.isComplete(expectedMarkers);
        info.markerCount = record.size();
        for (MarkerObservation obs : record.getObservations().values()) {
            MarkerInfo m = new MarkerInfo();
            m.id = obs.getMarkerId();
            m.center = obs.getCenter();
            m.angle = obs.getAngle();
            m.corners = obs.getCorners().getCorners();
            m.stage = obs.getStage() == null ? null : obs.getStage().name();
            m.params = obs.getParams() == null ? null : obs.getParams().toString();
            m.contrastLevel = obs.getContrastLevel();
            info.markers.add(m);
        }
        return info;
    }
}

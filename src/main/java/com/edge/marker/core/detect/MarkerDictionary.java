package com.edge.marker.core.detect;

import org.opencv.objdetect.Objdetect;

/**
 * 支持的 ArUco 预定义字典
 */
public enum MarkerDictionary {
    DICT_4X4_50(Objdetect.DICT_4X4_50),
    DICT_4X4_100(Objdetect.DICT_4X4_100),
    DICT_5X5_50(Objdetect.DICT_5X5_50),
    DICT_5X5_100(Objdetect.DICT_5X5_100),
    DICT_6X6_50(Objdetect.DICT_6X6_50),
    DICT_6X6_250(Objdetect.DICT_6X6_250),
    DICT_7X7_50(Objdetect.DICT_7X7_50),
    DICT_ARUCO_ORIGINAL(Objdetect.DICT_ARUCO_ORIGINAL);

    private final int opencvId;

    MarkerDictionary(int opencvId) {
        this.opencvId = opencvId;
    }

    public int getOpencvId() {
        return opencvId;
    }
}

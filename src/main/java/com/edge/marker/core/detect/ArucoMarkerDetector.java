package com.edge.marker.core.detect;

import com.edge.marker.core.model.CornerSet;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.opencv.objdetect.ArucoDetector;
import org.opencv.objdetect.DetectorParameters;
import org.opencv.objdetect.Dictionary;
import org.opencv.objdetect.Objdetect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 OpenCV objdetect 模块的 ArUco 检测实现
 * <p>
 * 非线程安全：字典按实例缓存，每个工作线程持有自己的实例。
 */
public class ArucoMarkerDetector implements MarkerDetector {
    private static final Logger logger = LoggerFactory.getLogger(ArucoMarkerDetector.class);

    private final Map<MarkerDictionary, Dictionary> dictionaries = new EnumMap<>(MarkerDictionary.class);

    @Override
    public List<MarkerCandidate> detect(Mat image, DetectionParams params) {
        List<MarkerCandidate> result = new ArrayList<>();

        // 准备图像（灰度）
        Mat gray;
        if (image.channels() > 1) {
            gray = new Mat();
            Imgproc.cvtColor(image, gray, Imgproc.COLOR_BGR2GRAY);
        } else {
            gray = image;
        }

        List<Mat> markerCorners = new ArrayList<>();
        Mat markerIds = new Mat();
        ArucoDetector detector = new ArucoDetector(dictionary(params.getDictionary()), toDetectorParameters(params));
        try {
            detector.detectMarkers(gray, markerCorners, markerIds);

            if (markerIds.empty()) {
                return result;
            }

            int[] idsData = new int[(int) markerIds.total()];
            markerIds.get(0, 0, idsData);

            for (int i = 0; i < idsData.length; i++) {
                Mat cornersMat = markerCorners.get(i);
                float[] cornersData = new float[(int) cornersMat.total() * cornersMat.channels()];
                cornersMat.get(0, 0, cornersData);
                result.add(new MarkerCandidate(idsData[i], CornerSet.fromXy(cornersData)));
            }
            logger.debug("ArUco: {} candidates with {}", result.size(), params);
            return result;
        } finally {
            for (Mat m : markerCorners) {
                m.release();
            }
            markerIds.release();
            if (gray != image) {
                gray.release();
            }
        }
    }

    private Dictionary dictionary(MarkerDictionary type) {
        return dictionaries.computeIfAbsent(type, t -> Objdetect.getPredefinedDictionary(t.getOpencvId()));
    }

    static DetectorParameters toDetectorParameters(DetectionParams params) {
        DetectorParameters p = new DetectorParameters();
        p.set_adaptiveThreshWinSizeMin(params.getWinSizeMin());
        p.set_adaptiveThreshWinSizeMax(params.getWinSizeMax());
        p.set_adaptiveThreshWinSizeStep(params.getWinSizeStep());
        p.set_adaptiveThreshConstant(params.getThresholdConstant());
        p.set_minMarkerPerimeterRate(params.getMinPerimeterRate());
        p.set_polygonalApproxAccuracyRate(params.getApproxAccuracyRate());
        p.set_minCornerDistanceRate(params.getMinCornerDistanceRate());
        p.set_minMarkerDistanceRate(params.getMinMarkerDistanceRate());
        return p;
    }
}

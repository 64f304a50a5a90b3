package com.edge.marker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "marker-track")
public class YamlConfig {
    private DetectionConfig detection = new DetectionConfig();
    private ExportConfig export = new ExportConfig();
    private ProcessingConfig processing = new ProcessingConfig();

    @Data
    public static class DetectionConfig {
        private int expectedMarkers = 4;
        // 精细搜索阶段尝试的字典，第一个同时用于默认阶段和快速扫描
        private List<String> dictionaries = new ArrayList<>(List.of("DICT_4X4_50"));
        private ParamsConfig baseline = new ParamsConfig();
        private ParamsConfig quickScan = ParamsConfig.quickScan();
        private DetailedConfig detailed = new DetailedConfig();
        private ContrastConfig contrast = new ContrastConfig();
        private int maxDetailedAttempts = 200;
        private int claheTileSize = 8;
    }

    @Data
    public static class ParamsConfig {
        private int winSizeMin = 3;
        private int winSizeMax = 23;
        private int winSizeStep = 10;
        private double thresholdConstant = 7;
        private double minPerimeterRate = 0.03;
        private double approxAccuracyRate = 0.03;
        private double minCornerDistanceRate = 0.05;
        private double minMarkerDistanceRate = 0.05;

        static ParamsConfig quickScan() {
            ParamsConfig p = new ParamsConfig();
            p.setWinSizeMax(33);
            p.setWinSizeStep(6);
            p.setThresholdConstant(5);
            p.setMinPerimeterRate(0.01);
            p.setApproxAccuracyRate(0.05);
            p.setMinCornerDistanceRate(0.02);
            p.setMinMarkerDistanceRate(0.02);
            return p;
        }
    }

    @Data
    public static class DetailedConfig {
        private List<Integer> windowSizes = new ArrayList<>(List.of(3, 7, 15, 23, 33));
        private List<Double> thresholdConstants = new ArrayList<>(List.of(3.0, 7.0, 11.0));
        private double minPerimeterRate = 0.01;
        private double approxAccuracyRate = 0.05;
        private double minCornerDistanceRate = 0.02;
        private double minMarkerDistanceRate = 0.02;
    }

    @Data
    public static class ContrastConfig {
        private int min = 0;
        private int max = 100;
        private int step = 25;
    }

    @Data
    public static class ExportConfig {
        private String pointType = "outer";   // center, outer, inner
        private String outputDir = "export";
        private String nodeName = "CornerPin2D1";
        // to1..to4 对应的标记 ID
        private List<Integer> pinOrder = new ArrayList<>(List.of(3, 2, 1, 0));
    }

    @Data
    public static class ProcessingConfig {
        private int workers = 1;
        private int maxFrames = 0;     // 0 表示全部
    }
}

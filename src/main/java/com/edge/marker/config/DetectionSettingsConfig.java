package com.edge.marker.config;

import com.edge.marker.core.detect.ArucoMarkerDetector;
import com.edge.marker.core.detect.ContrastEnhancer;
import com.edge.marker.core.detect.DetectionParams;
import com.edge.marker.core.detect.DetectionSettings;
import com.edge.marker.core.detect.MarkerDetector;
import com.edge.marker.core.detect.MarkerDictionary;
import com.edge.marker.core.export.CornerPinExporter;
import com.edge.marker.core.export.TrackInterpolator;
import com.edge.marker.core.geometry.GeometryAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * 检测与导出组件配置
 * <p>
 * 从 application.yml 读取配置，转换为不可变的 {@link DetectionSettings}
 */
@Configuration
public class DetectionSettingsConfig {
    private static final Logger logger = LoggerFactory.getLogger(DetectionSettingsConfig.class);

    @Autowired
    private YamlConfig yamlConfig;

    @Bean
    public DetectionSettings detectionSettings() {
        YamlConfig.DetectionConfig config = yamlConfig.getDetection();
        if (config == null) {
            logger.info("使用默认的 DetectionSettings 配置");
            return DetectionSettings.defaults();
        }
        DetectionSettings settings = toSettings(config);
        logger.info("DetectionSettings 配置: expectedMarkers={}, detailedCandidates={}, contrastLevels={}, maxDetailedAttempts={}",
            settings.getExpectedMarkers(), settings.getDetailedCandidates().size(),
            settings.getContrastLevels(), settings.getMaxDetailedAttempts());
        return settings;
    }

    /**
     * 每个工作线程通过该工厂获取独立的检测器实例
     */
    @Bean
    public Supplier<MarkerDetector> markerDetectorFactory() {
        return () -> {
            NativeLibraryLoader.loadNativeLibraries();
            return new ArucoMarkerDetector();
        };
    }

    @Bean
    public GeometryAnalyzer geometryAnalyzer() {
        return new GeometryAnalyzer();
    }

    @Bean
    public TrackInterpolator trackInterpolator() {
        return new TrackInterpolator();
    }

    @Bean
    public CornerPinExporter cornerPinExporter() {
        YamlConfig.ExportConfig export = yamlConfig.getExport();
        return new CornerPinExporter(export == null ? null : export.getNodeName());
    }

    static DetectionSettings toSettings(YamlConfig.DetectionConfig config) {
        List<MarkerDictionary> dictionaries = new ArrayList<>();
        for (String name : config.getDictionaries()) {
            dictionaries.add(parseDictionary(name));
        }
        if (dictionaries.isEmpty()) {
            dictionaries.add(MarkerDictionary.DICT_4X4_50);
        }
        MarkerDictionary primary = dictionaries.get(0);

        YamlConfig.DetailedConfig detailed = config.getDetailed();
        DetectionParams template = DetectionParams.builder()
            .minPerimeterRate(detailed.getMinPerimeterRate())
            .approxAccuracyRate(detailed.getApproxAccuracyRate())
            .minCornerDistanceRate(detailed.getMinCornerDistanceRate())
            .minMarkerDistanceRate(detailed.getMinMarkerDistanceRate())
            .build();

        YamlConfig.ContrastConfig contrast = config.getContrast();
        return DetectionSettings.builder()
            .expectedMarkers(config.getExpectedMarkers())
            .baseline(toParams(config.getBaseline(), primary))
            .quickScan(toParams(config.getQuickScan(), primary))
            .detailedCandidates(DetectionSettings.sweep(dictionaries, detailed.getWindowSizes(),
                detailed.getThresholdConstants(), template))
            .contrastLevels(ContrastEnhancer.levels(contrast.getMin(), contrast.getMax(), contrast.getStep()))
            .maxDetailedAttempts(config.getMaxDetailedAttempts())
            .claheTileSize(config.getClaheTileSize())
            .build();
    }

    static DetectionParams toParams(YamlConfig.ParamsConfig p, MarkerDictionary dictionary) {
        return DetectionParams.builder()
            .dictionary(dictionary)
            .winSizeMin(p.getWinSizeMin())
            .winSizeMax(p.getWinSizeMax())
            .winSizeStep(p.getWinSizeStep())
            .thresholdConstant(p.getThresholdConstant())
            .minPerimeterRate(p.getMinPerimeterRate())
            .approxAccuracyRate(p.getApproxAccuracyRate())
            .minCornerDistanceRate(p.getMinCornerDistanceRate())
            .minMarkerDistanceRate(p.getMinMarkerDistanceRate())
            .build();
    }

    private static MarkerDictionary parseDictionary(String name) {
        try {
            return MarkerDictionary.valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown marker dictionary: " + name, e);
        }
    }
}

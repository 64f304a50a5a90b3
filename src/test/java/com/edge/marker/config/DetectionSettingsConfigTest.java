package com.edge.marker.config;

import com.edge.marker.core.detect.DetectionParams;
import com.edge.marker.core.detect.DetectionSettings;
import com.edge.marker.core.detect.MarkerDictionary;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionSettingsConfigTest {

    @Test
    void defaultConfigMatchesDefaultSettings() {
        DetectionSettings settings = DetectionSettingsConfig.toSettings(new YamlConfig.DetectionConfig());

        assertThat(settings).isEqualTo(DetectionSettings.defaults());
        assertThat(settings.getDetailedCandidates()).hasSize(5 * 3);
        assertThat(settings.getContrastLevels()).containsExactly(0, 25, 50, 75, 100);
    }

    @Test
    void detailedCandidatesCoverEveryDictionary() {
        YamlConfig.DetectionConfig config = new YamlConfig.DetectionConfig();
        config.setDictionaries(List.of("dict_4x4_50", "DICT_5X5_100"));
        config.getDetailed().setWindowSizes(List.of(5, 9));
        config.getDetailed().setThresholdConstants(List.of(7.0));
        config.getBaseline().setThresholdConstant(9);

        DetectionSettings settings = DetectionSettingsConfig.toSettings(config);

        assertThat(settings.getDetailedCandidates()).hasSize(4);
        assertThat(settings.getDetailedCandidates()).extracting(DetectionParams::getDictionary)
            .containsExactly(MarkerDictionary.DICT_4X4_50, MarkerDictionary.DICT_4X4_50,
                MarkerDictionary.DICT_5X5_100, MarkerDictionary.DICT_5X5_100);
        DetectionParams first = settings.getDetailedCandidates().get(0);
        assertThat(first.getWinSizeMin()).isEqualTo(5);
        assertThat(first.getWinSizeMax()).isEqualTo(5);
        assertThat(settings.getBaseline().getThresholdConstant()).isEqualTo(9.0);
        assertThat(settings.getQuickScan().getDictionary()).isEqualTo(MarkerDictionary.DICT_4X4_50);
    }

    @Test
    void unknownDictionaryIsRejected() {
        YamlConfig.DetectionConfig config = new YamlConfig.DetectionConfig();
        config.setDictionaries(List.of("DICT_9X9_1"));

        assertThatThrownBy(() -> DetectionSettingsConfig.toSettings(config))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("DICT_9X9_1");
    }
}

package com.edge.marker;

import com.edge.marker.config.YamlConfig;
import com.edge.marker.core.detect.DetectionSettings;
import com.edge.marker.service.MarkerTrackingService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class MarkerTrackApplicationTest {

    @Autowired
    private YamlConfig yamlConfig;

    @Autowired
    private DetectionSettings detectionSettings;

    @Autowired
    private MarkerTrackingService trackingService;

    @Test
    void applicationYmlIsBound() {
        assertThat(yamlConfig.getDetection().getDictionaries()).containsExactly("DICT_4X4_50");
        assertThat(yamlConfig.getExport().getPinOrder()).containsExactly(3, 2, 1, 0);
        assertThat(yamlConfig.getExport().getPointType()).isEqualTo("outer");
        assertThat(yamlConfig.getProcessing().getWorkers()).isEqualTo(1);
    }

    @Test
    void shippedConfigMatchesBuiltInDefaults() {
        assertThat(detectionSettings).isEqualTo(DetectionSettings.defaults());
        assertThat(trackingService.getLastRun()).isNull();
    }
}

package com.kpisentinel.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.kpisentinel.detection.analytics.IqrDetector;
import com.kpisentinel.detection.analytics.MetricAnalysisService;
import com.kpisentinel.detection.analytics.SeasonalDecomposer;
import com.kpisentinel.detection.analytics.ZScoreDetector;
import com.kpisentinel.detection.config.DetectionProperties;
import com.kpisentinel.detection.model.Anomaly;
import com.kpisentinel.detection.model.MetricAnalysis;
import com.kpisentinel.detection.model.MetricSeries;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "detection.zscore.threshold=2.5",
        "detection.seasonal.period=5",
        "detection.batch.parallelism=2"
})
class DetectionServiceApplicationTest {

    @Autowired
    private DetectionProperties properties;

    @Autowired
    private ZScoreDetector zScoreDetector;

    @Autowired
    private IqrDetector iqrDetector;

    @Autowired
    private SeasonalDecomposer seasonalDecomposer;

    @Autowired
    private MetricAnalysisService metricAnalysisService;

    @Test
    void bindsDetectorsFromConfiguration() {
        assertThat(properties.zscore().threshold()).isEqualTo(2.5);
        assertThat(zScoreDetector.threshold()).isEqualTo(2.5);
        assertThat(iqrDetector.multiplier()).isEqualTo(1.5);
        assertThat(seasonalDecomposer.period()).isEqualTo(5);
        assertThat(properties.batch().parallelism()).isEqualTo(2);
    }

    @Test
    void scansBatchThroughWiredService() {
        Instant start = Instant.parse("2024-03-01T00:00:00Z");

        List<MetricAnalysis> results = metricAnalysisService.scanBatch(List.of(
                MetricSeries.daily("sessions", start, 50, 52, 48, 51, 49, 53, 47, 50, 100, 48, 51, 49),
                MetricSeries.daily("empty", start)
        ));

        assertThat(results).hasSize(2);
        assertThat(results.get(0).anomalies()).extracting(Anomaly::index).contains(8);
        assertThat(results.get(1).anomalies()).isEmpty();
    }
}

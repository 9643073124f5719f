package com.kpisentinel.detection.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kpisentinel.detection.analytics.SeverityBands;
import com.kpisentinel.detection.model.Anomaly;
import com.kpisentinel.detection.model.Trend;
import org.junit.jupiter.api.Test;

class DetectionPropertiesTest {

    @Test
    void missingSectionsFallBackToDefaults() {
        DetectionProperties props = DetectionProperties.defaults();

        assertThat(props.zscore().threshold()).isEqualTo(3.0);
        assertThat(props.zscore().minSamples()).isEqualTo(10);
        assertThat(props.zscore().leaveOneOutBaseline()).isFalse();
        assertThat(props.zscore().bands()).isEqualTo(SeverityBands.ZSCORE_DEFAULTS);
        assertThat(props.iqr().multiplier()).isEqualTo(1.5);
        assertThat(props.iqr().bands()).isEqualTo(SeverityBands.IQR_DEFAULTS);
        assertThat(props.seasonal().period()).isEqualTo(7);
        assertThat(props.trend().significanceThreshold()).isEqualTo(0.10);
        assertThat(props.analysis().defaultMethods()).containsExactly(Anomaly.Method.ZSCORE, Anomaly.Method.IQR);
        assertThat(props.analysis().defaultPeriods()).containsExactly(Trend.Period.WOW, Trend.Period.MOM);
        assertThat(props.batch().parallelism()).isPositive();
    }

    @Test
    void partialSeverityOverridesKeepRemainingDefaults() {
        DetectionProperties.Iqr iqr = new DetectionProperties.Iqr(2.0, 12,
                new DetectionProperties.Severity(null, null, 2.5, null));

        assertThat(iqr.bands()).isEqualTo(new SeverityBands(0.5, 1.0, 2.5, 3.0));
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> new DetectionProperties.ZScore(0d, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("threshold");
        assertThatThrownBy(() -> new DetectionProperties.Iqr(-1d, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DetectionProperties.Seasonal(1, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("period");
        assertThatThrownBy(() -> new DetectionProperties.Batch(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DetectionProperties.Severity(4.0, 3.0, null, null).toBands(SeverityBands.ZSCORE_DEFAULTS))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

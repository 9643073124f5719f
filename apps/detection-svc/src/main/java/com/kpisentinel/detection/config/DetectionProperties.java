package com.kpisentinel.detection.config;

import com.kpisentinel.detection.analytics.IqrDetector;
import com.kpisentinel.detection.analytics.SeasonalDecomposer;
import com.kpisentinel.detection.analytics.SeverityBands;
import com.kpisentinel.detection.analytics.TrendAnalyzer;
import com.kpisentinel.detection.analytics.ZScoreDetector;
import com.kpisentinel.detection.model.Anomaly;
import com.kpisentinel.detection.model.Trend;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "detection")
public record DetectionProperties(
        ZScore zscore,
        Iqr iqr,
        Seasonal seasonal,
        TrendSettings trend,
        Analysis analysis,
        Batch batch
) {

    @ConstructorBinding
    public DetectionProperties {
        // every section is optional; a missing one means built-in defaults
        if (zscore == null) zscore = new ZScore(null, null, null, null);
        if (iqr == null) iqr = new Iqr(null, null, null);
        if (seasonal == null) seasonal = new Seasonal(null, null, null);
        if (trend == null) trend = new TrendSettings(null, null);
        if (analysis == null) analysis = new Analysis(null, null);
        if (batch == null) batch = new Batch(null);
    }

    public static DetectionProperties defaults() {
        return new DetectionProperties(null, null, null, null, null, null);
    }

    public record Severity(Double low, Double medium, Double high, Double critical) {

        public SeverityBands toBands(SeverityBands defaults) {
            return new SeverityBands(
                    low != null ? low : defaults.low(),
                    medium != null ? medium : defaults.medium(),
                    high != null ? high : defaults.high(),
                    critical != null ? critical : defaults.critical()
            );
        }
    }

    public record ZScore(Double threshold, Integer minSamples, Boolean leaveOneOutBaseline, Severity severity) {
        public ZScore {
            if (threshold == null) threshold = ZScoreDetector.DEFAULT_THRESHOLD;
            if (minSamples == null) minSamples = ZScoreDetector.DEFAULT_MIN_SAMPLES;
            if (leaveOneOutBaseline == null) leaveOneOutBaseline = false;
            if (threshold <= 0) {
                throw new IllegalArgumentException("zscore threshold must be positive");
            }
            if (minSamples < 1) {
                throw new IllegalArgumentException("zscore minSamples must be at least 1");
            }
        }

        public SeverityBands bands() {
            return severity != null ? severity.toBands(SeverityBands.ZSCORE_DEFAULTS) : SeverityBands.ZSCORE_DEFAULTS;
        }
    }

    public record Iqr(Double multiplier, Integer minSamples, Severity severity) {
        public Iqr {
            if (multiplier == null) multiplier = IqrDetector.DEFAULT_MULTIPLIER;
            if (minSamples == null) minSamples = IqrDetector.DEFAULT_MIN_SAMPLES;
            if (multiplier <= 0) {
                throw new IllegalArgumentException("iqr multiplier must be positive");
            }
            if (minSamples < 1) {
                throw new IllegalArgumentException("iqr minSamples must be at least 1");
            }
        }

        public SeverityBands bands() {
            return severity != null ? severity.toBands(SeverityBands.IQR_DEFAULTS) : SeverityBands.IQR_DEFAULTS;
        }
    }

    public record Seasonal(Integer period, Double threshold, Severity severity) {
        public Seasonal {
            if (period == null) period = SeasonalDecomposer.DEFAULT_PERIOD;
            if (threshold == null) threshold = SeasonalDecomposer.DEFAULT_THRESHOLD;
            if (period < 2) {
                throw new IllegalArgumentException("seasonal period must be at least 2");
            }
            if (threshold <= 0) {
                throw new IllegalArgumentException("seasonal threshold must be positive");
            }
        }

        public SeverityBands bands() {
            return severity != null ? severity.toBands(SeverityBands.SEASONAL_DEFAULTS) : SeverityBands.SEASONAL_DEFAULTS;
        }
    }

    public record TrendSettings(Double significanceThreshold, Severity severity) {
        public TrendSettings {
            if (significanceThreshold == null) significanceThreshold = TrendAnalyzer.DEFAULT_SIGNIFICANCE_THRESHOLD;
            if (significanceThreshold < 0) {
                throw new IllegalArgumentException("trend significanceThreshold must not be negative");
            }
        }

        public SeverityBands bands() {
            return severity != null ? severity.toBands(SeverityBands.TREND_DEFAULTS) : SeverityBands.TREND_DEFAULTS;
        }
    }

    public record Analysis(List<Anomaly.Method> defaultMethods, List<Trend.Period> defaultPeriods) {
        public Analysis {
            defaultMethods = defaultMethods == null || defaultMethods.isEmpty()
                    ? List.of(Anomaly.Method.ZSCORE, Anomaly.Method.IQR)
                    : List.copyOf(defaultMethods);
            defaultPeriods = defaultPeriods == null || defaultPeriods.isEmpty()
                    ? List.of(Trend.Period.WOW, Trend.Period.MOM)
                    : List.copyOf(defaultPeriods);
        }
    }

    public record Batch(Integer parallelism) {
        public Batch {
            if (parallelism == null) parallelism = Math.max(1, Runtime.getRuntime().availableProcessors());
            if (parallelism < 1) {
                throw new IllegalArgumentException("batch parallelism must be at least 1");
            }
        }
    }
}

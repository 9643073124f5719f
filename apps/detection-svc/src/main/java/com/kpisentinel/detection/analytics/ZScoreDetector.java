package com.kpisentinel.detection.analytics;

import com.kpisentinel.detection.model.Anomaly;
import com.kpisentinel.detection.model.DescriptiveStatistics;
import com.kpisentinel.detection.model.MetricSeries;
import com.kpisentinel.detection.model.SeriesPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags points whose distance from the series mean, in population standard deviations, reaches the
 * configured threshold.
 */
public class ZScoreDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(ZScoreDetector.class);

    public static final double DEFAULT_THRESHOLD = 3.0d;
    public static final int DEFAULT_MIN_SAMPLES = 10;

    private final double threshold;
    private final int minSamples;
    private final SeverityBands severityBands;
    private final boolean leaveOneOutBaseline;

    public ZScoreDetector() {
        this(DEFAULT_THRESHOLD, DEFAULT_MIN_SAMPLES, SeverityBands.ZSCORE_DEFAULTS, false);
    }

    public ZScoreDetector(double threshold) {
        this(threshold, DEFAULT_MIN_SAMPLES, SeverityBands.ZSCORE_DEFAULTS, false);
    }

    public ZScoreDetector(double threshold, int minSamples, SeverityBands severityBands, boolean leaveOneOutBaseline) {
        if (!(threshold > 0d)) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1");
        }
        this.threshold = threshold;
        this.minSamples = minSamples;
        this.severityBands = Objects.requireNonNull(severityBands, "severityBands");
        this.leaveOneOutBaseline = leaveOneOutBaseline;
    }

    @Override
    public Anomaly.Method method() {
        return Anomaly.Method.ZSCORE;
    }

    @Override
    public List<Anomaly> detect(MetricSeries series) {
        double[] values = series.values();
        if (values.length < minSamples) {
            log.debug("Z-score: {} has {} samples, {} required", series.metricName(), values.length, minSamples);
            return List.of();
        }
        if (SeriesMath.min(values) == SeriesMath.max(values)) {
            log.debug("Z-score: {} is constant, nothing to flag", series.metricName());
            return List.of();
        }
        double mean = SeriesMath.mean(values);
        double std = SeriesMath.std(values, mean);
        if (!(std > 0d && Double.isFinite(std))) {
            log.debug("Z-score: {} has zero standard deviation, nothing to flag", series.metricName());
            return List.of();
        }

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double zScore = SeriesMath.zScore(values[i], mean, std);
            if (!Double.isFinite(zScore) || Math.abs(zScore) < threshold) {
                continue;
            }
            SeriesPoint point = series.point(i);
            anomalies.add(new Anomaly(
                    i,
                    point.pointId(),
                    point.timestamp(),
                    Anomaly.Method.ZSCORE,
                    values[i] > mean ? Anomaly.Type.SPIKE : Anomaly.Type.DROP,
                    severityBands.classify(Math.abs(zScore)),
                    calculateExpectedValue(values, i),
                    values[i],
                    zScore,
                    calculateConfidence(values, zScore)
            ));
        }
        log.debug("Z-score: {} anomalies in {} (mean={}, std={}, threshold={})",
                anomalies.size(), series.metricName(), mean, std, threshold);
        return anomalies;
    }

    /**
     * Baseline reported as the expected value of the point at {@code index}: the series mean, or
     * the mean of every other point when the detector runs with a leave-one-out baseline.
     */
    public double calculateExpectedValue(double[] values, int index) {
        Objects.checkIndex(index, values.length);
        if (!leaveOneOutBaseline || values.length == 1) {
            return SeriesMath.mean(values);
        }
        double sum = 0d;
        for (int i = 0; i < values.length; i++) {
            if (i != index) {
                sum += values[i];
            }
        }
        return sum / (values.length - 1);
    }

    /** Weighted blend of sample size (saturating at 100) and |z| (saturating at 5). */
    public double calculateConfidence(double[] values, double zScore) {
        double sampleSizeFactor = Math.min(values.length / 100.0, 1.0);
        double zScoreFactor = Math.min(Math.abs(zScore) / 5.0, 1.0);
        return SeriesMath.clamp(sampleSizeFactor * 0.3 + zScoreFactor * 0.7, 0d, 1d);
    }

    @Override
    public DescriptiveStatistics getStatistics(double[] values) {
        return SeriesMath.describe(values);
    }

    public double threshold() {
        return threshold;
    }

    public int minSamples() {
        return minSamples;
    }
}

package com.kpisentinel.detection.analytics;

import com.kpisentinel.detection.model.Anomaly;
import com.kpisentinel.detection.model.MetricSeries;
import com.kpisentinel.detection.model.QuartileStatistics;
import com.kpisentinel.detection.model.SeriesPoint;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tukey fences: flags points outside {@code [Q1 - k*IQR, Q3 + k*IQR]}.
 */
public class IqrDetector implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(IqrDetector.class);

    public static final double DEFAULT_MULTIPLIER = 1.5d;
    public static final int DEFAULT_MIN_SAMPLES = 10;

    private final double multiplier;
    private final int minSamples;
    private final SeverityBands severityBands;

    public IqrDetector() {
        this(DEFAULT_MULTIPLIER, DEFAULT_MIN_SAMPLES, SeverityBands.IQR_DEFAULTS);
    }

    public IqrDetector(double multiplier) {
        this(multiplier, DEFAULT_MIN_SAMPLES, SeverityBands.IQR_DEFAULTS);
    }

    public IqrDetector(double multiplier, int minSamples, SeverityBands severityBands) {
        if (!(multiplier >= 0d) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("multiplier must be a finite, non-negative number");
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1");
        }
        this.multiplier = multiplier;
        this.minSamples = minSamples;
        this.severityBands = Objects.requireNonNull(severityBands, "severityBands");
    }

    @Override
    public Anomaly.Method method() {
        return Anomaly.Method.IQR;
    }

    @Override
    public List<Anomaly> detect(MetricSeries series) {
        double[] values = series.values();
        if (values.length < minSamples) {
            log.debug("IQR: {} has {} samples, {} required", series.metricName(), values.length, minSamples);
            return List.of();
        }
        QuartileStatistics stats = getStatistics(values);
        double iqr = stats.iqr();
        if (iqr == 0d) {
            log.debug("IQR: {} has zero interquartile range, nothing to flag", series.metricName());
            return List.of();
        }
        double lower = stats.lowerBound();
        double upper = stats.upperBound();
        double expected = (lower + upper) / 2;

        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (value >= lower && value <= upper) {
                continue;
            }
            boolean spike = value > upper;
            double deviation = spike ? (value - upper) / iqr : (lower - value) / iqr;
            SeriesPoint point = series.point(i);
            anomalies.add(new Anomaly(
                    i,
                    point.pointId(),
                    point.timestamp(),
                    Anomaly.Method.IQR,
                    spike ? Anomaly.Type.SPIKE : Anomaly.Type.DROP,
                    severityBands.classify(deviation),
                    expected,
                    value,
                    deviation,
                    calculateConfidence(values, deviation)
            ));
        }
        log.debug("IQR: {} anomalies in {} (Q1={}, Q3={}, IQR={}, bounds=[{}, {}])",
                anomalies.size(), series.metricName(), stats.q1(), stats.q3(), iqr, lower, upper);
        return anomalies;
    }

    public ExpectedRange calculateExpectedRange(double[] values) {
        if (values.length == 0) {
            return new ExpectedRange(0d, 0d);
        }
        QuartileStatistics stats = getStatistics(values);
        return new ExpectedRange(stats.lowerBound(), stats.upperBound());
    }

    public double calculateConfidence(double[] values, double deviation) {
        double sampleSizeFactor = Math.min(values.length / 100.0, 1.0);
        double deviationFactor = Math.min(Math.abs(deviation) / 3.0, 1.0);
        return SeriesMath.clamp(sampleSizeFactor * 0.3 + deviationFactor * 0.7, 0d, 1d);
    }

    @Override
    public QuartileStatistics getStatistics(double[] values) {
        if (values.length == 0) {
            return QuartileStatistics.empty();
        }
        double[] sorted = SeriesMath.sortedCopy(values);
        double q1 = SeriesMath.percentile(sorted, 25);
        double median = SeriesMath.percentile(sorted, 50);
        double q3 = SeriesMath.percentile(sorted, 75);
        double iqr = q3 - q1;
        return new QuartileStatistics(
                sorted.length,
                sorted[0],
                sorted[sorted.length - 1],
                q1,
                median,
                q3,
                iqr,
                q1 - multiplier * iqr,
                q3 + multiplier * iqr
        );
    }

    /** Checks {@code value} against the fences of {@code values}; the value need not belong to them. */
    public boolean isOutlier(double value, double[] values) {
        if (values.length == 0) {
            return false;
        }
        ExpectedRange range = calculateExpectedRange(values);
        return !range.contains(value);
    }

    public double multiplier() {
        return multiplier;
    }

    public int minSamples() {
        return minSamples;
    }

    public record ExpectedRange(double lower, double upper) {

        public boolean contains(double value) {
            return value >= lower && value <= upper;
        }
    }
}

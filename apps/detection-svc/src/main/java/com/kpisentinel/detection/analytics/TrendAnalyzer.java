package com.kpisentinel.detection.analytics;

import com.kpisentinel.detection.model.MetricSeries;
import com.kpisentinel.detection.model.SeriesPoint;
import com.kpisentinel.detection.model.Trend;
import com.kpisentinel.detection.model.TrendChange;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Period-over-period comparison: the first value inside the lookback window against the latest value.
 */
public class TrendAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(TrendAnalyzer.class);

    public static final double DEFAULT_SIGNIFICANCE_THRESHOLD = 0.10d;

    private static final double SECONDS_PER_DAY = 86_400d;

    private final double significanceThreshold;
    private final SeverityBands severityBands;

    public TrendAnalyzer() {
        this(DEFAULT_SIGNIFICANCE_THRESHOLD, SeverityBands.TREND_DEFAULTS);
    }

    public TrendAnalyzer(double significanceThreshold) {
        this(significanceThreshold, SeverityBands.TREND_DEFAULTS);
    }

    public TrendAnalyzer(double significanceThreshold, SeverityBands severityBands) {
        if (!(significanceThreshold >= 0d) || Double.isInfinite(significanceThreshold)) {
            throw new IllegalArgumentException("significanceThreshold must be a finite, non-negative number");
        }
        this.significanceThreshold = significanceThreshold;
        this.severityBands = Objects.requireNonNull(severityBands, "severityBands");
    }

    public Trend analyzeTrend(MetricSeries series, Trend.Period period) {
        Objects.requireNonNull(period, "period");
        int size = series.size();
        if (size < 2) {
            log.debug("Trend: {} has {} samples, at least 2 required for {}", series.metricName(), size, period);
            return size == 0
                    ? Trend.flat(period, null, 0d)
                    : Trend.flat(period, series.point(0).timestamp(), series.point(0).value());
        }

        SeriesPoint last = series.point(size - 1);
        Instant cutoff = last.timestamp().minus(Duration.ofDays(period.windowDays()));
        int startIndex = 0;
        while (series.point(startIndex).timestamp().isBefore(cutoff)) {
            startIndex++;
        }
        SeriesPoint first = series.point(startIndex);

        double startValue = first.value();
        double endValue = last.value();
        double absoluteChange = endValue - startValue;
        double percentageChange = startValue == 0d ? 0d : absoluteChange / Math.abs(startValue) * 100;
        if (!Double.isFinite(percentageChange)) {
            // a start value too close to zero carries no usable ratio, same as an exact zero
            percentageChange = 0d;
        }
        Trend.Direction direction = absoluteChange > 0
                ? Trend.Direction.UP
                : absoluteChange < 0 ? Trend.Direction.DOWN : Trend.Direction.STABLE;
        boolean significant = Math.abs(percentageChange) / 100 >= significanceThreshold;

        int windowSamples = size - startIndex;
        SeriesMath.LinearFit fit = fit(series, startIndex, size);
        double confidence = calculateConfidence(percentageChange, fit.rSquared(), windowSamples);

        Trend trend = new Trend(
                period,
                direction,
                first.timestamp(),
                last.timestamp(),
                startValue,
                endValue,
                absoluteChange,
                percentageChange,
                windowSamples,
                fit.slope(),
                fit.rSquared(),
                volatility(series.values()),
                severityBands.classify(Math.abs(percentageChange)),
                confidence,
                significant
        );
        log.debug("Trend: {} {} {} {}% (significant={}, confidence={})",
                series.metricName(), period, direction, percentageChange, significant, confidence);
        return trend;
    }

    public List<Trend> analyzeTrends(MetricSeries series, Collection<Trend.Period> periods) {
        List<Trend> trends = new ArrayList<>(periods.size());
        for (Trend.Period period : periods) {
            trends.add(analyzeTrend(series, period));
        }
        return trends;
    }

    /**
     * Blend of fit quality, window coverage (saturating at 30 samples) and change size (saturating
     * at 50%).
     */
    public double calculateConfidence(double percentageChange, double rSquared, int windowSamples) {
        double sampleConfidence = Math.min(windowSamples / 30.0, 1.0);
        double changeConfidence = Math.min(Math.abs(percentageChange) / 50.0, 1.0);
        double confidence = rSquared * 0.4 + sampleConfidence * 0.3 + changeConfidence * 0.3;
        return SeriesMath.clamp(confidence, 0d, 1d);
    }

    /**
     * Points where the least-squares slope of the preceding {@code windowSize} samples and of the
     * following {@code windowSize} samples have opposite signs.
     */
    public List<TrendChange> detectTrendChanges(MetricSeries series, int windowSize) {
        if (windowSize < 2) {
            throw new IllegalArgumentException("windowSize must be at least 2");
        }
        int size = series.size();
        if (size < windowSize * 2) {
            return List.of();
        }
        List<TrendChange> changes = new ArrayList<>();
        for (int i = windowSize; i <= size - windowSize; i++) {
            double previousSlope = fit(series, i - windowSize, i).slope();
            double nextSlope = fit(series, i, i + windowSize).slope();
            if (previousSlope * nextSlope < 0) {
                SeriesPoint point = series.point(i);
                changes.add(new TrendChange(i, point.timestamp(), point.value(), previousSlope, nextSlope));
            }
        }
        return changes;
    }

    /** Straight-line extrapolation of the whole series, {@code periodsAhead} days past the last value. */
    public double forecastNextValue(MetricSeries series, int periodsAhead) {
        if (series.isEmpty()) {
            return 0d;
        }
        double lastValue = series.point(series.size() - 1).value();
        return lastValue + fit(series, 0, series.size()).slope() * periodsAhead;
    }

    public double significanceThreshold() {
        return significanceThreshold;
    }

    // x is measured in days since the first point of the range
    private static SeriesMath.LinearFit fit(MetricSeries series, int fromInclusive, int toExclusive) {
        int length = toExclusive - fromInclusive;
        double[] x = new double[length];
        double[] y = new double[length];
        Instant origin = series.point(fromInclusive).timestamp();
        for (int i = 0; i < length; i++) {
            SeriesPoint point = series.point(fromInclusive + i);
            x[i] = Duration.between(origin, point.timestamp()).toMillis() / 1000d / SECONDS_PER_DAY;
            y[i] = point.value();
        }
        return SeriesMath.fitLine(x, y);
    }

    private static double volatility(double[] values) {
        double mean = SeriesMath.mean(values);
        if (mean == 0d) {
            return 0d;
        }
        return SeriesMath.std(values, mean) / Math.abs(mean) * 100;
    }
}

package com.kpisentinel.detection.analytics;

import com.kpisentinel.detection.model.Anomaly;
import com.kpisentinel.detection.model.DescriptiveStatistics;
import com.kpisentinel.detection.model.MetricSeries;
import com.kpisentinel.detection.model.SeasonalDecomposition;
import com.kpisentinel.detection.model.SeriesPoint;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Additive decomposition into trend, seasonal and residual components using a centered moving
 * average, and residual-based anomaly detection on top of it.
 *
 * <p>Series are indexed by position, so a cycle is {@code period} consecutive samples regardless of
 * the wall-clock spacing between them. At least two full cycles are needed.
 */
public class SeasonalDecomposer implements AnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(SeasonalDecomposer.class);

    public static final int DEFAULT_PERIOD = 7;
    public static final double DEFAULT_THRESHOLD = 2.0d;

    private final int period;
    private final double threshold;
    private final SeverityBands severityBands;

    public SeasonalDecomposer() {
        this(DEFAULT_PERIOD, DEFAULT_THRESHOLD, SeverityBands.SEASONAL_DEFAULTS);
    }

    public SeasonalDecomposer(int period) {
        this(period, DEFAULT_THRESHOLD, SeverityBands.SEASONAL_DEFAULTS);
    }

    public SeasonalDecomposer(int period, double threshold, SeverityBands severityBands) {
        if (period < 2) {
            throw new IllegalArgumentException("seasonal period must be at least 2");
        }
        if (!(threshold > 0d)) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        this.period = period;
        this.threshold = threshold;
        this.severityBands = Objects.requireNonNull(severityBands, "severityBands");
    }

    @Override
    public Anomaly.Method method() {
        return Anomaly.Method.SEASONAL;
    }

    public int minSamples() {
        return 2 * period;
    }

    public Optional<SeasonalDecomposition> decompose(double[] values) {
        if (values.length < minSamples()) {
            return Optional.empty();
        }
        double[] trend = movingAverage(values);
        double[] detrended = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            detrended[i] = values[i] - trend[i];
        }
        double[] seasonal = seasonalComponent(detrended);
        double[] residual = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            residual[i] = values[i] - trend[i] - seasonal[i];
        }
        return Optional.of(new SeasonalDecomposition(
                period,
                boxed(values),
                boxed(trend),
                boxed(seasonal),
                boxed(residual),
                strength(seasonal, residual),
                strength(trend, residual)
        ));
    }

    @Override
    public List<Anomaly> detect(MetricSeries series) {
        double[] values = series.values();
        Optional<double[]> residuals = residuals(values);
        if (residuals.isEmpty()) {
            log.debug("Seasonal: {} has {} samples, {} required", series.metricName(), values.length, minSamples());
            return List.of();
        }
        double std = SeriesMath.std(residuals.get());
        List<Anomaly> anomalies = new ArrayList<>();
        for (ResidualOutlier outlier : findOutliers(residuals.get(), std, threshold)) {
            int index = outlier.index();
            double residual = outlier.residual();
            double sigmas = Math.abs(residual) / std;
            SeriesPoint point = series.point(index);
            anomalies.add(new Anomaly(
                    index,
                    point.pointId(),
                    point.timestamp(),
                    Anomaly.Method.SEASONAL,
                    residual > 0 ? Anomaly.Type.SPIKE : Anomaly.Type.DROP,
                    severityBands.classify(sigmas),
                    values[index] - residual,
                    values[index],
                    Math.abs(residual),
                    calculateConfidence(values, sigmas)
            ));
        }
        log.debug("Seasonal: {} anomalies in {} (period={}, residual std={}, threshold={})",
                anomalies.size(), series.metricName(), period, std, threshold);
        return anomalies;
    }

    /**
     * Indices whose residual magnitude exceeds {@code threshold} residual standard deviations.
     */
    public List<ResidualOutlier> detectSeasonalAnomalies(double[] values, double threshold) {
        return residuals(values)
                .map(residuals -> findOutliers(residuals, SeriesMath.std(residuals), threshold))
                .orElse(List.of());
    }

    public double calculateConfidence(double[] values, double residualSigmas) {
        double sampleSizeFactor = Math.min(values.length / 100.0, 1.0);
        double sigmaFactor = Math.min(Math.abs(residualSigmas) / 5.0, 1.0);
        return SeriesMath.clamp(sampleSizeFactor * 0.3 + sigmaFactor * 0.7, 0d, 1d);
    }

    /** Statistics of the residual component; empty when the series is too short to decompose. */
    @Override
    public DescriptiveStatistics getStatistics(double[] values) {
        return residuals(values).map(SeriesMath::describe).orElse(DescriptiveStatistics.empty());
    }

    public double[] adjustForSeasonality(double[] values) {
        Optional<SeasonalDecomposition> decomposition = decompose(values);
        if (decomposition.isEmpty()) {
            return Arrays.copyOf(values, values.length);
        }
        List<Double> seasonal = decomposition.get().seasonal();
        double[] adjusted = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            adjusted[i] = values[i] - seasonal.get(i);
        }
        return adjusted;
    }

    /** Continues the last trend level plus the seasonal cycle for {@code periodsAhead} samples. */
    public double[] predictSeasonalPattern(double[] values, int periodsAhead) {
        if (periodsAhead < 0) {
            throw new IllegalArgumentException("periodsAhead must not be negative");
        }
        double[] predictions = new double[periodsAhead];
        if (values.length == 0) {
            return predictions;
        }
        Optional<SeasonalDecomposition> decomposition = decompose(values);
        if (decomposition.isEmpty()) {
            Arrays.fill(predictions, values[values.length - 1]);
            return predictions;
        }
        List<Double> trend = decomposition.get().trend();
        List<Double> seasonal = decomposition.get().seasonal();
        double lastTrend = trend.get(trend.size() - 1);
        int cycleStart = seasonal.size() - period;
        for (int i = 0; i < periodsAhead; i++) {
            predictions[i] = lastTrend + seasonal.get(cycleStart + i % period);
        }
        return predictions;
    }

    public int period() {
        return period;
    }

    private Optional<double[]> residuals(double[] values) {
        return decompose(values).map(decomposition -> unboxed(decomposition.residual()));
    }

    private List<ResidualOutlier> findOutliers(double[] residuals, double std, double sigmaThreshold) {
        if (std == 0d) {
            return List.of();
        }
        List<ResidualOutlier> outliers = new ArrayList<>();
        double limit = sigmaThreshold * std;
        for (int i = 0; i < residuals.length; i++) {
            if (Math.abs(residuals[i]) > limit) {
                outliers.add(new ResidualOutlier(i, residuals[i]));
            }
        }
        return outliers;
    }

    // window truncated at both edges
    private double[] movingAverage(double[] values) {
        int half = period / 2;
        double[] trend = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int start = Math.max(0, i - half);
            int end = Math.min(values.length, i + half + 1);
            double sum = 0d;
            for (int j = start; j < end; j++) {
                sum += values[j];
            }
            trend[i] = sum / (end - start);
        }
        return trend;
    }

    private double[] seasonalComponent(double[] detrended) {
        double[] cycle = new double[period];
        for (int position = 0; position < period; position++) {
            double sum = 0d;
            int count = 0;
            for (int i = position; i < detrended.length; i += period) {
                sum += detrended[i];
                count++;
            }
            cycle[position] = count == 0 ? 0d : sum / count;
        }
        double cycleMean = SeriesMath.mean(cycle);
        for (int position = 0; position < period; position++) {
            cycle[position] -= cycleMean;
        }
        double[] seasonal = new double[detrended.length];
        for (int i = 0; i < detrended.length; i++) {
            seasonal[i] = cycle[i % period];
        }
        return seasonal;
    }

    private static double strength(double[] component, double[] residual) {
        double componentVariance = SeriesMath.variance(component);
        double residualVariance = SeriesMath.variance(residual);
        if (componentVariance + residualVariance == 0d) {
            return 0d;
        }
        return SeriesMath.clamp(componentVariance / (componentVariance + residualVariance), 0d, 1d);
    }

    private static List<Double> boxed(double[] values) {
        return Arrays.stream(values).boxed().toList();
    }

    private static double[] unboxed(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public record ResidualOutlier(int index, double residual) {
    }
}

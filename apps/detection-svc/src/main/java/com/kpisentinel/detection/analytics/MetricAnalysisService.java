package com.kpisentinel.detection.analytics;

import com.kpisentinel.detection.config.DetectionProperties;
import com.kpisentinel.detection.model.Anomaly;
import com.kpisentinel.detection.model.MetricAnalysis;
import com.kpisentinel.detection.model.MetricSeries;
import com.kpisentinel.detection.model.Trend;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the detectors over one metric at a time and merges their output. A detector or metric that
 * fails is logged and contributes nothing, so one bad series never aborts a batch scan.
 */
@Service
public class MetricAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(MetricAnalysisService.class);

    private final Map<Anomaly.Method, AnomalyDetector> detectors;
    private final TrendAnalyzer trendAnalyzer;
    private final List<Anomaly.Method> defaultMethods;
    private final List<Trend.Period> defaultPeriods;
    private final Executor executor;

    public MetricAnalysisService(
            List<AnomalyDetector> detectors,
            TrendAnalyzer trendAnalyzer,
            DetectionProperties properties,
            @Qualifier("detectionExecutor") Executor executor
    ) {
        this.detectors = new EnumMap<>(Anomaly.Method.class);
        for (AnomalyDetector detector : detectors) {
            AnomalyDetector previous = this.detectors.put(detector.method(), detector);
            if (previous != null) {
                throw new IllegalArgumentException("more than one detector registered for " + detector.method());
            }
        }
        this.trendAnalyzer = trendAnalyzer;
        this.defaultMethods = properties.analysis().defaultMethods();
        this.defaultPeriods = properties.analysis().defaultPeriods();
        this.executor = executor;
    }

    public List<Anomaly> detectAnomalies(MetricSeries series) {
        return detectAnomalies(series, Set.copyOf(defaultMethods));
    }

    /**
     * Runs the requested methods in declaration order of {@link Anomaly.Method}. A point already
     * reported by an earlier method is not reported again. The result is ordered by index.
     */
    public List<Anomaly> detectAnomalies(MetricSeries series, Set<Anomaly.Method> methods) {
        Collection<Anomaly.Method> requested = methods == null || methods.isEmpty() ? defaultMethods : methods;
        Map<Integer, Anomaly> byIndex = new TreeMap<>();
        for (Anomaly.Method method : Anomaly.Method.values()) {
            if (!requested.contains(method)) {
                continue;
            }
            AnomalyDetector detector = detectors.get(method);
            if (detector == null) {
                log.warn("Anomaly detection: no detector registered for {}, skipping {}", method, series.metricName());
                continue;
            }
            List<Anomaly> found;
            try {
                found = detector.detect(series);
            } catch (RuntimeException ex) {
                log.warn("Anomaly detection: {} failed for {}, continuing without it", method, series.metricName(), ex);
                continue;
            }
            for (Anomaly anomaly : found) {
                byIndex.putIfAbsent(anomaly.index(), anomaly);
            }
        }
        log.debug("Anomaly detection: {} anomalies for {} using {}", byIndex.size(), series.metricName(), requested);
        return List.copyOf(byIndex.values());
    }

    public List<Trend> analyzeTrends(MetricSeries series, Collection<Trend.Period> periods) {
        Collection<Trend.Period> requested = periods == null || periods.isEmpty() ? defaultPeriods : periods;
        List<Trend> trends = new ArrayList<>(requested.size());
        for (Trend.Period period : requested) {
            try {
                trends.add(trendAnalyzer.analyzeTrend(series, period));
            } catch (RuntimeException ex) {
                log.warn("Trend analysis: {} failed for {}", period, series.metricName(), ex);
            }
        }
        return trends;
    }

    public MetricAnalysis analyze(MetricSeries series) {
        List<Anomaly> anomalies = detectAnomalies(series);
        List<Trend> trends = analyzeTrends(series, defaultPeriods);
        MetricAnalysis analysis = new MetricAnalysis(
                series.metricName(),
                series.size(),
                anomalies,
                trends,
                SeriesMath.describe(series.values())
        );
        log.info("Metric analysis {}: {} samples, {} anomalies, {} significant trends",
                series.metricName(), series.size(), anomalies.size(),
                trends.stream().filter(Trend::significant).count());
        return analysis;
    }

    /**
     * Analyzes every series on the detection executor. Results keep the input order; a metric
     * whose analysis fails yields an empty analysis.
     */
    public List<MetricAnalysis> scanBatch(List<MetricSeries> batch) {
        for (MetricSeries series : batch) {
            if (series == null) {
                throw new IllegalArgumentException("batch must not contain null series");
            }
        }
        List<CompletableFuture<MetricAnalysis>> futures = batch.stream()
                .map(series -> CompletableFuture.supplyAsync(() -> analyze(series), executor)
                        .exceptionally(ex -> {
                            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                            log.warn("Batch scan: analysis failed for {}, reporting no anomalies", series.metricName(), cause);
                            return MetricAnalysis.empty(series.metricName(), series.size());
                        }))
                .toList();
        List<MetricAnalysis> results = futures.stream().map(CompletableFuture::join).toList();
        log.info("Batch scan: {} metrics analyzed, {} with anomalies",
                results.size(), results.stream().filter(MetricAnalysis::hasAnomalies).count());
        return results;
    }
}

package com.kpisentinel.detection.model;

import java.util.List;

public record MetricAnalysis(
        String metricName,
        int sampleCount,
        List<Anomaly> anomalies,
        List<Trend> trends,
        DescriptiveStatistics statistics
) {
    public MetricAnalysis {
        anomalies = List.copyOf(anomalies);
        trends = List.copyOf(trends);
    }

    public static MetricAnalysis empty(String metricName, int sampleCount) {
        return new MetricAnalysis(metricName, sampleCount, List.of(), List.of(), DescriptiveStatistics.empty());
    }

    public boolean hasAnomalies() {
        return !anomalies.isEmpty();
    }
}

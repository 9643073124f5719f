package com.kpisentinel.detection.model;

public record DescriptiveStatistics(
        int count,
        double min,
        double max,
        double mean,
        double median,
        double std,
        double variance
) implements SeriesStatistics {

    public static DescriptiveStatistics empty() {
        return new DescriptiveStatistics(0, 0d, 0d, 0d, 0d, 0d, 0d);
    }
}

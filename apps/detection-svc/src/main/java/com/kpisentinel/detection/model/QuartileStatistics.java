package com.kpisentinel.detection.model;

public record QuartileStatistics(
        int count,
        double min,
        double max,
        double q1,
        double median,
        double q3,
        double iqr,
        double lowerBound,
        double upperBound
) implements SeriesStatistics {

    public static QuartileStatistics empty() {
        return new QuartileStatistics(0, 0d, 0d, 0d, 0d, 0d, 0d, 0d, 0d);
    }
}

package com.kpisentinel.detection.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Chronologically ordered observations of one metric.
 *
 * <p>Detectors read the series by position. Each point carries an opaque identifier that is
 * echoed back on every anomaly so the caller can map a flagged index to its stored data point.
 */
public record MetricSeries(
        String metricName,
        List<SeriesPoint> points
) {
    public MetricSeries {
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metricName must be provided");
        }
        if (points == null) {
            throw new IllegalArgumentException("points must be provided");
        }
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i) == null) {
                throw new IllegalArgumentException("point at index " + i + " must not be null");
            }
        }
        points = List.copyOf(points);
        for (int i = 1; i < points.size(); i++) {
            if (points.get(i).timestamp().isBefore(points.get(i - 1).timestamp())) {
                throw new IllegalArgumentException("points must be in chronological order; index " + i
                        + " (" + points.get(i).timestamp() + ") precedes " + points.get(i - 1).timestamp());
            }
        }
    }

    /**
     * Builds a series from parallel lists.
     *
     * @param pointIds identifiers of the stored data points, or {@code null} to use positions
     * @throws IllegalArgumentException when the lists differ in length
     */
    public static MetricSeries of(String metricName, List<Double> values, List<Instant> timestamps, List<String> pointIds) {
        if (values == null || timestamps == null) {
            throw new IllegalArgumentException("values and timestamps must be provided");
        }
        if (values.size() != timestamps.size()) {
            throw new IllegalArgumentException("values and timestamps differ in length: "
                    + values.size() + " != " + timestamps.size());
        }
        if (pointIds != null && pointIds.size() != values.size()) {
            throw new IllegalArgumentException("values and pointIds differ in length: "
                    + values.size() + " != " + pointIds.size());
        }
        List<SeriesPoint> points = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            Double value = values.get(i);
            if (value == null) {
                throw new IllegalArgumentException("value at index " + i + " is missing");
            }
            String pointId = pointIds != null ? pointIds.get(i) : String.valueOf(i);
            points.add(new SeriesPoint(timestamps.get(i), value, pointId));
        }
        return new MetricSeries(metricName, points);
    }

    public static MetricSeries daily(String metricName, Instant start, double... values) {
        List<SeriesPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new SeriesPoint(start.plus(Duration.ofDays(i)), values[i], String.valueOf(i)));
        }
        return new MetricSeries(metricName, points);
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public SeriesPoint point(int index) {
        return points.get(index);
    }

    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).value();
        }
        return values;
    }

    public List<Instant> timestamps() {
        return points.stream().map(SeriesPoint::timestamp).toList();
    }
}

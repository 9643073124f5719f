package com.kpisentinel.detection.analytics;

import com.kpisentinel.detection.model.AnomalySeverity;

/**
 * Lower cut-points of each severity level. A magnitude below {@code low} is {@link AnomalySeverity#INFO}.
 */
public record SeverityBands(
        double low,
        double medium,
        double high,
        double critical
) {
    public static final SeverityBands ZSCORE_DEFAULTS = new SeverityBands(3.0, 3.5, 4.0, 5.0);
    public static final SeverityBands IQR_DEFAULTS = new SeverityBands(0.5, 1.0, 2.0, 3.0);
    public static final SeverityBands SEASONAL_DEFAULTS = new SeverityBands(2.0, 3.0, 4.0, 5.0);
    public static final SeverityBands TREND_DEFAULTS = new SeverityBands(10.0, 15.0, 30.0, 50.0);

    public SeverityBands {
        if (!(low >= 0d)) {
            throw new IllegalArgumentException("low cut-point must not be negative");
        }
        if (!(low <= medium && medium <= high && high <= critical)) {
            throw new IllegalArgumentException(String.format(
                    "severity cut-points must be ascending: low=%s medium=%s high=%s critical=%s",
                    low, medium, high, critical));
        }
    }

    public AnomalySeverity classify(double magnitude) {
        if (magnitude >= critical) {
            return AnomalySeverity.CRITICAL;
        }
        if (magnitude >= high) {
            return AnomalySeverity.HIGH;
        }
        if (magnitude >= medium) {
            return AnomalySeverity.MEDIUM;
        }
        if (magnitude >= low) {
            return AnomalySeverity.LOW;
        }
        return AnomalySeverity.INFO;
    }
}

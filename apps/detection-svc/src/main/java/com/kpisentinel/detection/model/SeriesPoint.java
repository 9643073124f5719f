package com.kpisentinel.detection.model;

import java.time.Instant;

public record SeriesPoint(
        Instant timestamp,
        double value,
        String pointId
) {
    public SeriesPoint {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp must be provided");
        }
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite but was " + value + " at " + timestamp);
        }
    }
}

package com.kpisentinel.detection.model;

import java.time.Instant;

public record Anomaly(
        int index,
        String pointId,
        Instant timestamp,
        Method method,
        Type type,
        AnomalySeverity severity,
        double expectedValue,
        double actualValue,
        double deviation,
        double confidence
) {
    public Anomaly {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
        if (method == null || type == null || severity == null) {
            throw new IllegalArgumentException("method, type and severity must be provided");
        }
        if (!(confidence >= 0d && confidence <= 1d)) {
            throw new IllegalArgumentException("confidence must be within [0, 1] but was " + confidence);
        }
    }

    public enum Method {
        ZSCORE,
        IQR,
        SEASONAL
    }

    public enum Type {
        SPIKE,
        DROP
    }
}

package com.kpisentinel.detection.model;

import java.time.Instant;

/** A reversal of the local least-squares slope around {@code index}. */
public record TrendChange(
        int index,
        Instant timestamp,
        double value,
        double previousSlope,
        double nextSlope
) {
}

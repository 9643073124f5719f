package com.kpisentinel.detection.model;

import java.time.Instant;

public record Trend(
        Period period,
        Direction direction,
        Instant startTimestamp,
        Instant endTimestamp,
        double startValue,
        double endValue,
        double absoluteChange,
        double percentageChange,
        int windowSamples,
        double slope,
        double trendStrength,
        double volatility,
        AnomalySeverity severity,
        double confidence,
        boolean significant
) {
    public Trend {
        if (period == null || direction == null || severity == null) {
            throw new IllegalArgumentException("period, direction and severity must be provided");
        }
        if (!(confidence >= 0d && confidence <= 1d)) {
            throw new IllegalArgumentException("confidence must be within [0, 1] but was " + confidence);
        }
    }

    public static Trend flat(Period period, Instant at, double value) {
        return new Trend(period, Direction.STABLE, at, at, value, value, 0d, 0d, 0, 0d, 0d, 0d,
                AnomalySeverity.INFO, 0d, false);
    }

    public enum Direction {
        UP,
        DOWN,
        STABLE
    }

    public enum Period {
        WOW(7),
        MOM(30),
        QOQ(90),
        YOY(365);

        private final int windowDays;

        Period(int windowDays) {
            this.windowDays = windowDays;
        }

        public int windowDays() {
            return windowDays;
        }
    }
}

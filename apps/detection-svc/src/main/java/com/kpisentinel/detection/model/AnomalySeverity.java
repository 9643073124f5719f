package com.kpisentinel.detection.model;

public enum AnomalySeverity {
    INFO,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}

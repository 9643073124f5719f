package com.kpisentinel.detection.model;

import java.util.List;

public record SeasonalDecomposition(
        int period,
        List<Double> original,
        List<Double> trend,
        List<Double> seasonal,
        List<Double> residual,
        double seasonalStrength,
        double trendStrength
) {
    public SeasonalDecomposition {
        original = List.copyOf(original);
        trend = List.copyOf(trend);
        seasonal = List.copyOf(seasonal);
        residual = List.copyOf(residual);
    }
}

package com.kpisentinel.detection.model;

public interface SeriesStatistics {

    int count();

    double min();

    double max();
}

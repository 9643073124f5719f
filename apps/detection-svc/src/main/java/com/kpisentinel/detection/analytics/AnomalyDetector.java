package com.kpisentinel.detection.analytics;

import com.kpisentinel.detection.model.Anomaly;
import com.kpisentinel.detection.model.MetricSeries;
import com.kpisentinel.detection.model.SeriesStatistics;
import java.util.List;

/**
 * A stateless point-anomaly detector. Implementations never mutate their input and return an empty
 * list, not an error, for series that are too short or have no spread.
 */
public interface AnomalyDetector {

    Anomaly.Method method();

    List<Anomaly> detect(MetricSeries series);

    SeriesStatistics getStatistics(double[] values);
}

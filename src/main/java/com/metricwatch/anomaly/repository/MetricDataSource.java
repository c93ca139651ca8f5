package com.metricwatch.anomaly.repository;

import com.metricwatch.anomaly.model.Cohort;
import com.metricwatch.anomaly.model.MetricSeries;

import java.util.List;

/**
 * Read side of the analytics store that detection jobs score.
 */
public interface MetricDataSource {

    /**
     * Every cohort that has observations for {@code metric}, in a stable order.
     */
    List<Cohort> listCohorts(String metric);

    /**
     * The most recent {@code window} observations for the slice, oldest first.
     * Returns an empty series when the slice is unknown.
     */
    MetricSeries fetchSeries(Cohort cohort, String metric, int window);
}

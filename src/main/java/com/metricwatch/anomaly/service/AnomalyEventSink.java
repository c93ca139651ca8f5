package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.model.AnomalyEvent;

/**
 * Consumer of emitted anomaly events (notification, ticketing, dashboards).
 * Every sink bean in the context receives every event.
 */
public interface AnomalyEventSink {

    void publish(AnomalyEvent event);
}

package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.DetectionProperties;
import com.metricwatch.anomaly.model.AnomalyEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Default sink: logs every event and keeps the most recent ones for the admin API.
 */
@Service
public class RecentAnomalyLog implements AnomalyEventSink {

    private static final Logger log = LoggerFactory.getLogger(RecentAnomalyLog.class);

    private final int capacity;
    private final Deque<AnomalyEvent> recent = new ArrayDeque<>();

    public RecentAnomalyLog(DetectionProperties properties) {
        this.capacity = Math.max(1, properties.getRecentEvents().getCapacity());
    }

    @Override
    public void publish(AnomalyEvent event) {
        log.warn("ANOMALY: detector={} metric={} cohort=[{}] score={} persistence={}",
                event.getDetectorId(), event.getMetric(), event.getCohort().key(),
                String.format("%.3f", event.getScore()), event.getPersistenceCount());
        synchronized (recent) {
            if (recent.size() == capacity) {
                recent.pollLast();
            }
            recent.addFirst(event);
        }
    }

    /**
     * Newest first, at most {@code limit} events.
     */
    public List<AnomalyEvent> getRecent(int limit) {
        synchronized (recent) {
            return recent.stream().limit(Math.max(0, limit)).toList();
        }
    }

    public List<AnomalyEvent> getRecent() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }
}

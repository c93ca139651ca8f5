package com.metricwatch.anomaly.repository;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import com.metricwatch.anomaly.model.Cohort;
import com.metricwatch.anomaly.model.MetricKey;
import com.metricwatch.anomaly.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * In-process {@link MetricDataSource}: a bounded ring of the latest observations per slice.
 * The host application appends rows; detection jobs read windows from it. At most
 * {@code maxSlices} slices are held; the least recently used one is dropped beyond that.
 */
public class MetricSeriesBuffer implements MetricDataSource {

    private static final Logger log = LoggerFactory.getLogger(MetricSeriesBuffer.class);

    public static final int DEFAULT_MAX_SLICES = 10_000;

    private final int capacity;
    private final Cache<MetricKey, Deque<double[]>> series;

    public MetricSeriesBuffer(int capacity) {
        this(capacity, DEFAULT_MAX_SLICES);
    }

    public MetricSeriesBuffer(int capacity, int maxSlices) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be >= 1, got " + capacity);
        }
        if (maxSlices < 1) {
            throw new IllegalArgumentException("Buffer max slices must be >= 1, got " + maxSlices);
        }
        this.capacity = capacity;
        this.series = CacheBuilder.newBuilder()
                .maximumSize(maxSlices)
                .removalListener((RemovalListener<MetricKey, Deque<double[]>>) notification -> {
                    if (notification.wasEvicted()) {
                        log.debug("Evicted buffered series for {}", notification.getKey());
                    }
                })
                .build();
    }

    /**
     * Append one observation. All rows of a slice must have the same width; the oldest row is
     * evicted once the slice holds {@code capacity} rows.
     */
    public void append(Cohort cohort, String metric, double... row) {
        Objects.requireNonNull(row, "Row must not be null");
        if (row.length == 0) {
            throw new IllegalArgumentException("Row must have at least one value");
        }
        MetricKey key = MetricKey.of(cohort, metric);
        Deque<double[]> rows = series.asMap().computeIfAbsent(key, k -> new ArrayDeque<>());
        synchronized (rows) {
            double[] first = rows.peekFirst();
            if (first != null && first.length != row.length) {
                throw new IllegalArgumentException("Row width " + row.length + " does not match width "
                        + first.length + " already buffered for " + key);
            }
            if (rows.size() == capacity) {
                rows.pollFirst();
            }
            rows.addLast(row.clone());
        }
    }

    @Override
    public List<Cohort> listCohorts(String metric) {
        return series.asMap().keySet().stream()
                .filter(key -> key.metric().equals(metric))
                .map(MetricKey::cohort)
                .sorted()
                .toList();
    }

    @Override
    public MetricSeries fetchSeries(Cohort cohort, String metric, int window) {
        Deque<double[]> rows = series.getIfPresent(MetricKey.of(cohort, metric));
        if (rows == null) {
            return MetricSeries.empty();
        }
        List<double[]> copy;
        synchronized (rows) {
            copy = new ArrayList<>(rows);
        }
        int from = Math.max(0, copy.size() - window);
        return MetricSeries.ofRows(copy.subList(from, copy.size()));
    }

    public int size(Cohort cohort, String metric) {
        Deque<double[]> rows = series.getIfPresent(MetricKey.of(cohort, metric));
        if (rows == null) return 0;
        synchronized (rows) {
            return rows.size();
        }
    }

    public void clear(Cohort cohort, String metric) {
        if (series.asMap().remove(MetricKey.of(cohort, metric)) != null) {
            log.debug("Cleared buffered series for {}", MetricKey.of(cohort, metric));
        }
    }

    public long sliceCount() {
        return series.size();
    }
}

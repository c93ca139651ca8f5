package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.MetricsConfig;
import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.JobRunSummary;
import com.metricwatch.anomaly.model.SchedulerState;
import com.metricwatch.anomaly.model.SchedulerStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link DetectionScheduler} on a Spring {@link ThreadPoolTaskScheduler}. Each enabled detector
 * gets a fixed-rate task that fires immediately on registration, then every
 * {@code scheduleIntervalMinutes}.
 */
public class LiveDetectionScheduler implements DetectionScheduler, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(LiveDetectionScheduler.class);

    private final ThreadPoolTaskScheduler taskScheduler;
    private final DetectionJobRunner jobRunner;
    private final MetricsConfig metricsConfig;
    private final Duration awaitTermination;

    // Guarded by this
    private SchedulerState state = SchedulerState.STOPPED;
    private Map<String, DetectorConfig> configs = new LinkedHashMap<>();
    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();

    private final AtomicInteger inFlight = new AtomicInteger();
    private final Object inFlightMonitor = new Object();

    public LiveDetectionScheduler(ThreadPoolTaskScheduler taskScheduler,
                                  DetectionJobRunner jobRunner,
                                  MetricsConfig metricsConfig,
                                  Duration awaitTermination) {
        this.taskScheduler = taskScheduler;
        this.jobRunner = jobRunner;
        this.metricsConfig = metricsConfig;
        this.awaitTermination = awaitTermination;
    }

    @Override
    public synchronized void start() {
        if (state == SchedulerState.RUNNING) {
            log.warn("Detection scheduler already running, ignoring start()");
            return;
        }
        state = SchedulerState.RUNNING;
        configs.values().forEach(this::schedule);
        metricsConfig.updateScheduledJobCount(jobs.size());
        log.info("Detection scheduler started with {} job(s): {}", jobs.size(), jobs.keySet());
    }

    @Override
    public void stop() {
        synchronized (this) {
            if (state != SchedulerState.RUNNING) {
                return;
            }
            state = SchedulerState.STOPPED;
            jobs.values().forEach(job -> job.future().cancel(false));
            jobs.clear();
            metricsConfig.updateScheduledJobCount(0);
        }
        // Not under the scheduler lock
        boolean drained = awaitInFlight();
        log.info("Detection scheduler stopped{}", drained ? "" : " (some jobs still running)");
    }

    @Override
    public synchronized void refreshJobs(List<DetectorConfig> newConfigs) {
        Map<String, DetectorConfig> next = new LinkedHashMap<>();
        for (DetectorConfig config : newConfigs) {
            next.put(config.getId(), config);
        }
        configs = next;

        if (state != SchedulerState.RUNNING) {
            log.debug("Detection scheduler stopped, recorded {} detector(s)", next.size());
            return;
        }

        int cancelled = 0;
        Iterator<Map.Entry<String, ScheduledJob>> it = jobs.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ScheduledJob> entry = it.next();
            DetectorConfig replacement = next.get(entry.getKey());
            if (replacement == null || !replacement.isEnabled() || !replacement.equals(entry.getValue().config())) {
                entry.getValue().future().cancel(false);
                it.remove();
                cancelled++;
            }
        }

        int scheduled = 0;
        for (DetectorConfig config : next.values()) {
            if (config.isEnabled() && !jobs.containsKey(config.getId())) {
                schedule(config);
                scheduled++;
            }
        }

        metricsConfig.updateScheduledJobCount(jobs.size());
        log.info("Detection jobs refreshed: {} active, {} cancelled, {} (re)scheduled",
                jobs.size(), cancelled, scheduled);
    }

    @Override
    public Optional<JobRunSummary> runNow(String detectorId) {
        DetectorConfig config;
        synchronized (this) {
            config = configs.get(detectorId);
        }
        if (config == null) {
            throw new IllegalArgumentException("Unknown detector: " + detectorId);
        }
        return Optional.of(execute(config));
    }

    @Override
    public synchronized SchedulerStatus status() {
        return new SchedulerStatus(state, List.copyOf(jobs.keySet()), inFlight.get());
    }

    @Override
    public void destroy() {
        stop();
        taskScheduler.shutdown();
    }

    private void schedule(DetectorConfig config) {
        if (!config.isEnabled()) {
            return;
        }
        Duration interval = Duration.ofMinutes(config.getScheduleIntervalMinutes());
        ScheduledFuture<?> future = taskScheduler.scheduleAtFixedRate(() -> runScheduled(config), interval);
        jobs.put(config.getId(), new ScheduledJob(config, future));
        log.info("Scheduled detector {} ({}) on metric {} every {} min",
                config.getId(), config.getDetectorType(), config.getMetric(), config.getScheduleIntervalMinutes());
    }

    // An exception escaping a periodic task would cancel all of its future runs
    private void runScheduled(DetectorConfig config) {
        // A firing dequeued before stop() must either be counted before stop() waits or not run
        synchronized (this) {
            if (state != SchedulerState.RUNNING) {
                log.debug("Skipping detection job {}: scheduler is {}", config.getId(), state);
                return;
            }
            inFlight.incrementAndGet();
        }
        try {
            runCounted(config);
        } catch (RuntimeException e) {
            log.error("Detection job {} failed: {}", config.getId(), e.getMessage(), e);
        }
    }

    private JobRunSummary execute(DetectorConfig config) {
        inFlight.incrementAndGet();
        return runCounted(config);
    }

    // Caller has already incremented inFlight
    private JobRunSummary runCounted(DetectorConfig config) {
        try {
            return jobRunner.run(config);
        } finally {
            synchronized (inFlightMonitor) {
                inFlight.decrementAndGet();
                inFlightMonitor.notifyAll();
            }
        }
    }

    private boolean awaitInFlight() {
        long deadline = System.nanoTime() + awaitTermination.toNanos();
        synchronized (inFlightMonitor) {
            while (inFlight.get() > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    log.warn("Timed out after {} waiting for {} running detection job(s)",
                            awaitTermination, inFlight.get());
                    return false;
                }
                try {
                    TimeUnit.NANOSECONDS.timedWait(inFlightMonitor, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
        }
        return true;
    }

    private record ScheduledJob(DetectorConfig config, ScheduledFuture<?> future) {
    }
}

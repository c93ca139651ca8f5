package com.metricwatch.anomaly.config;

import com.metricwatch.anomaly.service.DetectionJobRunner;
import com.metricwatch.anomaly.service.DetectionScheduler;
import com.metricwatch.anomaly.service.DisabledDetectionScheduler;
import com.metricwatch.anomaly.service.LiveDetectionScheduler;
import com.metricwatch.anomaly.service.SchedulerUnavailableException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;

/**
 * Wires the detection scheduler. The task scheduler is created explicitly so that a missing or
 * broken substrate degrades to {@link DisabledDetectionScheduler} instead of failing startup.
 */
@Configuration
public class SchedulerConfig {

    @Bean
    public DetectionScheduler detectionScheduler(DetectionProperties properties,
                                                 DetectionJobRunner jobRunner,
                                                 MetricsConfig metricsConfig) {
        DetectionProperties.Scheduler settings = properties.getScheduler();
        try {
            ThreadPoolTaskScheduler taskScheduler = createTaskScheduler(settings);
            return new LiveDetectionScheduler(taskScheduler, jobRunner, metricsConfig,
                    Duration.ofSeconds(settings.getAwaitTerminationSeconds()));
        } catch (SchedulerUnavailableException e) {
            return new DisabledDetectionScheduler(e.getMessage());
        }
    }

    /**
     * @throws SchedulerUnavailableException if scheduling is switched off or the pool cannot start
     */
    static ThreadPoolTaskScheduler createTaskScheduler(DetectionProperties.Scheduler settings) {
        if (!settings.isEnabled()) {
            throw new SchedulerUnavailableException("disabled by configuration (detection.scheduler.enabled=false)");
        }
        try {
            ThreadPoolTaskScheduler taskScheduler = new ThreadPoolTaskScheduler();
            taskScheduler.setPoolSize(settings.getPoolSize());
            taskScheduler.setThreadNamePrefix("detection-");
            taskScheduler.setRemoveOnCancelPolicy(true);
            taskScheduler.initialize();
            return taskScheduler;
        } catch (RuntimeException e) {
            throw new SchedulerUnavailableException("task scheduler could not be created: " + e.getMessage(), e);
        }
    }
}

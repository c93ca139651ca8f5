package com.metricwatch.anomaly.config;

import com.metricwatch.anomaly.model.SchedulerState;
import com.metricwatch.anomaly.service.DetectionJobRunner;
import com.metricwatch.anomaly.service.DetectionScheduler;
import com.metricwatch.anomaly.service.DisabledDetectionScheduler;
import com.metricwatch.anomaly.service.LiveDetectionScheduler;
import com.metricwatch.anomaly.service.SchedulerUnavailableException;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class SchedulerConfigTest {

    private final SchedulerConfig schedulerConfig = new SchedulerConfig();

    @Test
    void createTaskScheduler_disabledByConfiguration_isUnavailable() {
        DetectionProperties.Scheduler settings = new DetectionProperties.Scheduler();
        settings.setEnabled(false);

        assertThatThrownBy(() -> SchedulerConfig.createTaskScheduler(settings))
                .isInstanceOf(SchedulerUnavailableException.class)
                .hasMessageContaining("detection.scheduler.enabled=false");
    }

    @Test
    void createTaskScheduler_invalidPoolSize_isUnavailable() {
        DetectionProperties.Scheduler settings = new DetectionProperties.Scheduler();
        settings.setPoolSize(0);

        assertThatThrownBy(() -> SchedulerConfig.createTaskScheduler(settings))
                .isInstanceOf(SchedulerUnavailableException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void createTaskScheduler_defaults_initializesPool() {
        ThreadPoolTaskScheduler taskScheduler = SchedulerConfig.createTaskScheduler(new DetectionProperties.Scheduler());
        try {
            assertThat(taskScheduler.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(4);
            assertThat(taskScheduler.getThreadNamePrefix()).isEqualTo("detection-");
        } finally {
            taskScheduler.shutdown();
        }
    }

    @Test
    void detectionScheduler_unavailable_fallsBackToDisabledNoOp() {
        DetectionProperties properties = new DetectionProperties();
        properties.getScheduler().setEnabled(false);

        DetectionScheduler scheduler = schedulerConfig.detectionScheduler(properties,
                mock(DetectionJobRunner.class), mock(MetricsConfig.class));

        assertThat(scheduler).isInstanceOf(DisabledDetectionScheduler.class);
        scheduler.start();
        scheduler.refreshJobs(List.of());
        assertThat(scheduler.status().state()).isEqualTo(SchedulerState.DISABLED);
        assertThat(scheduler.runNow("anything")).isEmpty();
    }

    @Test
    void detectionScheduler_available_isLive() throws Exception {
        DetectionScheduler scheduler = schedulerConfig.detectionScheduler(new DetectionProperties(),
                mock(DetectionJobRunner.class), mock(MetricsConfig.class));
        try {
            assertThat(scheduler).isInstanceOf(LiveDetectionScheduler.class);
            assertThat(scheduler.status().state()).isEqualTo(SchedulerState.STOPPED);
        } finally {
            ((LiveDetectionScheduler) scheduler).destroy();
        }
    }
}

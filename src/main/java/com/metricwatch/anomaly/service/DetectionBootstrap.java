package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.DetectionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Starts the scheduler after the context is up, unless {@code detection.scheduler.auto-start=false}.
 */
@Component
public class DetectionBootstrap implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DetectionBootstrap.class);

    private final DetectionScheduler scheduler;
    private final DetectionProperties properties;

    public DetectionBootstrap(DetectionScheduler scheduler, DetectionProperties properties) {
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        if (!properties.getScheduler().isAutoStart()) {
            log.info("Detection scheduler auto-start disabled; start it via POST /api/v1/scheduler/start");
            return;
        }
        scheduler.start();
    }
}

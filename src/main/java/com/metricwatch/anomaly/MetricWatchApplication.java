package com.metricwatch.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetricWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetricWatchApplication.class, args);
    }
}

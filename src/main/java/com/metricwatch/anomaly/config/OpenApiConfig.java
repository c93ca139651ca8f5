package com.metricwatch.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI metricWatchOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("MetricWatch Anomaly Engine API")
                        .version("1.0.0")
                        .description(
                                "Scheduled, cohort-based anomaly detection over metric time series.\n\n" +
                                "**Detection cycle (per detector, every `scheduleIntervalMinutes`):**\n" +
                                "1. Resolve cohorts: explicit list or every cohort known for the metric\n" +
                                "2. Fetch the latest `windowSize` observations per cohort\n" +
                                "3. Score with the configured detector; skip cohorts below `minSupport`\n" +
                                "4. Pass the latest score through the guardrails: **persistence** " +
                                "(N consecutive breaching cycles), **hysteresis** (raise at `raiseK`, clear at `clearK`) " +
                                "and **cooldown** (randomized gap between alerts)\n" +
                                "5. Publish surviving anomalies to every event sink\n\n" +
                                "**Detector types:**\n" +
                                "- `ISOLATION_FOREST`: multivariate, normalized isolation score\n" +
                                "- `ZSCORE`: per-column absolute z-score\n" +
                                "- `THRESHOLD`: raw value against an absolute ceiling\n" +
                                "- `IQR`: distance outside the Tukey fences, in IQR units")
                        .contact(new Contact().name("MetricWatch Team")));
    }
}

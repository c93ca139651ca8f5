package com.metricwatch.anomaly.service;

import com.metricwatch.anomaly.config.MetricsConfig;
import com.metricwatch.anomaly.engine.DetectionException;
import com.metricwatch.anomaly.engine.Detector;
import com.metricwatch.anomaly.engine.DetectorRegistry;
import com.metricwatch.anomaly.engine.guardrail.GuardrailDecision;
import com.metricwatch.anomaly.engine.guardrail.GuardrailEngine;
import com.metricwatch.anomaly.model.AnomalyEvent;
import com.metricwatch.anomaly.model.Cohort;
import com.metricwatch.anomaly.model.DetectorConfig;
import com.metricwatch.anomaly.model.DetectorResult;
import com.metricwatch.anomaly.model.JobRunSummary;
import com.metricwatch.anomaly.model.MetricSeries;
import com.metricwatch.anomaly.repository.MetricDataSource;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Executes one detection cycle for a detector: every cohort is fetched, scored and passed through
 * the guardrails; surviving alerts are published to all sinks.
 *
 * A failing cohort is logged and skipped, it never aborts the rest of the batch. The guardrail is
 * consulted exactly once per cohort per cycle with the score of the latest observation, so
 * persistence counts consecutive cycles. Earlier flagged indices in the window are reported only as
 * evidence in {@code anomalyIndices}: they were scored in previous cycles, and gating them again would
 * advance persistence more than once per cycle.
 */
@Service
public class DetectionJobRunner {

    private static final Logger log = LoggerFactory.getLogger(DetectionJobRunner.class);

    private final DetectorRegistry detectorRegistry;
    private final MetricDataSource dataSource;
    private final GuardrailService guardrailService;
    private final List<AnomalyEventSink> sinks;
    private final MetricsConfig metricsConfig;
    private final Tracer tracer;
    private final Clock clock;

    public DetectionJobRunner(DetectorRegistry detectorRegistry,
                              MetricDataSource dataSource,
                              GuardrailService guardrailService,
                              List<AnomalyEventSink> sinks,
                              MetricsConfig metricsConfig,
                              Tracer tracer,
                              Clock clock) {
        this.detectorRegistry = detectorRegistry;
        this.dataSource = dataSource;
        this.guardrailService = guardrailService;
        this.sinks = List.copyOf(sinks);
        this.metricsConfig = metricsConfig;
        this.tracer = tracer;
        this.clock = clock;
    }

    /**
     * Run one cycle.
     *
     * @throws IllegalArgumentException if no detector is registered for the config's type
     */
    @Observed(name = "detection.run", contextualName = "detection-run")
    public JobRunSummary run(DetectorConfig config) {
        Instant startedAt = clock.instant();
        Detector detector = detectorRegistry.create(config);
        GuardrailEngine guardrail = guardrailService.engineFor(config);
        List<Cohort> cohorts = resolveCohorts(config);

        int evaluated = 0;
        int failed = 0;
        int emitted = 0;

        for (Cohort cohort : cohorts) {
            Span span = tracer.nextSpan()
                    .name("detection.cohort")
                    .tag("detector.id", config.getId())
                    .tag("detector.type", config.getDetectorType().name())
                    .tag("metric", config.getMetric())
                    .tag("cohort", cohort.key())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(span)) {
                Optional<AnomalyEvent> event = evaluateCohort(config, detector, guardrail, cohort);
                evaluated++;
                span.tag("anomaly.emitted", String.valueOf(event.isPresent()));
                if (event.isPresent()) {
                    publish(event.get());
                    metricsConfig.recordAnomalyEmitted(config.getId());
                    emitted++;
                }
            } catch (DetectionException e) {
                failed++;
                span.error(e);
                metricsConfig.recordCohortFailure(e.reason());
                log.warn("Skipping cohort [{}] for detector {} ({}): {}",
                        cohort.key(), config.getId(), e.reason(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                span.error(e);
                metricsConfig.recordCohortFailure("unexpected");
                log.error("Unexpected failure evaluating cohort [{}] for detector {}: {}",
                        cohort.key(), config.getId(), e.getMessage(), e);
            } finally {
                span.end();
            }
        }

        metricsConfig.recordCycle(config.getId(), evaluated);
        Instant finishedAt = clock.instant();
        log.info("Detection cycle complete: detector={} cohorts={} failed={} emitted={}",
                config.getId(), evaluated, failed, emitted);

        return JobRunSummary.builder()
                .detectorId(config.getId())
                .cohortsEvaluated(evaluated)
                .cohortsFailed(failed)
                .eventsEmitted(emitted)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .build();
    }

    private List<Cohort> resolveCohorts(DetectorConfig config) {
        if (!config.getCohorts().isEmpty()) {
            return config.getCohorts();
        }
        return dataSource.listCohorts(config.getMetric());
    }

    private Optional<AnomalyEvent> evaluateCohort(DetectorConfig config, Detector detector,
                                                  GuardrailEngine guardrail, Cohort cohort) {
        MetricSeries series = dataSource.fetchSeries(cohort, config.getMetric(), config.getWindowSize());
        DetectorResult result = detector.detect(series);

        int latest = series.latestIndex();
        double score = result.scoreAt(latest);
        boolean flagged = result.isAnomalous(latest);
        Instant now = clock.instant();

        GuardrailDecision decision = guardrail.evaluate(cohort, config.getMetric(), score,
                config.getK(), config.getPersistenceRequired(), now);

        if (!decision.raised()) {
            if (flagged) {
                metricsConfig.recordGuardrailSuppressed(decision.suppressedBy());
                log.debug("Anomaly for cohort [{}] detector {} suppressed by {} (score={})",
                        cohort.key(), config.getId(), decision.suppressedBy(), score);
            }
            return Optional.empty();
        }

        Map<String, Object> evidence = new LinkedHashMap<>(result.getEvidence());
        evidence.put("anomalyIndices", result.getAnomalyIndices());
        evidence.put("persistenceCount", decision.state().getPersistenceCount());
        evidence.put("cooldownMinutes", decision.state().getCooldownMinutes());

        return Optional.of(AnomalyEvent.builder()
                .cohort(cohort)
                .metric(config.getMetric())
                .score(score)
                .detectorId(config.getId())
                .persistenceCount(decision.state().getPersistenceCount())
                .evidence(evidence)
                .timestamp(now)
                .build());
    }

    // Guardrail state is already committed; a failing sink must not stop the others.
    private void publish(AnomalyEvent event) {
        for (AnomalyEventSink sink : sinks) {
            try {
                sink.publish(event);
            } catch (RuntimeException e) {
                metricsConfig.recordSinkFailure(sink.getClass().getSimpleName());
                log.error("Anomaly sink {} failed for detector {} cohort [{}]: {}",
                        sink.getClass().getSimpleName(), event.getDetectorId(),
                        event.getCohort().key(), e.getMessage(), e);
            }
        }
    }
}

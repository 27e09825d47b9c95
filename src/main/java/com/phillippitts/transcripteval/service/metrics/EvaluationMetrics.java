package com.phillippitts.transcripteval.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for evaluation runs.
 *
 * <p>Provides:
 * <ul>
 *   <li>Per-transcript evaluation duration</li>
 *   <li>Outcome counts by status (passed, failed, not_evaluable, error)</li>
 *   <li>Failure counts per gated metric</li>
 *   <li>Degradation counts (missing performance data, undefined metrics)</li>
 * </ul>
 */
@Component
public class EvaluationMetrics {

    private static final String METRIC_PREFIX = "transcripteval.evaluation";

    private final MeterRegistry registry;

    public EvaluationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one transcript took to evaluate.
     *
     * @param durationNanos duration in nanoseconds
     */
    public void recordDuration(long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".duration")
                .description("Time taken to evaluate one transcript")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the outcome counter.
     *
     * @param status lower-case status name (passed, failed, not_evaluable, error)
     */
    public void incrementOutcome(String status) {
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of evaluated transcripts by outcome")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter of a gated metric.
     *
     * @param metric report key of the metric (e.g. word_error_rate)
     */
    public void incrementMetricFailure(String metric) {
        Counter.builder(METRIC_PREFIX + ".metric.failure")
                .description("Number of threshold failures per metric")
                .tag("metric", metric)
                .register(registry)
                .increment();
    }

    /**
     * Increments the degradation counter.
     *
     * @param reason degradation reason (missing_performance_data, undefined_metric)
     */
    public void incrementDegraded(String reason) {
        Counter.builder(METRIC_PREFIX + ".degraded")
                .description("Number of transcripts evaluated with reduced metrics")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}

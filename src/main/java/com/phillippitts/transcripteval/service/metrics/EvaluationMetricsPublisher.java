package com.phillippitts.transcripteval.service.metrics;

import com.phillippitts.transcripteval.domain.EvaluationRecord;
import com.phillippitts.transcripteval.domain.MetricName;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Translates finished evaluation records into {@link EvaluationMetrics} updates.
 *
 * <p><b>Null Safety:</b> a publisher without metrics is a no-op, so evaluation services can
 * run without a meter registry in tests.
 *
 * @see EvaluationMetrics
 */
@Component
public final class EvaluationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(EvaluationMetricsPublisher.class);

    /** No-op instance for tests and manual wiring. */
    public static final EvaluationMetricsPublisher NOOP = new EvaluationMetricsPublisher(null);

    private final EvaluationMetrics metrics;

    /**
     * @param metrics metrics service (nullable for test mode)
     */
    public EvaluationMetricsPublisher(EvaluationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("EvaluationMetricsPublisher created without metrics (test mode)");
        }
    }

    /**
     * Records outcome, per-metric failures, degradations and duration of one evaluation.
     *
     * @param record finished record
     * @param durationNanos evaluation duration in nanoseconds
     */
    public void recordEvaluation(EvaluationRecord record, long durationNanos) {
        if (metrics == null) {
            return;
        }

        metrics.recordDuration(durationNanos);
        metrics.incrementOutcome(record.status().name().toLowerCase(Locale.ROOT));
        for (Map.Entry<MetricName, Boolean> e : record.evaluations().entrySet()) {
            if (!e.getValue()) {
                metrics.incrementMetricFailure(e.getKey().key());
            }
        }
        if (record.missingPerformanceData()) {
            metrics.incrementDegraded("missing_performance_data");
        }
        if (!record.undefinedMetrics().isEmpty()) {
            metrics.incrementDegraded("undefined_metric");
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}

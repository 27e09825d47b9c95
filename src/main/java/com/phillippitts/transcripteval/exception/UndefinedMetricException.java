package com.phillippitts.transcripteval.exception;

import com.phillippitts.transcripteval.domain.MetricName;

/**
 * Thrown when degenerate input makes a metric undefined (e.g. an error rate over an
 * empty reference). Callers mark the metric as not evaluated instead of failing the run.
 */
public class UndefinedMetricException extends TranscriptEvalException {

    private final MetricName metric;

    public UndefinedMetricException(MetricName metric, String reason) {
        super("Metric " + metric.key() + " is undefined: " + reason);
        this.metric = metric;
    }

    public MetricName getMetric() {
        return metric;
    }
}

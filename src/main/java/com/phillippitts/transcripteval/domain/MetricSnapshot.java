package com.phillippitts.transcripteval.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Metric values gathered for one transcript before threshold evaluation.
 *
 * @param values                 computed values; a metric is absent when undefined or not available
 * @param undefinedMetrics       metrics that degenerate input made undefined
 * @param missingPerformanceData true when no latency entry existed for the transcript
 */
public record MetricSnapshot(Map<MetricName, Double> values,
                             Set<MetricName> undefinedMetrics,
                             boolean missingPerformanceData) {

    public MetricSnapshot {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(undefinedMetrics, "undefinedMetrics");
        EnumMap<MetricName, Double> valuesCopy = new EnumMap<>(MetricName.class);
        values.forEach((metric, value) -> valuesCopy.put(metric, new MetricValue(metric, value).value()));
        values = Collections.unmodifiableMap(valuesCopy);
        EnumSet<MetricName> undefinedCopy = EnumSet.noneOf(MetricName.class);
        undefinedCopy.addAll(undefinedMetrics);
        undefinedMetrics = Collections.unmodifiableSet(undefinedCopy);
    }

    /**
     * Returns a copy with latency (and RTF when present) added.
     */
    public MetricSnapshot withPerformance(PerformanceRecord performance) {
        EnumMap<MetricName, Double> merged = new EnumMap<>(MetricName.class);
        merged.putAll(values);
        merged.put(MetricName.LATENCY_MS, performance.latencyMs());
        if (performance.hasRtf()) {
            merged.put(MetricName.RTF, performance.rtf());
        }
        return new MetricSnapshot(merged, undefinedMetrics, false);
    }

    /**
     * Returns a copy flagged as lacking performance data.
     */
    public MetricSnapshot withMissingPerformanceData() {
        return new MetricSnapshot(values, undefinedMetrics, true);
    }
}

package com.phillippitts.transcripteval.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Immutable metric-to-limit mapping used for one evaluation run.
 *
 * <p>A gated metric with no entry is not evaluated. Informational metrics can never carry
 * a limit. Safe to share between concurrent evaluations.
 *
 * @param limits limit per gated metric (copied, iteration follows {@link MetricName} order)
 */
public record ThresholdSet(Map<MetricName, Double> limits) {

    public static final double DEFAULT_WER = 0.15;
    public static final double DEFAULT_CER = 0.1;
    public static final double DEFAULT_TFIDF = 0.75;
    public static final double DEFAULT_LATENCY_MS = 800.0;
    public static final double DEFAULT_RTF = 0.8;

    public ThresholdSet {
        Objects.requireNonNull(limits, "limits");
        EnumMap<MetricName, Double> copy = new EnumMap<>(MetricName.class);
        for (Map.Entry<MetricName, Double> e : limits.entrySet()) {
            MetricName metric = Objects.requireNonNull(e.getKey(), "metric");
            Double limit = Objects.requireNonNull(e.getValue(), "limit for " + metric.key());
            if (!metric.isGated()) {
                throw new IllegalArgumentException(metric.key() + " is informational and cannot have a threshold");
            }
            if (limit.isNaN() || limit.isInfinite() || limit < 0.0) {
                throw new IllegalArgumentException("threshold for " + metric.key() + " must be finite and >= 0");
            }
            copy.put(metric, limit);
        }
        limits = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the documented default limits for every gated metric.
     */
    public static ThresholdSet defaults() {
        EnumMap<MetricName, Double> limits = new EnumMap<>(MetricName.class);
        limits.put(MetricName.TFIDF_SIMILARITY, DEFAULT_TFIDF);
        limits.put(MetricName.WORD_ERROR_RATE, DEFAULT_WER);
        limits.put(MetricName.CHARACTER_ERROR_RATE, DEFAULT_CER);
        limits.put(MetricName.LATENCY_MS, DEFAULT_LATENCY_MS);
        limits.put(MetricName.RTF, DEFAULT_RTF);
        return new ThresholdSet(limits);
    }

    public OptionalDouble limitFor(MetricName metric) {
        Double limit = limits.get(metric);
        return limit == null ? OptionalDouble.empty() : OptionalDouble.of(limit);
    }

    /**
     * Returns a copy with the given metric's limit replaced.
     */
    public ThresholdSet with(MetricName metric, double limit) {
        EnumMap<MetricName, Double> copy = new EnumMap<>(MetricName.class);
        copy.putAll(limits);
        copy.put(metric, limit);
        return new ThresholdSet(copy);
    }

    /**
     * Returns a copy in which the given metric has no limit and is therefore not evaluated.
     */
    public ThresholdSet without(MetricName metric) {
        EnumMap<MetricName, Double> copy = new EnumMap<>(MetricName.class);
        copy.putAll(limits);
        copy.remove(metric);
        return new ThresholdSet(copy);
    }
}

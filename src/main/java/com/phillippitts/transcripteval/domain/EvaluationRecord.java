package com.phillippitts.transcripteval.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable evaluation outcome for one hypothesis transcript.
 *
 * <p>{@code evaluations} holds an entry only for metrics that had both a value and a
 * threshold; {@code totalMetrics} is its size.
 *
 * @param name                   transcript display name
 * @param groundTruthPath        path of the reference transcript
 * @param hypothesisPath         path of the hypothesis transcript
 * @param metrics                all computed metric values
 * @param evaluations            pass flag per evaluated metric
 * @param thresholds             thresholds in force for the run
 * @param transcriptor           transcriptor identity, may be null
 * @param passedMetrics          evaluated metrics that passed
 * @param totalMetrics           evaluated metrics
 * @param status                 overall verdict
 * @param missingPerformanceData true when latency/RTF were skipped for lack of data
 * @param undefinedMetrics       metrics left out because input made them undefined
 * @param error                  failure reason, set only for {@link EvaluationStatus#ERROR}
 */
public record EvaluationRecord(
        String name,
        String groundTruthPath,
        String hypothesisPath,
        Map<MetricName, Double> metrics,
        Map<MetricName, Boolean> evaluations,
        ThresholdSet thresholds,
        TranscriptorInfo transcriptor,
        int passedMetrics,
        int totalMetrics,
        EvaluationStatus status,
        boolean missingPerformanceData,
        Set<MetricName> undefinedMetrics,
        String error
) {

    public EvaluationRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(groundTruthPath, "groundTruthPath");
        Objects.requireNonNull(hypothesisPath, "hypothesisPath");
        Objects.requireNonNull(thresholds, "thresholds");
        Objects.requireNonNull(status, "status");
        EnumMap<MetricName, Double> metricsCopy = new EnumMap<>(MetricName.class);
        metricsCopy.putAll(Objects.requireNonNull(metrics, "metrics"));
        metrics = Collections.unmodifiableMap(metricsCopy);
        EnumMap<MetricName, Boolean> evaluationsCopy = new EnumMap<>(MetricName.class);
        evaluationsCopy.putAll(Objects.requireNonNull(evaluations, "evaluations"));
        evaluations = Collections.unmodifiableMap(evaluationsCopy);
        EnumSet<MetricName> undefinedCopy = EnumSet.noneOf(MetricName.class);
        undefinedCopy.addAll(Objects.requireNonNull(undefinedMetrics, "undefinedMetrics"));
        undefinedMetrics = Collections.unmodifiableSet(undefinedCopy);
        if (passedMetrics < 0 || passedMetrics > totalMetrics || totalMetrics != evaluations.size()) {
            throw new IllegalArgumentException("inconsistent metric counts: passed=" + passedMetrics
                    + ", total=" + totalMetrics + ", evaluations=" + evaluations.size());
        }
        if ((status == EvaluationStatus.ERROR) != (error != null)) {
            throw new IllegalArgumentException("error reason must be set exactly for status ERROR: status="
                    + status + ", error=" + error);
        }
        if (status == EvaluationStatus.ERROR && totalMetrics != 0) {
            throw new IllegalArgumentException("an ERROR record cannot carry evaluated metrics");
        }
    }

    public EvaluationRecord(String name,
                            String groundTruthPath,
                            String hypothesisPath,
                            Map<MetricName, Double> metrics,
                            Map<MetricName, Boolean> evaluations,
                            ThresholdSet thresholds,
                            TranscriptorInfo transcriptor,
                            int passedMetrics,
                            int totalMetrics,
                            EvaluationStatus status,
                            boolean missingPerformanceData,
                            Set<MetricName> undefinedMetrics) {
        this(name, groundTruthPath, hypothesisPath, metrics, evaluations, thresholds, transcriptor,
                passedMetrics, totalMetrics, status, missingPerformanceData, undefinedMetrics, null);
    }

    /**
     * Record for a transcript that produced no metrics because it could not be read or evaluated.
     *
     * @param reason human-readable failure reason
     * @return a record with status {@link EvaluationStatus#ERROR}
     */
    public static EvaluationRecord failed(String name,
                                          String groundTruthPath,
                                          String hypothesisPath,
                                          ThresholdSet thresholds,
                                          TranscriptorInfo transcriptor,
                                          String reason) {
        Objects.requireNonNull(reason, "reason");
        return new EvaluationRecord(name, groundTruthPath, hypothesisPath, Map.of(), Map.of(), thresholds,
                transcriptor, 0, 0, EvaluationStatus.ERROR, false, Set.of(), reason);
    }

    /** True iff every evaluated metric passed and at least one was evaluated. */
    public boolean overallPassed() {
        return status == EvaluationStatus.PASSED;
    }
}

package com.phillippitts.transcripteval.service.evaluation;

import com.phillippitts.transcripteval.domain.EvaluationRecord;
import com.phillippitts.transcripteval.domain.EvaluationStatus;
import com.phillippitts.transcripteval.domain.MetricName;
import com.phillippitts.transcripteval.domain.MetricSnapshot;
import com.phillippitts.transcripteval.domain.ThresholdSet;
import com.phillippitts.transcripteval.domain.Transcript;
import com.phillippitts.transcripteval.domain.TranscriptorInfo;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Gates metric values against a {@link ThresholdSet} and builds the {@link EvaluationRecord}.
 *
 * <p>Rules:
 * <ul>
 *   <li>Only gated metrics with both a value and a threshold are evaluated</li>
 *   <li>Lower-is-better passes when value &lt;= limit, higher-is-better when value &gt;= limit</li>
 *   <li>Overall pass is the AND of all evaluated metrics; no weighting or averaging</li>
 *   <li>Zero evaluated metrics yields {@link EvaluationStatus#NOT_EVALUABLE}</li>
 * </ul>
 *
 * <p>Thresholds are passed in on every call; the evaluator itself is stateless.
 */
@Component
public class ThresholdEvaluator {

    private static final Logger LOG = LogManager.getLogger(ThresholdEvaluator.class);

    /**
     * Evaluates one transcript.
     *
     * @param reference ground-truth transcript (for its path)
     * @param hypothesis evaluated transcript
     * @param snapshot computed metric values
     * @param thresholds limits for this run
     * @param transcriptor transcriptor identity (nullable)
     * @return the evaluation record
     */
    public EvaluationRecord evaluate(Transcript reference,
                                     Transcript hypothesis,
                                     MetricSnapshot snapshot,
                                     ThresholdSet thresholds,
                                     TranscriptorInfo transcriptor) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(hypothesis, "hypothesis");
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(thresholds, "thresholds");

        Map<MetricName, Boolean> evaluations = new EnumMap<>(MetricName.class);
        for (MetricName metric : MetricName.values()) {
            if (!metric.isGated()) {
                continue;
            }
            Double value = snapshot.values().get(metric);
            OptionalDouble limit = thresholds.limitFor(metric);
            if (value == null || limit.isEmpty()) {
                continue;
            }
            evaluations.put(metric, metric.direction().passes(value, limit.getAsDouble()));
        }

        int total = evaluations.size();
        int passed = (int) evaluations.values().stream().filter(Boolean::booleanValue).count();
        EvaluationStatus status;
        if (total == 0) {
            status = EvaluationStatus.NOT_EVALUABLE;
            LOG.warn("No evaluable metrics for {}: every metric lacks a value or a threshold", hypothesis.name());
        } else {
            status = passed == total ? EvaluationStatus.PASSED : EvaluationStatus.FAILED;
        }

        return new EvaluationRecord(
                hypothesis.name(),
                reference.path(),
                hypothesis.path(),
                snapshot.values(),
                evaluations,
                thresholds,
                transcriptor,
                passed,
                total,
                status,
                snapshot.missingPerformanceData(),
                snapshot.undefinedMetrics()
        );
    }
}

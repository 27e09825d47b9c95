package com.phillippitts.transcripteval.service.report;

import com.phillippitts.transcripteval.domain.EvaluationRecord;
import com.phillippitts.transcripteval.domain.EvaluationReport;
import com.phillippitts.transcripteval.domain.EvaluationStatus;
import com.phillippitts.transcripteval.domain.MetricName;
import com.phillippitts.transcripteval.domain.ThresholdSet;
import com.phillippitts.transcripteval.domain.TranscriptorInfo;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

final class ReportFixtures {

    static final TranscriptorInfo TRANSCRIPTOR = new TranscriptorInfo("whisper", "1.2", "ci");
    static final ThresholdSet THRESHOLDS = ThresholdSet.defaults().without(MetricName.RTF);

    private ReportFixtures() {
    }

    static EvaluationRecord passed() {
        Map<MetricName, Double> metrics = new EnumMap<>(MetricName.class);
        metrics.put(MetricName.TFIDF_SIMILARITY, 1.0);
        metrics.put(MetricName.WORD_ERROR_RATE, 0.0);
        metrics.put(MetricName.CHARACTER_ERROR_RATE, 0.0);
        metrics.put(MetricName.LATENCY_MS, 500.0);
        metrics.put(MetricName.RTF, 0.4);
        Map<MetricName, Boolean> evaluations = new EnumMap<>(MetricName.class);
        evaluations.put(MetricName.TFIDF_SIMILARITY, true);
        evaluations.put(MetricName.WORD_ERROR_RATE, true);
        evaluations.put(MetricName.CHARACTER_ERROR_RATE, true);
        evaluations.put(MetricName.LATENCY_MS, true);
        return new EvaluationRecord("good", "texts/gt/reference.txt", "texts/good.txt", metrics, evaluations,
                THRESHOLDS, TRANSCRIPTOR, 4, 4, EvaluationStatus.PASSED, false, Set.of());
    }

    static EvaluationRecord failed() {
        Map<MetricName, Double> metrics = new EnumMap<>(MetricName.class);
        metrics.put(MetricName.TFIDF_SIMILARITY, 0.818);
        metrics.put(MetricName.WORD_ERROR_RATE, 0.2);
        metrics.put(MetricName.CHARACTER_ERROR_RATE, 0.12);
        Map<MetricName, Boolean> evaluations = new EnumMap<>(MetricName.class);
        evaluations.put(MetricName.TFIDF_SIMILARITY, true);
        evaluations.put(MetricName.WORD_ERROR_RATE, false);
        evaluations.put(MetricName.CHARACTER_ERROR_RATE, false);
        return new EvaluationRecord("weak", "texts/gt/reference.txt", "texts/weak.txt", metrics, evaluations,
                THRESHOLDS, TRANSCRIPTOR, 1, 3, EvaluationStatus.FAILED, true, Set.of());
    }

    static EvaluationRecord notEvaluable() {
        return new EvaluationRecord("empty", "texts/gt/reference.txt", "texts/empty.txt",
                Map.of(), Map.of(), THRESHOLDS, TRANSCRIPTOR, 0, 0, EvaluationStatus.NOT_EVALUABLE, true,
                Set.of(MetricName.WORD_ERROR_RATE));
    }

    static EvaluationReport report(EvaluationRecord... records) {
        return new EvaluationReport(List.of(records), THRESHOLDS, TRANSCRIPTOR);
    }

    static EvaluationRecord error() {
        return EvaluationRecord.failed("broken", "texts/gt/reference.txt", "texts/broken.txt", THRESHOLDS,
                TRANSCRIPTOR, "Cannot read transcript: MalformedInputException (Input length = 1)");
    }
}

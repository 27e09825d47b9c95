package com.phillippitts.transcripteval.domain;

import java.util.List;
import java.util.Objects;

/**
 * Ordered evaluation records of one run plus the run-wide context.
 *
 * @param records      one record per hypothesis, in discovery order
 * @param thresholds   thresholds used for every record
 * @param transcriptor transcriptor identity, may be null
 */
public record EvaluationReport(List<EvaluationRecord> records,
                               ThresholdSet thresholds,
                               TranscriptorInfo transcriptor) {

    public EvaluationReport {
        records = List.copyOf(Objects.requireNonNull(records, "records"));
        Objects.requireNonNull(thresholds, "thresholds");
    }

    /** True iff every record passed. */
    public boolean allPassed() {
        return records.stream().allMatch(EvaluationRecord::overallPassed);
    }

    public long passedCount() {
        return records.stream().filter(EvaluationRecord::overallPassed).count();
    }
}

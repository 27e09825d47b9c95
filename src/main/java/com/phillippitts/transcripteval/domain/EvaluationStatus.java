package com.phillippitts.transcripteval.domain;

/**
 * Verdict for one transcript.
 */
public enum EvaluationStatus {
    /** Every evaluated metric passed. */
    PASSED,
    /** At least one evaluated metric failed. */
    FAILED,
    /** No metric had both a value and a threshold: a configuration problem, not a normal fail. */
    NOT_EVALUABLE,
    /** The transcript could not be read or its evaluation failed; the record carries the reason. */
    ERROR
}

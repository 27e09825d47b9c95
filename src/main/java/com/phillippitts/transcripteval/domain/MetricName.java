package com.phillippitts.transcripteval.domain;

/**
 * All metrics produced for a transcript, with their report keys.
 *
 * <p>Gated metrics can carry a threshold and take part in the pass/fail verdict.
 * Informational metrics ({@link #LEVENSHTEIN_SIMILARITY}, {@link #JACCARD_SIMILARITY}) are
 * reported but never evaluated.
 */
public enum MetricName {
    TFIDF_SIMILARITY("tfidf_similarity", "tfidf_passed", "tfidf_threshold", BetterDirection.HIGHER_IS_BETTER),
    WORD_ERROR_RATE("word_error_rate", "wer_passed", "wer_threshold", BetterDirection.LOWER_IS_BETTER),
    CHARACTER_ERROR_RATE("character_error_rate", "cer_passed", "cer_threshold", BetterDirection.LOWER_IS_BETTER),
    LATENCY_MS("latency_ms", "latency_passed", "latency_threshold_ms", BetterDirection.LOWER_IS_BETTER),
    RTF("rtf", "rtf_passed", "rtf_threshold", BetterDirection.LOWER_IS_BETTER),
    LEVENSHTEIN_SIMILARITY("levenshtein_similarity", null, null, BetterDirection.HIGHER_IS_BETTER),
    JACCARD_SIMILARITY("jaccard_similarity", null, null, BetterDirection.HIGHER_IS_BETTER);

    private final String key;
    private final String evaluationKey;
    private final String thresholdKey;
    private final BetterDirection direction;

    MetricName(String key, String evaluationKey, String thresholdKey, BetterDirection direction) {
        this.key = key;
        this.evaluationKey = evaluationKey;
        this.thresholdKey = thresholdKey;
        this.direction = direction;
    }

    /** Key under {@code metrics} in reports. */
    public String key() {
        return key;
    }

    /** Key under {@code evaluations} in reports; null for informational metrics. */
    public String evaluationKey() {
        return evaluationKey;
    }

    /** Key under {@code thresholds} in reports; null for informational metrics. */
    public String thresholdKey() {
        return thresholdKey;
    }

    public BetterDirection direction() {
        return direction;
    }

    public boolean isGated() {
        return thresholdKey != null;
    }
}

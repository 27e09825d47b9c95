package com.phillippitts.transcripteval.domain;

/**
 * Which way a metric improves. Decides the comparison used against its threshold.
 */
public enum BetterDirection {
    LOWER_IS_BETTER,
    HIGHER_IS_BETTER;

    /**
     * Compares a value with its limit. A value equal to the limit always passes.
     *
     * @param value computed metric value
     * @param limit configured threshold
     * @return true if the value is on the passing side of the limit (inclusive)
     */
    public boolean passes(double value, double limit) {
        return this == LOWER_IS_BETTER ? value <= limit : value >= limit;
    }
}

package com.phillippitts.transcripteval.domain;

import java.util.Objects;

/**
 * A computed metric value with its declared better direction.
 *
 * @param name  which metric this is
 * @param value non-negative, finite value (error rates may exceed 1.0)
 */
public record MetricValue(MetricName name, double value) {

    public MetricValue {
        Objects.requireNonNull(name, "name");
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0.0) {
            throw new IllegalArgumentException(name.key() + " must be a finite non-negative number, got: " + value);
        }
    }

    public BetterDirection direction() {
        return name.direction();
    }
}

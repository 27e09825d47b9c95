package com.phillippitts.transcripteval.service.performance;

/**
 * Latency metadata as found in the latency mapping, before normalization.
 *
 * <p>An entry is either a bare number of milliseconds or an object carrying
 * {@code latency_ms} and optionally {@code rtf}.
 */
public sealed interface PerformanceMetadata {

    double latencyMs();

    /** Bare numeric entry: {@code "file.txt": 650}. */
    record NumericLatency(double latencyMs) implements PerformanceMetadata {
    }

    /** Structured entry: {@code "file.txt": {"latency_ms": 650, "rtf": 0.4}}; rtf may be null. */
    record DetailedLatency(double latencyMs, Double rtf) implements PerformanceMetadata {
    }
}

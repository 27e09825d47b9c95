package com.phillippitts.transcripteval.domain;

/**
 * Normalized performance data for one hypothesis transcript.
 *
 * @param latencyMs processing latency in milliseconds
 * @param rtf       real-time factor, or null when the source carried none
 */
public record PerformanceRecord(double latencyMs, Double rtf) {

    public PerformanceRecord {
        if (Double.isNaN(latencyMs) || Double.isInfinite(latencyMs) || latencyMs < 0.0) {
            throw new IllegalArgumentException("latencyMs must be finite and >= 0, got: " + latencyMs);
        }
        if (rtf != null && (rtf.isNaN() || rtf.isInfinite() || rtf < 0.0)) {
            throw new IllegalArgumentException("rtf must be finite and >= 0, got: " + rtf);
        }
    }

    public boolean hasRtf() {
        return rtf != null;
    }
}

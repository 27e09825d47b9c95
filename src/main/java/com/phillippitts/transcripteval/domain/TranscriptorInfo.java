package com.phillippitts.transcripteval.domain;

import java.util.Objects;

/**
 * Identity of the system that produced the hypothesis transcripts. Opaque to evaluation,
 * attached to every record as-is.
 */
public record TranscriptorInfo(String name, String version, String environment) {

    public static final String UNKNOWN = "unknown";

    public TranscriptorInfo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(environment, "environment");
    }

    public static TranscriptorInfo unknown() {
        return new TranscriptorInfo(UNKNOWN, UNKNOWN, UNKNOWN);
    }
}

package com.phillippitts.transcripteval.exception;

/**
 * Thrown when a hypothesis transcript has no latency entry.
 * Recovered per transcript: latency and RTF are skipped and the record is flagged.
 */
public class MissingPerformanceDataException extends TranscriptEvalException {

    private final String transcriptFile;

    public MissingPerformanceDataException(String transcriptFile) {
        super("No latency entry for transcript: " + transcriptFile);
        this.transcriptFile = transcriptFile;
    }

    public String getTranscriptFile() {
        return transcriptFile;
    }
}

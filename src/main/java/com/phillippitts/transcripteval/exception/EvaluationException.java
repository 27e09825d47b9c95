package com.phillippitts.transcripteval.exception;

/**
 * Evaluation failure. Without a transcript name it means the run as a whole could not complete
 * (e.g. it timed out); with one it describes a single failed transcript.
 */
public class EvaluationException extends TranscriptEvalException {

    private final String transcriptName;

    public EvaluationException(String message) {
        super(message);
        this.transcriptName = "unknown";
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
        this.transcriptName = "unknown";
    }

    public EvaluationException(String message, String transcriptName, Throwable cause) {
        super(message + " (transcript: " + transcriptName + ")", cause);
        this.transcriptName = transcriptName;
    }

    public String getTranscriptName() {
        return transcriptName;
    }
}

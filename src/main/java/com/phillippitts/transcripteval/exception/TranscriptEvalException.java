package com.phillippitts.transcripteval.exception;

/**
 * Base exception for all transcript-eval application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TranscriptEvalException extends RuntimeException {

    public TranscriptEvalException(String message) {
        super(message);
    }

    public TranscriptEvalException(String message, Throwable cause) {
        super(message, cause);
    }

    public TranscriptEvalException(Throwable cause) {
        super(cause);
    }
}

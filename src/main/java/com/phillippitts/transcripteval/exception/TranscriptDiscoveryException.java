package com.phillippitts.transcripteval.exception;

/**
 * Thrown when transcript files cannot be discovered or read. It aborts the run unless it
 * concerns a single hypothesis file, which is then reported as unreadable.
 */
public class TranscriptDiscoveryException extends TranscriptEvalException {

    private final String path;

    public TranscriptDiscoveryException(String message, String path) {
        super(message + " (path: " + path + ")");
        this.path = path;
    }

    public TranscriptDiscoveryException(String message, String path, Throwable cause) {
        super(message + " (path: " + path + ")", cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}

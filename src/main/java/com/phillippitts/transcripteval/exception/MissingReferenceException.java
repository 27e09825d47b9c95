package com.phillippitts.transcripteval.exception;

/**
 * Thrown when the ground-truth folder does not contain exactly one reference transcript.
 * This is fatal to the whole run: without a single reference no comparison is possible.
 */
public class MissingReferenceException extends TranscriptEvalException {

    private final String directory;
    private final int foundCount;

    public MissingReferenceException(String directory, int foundCount) {
        super("Expected exactly one ground-truth transcript in " + directory + ", found " + foundCount);
        this.directory = directory;
        this.foundCount = foundCount;
    }

    public String getDirectory() {
        return directory;
    }

    public int getFoundCount() {
        return foundCount;
    }
}

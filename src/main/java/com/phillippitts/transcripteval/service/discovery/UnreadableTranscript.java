package com.phillippitts.transcripteval.service.discovery;

import java.util.Objects;

/**
 * A hypothesis file that was found but could not be loaded.
 *
 * @param name     display name (file name without extension)
 * @param fileName file name
 * @param path     path of the file
 * @param reason   why loading failed
 */
public record UnreadableTranscript(String name, String fileName, String path, String reason) {

    public UnreadableTranscript {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(reason, "reason");
    }
}

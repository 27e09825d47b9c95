package com.phillippitts.transcripteval.domain;

import java.util.Objects;

/**
 * A transcript already loaded into memory.
 *
 * @param name     display name (file stem)
 * @param fileName file name including extension, used to look up performance data
 * @param path     source path as discovered
 * @param text     raw text, trimmed
 */
public record Transcript(String name, String fileName, String path, String text) {

    public Transcript {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(text, "text");
    }
}

package com.phillippitts.transcripteval.service.text;

import java.util.Objects;

/**
 * Settings for {@link TextNormalizer}.
 *
 * @param punctuation characters removed before tokenization (empty by default)
 * @param asciiFold   decompose (NFKD) and drop non-ASCII characters, e.g. "café" becomes "cafe"
 */
public record NormalizationOptions(String punctuation, boolean asciiFold) {

    public NormalizationOptions {
        Objects.requireNonNull(punctuation, "punctuation");
    }

    public static NormalizationOptions defaults() {
        return new NormalizationOptions("", false);
    }
}

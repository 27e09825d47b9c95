package com.phillippitts.transcripteval.service.text;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw transcript text before comparison.
 *
 * <p>Rules, applied in order:
 * <ol>
 *   <li>Lower-case with {@link Locale#ROOT}</li>
 *   <li>Optional ASCII folding (NFKD, then non-ASCII removed)</li>
 *   <li>Removal of the configured punctuation characters</li>
 *   <li>Whitespace runs (Unicode-aware) collapsed to one space, then trimmed</li>
 * </ol>
 *
 * <p>Pure and thread-safe.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NON_ASCII = Pattern.compile("[^\\p{ASCII}]");

    private final NormalizationOptions options;

    public TextNormalizer(NormalizationOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Normalizes raw text.
     *
     * @param raw input text (null treated as empty)
     * @return normalized text
     */
    public NormalizedText normalize(String raw) {
        if (raw == null || raw.isEmpty()) {
            return NormalizedText.EMPTY;
        }
        String text = raw.toLowerCase(Locale.ROOT);
        if (options.asciiFold()) {
            text = NON_ASCII.matcher(Normalizer.normalize(text, Normalizer.Form.NFKD)).replaceAll("");
        }
        text = stripPunctuation(text);
        text = WHITESPACE.matcher(text).replaceAll(" ").strip();
        return text.isEmpty() ? NormalizedText.EMPTY : new NormalizedText(text);
    }

    private String stripPunctuation(String text) {
        String punctuation = options.punctuation();
        if (punctuation.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        text.codePoints()
                .filter(cp -> punctuation.indexOf(cp) < 0)
                .forEach(sb::appendCodePoint);
        return sb.toString();
    }
}

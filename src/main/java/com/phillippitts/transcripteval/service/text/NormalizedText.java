package com.phillippitts.transcripteval.service.text;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Canonical text shared by every metric so error rates and similarity see the same input.
 *
 * <p>Instances come from {@link TextNormalizer}. The text is lower-cased, single-space
 * separated and trimmed. Spaces stay in the character view: CER counts a missing space like
 * any other missing character.
 *
 * @param text normalized text (never null, may be empty)
 * @throws IllegalArgumentException if the text has leading, trailing, repeated or non-space whitespace
 */
public record NormalizedText(String text) {

    private static final Pattern NON_CANONICAL_SPACING =
            Pattern.compile("^ | $|  |[^\\S ]", Pattern.UNICODE_CHARACTER_CLASS);

    public static final NormalizedText EMPTY = new NormalizedText("");

    public NormalizedText {
        Objects.requireNonNull(text, "text");
        if (NON_CANONICAL_SPACING.matcher(text).find()) {
            throw new IllegalArgumentException("text is not normalized: '" + text + "'");
        }
    }

    /**
     * Word tokens for WER and similarity.
     *
     * @return immutable list of tokens, empty for empty text
     */
    public List<String> words() {
        if (text.isEmpty()) {
            return List.of();
        }
        return List.of(text.split(" "));
    }

    /**
     * Characters (as code points) for CER, spaces included.
     *
     * @return immutable list of code points
     */
    public List<Integer> characters() {
        return text.codePoints().boxed().collect(Collectors.toUnmodifiableList());
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}

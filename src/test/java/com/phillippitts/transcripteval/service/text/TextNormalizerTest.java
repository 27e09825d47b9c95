package com.phillippitts.transcripteval.service.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextNormalizerTest {

    private final TextNormalizer normalizer = new TextNormalizer(NormalizationOptions.defaults());

    @Test
    void shouldLowerCaseAndCollapseWhitespace() {
        NormalizedText text = normalizer.normalize("  The   Weather\tIS\n nice ");

        assertThat(text.text()).isEqualTo("the weather is nice");
        assertThat(text.words()).containsExactly("the", "weather", "is", "nice");
    }

    @Test
    void shouldCollapseUnicodeWhitespace() {
        NormalizedText text = normalizer.normalize("hello  world");

        assertThat(text.text()).isEqualTo("hello world");
    }

    @Test
    void shouldKeepPunctuationByDefault() {
        assertThat(normalizer.normalize("Hello, world!").text()).isEqualTo("hello, world!");
    }

    @Test
    void shouldStripConfiguredPunctuation() {
        TextNormalizer stripping = new TextNormalizer(new NormalizationOptions(".,!?", false));

        assertThat(stripping.normalize("Hello, world! How are you?").text()).isEqualTo("hello world how are you");
    }

    @Test
    void shouldNotLeaveDoubleSpacesWhenPunctuationIsAToken() {
        TextNormalizer stripping = new TextNormalizer(new NormalizationOptions("-", false));

        assertThat(stripping.normalize("yes - no").words()).containsExactly("yes", "no");
    }

    @Test
    void shouldFoldAccentsWhenEnabled() {
        TextNormalizer folding = new TextNormalizer(new NormalizationOptions("", true));

        assertThat(folding.normalize("Café Naïve").text()).isEqualTo("cafe naive");
        assertThat(normalizer.normalize("Café").text()).isEqualTo("café");
    }

    @Test
    void shouldTreatNullAndBlankAsEmpty() {
        assertThat(normalizer.normalize(null)).isEqualTo(NormalizedText.EMPTY);
        assertThat(normalizer.normalize(" \t\n ").isEmpty()).isTrue();
        assertThat(NormalizedText.EMPTY.words()).isEmpty();
        assertThat(NormalizedText.EMPTY.characters()).isEmpty();
    }

    @Test
    void shouldKeepSpacesInCharacterView() {
        NormalizedText text = normalizer.normalize("ab c");

        assertThat(text.characters()).containsExactly((int) 'a', (int) 'b', (int) ' ', (int) 'c');
    }

    @Test
    void shouldCountSupplementaryCharactersOnce() {
        NormalizedText text = normalizer.normalize("a😀");

        assertThat(text.characters()).hasSize(2);
    }

    @Test
    void shouldBeIdempotent() {
        NormalizedText once = normalizer.normalize("  Mixed   CASE\ttext ");
        NormalizedText twice = normalizer.normalize(once.text());

        assertThat(twice).isEqualTo(once);
    }

    @Test
    void normalizedTextShouldRejectNonCanonicalSpacing() {
        assertThatThrownBy(() -> new NormalizedText(" a"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not normalized");
        assertThatThrownBy(() -> new NormalizedText("a "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new NormalizedText("a  b"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new NormalizedText("a\tb"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new NormalizedText("a\u00A0b"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void normalizedTextShouldAcceptNormalizerOutput() {
        NormalizedText text = new NormalizedText(normalizer.normalize(" \u00A0Hello\t World ").text());

        assertThat(text.words()).containsExactly("hello", "world");
    }
}

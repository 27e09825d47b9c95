package com.phillippitts.transcripteval.service.similarity;

import com.phillippitts.transcripteval.service.alignment.EditDistanceEngine;
import com.phillippitts.transcripteval.service.text.NormalizedText;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class LexicalSimilarityTest {

    private final LexicalSimilarity similarity = new LexicalSimilarity(new EditDistanceEngine());

    private static NormalizedText text(String s) {
        return new NormalizedText(s);
    }

    @Test
    void levenshteinShouldNormalizeByLongerText() {
        assertThat(similarity.levenshtein(text("colour"), text("color"))).isCloseTo(5.0 / 6.0, within(1e-12));
    }

    @Test
    void levenshteinOfTwoEmptyTextsShouldBeOne() {
        assertThat(similarity.levenshtein(NormalizedText.EMPTY, NormalizedText.EMPTY)).isEqualTo(1.0);
        assertThat(similarity.levenshtein(NormalizedText.EMPTY, text("abc"))).isZero();
    }

    @Test
    void jaccardShouldUseWordSets() {
        // {the, cat, sat} vs {the, cat, ran}: 2 shared of 4
        assertThat(similarity.jaccard(text("the cat sat"), text("the cat ran the"))).isEqualTo(0.5);
    }

    @Test
    void jaccardShouldHandleEmptyTexts() {
        assertThat(similarity.jaccard(NormalizedText.EMPTY, NormalizedText.EMPTY)).isEqualTo(1.0);
        assertThat(similarity.jaccard(NormalizedText.EMPTY, text("word"))).isZero();
        assertThat(similarity.jaccard(text("word"), NormalizedText.EMPTY)).isZero();
    }
}

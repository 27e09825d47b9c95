package com.phillippitts.transcripteval.service.similarity;

import com.phillippitts.transcripteval.service.alignment.EditDistanceEngine;
import com.phillippitts.transcripteval.service.text.NormalizedText;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Informational surface-similarity scores reported next to the gated metrics.
 *
 * <ul>
 *   <li>Levenshtein similarity = 1 - charDistance / max(len(ref), len(hyp))</li>
 *   <li>Jaccard similarity = |A ∩ B| / |A ∪ B| over the word sets</li>
 * </ul>
 */
@Component
public class LexicalSimilarity {

    private final EditDistanceEngine engine;

    public LexicalSimilarity(EditDistanceEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * Normalized character-level Levenshtein similarity.
     *
     * @return similarity in [0, 1]; 1.0 when both texts are empty
     */
    public double levenshtein(NormalizedText reference, NormalizedText hypothesis) {
        List<Integer> ref = reference.characters();
        List<Integer> hyp = hypothesis.characters();
        int maxLength = Math.max(ref.size(), hyp.size());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - engine.distance(ref, hyp) / (double) maxLength;
    }

    /**
     * Jaccard similarity of the word sets.
     *
     * @return similarity in [0, 1]; 1.0 when both are empty, 0.0 when exactly one is
     */
    public double jaccard(NormalizedText reference, NormalizedText hypothesis) {
        Set<String> ref = new HashSet<>(reference.words());
        Set<String> hyp = new HashSet<>(hypothesis.words());
        if (ref.isEmpty() && hyp.isEmpty()) {
            return 1.0;
        }
        if (ref.isEmpty() || hyp.isEmpty()) {
            return 0.0;
        }

        Set<String> union = new HashSet<>(ref);
        union.addAll(hyp);
        ref.retainAll(hyp); // intersection
        return ref.size() / (double) union.size();
    }
}

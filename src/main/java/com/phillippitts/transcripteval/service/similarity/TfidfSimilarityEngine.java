package com.phillippitts.transcripteval.service.similarity;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Cosine similarity of TF-IDF vectors built from two token sequences.
 *
 * <p>Weighting:
 * <ul>
 *   <li>tf(t, d) = raw count of t in d</li>
 *   <li>idf(t) = ln((1 + N) / (1 + df(t))) + 1, smoothed, N = number of corpus documents</li>
 * </ul>
 *
 * <p>The vocabulary is the union of tokens of the two compared documents, iterated in
 * sorted order so floating-point sums are reproducible. Unless a corpus is supplied the
 * corpus is exactly the two documents (N = 2).
 *
 * <p>Returns 0.0 when either vector is the zero vector. Result is clamped to [0, 1].
 */
@Component
public class TfidfSimilarityEngine {

    /**
     * Similarity over the two-document corpus.
     *
     * @param reference reference tokens
     * @param hypothesis hypothesis tokens
     * @return cosine similarity in [0, 1]
     */
    public double similarity(List<String> reference, List<String> hypothesis) {
        return similarity(reference, hypothesis, List.of(reference, hypothesis));
    }

    /**
     * Similarity with document frequencies taken from a caller-supplied corpus.
     *
     * @param reference reference tokens
     * @param hypothesis hypothesis tokens
     * @param corpus documents used for document frequencies (must not be empty)
     * @return cosine similarity in [0, 1]
     */
    public double similarity(List<String> reference, List<String> hypothesis, List<List<String>> corpus) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(hypothesis, "hypothesis");
        Objects.requireNonNull(corpus, "corpus");
        if (corpus.isEmpty()) {
            throw new IllegalArgumentException("corpus must contain at least one document");
        }

        Map<String, Integer> tfRef = termCounts(reference);
        Map<String, Integer> tfHyp = termCounts(hypothesis);
        if (tfRef.isEmpty() || tfHyp.isEmpty()) {
            return 0.0;
        }

        SortedSet<String> vocabulary = new TreeSet<>(tfRef.keySet());
        vocabulary.addAll(tfHyp.keySet());
        List<Set<String>> documents = corpus.stream().<Set<String>>map(HashSet::new).toList();
        int n = documents.size();

        double dot = 0.0;
        double normRef = 0.0;
        double normHyp = 0.0;
        for (String term : vocabulary) {
            double idf = idf(term, documents, n);
            double a = tfRef.getOrDefault(term, 0) * idf;
            double b = tfHyp.getOrDefault(term, 0) * idf;
            dot += a * b;
            normRef += a * a;
            normHyp += b * b;
        }

        if (normRef == 0.0 || normHyp == 0.0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(normRef) * Math.sqrt(normHyp));
        return Math.max(0.0, Math.min(1.0, cosine));
    }

    private static double idf(String term, List<Set<String>> documents, int n) {
        int df = 0;
        for (Set<String> doc : documents) {
            if (doc.contains(term)) {
                df++;
            }
        }
        return Math.log((1.0 + n) / (1.0 + df)) + 1.0;
    }

    private static Map<String, Integer> termCounts(List<String> tokens) {
        Map<String, Integer> counts = new TreeMap<>();
        for (String token : tokens) {
            if (token != null && !token.isEmpty()) {
                counts.merge(token, 1, Integer::sum);
            }
        }
        return counts;
    }
}

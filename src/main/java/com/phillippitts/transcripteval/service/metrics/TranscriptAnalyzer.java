package com.phillippitts.transcripteval.service.metrics;

import com.phillippitts.transcripteval.domain.MetricName;
import com.phillippitts.transcripteval.domain.MetricSnapshot;
import com.phillippitts.transcripteval.exception.UndefinedMetricException;
import com.phillippitts.transcripteval.service.similarity.LexicalSimilarity;
import com.phillippitts.transcripteval.service.similarity.TfidfSimilarityEngine;
import com.phillippitts.transcripteval.service.text.NormalizedText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.DoubleSupplier;

/**
 * Computes every text metric for a normalized reference/hypothesis pair.
 *
 * <p>A metric that the input makes undefined is left out of the values and listed in
 * {@link MetricSnapshot#undefinedMetrics()}; the remaining metrics are still computed.
 */
@Component
public class TranscriptAnalyzer {

    private static final Logger LOG = LogManager.getLogger(TranscriptAnalyzer.class);

    private final ErrorRateCalculator errorRates;
    private final TfidfSimilarityEngine tfidf;
    private final LexicalSimilarity lexical;

    public TranscriptAnalyzer(ErrorRateCalculator errorRates,
                              TfidfSimilarityEngine tfidf,
                              LexicalSimilarity lexical) {
        this.errorRates = Objects.requireNonNull(errorRates, "errorRates");
        this.tfidf = Objects.requireNonNull(tfidf, "tfidf");
        this.lexical = Objects.requireNonNull(lexical, "lexical");
    }

    /**
     * Computes all text metrics.
     *
     * @param reference normalized ground truth
     * @param hypothesis normalized hypothesis
     * @return snapshot without performance data
     */
    public MetricSnapshot analyze(NormalizedText reference, NormalizedText hypothesis) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(hypothesis, "hypothesis");

        Map<MetricName, Double> values = new EnumMap<>(MetricName.class);
        Set<MetricName> undefined = EnumSet.noneOf(MetricName.class);

        values.put(MetricName.TFIDF_SIMILARITY, tfidf.similarity(reference.words(), hypothesis.words()));
        compute(MetricName.WORD_ERROR_RATE, () -> errorRates.wordErrorRate(reference, hypothesis),
                values, undefined);
        compute(MetricName.CHARACTER_ERROR_RATE, () -> errorRates.characterErrorRate(reference, hypothesis),
                values, undefined);
        values.put(MetricName.LEVENSHTEIN_SIMILARITY, lexical.levenshtein(reference, hypothesis));
        values.put(MetricName.JACCARD_SIMILARITY, lexical.jaccard(reference, hypothesis));

        return new MetricSnapshot(values, undefined, false);
    }

    private static void compute(MetricName metric, DoubleSupplier supplier,
                                Map<MetricName, Double> values, Set<MetricName> undefined) {
        try {
            values.put(metric, supplier.getAsDouble());
        } catch (UndefinedMetricException e) {
            LOG.warn("{} not evaluated: {}", metric.key(), e.getMessage());
            undefined.add(metric);
        }
    }
}

package com.phillippitts.transcripteval.service.evaluation;

import com.phillippitts.transcripteval.domain.EvaluationRecord;
import com.phillippitts.transcripteval.domain.MetricSnapshot;
import com.phillippitts.transcripteval.domain.PerformanceRecord;
import com.phillippitts.transcripteval.domain.ThresholdSet;
import com.phillippitts.transcripteval.domain.Transcript;
import com.phillippitts.transcripteval.domain.TranscriptorInfo;
import com.phillippitts.transcripteval.exception.MissingPerformanceDataException;
import com.phillippitts.transcripteval.service.metrics.EvaluationMetricsPublisher;
import com.phillippitts.transcripteval.service.metrics.TranscriptAnalyzer;
import com.phillippitts.transcripteval.service.performance.PerformanceAggregator;
import com.phillippitts.transcripteval.service.performance.PerformanceMetadata;
import com.phillippitts.transcripteval.service.text.NormalizedText;
import com.phillippitts.transcripteval.service.text.TextNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.Map;
import java.util.Objects;

/**
 * Evaluates a single hypothesis transcript against the ground truth.
 *
 * <p>Pipeline: normalize both texts, compute text metrics, attach performance data
 * (or flag it as missing), then gate everything against the thresholds.
 *
 * <p>Thread-safe: holds only immutable collaborators and the read-only {@link ThresholdSet}.
 * The transcript name is put into the Log4j2 ThreadContext under {@value #MDC_TRANSCRIPT}
 * while the evaluation runs.
 */
public class TranscriptEvaluationService {

    private static final Logger LOG = LogManager.getLogger(TranscriptEvaluationService.class);

    static final String MDC_TRANSCRIPT = "transcript";

    private final TextNormalizer normalizer;
    private final TranscriptAnalyzer analyzer;
    private final PerformanceAggregator performance;
    private final ThresholdEvaluator evaluator;
    private final ThresholdSet thresholds;
    private final TranscriptorInfo transcriptor;
    private final EvaluationMetricsPublisher metricsPublisher;

    /**
     * Computation collaborators (parameter object).
     */
    public record Collaborators(TextNormalizer normalizer,
                                TranscriptAnalyzer analyzer,
                                PerformanceAggregator performance,
                                ThresholdEvaluator evaluator) {
        public Collaborators {
            Objects.requireNonNull(normalizer, "normalizer");
            Objects.requireNonNull(analyzer, "analyzer");
            Objects.requireNonNull(performance, "performance");
            Objects.requireNonNull(evaluator, "evaluator");
        }
    }

    public TranscriptEvaluationService(Collaborators collaborators,
                                       ThresholdSet thresholds,
                                       TranscriptorInfo transcriptor,
                                       EvaluationMetricsPublisher metricsPublisher) {
        Objects.requireNonNull(collaborators, "collaborators");
        this.normalizer = collaborators.normalizer();
        this.analyzer = collaborators.analyzer();
        this.performance = collaborators.performance();
        this.evaluator = collaborators.evaluator();
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
        this.transcriptor = transcriptor;
        this.metricsPublisher = Objects.requireNonNull(metricsPublisher, "metricsPublisher");
    }

    /**
     * Evaluates one hypothesis.
     *
     * @param reference ground-truth transcript
     * @param hypothesis transcript under evaluation
     * @param latencyMap performance metadata keyed by hypothesis file name (may be empty)
     * @return the evaluation record
     */
    public EvaluationRecord evaluate(Transcript reference,
                                     Transcript hypothesis,
                                     Map<String, PerformanceMetadata> latencyMap) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(hypothesis, "hypothesis");

        long startTime = System.nanoTime();
        ThreadContext.put(MDC_TRANSCRIPT, hypothesis.name());
        try {
            NormalizedText ref = normalizer.normalize(reference.text());
            NormalizedText hyp = normalizer.normalize(hypothesis.text());

            MetricSnapshot snapshot = withPerformance(analyzer.analyze(ref, hyp), hypothesis, latencyMap);
            EvaluationRecord record = evaluator.evaluate(reference, hypothesis, snapshot, thresholds, transcriptor);

            long duration = System.nanoTime() - startTime;
            metricsPublisher.recordEvaluation(record, duration);
            LOG.info("Evaluated {}: status={}, passed={}/{}, duration={}ms",
                    hypothesis.name(), record.status(), record.passedMetrics(), record.totalMetrics(),
                    duration / 1_000_000L);
            return record;
        } finally {
            ThreadContext.remove(MDC_TRANSCRIPT);
        }
    }

    /**
     * Builds the record of a transcript that could not be read or evaluated.
     *
     * @param reference ground-truth transcript
     * @param name hypothesis display name
     * @param hypothesisPath hypothesis path
     * @param reason failure reason shown in the report
     * @return a record with status ERROR
     */
    public EvaluationRecord failed(Transcript reference, String name, String hypothesisPath, String reason) {
        Objects.requireNonNull(reference, "reference");
        EvaluationRecord record = EvaluationRecord.failed(name, reference.path(), hypothesisPath,
                thresholds, transcriptor, reason);
        metricsPublisher.recordEvaluation(record, 0L);
        return record;
    }

    private MetricSnapshot withPerformance(MetricSnapshot snapshot,
                                           Transcript hypothesis,
                                           Map<String, PerformanceMetadata> latencyMap) {
        try {
            PerformanceRecord record = performance.resolve(hypothesis.fileName(), latencyMap);
            if (!record.hasRtf()) {
                LOG.debug("No RTF for {}: RTF not evaluated", hypothesis.fileName());
            }
            return snapshot.withPerformance(record);
        } catch (MissingPerformanceDataException e) {
            LOG.warn("{}; latency and RTF not evaluated", e.getMessage());
            return snapshot.withMissingPerformanceData();
        }
    }

    public ThresholdSet getThresholds() {
        return thresholds;
    }

    public TranscriptorInfo getTranscriptor() {
        return transcriptor;
    }
}

package com.phillippitts.transcripteval.service.evaluation;

import com.phillippitts.transcripteval.domain.EvaluationRecord;
import com.phillippitts.transcripteval.domain.EvaluationStatus;
import com.phillippitts.transcripteval.domain.MetricName;
import com.phillippitts.transcripteval.domain.ThresholdSet;
import com.phillippitts.transcripteval.domain.Transcript;
import com.phillippitts.transcripteval.domain.TranscriptorInfo;
import com.phillippitts.transcripteval.service.metrics.EvaluationMetrics;
import com.phillippitts.transcripteval.service.metrics.EvaluationMetricsPublisher;
import com.phillippitts.transcripteval.service.performance.PerformanceMetadata;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.phillippitts.transcripteval.testutil.TranscriptFixtures.REFERENCE_TEXT;
import static com.phillippitts.transcripteval.testutil.TranscriptFixtures.collaborators;
import static com.phillippitts.transcripteval.testutil.TranscriptFixtures.hypothesis;
import static com.phillippitts.transcripteval.testutil.TranscriptFixtures.reference;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TranscriptEvaluationServiceTest {

    private static final TranscriptorInfo TRANSCRIPTOR = new TranscriptorInfo("whisper", "1.2", "ci");

    private final Transcript reference = reference(REFERENCE_TEXT);
    private final Transcript hypothesis = hypothesis("engine", "The weather   nice today");
    private final Map<String, PerformanceMetadata> latency =
            Map.of("engine.txt", new PerformanceMetadata.DetailedLatency(650.0, null));

    private TranscriptEvaluationService service(EvaluationMetricsPublisher publisher) {
        return new TranscriptEvaluationService(collaborators(), ThresholdSet.defaults(), TRANSCRIPTOR, publisher);
    }

    @Test
    void shouldEvaluateAgainstDefaults() {
        EvaluationRecord record = service(EvaluationMetricsPublisher.NOOP).evaluate(reference, hypothesis, latency);

        assertThat(record.metrics().get(MetricName.WORD_ERROR_RATE)).isCloseTo(0.2, within(1e-12));
        assertThat(record.metrics().get(MetricName.CHARACTER_ERROR_RATE)).isCloseTo(0.12, within(1e-12));
        assertThat(record.metrics()).containsEntry(MetricName.LATENCY_MS, 650.0);
        assertThat(record.evaluations())
                .containsEntry(MetricName.TFIDF_SIMILARITY, true)
                .containsEntry(MetricName.WORD_ERROR_RATE, false)
                .containsEntry(MetricName.CHARACTER_ERROR_RATE, false)
                .containsEntry(MetricName.LATENCY_MS, true)
                .doesNotContainKey(MetricName.RTF);
        assertThat(record.passedMetrics()).isEqualTo(2);
        assertThat(record.totalMetrics()).isEqualTo(4);
        assertThat(record.status()).isEqualTo(EvaluationStatus.FAILED);
        assertThat(record.transcriptor()).isEqualTo(TRANSCRIPTOR);
    }

    @Test
    void repeatedEvaluationShouldYieldEqualRecords() {
        TranscriptEvaluationService service = service(EvaluationMetricsPublisher.NOOP);

        EvaluationRecord first = service.evaluate(reference, hypothesis, latency);
        EvaluationRecord second = service.evaluate(reference, hypothesis, latency);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void missingLatencyEntryShouldDegradeNotFail() {
        EvaluationRecord record = service(EvaluationMetricsPublisher.NOOP).evaluate(reference, hypothesis, Map.of());

        assertThat(record.missingPerformanceData()).isTrue();
        assertThat(record.metrics()).doesNotContainKeys(MetricName.LATENCY_MS, MetricName.RTF);
        assertThat(record.totalMetrics()).isEqualTo(3);
    }

    @Test
    void emptyReferenceShouldStillEvaluateSimilarity() {
        EvaluationRecord record = service(EvaluationMetricsPublisher.NOOP)
                .evaluate(reference(""), hypothesis, latency);

        assertThat(record.undefinedMetrics())
                .containsExactlyInAnyOrder(MetricName.WORD_ERROR_RATE, MetricName.CHARACTER_ERROR_RATE);
        assertThat(record.evaluations()).containsEntry(MetricName.TFIDF_SIMILARITY, false);
        assertThat(record.status()).isEqualTo(EvaluationStatus.FAILED);
    }

    @Test
    void shouldClearTranscriptContextAfterEvaluation() {
        service(EvaluationMetricsPublisher.NOOP).evaluate(reference, hypothesis, latency);

        assertThat(ThreadContext.get(TranscriptEvaluationService.MDC_TRANSCRIPT)).isNull();
    }

    @Test
    void shouldPublishMetrics() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        service(new EvaluationMetricsPublisher(new EvaluationMetrics(registry))).evaluate(reference, hypothesis, latency);

        assertThat(registry.find("transcripteval.evaluation.outcome").tag("status", "failed").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("transcripteval.evaluation.metric.failure")
                .tag("metric", "word_error_rate").counter().count()).isEqualTo(1.0);
    }
}

package com.phillippitts.transcripteval.service.evaluation;

import com.phillippitts.transcripteval.domain.EvaluationRecord;
import com.phillippitts.transcripteval.domain.Transcript;
import com.phillippitts.transcripteval.exception.EvaluationException;
import com.phillippitts.transcripteval.service.discovery.DiscoveredTranscripts;
import com.phillippitts.transcripteval.service.discovery.UnreadableTranscript;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Evaluates all hypotheses of a run concurrently on the provided Executor.
 *
 * <p>Transcripts are independent, so each one is a separate task; results are returned in
 * file-name order regardless of completion order, and output is identical to a sequential run.
 *
 * <p>Error handling: a failing task or an unreadable hypothesis yields an ERROR record for that
 * transcript only. A run-level timeout is translated to {@link EvaluationException}, which
 * aborts the run.
 */
public class ParallelEvaluationService {

    private static final Logger LOG = LogManager.getLogger(ParallelEvaluationService.class);

    private final TranscriptEvaluationService evaluationService;
    private final Executor executor;

    public ParallelEvaluationService(TranscriptEvaluationService evaluationService, Executor executor) {
        this.evaluationService = Objects.requireNonNull(evaluationService, "evaluationService");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Evaluates every hypothesis against the ground truth.
     *
     * @param input discovered transcripts
     * @param timeout overall timeout for all evaluations
     * @return one record per hypothesis file, readable or not, sorted by file name
     * @throws EvaluationException if the timeout elapses
     */
    public List<EvaluationRecord> evaluateAll(DiscoveredTranscripts input, Duration timeout) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(timeout, "timeout");

        long startMs = System.currentTimeMillis();
        LOG.info("Starting evaluation of {} transcript(s): timeout={}ms", input.hypotheses().size(), timeout.toMillis());

        Map<String, CompletableFuture<EvaluationRecord>> byFileName = new TreeMap<>();
        for (Transcript hypothesis : input.hypotheses()) {
            byFileName.put(hypothesis.fileName(), CompletableFuture
                    .supplyAsync(() -> evaluationService.evaluate(input.groundTruth(), hypothesis, input.latencyMap()),
                            executor)
                    .exceptionally(ex -> recover(input, hypothesis, ex)));
        }
        for (UnreadableTranscript unreadable : input.unreadable()) {
            byFileName.put(unreadable.fileName(), CompletableFuture.completedFuture(evaluationService.failed(
                    input.groundTruth(), unreadable.name(), unreadable.path(), unreadable.reason())));
        }
        List<CompletableFuture<EvaluationRecord>> futures = new ArrayList<>(byFileName.values());

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .join();

            long durationMs = System.currentTimeMillis() - startMs;
            LOG.info("Evaluation completed: duration={}ms", durationMs);

            return futures.stream().map(CompletableFuture::join).toList();

        } catch (CompletionException e) {
            long durationMs = System.currentTimeMillis() - startMs;
            futures.forEach(f -> f.cancel(true));

            if (e.getCause() instanceof TimeoutException) {
                LOG.warn("Evaluation timed out after {}ms (limit: {}ms)", durationMs, timeout.toMillis());
                throw new EvaluationException("Evaluation timed out after " + durationMs + "ms", e);
            }

            LOG.error("Evaluation failed after {}ms: {}", durationMs, e.getMessage());
            throw new EvaluationException("Evaluation failed: " + e.getMessage(), e);
        }
    }

    private EvaluationRecord recover(DiscoveredTranscripts input, Transcript hypothesis, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        EvaluationException failure = new EvaluationException(
                "Evaluation failed: " + cause.getClass().getSimpleName() + ": " + cause.getMessage(),
                hypothesis.name(), cause);
        LOG.error(failure.getMessage(), failure);
        return evaluationService.failed(input.groundTruth(), failure.getTranscriptName(), hypothesis.path(),
                failure.getMessage());
    }
}

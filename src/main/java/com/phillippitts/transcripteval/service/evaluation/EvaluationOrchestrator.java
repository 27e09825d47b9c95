package com.phillippitts.transcripteval.service.evaluation;

import com.phillippitts.transcripteval.domain.EvaluationRecord;
import com.phillippitts.transcripteval.domain.EvaluationReport;
import com.phillippitts.transcripteval.service.discovery.DiscoveredTranscripts;
import com.phillippitts.transcripteval.service.discovery.TranscriptDiscoveryService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Runs one complete evaluation: discovery, then parallel evaluation, then report assembly.
 *
 * <p>Discovery failures propagate unchanged so that the run aborts before any transcript is
 * evaluated. Unreadable hypotheses are not discovery failures; they appear in the report as
 * ERROR records.
 */
public class EvaluationOrchestrator {

    private static final Logger LOG = LogManager.getLogger(EvaluationOrchestrator.class);

    private final TranscriptDiscoveryService discovery;
    private final ParallelEvaluationService parallel;
    private final TranscriptEvaluationService evaluationService;
    private final Duration timeout;

    public EvaluationOrchestrator(TranscriptDiscoveryService discovery,
                                  ParallelEvaluationService parallel,
                                  TranscriptEvaluationService evaluationService,
                                  Duration timeout) {
        this.discovery = Objects.requireNonNull(discovery, "discovery must not be null");
        this.parallel = Objects.requireNonNull(parallel, "parallel must not be null");
        this.evaluationService = Objects.requireNonNull(evaluationService, "evaluationService must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /**
     * Evaluates every transcript under a texts folder.
     *
     * @param textsDir folder to scan
     * @return the run report
     */
    public EvaluationReport run(Path textsDir) {
        DiscoveredTranscripts input = discovery.discover(textsDir);
        List<EvaluationRecord> records = parallel.evaluateAll(input, timeout);
        EvaluationReport report = new EvaluationReport(records,
                evaluationService.getThresholds(),
                evaluationService.getTranscriptor());
        LOG.info("Run finished: {}/{} transcript(s) passed", report.passedCount(), records.size());
        return report;
    }
}

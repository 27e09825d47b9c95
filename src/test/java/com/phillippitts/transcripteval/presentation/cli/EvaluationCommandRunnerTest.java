package com.phillippitts.transcripteval.presentation.cli;

import com.phillippitts.transcripteval.config.properties.EvaluationProperties;
import com.phillippitts.transcripteval.domain.EvaluationRecord;
import com.phillippitts.transcripteval.domain.EvaluationReport;
import com.phillippitts.transcripteval.domain.EvaluationStatus;
import com.phillippitts.transcripteval.domain.MetricName;
import com.phillippitts.transcripteval.domain.ThresholdSet;
import com.phillippitts.transcripteval.exception.EvaluationException;
import com.phillippitts.transcripteval.exception.MissingReferenceException;
import com.phillippitts.transcripteval.exception.TranscriptEvalException;
import com.phillippitts.transcripteval.service.evaluation.EvaluationOrchestrator;
import com.phillippitts.transcripteval.service.report.ConsoleReportPrinter;
import com.phillippitts.transcripteval.service.report.JsonReportWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EvaluationCommandRunnerTest {

    private EvaluationOrchestrator orchestrator;
    private ConsoleReportPrinter printer;
    private JsonReportWriter jsonWriter;

    @BeforeEach
    void setUp() {
        orchestrator = mock(EvaluationOrchestrator.class);
        printer = mock(ConsoleReportPrinter.class);
        jsonWriter = mock(JsonReportWriter.class);
    }

    private static EvaluationReport reportWith(EvaluationStatus status) {
        int passed = status == EvaluationStatus.PASSED ? 1 : 0;
        int total = status == EvaluationStatus.NOT_EVALUABLE ? 0 : 1;
        Map<MetricName, Boolean> evaluations = total == 0
                ? Map.of()
                : Map.of(MetricName.WORD_ERROR_RATE, status == EvaluationStatus.PASSED);
        EvaluationRecord record = new EvaluationRecord("engine", "gt/ref.txt", "engine.txt",
                Map.of(MetricName.WORD_ERROR_RATE, 0.1), evaluations, ThresholdSet.defaults(), null,
                passed, total, status, false, Set.of());
        return new EvaluationReport(List.of(record), ThresholdSet.defaults(), null);
    }

    private EvaluationCommandRunner runner(String reportFile) {
        EvaluationProperties properties = new EvaluationProperties("texts", null, null, reportFile, null, null);
        return new EvaluationCommandRunner(orchestrator, printer, jsonWriter, properties);
    }

    @Test
    void allPassedShouldExitZero() {
        EvaluationReport report = reportWith(EvaluationStatus.PASSED);
        when(orchestrator.run(Path.of("texts"))).thenReturn(report);
        EvaluationCommandRunner runner = runner(null);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_PASSED);
        verify(printer).print(report);
        verify(jsonWriter, never()).write(any(), any());
    }

    @Test
    void failedTranscriptShouldExitOne() {
        when(orchestrator.run(any())).thenReturn(reportWith(EvaluationStatus.FAILED));
        EvaluationCommandRunner runner = runner(null);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_FAILED);
    }

    @Test
    void notEvaluableTranscriptShouldExitOne() {
        when(orchestrator.run(any())).thenReturn(reportWith(EvaluationStatus.NOT_EVALUABLE));
        EvaluationCommandRunner runner = runner(null);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_FAILED);
    }

    @Test
    void erroredTranscriptShouldExitOneAndStillReport() {
        EvaluationRecord passed = reportWith(EvaluationStatus.PASSED).records().get(0);
        EvaluationRecord errored = EvaluationRecord.failed("broken", "gt/ref.txt", "broken.txt",
                ThresholdSet.defaults(), null, "Cannot read transcript");
        EvaluationReport report = new EvaluationReport(List.of(passed, errored), ThresholdSet.defaults(), null);
        when(orchestrator.run(any())).thenReturn(report);
        EvaluationCommandRunner runner = runner(null);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_FAILED);
        verify(printer).print(report);
    }

    @Test
    void discoveryFailureShouldExitTwo() {
        when(orchestrator.run(any())).thenThrow(new MissingReferenceException("texts/gt", 0));
        EvaluationCommandRunner runner = runner(null);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_ABORTED);
        verify(printer, never()).print(any());
    }

    @Test
    void timeoutShouldExitTwo() {
        when(orchestrator.run(any())).thenThrow(new EvaluationException("Evaluation timed out after 5000ms"));
        EvaluationCommandRunner runner = runner(null);

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_ABORTED);
    }

    @Test
    void positionalArgumentShouldOverrideTextsDir() {
        when(orchestrator.run(Path.of("other"))).thenReturn(reportWith(EvaluationStatus.PASSED));
        EvaluationCommandRunner runner = runner(null);

        runner.run(new DefaultApplicationArguments("other"));

        verify(orchestrator).run(Path.of("other"));
    }

    @Test
    void shouldWriteJsonReportWhenConfigured() {
        EvaluationReport report = reportWith(EvaluationStatus.PASSED);
        when(orchestrator.run(any())).thenReturn(report);
        EvaluationCommandRunner runner = runner("reports/out.json");

        runner.run(new DefaultApplicationArguments());

        verify(jsonWriter).write(report, Path.of("reports/out.json"));
        assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_PASSED);
    }

    @Test
    void reportWriteFailureShouldExitTwo() {
        EvaluationReport report = reportWith(EvaluationStatus.PASSED);
        when(orchestrator.run(any())).thenReturn(report);
        doThrow(new TranscriptEvalException("disk full")).when(jsonWriter).write(any(), any());
        EvaluationCommandRunner runner = runner("reports/out.json");

        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(EvaluationCommandRunner.EXIT_ABORTED);
    }
}

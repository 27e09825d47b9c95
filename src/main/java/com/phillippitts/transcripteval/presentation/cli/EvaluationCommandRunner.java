package com.phillippitts.transcripteval.presentation.cli;

import com.phillippitts.transcripteval.config.properties.EvaluationProperties;
import com.phillippitts.transcripteval.domain.EvaluationReport;
import com.phillippitts.transcripteval.exception.TranscriptEvalException;
import com.phillippitts.transcripteval.service.evaluation.EvaluationOrchestrator;
import com.phillippitts.transcripteval.service.report.ConsoleReportPrinter;
import com.phillippitts.transcripteval.service.report.JsonReportWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs a single evaluation at start-up and maps its outcome to a process exit code.
 *
 * <p>The texts folder is the first positional argument, or {@code eval.texts-dir} when none
 * is given. Exit codes:
 * <ul>
 *   <li>{@value #EXIT_PASSED} - every transcript passed</li>
 *   <li>{@value #EXIT_FAILED} - at least one transcript failed or was not evaluable</li>
 *   <li>{@value #EXIT_ABORTED} - the run aborted (discovery, timeout, worker or report failure)</li>
 * </ul>
 *
 * <p>Disable with {@code eval.runner.enabled=false} (used by context tests).
 */
@Component
@ConditionalOnProperty(prefix = "eval.runner", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EvaluationCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LogManager.getLogger(EvaluationCommandRunner.class);

    public static final int EXIT_PASSED = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_ABORTED = 2;

    private final EvaluationOrchestrator orchestrator;
    private final ConsoleReportPrinter printer;
    private final JsonReportWriter jsonWriter;
    private final EvaluationProperties properties;

    private volatile int exitCode = EXIT_PASSED;

    public EvaluationCommandRunner(EvaluationOrchestrator orchestrator,
                                   ConsoleReportPrinter printer,
                                   JsonReportWriter jsonWriter,
                                   EvaluationProperties properties) {
        this.orchestrator = orchestrator;
        this.printer = printer;
        this.jsonWriter = jsonWriter;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        Path textsDir = resolveTextsDir(args);
        LOG.info("Evaluating transcripts in {}", textsDir.toAbsolutePath());
        try {
            EvaluationReport report = orchestrator.run(textsDir);
            printer.print(report);
            if (properties.hasReportFile()) {
                jsonWriter.write(report, Path.of(properties.getReportFile()));
            }
            exitCode = report.allPassed() ? EXIT_PASSED : EXIT_FAILED;
        } catch (TranscriptEvalException e) {
            LOG.error("Evaluation aborted: {}", e.getMessage(), e);
            exitCode = EXIT_ABORTED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private Path resolveTextsDir(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (!positional.isEmpty() && !positional.get(0).isBlank()) {
            return Path.of(positional.get(0));
        }
        return Path.of(properties.getTextsDir());
    }
}

package com.phillippitts.transcripteval.service.report;

import com.phillippitts.transcripteval.domain.EvaluationRecord;
import com.phillippitts.transcripteval.domain.EvaluationReport;
import com.phillippitts.transcripteval.domain.EvaluationStatus;
import com.phillippitts.transcripteval.domain.MetricName;
import com.phillippitts.transcripteval.domain.ThresholdSet;
import com.phillippitts.transcripteval.domain.TranscriptorInfo;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Prints a human-readable run report.
 *
 * <p>Every gated metric gets a line; a metric without value or threshold is shown as
 * {@code N/A} and marked not evaluated instead of failed.
 */
public class ConsoleReportPrinter {

    private static final String HEAVY_RULE = "=".repeat(80);
    private static final String LIGHT_RULE = "-".repeat(80);

    private static final Map<MetricName, String> LABELS = new EnumMap<>(MetricName.class);

    static {
        LABELS.put(MetricName.TFIDF_SIMILARITY, "TF-IDF Similarity:");
        LABELS.put(MetricName.WORD_ERROR_RATE, "Word Error Rate:");
        LABELS.put(MetricName.CHARACTER_ERROR_RATE, "Character Error Rate:");
        LABELS.put(MetricName.LATENCY_MS, "Latency (ms):");
        LABELS.put(MetricName.RTF, "Real-Time Factor:");
        LABELS.put(MetricName.LEVENSHTEIN_SIMILARITY, "Levenshtein Similarity:");
        LABELS.put(MetricName.JACCARD_SIMILARITY, "Jaccard Similarity:");
    }

    private final PrintStream out;

    public ConsoleReportPrinter(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void print(EvaluationReport report) {
        out.println(HEAVY_RULE);
        out.println("TRANSCRIPTION QUALITY METRICS REPORT");
        out.println(HEAVY_RULE);
        printTranscriptor(report.transcriptor());
        printThresholds(report.thresholds());

        for (EvaluationRecord record : report.records()) {
            printRecord(record);
        }

        out.println();
        out.println(HEAVY_RULE);
        out.printf(Locale.ROOT, "Summary: %d/%d transcript(s) passed -> overall pass: %s%n",
                report.passedCount(), report.records().size(), report.allPassed());
        out.println(HEAVY_RULE);
    }

    private void printTranscriptor(TranscriptorInfo transcriptor) {
        TranscriptorInfo info = transcriptor == null ? TranscriptorInfo.unknown() : transcriptor;
        out.println("Transcriptor Info:");
        out.println("  Name: " + info.name());
        out.println("  Version: " + info.version());
        out.println("  Environment: " + info.environment());
        out.println(LIGHT_RULE);
    }

    private void printThresholds(ThresholdSet thresholds) {
        out.println("Thresholds:");
        for (MetricName metric : MetricName.values()) {
            if (!metric.isGated()) {
                continue;
            }
            OptionalDouble limit = thresholds.limitFor(metric);
            out.println("  " + metric.thresholdKey() + ": "
                    + (limit.isPresent() ? String.valueOf(limit.getAsDouble()) : "none"));
        }
    }

    private void printRecord(EvaluationRecord record) {
        out.println();
        out.println(record.name() + " (" + Path.of(record.hypothesisPath()).getFileName() + ")");
        out.println(LIGHT_RULE);
        if (record.status() == EvaluationStatus.ERROR) {
            out.println("  Overall Result:          ERROR: " + record.error());
            return;
        }
        out.println("Metrics:");
        for (MetricName metric : MetricName.values()) {
            Double value = record.metrics().get(metric);
            String text = value == null ? "N/A" : String.format(Locale.ROOT, "%.3f", value);
            String line = String.format(Locale.ROOT, "  %-24s %s", LABELS.get(metric), text);
            if (metric.isGated()) {
                Boolean passed = record.evaluations().get(metric);
                line += passed == null ? "  -> not evaluated" : "  -> pass: " + passed;
            }
            out.println(line);
        }
        if (record.missingPerformanceData()) {
            out.println("  (no latency entry: latency and RTF not evaluated)");
        }
        for (MetricName undefined : record.undefinedMetrics()) {
            out.println("  (" + undefined.key() + " undefined for this input)");
        }
        out.println();
        if (record.status() == EvaluationStatus.NOT_EVALUABLE) {
            out.println("  Overall Result:          NOT EVALUABLE (no metric had both a value and a threshold)");
        } else {
            out.printf(Locale.ROOT, "  Overall Result:          pass: %s (%d/%d)%n",
                    record.overallPassed(), record.passedMetrics(), record.totalMetrics());
        }
    }
}

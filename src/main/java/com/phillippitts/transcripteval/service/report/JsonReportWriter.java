package com.phillippitts.transcripteval.service.report;

import com.phillippitts.transcripteval.domain.EvaluationRecord;
import com.phillippitts.transcripteval.domain.EvaluationReport;
import com.phillippitts.transcripteval.domain.MetricName;
import com.phillippitts.transcripteval.domain.ThresholdSet;
import com.phillippitts.transcripteval.domain.TranscriptorInfo;
import com.phillippitts.transcripteval.exception.TranscriptEvalException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes evaluation records to JSON with org.json.
 *
 * <p>One object per record:
 * <pre>
 * {
 *   "name": "...", "gt_path": "...", "hyp_path": "...",
 *   "metrics": {"tfidf_similarity": 0.9, "word_error_rate": 0.1, ...},
 *   "evaluations": {"tfidf_passed": true, "wer_passed": true, ...},
 *   "thresholds": {"wer_threshold": 0.15, ...},
 *   "transcriptor": {"name": "...", "version": "...", "environment": "..."},
 *   "passed_metrics": 3, "total_metrics": 3, "overall_passed": true,
 *   "status": "PASSED", "missing_performance_data": false, "undefined_metrics": []
 * }
 * </pre>
 *
 * <p>Records with status {@code ERROR} also carry an {@code "error"} key with the reason.
 */
public class JsonReportWriter {

    private static final Logger LOG = LogManager.getLogger(JsonReportWriter.class);

    private static final int INDENT = 2;

    /**
     * Renders the report as a JSON array of records.
     */
    public String toJson(EvaluationReport report) {
        Objects.requireNonNull(report, "report");
        JSONArray array = new JSONArray();
        for (EvaluationRecord record : report.records()) {
            array.put(toJson(record));
        }
        return array.toString(INDENT);
    }

    /**
     * Writes the rendered report to a file, creating parent folders as needed.
     *
     * @throws TranscriptEvalException if the file cannot be written
     */
    public void write(EvaluationReport report, Path file) {
        Objects.requireNonNull(file, "file");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, toJson(report), StandardCharsets.UTF_8);
            LOG.info("Wrote JSON report with {} record(s) to {}", report.records().size(), file);
        } catch (IOException e) {
            throw new TranscriptEvalException("Cannot write report to " + file, e);
        }
    }

    JSONObject toJson(EvaluationRecord record) {
        JSONObject json = new JSONObject();
        json.put("name", record.name());
        json.put("gt_path", record.groundTruthPath());
        json.put("hyp_path", record.hypothesisPath());

        JSONObject metrics = new JSONObject();
        for (Map.Entry<MetricName, Double> e : record.metrics().entrySet()) {
            metrics.put(e.getKey().key(), e.getValue().doubleValue());
        }
        json.put("metrics", metrics);

        JSONObject evaluations = new JSONObject();
        for (Map.Entry<MetricName, Boolean> e : record.evaluations().entrySet()) {
            evaluations.put(e.getKey().evaluationKey(), e.getValue().booleanValue());
        }
        json.put("evaluations", evaluations);

        json.put("thresholds", thresholdsJson(record.thresholds()));
        if (record.transcriptor() != null) {
            json.put("transcriptor", transcriptorJson(record.transcriptor()));
        }
        json.put("passed_metrics", record.passedMetrics());
        json.put("total_metrics", record.totalMetrics());
        json.put("overall_passed", record.overallPassed());
        json.put("status", record.status().name());
        json.put("missing_performance_data", record.missingPerformanceData());

        JSONArray undefined = new JSONArray();
        record.undefinedMetrics().forEach(m -> undefined.put(m.key()));
        json.put("undefined_metrics", undefined);
        if (record.error() != null) {
            json.put("error", record.error());
        }
        return json;
    }

    private static JSONObject thresholdsJson(ThresholdSet thresholds) {
        JSONObject json = new JSONObject();
        for (Map.Entry<MetricName, Double> e : thresholds.limits().entrySet()) {
            json.put(e.getKey().thresholdKey(), e.getValue().doubleValue());
        }
        return json;
    }

    private static JSONObject transcriptorJson(TranscriptorInfo info) {
        JSONObject json = new JSONObject();
        json.put("name", info.name());
        json.put("version", info.version());
        json.put("environment", info.environment());
        return json;
    }
}

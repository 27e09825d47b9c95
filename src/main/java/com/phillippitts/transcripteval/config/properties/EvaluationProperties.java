package com.phillippitts.transcripteval.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for an evaluation run.
 *
 * <p>Example application.properties:
 * <pre>
 * eval.texts-dir=texts
 * eval.ground-truth-dir=gt
 * eval.latency-file=latency.json
 * eval.report-file=reports/evaluation_report.json
 * eval.timeout=5m
 * eval.normalization.punctuation=.,;:!?"
 * eval.normalization.ascii-fold=false
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "eval")
public class EvaluationProperties {

    /** Folder holding hypothesis transcripts, the ground-truth sub-folder and the latency file. */
    @NotBlank
    private final String textsDir;

    /** Ground-truth sub-folder name inside the texts folder. */
    @NotBlank
    private final String groundTruthDir;

    /** Latency mapping file name inside the texts folder. */
    @NotBlank
    private final String latencyFile;

    /** Optional JSON report destination; no file is written when blank. */
    private final String reportFile;

    /** Overall timeout for evaluating all transcripts. */
    @NotNull
    private final Duration timeout;

    @NotNull
    private final Normalization normalization;

    /**
     * Text normalization settings.
     *
     * @param punctuation characters stripped before comparison (default none)
     * @param asciiFold   fold accented characters to ASCII (default false)
     */
    public record Normalization(String punctuation, Boolean asciiFold) {
        public Normalization {
            punctuation = punctuation == null ? "" : punctuation;
            asciiFold = asciiFold != null && asciiFold;
        }
    }

    @ConstructorBinding
    public EvaluationProperties(String textsDir, String groundTruthDir, String latencyFile,
                                String reportFile, Duration timeout, Normalization normalization) {
        this.textsDir = textsDir == null ? "texts" : textsDir;
        this.groundTruthDir = groundTruthDir == null ? "gt" : groundTruthDir;
        this.latencyFile = latencyFile == null ? "latency.json" : latencyFile;
        this.reportFile = reportFile;
        Duration t = timeout == null ? Duration.ofMinutes(5) : timeout;
        if (t.isNegative() || t.isZero()) {
            throw new IllegalArgumentException("eval.timeout must be positive");
        }
        this.timeout = t;
        this.normalization = normalization == null ? new Normalization(null, null) : normalization;
    }

    public String getTextsDir() {
        return textsDir;
    }

    public String getGroundTruthDir() {
        return groundTruthDir;
    }

    public String getLatencyFile() {
        return latencyFile;
    }

    public String getReportFile() {
        return reportFile;
    }

    public boolean hasReportFile() {
        return reportFile != null && !reportFile.isBlank();
    }

    public Duration getTimeout() {
        return timeout;
    }

    public Normalization getNormalization() {
        return normalization;
    }
}

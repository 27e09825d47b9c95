package com.phillippitts.transcripteval.config;

import com.phillippitts.transcripteval.config.properties.EvaluationProperties;
import com.phillippitts.transcripteval.domain.ThresholdSet;
import com.phillippitts.transcripteval.domain.TranscriptorInfo;
import com.phillippitts.transcripteval.service.discovery.TranscriptDiscoveryService;
import com.phillippitts.transcripteval.service.evaluation.EvaluationOrchestrator;
import com.phillippitts.transcripteval.service.evaluation.ParallelEvaluationService;
import com.phillippitts.transcripteval.service.evaluation.ThresholdEvaluator;
import com.phillippitts.transcripteval.service.evaluation.TranscriptEvaluationService;
import com.phillippitts.transcripteval.service.metrics.EvaluationMetricsPublisher;
import com.phillippitts.transcripteval.service.metrics.TranscriptAnalyzer;
import com.phillippitts.transcripteval.service.performance.LatencyMetadataParser;
import com.phillippitts.transcripteval.service.performance.PerformanceAggregator;
import com.phillippitts.transcripteval.service.report.ConsoleReportPrinter;
import com.phillippitts.transcripteval.service.report.JsonReportWriter;
import com.phillippitts.transcripteval.service.text.NormalizationOptions;
import com.phillippitts.transcripteval.service.text.TextNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.concurrent.Executor;

/**
 * Wires the evaluation pipeline explicitly.
 *
 * <p>Thresholds and transcriptor identity are resolved once from the {@link Environment}
 * (environment variables, system properties, application.properties and an optional .env file)
 * and shared read-only by all evaluations.
 */
@Configuration
public class EvaluationConfig {

    private static final Logger LOG = LogManager.getLogger(EvaluationConfig.class);

    private final EvaluationProperties properties;
    private final Environment environment;

    public EvaluationConfig(EvaluationProperties properties, Environment environment) {
        this.properties = properties;
        this.environment = environment;
    }

    @Bean
    public TextNormalizer textNormalizer() {
        EvaluationProperties.Normalization n = properties.getNormalization();
        return new TextNormalizer(new NormalizationOptions(n.punctuation(), n.asciiFold()));
    }

    @Bean
    public ThresholdSet thresholdSet() {
        ThresholdSet thresholds = ThresholdSetFactory.fromSettings(environment::getProperty);
        LOG.info("Thresholds in effect: {}", thresholds.limits());
        return thresholds;
    }

    @Bean
    public TranscriptorInfo transcriptorInfo() {
        return ThresholdSetFactory.transcriptorFromSettings(environment::getProperty);
    }

    @Bean
    public TranscriptEvaluationService transcriptEvaluationService(TextNormalizer textNormalizer,
                                                                   TranscriptAnalyzer analyzer,
                                                                   PerformanceAggregator performanceAggregator,
                                                                   ThresholdEvaluator thresholdEvaluator,
                                                                   ThresholdSet thresholdSet,
                                                                   TranscriptorInfo transcriptorInfo,
                                                                   EvaluationMetricsPublisher metricsPublisher) {
        return new TranscriptEvaluationService(
                new TranscriptEvaluationService.Collaborators(
                        textNormalizer, analyzer, performanceAggregator, thresholdEvaluator),
                thresholdSet, transcriptorInfo, metricsPublisher);
    }

    @Bean
    public ParallelEvaluationService parallelEvaluationService(
            TranscriptEvaluationService transcriptEvaluationService,
            @Qualifier("evaluationExecutor") Executor evaluationExecutor) {
        return new ParallelEvaluationService(transcriptEvaluationService, evaluationExecutor);
    }

    @Bean
    public TranscriptDiscoveryService transcriptDiscoveryService(LatencyMetadataParser latencyParser) {
        return new TranscriptDiscoveryService(properties.getGroundTruthDir(), properties.getLatencyFile(), latencyParser);
    }

    @Bean
    public EvaluationOrchestrator evaluationOrchestrator(TranscriptDiscoveryService discoveryService,
                                                         ParallelEvaluationService parallelEvaluationService,
                                                         TranscriptEvaluationService transcriptEvaluationService) {
        return new EvaluationOrchestrator(discoveryService, parallelEvaluationService,
                transcriptEvaluationService, properties.getTimeout());
    }

    @Bean
    public ConsoleReportPrinter consoleReportPrinter() {
        return new ConsoleReportPrinter(System.out);
    }

    @Bean
    public JsonReportWriter jsonReportWriter() {
        return new JsonReportWriter();
    }
}

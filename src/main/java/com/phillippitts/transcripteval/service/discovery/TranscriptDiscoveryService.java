package com.phillippitts.transcripteval.service.discovery;

import com.phillippitts.transcripteval.domain.Transcript;
import com.phillippitts.transcripteval.exception.MissingReferenceException;
import com.phillippitts.transcripteval.exception.TranscriptDiscoveryException;
import com.phillippitts.transcripteval.service.performance.LatencyMetadataParser;
import com.phillippitts.transcripteval.service.performance.PerformanceMetadata;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Finds and loads the transcripts of one run from a texts folder.
 *
 * <p>Layout:
 * <pre>
 * texts/
 *   gt/reference.txt        exactly one ground-truth transcript
 *   engine_a.txt            hypothesis transcripts (sorted by file name)
 *   engine_b.txt
 *   latency.json            optional performance metadata
 * </pre>
 *
 * <p>A missing or ambiguous ground truth raises {@link MissingReferenceException}; a missing
 * texts folder, an unreadable ground truth or a folder without hypotheses raises
 * {@link TranscriptDiscoveryException}. Both abort the run before evaluation. A hypothesis
 * that cannot be read is reported as {@link UnreadableTranscript} and the others still load.
 * A broken latency file only degrades the affected transcripts.
 */
public class TranscriptDiscoveryService {

    private static final Logger LOG = LogManager.getLogger(TranscriptDiscoveryService.class);

    private static final String TRANSCRIPT_EXTENSION = ".txt";

    private final String groundTruthDir;
    private final String latencyFile;
    private final LatencyMetadataParser latencyParser;

    /**
     * @param groundTruthDir name of the ground-truth sub-folder
     * @param latencyFile name of the latency mapping file inside the texts folder
     * @param latencyParser parser for the latency mapping
     */
    public TranscriptDiscoveryService(String groundTruthDir, String latencyFile, LatencyMetadataParser latencyParser) {
        this.groundTruthDir = Objects.requireNonNull(groundTruthDir, "groundTruthDir");
        this.latencyFile = Objects.requireNonNull(latencyFile, "latencyFile");
        this.latencyParser = Objects.requireNonNull(latencyParser, "latencyParser");
    }

    /**
     * Discovers and loads all inputs under a texts folder.
     *
     * @param textsDir folder holding hypotheses, the ground-truth sub-folder and the latency file
     * @return loaded transcripts, unreadable hypotheses and latency mapping
     * @throws MissingReferenceException if the ground-truth folder does not hold exactly one transcript
     * @throws TranscriptDiscoveryException if folders are missing, the ground truth is unreadable
     *                                      or no hypothesis file exists
     */
    public DiscoveredTranscripts discover(Path textsDir) {
        Objects.requireNonNull(textsDir, "textsDir");
        if (!Files.isDirectory(textsDir)) {
            throw new TranscriptDiscoveryException("Texts folder not found", textsDir.toString());
        }

        Transcript groundTruth = loadGroundTruth(textsDir.resolve(groundTruthDir));
        List<Path> files = listTranscripts(textsDir);
        if (files.isEmpty()) {
            throw new TranscriptDiscoveryException("No hypothesis transcripts found", textsDir.toString());
        }
        List<Transcript> hypotheses = new ArrayList<>();
        List<UnreadableTranscript> unreadable = new ArrayList<>();
        for (Path file : files) {
            try {
                hypotheses.add(load(file));
            } catch (TranscriptDiscoveryException e) {
                String reason = describe(e);
                LOG.warn("Skipping unreadable hypothesis {}: {}", file, reason);
                String fileName = file.getFileName().toString();
                unreadable.add(new UnreadableTranscript(nameOf(fileName), fileName, file.toString(), reason));
            }
        }
        Map<String, PerformanceMetadata> latencyMap = loadLatencyMap(textsDir.resolve(latencyFile));

        LOG.info("Discovered ground truth {} and {} hypothesis transcript(s) ({} unreadable), {} latency entr(y/ies)",
                groundTruth.fileName(), hypotheses.size(), unreadable.size(), latencyMap.size());
        return new DiscoveredTranscripts(groundTruth, hypotheses, latencyMap, unreadable);
    }

    private Transcript loadGroundTruth(Path gtDir) {
        if (!Files.isDirectory(gtDir)) {
            throw new MissingReferenceException(gtDir.toString(), 0);
        }
        List<Path> candidates = listTranscripts(gtDir);
        if (candidates.size() != 1) {
            throw new MissingReferenceException(gtDir.toString(), candidates.size());
        }
        return load(candidates.get(0));
    }

    private static List<Path> listTranscripts(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(TRANSCRIPT_EXTENSION))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new TranscriptDiscoveryException("Cannot list transcripts", dir.toString(), e);
        }
    }

    private static Transcript load(Path file) {
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8).strip();
            String fileName = file.getFileName().toString();
            return new Transcript(nameOf(fileName), fileName, file.toString(), text);
        } catch (IOException e) {
            throw new TranscriptDiscoveryException("Cannot read transcript", file.toString(), e);
        }
    }

    private static String nameOf(String fileName) {
        return fileName.substring(0, fileName.length() - TRANSCRIPT_EXTENSION.length());
    }

    private static String describe(TranscriptDiscoveryException e) {
        Throwable cause = e.getCause();
        if (cause == null) {
            return e.getMessage();
        }
        String detail = cause.getMessage();
        return "Cannot read transcript: " + cause.getClass().getSimpleName() + (detail == null ? "" : " (" + detail + ")");
    }

    private Map<String, PerformanceMetadata> loadLatencyMap(Path file) {
        if (!Files.isRegularFile(file)) {
            LOG.warn("No latency mapping at {}; latency and RTF will not be evaluated", file);
            return Map.of();
        }
        try {
            return latencyParser.parse(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.warn("Cannot read latency mapping {}: {}", file, e.getMessage());
            return Map.of();
        }
    }
}

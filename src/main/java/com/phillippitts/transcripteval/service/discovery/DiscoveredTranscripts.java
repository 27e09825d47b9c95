package com.phillippitts.transcripteval.service.discovery;

import com.phillippitts.transcripteval.domain.Transcript;
import com.phillippitts.transcripteval.service.performance.PerformanceMetadata;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything one run needs, loaded into memory before evaluation starts.
 *
 * @param groundTruth the single reference transcript
 * @param hypotheses  hypothesis transcripts sorted by file name
 * @param latencyMap  performance metadata keyed by hypothesis file name (may be empty)
 * @param unreadable  hypothesis files that could not be loaded, sorted by file name
 */
public record DiscoveredTranscripts(Transcript groundTruth,
                                    List<Transcript> hypotheses,
                                    Map<String, PerformanceMetadata> latencyMap,
                                    List<UnreadableTranscript> unreadable) {

    public DiscoveredTranscripts {
        Objects.requireNonNull(groundTruth, "groundTruth");
        hypotheses = List.copyOf(Objects.requireNonNull(hypotheses, "hypotheses"));
        latencyMap = latencyMap == null ? Map.of() : Map.copyOf(latencyMap);
        unreadable = unreadable == null ? List.of() : List.copyOf(unreadable);
    }

    public DiscoveredTranscripts(Transcript groundTruth,
                                 List<Transcript> hypotheses,
                                 Map<String, PerformanceMetadata> latencyMap) {
        this(groundTruth, hypotheses, latencyMap, List.of());
    }
}

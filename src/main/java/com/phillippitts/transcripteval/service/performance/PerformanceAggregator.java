package com.phillippitts.transcripteval.service.performance;

import com.phillippitts.transcripteval.domain.PerformanceRecord;
import com.phillippitts.transcripteval.exception.MissingPerformanceDataException;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;

/**
 * Resolves and normalizes performance metadata for a transcript.
 *
 * <p>RTF is never derived from latency: audio duration is not known here, so a missing
 * RTF stays missing and RTF is simply not evaluated for that transcript.
 */
@Component
public class PerformanceAggregator {

    /**
     * Looks up and normalizes the entry for one hypothesis file.
     *
     * @param fileName hypothesis file name (the mapping key)
     * @param latencyMap parsed latency mapping
     * @return normalized (latency, rtf-or-null) pair
     * @throws MissingPerformanceDataException if the mapping has no entry for the file
     */
    public PerformanceRecord resolve(String fileName, Map<String, PerformanceMetadata> latencyMap) {
        Objects.requireNonNull(fileName, "fileName");
        PerformanceMetadata metadata = latencyMap == null ? null : latencyMap.get(fileName);
        if (metadata == null) {
            throw new MissingPerformanceDataException(fileName);
        }
        return normalize(metadata);
    }

    /**
     * Collapses either metadata shape into a {@link PerformanceRecord}.
     */
    public PerformanceRecord normalize(PerformanceMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        if (metadata instanceof PerformanceMetadata.DetailedLatency detailed) {
            return new PerformanceRecord(detailed.latencyMs(), detailed.rtf());
        }
        return new PerformanceRecord(metadata.latencyMs(), null);
    }
}

package com.phillippitts.transcripteval.service.performance;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses the latency mapping JSON into {@link PerformanceMetadata} per transcript file name.
 *
 * <p>Safe against malformed input: an unreadable document yields an empty mapping and an
 * invalid entry is skipped. Both are logged, and the affected transcripts later surface as
 * missing performance data.
 */
@Component
public class LatencyMetadataParser {

    private static final Logger LOG = LogManager.getLogger(LatencyMetadataParser.class);

    static final String LATENCY_MS = "latency_ms";
    static final String RTF = "rtf";

    /**
     * Parses a mapping document.
     *
     * @param json JSON object text (null or blank yields an empty mapping)
     * @return immutable mapping from hypothesis file name to metadata
     */
    public Map<String, PerformanceMetadata> parse(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            LOG.warn("Ignoring latency mapping, not a JSON object: {}", e.getMessage());
            return Map.of();
        }

        Map<String, PerformanceMetadata> result = new TreeMap<>();
        for (String fileName : root.keySet()) {
            PerformanceMetadata metadata = parseEntry(root, fileName);
            if (metadata != null) {
                result.put(fileName, metadata);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private PerformanceMetadata parseEntry(JSONObject root, String fileName) {
        JSONObject detailed = root.optJSONObject(fileName);
        if (detailed != null) {
            double latency = detailed.optDouble(LATENCY_MS, Double.NaN);
            if (!isValid(latency)) {
                LOG.warn("Skipping latency entry for {}: missing or invalid {}", fileName, LATENCY_MS);
                return null;
            }
            Double rtf = null;
            if (detailed.has(RTF) && !detailed.isNull(RTF)) {
                double value = detailed.optDouble(RTF, Double.NaN);
                if (isValid(value)) {
                    rtf = value;
                } else {
                    LOG.warn("Ignoring invalid {} for {}", RTF, fileName);
                }
            }
            return new PerformanceMetadata.DetailedLatency(latency, rtf);
        }

        double latency = root.optDouble(fileName, Double.NaN);
        if (!isValid(latency)) {
            LOG.warn("Skipping latency entry for {}: expected a number or an object", fileName);
            return null;
        }
        return new PerformanceMetadata.NumericLatency(latency);
    }

    private static boolean isValid(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value) && value >= 0.0;
    }
}

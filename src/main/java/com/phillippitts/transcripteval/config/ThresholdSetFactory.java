package com.phillippitts.transcripteval.config;

import com.phillippitts.transcripteval.domain.MetricName;
import com.phillippitts.transcripteval.domain.ThresholdSet;
import com.phillippitts.transcripteval.domain.TranscriptorInfo;
import com.phillippitts.transcripteval.exception.InvalidThresholdException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds the run's {@link ThresholdSet} and {@link TranscriptorInfo} from named settings.
 *
 * <p>Settings are looked up once through a function (typically the Spring Environment, which
 * covers environment variables, system properties, application.properties and .env):
 * <ul>
 *   <li>{@code WER_THRESHOLD} (default 0.15)</li>
 *   <li>{@code CER_THRESHOLD} (default 0.1)</li>
 *   <li>{@code TFIDF_THRESHOLD} (default 0.75)</li>
 *   <li>{@code LATENCY_THRESHOLD_MS} (default 800)</li>
 *   <li>{@code RTF_THRESHOLD} (default 0.8)</li>
 * </ul>
 *
 * <p>A blank value means default. An unparseable, non-finite or negative value is logged
 * and replaced by the default. {@code none} or {@code off} removes the threshold, so the
 * metric is reported but not evaluated.
 */
public final class ThresholdSetFactory {

    private static final Logger LOG = LogManager.getLogger(ThresholdSetFactory.class);

    public static final String TRANSCRIPTOR_NAME = "TRANSCRIPTOR_NAME";
    public static final String TRANSCRIPTOR_VERSION = "TRANSCRIPTOR_VERSION";
    public static final String TRANSCRIPTOR_ENVIRONMENT = "TRANSCRIPTOR_ENVIRONMENT";

    /** Setting name per gated metric. */
    public static final Map<MetricName, String> SETTING_NAMES;

    static {
        Map<MetricName, String> names = new EnumMap<>(MetricName.class);
        names.put(MetricName.TFIDF_SIMILARITY, "TFIDF_THRESHOLD");
        names.put(MetricName.WORD_ERROR_RATE, "WER_THRESHOLD");
        names.put(MetricName.CHARACTER_ERROR_RATE, "CER_THRESHOLD");
        names.put(MetricName.LATENCY_MS, "LATENCY_THRESHOLD_MS");
        names.put(MetricName.RTF, "RTF_THRESHOLD");
        SETTING_NAMES = Collections.unmodifiableMap(names);
    }

    private ThresholdSetFactory() {
        // Utility class - prevent instantiation
    }

    /**
     * Resolves all thresholds.
     *
     * @param lookup returns the raw setting value or null when absent
     * @return immutable threshold set
     */
    public static ThresholdSet fromSettings(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup");
        Map<MetricName, Double> defaults = ThresholdSet.defaults().limits();
        Map<MetricName, Double> limits = new EnumMap<>(MetricName.class);

        for (Map.Entry<MetricName, String> e : SETTING_NAMES.entrySet()) {
            MetricName metric = e.getKey();
            String setting = e.getValue();
            double fallback = defaults.get(metric);
            String raw = lookup.apply(setting);

            if (raw == null || raw.isBlank()) {
                limits.put(metric, fallback);
            } else if (isDisabled(raw)) {
                LOG.info("{} disabled: {} will not be evaluated", setting, metric.key());
            } else {
                try {
                    limits.put(metric, parse(setting, raw));
                } catch (InvalidThresholdException ex) {
                    LOG.warn("{}, falling back to default {}", ex.getMessage(), fallback);
                    limits.put(metric, fallback);
                }
            }
        }
        return new ThresholdSet(limits);
    }

    /**
     * Resolves the transcriptor identity; absent values become {@code unknown}.
     */
    public static TranscriptorInfo transcriptorFromSettings(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup");
        return new TranscriptorInfo(
                valueOrUnknown(lookup.apply(TRANSCRIPTOR_NAME)),
                valueOrUnknown(lookup.apply(TRANSCRIPTOR_VERSION)),
                valueOrUnknown(lookup.apply(TRANSCRIPTOR_ENVIRONMENT)));
    }

    /**
     * Parses one threshold value.
     *
     * @throws InvalidThresholdException if the value is not a finite non-negative number
     */
    static double parse(String setting, String raw) {
        double value;
        try {
            value = Double.parseDouble(raw.strip());
        } catch (NumberFormatException e) {
            throw new InvalidThresholdException(setting, raw, e);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidThresholdException(setting, raw, "must be finite");
        }
        if (value < 0.0) {
            throw new InvalidThresholdException(setting, raw, "must not be negative");
        }
        return value;
    }

    private static boolean isDisabled(String raw) {
        String v = raw.strip().toLowerCase(Locale.ROOT);
        return v.equals("none") || v.equals("off");
    }

    private static String valueOrUnknown(String raw) {
        return raw == null || raw.isBlank() ? TranscriptorInfo.UNKNOWN : raw.strip();
    }
}

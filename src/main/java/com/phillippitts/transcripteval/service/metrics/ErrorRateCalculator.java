package com.phillippitts.transcripteval.service.metrics;

import com.phillippitts.transcripteval.domain.AlignmentResult;
import com.phillippitts.transcripteval.domain.MetricName;
import com.phillippitts.transcripteval.exception.UndefinedMetricException;
import com.phillippitts.transcripteval.service.alignment.EditDistanceEngine;
import com.phillippitts.transcripteval.service.text.NormalizedText;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Word and character error rates: (S + I + D) / reference length.
 *
 * <p>An empty reference makes the rate undefined; this is always signalled with
 * {@link UndefinedMetricException}, never mapped to 0 or infinity.
 */
@Component
public class ErrorRateCalculator {

    private final EditDistanceEngine engine;

    public ErrorRateCalculator(EditDistanceEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    /**
     * WER over whitespace tokens of the normalized texts.
     *
     * @throws UndefinedMetricException if the reference has no tokens
     */
    public double wordErrorRate(NormalizedText reference, NormalizedText hypothesis) {
        return errorRate(MetricName.WORD_ERROR_RATE, engine.align(reference.words(), hypothesis.words()));
    }

    /**
     * CER over characters of the normalized texts, spaces included.
     *
     * @throws UndefinedMetricException if the reference is empty
     */
    public double characterErrorRate(NormalizedText reference, NormalizedText hypothesis) {
        return errorRate(MetricName.CHARACTER_ERROR_RATE,
                engine.align(reference.characters(), hypothesis.characters()));
    }

    /**
     * Derives a rate from alignment counts.
     *
     * @param metric which rate is being computed (for the error signal)
     * @param alignment edit counts
     * @return non-negative rate, may exceed 1.0 when insertions dominate
     * @throws UndefinedMetricException if the reference length is 0
     */
    public double errorRate(MetricName metric, AlignmentResult alignment) {
        if (alignment.referenceLength() == 0) {
            throw new UndefinedMetricException(metric, "reference is empty");
        }
        return alignment.errors() / (double) alignment.referenceLength();
    }
}

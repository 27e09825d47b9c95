/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.transcripteval.exception.TranscriptEvalException}
 * and are unchecked. They fall into two groups:
 * <ul>
 *   <li>Fatal to the run: {@link com.phillippitts.transcripteval.exception.MissingReferenceException},
 *       {@link com.phillippitts.transcripteval.exception.TranscriptDiscoveryException} for the texts
 *       folder and the ground truth, and {@link com.phillippitts.transcripteval.exception.EvaluationException}
 *       when the run times out</li>
 *   <li>Recovered at the narrowest scope (one metric or one transcript):
 *       {@link com.phillippitts.transcripteval.exception.InvalidThresholdException},
 *       {@link com.phillippitts.transcripteval.exception.MissingPerformanceDataException},
 *       {@link com.phillippitts.transcripteval.exception.UndefinedMetricException}, an unreadable
 *       hypothesis and an {@link com.phillippitts.transcripteval.exception.EvaluationException}
 *       naming a single transcript; the latter two become an ERROR record</li>
 * </ul>
 *
 * @see com.phillippitts.transcripteval.presentation.cli.EvaluationCommandRunner
 * @since 1.0
 */
package com.phillippitts.transcripteval.exception;

/**
 * Immutable domain model of a transcript evaluation.
 *
 * <p>Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.transcripteval.domain.MetricName} - every metric with its report keys
 *       and {@link com.phillippitts.transcripteval.domain.BetterDirection}</li>
 *   <li>{@link com.phillippitts.transcripteval.domain.AlignmentResult} - S/I/D counts of one alignment</li>
 *   <li>{@link com.phillippitts.transcripteval.domain.ThresholdSet} - limits for one run</li>
 *   <li>{@link com.phillippitts.transcripteval.domain.EvaluationRecord} - per-transcript verdict</li>
 * </ul>
 *
 * <p>All types are records or enums, validate in their constructors and hold defensive copies.
 *
 * @since 1.0
 */
package com.phillippitts.transcripteval.domain;

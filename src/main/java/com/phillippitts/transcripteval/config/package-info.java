/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.transcripteval.config.EvaluationConfig} - Wires the evaluation
 *       pipeline, thresholds and report writers</li>
 *   <li>{@link com.phillippitts.transcripteval.config.ThreadPoolConfig} - Executor for parallel
 *       transcript evaluation</li>
 *   <li>{@link com.phillippitts.transcripteval.config.ThresholdSetFactory} - Parses threshold and
 *       transcriptor settings</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code eval.*} and {@code threadpool.*} properties</li>
 * </ul>
 */
package com.phillippitts.transcripteval.config;

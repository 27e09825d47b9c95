/**
 * Evaluation services.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code service.text} - text normalization shared by all metrics</li>
 *   <li>{@code service.alignment} - edit-distance alignment</li>
 *   <li>{@code service.metrics} - error rates, per-transcript analysis and Micrometer instrumentation</li>
 *   <li>{@code service.similarity} - TF-IDF cosine and informational lexical similarity</li>
 *   <li>{@code service.performance} - latency mapping parsing and normalization</li>
 *   <li>{@code service.evaluation} - threshold gating and run orchestration</li>
 *   <li>{@code service.discovery} - locating and loading transcripts</li>
 *   <li>{@code service.report} - console and JSON reports</li>
 * </ul>
 */
package com.phillippitts.transcripteval.service;

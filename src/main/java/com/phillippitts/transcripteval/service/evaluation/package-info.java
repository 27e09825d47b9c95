/**
 * Threshold gating and orchestration of an evaluation run.
 *
 * <p>{@link com.phillippitts.transcripteval.service.evaluation.TranscriptEvaluationService} evaluates
 * one transcript; {@link com.phillippitts.transcripteval.service.evaluation.ParallelEvaluationService}
 * fans transcripts out to the evaluation executor and keeps their order.
 */
package com.phillippitts.transcripteval.service.evaluation;

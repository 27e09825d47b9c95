/**
 * Error rates, per-transcript text analysis and Micrometer instrumentation.
 */
package com.phillippitts.transcripteval.service.metrics;

/**
 * Command-line entry point: runs one evaluation and sets the process exit code.
 */
package com.phillippitts.transcripteval.presentation.cli;

package com.phillippitts.transcripteval.domain;

/**
 * Edit operation counts for one reference/hypothesis sequence pair.
 *
 * @param substitutions   reference elements replaced by a different hypothesis element
 * @param insertions      hypothesis elements with no reference counterpart
 * @param deletions       reference elements missing from the hypothesis
 * @param referenceLength number of elements in the reference sequence
 */
public record AlignmentResult(int substitutions, int insertions, int deletions, int referenceLength) {

    public AlignmentResult {
        if (substitutions < 0 || insertions < 0 || deletions < 0 || referenceLength < 0) {
            throw new IllegalArgumentException("alignment counts must be non-negative");
        }
        if (substitutions + deletions > referenceLength) {
            throw new IllegalArgumentException("substitutions + deletions cannot exceed reference length");
        }
    }

    /** Total edit operations (S + I + D). */
    public int errors() {
        return substitutions + insertions + deletions;
    }

    /** Reference elements matched exactly. */
    public int hits() {
        return referenceLength - substitutions - deletions;
    }
}

package com.phillippitts.transcripteval.service.alignment;

import com.phillippitts.transcripteval.domain.AlignmentResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Unit-cost edit distance between a reference and a hypothesis sequence.
 *
 * <p>Classic dynamic-programming recurrence over a (m+1) x (n+1) grid, kept as two rolling
 * rows because only operation counts are needed, not the path. Each cell carries its own
 * (S, I, D) counts alongside the cost.
 *
 * <p><b>Tie-breaking:</b> when several predecessors give the same minimal cost the cell
 * takes, in order: diagonal (match or substitution), deletion, insertion. Repeated runs
 * on identical input therefore yield identical counts.
 *
 * <p>Complexity: O(m*n) time, O(n) space. Stateless and thread-safe.
 */
@Component
public class EditDistanceEngine {

    /**
     * Aligns two sequences and returns the operation counts of a minimal alignment.
     *
     * @param reference reference sequence R (length m)
     * @param hypothesis hypothesis sequence H (length n)
     * @param <T> element type, compared with {@link Objects#equals(Object, Object)}
     * @return counts transforming R into H, with reference length m
     */
    public <T> AlignmentResult align(List<? extends T> reference, List<? extends T> hypothesis) {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(hypothesis, "hypothesis");
        Object[] ref = reference.toArray();
        Object[] hyp = hypothesis.toArray();
        int m = ref.length;
        int n = hyp.length;

        if (m == 0) {
            return new AlignmentResult(0, n, 0, 0);
        }
        if (n == 0) {
            return new AlignmentResult(0, 0, m, m);
        }

        Row prev = new Row(n);
        Row cur = new Row(n);
        for (int j = 0; j <= n; j++) {
            prev.set(j, j, 0, j, 0);
        }

        for (int i = 1; i <= m; i++) {
            cur.set(0, i, 0, 0, i);
            Object r = ref[i - 1];
            for (int j = 1; j <= n; j++) {
                int mismatch = Objects.equals(r, hyp[j - 1]) ? 0 : 1;
                int diagonal = prev.cost[j - 1] + mismatch;
                int deletion = prev.cost[j] + 1;
                int insertion = cur.cost[j - 1] + 1;

                if (diagonal <= deletion && diagonal <= insertion) {
                    cur.set(j, diagonal, prev.subs[j - 1] + mismatch, prev.ins[j - 1], prev.dels[j - 1]);
                } else if (deletion <= insertion) {
                    cur.set(j, deletion, prev.subs[j], prev.ins[j], prev.dels[j] + 1);
                } else {
                    cur.set(j, insertion, cur.subs[j - 1], cur.ins[j - 1] + 1, cur.dels[j - 1]);
                }
            }
            Row tmp = prev;
            prev = cur;
            cur = tmp;
        }

        return new AlignmentResult(prev.subs[n], prev.ins[n], prev.dels[n], m);
    }

    /**
     * Total unit-cost edit distance (S + I + D).
     */
    public <T> int distance(List<? extends T> reference, List<? extends T> hypothesis) {
        return align(reference, hypothesis).errors();
    }

    /** One DP row: cost plus the S/I/D counts that achieve it. */
    private static final class Row {
        final int[] cost;
        final int[] subs;
        final int[] ins;
        final int[] dels;

        Row(int n) {
            cost = new int[n + 1];
            subs = new int[n + 1];
            ins = new int[n + 1];
            dels = new int[n + 1];
        }

        void set(int j, int c, int s, int i, int d) {
            cost[j] = c;
            subs[j] = s;
            ins[j] = i;
            dels[j] = d;
        }
    }
}

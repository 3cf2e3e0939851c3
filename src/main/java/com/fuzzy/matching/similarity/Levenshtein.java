package com.fuzzy.matching.similarity;

import com.fuzzy.matching.core.ScratchBuffers;
import com.fuzzy.matching.core.model.SymbolSequence;
import com.fuzzy.matching.core.model.SymbolSequences;

import java.util.Objects;

/**
 * Levenshtein edit distance and the similarity ratio derived from it.
 */
public final class Levenshtein {

    private Levenshtein() {
    }

    /**
     * Computes the unit-cost Levenshtein distance.
     */
    public static int distance(SymbolSequence<?> s1, SymbolSequence<?> s2) {
        return distance(s1, s2, SubstitutionCost.UNIT);
    }

    /**
     * Computes the Levenshtein distance between two sequences.
     * Uses the Wagner-Fischer algorithm on what remains after stripping the common prefix and
     * suffix, with a rolling pair of rows over the shorter sequence: O(m*n) time, O(min(m,n)) space.
     *
     * @param s1   first sequence
     * @param s2   second sequence
     * @param cost cost of a substitution
     * @return the minimal total cost of insertions, deletions and substitutions
     */
    public static int distance(SymbolSequence<?> s1, SymbolSequence<?> s2, SubstitutionCost cost) {
        Objects.requireNonNull(s1, "s1 is required");
        Objects.requireNonNull(s2, "s2 is required");
        Objects.requireNonNull(cost, "cost is required");

        int prefix = SymbolSequences.commonPrefixLength(s1, s2);
        int suffix = SymbolSequences.commonSuffixLength(s1, s2, prefix);
        int len1 = s1.length() - prefix - suffix;
        int len2 = s2.length() - prefix - suffix;
        if (len1 == 0) {
            return len2;
        }
        if (len2 == 0) {
            return len1;
        }

        // Ensure the shorter sequence indexes the row
        SymbolSequence<?> shorter = s1;
        SymbolSequence<?> longer = s2;
        int m = len1;
        int n = len2;
        if (m > n) {
            shorter = s2;
            longer = s1;
            m = len2;
            n = len1;
        }

        int substitution = cost.weight();
        int[] previousRow = ScratchBuffers.intBuffer(m + 1L);
        int[] currentRow = ScratchBuffers.intBuffer(m + 1L);

        for (int i = 0; i <= m; i++) {
            previousRow[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            currentRow[0] = j;
            int symbol = longer.symbolAt(prefix + j - 1);

            for (int i = 1; i <= m; i++) {
                int c = shorter.symbolAt(prefix + i - 1) == symbol ? 0 : substitution;
                currentRow[i] = Math.min(
                        Math.min(currentRow[i - 1] + 1, previousRow[i] + 1),
                        previousRow[i - 1] + c
                );
            }

            int[] temp = previousRow;
            previousRow = currentRow;
            currentRow = temp;
        }

        return previousRow[m];
    }

    /**
     * Computes the similarity ratio {@code (|a| + |b| - d) / (|a| + |b|)} where {@code d} is the
     * distance with {@link SubstitutionCost#DOUBLE}. Two empty sequences have ratio 1.0.
     *
     * @return similarity in {@code [0, 1]}
     */
    public static double ratio(SymbolSequence<?> s1, SymbolSequence<?> s2) {
        int lengthSum = s1.length() + s2.length();
        if (lengthSum == 0) {
            return 1.0;
        }
        int distance = distance(s1, s2, SubstitutionCost.DOUBLE);
        return (double) (lengthSum - distance) / lengthSum;
    }
}

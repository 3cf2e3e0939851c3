package com.fuzzy.matching.similarity;

import com.fuzzy.matching.core.model.SymbolSequence;

/**
 * Hamming distance: the number of positions at which two equal-length sequences differ.
 */
public final class Hamming {

    private Hamming() {
    }

    /**
     * Counts the differing positions.
     *
     * @throws LengthMismatchException if the sequences differ in length
     */
    public static int distance(SymbolSequence<?> s1, SymbolSequence<?> s2) {
        if (s1.length() != s2.length()) {
            throw new LengthMismatchException(s1.length(), s2.length());
        }
        int mismatches = 0;
        for (int i = 0; i < s1.length(); i++) {
            if (s1.symbolAt(i) != s2.symbolAt(i)) {
                mismatches++;
            }
        }
        return mismatches;
    }
}

package com.fuzzy.matching.median;

import com.fuzzy.matching.core.ScratchBuffers;

/**
 * Last Levenshtein matrix row of every input string against a growing candidate prefix.
 * Row {@code i} holds the distances between the prefix and each prefix of string {@code i}.
 */
final class LevenshteinRows {

    private final int[][] strings;
    private final int[][] rows;
    private final int[] scratch;
    private final int maxLength;

    LevenshteinRows(int[][] strings) {
        this.strings = strings;
        this.rows = new int[strings.length][];
        int max = 0;
        for (int i = 0; i < strings.length; i++) {
            int length = strings[i].length;
            max = Math.max(max, length);
            int[] row = ScratchBuffers.intBuffer(length + 1L);
            for (int j = 0; j <= length; j++) {
                row[j] = j;
            }
            rows[i] = row;
        }
        this.maxLength = max;
        this.scratch = ScratchBuffers.intBuffer(max + 1L);
    }

    int maxLength() {
        return maxLength;
    }

    int[] row(int index) {
        return rows[index];
    }

    int[] scratch() {
        return scratch;
    }

    /**
     * Advances every row by one candidate symbol; {@code prefixLength} is the candidate prefix
     * length after appending it.
     */
    void append(int symbol, int prefixLength) {
        scratch[0] = prefixLength;
        for (int i = 0; i < strings.length; i++) {
            int[] s = strings[i];
            int[] oldRow = rows[i];
            for (int k = 1; k <= s.length; k++) {
                int c1 = oldRow[k] + 1;
                int c2 = scratch[k - 1] + 1;
                int c3 = oldRow[k - 1] + (symbol != s[k - 1] ? 1 : 0);
                scratch[k] = Math.min(Math.min(c2, c3), c1);
            }
            System.arraycopy(scratch, 0, oldRow, 0, s.length + 1);
        }
    }
}

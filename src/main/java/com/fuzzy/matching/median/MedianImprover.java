package com.fuzzy.matching.median;

import com.fuzzy.matching.core.model.EditType;

import java.util.Arrays;

/**
 * One left-to-right perturbation pass over a median candidate.
 *
 * <p>At each position every replacement by another alphabet symbol, every insertion of an
 * alphabet symbol before it, and its deletion are scored by the weighted sum of distances; the
 * best strictly-improving one is applied. The Levenshtein rows of the already fixed prefix are
 * kept, so scoring a perturbation only completes the matrices for the remaining suffix.</p>
 */
final class MedianImprover {

    // Slot before position 0, used to score insertions at the front
    private static final int BASE = 1;

    private final int[][] strings;
    private final double[] weights;
    private final LevenshteinRows rows;

    private MedianImprover(int[][] strings, double[] weights) {
        this.strings = strings;
        this.weights = weights;
        this.rows = new LevenshteinRows(strings);
    }

    static int[] improve(int[] candidate, int[][] strings, double[] weights) {
        int[] alphabet = SymbolAlphabet.of(strings);
        if (alphabet.length == 0) {
            return new int[0];
        }
        return new MedianImprover(strings, weights).run(candidate, alphabet);
    }

    private int[] run(int[] candidate, int[] alphabet) {
        int[] median = new int[BASE + 2 * candidate.length + 2];
        System.arraycopy(candidate, 0, median, BASE, candidate.length);
        int medianLength = candidate.length;
        double minMinSum = finishDistances(median, BASE, medianLength);

        for (int pos = 0; pos <= medianLength; ) {
            int at = BASE + pos;
            int symbol = median[at];
            EditType operation = EditType.KEEP;

            if (pos < medianLength) {
                int original = median[at];
                for (int candidateSymbol : alphabet) {
                    if (candidateSymbol == original) {
                        continue;
                    }
                    median[at] = candidateSymbol;
                    double sum = finishDistances(median, at, medianLength - pos);
                    if (sum < minMinSum) {
                        minMinSum = sum;
                        symbol = candidateSymbol;
                        operation = EditType.REPLACE;
                    }
                }
                median[at] = original;
            }

            // An insertion at pos is scored by overwriting the slot just before it
            int before = median[at - 1];
            for (int candidateSymbol : alphabet) {
                median[at - 1] = candidateSymbol;
                double sum = finishDistances(median, at - 1, medianLength - pos + 1);
                if (sum < minMinSum) {
                    minMinSum = sum;
                    symbol = candidateSymbol;
                    operation = EditType.INSERT;
                }
            }
            median[at - 1] = before;

            if (pos < medianLength) {
                double sum = finishDistances(median, at + 1, medianLength - pos - 1);
                if (sum < minMinSum) {
                    minMinSum = sum;
                    operation = EditType.DELETE;
                }
            }

            switch (operation) {
                case REPLACE -> median[at] = symbol;
                case INSERT -> {
                    if (BASE + medianLength + 1 >= median.length) {
                        median = Arrays.copyOf(median, median.length * 2);
                    }
                    System.arraycopy(median, at, median, at + 1, medianLength - pos);
                    median[at] = symbol;
                    medianLength++;
                }
                case DELETE -> {
                    System.arraycopy(median, at + 1, median, at, medianLength - pos - 1);
                    medianLength--;
                }
                default -> {
                }
            }

            // The symbol at pos is final now, fold it into the prefix rows and move on
            if (operation != EditType.DELETE) {
                if (pos < medianLength) {
                    rows.append(median[at], pos + 1);
                }
                pos++;
            }
        }
        return Arrays.copyOfRange(median, BASE, BASE + medianLength);
    }

    /**
     * Weighted sum of distances of the fixed prefix followed by {@code s[from, from + length)}.
     */
    private double finishDistances(int[] s, int from, int length) {
        double distanceSum = 0.0;
        if (length == 0) {
            for (int j = 0; j < strings.length; j++) {
                distanceSum += rows.row(j)[strings[j].length] * weights[j];
            }
            return distanceSum;
        }

        int[] row = rows.scratch();
        for (int j = 0; j < strings.length; j++) {
            int[] rowj = rows.row(j);
            int[] sj = strings[j];
            int lenj = sj.length;
            int len = length;

            // Common suffix only; the prefix is already folded into the rows
            while (len > 0 && lenj > 0 && sj[lenj - 1] == s[from + len - 1]) {
                len--;
                lenj--;
            }
            if (len == 0) {
                distanceSum += rowj[lenj] * weights[j];
                continue;
            }
            int offset = rowj[0];
            if (lenj == 0) {
                distanceSum += (offset + len) * weights[j];
                continue;
            }

            System.arraycopy(rowj, 0, row, 0, lenj + 1);
            for (int i = 1; i <= len; i++) {
                int symbol = s[from + i - 1];
                int diagonal = i - 1 + offset;
                int x = i + offset;
                for (int k = 1; k <= lenj; k++) {
                    int above = row[k];
                    x = Math.min(x + 1, diagonal + (symbol != sj[k - 1] ? 1 : 0));
                    x = Math.min(x, above + 1);
                    row[k] = x;
                    diagonal = above;
                }
            }
            distanceSum += weights[j] * row[lenj];
        }
        return distanceSum;
    }
}

package com.fuzzy.matching.median;

import java.util.Arrays;

/**
 * Fast, rough median without alignment. The result length is the weighted mean input length;
 * output position {@code j} of {@code L} is elected by every string voting for the symbols in
 * its proportional slice {@code [j*len/L, (j+1)*len/L)}, partially covered symbols voting with
 * the covered fraction.
 */
final class QuickMedian {

    private QuickMedian() {
    }

    static int[] compute(int[][] strings, double[] weights) {
        double meanLength = 0.0;
        double weightSum = 0.0;
        for (int i = 0; i < strings.length; i++) {
            meanLength += strings[i].length * weights[i];
            weightSum += weights[i];
        }
        if (weightSum == 0.0) {
            return new int[0];
        }
        double ml = Math.floor(meanLength / weightSum + 0.499999);
        int length = (int) ml;
        if (length == 0) {
            return new int[0];
        }

        int[] alphabet = SymbolAlphabet.of(strings);
        double[] votes = new double[alphabet.length];
        int[] median = new int[length];
        for (int j = 0; j < length; j++) {
            Arrays.fill(votes, 0.0);
            for (int i = 0; i < strings.length; i++) {
                int[] s = strings[i];
                if (s.length == 0) {
                    continue;
                }
                double weight = weights[i];
                double start = s.length / ml * j;
                double end = start + s.length / ml;
                int istart = (int) Math.floor(start);
                // Rounding errors can push the slice end past the string
                int iend = Math.min((int) Math.ceil(end), s.length);

                for (int k = istart + 1; k < iend; k++) {
                    votes[indexOf(alphabet, s[k])] += weight;
                }
                votes[indexOf(alphabet, s[istart])] += weight * (1 + istart - start);
                votes[indexOf(alphabet, s[iend - 1])] -= weight * (iend - end);
            }
            int elected = 0;
            for (int k = 1; k < votes.length; k++) {
                if (votes[k] > votes[elected]) {
                    elected = k;
                }
            }
            median[j] = alphabet[elected];
        }
        return median;
    }

    private static int indexOf(int[] alphabet, int symbol) {
        return Arrays.binarySearch(alphabet, symbol);
    }
}

package com.fuzzy.matching.median;

import com.fuzzy.matching.core.ScratchBuffers;

import java.util.Arrays;

/**
 * Greedy generalized median: the candidate grows one symbol at a time, each time appending the
 * alphabet symbol whose weighted sum of row minima is smallest.
 *
 * <p>The weighted sum of row ends gives the total distance of every prefix length tried; the
 * prefix with the smallest total wins. Growth stops at {@code 2 * maxLength + 1} symbols, or as
 * soon as a prefix longer than every input is worse than its predecessor.</p>
 */
final class GreedyMedian {

    private GreedyMedian() {
    }

    static int[] compute(int[][] strings, double[] weights) {
        int[] alphabet = SymbolAlphabet.of(strings);
        if (alphabet.length == 0) {
            return new int[0];
        }

        LevenshteinRows rows = new LevenshteinRows(strings);
        int maxLength = rows.maxLength();
        int stopLength = 2 * maxLength + 1;
        int[] median = ScratchBuffers.intBuffer(stopLength);
        // medianDistance[len] is the total distance of the prefix of length len
        double[] medianDistance = ScratchBuffers.doubleBuffer(stopLength + 1L);
        for (int i = 0; i < strings.length; i++) {
            medianDistance[0] += strings[i].length * weights[i];
        }

        for (int len = 1; len <= stopLength; len++) {
            double minMinSum = Double.POSITIVE_INFINITY;
            for (int symbol : alphabet) {
                double totalDistance = 0.0;
                double minSum = 0.0;
                for (int i = 0; i < strings.length; i++) {
                    int[] s = strings[i];
                    int[] row = rows.row(i);
                    int min = len;
                    int x = len;
                    for (int k = 0; k < s.length; k++) {
                        x = Math.min(x + 1, row[k] + (symbol != s[k] ? 1 : 0));
                        x = Math.min(x, row[k + 1] + 1);
                        min = Math.min(min, x);
                    }
                    minSum += min * weights[i];
                    totalDistance += x * weights[i];
                }
                if (minSum < minMinSum) {
                    minMinSum = minSum;
                    medianDistance[len] = totalDistance;
                    median[len - 1] = symbol;
                }
            }
            if (len == stopLength || (len > maxLength && medianDistance[len] > medianDistance[len - 1])) {
                stopLength = len;
                break;
            }
            rows.append(median[len - 1], len);
        }

        int bestLength = 0;
        for (int len = 1; len <= stopLength; len++) {
            if (medianDistance[len] < medianDistance[bestLength]) {
                bestLength = len;
            }
        }
        return Arrays.copyOf(median, bestLength);
    }
}

package com.fuzzy.matching.median;

import java.util.Arrays;

/**
 * Sorted set of the symbols occurring in a string set. The median searches iterate over it
 * instead of the whole symbol space, so ties go to the smaller symbol.
 */
final class SymbolAlphabet {

    private SymbolAlphabet() {
    }

    static int[] of(int[][] strings) {
        int total = 0;
        for (int[] s : strings) {
            total += s.length;
        }
        int[] all = new int[total];
        int pos = 0;
        for (int[] s : strings) {
            System.arraycopy(s, 0, all, pos, s.length);
            pos += s.length;
        }
        Arrays.sort(all);

        int distinct = 0;
        for (int i = 0; i < all.length; i++) {
            if (i == 0 || all[i] != all[i - 1]) {
                all[distinct++] = all[i];
            }
        }
        return Arrays.copyOf(all, distinct);
    }
}

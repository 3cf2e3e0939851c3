package com.fuzzy.matching.core.model;

/**
 * Static helpers shared by the dynamic programs.
 */
public final class SymbolSequences {

    private SymbolSequences() {
    }

    /**
     * Returns the length of the longest common prefix.
     */
    public static int commonPrefixLength(SymbolSequence<?> a, SymbolSequence<?> b) {
        int max = Math.min(a.length(), b.length());
        int prefix = 0;
        while (prefix < max && a.symbolAt(prefix) == b.symbolAt(prefix)) {
            prefix++;
        }
        return prefix;
    }

    /**
     * Returns the length of the longest common suffix that does not overlap the first
     * {@code prefixLength} symbols of either sequence.
     */
    public static int commonSuffixLength(SymbolSequence<?> a, SymbolSequence<?> b, int prefixLength) {
        int len1 = a.length();
        int len2 = b.length();
        int max = Math.min(len1, len2) - prefixLength;
        int suffix = 0;
        while (suffix < max && a.symbolAt(len1 - 1 - suffix) == b.symbolAt(len2 - 1 - suffix)) {
            suffix++;
        }
        return suffix;
    }
}

package com.fuzzy.matching.api;

/**
 * How {@link FuzzyMatcher} turns Java strings into symbol sequences.
 */
public enum SymbolEncoding {
    /** One symbol per Unicode code point. */
    CODE_POINTS,
    /** One symbol per byte of the UTF-8 encoding. */
    UTF8_BYTES
}

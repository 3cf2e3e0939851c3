package com.fuzzy.matching.metrics;

import java.util.Locale;

/**
 * Operations of the {@code FuzzyMatcher} facade, used as metric tag and log context value.
 */
public enum Operation {
    DISTANCE,
    RATIO,
    HAMMING,
    JARO,
    JARO_WINKLER,
    MEDIAN,
    MEDIAN_IMPROVE,
    QUICK_MEDIAN,
    SET_MEDIAN,
    EDIT_OPS,
    OP_CODES,
    INVERSE,
    APPLY_EDIT,
    MATCHING_BLOCKS,
    SUBTRACT_EDIT,
    SEQ_RATIO,
    SET_RATIO;

    /**
     * Lower-case name used in tags and MDC values, e.g. {@code jaro_winkler}.
     */
    public String tagValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}

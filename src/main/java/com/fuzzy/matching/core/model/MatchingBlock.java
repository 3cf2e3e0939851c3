package com.fuzzy.matching.core.model;

/**
 * Maximal run of symbols shared by source and destination and untouched by an edit.
 *
 * @param sourcePos start of the run in the source
 * @param destPos   start of the run in the destination
 * @param length    number of symbols in the run
 */
public record MatchingBlock(int sourcePos, int destPos, int length) {

    /**
     * Zero-length block closing every matching-block list.
     */
    public static MatchingBlock sentinel(int sourceLength, int destLength) {
        return new MatchingBlock(sourceLength, destLength, 0);
    }
}

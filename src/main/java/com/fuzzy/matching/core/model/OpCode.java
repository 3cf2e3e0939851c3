package com.fuzzy.matching.core.model;

/**
 * Block edit operation over half-open ranges of the source and destination.
 *
 * @param type        the operation type
 * @param sourceBegin first source position of the block
 * @param sourceEnd   source position just past the block
 * @param destBegin   first destination position of the block
 * @param destEnd     destination position just past the block
 */
public record OpCode(EditType type, int sourceBegin, int sourceEnd, int destBegin, int destEnd) {

    public int sourceLength() {
        return sourceEnd - sourceBegin;
    }

    public int destLength() {
        return destEnd - destBegin;
    }

    /**
     * Returns the block with source and destination ranges exchanged.
     */
    public OpCode inverse() {
        return new OpCode(type == null ? null : type.inverse(), destBegin, destEnd, sourceBegin, sourceEnd);
    }

    @Override
    public String toString() {
        return type + "[" + sourceBegin + ".." + sourceEnd + ", " + destBegin + ".." + destEnd + "]";
    }
}

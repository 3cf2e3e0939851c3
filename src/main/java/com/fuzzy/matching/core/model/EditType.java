package com.fuzzy.matching.core.model;

/**
 * Kind of an edit operation, atomic or block.
 */
public enum EditType {
    /**
     * Symbols are left unchanged (sometimes called "equal").
     */
    KEEP,

    /**
     * Source symbols are substituted by destination symbols.
     */
    REPLACE,

    /**
     * Destination symbols are inserted into the source.
     */
    INSERT,

    /**
     * Source symbols are removed.
     */
    DELETE;

    /**
     * Returns the type seen from the destination side: INSERT and DELETE swap, the others stay.
     */
    public EditType inverse() {
        return switch (this) {
            case INSERT -> DELETE;
            case DELETE -> INSERT;
            default -> this;
        };
    }
}

package com.fuzzy.matching.core.model;

/**
 * Outcome of structural validation of an edit-operation list.
 */
public enum EditOpError {
    OK("no error"),
    BAD_KIND("missing or unsupported edit type"),
    OUT_OF_BOUNDS("edit position out of sequence bounds"),
    NOT_ORDERED("edit operations are not ordered"),
    BAD_BLOCK_BOUNDARY("inconsistent block boundaries"),
    INCOMPLETE_SPAN("blocks do not span both sequences completely");

    private final String description;

    EditOpError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isOk() {
        return this == OK;
    }
}

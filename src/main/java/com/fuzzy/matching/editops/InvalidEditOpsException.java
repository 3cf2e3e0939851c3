package com.fuzzy.matching.editops;

import com.fuzzy.matching.core.model.EditOpError;

/**
 * Thrown when an edit-operation list fails structural validation or is not applicable to the
 * given sequences.
 */
public class InvalidEditOpsException extends IllegalArgumentException {

    private final EditOpError error;

    public InvalidEditOpsException(EditOpError error) {
        this(error, error.getDescription());
    }

    public InvalidEditOpsException(EditOpError error, String message) {
        super("Invalid edit operations (" + error + "): " + message);
        this.error = error;
    }

    public EditOpError getError() {
        return error;
    }
}

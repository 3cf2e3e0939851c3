package com.fuzzy.matching.core;

/**
 * Runtime exception thrown when a scratch buffer sized from the inputs cannot be obtained.
 */
public class AllocationFailureException extends RuntimeException {

    public AllocationFailureException(String message) {
        super(message);
    }

    public AllocationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}

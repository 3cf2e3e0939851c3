package com.fuzzy.matching.similarity;

/**
 * Thrown when a metric defined only for equal-length sequences receives sequences of
 * different lengths.
 */
public class LengthMismatchException extends IllegalArgumentException {

    private final int firstLength;
    private final int secondLength;

    public LengthMismatchException(int firstLength, int secondLength) {
        super("Expected two sequences of the same length, got " + firstLength + " and " + secondLength);
        this.firstLength = firstLength;
        this.secondLength = secondLength;
    }

    public int getFirstLength() {
        return firstLength;
    }

    public int getSecondLength() {
        return secondLength;
    }
}

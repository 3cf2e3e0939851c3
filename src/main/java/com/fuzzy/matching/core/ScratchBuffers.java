package com.fuzzy.matching.core;

/**
 * Allocates the per-call scratch memory of the algorithms (DP rows, cost matrices).
 *
 * <p>Matrices are flat row-major arrays. Sizes are checked for overflow and allocation failures
 * surface as {@link AllocationFailureException} instead of truncated results.</p>
 */
public final class ScratchBuffers {

    // Some VMs reserve header words in arrays
    static final long MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8L;

    private ScratchBuffers() {
    }

    /**
     * Allocates a zeroed {@code int} buffer.
     */
    public static int[] intBuffer(long length) {
        int size = checkedSize(length);
        try {
            return new int[size];
        } catch (OutOfMemoryError e) {
            throw new AllocationFailureException("Cannot allocate int buffer of length " + length, e);
        }
    }

    /**
     * Allocates a zeroed {@code double} buffer.
     */
    public static double[] doubleBuffer(long length) {
        int size = checkedSize(length);
        try {
            return new double[size];
        } catch (OutOfMemoryError e) {
            throw new AllocationFailureException("Cannot allocate double buffer of length " + length, e);
        }
    }

    /**
     * Allocates a flat {@code rows x cols} int matrix.
     */
    public static int[] intMatrix(int rows, int cols) {
        return intBuffer((long) rows * cols);
    }

    /**
     * Allocates a flat {@code rows x cols} double matrix.
     */
    public static double[] doubleMatrix(int rows, int cols) {
        return doubleBuffer((long) rows * cols);
    }

    private static int checkedSize(long length) {
        if (length < 0 || length > MAX_ARRAY_LENGTH) {
            throw new AllocationFailureException("Scratch buffer length " + length + " exceeds the addressable maximum");
        }
        return (int) length;
    }
}

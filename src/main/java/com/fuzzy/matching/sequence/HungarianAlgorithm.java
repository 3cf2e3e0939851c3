package com.fuzzy.matching.sequence;

import com.fuzzy.matching.core.ScratchBuffers;

import java.util.Arrays;

/**
 * Minimum-cost assignment (Kuhn-Munkres with row and column potentials), O(rows² · cols).
 */
public final class HungarianAlgorithm {

    private HungarianAlgorithm() {
    }

    /**
     * Assigns every row to a distinct column so that the total cost is minimal.
     *
     * @param costs flat row-major {@code rows x cols} cost matrix of finite values
     * @param rows  number of rows, at most {@code cols}
     * @param cols  number of columns
     * @return the column assigned to each row
     * @throws IllegalArgumentException if the dimensions do not fit the matrix or rows exceed columns
     */
    public static int[] assign(double[] costs, int rows, int cols) {
        if (rows < 0 || rows > cols || costs.length != (long) rows * cols) {
            throw new IllegalArgumentException(
                    "Invalid assignment matrix: " + rows + "x" + cols + " with " + costs.length + " entries");
        }

        // 1-based potentials; column 0 is the virtual start column
        double[] u = ScratchBuffers.doubleBuffer(rows + 1L);
        double[] v = ScratchBuffers.doubleBuffer(cols + 1L);
        int[] owner = ScratchBuffers.intBuffer(cols + 1L);
        int[] way = ScratchBuffers.intBuffer(cols + 1L);
        double[] minSlack = ScratchBuffers.doubleBuffer(cols + 1L);
        boolean[] used = new boolean[cols + 1];

        for (int row = 1; row <= rows; row++) {
            owner[0] = row;
            int col0 = 0;
            Arrays.fill(minSlack, Double.POSITIVE_INFINITY);
            Arrays.fill(used, false);
            do {
                used[col0] = true;
                int row0 = owner[col0];
                double delta = Double.POSITIVE_INFINITY;
                int col1 = 0;
                for (int col = 1; col <= cols; col++) {
                    if (used[col]) {
                        continue;
                    }
                    double slack = costs[(row0 - 1) * cols + col - 1] - u[row0] - v[col];
                    if (slack < minSlack[col]) {
                        minSlack[col] = slack;
                        way[col] = col0;
                    }
                    if (minSlack[col] < delta) {
                        delta = minSlack[col];
                        col1 = col;
                    }
                }
                for (int col = 0; col <= cols; col++) {
                    if (used[col]) {
                        u[owner[col]] += delta;
                        v[col] -= delta;
                    } else {
                        minSlack[col] -= delta;
                    }
                }
                col0 = col1;
            } while (owner[col0] != 0);

            // Flip the augmenting path
            do {
                int col1 = way[col0];
                owner[col0] = owner[col1];
                col0 = col1;
            } while (col0 != 0);
        }

        int[] assignment = new int[rows];
        for (int col = 1; col <= cols; col++) {
            if (owner[col] != 0) {
                assignment[owner[col] - 1] = col - 1;
            }
        }
        return assignment;
    }
}

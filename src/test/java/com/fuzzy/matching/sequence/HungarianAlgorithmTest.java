package com.fuzzy.matching.sequence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class HungarianAlgorithmTest {

    @Test
    @DisplayName("Finds the minimum-cost assignment of a square matrix")
    void squareMatrix() {
        double[] costs = {
                4, 1, 3,
                2, 0, 5,
                3, 2, 2
        };

        int[] assignment = HungarianAlgorithm.assign(costs, 3, 3);

        assertArrayEquals(new int[]{1, 0, 2}, assignment);
    }

    @Test
    @DisplayName("Assigns every row of a wide matrix to a distinct column")
    void wideMatrix() {
        double[] costs = {
                9, 2, 7, 1,
                6, 4, 3, 8
        };

        int[] assignment = HungarianAlgorithm.assign(costs, 2, 4);

        assertArrayEquals(new int[]{3, 2}, assignment);
    }

    @Test
    @DisplayName("Matches brute force on a matrix with many ties")
    void tiesMatchBruteForce() {
        double[] costs = {
                1, 1, 0.5, 2,
                1, 0.5, 1, 1,
                0.5, 1, 1, 1,
                2, 1, 1, 0.5
        };

        int[] assignment = HungarianAlgorithm.assign(costs, 4, 4);

        double total = 0.0;
        for (int i = 0; i < 4; i++) {
            total += costs[i * 4 + assignment[i]];
        }
        assertEquals(2.0, total, 1e-12);
        assertEquals(4, Arrays.stream(assignment).distinct().count());
    }

    @Test
    @DisplayName("Rejects more rows than columns")
    void rejectsTallMatrix() {
        assertThrows(IllegalArgumentException.class, () -> HungarianAlgorithm.assign(new double[6], 3, 2));
        assertThrows(IllegalArgumentException.class, () -> HungarianAlgorithm.assign(new double[5], 2, 3));
    }

    @Test
    @DisplayName("Empty matrix gives an empty assignment")
    void emptyMatrix() {
        assertEquals(0, HungarianAlgorithm.assign(new double[0], 0, 0).length);
    }
}

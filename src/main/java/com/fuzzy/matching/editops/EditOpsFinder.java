package com.fuzzy.matching.editops;

import com.fuzzy.matching.core.ScratchBuffers;
import com.fuzzy.matching.core.model.EditOp;
import com.fuzzy.matching.core.model.OpCode;
import com.fuzzy.matching.core.model.SymbolSequence;
import com.fuzzy.matching.core.model.SymbolSequences;

import java.util.List;
import java.util.Objects;

/**
 * Finds an optimal unit-cost edit between two sequences.
 *
 * <p>The common prefix and suffix are stripped, the full Levenshtein cost matrix of the rest is
 * filled, and the backtrace walks from the bottom-right cell to the origin. When several moves are
 * optimal the choice is fixed, so the same inputs always yield the same alignment:</p>
 * <ol>
 *   <li>keep inserting (or deleting) while the previous move was an insertion (deletion);</li>
 *   <li>otherwise move diagonally over equal symbols;</li>
 *   <li>otherwise substitute;</li>
 *   <li>otherwise, with no pending direction, insert, then delete.</li>
 * </ol>
 */
public final class EditOpsFinder {

    private EditOpsFinder() {
    }

    /**
     * Returns an ordered, normalized list of atomic operations transforming {@code s1} into
     * {@code s2}. Its size equals the unit-cost Levenshtein distance.
     */
    public static List<EditOp> find(SymbolSequence<?> s1, SymbolSequence<?> s2) {
        Objects.requireNonNull(s1, "s1 is required");
        Objects.requireNonNull(s2, "s2 is required");

        int offset = SymbolSequences.commonPrefixLength(s1, s2);
        int suffix = SymbolSequences.commonSuffixLength(s1, s2, offset);
        int rows = s1.length() - offset - suffix + 1;
        int cols = s2.length() - offset - suffix + 1;

        int[] matrix = ScratchBuffers.intMatrix(rows, cols);
        for (int j = 0; j < cols; j++) {
            matrix[j] = j;
        }
        for (int i = 1; i < rows; i++) {
            matrix[cols * i] = i;
        }

        for (int i = 1; i < rows; i++) {
            int row = i * cols;
            int previous = row - cols;
            int symbol = s1.symbolAt(offset + i - 1);
            for (int j = 1; j < cols; j++) {
                int diagonal = matrix[previous + j - 1] + (symbol == s2.symbolAt(offset + j - 1) ? 0 : 1);
                int sideways = Math.min(matrix[row + j - 1], matrix[previous + j]) + 1;
                matrix[row + j] = Math.min(diagonal, sideways);
            }
        }

        return backtrace(s1, s2, offset, rows, cols, matrix);
    }

    /**
     * Returns the alignment of {@link #find} as block operations spanning both sequences.
     */
    public static List<OpCode> findBlocks(SymbolSequence<?> s1, SymbolSequence<?> s2) {
        return EditOps.toBlockOps(find(s1, s2), s1.length(), s2.length());
    }

    private static List<EditOp> backtrace(SymbolSequence<?> s1, SymbolSequence<?> s2, int offset,
                                          int rows, int cols, int[] matrix) {
        int p = rows * cols - 1;
        int pos = matrix[p];
        if (pos == 0) {
            return List.of();
        }

        EditOp[] ops = new EditOp[pos];
        int i = rows - 1;
        int j = cols - 1;
        // -1 while inserting, 1 while deleting, 0 otherwise
        int direction = 0;

        while (i > 0 || j > 0) {
            if (direction < 0 && j > 0 && matrix[p] == matrix[p - 1] + 1) {
                j--;
                ops[--pos] = EditOp.insert(i + offset, j + offset);
                p--;
                continue;
            }
            if (direction > 0 && i > 0 && matrix[p] == matrix[p - cols] + 1) {
                i--;
                ops[--pos] = EditOp.delete(i + offset, j + offset);
                p -= cols;
                continue;
            }
            if (i > 0 && j > 0 && matrix[p] == matrix[p - cols - 1]
                    && s1.symbolAt(offset + i - 1) == s2.symbolAt(offset + j - 1)) {
                i--;
                j--;
                p -= cols + 1;
                direction = 0;
                continue;
            }
            if (i > 0 && j > 0 && matrix[p] == matrix[p - cols - 1] + 1) {
                i--;
                j--;
                ops[--pos] = EditOp.replace(i + offset, j + offset);
                p -= cols + 1;
                direction = 0;
                continue;
            }
            // Never turn directly from inserting to deleting, a diagonal move is at least as good
            if (direction == 0 && j > 0 && matrix[p] == matrix[p - 1] + 1) {
                j--;
                ops[--pos] = EditOp.insert(i + offset, j + offset);
                p--;
                direction = -1;
                continue;
            }
            if (direction == 0 && i > 0 && matrix[p] == matrix[p - cols] + 1) {
                i--;
                ops[--pos] = EditOp.delete(i + offset, j + offset);
                p -= cols;
                direction = 1;
                continue;
            }
            throw new IllegalStateException("Backtrace lost in the cost matrix at (" + i + ", " + j + ")");
        }

        return List.of(ops);
    }
}

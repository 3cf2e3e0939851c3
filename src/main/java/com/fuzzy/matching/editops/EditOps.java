package com.fuzzy.matching.editops;

import com.fuzzy.matching.core.model.EditOp;
import com.fuzzy.matching.core.model.EditOpError;
import com.fuzzy.matching.core.model.EditType;
import com.fuzzy.matching.core.model.MatchingBlock;
import com.fuzzy.matching.core.model.OpCode;
import com.fuzzy.matching.core.model.SymbolSequence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Algebra over atomic edit operations: conversion to blocks, inversion, application,
 * matching blocks, subtraction and normalization.
 *
 * <p>Every operation accepts lists with or without KEEP entries. Operations taking sequence
 * lengths validate the list with {@link EditOpsValidator} before using it.</p>
 */
public final class EditOps {

    private EditOps() {
    }

    /**
     * Converts atomic operations to block operations covering both sequences completely.
     * Consecutive operations of the same type form one block, gaps become KEEP blocks.
     *
     * @throws InvalidEditOpsException if {@code ops} is not a valid edit for the lengths
     */
    public static List<OpCode> toBlockOps(List<EditOp> ops, int len1, int len2) {
        EditOpsValidator.requireValidEditOps(len1, len2, ops);

        List<OpCode> blocks = new ArrayList<>();
        int spos = 0;
        int dpos = 0;
        int i = 0;
        int n = ops.size();
        while (i < n) {
            EditOp op = ops.get(i);
            if (op.type() == EditType.KEEP) {
                i++;
                continue;
            }
            if (spos < op.sourcePos() || dpos < op.destPos()) {
                blocks.add(new OpCode(EditType.KEEP, spos, op.sourcePos(), dpos, op.destPos()));
                spos = op.sourcePos();
                dpos = op.destPos();
            }
            EditType type = op.type();
            int sourceBegin = spos;
            int destBegin = dpos;
            do {
                if (type != EditType.INSERT) {
                    spos++;
                }
                if (type != EditType.DELETE) {
                    dpos++;
                }
                i++;
            } while (i < n && continues(ops.get(i), type, spos, dpos));
            blocks.add(new OpCode(type, sourceBegin, spos, destBegin, dpos));
        }
        if (spos < len1 || dpos < len2) {
            blocks.add(new OpCode(EditType.KEEP, spos, len1, dpos, len2));
        }
        return blocks;
    }

    /**
     * Inverts the sense of an edit: the result transforms the old destination into the old source.
     *
     * @throws InvalidEditOpsException if {@code ops} has a missing kind, a negative position or is not ordered
     */
    public static List<EditOp> invert(List<EditOp> ops) {
        EditOpsValidator.requireValidEditOps(ops);
        List<EditOp> inverted = new ArrayList<>(ops.size());
        for (EditOp op : ops) {
            inverted.add(op.inverse());
        }
        return inverted;
    }

    /**
     * Applies an edit, or any ordered subset of one, to {@code source}.
     * Untouched runs of {@code source} are copied verbatim, inserted and replacing symbols come
     * from {@code destination}.
     *
     * @throws InvalidEditOpsException if {@code ops} is not applicable to the two sequences
     */
    public static <S extends SymbolSequence<S>> S apply(List<EditOp> ops, S source, S destination) {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(destination, "destination is required");
        if (ops.isEmpty()) {
            return source;
        }
        EditOpsValidator.requireValidEditOps(source.length(), destination.length(), ops);

        int[] result = new int[source.length() + ops.size()];
        int length = 0;
        int spos = 0;
        for (EditOp op : ops) {
            // A KEEP copies the kept symbol along with the untouched run before it
            int run = op.sourcePos() - spos + (op.type() == EditType.KEEP ? 1 : 0);
            for (int k = 0; k < run; k++) {
                result[length++] = source.symbolAt(spos++);
            }
            switch (op.type()) {
                case DELETE -> spos++;
                case REPLACE -> {
                    spos++;
                    result[length++] = destination.symbolAt(op.destPos());
                }
                case INSERT -> result[length++] = destination.symbolAt(op.destPos());
                default -> {
                }
            }
        }
        while (spos < source.length()) {
            result[length++] = source.symbolAt(spos++);
        }
        return source.withSymbols(Arrays.copyOf(result, length));
    }

    /**
     * Returns the runs of symbols untouched by {@code ops}, closed by the zero-length sentinel
     * {@code (len1, len2, 0)}. Run lengths are measured on the source side.
     *
     * @throws InvalidEditOpsException if {@code ops} is not a valid edit for the lengths
     */
    public static List<MatchingBlock> matchingBlocks(List<EditOp> ops, int len1, int len2) {
        EditOpsValidator.requireValidEditOps(len1, len2, ops);

        List<MatchingBlock> blocks = new ArrayList<>();
        int spos = 0;
        int dpos = 0;
        int i = 0;
        int n = ops.size();
        while (i < n) {
            EditOp op = ops.get(i);
            if (op.type() == EditType.KEEP) {
                i++;
                continue;
            }
            if (spos < op.sourcePos() || dpos < op.destPos()) {
                addBlock(blocks, spos, dpos, op.sourcePos() - spos);
                spos = op.sourcePos();
                dpos = op.destPos();
            }
            EditType type = op.type();
            do {
                if (type != EditType.INSERT) {
                    spos++;
                }
                if (type != EditType.DELETE) {
                    dpos++;
                }
                i++;
            } while (i < n && continues(ops.get(i), type, spos, dpos));
        }
        if (spos < len1 || dpos < len2) {
            addBlock(blocks, spos, dpos, len1 - spos);
        }
        blocks.add(MatchingBlock.sentinel(len1, len2));
        return blocks;
    }

    /**
     * Subtracts an ordered subset of an edit from it.
     *
     * <p>Applying the result to the outcome of applying {@code subsequence} gives the same final
     * sequence as applying {@code ops} to the original. The remainder is computed by shifting the
     * source positions of the remaining operations, not by a fresh alignment, so it may differ from
     * {@link EditOpsFinder#find} in ambiguous cases. KEEP entries are dropped.</p>
     *
     * @throws InvalidEditOpsException if either list is malformed or {@code subsequence} is not an
     *                                 ordered subset of {@code ops}
     */
    public static List<EditOp> subtract(List<EditOp> ops, List<EditOp> subsequence) {
        EditOpsValidator.requireValidEditOps(ops);
        EditOpsValidator.requireValidEditOps(subsequence);

        List<EditOp> remainder = new ArrayList<>();
        int n = ops.size();
        int j = 0;
        int shift = 0;
        for (EditOp removed : subsequence) {
            while (j < n && !ops.get(j).equals(removed)) {
                addShifted(remainder, ops.get(j), shift);
                j++;
            }
            if (j == n) {
                throw new InvalidEditOpsException(EditOpError.NOT_ORDERED,
                        "subsequence entry " + removed + " is not part of an ordered subset of ops");
            }
            shift += sourceShift(removed.type());
            j++;
        }
        while (j < n) {
            addShifted(remainder, ops.get(j), shift);
            j++;
        }
        return remainder;
    }

    /**
     * Removes KEEP entries.
     */
    public static List<EditOp> normalize(List<EditOp> ops) {
        Objects.requireNonNull(ops, "ops is required");
        List<EditOp> normalized = new ArrayList<>(ops.size());
        for (EditOp op : ops) {
            if (op.type() != EditType.KEEP) {
                normalized.add(op);
            }
        }
        return normalized;
    }

    /**
     * Returns the unit cost of an edit, the number of non-KEEP entries.
     */
    public static int totalCost(List<EditOp> ops) {
        int cost = 0;
        for (EditOp op : ops) {
            if (op.type() != EditType.KEEP) {
                cost++;
            }
        }
        return cost;
    }

    private static boolean continues(EditOp next, EditType type, int spos, int dpos) {
        return next.type() == type && next.sourcePos() == spos && next.destPos() == dpos;
    }

    private static void addBlock(List<MatchingBlock> blocks, int spos, int dpos, int length) {
        if (length > 0) {
            blocks.add(new MatchingBlock(spos, dpos, length));
        }
    }

    private static void addShifted(List<EditOp> remainder, EditOp op, int shift) {
        if (op.type() != EditType.KEEP) {
            remainder.add(new EditOp(op.type(), op.sourcePos() + shift, op.destPos()));
        }
    }

    private static int sourceShift(EditType type) {
        return switch (type) {
            case INSERT -> 1;
            case DELETE -> -1;
            default -> 0;
        };
    }
}

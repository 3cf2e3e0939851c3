package com.fuzzy.matching.editops;

import com.fuzzy.matching.core.model.EditOp;
import com.fuzzy.matching.core.model.EditType;
import com.fuzzy.matching.core.model.MatchingBlock;
import com.fuzzy.matching.core.model.OpCode;
import com.fuzzy.matching.core.model.SymbolSequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Algebra over block edit operations. A block edit always spans both sequences completely.
 */
public final class OpCodes {

    private OpCodes() {
    }

    /**
     * Expands blocks into atomic operations, one per symbol position.
     * The sequence lengths are taken from the last block.
     *
     * @param keepKeep whether KEEP blocks are expanded too; without them the result is normalized
     * @throws InvalidEditOpsException if {@code ops} is not a complete block edit
     */
    public static List<EditOp> toAtomicOps(List<OpCode> ops, boolean keepKeep) {
        Objects.requireNonNull(ops, "ops is required");
        int len1 = ops.isEmpty() ? 0 : ops.get(ops.size() - 1).sourceEnd();
        int len2 = ops.isEmpty() ? 0 : ops.get(ops.size() - 1).destEnd();
        return toAtomicOps(ops, len1, len2, keepKeep);
    }

    /**
     * Expands blocks into atomic operations after validating them against the sequence lengths.
     *
     * @throws InvalidEditOpsException if {@code ops} is not a complete block edit for the lengths
     */
    public static List<EditOp> toAtomicOps(List<OpCode> ops, int len1, int len2, boolean keepKeep) {
        EditOpsValidator.requireValidOpCodes(len1, len2, ops);

        List<EditOp> atomic = new ArrayList<>();
        for (OpCode op : ops) {
            switch (op.type()) {
                case KEEP -> {
                    if (keepKeep) {
                        for (int k = 0; k < op.sourceLength(); k++) {
                            atomic.add(EditOp.keep(op.sourceBegin() + k, op.destBegin() + k));
                        }
                    }
                }
                case REPLACE -> {
                    for (int k = 0; k < op.sourceLength(); k++) {
                        atomic.add(EditOp.replace(op.sourceBegin() + k, op.destBegin() + k));
                    }
                }
                case DELETE -> {
                    for (int k = 0; k < op.sourceLength(); k++) {
                        atomic.add(EditOp.delete(op.sourceBegin() + k, op.destBegin()));
                    }
                }
                case INSERT -> {
                    for (int k = 0; k < op.destLength(); k++) {
                        atomic.add(EditOp.insert(op.sourceBegin(), op.destBegin() + k));
                    }
                }
            }
        }
        return atomic;
    }

    /**
     * Inverts the sense of a block edit: source and destination ranges swap, INSERT and DELETE
     * swap.
     *
     * @throws InvalidEditOpsException if the blocks are malformed or do not follow each other from {@code (0, 0)}
     */
    public static List<OpCode> invert(List<OpCode> ops) {
        EditOpsValidator.requireValidOpCodes(ops);
        List<OpCode> inverted = new ArrayList<>(ops.size());
        for (OpCode op : ops) {
            inverted.add(op.inverse());
        }
        return inverted;
    }

    /**
     * Replays a block edit: KEEP blocks copy from {@code source}, INSERT and REPLACE blocks copy
     * from {@code destination}, DELETE blocks copy nothing.
     *
     * @throws InvalidEditOpsException if {@code ops} is not a complete block edit for the sequences
     */
    public static <S extends SymbolSequence<S>> S apply(List<OpCode> ops, S source, S destination) {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(destination, "destination is required");
        EditOpsValidator.requireValidOpCodes(source.length(), destination.length(), ops);

        int[] result = new int[destination.length()];
        int length = 0;
        for (OpCode op : ops) {
            switch (op.type()) {
                case KEEP -> {
                    for (int k = op.sourceBegin(); k < op.sourceEnd(); k++) {
                        result[length++] = source.symbolAt(k);
                    }
                }
                case INSERT, REPLACE -> {
                    for (int k = op.destBegin(); k < op.destEnd(); k++) {
                        result[length++] = destination.symbolAt(k);
                    }
                }
                case DELETE -> {
                }
            }
        }
        return source.withSymbols(result);
    }

    /**
     * Returns the KEEP blocks as matching blocks, adjacent KEEP blocks merged, closed by the
     * zero-length sentinel {@code (len1, len2, 0)}.
     *
     * @throws InvalidEditOpsException if {@code ops} is not a complete block edit for the lengths
     */
    public static List<MatchingBlock> matchingBlocks(List<OpCode> ops, int len1, int len2) {
        EditOpsValidator.requireValidOpCodes(len1, len2, ops);

        List<MatchingBlock> blocks = new ArrayList<>();
        int i = 0;
        while (i < ops.size()) {
            OpCode op = ops.get(i);
            if (op.type() != EditType.KEEP) {
                i++;
                continue;
            }
            int sourcePos = op.sourceBegin();
            int destPos = op.destBegin();
            int sourceEnd = op.sourceEnd();
            i++;
            while (i < ops.size() && ops.get(i).type() == EditType.KEEP) {
                sourceEnd = ops.get(i).sourceEnd();
                i++;
            }
            blocks.add(new MatchingBlock(sourcePos, destPos, sourceEnd - sourcePos));
        }
        blocks.add(MatchingBlock.sentinel(len1, len2));
        return blocks;
    }

    /**
     * Returns the unit cost of a block edit.
     */
    public static int totalCost(List<OpCode> ops) {
        int cost = 0;
        for (OpCode op : ops) {
            switch (op.type()) {
                case REPLACE, DELETE -> cost += op.sourceLength();
                case INSERT -> cost += op.destLength();
                default -> {
                }
            }
        }
        return cost;
    }
}

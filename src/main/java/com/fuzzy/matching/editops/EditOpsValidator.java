package com.fuzzy.matching.editops;

import com.fuzzy.matching.core.model.EditOp;
import com.fuzzy.matching.core.model.EditOpError;
import com.fuzzy.matching.core.model.EditType;
import com.fuzzy.matching.core.model.OpCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Structural validation of atomic and block edit-operation lists.
 *
 * <p>The operations of {@link EditOps} and {@link OpCodes} trust their input only after it has
 * passed through one of the {@code require*} methods.</p>
 */
public final class EditOpsValidator {
    private static final Logger log = LoggerFactory.getLogger(EditOpsValidator.class);

    // Stands in for a length when only the shape of a block edit is checked
    private static final int UNKNOWN_LENGTH = Integer.MAX_VALUE;

    private EditOpsValidator() {
    }

    /**
     * Checks whether {@code ops} is an ordered partial edit from a sequence of length {@code len1}
     * to a sequence of length {@code len2}.
     *
     * @return {@link EditOpError#OK} or the first problem found
     */
    public static EditOpError checkEditOps(int len1, int len2, List<EditOp> ops) {
        Objects.requireNonNull(ops, "ops is required");
        for (EditOp op : ops) {
            if (op == null || op.type() == null) {
                return EditOpError.BAD_KIND;
            }
            if (op.sourcePos() < 0 || op.destPos() < 0 || op.sourcePos() > len1 || op.destPos() > len2) {
                return EditOpError.OUT_OF_BOUNDS;
            }
            // Only an insertion may sit at the source end, only a deletion at the destination end
            if (op.sourcePos() == len1 && op.type() != EditType.INSERT) {
                return EditOpError.OUT_OF_BOUNDS;
            }
            if (op.destPos() == len2 && op.type() != EditType.DELETE) {
                return EditOpError.OUT_OF_BOUNDS;
            }
        }
        return checkOrder(ops);
    }

    /**
     * Checks kinds, signs and ordering of {@code ops} without knowing the sequence lengths.
     */
    public static EditOpError checkEditOps(List<EditOp> ops) {
        Objects.requireNonNull(ops, "ops is required");
        for (EditOp op : ops) {
            if (op == null || op.type() == null) {
                return EditOpError.BAD_KIND;
            }
            if (op.sourcePos() < 0 || op.destPos() < 0) {
                return EditOpError.OUT_OF_BOUNDS;
            }
        }
        return checkOrder(ops);
    }

    /**
     * Checks whether {@code ops} is a complete block edit from a sequence of length {@code len1}
     * to a sequence of length {@code len2}.
     *
     * @return {@link EditOpError#OK} or the first problem found
     */
    public static EditOpError checkOpCodes(int len1, int len2, List<OpCode> ops) {
        Objects.requireNonNull(ops, "ops is required");
        if (ops.isEmpty()) {
            return len1 == 0 && len2 == 0 ? EditOpError.OK : EditOpError.INCOMPLETE_SPAN;
        }
        return checkBlocks(len1, len2, ops);
    }

    /**
     * Checks kinds, ranges and contiguity of a block edit whose sequence lengths are unknown.
     * The blocks must start at {@code (0, 0)}; where they end is not checked.
     *
     * @return {@link EditOpError#OK} or the first problem found
     */
    public static EditOpError checkOpCodes(List<OpCode> ops) {
        Objects.requireNonNull(ops, "ops is required");
        if (ops.isEmpty()) {
            return EditOpError.OK;
        }
        return checkBlocks(UNKNOWN_LENGTH, UNKNOWN_LENGTH, ops);
    }

    private static EditOpError checkBlocks(int len1, int len2, List<OpCode> ops) {
        for (OpCode op : ops) {
            if (op == null || op.type() == null) {
                return EditOpError.BAD_KIND;
            }
        }

        OpCode first = ops.get(0);
        OpCode last = ops.get(ops.size() - 1);
        if (first.sourceBegin() != 0 || first.destBegin() != 0) {
            return EditOpError.INCOMPLETE_SPAN;
        }
        if (len1 != UNKNOWN_LENGTH && (last.sourceEnd() != len1 || last.destEnd() != len2)) {
            return EditOpError.INCOMPLETE_SPAN;
        }

        for (OpCode op : ops) {
            if (op.sourceBegin() < 0 || op.destBegin() < 0 || op.sourceEnd() > len1 || op.destEnd() > len2) {
                return EditOpError.OUT_OF_BOUNDS;
            }
            if (op.sourceLength() < 0 || op.destLength() < 0) {
                return EditOpError.BAD_BLOCK_BOUNDARY;
            }
            boolean consistent = switch (op.type()) {
                case KEEP, REPLACE -> op.sourceLength() == op.destLength() && op.destLength() > 0;
                case INSERT -> op.sourceLength() == 0 && op.destLength() > 0;
                case DELETE -> op.sourceLength() > 0 && op.destLength() == 0;
            };
            if (!consistent) {
                return EditOpError.BAD_BLOCK_BOUNDARY;
            }
        }

        for (int i = 1; i < ops.size(); i++) {
            OpCode previous = ops.get(i - 1);
            OpCode current = ops.get(i);
            if (current.sourceBegin() != previous.sourceEnd() || current.destBegin() != previous.destEnd()) {
                return EditOpError.NOT_ORDERED;
            }
        }
        return EditOpError.OK;
    }

    /**
     * Validates an atomic edit against the sequence lengths.
     *
     * @throws InvalidEditOpsException if the check fails
     */
    public static void requireValidEditOps(int len1, int len2, List<EditOp> ops) {
        raiseUnlessOk(checkEditOps(len1, len2, ops), "edit operations for lengths " + len1 + " and " + len2);
    }

    /**
     * Validates an atomic edit whose sequence lengths are unknown.
     *
     * @throws InvalidEditOpsException if the check fails
     */
    public static void requireValidEditOps(List<EditOp> ops) {
        raiseUnlessOk(checkEditOps(ops), "edit operations");
    }

    /**
     * Validates a block edit against the sequence lengths.
     *
     * @throws InvalidEditOpsException if the check fails
     */
    public static void requireValidOpCodes(int len1, int len2, List<OpCode> ops) {
        raiseUnlessOk(checkOpCodes(len1, len2, ops), "opcodes for lengths " + len1 + " and " + len2);
    }

    private static EditOpError checkOrder(List<EditOp> ops) {
        for (int i = 1; i < ops.size(); i++) {
            EditOp previous = ops.get(i - 1);
            EditOp current = ops.get(i);
            if (current.sourcePos() < previous.sourcePos() || current.destPos() < previous.destPos()) {
                return EditOpError.NOT_ORDERED;
            }
        }
        return EditOpError.OK;
    }

    /**
     * Validates a block edit whose sequence lengths are unknown.
     *
     * @throws InvalidEditOpsException if the check fails
     */
    public static void requireValidOpCodes(List<OpCode> ops) {
        raiseUnlessOk(checkOpCodes(ops), "opcodes");
    }

    private static void raiseUnlessOk(EditOpError error, String subject) {
        if (!error.isOk()) {
            log.debug("Rejected {}: {}", subject, error);
            throw new InvalidEditOpsException(error, subject + " are invalid or inapplicable: " + error.getDescription());
        }
    }
}

package com.fuzzy.matching.core.model;

/**
 * Atomic edit operation changing a single symbol.
 *
 * <p>Positions are left-edge offsets: an INSERT at {@code (s, d)} puts destination symbol {@code d}
 * before source symbol {@code s}, a DELETE at {@code (s, d)} removes source symbol {@code s}.
 * Instances are plain values; structural validity is checked by
 * {@link com.fuzzy.matching.editops.EditOpsValidator}, not on construction.</p>
 *
 * @param type      the operation type
 * @param sourcePos position in the source sequence
 * @param destPos   position in the destination sequence
 */
public record EditOp(EditType type, int sourcePos, int destPos) {

    public static EditOp keep(int sourcePos, int destPos) {
        return new EditOp(EditType.KEEP, sourcePos, destPos);
    }

    public static EditOp replace(int sourcePos, int destPos) {
        return new EditOp(EditType.REPLACE, sourcePos, destPos);
    }

    public static EditOp insert(int sourcePos, int destPos) {
        return new EditOp(EditType.INSERT, sourcePos, destPos);
    }

    public static EditOp delete(int sourcePos, int destPos) {
        return new EditOp(EditType.DELETE, sourcePos, destPos);
    }

    /**
     * Returns the operation with source and destination roles exchanged.
     */
    public EditOp inverse() {
        return new EditOp(type.inverse(), destPos, sourcePos);
    }

    @Override
    public String toString() {
        return type + "(" + sourcePos + ", " + destPos + ")";
    }
}

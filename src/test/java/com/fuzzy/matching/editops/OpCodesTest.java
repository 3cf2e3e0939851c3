package com.fuzzy.matching.editops;

import com.fuzzy.matching.core.model.CodePointSequence;
import com.fuzzy.matching.core.model.EditOpError;
import com.fuzzy.matching.core.model.EditType;
import com.fuzzy.matching.core.model.MatchingBlock;
import com.fuzzy.matching.core.model.OpCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OpCodes Tests")
class OpCodesTest {

    private static CodePointSequence cp(String s) {
        return CodePointSequence.of(s);
    }

    private static List<OpCode> blocks(String a, String b) {
        return EditOpsFinder.findBlocks(cp(a), cp(b));
    }

    @Test
    @DisplayName("Expanding blocks without KEEPs gives the atomic edit")
    void toAtomicOpsMatchesFind() {
        assertEquals(EditOpsFinder.find(cp("spam"), cp("park")), OpCodes.toAtomicOps(blocks("spam", "park"), false));
        assertEquals(EditOpsFinder.find(cp("kitten"), cp("sitting")),
                OpCodes.toAtomicOps(blocks("kitten", "sitting"), 6, 7, false));
    }

    @Test
    @DisplayName("Expansion validates against the given lengths")
    void toAtomicOpsValidates() {
        InvalidEditOpsException e = assertThrows(InvalidEditOpsException.class,
                () -> OpCodes.toAtomicOps(blocks("spam", "park"), 5, 4, false));
        assertEquals(EditOpError.INCOMPLETE_SPAN, e.getError());
    }

    @Test
    @DisplayName("Inverted blocks equal the blocks of the reverse direction")
    void invertMatchesReverse() {
        assertEquals(blocks("park", "spam"), OpCodes.invert(blocks("spam", "park")));
    }

    @Test
    @DisplayName("Applying blocks and their inverse")
    void applyAndInverse() {
        List<OpCode> ops = blocks("Levenshtein", "Lenvinsten");

        assertEquals("Lenvinsten", OpCodes.apply(ops, cp("Levenshtein"), cp("Lenvinsten")).toString());
        assertEquals("Levenshtein",
                OpCodes.apply(OpCodes.invert(ops), cp("Lenvinsten"), cp("Levenshtein")).toString());
    }

    @Test
    @DisplayName("Empty block list is only valid between empty sequences")
    void emptyBlockList() {
        assertEquals("", OpCodes.apply(List.of(), cp(""), cp("")).toString());

        InvalidEditOpsException e = assertThrows(InvalidEditOpsException.class,
                () -> OpCodes.apply(List.of(), cp("ab"), cp("ab")));
        assertEquals(EditOpError.INCOMPLETE_SPAN, e.getError());
    }

    @Test
    @DisplayName("Adjacent KEEP blocks merge into one matching block")
    void adjacentKeepsMerge() {
        List<OpCode> ops = List.of(
                new OpCode(EditType.KEEP, 0, 1, 0, 1),
                new OpCode(EditType.KEEP, 1, 2, 1, 2),
                new OpCode(EditType.REPLACE, 2, 3, 2, 3));

        assertEquals(List.of(new MatchingBlock(0, 0, 2), new MatchingBlock(3, 3, 0)),
                OpCodes.matchingBlocks(ops, 3, 3));
    }

    @Test
    @DisplayName("Matching blocks agree with the atomic form")
    void matchingBlocksAgree() {
        assertEquals(EditOps.matchingBlocks(EditOpsFinder.find(cp("spam"), cp("park")), 4, 4),
                OpCodes.matchingBlocks(blocks("spam", "park"), 4, 4));
    }

    @Test
    @DisplayName("Total cost counts changed symbols")
    void totalCost() {
        assertEquals(3, OpCodes.totalCost(blocks("kitten", "sitting")));
        assertEquals(3, OpCodes.totalCost(blocks("spam", "park")));
        assertEquals(0, OpCodes.totalCost(blocks("same", "same")));
    }

    @Test
    @DisplayName("invert rejects blocks not starting at the origin")
    void invertRejectsDisplacedStart() {
        InvalidEditOpsException e = assertThrows(InvalidEditOpsException.class,
                () -> OpCodes.invert(List.of(new OpCode(EditType.KEEP, 5, 2, 0, 9))));
        assertEquals(EditOpError.INCOMPLETE_SPAN, e.getError());
    }

    @Test
    @DisplayName("invert rejects inconsistent block ranges")
    void invertRejectsBadBoundaries() {
        List<OpCode> ops = List.of(
                new OpCode(EditType.KEEP, 0, 2, 0, 2),
                new OpCode(EditType.DELETE, 2, 1, 2, 2));

        InvalidEditOpsException e = assertThrows(InvalidEditOpsException.class, () -> OpCodes.invert(ops));
        assertEquals(EditOpError.BAD_BLOCK_BOUNDARY, e.getError());
    }

    @Test
    @DisplayName("invert rejects gaps between blocks")
    void invertRejectsGaps() {
        List<OpCode> ops = List.of(
                new OpCode(EditType.KEEP, 0, 2, 0, 2),
                new OpCode(EditType.REPLACE, 3, 4, 3, 4));

        InvalidEditOpsException e = assertThrows(InvalidEditOpsException.class, () -> OpCodes.invert(ops));
        assertEquals(EditOpError.NOT_ORDERED, e.getError());
    }

    @Test
    @DisplayName("invert rejects blocks without a kind")
    void invertRejectsMissingKind() {
        InvalidEditOpsException e = assertThrows(InvalidEditOpsException.class,
                () -> OpCodes.invert(List.of(new OpCode(null, 0, 1, 0, 1))));
        assertEquals(EditOpError.BAD_KIND, e.getError());
    }

    @Test
    @DisplayName("invert of an empty block list is empty")
    void invertEmpty() {
        assertEquals(List.of(), OpCodes.invert(List.of()));
    }
}

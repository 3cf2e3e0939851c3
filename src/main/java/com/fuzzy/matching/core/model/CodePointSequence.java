package com.fuzzy.matching.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Code-point instantiation of {@link SymbolSequence}. Symbols are Unicode code points, so a
 * supplementary character counts as one symbol.
 */
public final class CodePointSequence implements SymbolSequence<CodePointSequence> {

    public static final CodePointSequence EMPTY = new CodePointSequence(new int[0]);

    public static final SequenceFactory<CodePointSequence> FACTORY = CodePointSequence::fromSymbolArray;

    private final int[] codePoints;

    private CodePointSequence(int[] codePoints) {
        this.codePoints = codePoints;
    }

    /**
     * Creates a sequence holding the code points of the given text.
     */
    public static CodePointSequence of(String text) {
        Objects.requireNonNull(text, "text is required");
        return new CodePointSequence(text.codePoints().toArray());
    }

    private static CodePointSequence fromSymbolArray(int[] symbols) {
        for (int i = 0; i < symbols.length; i++) {
            if (!Character.isValidCodePoint(symbols[i])) {
                throw new IllegalArgumentException("Symbol " + symbols[i] + " at index " + i + " is not a code point");
            }
        }
        return new CodePointSequence(symbols.clone());
    }

    @Override
    public int length() {
        return codePoints.length;
    }

    @Override
    public int symbolAt(int index) {
        return codePoints[index];
    }

    @Override
    public CodePointSequence withSymbols(int[] symbols) {
        return FACTORY.fromSymbols(symbols);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodePointSequence that)) return false;
        return Arrays.equals(codePoints, that.codePoints);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(codePoints);
    }

    @Override
    public String toString() {
        return new String(codePoints, 0, codePoints.length);
    }
}

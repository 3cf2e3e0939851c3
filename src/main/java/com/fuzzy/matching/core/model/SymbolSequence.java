package com.fuzzy.matching.core.model;

/**
 * Immutable, 0-indexed sequence of opaque symbols.
 *
 * <p>Symbols are exposed as {@code int} values and compared by integer equality and ordering.
 * The byte instantiation ({@link ByteSequence}) yields values in {@code 0..255}, the code-point
 * instantiation ({@link CodePointSequence}) yields Unicode code points. Every algorithm in this
 * library is written once against this interface.</p>
 *
 * @param <S> the concrete sequence type, so derived sequences keep the caller's symbol kind
 */
public interface SymbolSequence<S extends SymbolSequence<S>> {

    /**
     * Returns the number of symbols.
     */
    int length();

    /**
     * Returns the symbol at the given index.
     *
     * @param index position in {@code [0, length())}
     * @return the symbol value
     */
    int symbolAt(int index);

    /**
     * Creates a new sequence of the same kind holding the given symbols.
     *
     * @param symbols the symbols, not retained by the new sequence
     * @return a new sequence
     */
    S withSymbols(int[] symbols);

    default boolean isEmpty() {
        return length() == 0;
    }

    /**
     * Copies the symbols into a fresh array.
     */
    default int[] toSymbolArray() {
        int[] symbols = new int[length()];
        for (int i = 0; i < symbols.length; i++) {
            symbols[i] = symbolAt(i);
        }
        return symbols;
    }

    /**
     * Returns true if both sequences hold the same symbols, regardless of their kind.
     */
    default boolean contentEquals(SymbolSequence<?> other) {
        if (other == null || other.length() != length()) {
            return false;
        }
        for (int i = 0; i < length(); i++) {
            if (symbolAt(i) != other.symbolAt(i)) {
                return false;
            }
        }
        return true;
    }
}

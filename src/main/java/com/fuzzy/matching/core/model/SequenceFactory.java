package com.fuzzy.matching.core.model;

/**
 * Creates sequences of one symbol kind without needing an existing instance.
 *
 * @param <S> the sequence type produced
 */
@FunctionalInterface
public interface SequenceFactory<S extends SymbolSequence<S>> {

    /**
     * Creates a sequence holding the given symbols.
     */
    S fromSymbols(int[] symbols);

    /**
     * Creates an empty sequence.
     */
    default S empty() {
        return fromSymbols(new int[0]);
    }
}

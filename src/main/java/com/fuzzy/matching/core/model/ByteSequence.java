package com.fuzzy.matching.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Byte instantiation of {@link SymbolSequence}. Symbols are unsigned byte values {@code 0..255}.
 */
public final class ByteSequence implements SymbolSequence<ByteSequence> {

    public static final ByteSequence EMPTY = new ByteSequence(new byte[0]);

    public static final SequenceFactory<ByteSequence> FACTORY = ByteSequence::fromSymbolArray;

    private final byte[] bytes;

    private ByteSequence(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a sequence from a copy of the given bytes.
     */
    public static ByteSequence of(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes is required");
        return new ByteSequence(bytes.clone());
    }

    /**
     * Creates a sequence from the UTF-8 encoding of the given text.
     */
    public static ByteSequence ofUtf8(String text) {
        Objects.requireNonNull(text, "text is required");
        return new ByteSequence(text.getBytes(StandardCharsets.UTF_8));
    }

    private static ByteSequence fromSymbolArray(int[] symbols) {
        byte[] bytes = new byte[symbols.length];
        for (int i = 0; i < symbols.length; i++) {
            int symbol = symbols[i];
            if (symbol < 0 || symbol > 0xFF) {
                throw new IllegalArgumentException("Symbol " + symbol + " at index " + i + " is not a byte value");
            }
            bytes[i] = (byte) symbol;
        }
        return new ByteSequence(bytes);
    }

    @Override
    public int length() {
        return bytes.length;
    }

    @Override
    public int symbolAt(int index) {
        return bytes[index] & 0xFF;
    }

    @Override
    public ByteSequence withSymbols(int[] symbols) {
        return fromSymbolArray(symbols);
    }

    /**
     * Returns a copy of the underlying bytes.
     */
    public byte[] toByteArray() {
        return bytes.clone();
    }

    /**
     * Decodes the bytes as UTF-8. Malformed input is replaced, so this is lossy for arbitrary bytes.
     */
    public String toUtf8String() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ByteSequence that)) return false;
        return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toUtf8String();
    }
}

package com.fuzzy.matching.api;

import com.fuzzy.matching.core.model.ByteSequence;
import com.fuzzy.matching.core.model.CodePointSequence;
import com.fuzzy.matching.core.model.SymbolSequence;
import com.fuzzy.matching.median.MedianEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Converts between Java strings and one symbol kind, and carries the median engine of that kind.
 */
final class StringCodec<S extends SymbolSequence<S>> {

    private final Function<String, S> encoder;
    private final Function<S, String> decoder;
    private final MedianEngine<S> medianEngine;

    private StringCodec(Function<String, S> encoder, Function<S, String> decoder, MedianEngine<S> medianEngine) {
        this.encoder = encoder;
        this.decoder = decoder;
        this.medianEngine = medianEngine;
    }

    static StringCodec<?> forEncoding(SymbolEncoding encoding) {
        return switch (encoding) {
            case CODE_POINTS -> new StringCodec<CodePointSequence>(CodePointSequence::of, CodePointSequence::toString,
                    MedianEngine.forCodePoints());
            // Median results are not guaranteed to be valid UTF-8; malformed bytes decode to U+FFFD
            case UTF8_BYTES -> new StringCodec<ByteSequence>(ByteSequence::ofUtf8, ByteSequence::toUtf8String,
                    MedianEngine.forBytes());
        };
    }

    S encode(String text) {
        return encoder.apply(text);
    }

    List<S> encodeAll(List<String> texts) {
        List<S> encoded = new ArrayList<>(texts.size());
        for (String text : texts) {
            encoded.add(encode(text));
        }
        return encoded;
    }

    String decode(S sequence) {
        return decoder.apply(sequence);
    }

    MedianEngine<S> medianEngine() {
        return medianEngine;
    }
}

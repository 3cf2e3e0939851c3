package com.fuzzy.matching.api;

import com.fuzzy.matching.similarity.JaroWinklerSimilarity;

import java.util.Objects;

/**
 * Options for the {@link FuzzyMatcher} facade.
 */
public class MatcherOptions {

    private final SymbolEncoding symbolEncoding;
    private final double prefixWeight;
    private final boolean metricsEnabled;

    private MatcherOptions(Builder builder) {
        this.symbolEncoding = builder.symbolEncoding;
        this.prefixWeight = builder.prefixWeight;
        this.metricsEnabled = builder.metricsEnabled;
    }

    public SymbolEncoding getSymbolEncoding() {
        return symbolEncoding;
    }

    /**
     * Prefix weight used by {@link FuzzyMatcher#jaroWinkler(String, String)}.
     */
    public double getPrefixWeight() {
        return prefixWeight;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    /**
     * Creates default options: code points, prefix weight 0.1, metrics enabled.
     */
    public static MatcherOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options matching strings byte by byte on their UTF-8 encoding.
     */
    public static MatcherOptions utf8Bytes() {
        return builder().symbolEncoding(SymbolEncoding.UTF8_BYTES).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SymbolEncoding symbolEncoding = SymbolEncoding.CODE_POINTS;
        private double prefixWeight = JaroWinklerSimilarity.DEFAULT_PREFIX_WEIGHT;
        private boolean metricsEnabled = true;

        public Builder symbolEncoding(SymbolEncoding symbolEncoding) {
            this.symbolEncoding = Objects.requireNonNull(symbolEncoding, "symbolEncoding is required");
            return this;
        }

        public Builder prefixWeight(double prefixWeight) {
            if (!(prefixWeight >= 0.0) || Double.isInfinite(prefixWeight)) {
                throw new IllegalArgumentException("prefixWeight must be a finite value >= 0.0, got " + prefixWeight);
            }
            this.prefixWeight = prefixWeight;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public MatcherOptions build() {
            return new MatcherOptions(this);
        }
    }
}

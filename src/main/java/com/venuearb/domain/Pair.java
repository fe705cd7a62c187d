package com.venuearb.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A directed market: {@code base} is bought or sold against {@code quote}.
 */
@Getter
@EqualsAndHashCode
public final class Pair implements Comparable<Pair> {

    private final Asset base;
    private final Asset quote;

    private Pair(Asset base, Asset quote) {
        this.base = base;
        this.quote = quote;
    }

    public static Pair of(Asset base, Asset quote) {
        if (base == null || quote == null) {
            throw new IllegalArgumentException("Pair needs both base and quote");
        }
        if (base.equals(quote)) {
            throw new IllegalArgumentException("Pair base and quote must differ: " + base);
        }
        return new Pair(base, quote);
    }

    /**
     * Parses {@code BASE/QUOTE}.
     */
    public static Pair parse(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Pair symbol must not be null");
        }
        String[] parts = symbol.split("/");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Pair symbol must look like BASE/QUOTE: " + symbol);
        }
        return of(Asset.of(parts[0]), Asset.of(parts[1]));
    }

    public boolean contains(Asset asset) {
        return base.equals(asset) || quote.equals(asset);
    }

    public boolean connects(Asset a, Asset b) {
        return (base.equals(a) && quote.equals(b)) || (base.equals(b) && quote.equals(a));
    }

    public Asset other(Asset asset) {
        if (base.equals(asset)) {
            return quote;
        }
        if (quote.equals(asset)) {
            return base;
        }
        throw new IllegalArgumentException(asset + " is not part of " + this);
    }

    public String symbol() {
        return base.getSymbol() + "/" + quote.getSymbol();
    }

    @Override
    public int compareTo(Pair other) {
        return symbol().compareTo(other.symbol());
    }

    @Override
    public String toString() {
        return symbol();
    }
}

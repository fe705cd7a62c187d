package com.venuearb.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Locale;

@Getter
@EqualsAndHashCode
public final class Asset implements Comparable<Asset> {

    private final String symbol;

    private Asset(String symbol) {
        this.symbol = symbol;
    }

    public static Asset of(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Asset symbol must not be blank");
        }
        return new Asset(symbol.trim().toUpperCase(Locale.ROOT));
    }

    @Override
    public int compareTo(Asset other) {
        return symbol.compareTo(other.symbol);
    }

    @Override
    public String toString() {
        return symbol;
    }
}

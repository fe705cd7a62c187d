package com.venuearb.domain;

import lombok.Value;

/**
 * One taker order of a path. A buy spends the quote asset for the base; a sell does the reverse.
 */
@Value(staticConstructor = "of")
public class Leg {
    String venue;
    Pair pair;
    Side side;

    public Asset consumed() {
        return side == Side.BUY ? pair.getQuote() : pair.getBase();
    }

    public Asset received() {
        return side == Side.BUY ? pair.getBase() : pair.getQuote();
    }

    public BookKey bookKey() {
        return BookKey.of(venue, pair);
    }

    /**
     * The leg that converts {@code from} into {@code to} on {@code pair}.
     */
    public static Leg converting(String venue, Pair pair, Asset from, Asset to) {
        if (!pair.connects(from, to)) {
            throw new InvalidPathException(pair + " does not connect " + from + " and " + to);
        }
        return of(venue, pair, pair.getBase().equals(from) ? Side.SELL : Side.BUY);
    }

    @Override
    public String toString() {
        return side + " " + pair + "@" + venue;
    }
}

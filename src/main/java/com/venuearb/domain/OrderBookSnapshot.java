package com.venuearb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Top of book for one (venue, pair) as published by the feed. Bids are kept best (highest) first,
 * asks best (lowest) first.
 */
@Value
public class OrderBookSnapshot {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    String venue;
    Pair pair;
    List<OrderLevel> bids;
    List<OrderLevel> asks;
    Instant observedAt;

    @Builder
    private OrderBookSnapshot(String venue, Pair pair, List<OrderLevel> bids, List<OrderLevel> asks,
            Instant observedAt) {
        if (venue == null || pair == null || observedAt == null) {
            throw new IllegalArgumentException("Snapshot needs venue, pair and observedAt");
        }
        this.venue = venue;
        this.pair = pair;
        this.bids = sorted(bids, Comparator.comparing(OrderLevel::getPrice).reversed());
        this.asks = sorted(asks, Comparator.comparing(OrderLevel::getPrice));
        this.observedAt = observedAt;
    }

    private static List<OrderLevel> sorted(List<OrderLevel> levels, Comparator<OrderLevel> order) {
        if (levels == null || levels.isEmpty()) {
            return List.of();
        }
        List<OrderLevel> copy = new ArrayList<>(levels);
        copy.sort(order);
        return List.copyOf(copy);
    }

    public BookKey bookKey() {
        return BookKey.of(venue, pair);
    }

    public BigDecimal bestBid() {
        return bids.isEmpty() ? null : bids.get(0).getPrice();
    }

    public BigDecimal bestAsk() {
        return asks.isEmpty() ? null : asks.get(0).getPrice();
    }

    public boolean isTwoSided() {
        BigDecimal bid = bestBid();
        BigDecimal ask = bestAsk();
        return bid != null && ask != null && bid.signum() > 0 && ask.signum() > 0;
    }

    public BigDecimal midPrice() {
        if (!isTwoSided()) {
            return null;
        }
        return bestBid().add(bestAsk()).divide(TWO, MathContext.DECIMAL128);
    }

    /**
     * Cumulative bid quantity priced within {@code pct} percent below mid.
     */
    public BigDecimal bidDepthAtPct(BigDecimal pct) {
        BigDecimal mid = midPrice();
        if (mid == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal floor = mid.multiply(BigDecimal.ONE.subtract(pct.divide(HUNDRED, MathContext.DECIMAL128)));
        return bids.stream()
                .filter(l -> l.getPrice().compareTo(floor) >= 0)
                .map(OrderLevel::getSize)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Cumulative ask quantity priced within {@code pct} percent above mid.
     */
    public BigDecimal askDepthAtPct(BigDecimal pct) {
        BigDecimal mid = midPrice();
        if (mid == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal ceiling = mid.multiply(BigDecimal.ONE.add(pct.divide(HUNDRED, MathContext.DECIMAL128)));
        return asks.stream()
                .filter(l -> l.getPrice().compareTo(ceiling) <= 0)
                .map(OrderLevel::getSize)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal topBidVolume(int levels) {
        return sum(bids, levels);
    }

    public BigDecimal topAskVolume(int levels) {
        return sum(asks, levels);
    }

    /**
     * Volume on the side a taker of {@code side} consumes: asks for a buy, bids for a sell.
     */
    public BigDecimal takerVolume(Side side, int levels) {
        return side == Side.BUY ? topAskVolume(levels) : topBidVolume(levels);
    }

    /**
     * Top-of-book imbalance in [-1, 1]; positive means bids outweigh asks.
     */
    public BigDecimal imbalance(int levels) {
        BigDecimal bidVol = topBidVolume(levels);
        BigDecimal askVol = topAskVolume(levels);
        BigDecimal total = bidVol.add(askVol);
        if (total.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return bidVol.subtract(askVol).divide(total, MathContext.DECIMAL128);
    }

    private static BigDecimal sum(List<OrderLevel> side, int levels) {
        return side.stream()
                .limit(levels)
                .map(OrderLevel::getSize)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}

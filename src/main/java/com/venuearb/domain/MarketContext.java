package com.venuearb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

/**
 * Market-state signals for one admission decision, captured by the caller: the books the legs
 * trade against, recent per-asset volatility and the balances available right now.
 */
@Value
@Builder
public class MarketContext {

    @Singular
    Map<BookKey, OrderBookSnapshot> books;

    /** Relative standard deviation of recent mid prices, in percent. Absent while warming up. */
    @Singular("volatility")
    Map<Asset, BigDecimal> volatilityPct;

    @Singular
    Map<ResourceKey, BigDecimal> balances;

    public Optional<OrderBookSnapshot> book(BookKey key) {
        return Optional.ofNullable(books.get(key));
    }

    public Optional<BigDecimal> volatilityOf(Asset asset) {
        return Optional.ofNullable(volatilityPct.get(asset));
    }

    public BigDecimal availableBalance(String venue, Asset asset) {
        return balances.getOrDefault(ResourceKey.of(venue, asset), BigDecimal.ZERO);
    }
}

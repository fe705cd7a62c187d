package com.venuearb.core;

import com.venuearb.domain.Asset;
import com.venuearb.domain.Leg;
import com.venuearb.domain.MarketContext;
import com.venuearb.domain.Path;
import com.venuearb.domain.ResourceKey;
import com.venuearb.domain.SnapshotRead;
import com.venuearb.infra.BalanceProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Captures the market state the risk gate judges one path against. Balances are queried from the
 * balance collaborator every time, never cached.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketContextFactory {

    private final SnapshotCache cache;
    private final VolatilityMonitor volatilityMonitor;
    private final BalanceProvider balances;

    public MarketContext build(Path path) {
        MarketContext.MarketContextBuilder context = MarketContext.builder();
        for (int i = 0; i < path.size(); i++) {
            Leg leg = path.leg(i);
            SnapshotRead read = cache.read(leg.bookKey());
            if (read.isFresh()) {
                context.book(leg.bookKey(), read.getSnapshot());
            }
            if (path.isFundedLeg(i)) {
                context.balance(ResourceKey.of(leg.getVenue(), leg.consumed()),
                        queryBalance(leg.getVenue(), leg.consumed()));
            }
        }
        for (Asset asset : path.getAssets()) {
            volatilityMonitor.volatilityPct(asset).ifPresent(v -> context.volatility(asset, v));
        }
        return context.build();
    }

    private BigDecimal queryBalance(String venue, Asset asset) {
        try {
            BigDecimal available = balances.available(venue, asset);
            return available != null ? available : BigDecimal.ZERO;
        } catch (RuntimeException e) {
            log.warn("Balance query failed for {} on {}; treating as zero", asset, venue, e);
            return BigDecimal.ZERO;
        }
    }
}

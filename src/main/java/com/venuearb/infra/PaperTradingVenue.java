package com.venuearb.infra;

import com.venuearb.config.ArbProperties;
import com.venuearb.core.SnapshotCache;
import com.venuearb.domain.Asset;
import com.venuearb.domain.FillEvent;
import com.venuearb.domain.FillStatus;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.domain.OrderLevel;
import com.venuearb.domain.OrderRequest;
import com.venuearb.domain.ResourceKey;
import com.venuearb.domain.Side;
import com.venuearb.domain.SnapshotRead;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated venues backed by the snapshot cache. Orders are immediate-or-cancel: they walk the
 * opposite side of the cached book up to the limit price, pay the configured taker fee in the
 * received asset and settle against in-memory balances. Fill confirmations are delivered on a
 * separate thread, like a venue's user stream.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "arb.paper", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PaperTradingVenue implements OrderGateway, BalanceProvider {

    private static final MathContext MC = MathContext.DECIMAL128;

    private final SnapshotCache cache;
    private final FillListener fills;
    private final ArbProperties properties;
    private final Clock clock;
    private final Map<ResourceKey, BigDecimal> balances = new ConcurrentHashMap<>();
    private final AtomicLong orderSeq = new AtomicLong();
    private final ExecutorService confirmations =
            Executors.newSingleThreadExecutor(new CustomizableThreadFactory("paper-fills-"));

    public PaperTradingVenue(SnapshotCache cache, FillListener fills, ArbProperties properties, Clock clock) {
        this.cache = cache;
        this.fills = fills;
        this.properties = properties;
        this.clock = clock;
        properties.paper().balances().forEach((venue, assets) -> assets.forEach(
                (symbol, amount) -> balances.put(ResourceKey.of(venue, Asset.of(symbol)), amount)));
        log.info("[PAPER] Seeded {} balances across {} venues", balances.size(), properties.paper().balances().size());
    }

    @Override
    public synchronized String submit(OrderRequest request) {
        SnapshotRead read = cache.read(request.getVenue(), request.getPair());
        if (!read.isFresh()) {
            throw new OrderRejectedException("No fresh book for " + request.getPair() + " on " + request.getVenue());
        }
        BigDecimal takerRate = takerRate(request.getVenue());
        String venueOrderId = "paper-" + orderSeq.incrementAndGet();

        Match match = match(read.getSnapshot(), request);
        Asset base = request.getPair().getBase();
        Asset quote = request.getPair().getQuote();
        ResourceKey spendKey = ResourceKey.of(request.getVenue(), request.getSide() == Side.BUY ? quote : base);
        BigDecimal spend = request.getSide() == Side.BUY ? match.notional : match.filled;
        BigDecimal held = balances.getOrDefault(spendKey, BigDecimal.ZERO);
        if (spend.compareTo(held) > 0) {
            throw new OrderRejectedException("Insufficient " + spendKey + ": need " + spend + ", have " + held);
        }

        BigDecimal fee = BigDecimal.ZERO;
        if (match.filled.signum() > 0) {
            BigDecimal gross = request.getSide() == Side.BUY ? match.filled : match.notional;
            fee = gross.multiply(takerRate, MC);
            ResourceKey receiveKey = ResourceKey.of(request.getVenue(), request.getSide() == Side.BUY ? base : quote);
            balances.merge(spendKey, spend.negate(), BigDecimal::add);
            balances.merge(receiveKey, gross.subtract(fee), BigDecimal::add);
        }

        boolean complete = match.filled.compareTo(request.getQuantity()) >= 0;
        FillEvent event = FillEvent.builder()
                .clientOrderId(request.getClientOrderId())
                .venueOrderId(venueOrderId)
                .status(complete ? FillStatus.FILLED : FillStatus.CANCELED)
                .filledQuantity(match.filled)
                .averagePrice(match.filled.signum() > 0 ? match.notional.divide(match.filled, MC) : null)
                .feeAmount(fee)
                .reason(complete ? null : "no further liquidity within limit")
                .timestamp(clock.instant())
                .build();
        log.info("[PAPER] {} {} {} {}@{} filled {} avg {}", venueOrderId, request.getSide(), request.getQuantity(),
                request.getPair(), request.getVenue(), event.getFilledQuantity(), event.getAveragePrice());
        confirmations.execute(() -> fills.onFill(event));
        return venueOrderId;
    }

    @Override
    public void cancel(String venue, String clientOrderId) {
        // orders never rest on the paper book
        log.debug("[PAPER] cancel {} on {}: nothing resting", clientOrderId, venue);
    }

    @Override
    public BigDecimal available(String venue, Asset asset) {
        return balances.getOrDefault(ResourceKey.of(venue, asset), BigDecimal.ZERO);
    }

    public Map<ResourceKey, BigDecimal> balances() {
        return Map.copyOf(balances);
    }

    private BigDecimal takerRate(String venue) {
        ArbProperties.Venue config = properties.venues().get(venue);
        if (config == null || config.takerFeeRate() == null) {
            throw new OrderRejectedException("Unknown venue or fee for " + venue);
        }
        return config.takerFeeRate();
    }

    /**
     * Walks the levels a taker of {@code request.side} consumes until the quantity is met or the
     * next level is past the limit price.
     */
    static Match match(OrderBookSnapshot book, OrderRequest request) {
        List<OrderLevel> levels = request.getSide() == Side.BUY ? book.getAsks() : book.getBids();
        BigDecimal remaining = request.getQuantity();
        BigDecimal filled = BigDecimal.ZERO;
        BigDecimal notional = BigDecimal.ZERO;
        for (OrderLevel level : levels) {
            if (remaining.signum() <= 0) {
                break;
            }
            if (!request.isMarket() && !withinLimit(request.getSide(), level.getPrice(), request.getLimitPrice())) {
                break;
            }
            BigDecimal take = remaining.min(level.getSize());
            filled = filled.add(take);
            notional = notional.add(take.multiply(level.getPrice(), MC));
            remaining = remaining.subtract(take);
        }
        return new Match(filled, notional);
    }

    private static boolean withinLimit(Side side, BigDecimal price, BigDecimal limit) {
        return side == Side.BUY ? price.compareTo(limit) <= 0 : price.compareTo(limit) >= 0;
    }

    @PreDestroy
    void shutdown() {
        confirmations.shutdown();
    }

    static final class Match {
        final BigDecimal filled;
        final BigDecimal notional;

        Match(BigDecimal filled, BigDecimal notional) {
            this.filled = filled;
            this.notional = notional;
        }
    }
}

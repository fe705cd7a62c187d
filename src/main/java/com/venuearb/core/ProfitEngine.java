package com.venuearb.core;

import com.venuearb.domain.Evaluation;
import com.venuearb.domain.Fee;
import com.venuearb.domain.FeeSchedule;
import com.venuearb.domain.Leg;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.domain.Opportunity;
import com.venuearb.domain.Path;
import com.venuearb.domain.Side;
import com.venuearb.domain.SnapshotRead;
import com.venuearb.domain.UnevaluableReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Walks one unit of the start asset through a path at the cached best prices. Gross profit
 * ignores fees and slippage; net profit deducts {@code takerFee + slippage} on every leg.
 * All arithmetic is decimal with a fixed {@link MathContext}, so identical inputs give identical results.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfitEngine {

    static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final SnapshotCache cache;

    public Evaluation evaluate(Path path, FeeSchedule fees, BigDecimal assumedSlippageRate) {
        BigDecimal gross = BigDecimal.ONE;
        BigDecimal net = BigDecimal.ONE;
        List<BigDecimal> prices = new ArrayList<>(path.size());
        List<BigDecimal> inputs = new ArrayList<>(path.size());
        List<Instant> timestamps = new ArrayList<>(path.size());

        for (Leg leg : path.getLegs()) {
            SnapshotRead read = cache.read(leg.bookKey());
            if (read.getStatus() == SnapshotRead.Status.MISSING) {
                return Evaluation.unevaluable(UnevaluableReason.MISSING_DATA, "no book for " + leg.bookKey());
            }
            if (read.getStatus() == SnapshotRead.Status.STALE) {
                return Evaluation.unevaluable(UnevaluableReason.STALE_DATA,
                        "book for " + leg.bookKey() + " observed at " + read.getSnapshot().getObservedAt());
            }
            OrderBookSnapshot book = read.getSnapshot();
            BigDecimal price = leg.getSide() == Side.BUY ? book.bestAsk() : book.bestBid();
            if (price == null || price.signum() <= 0) {
                return Evaluation.unevaluable(UnevaluableReason.INVALID_BOOK,
                        "no " + (leg.getSide() == Side.BUY ? "ask" : "bid") + " on " + leg.bookKey());
            }
            Optional<Fee> fee = fees.find(leg.getVenue(), leg.getPair());
            if (fee.isEmpty() || fee.get().getTakerRate() == null) {
                return Evaluation.unevaluable(UnevaluableReason.MISSING_FEE, "no fee for " + leg.bookKey());
            }
            BigDecimal keep = BigDecimal.ONE.subtract(fee.get().getTakerRate()).subtract(assumedSlippageRate);
            if (keep.signum() <= 0) {
                return Evaluation.unevaluable(UnevaluableReason.MISSING_FEE,
                        "fee and slippage consume the whole leg on " + leg.bookKey());
            }

            inputs.add(net);
            prices.add(price);
            timestamps.add(book.getObservedAt());
            gross = convert(gross, leg.getSide(), price);
            net = convert(net, leg.getSide(), price).multiply(keep, MC);
        }

        Opportunity opportunity = Opportunity.builder()
                .path(path)
                .grossProfitPct(toPct(gross))
                .netProfitPct(toPct(net))
                .referencePrices(List.copyOf(prices))
                .legInputsPerUnit(List.copyOf(inputs))
                .snapshotTimestamps(List.copyOf(timestamps))
                .detectedAt(timestamps.stream().max(Comparator.naturalOrder()).orElseThrow())
                .build();
        log.trace("Evaluated {} gross={} net={}", path, opportunity.getGrossProfitPct(), opportunity.getNetProfitPct());
        return Evaluation.of(opportunity);
    }

    static BigDecimal convert(BigDecimal amount, Side side, BigDecimal price) {
        return side == Side.BUY ? amount.divide(price, MC) : amount.multiply(price, MC);
    }

    private static BigDecimal toPct(BigDecimal finalAmount) {
        return finalAmount.subtract(BigDecimal.ONE).multiply(HUNDRED, MC);
    }
}

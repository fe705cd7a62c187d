package com.venuearb.core;

import com.venuearb.config.ArbProperties;
import com.venuearb.domain.Admission;
import com.venuearb.domain.Asset;
import com.venuearb.domain.Leg;
import com.venuearb.domain.MarketContext;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.domain.Opportunity;
import com.venuearb.domain.Path;
import com.venuearb.domain.RejectReason;
import com.venuearb.domain.Side;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Last check before capital is committed. An opportunity must clear the dynamic profit threshold
 * and is then sized to the smallest of the configured trade cap, the book depth every leg can
 * absorb and the balance available to every funded leg.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskGate {

    private static final MathContext MC = MathContext.DECIMAL128;

    private final ArbProperties properties;
    private final ProfitThresholdModel thresholdModel;
    private final VolatilityMonitor volatilityMonitor;

    public Admission admit(Opportunity opportunity, MarketContext context) {
        Path path = opportunity.getPath();
        ArbProperties.Risk risk = properties.risk();
        BigDecimal threshold = thresholdModel.thresholdPct(path, context);

        if (opportunity.getNetProfitPct().compareTo(threshold) < 0) {
            return reject(path, RejectReason.BELOW_THRESHOLD,
                    "net " + opportunity.getNetProfitPct().stripTrailingZeros().toPlainString()
                            + "% below threshold " + threshold.stripTrailingZeros().toPlainString() + "%",
                    threshold);
        }

        BigDecimal depthCap = null;
        for (int i = 0; i < path.size(); i++) {
            Leg leg = path.leg(i);
            Optional<OrderBookSnapshot> book = context.book(leg.bookKey());
            if (book.isEmpty()) {
                return reject(path, RejectReason.INSUFFICIENT_DEPTH, "no book for " + leg.bookKey(), threshold);
            }
            BigDecimal basePerUnit = baseQuantityPerUnit(opportunity, i);
            if (basePerUnit.signum() <= 0) {
                continue;
            }
            BigDecimal available = book.get().takerVolume(leg.getSide(), risk.depthLevels());
            BigDecimal cap = available.divide(risk.depthMultiple().multiply(basePerUnit, MC), MC);
            depthCap = depthCap == null ? cap : depthCap.min(cap);
        }
        if (depthCap == null) {
            depthCap = BigDecimal.ZERO;
        }

        BigDecimal balanceCap = null;
        for (int i = 0; i < path.size(); i++) {
            if (!path.isFundedLeg(i)) {
                continue;
            }
            Leg leg = path.leg(i);
            BigDecimal perUnit = opportunity.getLegInputsPerUnit().get(i);
            BigDecimal balance = context.availableBalance(leg.getVenue(), leg.consumed());
            BigDecimal cap = balance.divide(perUnit, MC);
            balanceCap = balanceCap == null ? cap : balanceCap.min(cap);
        }

        Asset start = path.getStartAsset();
        BigDecimal minSize = risk.minTradeSizeFor(start);
        if (depthCap.signum() <= 0 || depthCap.compareTo(minSize) < 0) {
            return reject(path, RejectReason.INSUFFICIENT_DEPTH,
                    "depth allows " + plain(depthCap) + " " + start + ", minimum " + plain(minSize), threshold);
        }
        if (balanceCap.signum() <= 0 || balanceCap.compareTo(minSize) < 0) {
            return reject(path, RejectReason.INSUFFICIENT_BALANCE,
                    "balance allows " + plain(balanceCap) + " " + start + ", minimum " + plain(minSize), threshold);
        }

        BigDecimal size = depthCap.min(balanceCap);
        Optional<BigDecimal> maxSize = risk.maxTradeSizeFor(start);
        if (maxSize.isPresent()) {
            size = size.min(maxSize.get());
        }
        size = size.setScale(properties.execution().quantityScale(), RoundingMode.DOWN);
        if (size.signum() <= 0 || size.compareTo(minSize) < 0) {
            return reject(path, RejectReason.INSUFFICIENT_BALANCE,
                    "sized to " + plain(size) + " " + start + ", minimum " + plain(minSize), threshold);
        }

        log.debug("Admitted {} size={} {} net={}% threshold={}%", path, size, start,
                opportunity.getNetProfitPct(), threshold);
        return Admission.accept(opportunity.withMaxSafeSize(size), threshold);
    }

    /**
     * Multiplier applied to a path's scan spacing: the slowdown factor while any asset it touches
     * is above the volatility band, one otherwise.
     */
    public BigDecimal cadenceMultiplier(Path path) {
        BigDecimal band = properties.risk().volatilityBandPct();
        for (Asset asset : path.getAssets()) {
            Optional<BigDecimal> vol = volatilityMonitor.volatilityPct(asset);
            if (vol.isPresent() && vol.get().compareTo(band) > 0) {
                return properties.risk().slowdownFactor();
            }
        }
        return BigDecimal.ONE;
    }

    /**
     * Base-asset quantity leg {@code i} trades per unit of start asset.
     */
    static BigDecimal baseQuantityPerUnit(Opportunity opportunity, int i) {
        BigDecimal input = opportunity.getLegInputsPerUnit().get(i);
        if (opportunity.getPath().leg(i).getSide() == Side.SELL) {
            return input;
        }
        return input.divide(opportunity.getReferencePrices().get(i), MC);
    }

    private static Admission reject(Path path, RejectReason reason, String detail, BigDecimal threshold) {
        log.debug("Rejected {}: {} ({})", path, reason, detail);
        return Admission.reject(reason, detail, threshold);
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}

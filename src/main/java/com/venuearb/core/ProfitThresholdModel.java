package com.venuearb.core;

import com.venuearb.config.ArbProperties;
import com.venuearb.domain.Asset;
import com.venuearb.domain.Leg;
import com.venuearb.domain.MarketContext;
import com.venuearb.domain.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Dynamic minimum net profit for a path. Calm, balanced books pull the threshold toward the
 * configured minimum; high volatility or a lopsided book pushes it toward the maximum. The
 * result never leaves {@code [minThresholdPct, maxThresholdPct]}.
 */
@Component
@RequiredArgsConstructor
public class ProfitThresholdModel {

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal MINUS_ONE = BigDecimal.ONE.negate();

    private final ArbProperties properties;

    public BigDecimal thresholdPct(Path path, MarketContext context) {
        ArbProperties.Risk risk = properties.risk();
        BigDecimal pressure = pressure(path, context, risk);
        BigDecimal baseline = risk.baselineThresholdPct();
        BigDecimal threshold;
        if (pressure.signum() >= 0) {
            threshold = baseline.add(risk.maxThresholdPct().subtract(baseline).multiply(pressure, MC));
        } else {
            threshold = baseline.add(baseline.subtract(risk.minThresholdPct()).multiply(pressure, MC));
        }
        return clamp(threshold, risk.minThresholdPct(), risk.maxThresholdPct());
    }

    /**
     * Market pressure in [-1, 1]. Zero means baseline conditions.
     */
    BigDecimal pressure(Path path, MarketContext context, ArbProperties.Risk risk) {
        BigDecimal volScore = volatilityScore(path, context, risk);
        BigDecimal imbalance = maxImbalance(path, context, risk.depthLevels());
        BigDecimal raw = risk.volatilityWeight().multiply(volScore, MC)
                .add(risk.imbalanceWeight().multiply(imbalance, MC));
        return clamp(raw, MINUS_ONE, BigDecimal.ONE);
    }

    private BigDecimal volatilityScore(Path path, MarketContext context, ArbProperties.Risk risk) {
        BigDecimal worst = null;
        for (Asset asset : path.getAssets()) {
            BigDecimal vol = context.volatilityOf(asset).orElse(null);
            if (vol != null && (worst == null || vol.compareTo(worst) > 0)) {
                worst = vol;
            }
        }
        if (worst == null) {
            return BigDecimal.ZERO;
        }
        BigDecimal ratio = worst.divide(risk.volatilityReferencePct(), MC);
        return clamp(ratio, BigDecimal.ZERO, TWO).subtract(BigDecimal.ONE);
    }

    private BigDecimal maxImbalance(Path path, MarketContext context, int levels) {
        BigDecimal worst = BigDecimal.ZERO;
        for (Leg leg : path.getLegs()) {
            BigDecimal imbalance = context.book(leg.bookKey())
                    .map(b -> b.imbalance(levels).abs())
                    .orElse(BigDecimal.ZERO);
            worst = worst.max(imbalance);
        }
        return worst;
    }

    private static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        return value.max(min).min(max);
    }
}

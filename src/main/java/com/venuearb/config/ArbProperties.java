package com.venuearb.config;

import com.venuearb.domain.Asset;
import com.venuearb.domain.Pair;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Engine configuration. Bump {@code configVersion} whenever thresholds or sizing change so
 * journal entries can be tied to the settings that produced them.
 */
@Validated
@ConfigurationProperties(prefix = "arb")
public record ArbProperties(
        @NotNull @Min(1) Integer configVersion,
        @Valid Map<String, Venue> venues,
        @Valid Pricing pricing,
        @Valid Risk risk,
        @Valid Execution execution,
        @Valid Scan scan,
        @Valid Fees fees,
        @Valid Paper paper,
        @Valid Replay replay
) {

    public ArbProperties {
        if (configVersion == null) {
            configVersion = 1;
        }
        venues = venues == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(venues));
        if (pricing == null) {
            pricing = new Pricing(null, null);
        }
        if (risk == null) {
            risk = Risk.defaults();
        }
        if (execution == null) {
            execution = new Execution(null, null, null, null, null, null, null);
        }
        if (scan == null) {
            scan = new Scan(null, null, null, null);
        }
        if (fees == null) {
            fees = new Fees(null);
        }
        if (paper == null) {
            paper = new Paper(null, null);
        }
        if (replay == null) {
            replay = new Replay(null, null, null, null);
        }
    }

    /**
     * Declared pairs per venue, in configuration order.
     */
    public Map<String, List<Pair>> pairsByVenue() {
        Map<String, List<Pair>> result = new LinkedHashMap<>();
        venues.forEach((name, venue) -> result.put(name, venue.pairs().stream().map(Pair::parse).toList()));
        return result;
    }

    public Duration legTimeoutFor(String venue) {
        Venue v = venues.get(venue);
        if (v != null && v.legTimeout() != null) {
            return v.legTimeout();
        }
        return execution.defaultLegTimeout();
    }

    private static Map<String, BigDecimal> upperCaseKeys(Map<String, BigDecimal> values) {
        if (values == null || values.isEmpty()) {
            return Map.of();
        }
        Map<String, BigDecimal> result = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (k != null && v != null) {
                result.put(k.trim().toUpperCase(Locale.ROOT), v);
            }
        });
        return Collections.unmodifiableMap(result);
    }

    public record Venue(
            List<String> pairs,
            @DecimalMin("0") @DecimalMax("0.1") BigDecimal takerFeeRate,
            @DecimalMin("0") @DecimalMax("0.1") BigDecimal makerFeeRate,
            Duration legTimeout
    ) {
        public Venue {
            pairs = pairs == null ? List.of() : pairs.stream()
                    .filter(Objects::nonNull)
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .distinct()
                    .toList();
        }
    }

    public record Pricing(
            /** A snapshot older than this is stale. */
            Duration freshness,
            /** Fraction deducted per leg on top of the taker fee, e.g. 0.0005. */
            @DecimalMin("0") @DecimalMax("0.05") BigDecimal assumedSlippageRate
    ) {
        public Pricing {
            if (freshness == null) {
                freshness = Duration.ofSeconds(3);
            }
            if (assumedSlippageRate == null) {
                assumedSlippageRate = BigDecimal.ZERO;
            }
        }
    }

    public record Risk(
            /** Top-of-book volume on the consumed side must be at least this multiple of the leg size. */
            @DecimalMin("2.5") @DecimalMax("5") BigDecimal depthMultiple,
            @Min(1) Integer depthLevels,
            @DecimalMin("0") BigDecimal minThresholdPct,
            @DecimalMin("0") BigDecimal baselineThresholdPct,
            @DecimalMin("0") BigDecimal maxThresholdPct,
            /** Volatility (percent) at which the threshold sits at baseline. */
            @DecimalMin(value = "0", inclusive = false) BigDecimal volatilityReferencePct,
            /** Volatility (percent) above which scans of the asset slow down. */
            @DecimalMin(value = "0", inclusive = false) BigDecimal volatilityBandPct,
            @Min(2) Integer volatilityWindow,
            @Min(2) Integer volatilityMinSamples,
            @DecimalMin("0") @DecimalMax("1") BigDecimal volatilityWeight,
            @DecimalMin("0") @DecimalMax("1") BigDecimal imbalanceWeight,
            @DecimalMin("1") BigDecimal slowdownFactor,
            Map<String, BigDecimal> maxTradeSize,
            Map<String, BigDecimal> minTradeSize
    ) {
        public Risk {
            if (depthMultiple == null) {
                depthMultiple = new BigDecimal("2.5");
            }
            if (depthLevels == null) {
                depthLevels = 5;
            }
            if (minThresholdPct == null) {
                minThresholdPct = new BigDecimal("0.4");
            }
            if (baselineThresholdPct == null) {
                baselineThresholdPct = new BigDecimal("0.5");
            }
            if (maxThresholdPct == null) {
                maxThresholdPct = new BigDecimal("1.0");
            }
            if (volatilityReferencePct == null) {
                volatilityReferencePct = new BigDecimal("0.25");
            }
            if (volatilityBandPct == null) {
                volatilityBandPct = new BigDecimal("0.5");
            }
            if (volatilityWindow == null) {
                volatilityWindow = 30;
            }
            if (volatilityMinSamples == null) {
                volatilityMinSamples = 5;
            }
            if (volatilityWeight == null) {
                volatilityWeight = new BigDecimal("0.6");
            }
            if (imbalanceWeight == null) {
                imbalanceWeight = new BigDecimal("0.4");
            }
            if (slowdownFactor == null) {
                slowdownFactor = BigDecimal.valueOf(2);
            }
            maxTradeSize = upperCaseKeys(maxTradeSize);
            minTradeSize = upperCaseKeys(minTradeSize);
            if (minThresholdPct.compareTo(baselineThresholdPct) > 0
                    || baselineThresholdPct.compareTo(maxThresholdPct) > 0) {
                throw new IllegalArgumentException("Threshold band must satisfy min <= baseline <= max, got "
                        + minThresholdPct + " / " + baselineThresholdPct + " / " + maxThresholdPct);
            }
        }

        public static Risk defaults() {
            return new Risk(null, null, null, null, null, null, null, null, null, null, null, null, null, null);
        }

        /** Empty when the asset has no configured cap; depth and balance still bound the size. */
        public Optional<BigDecimal> maxTradeSizeFor(Asset asset) {
            return Optional.ofNullable(maxTradeSize.get(asset.getSymbol()));
        }

        public BigDecimal minTradeSizeFor(Asset asset) {
            return minTradeSize.getOrDefault(asset.getSymbol(), BigDecimal.ZERO);
        }
    }

    public record Execution(
            /** False keeps the engine in watch-only mode. */
            Boolean enabled,
            Duration defaultLegTimeout,
            Duration remediationTimeout,
            /** Fraction of a leg that may stay unfilled before the leg counts as failed. */
            @DecimalMin("0") @DecimalMax("0.5") BigDecimal partialFillTolerance,
            /** Limit price offset from the reference price for leg orders. */
            @DecimalMin("0") @DecimalMax("0.05") BigDecimal limitSlippageRate,
            @Min(0) Integer quantityScale,
            /** How long a cancelled order may take to report its final fill. */
            Duration cancelGrace
    ) {
        public Execution {
            if (enabled == null) {
                enabled = false;
            }
            if (defaultLegTimeout == null) {
                defaultLegTimeout = Duration.ofSeconds(30);
            }
            if (remediationTimeout == null) {
                remediationTimeout = Duration.ofSeconds(30);
            }
            if (partialFillTolerance == null) {
                partialFillTolerance = new BigDecimal("0.01");
            }
            if (limitSlippageRate == null) {
                limitSlippageRate = new BigDecimal("0.002");
            }
            if (quantityScale == null) {
                quantityScale = 8;
            }
            if (cancelGrace == null) {
                cancelGrace = Duration.ofSeconds(5);
            }
        }
    }

    public record Scan(
            Boolean enabled,
            @Min(1) Integer workerThreads,
            @Valid Family crossVenue,
            @Valid Family triangular
    ) {
        public Scan {
            if (enabled == null) {
                enabled = true;
            }
            if (workerThreads == null) {
                workerThreads = 4;
            }
            if (crossVenue == null) {
                crossVenue = new Family(Duration.ofMillis(500), 10_000L);
            }
            if (triangular == null) {
                triangular = new Family(Duration.ofMillis(1500), 30_000L);
            }
        }
    }

    public record Family(
            /** Minimum time between two evaluations of the same path. */
            Duration minSpacing,
            /** Periodic sweep of the whole family, for paths whose books rarely update. */
            @Min(100) Long fallbackMillis
    ) {
        public Family {
            if (minSpacing == null) {
                minSpacing = Duration.ofSeconds(1);
            }
            if (fallbackMillis == null) {
                fallbackMillis = 10_000L;
            }
        }
    }

    public record Fees(
            @Min(1000) Long refreshMillis
    ) {
        public Fees {
            if (refreshMillis == null) {
                refreshMillis = 300_000L;
            }
        }
    }

    public record Paper(
            Boolean enabled,
            /** venue -> asset -> starting balance */
            Map<String, Map<String, BigDecimal>> balances
    ) {
        public Paper {
            if (enabled == null) {
                enabled = true;
            }
            if (balances == null) {
                balances = Map.of();
            } else {
                Map<String, Map<String, BigDecimal>> copy = new LinkedHashMap<>();
                balances.forEach((venue, assets) -> copy.put(venue, upperCaseKeys(assets)));
                balances = Collections.unmodifiableMap(copy);
            }
        }
    }

    /**
     * Recorded books pushed into the cache as if they came from a live feed. Each line of
     * {@code file} is one frame: a JSON array of books, restamped with the current time when emitted.
     */
    public record Replay(
            Boolean enabled,
            String file,
            @Min(10) Long intervalMillis,
            Boolean loop
    ) {
        public Replay {
            if (enabled == null) {
                enabled = false;
            }
            if (intervalMillis == null) {
                intervalMillis = 1000L;
            }
            if (loop == null) {
                loop = true;
            }
        }
    }
}

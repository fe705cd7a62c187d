package com.venuearb.core;

import com.venuearb.Fixtures;
import com.venuearb.MutableClock;
import com.venuearb.domain.Asset;
import com.venuearb.domain.Evaluation;
import com.venuearb.domain.FeeSchedule;
import com.venuearb.domain.Leg;
import com.venuearb.domain.Opportunity;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.domain.Pair;
import com.venuearb.domain.Path;
import com.venuearb.domain.Side;
import com.venuearb.domain.UnevaluableReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.venuearb.Fixtures.NOW;
import static com.venuearb.Fixtures.bd;
import static com.venuearb.Fixtures.book;
import static com.venuearb.Fixtures.level;
import static org.assertj.core.api.Assertions.assertThat;

class ProfitEngineTest {

    private static final MathContext MC = MathContext.DECIMAL128;
    private static final Pair SOL_USDT = Pair.parse("SOL/USDT");
    private static final Pair BTC_USDT = Pair.parse("BTC/USDT");
    private static final Asset USDT = Asset.of("USDT");

    private MutableClock clock;
    private SnapshotCache cache;
    private ProfitEngine engine;
    private FeeSchedule fees;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        cache = new SnapshotCache(Fixtures.properties(Map.of(), null, null, null), clock);
        engine = new ProfitEngine(cache);
        fees = Fixtures.fees("0.001", Map.of(
                "kraken", List.of("SOL/USDT", "BTC/USDT", "SOL/BTC"),
                "binanceus", List.of("SOL/USDT", "BTC/USDT")));
    }

    private static Path crossVenue(Pair pair) {
        return Path.of(0, pair.getQuote(), List.of(
                Leg.of("kraken", pair, Side.BUY),
                Leg.of("binanceus", pair, Side.SELL)));
    }

    @Test
    void solScenarioClearsTheBaselineThreshold() {
        cache.update(book("kraken", "SOL/USDT", "170.00", "170.12", "50", NOW));
        cache.update(book("binanceus", "SOL/USDT", "171.50", "171.60", "50", NOW));

        Evaluation evaluation = engine.evaluate(crossVenue(SOL_USDT), fees, BigDecimal.ZERO);

        assertThat(evaluation.isEvaluable()).isTrue();
        Opportunity opportunity = evaluation.getOpportunity();
        BigDecimal keep = bd("0.999");
        BigDecimal expectedNet = BigDecimal.ONE.divide(bd("170.12"), MC).multiply(keep, MC)
                .multiply(bd("171.50"), MC).multiply(keep, MC)
                .subtract(BigDecimal.ONE).multiply(BigDecimal.valueOf(100), MC);
        assertThat(opportunity.getNetProfitPct()).isEqualTo(expectedNet);
        assertThat(opportunity.getNetProfitPct()).isBetween(bd("0.60"), bd("0.62"));
        assertThat(opportunity.getGrossProfitPct()).isBetween(bd("0.81"), bd("0.82"));
        assertThat(opportunity.getReferencePrices()).containsExactly(bd("170.12"), bd("171.50"));
        assertThat(opportunity.getLegInputsPerUnit().get(0)).isEqualByComparingTo("1");
        assertThat(opportunity.getSnapshotTimestamps()).containsExactly(NOW, NOW);
        assertThat(opportunity.isSized()).isFalse();
    }

    @Test
    void btcScenarioIsBelowThreshold() {
        cache.update(book("kraken", "BTC/USDT", "65000.00", "65001.20", "2", NOW));
        cache.update(book("binanceus", "BTC/USDT", "65004.50", "65005.00", "2", NOW));

        Opportunity opportunity = engine.evaluate(crossVenue(BTC_USDT), fees, BigDecimal.ZERO).getOpportunity();

        assertThat(opportunity.getGrossProfitPct()).isBetween(bd("0.005"), bd("0.0051"));
        assertThat(opportunity.getNetProfitPct()).isLessThan(bd("0.5"));
        assertThat(opportunity.getNetProfitPct().signum()).isNegative();
    }

    @Test
    void slippageIsDeductedOnEveryLeg() {
        cache.update(book("kraken", "SOL/USDT", "170.00", "170.12", "50", NOW));
        cache.update(book("binanceus", "SOL/USDT", "171.50", "171.60", "50", NOW));

        BigDecimal withoutSlippage = engine.evaluate(crossVenue(SOL_USDT), fees, BigDecimal.ZERO)
                .getOpportunity().getNetProfitPct();
        BigDecimal withSlippage = engine.evaluate(crossVenue(SOL_USDT), fees, bd("0.0005"))
                .getOpportunity().getNetProfitPct();

        assertThat(withSlippage).isLessThan(withoutSlippage);
    }

    @Test
    void walksTriangleThroughConvertingLegs() {
        Asset btc = Asset.of("BTC");
        Asset sol = Asset.of("SOL");
        Path triangle = Path.of(0, USDT, List.of(
                Leg.converting("kraken", BTC_USDT, USDT, btc),
                Leg.converting("kraken", Pair.parse("SOL/BTC"), btc, sol),
                Leg.converting("kraken", SOL_USDT, sol, USDT)));
        cache.update(book("kraken", "BTC/USDT", "64990", "65000", "2", NOW));
        cache.update(book("kraken", "SOL/BTC", "0.00259", "0.0026", "500", NOW));
        cache.update(book("kraken", "SOL/USDT", "170", "170.1", "500", NOW));

        Opportunity opportunity = engine.evaluate(triangle, fees, BigDecimal.ZERO).getOpportunity();

        BigDecimal expectedGross = BigDecimal.ONE.divide(bd("65000"), MC).divide(bd("0.0026"), MC)
                .multiply(bd("170"), MC).subtract(BigDecimal.ONE).multiply(BigDecimal.valueOf(100), MC);
        assertThat(opportunity.getGrossProfitPct()).isEqualTo(expectedGross);
        assertThat(opportunity.getReferencePrices()).containsExactly(bd("65000"), bd("0.0026"), bd("170"));
    }

    @Test
    void staleLegMakesPathUnevaluable() {
        cache.update(book("kraken", "SOL/USDT", "170.00", "170.12", "50", NOW.minusSeconds(10)));
        cache.update(book("binanceus", "SOL/USDT", "171.50", "171.60", "50", NOW));

        Evaluation evaluation = engine.evaluate(crossVenue(SOL_USDT), fees, BigDecimal.ZERO);

        assertThat(evaluation.isEvaluable()).isFalse();
        assertThat(evaluation.getOpportunity()).isNull();
        assertThat(evaluation.getReason()).isEqualTo(UnevaluableReason.STALE_DATA);
    }

    @Test
    void bookAgingPastFreshnessBecomesUnevaluable() {
        cache.update(book("kraken", "SOL/USDT", "170.00", "170.12", "50", NOW));
        cache.update(book("binanceus", "SOL/USDT", "171.50", "171.60", "50", NOW));
        assertThat(engine.evaluate(crossVenue(SOL_USDT), fees, BigDecimal.ZERO).isEvaluable()).isTrue();

        clock.advance(Duration.ofSeconds(4));

        assertThat(engine.evaluate(crossVenue(SOL_USDT), fees, BigDecimal.ZERO).getReason())
                .isEqualTo(UnevaluableReason.STALE_DATA);
    }

    @Test
    void missingBookOrFeeIsReported() {
        cache.update(book("kraken", "SOL/USDT", "170.00", "170.12", "50", NOW));
        assertThat(engine.evaluate(crossVenue(SOL_USDT), fees, BigDecimal.ZERO).getReason())
                .isEqualTo(UnevaluableReason.MISSING_DATA);

        cache.update(book("binanceus", "SOL/USDT", "171.50", "171.60", "50", NOW));
        FeeSchedule krakenOnly = Fixtures.fees("0.001", Map.of("kraken", List.of("SOL/USDT")));
        assertThat(engine.evaluate(crossVenue(SOL_USDT), krakenOnly, BigDecimal.ZERO).getReason())
                .isEqualTo(UnevaluableReason.MISSING_FEE);
    }

    @Test
    void emptySideIsAnInvalidBook() {
        cache.update(OrderBookSnapshot.builder()
                .venue("kraken")
                .pair(SOL_USDT)
                .bids(List.of(level("170", "5")))
                .observedAt(NOW)
                .build());
        cache.update(book("binanceus", "SOL/USDT", "171.50", "171.60", "50", NOW));

        assertThat(engine.evaluate(crossVenue(SOL_USDT), fees, BigDecimal.ZERO).getReason())
                .isEqualTo(UnevaluableReason.INVALID_BOOK);
    }

    @Test
    void reevaluationIsBitIdentical() {
        cache.update(book("kraken", "SOL/USDT", "170.00", "170.12", "50", NOW));
        cache.update(book("binanceus", "SOL/USDT", "171.50", "171.60", "50", NOW));
        Path path = crossVenue(SOL_USDT);

        Opportunity first = engine.evaluate(path, fees, BigDecimal.ZERO).getOpportunity();
        for (int i = 0; i < 100; i++) {
            Opportunity again = engine.evaluate(path, fees, BigDecimal.ZERO).getOpportunity();
            assertThat(again).isEqualTo(first);
            assertThat(again.getNetProfitPct().unscaledValue()).isEqualTo(first.getNetProfitPct().unscaledValue());
            assertThat(again.getNetProfitPct().scale()).isEqualTo(first.getNetProfitPct().scale());
        }
    }
}

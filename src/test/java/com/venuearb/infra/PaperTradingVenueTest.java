package com.venuearb.infra;

import com.venuearb.Fixtures;
import com.venuearb.MutableClock;
import com.venuearb.config.ArbProperties;
import com.venuearb.core.SnapshotCache;
import com.venuearb.domain.Asset;
import com.venuearb.domain.FillEvent;
import com.venuearb.domain.FillStatus;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.domain.OrderRequest;
import com.venuearb.domain.Pair;
import com.venuearb.domain.Side;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static com.venuearb.Fixtures.NOW;
import static com.venuearb.Fixtures.bd;
import static com.venuearb.Fixtures.level;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaperTradingVenueTest {

    private static final Pair SOL_USDT = Pair.parse("SOL/USDT");
    private static final Asset SOL = Asset.of("SOL");
    private static final Asset USDT = Asset.of("USDT");

    private final MutableClock clock = new MutableClock(NOW);
    private final BlockingQueue<FillEvent> fills = new LinkedBlockingQueue<>();
    private PaperTradingVenue venue;

    @BeforeEach
    void setUp() {
        ArbProperties properties = Fixtures.properties(
                Map.of("kraken", Fixtures.venue("0.001", "SOL/USDT")), null, null,
                new ArbProperties.Paper(true, Map.of("kraken", Map.of("usdt", bd("1000"), "sol", bd("2")))));
        SnapshotCache cache = new SnapshotCache(properties, clock);
        cache.update(ladder());
        venue = new PaperTradingVenue(cache, fills::add, properties, clock);
    }

    @AfterEach
    void tearDown() {
        venue.shutdown();
    }

    private static OrderBookSnapshot ladder() {
        return OrderBookSnapshot.builder()
                .venue("kraken")
                .pair(SOL_USDT)
                .bids(List.of(level("169.90", "5"), level("169.50", "5")))
                .asks(List.of(level("170.00", "2"), level("170.20", "3"), level("171.00", "10")))
                .observedAt(NOW)
                .build();
    }

    private static OrderRequest order(String id, Side side, String quantity, String limit) {
        return OrderRequest.builder()
                .clientOrderId(id)
                .venue("kraken")
                .pair(SOL_USDT)
                .side(side)
                .quantity(bd(quantity))
                .limitPrice(limit != null ? bd(limit) : null)
                .build();
    }

    private FillEvent nextFill() throws InterruptedException {
        FillEvent event = fills.poll(2, TimeUnit.SECONDS);
        assertThat(event).as("fill confirmation").isNotNull();
        return event;
    }

    @Test
    void buyWalksAsksUpToTheLimitAndChargesFeeInBase() throws Exception {
        String venueOrderId = venue.submit(order("x-L1", Side.BUY, "4", "170.30"));

        FillEvent fill = nextFill();
        assertThat(venueOrderId).startsWith("paper-");
        assertThat(fill.getClientOrderId()).isEqualTo("x-L1");
        assertThat(fill.getStatus()).isEqualTo(FillStatus.FILLED);
        assertThat(fill.getFilledQuantity()).isEqualByComparingTo("4");
        assertThat(fill.getAveragePrice()).isEqualByComparingTo("170.10");
        assertThat(fill.getFeeAmount()).isEqualByComparingTo("0.004");
        assertThat(venue.available("kraken", USDT)).isEqualByComparingTo("319.60");
        assertThat(venue.available("kraken", SOL)).isEqualByComparingTo("5.996");
    }

    @Test
    void unfilledRemainderIsCanceled() throws Exception {
        venue.submit(order("x-L1", Side.BUY, "6", "170.30"));

        FillEvent fill = nextFill();
        assertThat(fill.getStatus()).isEqualTo(FillStatus.CANCELED);
        assertThat(fill.getFilledQuantity()).isEqualByComparingTo("5");
        assertThat(fill.getReason()).isNotBlank();
    }

    @Test
    void marketSellHitsBidsAndChargesFeeInQuote() throws Exception {
        venue.submit(order("x-R1", Side.SELL, "1", null));

        FillEvent fill = nextFill();
        assertThat(fill.getAveragePrice()).isEqualByComparingTo("169.90");
        assertThat(fill.getFeeAmount()).isEqualByComparingTo("0.16990");
        assertThat(venue.available("kraken", SOL)).isEqualByComparingTo("1");
        assertThat(venue.available("kraken", USDT)).isEqualByComparingTo(bd("1000").add(bd("169.90")).subtract(bd("0.1699")));
    }

    @Test
    void rejectsOrderLargerThanBalance() {
        assertThatThrownBy(() -> venue.submit(order("x-L1", Side.BUY, "10", "171.00")))
                .isInstanceOf(OrderRejectedException.class)
                .hasMessageContaining("Insufficient");
        assertThat(venue.available("kraken", USDT)).isEqualByComparingTo("1000");
        assertThat(fills).isEmpty();
    }

    @Test
    void rejectsOrderAgainstStaleBook() {
        clock.advance(Duration.ofSeconds(10));

        assertThatThrownBy(() -> venue.submit(order("x-L1", Side.BUY, "1", "170.30")))
                .isInstanceOf(OrderRejectedException.class);
    }

    @Test
    void matchStopsAtFirstLevelBeyondLimit() {
        OrderRequest request = order("x", Side.SELL, "8", "169.60");

        PaperTradingVenue.Match match = PaperTradingVenue.match(ladder(), request);

        assertThat(match.filled).isEqualByComparingTo("5");
        assertThat(match.notional).isEqualByComparingTo(bd("169.90").multiply(BigDecimal.valueOf(5)));
    }
}

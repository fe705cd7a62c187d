package com.venuearb;

import com.venuearb.config.ArbProperties;
import com.venuearb.domain.Fee;
import com.venuearb.domain.FeeSchedule;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.domain.OrderLevel;
import com.venuearb.domain.Pair;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Books, fees and properties shared by the engine tests.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private Fixtures() {
    }

    public static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    public static OrderLevel level(String price, String size) {
        return OrderLevel.builder().price(bd(price)).size(bd(size)).build();
    }

    /**
     * One-level book on each side.
     */
    public static OrderBookSnapshot book(String venue, String pair, String bid, String ask, String size,
            Instant at) {
        return OrderBookSnapshot.builder()
                .venue(venue)
                .pair(Pair.parse(pair))
                .bids(List.of(level(bid, size)))
                .asks(List.of(level(ask, size)))
                .observedAt(at)
                .build();
    }

    public static FeeSchedule fees(String takerRate, Map<String, List<String>> pairsByVenue) {
        List<Fee> fees = new ArrayList<>();
        pairsByVenue.forEach((venue, pairs) -> pairs.forEach(p -> fees.add(Fee.builder()
                .venue(venue)
                .pair(Pair.parse(p))
                .takerRate(bd(takerRate))
                .makerRate(bd(takerRate))
                .build())));
        return new FeeSchedule(fees, NOW);
    }

    public static ArbProperties.Venue venue(String takerRate, String... pairs) {
        return new ArbProperties.Venue(List.of(pairs), bd(takerRate), bd(takerRate), null);
    }

    public static ArbProperties properties(Map<String, ArbProperties.Venue> venues, ArbProperties.Risk risk,
            ArbProperties.Execution execution, ArbProperties.Paper paper) {
        return new ArbProperties(1, new LinkedHashMap<>(venues), null, risk, execution, null, null, paper, null);
    }

    public static ArbProperties.Risk risk(Map<String, BigDecimal> maxTradeSize, Map<String, BigDecimal> minTradeSize) {
        return new ArbProperties.Risk(null, null, null, null, null, null, null, null, null, null, null, null,
                maxTradeSize, minTradeSize);
    }
}

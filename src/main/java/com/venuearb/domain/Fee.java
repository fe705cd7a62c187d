package com.venuearb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Exact fractional fee rates for one market, e.g. {@code 0.001} for 0.1%.
 */
@Value
@Builder
public class Fee {
    String venue;
    Pair pair;
    BigDecimal makerRate;
    BigDecimal takerRate;

    public BookKey bookKey() {
        return BookKey.of(venue, pair);
    }
}

package com.venuearb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A taker order. {@code quantity} is always in base units; a null {@code limitPrice} means market.
 */
@Value
@Builder
public class OrderRequest {
    String clientOrderId;
    String venue;
    Pair pair;
    Side side;
    BigDecimal quantity;
    BigDecimal limitPrice;

    public boolean isMarket() {
        return limitPrice == null;
    }
}

package com.venuearb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Fill confirmation pushed by an order gateway. Quantities are cumulative for the order;
 * {@code feeAmount} is charged in the asset the order receives.
 */
@Value
@Builder
public class FillEvent {
    String clientOrderId;
    String venueOrderId;
    FillStatus status;
    @Builder.Default
    BigDecimal filledQuantity = BigDecimal.ZERO;
    BigDecimal averagePrice;
    @Builder.Default
    BigDecimal feeAmount = BigDecimal.ZERO;
    String reason;
    Instant timestamp;

    public boolean isTerminal() {
        return status.isTerminal();
    }
}

package com.venuearb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class LegOutcome {
    Leg leg;
    String clientOrderId;
    BigDecimal requestedQuantity;
    BigDecimal filledQuantity;
    BigDecimal averagePrice;
    /** Units of {@code leg.consumed()} spent. */
    BigDecimal consumedAmount;
    /** Units of {@code leg.received()} credited, after fees. */
    BigDecimal receivedAmount;
    LegStatus status;
    /** Whether the fill is close enough to the request to carry on with the path. */
    boolean acceptable;
    String failureReason;

    public boolean hasFill() {
        return filledQuantity != null && filledQuantity.signum() > 0;
    }
}

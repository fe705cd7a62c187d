package com.venuearb.infra;

import com.venuearb.domain.OrderRequest;

/**
 * Order placement on a venue. Fill progress is not returned here; it arrives asynchronously
 * through the {@link FillListener} the gateway was given.
 */
public interface OrderGateway {

    /**
     * @return the venue's order id
     * @throws OrderRejectedException if the venue refuses the order outright
     */
    String submit(OrderRequest request);

    /**
     * Best-effort cancel. A terminal fill event still follows if the order had partially filled.
     */
    void cancel(String venue, String clientOrderId);
}

package com.venuearb.infra;

import com.venuearb.domain.Asset;

import java.math.BigDecimal;

/**
 * Available (unreserved) quantity of an asset on a venue, queried synchronously.
 */
public interface BalanceProvider {

    BigDecimal available(String venue, Asset asset);
}

package com.venuearb.domain;

import lombok.Value;

import java.math.BigDecimal;

@Value(staticConstructor = "of")
public class Holding {
    String venue;
    Asset asset;
    BigDecimal amount;
}

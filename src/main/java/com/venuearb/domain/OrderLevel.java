package com.venuearb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class OrderLevel {
    BigDecimal price;
    BigDecimal size;
}

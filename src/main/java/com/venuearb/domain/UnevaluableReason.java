package com.venuearb.domain;

public enum UnevaluableReason {
    STALE_DATA,
    MISSING_DATA,
    MISSING_FEE,
    INVALID_BOOK
}

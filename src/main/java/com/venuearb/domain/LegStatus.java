package com.venuearb.domain;

public enum LegStatus {
    FILLED,
    PARTIALLY_FILLED,
    REJECTED,
    TIMED_OUT
}

package com.venuearb.domain;

public enum RejectReason {
    BELOW_THRESHOLD,
    INSUFFICIENT_DEPTH,
    INSUFFICIENT_BALANCE
}

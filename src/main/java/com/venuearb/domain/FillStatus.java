package com.venuearb.domain;

public enum FillStatus {
    PARTIAL,
    FILLED,
    REJECTED,
    CANCELED;

    public boolean isTerminal() {
        return this != PARTIAL;
    }
}

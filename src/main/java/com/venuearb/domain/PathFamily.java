package com.venuearb.domain;

public enum PathFamily {
    CROSS_VENUE(2),
    TRIANGULAR(3);

    private final int legCount;

    PathFamily(int legCount) {
        this.legCount = legCount;
    }

    public int legCount() {
        return legCount;
    }
}

package com.venuearb.domain;

public enum Side {
    BUY, SELL
}

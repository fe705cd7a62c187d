package com.venuearb.domain;

public enum TerminalState {
    COMPLETED,
    ROLLED_BACK,
    PARTIALLY_STRANDED
}

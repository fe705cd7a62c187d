package com.venuearb.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of reading the snapshot cache: a usable book, a stale one, or nothing at all.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SnapshotRead {

    public enum Status {
        FRESH, STALE, MISSING
    }

    private static final SnapshotRead MISSING = new SnapshotRead(Status.MISSING, null);

    private final Status status;
    private final OrderBookSnapshot snapshot;

    public static SnapshotRead fresh(OrderBookSnapshot snapshot) {
        return new SnapshotRead(Status.FRESH, snapshot);
    }

    public static SnapshotRead stale(OrderBookSnapshot snapshot) {
        return new SnapshotRead(Status.STALE, snapshot);
    }

    public static SnapshotRead missing() {
        return MISSING;
    }

    public boolean isFresh() {
        return status == Status.FRESH;
    }
}

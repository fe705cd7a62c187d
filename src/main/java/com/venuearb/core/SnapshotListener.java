package com.venuearb.core;

import com.venuearb.domain.OrderBookSnapshot;

/**
 * Called on the feed's thread after a book is stored. Implementations must not block.
 */
public interface SnapshotListener {

    void onSnapshot(OrderBookSnapshot snapshot);
}

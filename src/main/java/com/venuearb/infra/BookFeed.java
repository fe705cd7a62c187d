package com.venuearb.infra;

import com.venuearb.domain.BookKey;
import com.venuearb.domain.OrderBookSnapshot;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Push-based source of order books for one or more venues.
 */
public interface BookFeed {

    String name();

    /**
     * Starts delivering books for {@code books} to {@code sink}. Books for other keys may still
     * arrive; the sink drops them.
     */
    void subscribe(Set<BookKey> books, Consumer<OrderBookSnapshot> sink);
}

package com.venuearb.core;

import com.venuearb.domain.BookKey;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.infra.BookFeed;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Subscribes every book feed to the books the path catalog trades and pushes what they deliver
 * into the snapshot cache. Books nobody trades and out-of-order books are dropped.
 */
@Slf4j
@Service
public class MarketIngestor {

    private final ObjectProvider<BookFeed> feeds;
    private final PathCatalog catalog;
    private final SnapshotCache cache;

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile Set<BookKey> wanted = Set.of();

    public MarketIngestor(ObjectProvider<BookFeed> feeds, PathCatalog catalog, SnapshotCache cache) {
        this.feeds = feeds;
        this.catalog = catalog;
        this.cache = cache;
    }

    @PostConstruct
    public void start() {
        wanted = Set.copyOf(catalog.bookKeys());
        List<BookFeed> subscribed = feeds.orderedStream().collect(Collectors.toList());
        if (subscribed.isEmpty()) {
            log.warn("No book feed configured; the snapshot cache will stay empty");
            return;
        }
        for (BookFeed feed : subscribed) {
            feed.subscribe(wanted, this::accept);
            log.info("Subscribed feed {} to {} books", feed.name(), wanted.size());
        }
    }

    void accept(OrderBookSnapshot book) {
        if (!wanted.contains(book.bookKey())) {
            dropped.incrementAndGet();
            log.debug("Dropped book for untraded {}", book.bookKey());
            return;
        }
        if (cache.update(book)) {
            accepted.incrementAndGet();
        } else {
            dropped.incrementAndGet();
        }
    }

    public long accepted() {
        return accepted.get();
    }

    public long dropped() {
        return dropped.get();
    }
}

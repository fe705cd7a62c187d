package com.venuearb.core;

import com.venuearb.config.ArbProperties;
import com.venuearb.domain.BookKey;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.domain.Pair;
import com.venuearb.domain.SnapshotRead;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Latest book per (venue, pair). Writers to different keys never contend; writes to one key are
 * serialized and an update older than the stored one is dropped. Freshness is judged on read.
 */
@Slf4j
@Component
public class SnapshotCache {

    private final ConcurrentHashMap<BookKey, OrderBookSnapshot> cache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<BookKey, List<CompletableFuture<OrderBookSnapshot>>> waiters =
            new ConcurrentHashMap<>();
    private final List<SnapshotListener> listeners = new CopyOnWriteArrayList<>();
    private final ArbProperties properties;
    private final Clock clock;

    public SnapshotCache(ArbProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public void addListener(SnapshotListener listener) {
        listeners.add(listener);
    }

    /**
     * Stores {@code book} unless a newer one is already cached for its key.
     *
     * @return whether the book was stored
     */
    public boolean update(OrderBookSnapshot book) {
        BookKey key = book.bookKey();
        boolean[] stored = new boolean[1];
        cache.compute(key, (k, existing) -> {
            if (existing != null && existing.getObservedAt().isAfter(book.getObservedAt())) {
                return existing;
            }
            stored[0] = true;
            return book;
        });
        if (!stored[0]) {
            log.debug("Dropped out-of-order book for {} observed at {}", key, book.getObservedAt());
            return false;
        }
        List<CompletableFuture<OrderBookSnapshot>> pending = waiters.remove(key);
        if (pending != null) {
            pending.forEach(f -> f.complete(book));
        }
        for (SnapshotListener listener : listeners) {
            try {
                listener.onSnapshot(book);
            } catch (RuntimeException e) {
                log.error("Snapshot listener {} failed for {}", listener.getClass().getSimpleName(), key, e);
            }
        }
        return true;
    }

    public boolean update(String venue, Pair pair, OrderBookSnapshot book) {
        if (!book.getVenue().equals(venue) || !book.getPair().equals(pair)) {
            throw new IllegalArgumentException("Book " + book.bookKey() + " published under " + pair + "@" + venue);
        }
        return update(book);
    }

    public SnapshotRead read(String venue, Pair pair) {
        return read(BookKey.of(venue, pair));
    }

    public SnapshotRead read(BookKey key) {
        OrderBookSnapshot snapshot = cache.get(key);
        if (snapshot == null) {
            return SnapshotRead.missing();
        }
        return isFresh(snapshot) ? SnapshotRead.fresh(snapshot) : SnapshotRead.stale(snapshot);
    }

    /**
     * Last stored book regardless of age.
     */
    public Optional<OrderBookSnapshot> latest(BookKey key) {
        return Optional.ofNullable(cache.get(key));
    }

    /**
     * Returns a fresh book for the key, waiting up to {@code timeout} for the feed to publish one.
     */
    public Optional<OrderBookSnapshot> awaitFresh(String venue, Pair pair, Duration timeout) {
        BookKey key = BookKey.of(venue, pair);
        SnapshotRead current = read(key);
        if (current.isFresh()) {
            return Optional.of(current.getSnapshot());
        }
        CompletableFuture<OrderBookSnapshot> next = new CompletableFuture<>();
        waiters.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(next);
        // an update may have landed between the read and the registration
        SnapshotRead recheck = read(key);
        if (recheck.isFresh()) {
            removeWaiter(key, next);
            return Optional.of(recheck.getSnapshot());
        }
        try {
            return Optional.of(next.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.debug("No fresh book for {} within {}", key, timeout);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Snapshot waiter failed for " + key, e.getCause());
        } finally {
            removeWaiter(key, next);
        }
    }

    private void removeWaiter(BookKey key, CompletableFuture<OrderBookSnapshot> future) {
        waiters.computeIfPresent(key, (k, list) -> {
            list.remove(future);
            return list.isEmpty() ? null : list;
        });
    }

    private boolean isFresh(OrderBookSnapshot snapshot) {
        Instant now = clock.instant();
        Duration age = Duration.between(snapshot.getObservedAt(), now);
        return age.compareTo(properties.pricing().freshness()) <= 0;
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }
}

package com.venuearb.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of the fee rates in force at {@link #getFetchedAt()}.
 */
public final class FeeSchedule {

    private final Map<BookKey, Fee> fees;
    @Getter
    private final Instant fetchedAt;

    public FeeSchedule(Collection<Fee> fees, Instant fetchedAt) {
        Map<BookKey, Fee> byKey = new LinkedHashMap<>();
        for (Fee fee : fees) {
            byKey.put(fee.bookKey(), fee);
        }
        this.fees = Map.copyOf(byKey);
        this.fetchedAt = fetchedAt;
    }

    public static FeeSchedule empty() {
        return new FeeSchedule(List.of(), Instant.EPOCH);
    }

    public Optional<Fee> find(String venue, Pair pair) {
        return Optional.ofNullable(fees.get(BookKey.of(venue, pair)));
    }

    public int size() {
        return fees.size();
    }
}

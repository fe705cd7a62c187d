package com.venuearb.core;

import com.venuearb.domain.Asset;
import com.venuearb.domain.ResourceKey;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceLockTableTest {

    private static final ResourceKey KRAKEN_USDT = ResourceKey.of("kraken", Asset.of("USDT"));
    private static final ResourceKey KRAKEN_SOL = ResourceKey.of("kraken", Asset.of("SOL"));
    private static final ResourceKey BINANCE_SOL = ResourceKey.of("binanceus", Asset.of("SOL"));

    private final ResourceLockTable locks = new ResourceLockTable();

    @Test
    void conflictingClaimFailsWithoutPartialAcquisition() {
        locks.acquire("a", List.of(KRAKEN_USDT, KRAKEN_SOL));

        assertThatThrownBy(() -> locks.acquire("b", List.of(BINANCE_SOL, KRAKEN_SOL)))
                .isInstanceOf(ResourceBusyException.class)
                .satisfies(e -> assertThat(((ResourceBusyException) e).getConflicts()).containsExactly(KRAKEN_SOL));
        assertThat(locks.isLocked("binanceus", Asset.of("SOL"))).isFalse();
    }

    @Test
    void releaseFreesOnlyTheOwnersKeys() {
        locks.acquire("a", List.of(KRAKEN_USDT));
        locks.acquire("b", List.of(BINANCE_SOL));

        assertThat(locks.release("a")).isEqualTo(1);

        assertThat(locks.isLocked("kraken", Asset.of("USDT"))).isFalse();
        assertThat(locks.isAssetLocked(Asset.of("SOL"))).isTrue();
        assertThat(locks.tryAcquire("c", List.of(KRAKEN_USDT))).isTrue();
        assertThat(locks.snapshot()).containsEntry(KRAKEN_USDT, "c").containsEntry(BINANCE_SOL, "b");
    }

    @Test
    void disjointClaimsCoexist() {
        assertThat(locks.tryAcquire("a", List.of(KRAKEN_USDT))).isTrue();
        assertThat(locks.tryAcquire("b", List.of(KRAKEN_SOL))).isTrue();
        assertThat(locks.tryAcquire("c", List.of(KRAKEN_SOL, BINANCE_SOL))).isFalse();
    }

    @Test
    void onlyOneOfManyConcurrentClaimsWins() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String owner = "exec-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    if (locks.tryAcquire(owner, List.of(KRAKEN_USDT, KRAKEN_SOL))) {
                        winners.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(winners.get()).isEqualTo(1);
    }
}

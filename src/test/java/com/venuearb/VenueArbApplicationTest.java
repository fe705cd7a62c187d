package com.venuearb;

import com.venuearb.core.ExecutionStats;
import com.venuearb.core.MarketIngestor;
import com.venuearb.core.PathCatalog;
import com.venuearb.domain.PathFamily;
import com.venuearb.domain.TerminalState;
import com.venuearb.infra.PaperTradingVenue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the engine on the bundled recording with paper venues and waits for the replayed
 * SOL/USDT dislocation to be traded.
 */
@SpringBootTest(properties = {
        "arb.replay.enabled=true",
        "arb.replay.interval-millis=50",
        "arb.scan.cross-venue.min-spacing=20ms",
        "arb.scan.cross-venue.fallback-millis=200",
        "arb.execution.default-leg-timeout=2s",
        "arb.execution.remediation-timeout=2s",
        "arb.venues.kraken.leg-timeout=2s",
        "arb.venues.binanceus.leg-timeout=2s",
        "arb.venues.coinbase.leg-timeout=2s"
})
class VenueArbApplicationTest {

    @Autowired
    private PathCatalog catalog;
    @Autowired
    private ExecutionStats stats;
    @Autowired
    private MarketIngestor ingestor;
    @Autowired
    private PaperTradingVenue paper;

    @Test
    void tradesTheReplayedDislocation() throws InterruptedException {
        assertThat(catalog.paths(PathFamily.CROSS_VENUE)).isNotEmpty();
        assertThat(catalog.paths(PathFamily.TRIANGULAR)).isNotEmpty();

        Instant deadline = Instant.now().plus(Duration.ofSeconds(20));
        while (stats.total() == 0 && Instant.now().isBefore(deadline)) {
            Thread.sleep(50);
        }

        assertThat(ingestor.accepted()).isPositive();
        assertThat(stats.total()).isPositive();
        assertThat(stats.count(TerminalState.PARTIALLY_STRANDED)).isZero();
        assertThat(stats.legsPlaced()).isGreaterThanOrEqualTo(1);
        assertThat(paper.balances()).isNotEmpty();
    }
}

package com.venuearb.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathTest {

    private static final Pair SOL_USDT = Pair.parse("SOL/USDT");
    private static final Pair SOL_BTC = Pair.parse("SOL/BTC");
    private static final Pair BTC_USDT = Pair.parse("BTC/USDT");

    @Test
    void buildsCrossVenuePathOverOnePair() {
        Path path = Path.of(0, Asset.of("USDT"), List.of(
                Leg.of("kraken", SOL_USDT, Side.BUY),
                Leg.of("binanceus", SOL_USDT, Side.SELL)));

        assertThat(path.getFamily()).isEqualTo(PathFamily.CROSS_VENUE);
        assertThat(path.getAssets()).containsExactlyInAnyOrder(Asset.of("USDT"), Asset.of("SOL"));
        assertThat(path.getResources()).containsExactlyInAnyOrder(
                ResourceKey.of("kraken", Asset.of("USDT")),
                ResourceKey.of("kraken", Asset.of("SOL")),
                ResourceKey.of("binanceus", Asset.of("SOL")),
                ResourceKey.of("binanceus", Asset.of("USDT")));
        assertThat(path.isFundedLeg(0)).isTrue();
        assertThat(path.isFundedLeg(1)).isTrue();
    }

    @Test
    void buildsTriangleWithConvertingLegs() {
        Asset usdt = Asset.of("USDT");
        Asset btc = Asset.of("BTC");
        Asset sol = Asset.of("SOL");
        Path path = Path.of(3, usdt, List.of(
                Leg.converting("kraken", BTC_USDT, usdt, btc),
                Leg.converting("kraken", SOL_BTC, btc, sol),
                Leg.converting("kraken", SOL_USDT, sol, usdt)));

        assertThat(path.getFamily()).isEqualTo(PathFamily.TRIANGULAR);
        assertThat(path.leg(0).getSide()).isEqualTo(Side.BUY);
        assertThat(path.leg(1).getSide()).isEqualTo(Side.BUY);
        assertThat(path.leg(2).getSide()).isEqualTo(Side.SELL);
        assertThat(path.isFundedLeg(1)).isFalse();
        assertThat(path.toString()).startsWith("#3 USDT: BUY BTC/USDT@kraken");
    }

    @Test
    void rejectsBrokenChain() {
        assertThatThrownBy(() -> Path.of(0, Asset.of("USDT"), List.of(
                Leg.of("kraken", BTC_USDT, Side.BUY),
                Leg.of("kraken", SOL_BTC, Side.SELL),
                Leg.of("kraken", SOL_USDT, Side.SELL))))
                .isInstanceOf(InvalidPathException.class)
                .hasMessageContaining("Broken chain");
    }

    @Test
    void rejectsPathNotReturningToStart() {
        assertThatThrownBy(() -> Path.of(0, Asset.of("USDT"), List.of(
                Leg.of("kraken", SOL_USDT, Side.BUY),
                Leg.of("binanceus", SOL_USDT, Side.BUY))))
                .isInstanceOf(InvalidPathException.class);
    }

    @Test
    void rejectsCrossVenuePathOnOneVenue() {
        assertThatThrownBy(() -> Path.of(0, Asset.of("USDT"), List.of(
                Leg.of("kraken", SOL_USDT, Side.BUY),
                Leg.of("kraken", SOL_USDT, Side.SELL))))
                .isInstanceOf(InvalidPathException.class)
                .hasMessageContaining("two venues");
    }

    @Test
    void rejectsTriangleAcrossVenues() {
        Asset usdt = Asset.of("USDT");
        Asset btc = Asset.of("BTC");
        Asset sol = Asset.of("SOL");
        assertThatThrownBy(() -> Path.of(0, usdt, List.of(
                Leg.converting("kraken", BTC_USDT, usdt, btc),
                Leg.converting("coinbase", SOL_BTC, btc, sol),
                Leg.converting("kraken", SOL_USDT, sol, usdt))))
                .isInstanceOf(InvalidPathException.class)
                .hasMessageContaining("one venue");
    }

    @Test
    void rejectsUnsupportedLegCount() {
        assertThatThrownBy(() -> Path.of(0, Asset.of("USDT"), List.of(Leg.of("kraken", SOL_USDT, Side.BUY))))
                .isInstanceOf(InvalidPathException.class);
    }

    @Test
    void convertingRefusesUnrelatedPair() {
        assertThatThrownBy(() -> Leg.converting("kraken", SOL_USDT, Asset.of("BTC"), Asset.of("USDT")))
                .isInstanceOf(InvalidPathException.class);
    }
}

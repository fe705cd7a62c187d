package com.venuearb.config;

import com.venuearb.domain.Asset;
import com.venuearb.domain.Pair;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ArbPropertiesBindingTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(TestConfig.class)
            .withPropertyValues(
                    "arb.config-version=3",
                    "arb.venues.kraken.taker-fee-rate=0.0026",
                    "arb.venues.kraken.leg-timeout=10s",
                    "arb.venues.kraken.pairs[0]=SOL/USDT",
                    "arb.venues.kraken.pairs[1]= BTC/USDT ",
                    "arb.venues.binanceus.taker-fee-rate=0.001",
                    "arb.venues.binanceus.pairs[0]=SOL/USDT",
                    "arb.pricing.freshness=2s",
                    "arb.risk.max-trade-size.usdt=1000",
                    "arb.risk.min-trade-size.USDT=10",
                    "arb.execution.enabled=true",
                    "arb.scan.cross-venue.min-spacing=250ms"
            );

    @Test
    void bindsNestedRecordsAndFillsDefaults() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            ArbProperties properties = context.getBean(ArbProperties.class);

            assertThat(properties.configVersion()).isEqualTo(3);
            assertThat(properties.pairsByVenue().get("kraken"))
                    .containsExactly(Pair.parse("SOL/USDT"), Pair.parse("BTC/USDT"));
            assertThat(properties.legTimeoutFor("kraken")).isEqualTo(Duration.ofSeconds(10));
            assertThat(properties.legTimeoutFor("binanceus")).isEqualTo(Duration.ofSeconds(30));
            assertThat(properties.pricing().freshness()).isEqualTo(Duration.ofSeconds(2));
            assertThat(properties.risk().maxTradeSizeFor(Asset.of("USDT"))).hasValueSatisfying(
                    v -> assertThat(v).isEqualByComparingTo("1000"));
            assertThat(properties.risk().maxTradeSizeFor(Asset.of("SOL"))).isEmpty();
            assertThat(properties.risk().minTradeSizeFor(Asset.of("USDT"))).isEqualByComparingTo("10");
            assertThat(properties.risk().depthMultiple()).isEqualByComparingTo("2.5");
            assertThat(properties.execution().enabled()).isTrue();
            assertThat(properties.scan().crossVenue().minSpacing()).isEqualTo(Duration.ofMillis(250));
            assertThat(properties.scan().triangular().fallbackMillis()).isEqualTo(30_000L);
        });
    }

    @Test
    void executionDefaultsToWatchOnly() {
        new ApplicationContextRunner()
                .withUserConfiguration(TestConfig.class)
                .run(context -> assertThat(context.getBean(ArbProperties.class).execution().enabled()).isFalse());
    }

    @Test
    void rejectsDepthMultipleOutsideBand() {
        runner.withPropertyValues("arb.risk.depth-multiple=1.5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void rejectsInvertedThresholdBand() {
        runner.withPropertyValues("arb.risk.min-threshold-pct=0.8", "arb.risk.baseline-threshold-pct=0.5")
                .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(ArbProperties.class)
    static class TestConfig {
    }
}

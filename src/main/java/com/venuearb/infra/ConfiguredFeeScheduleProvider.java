package com.venuearb.infra;

import com.venuearb.config.ArbProperties;
import com.venuearb.domain.Fee;
import com.venuearb.domain.FeeSchedule;
import com.venuearb.domain.Pair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fee rates taken from the venue configuration. A venue without a taker rate contributes no
 * entries, so its paths stay unevaluable until a real schedule is supplied.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfiguredFeeScheduleProvider implements FeeScheduleProvider {

    private final ArbProperties properties;
    private final Clock clock;

    @Override
    public FeeSchedule fetch() {
        List<Fee> fees = new ArrayList<>();
        for (Map.Entry<String, ArbProperties.Venue> entry : properties.venues().entrySet()) {
            ArbProperties.Venue venue = entry.getValue();
            if (venue.takerFeeRate() == null) {
                log.warn("No taker fee configured for venue {}", entry.getKey());
                continue;
            }
            for (String symbol : venue.pairs()) {
                fees.add(Fee.builder()
                        .venue(entry.getKey())
                        .pair(Pair.parse(symbol))
                        .takerRate(venue.takerFeeRate())
                        .makerRate(venue.makerFeeRate() != null ? venue.makerFeeRate() : venue.takerFeeRate())
                        .build());
            }
        }
        return new FeeSchedule(fees, clock.instant());
    }
}

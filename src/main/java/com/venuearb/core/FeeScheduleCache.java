package com.venuearb.core;

import com.venuearb.domain.FeeSchedule;
import com.venuearb.infra.FeeScheduleProvider;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Fee rates change on a scale of minutes, so they are pulled on a slow cadence and every scan
 * reads the last good schedule. A failed refresh keeps the previous one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeeScheduleCache {

    private final FeeScheduleProvider provider;
    private final AtomicReference<FeeSchedule> current = new AtomicReference<>(FeeSchedule.empty());

    @PostConstruct
    public void init() {
        refresh();
    }

    @Scheduled(fixedDelayString = "${arb.fees.refresh-millis:300000}", initialDelayString = "${arb.fees.refresh-millis:300000}")
    public void refresh() {
        try {
            FeeSchedule schedule = provider.fetch();
            if (schedule == null) {
                log.warn("Fee provider returned nothing; keeping {} entries from {}",
                        current.get().size(), current.get().getFetchedAt());
                return;
            }
            current.set(schedule);
            log.info("Fee schedule refreshed: {} markets", schedule.size());
        } catch (RuntimeException e) {
            log.warn("Fee refresh failed; keeping {} entries from {}",
                    current.get().size(), current.get().getFetchedAt(), e);
        }
    }

    public FeeSchedule current() {
        return current.get();
    }
}

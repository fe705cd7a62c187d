package com.venuearb.core;

import com.venuearb.config.ArbProperties;
import com.venuearb.domain.Admission;
import com.venuearb.domain.Evaluation;
import com.venuearb.domain.FeeSchedule;
import com.venuearb.domain.Leg;
import com.venuearb.domain.MarketContext;
import com.venuearb.domain.Opportunity;
import com.venuearb.domain.OpportunityEvent;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.domain.Path;
import com.venuearb.domain.PathFamily;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives evaluation of the path catalog. A book update schedules every path touching its base
 * asset; each family also has a periodic sweep for paths whose books rarely move. A path is
 * never evaluated twice at once nor more often than its family's spacing, stretched while one of
 * its assets is volatile.
 */
@Slf4j
@Service
public class ScanScheduler implements SnapshotListener {

    private static final MathContext MC = MathContext.DECIMAL128;

    private final ArbProperties properties;
    private final PathCatalog catalog;
    private final SnapshotCache cache;
    private final ProfitEngine profitEngine;
    private final FeeScheduleCache fees;
    private final RiskGate riskGate;
    private final MarketContextFactory contextFactory;
    private final ExecutionCoordinator coordinator;
    private final ApplicationEventPublisher events;
    private final ExecutorService workers;
    private final Clock clock;

    private final Set<Integer> inFlight = ConcurrentHashMap.newKeySet();
    private final Map<Integer, Instant> lastEvaluated = new ConcurrentHashMap<>();

    public ScanScheduler(ArbProperties properties, PathCatalog catalog, SnapshotCache cache,
            ProfitEngine profitEngine, FeeScheduleCache fees, RiskGate riskGate,
            MarketContextFactory contextFactory, ExecutionCoordinator coordinator,
            ApplicationEventPublisher events, @Qualifier("scanExecutor") ExecutorService workers, Clock clock) {
        this.properties = properties;
        this.catalog = catalog;
        this.cache = cache;
        this.profitEngine = profitEngine;
        this.fees = fees;
        this.riskGate = riskGate;
        this.contextFactory = contextFactory;
        this.coordinator = coordinator;
        this.events = events;
        this.workers = workers;
        this.clock = clock;
    }

    @PostConstruct
    void register() {
        if (properties.scan().enabled()) {
            cache.addListener(this);
            log.info("Scan scheduler listening: {} paths, execution {}", catalog.size(),
                    properties.execution().enabled() ? "ENABLED" : "WATCH-ONLY");
        }
    }

    @Override
    public void onSnapshot(OrderBookSnapshot snapshot) {
        for (Path path : catalog.pathsTouching(snapshot.getPair().getBase())) {
            if (path.touches(snapshot.getPair().getQuote())) {
                submit(path);
            }
        }
    }

    @Scheduled(fixedDelayString = "${arb.scan.cross-venue.fallback-millis:10000}")
    public void sweepCrossVenue() {
        sweep(PathFamily.CROSS_VENUE);
    }

    @Scheduled(fixedDelayString = "${arb.scan.triangular.fallback-millis:30000}")
    public void sweepTriangular() {
        sweep(PathFamily.TRIANGULAR);
    }

    void sweep(PathFamily family) {
        if (!properties.scan().enabled()) {
            return;
        }
        log.debug("Sweep {}: {} paths, {} in flight", family, catalog.paths(family).size(), inFlight.size());
        catalog.paths(family).forEach(this::submit);
    }

    /**
     * Hands the path to a worker if it is due and not already being evaluated.
     *
     * @return whether a cycle was scheduled
     */
    boolean submit(Path path) {
        if (!isDue(path) || !inFlight.add(path.getIndex())) {
            return false;
        }
        try {
            workers.execute(() -> {
                try {
                    runCycle(path);
                } finally {
                    inFlight.remove(path.getIndex());
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(path.getIndex());
            log.debug("Scan pool refused {}", path);
            return false;
        }
    }

    boolean isDue(Path path) {
        Instant last = lastEvaluated.get(path.getIndex());
        if (last == null) {
            return true;
        }
        Duration spacing = spacingFor(path);
        return !Duration.between(last, clock.instant()).minus(spacing).isNegative();
    }

    Duration spacingFor(Path path) {
        ArbProperties.Family family = path.getFamily() == PathFamily.CROSS_VENUE
                ? properties.scan().crossVenue()
                : properties.scan().triangular();
        BigDecimal multiplier = riskGate.cadenceMultiplier(path);
        long millis = BigDecimal.valueOf(family.minSpacing().toMillis()).multiply(multiplier).longValue();
        return Duration.ofMillis(millis);
    }

    /**
     * One evaluate, admit and (optionally) execute pass over a single path. Never throws.
     */
    void runCycle(Path path) {
        lastEvaluated.put(path.getIndex(), clock.instant());
        try {
            FeeSchedule schedule = fees.current();
            BigDecimal slippage = properties.pricing().assumedSlippageRate();
            Evaluation evaluation = profitEngine.evaluate(path, schedule, slippage);
            if (!evaluation.isEvaluable()) {
                log.debug("Skipped {}: {} ({})", path, evaluation.getReason(), evaluation.getDetail());
                return;
            }
            Opportunity opportunity = evaluation.getOpportunity();
            if (opportunity.getNetProfitPct().signum() <= 0) {
                return;
            }

            MarketContext context = contextFactory.build(path);
            Admission admission = riskGate.admit(opportunity, context);
            events.publishEvent(new OpportunityEvent(opportunity, admission));
            if (!admission.isAccepted()) {
                return;
            }
            Opportunity sized = admission.getOpportunity();
            log.info("Opportunity {} net={}% threshold={}% size={} {}", path, sized.getNetProfitPct(),
                    admission.getThresholdPct(), sized.getMaxSafeSizeInStartAsset(), path.getStartAsset());

            if (!properties.execution().enabled()) {
                log.info("[WATCH-ONLY] Not executing {}", path);
                return;
            }
            coordinator.execute(sized, candidate -> stillProfitable(candidate, admission.getThresholdPct())
                    && stillFunded(candidate));
        } catch (ResourceBusyException e) {
            log.debug("Skipped {}: {}", path, e.getMessage());
        } catch (Exception e) {
            log.error("Scan cycle failed for {}", path, e);
        }
    }

    private boolean stillProfitable(Opportunity candidate, BigDecimal thresholdPct) {
        Evaluation recheck = profitEngine.evaluate(candidate.getPath(), fees.current(),
                properties.pricing().assumedSlippageRate());
        if (!recheck.isEvaluable()) {
            log.info("[EXECUTION] Pre-flight: {} no longer evaluable ({})", candidate.getPath(), recheck.getReason());
            return false;
        }
        BigDecimal net = recheck.getOpportunity().getNetProfitPct();
        if (net.compareTo(thresholdPct) < 0) {
            log.info("[EXECUTION] Pre-flight: {} net fell to {}% below {}%", candidate.getPath(), net, thresholdPct);
            return false;
        }
        return true;
    }

    /**
     * Balances are read again under the lock: another execution may have spent them since admission.
     */
    private boolean stillFunded(Opportunity candidate) {
        Path path = candidate.getPath();
        MarketContext context = contextFactory.build(path);
        for (int i = 0; i < path.size(); i++) {
            if (!path.isFundedLeg(i)) {
                continue;
            }
            Leg leg = path.leg(i);
            BigDecimal needed = candidate.getMaxSafeSizeInStartAsset()
                    .multiply(candidate.getLegInputsPerUnit().get(i), MC);
            BigDecimal available = context.availableBalance(leg.getVenue(), leg.consumed());
            if (available.compareTo(needed) < 0) {
                log.info("[EXECUTION] Pre-flight: {} needs {} {} on {} but only {} is available", path,
                        needed, leg.consumed(), leg.getVenue(), available);
                return false;
            }
        }
        return true;
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}

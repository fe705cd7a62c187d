package com.venuearb.core;

import com.venuearb.config.ArbProperties;
import com.venuearb.domain.Asset;
import com.venuearb.domain.ExecutionResult;
import com.venuearb.domain.ExecutionResultEvent;
import com.venuearb.domain.FillEvent;
import com.venuearb.domain.FillStatus;
import com.venuearb.domain.Holding;
import com.venuearb.domain.Leg;
import com.venuearb.domain.LegOutcome;
import com.venuearb.domain.LegStatus;
import com.venuearb.domain.Opportunity;
import com.venuearb.domain.OrderBookSnapshot;
import com.venuearb.domain.OrderRequest;
import com.venuearb.domain.Pair;
import com.venuearb.domain.Path;
import com.venuearb.domain.Side;
import com.venuearb.domain.StrandedPositionEvent;
import com.venuearb.domain.TerminalState;
import com.venuearb.infra.OrderGateway;
import com.venuearb.infra.OrderRejectedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Commits capital to an admitted opportunity. Legs are placed one at a time in path order; each
 * waits for its fill confirmation before the next is sized from what it actually produced. A
 * failed leg triggers one market liquidation per held intermediate balance back into the start
 * asset. Every resource the path touches stays locked until a terminal state is reached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionCoordinator {

    private static final MathContext MC = MathContext.DECIMAL128;

    private final ArbProperties properties;
    private final OrderGateway gateway;
    private final FillRouter fillRouter;
    private final ResourceLockTable locks;
    private final SnapshotCache snapshots;
    private final PathCatalog catalog;
    private final ApplicationEventPublisher events;
    private final Clock clock;

    private final Map<String, InFlightExecution> active = new ConcurrentHashMap<>();

    public ExecutionResult execute(Opportunity opportunity) {
        return execute(opportunity, PreFlightCheck.NONE);
    }

    /**
     * @throws ResourceBusyException if another execution holds any (venue, asset) the path touches
     */
    public ExecutionResult execute(Opportunity opportunity, PreFlightCheck preFlight) {
        if (!opportunity.isSized()) {
            throw new IllegalArgumentException("Opportunity on " + opportunity.getPath() + " has not been sized");
        }
        Path path = opportunity.getPath();
        String executionId = UUID.randomUUID().toString();
        locks.acquire(executionId, path.getResources());

        InFlightExecution flight = new InFlightExecution(executionId, path, clock.instant());
        active.put(executionId, flight);
        ExecutionResult result;
        try {
            log.info("[EXECUTION] {} start {} size={} {} expected net={}%", executionId, path,
                    opportunity.getMaxSafeSizeInStartAsset(), path.getStartAsset(), opportunity.getNetProfitPct());
            result = run(flight, opportunity, preFlight);
        } finally {
            active.remove(executionId);
            locks.release(executionId);
        }

        logOutcome(result);
        events.publishEvent(new ExecutionResultEvent(result));
        if (result.getTerminalState() == TerminalState.PARTIALLY_STRANDED) {
            events.publishEvent(new StrandedPositionEvent(executionId, path, result.getStrandedHoldings(),
                    result.getFailureReason()));
        }
        return result;
    }

    /**
     * States of the executions currently holding locks, by execution id.
     */
    public Map<String, ExecutionState> activeExecutions() {
        Map<String, ExecutionState> view = new LinkedHashMap<>();
        active.forEach((id, flight) -> view.put(id, flight.getState()));
        return view;
    }

    private ExecutionResult run(InFlightExecution flight, Opportunity opportunity, PreFlightCheck preFlight) {
        Path path = flight.getPath();
        BigDecimal size = opportunity.getMaxSafeSizeInStartAsset();
        ExecutionResult.ExecutionResultBuilder result = ExecutionResult.builder()
                .executionId(flight.getExecutionId())
                .opportunity(opportunity)
                .startSize(size)
                .startedAt(flight.getStartedAt());

        log.info("[EXECUTION] {} State: {} | Pre-flight check", flight.getExecutionId(), flight.getState());
        if (!preFlight.stillValid(opportunity)) {
            flight.moveTo(ExecutionState.ROLLED_BACK);
            return result.terminalState(TerminalState.ROLLED_BACK)
                    .failureReason("withdrawn at pre-flight check")
                    .recoveredAmount(size)
                    .realizedProfit(BigDecimal.ZERO)
                    .finishedAt(clock.instant())
                    .build();
        }

        BigDecimal amount = size;
        // start asset left over when the first leg fills below its limit price
        BigDecimal startLeftover = BigDecimal.ZERO;
        for (int i = 0; i < path.size(); i++) {
            Leg leg = path.leg(i);
            LegOutcome outcome = placeLeg(flight.getExecutionId(), i, leg, amount,
                    opportunity.getReferencePrices().get(i));
            result.legOutcome(outcome);
            if (!outcome.isAcceptable()) {
                flight.moveTo(ExecutionState.LEG_FAILED);
                log.warn("[EXECUTION] {} leg {} ({}) failed: {} filled {}/{}", flight.getExecutionId(), i + 1, leg,
                        outcome.getStatus(), outcome.getFilledQuantity(), outcome.getRequestedQuantity());
                return remediate(flight, result, i, amount, outcome, size, startLeftover);
            }
            flight.moveTo(ExecutionState.committed(i));
            if (i == 0) {
                startLeftover = size.subtract(outcome.getConsumedAmount()).max(BigDecimal.ZERO);
            }
            amount = outcome.getReceivedAmount();
        }

        BigDecimal recovered = amount.add(startLeftover);
        flight.moveTo(ExecutionState.COMPLETED);
        return result.terminalState(TerminalState.COMPLETED)
                .recoveredAmount(recovered)
                .realizedProfit(recovered.subtract(size))
                .finishedAt(clock.instant())
                .build();
    }

    private ExecutionResult remediate(InFlightExecution flight, ExecutionResult.ExecutionResultBuilder result,
            int failedIndex, BigDecimal legInput, LegOutcome failed, BigDecimal size, BigDecimal startLeftover) {
        Path path = flight.getPath();
        Asset start = path.getStartAsset();
        Leg leg = path.leg(failedIndex);

        BigDecimal recovered = startLeftover;
        List<Holding> held = new ArrayList<>();
        BigDecimal unspent = legInput.subtract(failed.getConsumedAmount());
        if (failedIndex == 0) {
            // the start balance was never converted
            recovered = recovered.add(unspent);
        } else if (unspent.signum() > 0) {
            // the input of a later leg sits where the previous leg produced it
            held.add(Holding.of(path.leg(failedIndex - 1).getVenue(), leg.consumed(), unspent));
        }
        if (failed.getReceivedAmount().signum() > 0) {
            if (leg.received().equals(start)) {
                recovered = recovered.add(failed.getReceivedAmount());
            } else {
                held.add(Holding.of(leg.getVenue(), leg.received(), failed.getReceivedAmount()));
            }
        }

        TerminalState cleanState = failedIndex == 0 ? TerminalState.ROLLED_BACK : TerminalState.COMPLETED;
        if (held.isEmpty()) {
            if (failedIndex > 0) {
                flight.moveTo(ExecutionState.REMEDIATING);
            }
            flight.moveTo(failedIndex == 0 ? ExecutionState.ROLLED_BACK : ExecutionState.COMPLETED);
            return result.terminalState(cleanState)
                    .failureReason(failureReason(failedIndex, failed))
                    .recoveredAmount(recovered)
                    .realizedProfit(recovered.subtract(size))
                    .finishedAt(clock.instant())
                    .build();
        }

        flight.moveTo(ExecutionState.REMEDIATING);
        List<Holding> stranded = new ArrayList<>();
        int seq = 0;
        for (Holding holding : held) {
            log.warn("[REMEDIATION] {} liquidating {} {} on {} into {}", flight.getExecutionId(),
                    holding.getAmount(), holding.getAsset(), holding.getVenue(), start);
            Optional<LegOutcome> outcome = liquidate(flight.getExecutionId(), seq++, holding, start);
            if (outcome.isEmpty()) {
                stranded.add(holding);
                continue;
            }
            LegOutcome liquidation = outcome.get();
            result.remediation(liquidation);
            recovered = recovered.add(liquidation.getReceivedAmount());
            if (!liquidation.isAcceptable()) {
                BigDecimal left = holding.getAmount().subtract(liquidation.getConsumedAmount());
                stranded.add(Holding.of(holding.getVenue(), holding.getAsset(), left.max(BigDecimal.ZERO)));
            }
        }

        String reason = failureReason(failedIndex, failed);
        TerminalState terminal;
        if (stranded.isEmpty()) {
            terminal = cleanState;
            flight.moveTo(failedIndex == 0 ? ExecutionState.ROLLED_BACK : ExecutionState.COMPLETED);
        } else {
            terminal = TerminalState.PARTIALLY_STRANDED;
            flight.moveTo(ExecutionState.PARTIALLY_STRANDED);
            reason = reason + "; remediation left " + stranded;
            stranded.forEach(result::strandedHolding);
        }
        return result.terminalState(terminal)
                .failureReason(reason)
                .recoveredAmount(recovered)
                .realizedProfit(recovered.subtract(size))
                .finishedAt(clock.instant())
                .build();
    }

    private LegOutcome placeLeg(String executionId, int index, Leg leg, BigDecimal input, BigDecimal reference) {
        ArbProperties.Execution cfg = properties.execution();
        BigDecimal limit;
        BigDecimal quantity;
        if (leg.getSide() == Side.BUY) {
            limit = reference.multiply(BigDecimal.ONE.add(cfg.limitSlippageRate()), MC);
            quantity = input.divide(limit, MC);
        } else {
            limit = reference.multiply(BigDecimal.ONE.subtract(cfg.limitSlippageRate()), MC);
            quantity = input;
        }
        quantity = normalize(quantity);
        OrderRequest request = OrderRequest.builder()
                .clientOrderId(executionId + "-L" + (index + 1))
                .venue(leg.getVenue())
                .pair(leg.getPair())
                .side(leg.getSide())
                .quantity(quantity)
                .limitPrice(limit)
                .build();
        log.info("[EXECUTION] {} leg {}: {} qty={} limit={}", executionId, index + 1, leg, quantity, limit);
        return submitAndAwait(leg, request, reference, properties.legTimeoutFor(leg.getVenue()));
    }

    /**
     * One market order converting a holding into {@code target}; empty when no route or price exists.
     */
    private Optional<LegOutcome> liquidate(String executionId, int seq, Holding holding, Asset target) {
        Optional<Pair> pair = catalog.findPair(holding.getVenue(), holding.getAsset(), target);
        if (pair.isEmpty()) {
            log.error("[REMEDIATION] {} no {}/{} market on {}", executionId, holding.getAsset(), target,
                    holding.getVenue());
            return Optional.empty();
        }
        Leg leg = Leg.converting(holding.getVenue(), pair.get(), holding.getAsset(), target);
        Duration timeout = properties.execution().remediationTimeout();
        Optional<OrderBookSnapshot> book = snapshots.awaitFresh(leg.getVenue(), leg.getPair(), timeout);
        BigDecimal reference = book.map(b -> leg.getSide() == Side.BUY ? b.bestAsk() : b.bestBid()).orElse(null);
        if (reference == null || reference.signum() <= 0) {
            log.error("[REMEDIATION] {} no usable price for {}", executionId, leg.bookKey());
            return Optional.empty();
        }
        BigDecimal quantity = leg.getSide() == Side.BUY
                ? normalize(holding.getAmount().divide(reference, MC))
                : normalize(holding.getAmount());
        OrderRequest request = OrderRequest.builder()
                .clientOrderId(executionId + "-R" + (seq + 1))
                .venue(leg.getVenue())
                .pair(leg.getPair())
                .side(leg.getSide())
                .quantity(quantity)
                .build();
        return Optional.of(submitAndAwait(leg, request, reference, timeout));
    }

    private LegOutcome submitAndAwait(Leg leg, OrderRequest request, BigDecimal reference, Duration timeout) {
        String id = request.getClientOrderId();
        LegOutcome.LegOutcomeBuilder outcome = LegOutcome.builder()
                .leg(leg)
                .clientOrderId(id)
                .requestedQuantity(request.getQuantity());
        if (request.getQuantity().signum() <= 0) {
            return emptyFill(outcome, LegStatus.REJECTED, "quantity rounds to zero");
        }

        CompletableFuture<FillEvent> confirmation = fillRouter.register(id);
        FillEvent fill;
        try {
            gateway.submit(request);
            fill = confirmation.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (OrderRejectedException e) {
            fillRouter.discard(id);
            return emptyFill(outcome, LegStatus.REJECTED, e.getMessage());
        } catch (TimeoutException e) {
            return timedOut(leg, id, confirmation, outcome, request, reference, "no confirmation within " + timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return timedOut(leg, id, confirmation, outcome, request, reference, "interrupted while awaiting fill");
        } catch (ExecutionException e) {
            fillRouter.discard(id);
            return emptyFill(outcome, LegStatus.REJECTED, String.valueOf(e.getCause()));
        } catch (RuntimeException e) {
            log.error("[EXECUTION] submit of {} on {} failed", id, request.getVenue(), e);
            fillRouter.discard(id);
            return emptyFill(outcome, LegStatus.REJECTED, "submit failed: " + e);
        }
        return settled(outcome, leg, request, fill, reference);
    }

    private LegOutcome settled(LegOutcome.LegOutcomeBuilder outcome, Leg leg, OrderRequest request, FillEvent fill,
            BigDecimal reference) {
        LegStatus status;
        if (fill.getStatus() == FillStatus.REJECTED || fill.getFilledQuantity().signum() <= 0) {
            status = LegStatus.REJECTED;
        } else if (fill.getFilledQuantity().compareTo(request.getQuantity()) >= 0) {
            status = LegStatus.FILLED;
        } else {
            status = LegStatus.PARTIALLY_FILLED;
        }
        boolean acceptable = status != LegStatus.REJECTED && withinTolerance(fill.getFilledQuantity(),
                request.getQuantity());
        return withFill(outcome, leg, fill, reference)
                .status(status)
                .acceptable(acceptable)
                .failureReason(acceptable ? null : Optional.ofNullable(fill.getReason()).orElse(status.name()))
                .build();
    }

    /**
     * Cancels the order and waits up to the cancel grace for its final fill report, which supersedes
     * any partial seen so far. The leg still counts as done if that report shows it filled in time.
     */
    private LegOutcome timedOut(Leg leg, String id, CompletableFuture<FillEvent> confirmation,
            LegOutcome.LegOutcomeBuilder outcome, OrderRequest request, BigDecimal reference, String reason) {
        try {
            gateway.cancel(request.getVenue(), id);
        } catch (RuntimeException e) {
            log.warn("[EXECUTION] cancel of {} on {} failed", id, request.getVenue(), e);
        }
        Optional<FillEvent> last = awaitFinalFill(id, confirmation);
        if (last.isPresent() && last.get().getStatus() != FillStatus.REJECTED
                && last.get().getFilledQuantity().signum() > 0
                && withinTolerance(last.get().getFilledQuantity(), request.getQuantity())) {
            log.info("[EXECUTION] {} filled {} before the cancel took effect", id, last.get().getFilledQuantity());
            return settled(outcome, leg, request, last.get(), reference);
        }
        if (last.isEmpty()) {
            last = fillRouter.lastPartial(id);
        }
        fillRouter.discard(id);
        if (last.isEmpty() || last.get().getFilledQuantity().signum() <= 0) {
            return emptyFill(outcome, LegStatus.TIMED_OUT, reason);
        }
        return withFill(outcome, leg, last.get(), reference)
                .status(LegStatus.TIMED_OUT)
                .acceptable(false)
                .failureReason(reason)
                .build();
    }

    private Optional<FillEvent> awaitFinalFill(String id, CompletableFuture<FillEvent> confirmation) {
        Duration grace = properties.execution().cancelGrace();
        try {
            return Optional.of(confirmation.get(grace.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            log.warn("[EXECUTION] no final fill for {} within {} of cancel; using last partial", id, grace);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.warn("[EXECUTION] final fill for {} failed: {}", id, e.getCause());
        }
        return Optional.empty();
    }

    private static LegOutcome.LegOutcomeBuilder withFill(LegOutcome.LegOutcomeBuilder outcome, Leg leg,
            FillEvent fill, BigDecimal reference) {
        BigDecimal filled = fill.getFilledQuantity();
        BigDecimal price = fill.getAveragePrice() != null ? fill.getAveragePrice() : reference;
        BigDecimal notional = filled.multiply(price, MC);
        BigDecimal consumed = leg.getSide() == Side.BUY ? notional : filled;
        BigDecimal received = (leg.getSide() == Side.BUY ? filled : notional).subtract(fill.getFeeAmount());
        return outcome.filledQuantity(filled)
                .averagePrice(price)
                .consumedAmount(consumed)
                .receivedAmount(received.max(BigDecimal.ZERO));
    }

    private static LegOutcome emptyFill(LegOutcome.LegOutcomeBuilder outcome, LegStatus status, String reason) {
        return outcome.filledQuantity(BigDecimal.ZERO)
                .consumedAmount(BigDecimal.ZERO)
                .receivedAmount(BigDecimal.ZERO)
                .status(status)
                .acceptable(false)
                .failureReason(reason)
                .build();
    }

    private boolean withinTolerance(BigDecimal filled, BigDecimal requested) {
        BigDecimal floor = requested.multiply(BigDecimal.ONE.subtract(properties.execution().partialFillTolerance()), MC);
        return filled.compareTo(floor) >= 0;
    }

    /**
     * Rounds down so an order never asks for more than the balance it draws on.
     */
    private BigDecimal normalize(BigDecimal quantity) {
        return quantity.setScale(properties.execution().quantityScale(), RoundingMode.DOWN);
    }

    private static String failureReason(int failedIndex, LegOutcome failed) {
        return "leg " + (failedIndex + 1) + " " + failed.getStatus()
                + (failed.getFailureReason() != null ? ": " + failed.getFailureReason() : "");
    }

    private void logOutcome(ExecutionResult result) {
        switch (result.getTerminalState()) {
            case COMPLETED:
                log.info("[EXECUTION] {} COMPLETED realized {} {}", result.getExecutionId(),
                        result.getRealizedProfit(), result.getOpportunity().getPath().getStartAsset());
                break;
            case ROLLED_BACK:
                log.warn("[EXECUTION] {} ROLLED_BACK: {}", result.getExecutionId(), result.getFailureReason());
                break;
            default:
                log.error("[ALERT] {} PARTIALLY_STRANDED on {}: {}", result.getExecutionId(),
                        result.getOpportunity().getPath(), result.getFailureReason());
        }
    }
}

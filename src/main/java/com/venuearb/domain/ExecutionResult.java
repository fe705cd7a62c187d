package com.venuearb.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Outcome of one committed opportunity. {@code realizedProfit} is in start-asset units and is
 * negative when remediation had to sell at a loss; stranded holdings are not counted in it.
 */
@Value
@Builder
public class ExecutionResult {
    String executionId;
    Opportunity opportunity;
    BigDecimal startSize;
    @Singular
    List<LegOutcome> legOutcomes;
    @Singular
    List<LegOutcome> remediations;
    @Singular
    List<Holding> strandedHoldings;
    BigDecimal recoveredAmount;
    BigDecimal realizedProfit;
    TerminalState terminalState;
    String failureReason;
    Instant startedAt;
    Instant finishedAt;
}

package com.venuearb.core;

import com.venuearb.domain.Asset;
import com.venuearb.domain.ExecutionResult;
import com.venuearb.domain.ExecutionResultEvent;
import com.venuearb.domain.TerminalState;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Running totals of execution outcomes: counts per terminal state and realized profit per start asset.
 */
@Component
public class ExecutionStats {

    private final Map<TerminalState, Long> byState = new EnumMap<>(TerminalState.class);
    private final Map<Asset, BigDecimal> realized = new TreeMap<>();
    private long legsPlaced;
    private long remediations;

    @EventListener
    public synchronized void onExecution(ExecutionResultEvent event) {
        ExecutionResult result = event.getResult();
        byState.merge(result.getTerminalState(), 1L, Long::sum);
        if (result.getRealizedProfit() != null) {
            realized.merge(result.getOpportunity().getPath().getStartAsset(), result.getRealizedProfit(),
                    BigDecimal::add);
        }
        legsPlaced += result.getLegOutcomes().size();
        remediations += result.getRemediations().size();
    }

    public synchronized long total() {
        return byState.values().stream().mapToLong(Long::longValue).sum();
    }

    public synchronized long count(TerminalState state) {
        return byState.getOrDefault(state, 0L);
    }

    public synchronized BigDecimal realizedProfit(Asset asset) {
        return realized.getOrDefault(asset, BigDecimal.ZERO);
    }

    /**
     * Share of executions that completed, in [0, 1]; zero before the first execution.
     */
    public synchronized double completionRate() {
        long total = total();
        return total == 0 ? 0.0 : (double) count(TerminalState.COMPLETED) / total;
    }

    public synchronized long legsPlaced() {
        return legsPlaced;
    }

    public synchronized long remediations() {
        return remediations;
    }
}

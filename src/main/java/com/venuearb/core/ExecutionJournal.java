package com.venuearb.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venuearb.config.ArbProperties;
import com.venuearb.domain.Admission;
import com.venuearb.domain.ExecutionResult;
import com.venuearb.domain.ExecutionResultEvent;
import com.venuearb.domain.LegOutcome;
import com.venuearb.domain.Opportunity;
import com.venuearb.domain.OpportunityEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes one JSON line per detected opportunity and per execution to the {@code arb.journal}
 * logger, where the log configuration routes it to durable storage.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionJournal {

    static final Logger JOURNAL = LoggerFactory.getLogger("arb.journal");

    private final ObjectMapper mapper;
    private final ArbProperties properties;

    @EventListener
    public void onOpportunity(OpportunityEvent event) {
        write(opportunityEntry(event.getOpportunity(), event.getAdmission()));
    }

    @EventListener
    public void onExecution(ExecutionResultEvent event) {
        write(executionEntry(event.getResult()));
    }

    Map<String, Object> opportunityEntry(Opportunity opportunity, Admission admission) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", "opportunity");
        entry.put("configVersion", properties.configVersion());
        entry.put("path", opportunity.getPath().id());
        entry.put("family", opportunity.getPath().getFamily());
        entry.put("grossProfitPct", opportunity.getGrossProfitPct().toPlainString());
        entry.put("netProfitPct", opportunity.getNetProfitPct().toPlainString());
        entry.put("referencePrices", opportunity.getReferencePrices().stream()
                .map(BigDecimal::toPlainString).collect(Collectors.toList()));
        entry.put("snapshotTimestamps", opportunity.getSnapshotTimestamps().stream()
                .map(Object::toString).collect(Collectors.toList()));
        entry.put("detectedAt", String.valueOf(opportunity.getDetectedAt()));
        entry.put("accepted", admission.isAccepted());
        entry.put("thresholdPct", admission.getThresholdPct() != null ? admission.getThresholdPct().toPlainString() : null);
        if (admission.isAccepted()) {
            entry.put("sizeCap", admission.getSizeCap().toPlainString());
        } else {
            entry.put("rejectReason", admission.getRejectReason());
            entry.put("detail", admission.getDetail());
        }
        return entry;
    }

    Map<String, Object> executionEntry(ExecutionResult result) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", "execution");
        entry.put("configVersion", properties.configVersion());
        entry.put("executionId", result.getExecutionId());
        entry.put("path", result.getOpportunity().getPath().id());
        entry.put("startSize", result.getStartSize().toPlainString());
        entry.put("terminalState", result.getTerminalState());
        entry.put("realizedProfit", plain(result.getRealizedProfit()));
        entry.put("legs", legs(result.getLegOutcomes()));
        entry.put("remediations", legs(result.getRemediations()));
        entry.put("stranded", result.getStrandedHoldings().stream()
                .map(h -> h.getAmount().toPlainString() + " " + h.getAsset() + "@" + h.getVenue())
                .collect(Collectors.toList()));
        entry.put("failureReason", result.getFailureReason());
        entry.put("startedAt", String.valueOf(result.getStartedAt()));
        entry.put("finishedAt", String.valueOf(result.getFinishedAt()));
        return entry;
    }

    private static List<Map<String, Object>> legs(List<LegOutcome> outcomes) {
        return outcomes.stream().map(o -> {
            Map<String, Object> leg = new LinkedHashMap<>();
            leg.put("leg", o.getLeg().toString());
            leg.put("orderId", o.getClientOrderId());
            leg.put("status", o.getStatus());
            leg.put("requested", plain(o.getRequestedQuantity()));
            leg.put("filled", plain(o.getFilledQuantity()));
            leg.put("averagePrice", plain(o.getAveragePrice()));
            return leg;
        }).collect(Collectors.toList());
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : null;
    }

    private void write(Map<String, Object> entry) {
        try {
            JOURNAL.info(mapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            log.warn("Could not journal {} entry", entry.get("type"), e);
        }
    }
}

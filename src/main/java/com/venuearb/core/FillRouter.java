package com.venuearb.core;

import com.venuearb.domain.FillEvent;
import com.venuearb.infra.FillListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One confirmation channel per in-flight order. Gateways push fill events here; the order's
 * owner waits on the future, which completes on the first terminal event.
 */
@Slf4j
@Component
public class FillRouter implements FillListener {

    private final Map<String, CompletableFuture<FillEvent>> pending = new ConcurrentHashMap<>();
    private final Map<String, FillEvent> partials = new ConcurrentHashMap<>();

    /**
     * Must be called before the order is submitted so an immediate fill is not lost.
     */
    public CompletableFuture<FillEvent> register(String clientOrderId) {
        CompletableFuture<FillEvent> future = new CompletableFuture<>();
        if (pending.putIfAbsent(clientOrderId, future) != null) {
            throw new IllegalStateException("Order " + clientOrderId + " is already awaiting fills");
        }
        return future;
    }

    @Override
    public void onFill(FillEvent event) {
        String id = event.getClientOrderId();
        if (!event.isTerminal()) {
            if (pending.containsKey(id)) {
                partials.put(id, event);
            } else {
                log.warn("Partial fill for unknown order {}", id);
            }
            return;
        }
        CompletableFuture<FillEvent> future = pending.remove(id);
        partials.remove(id);
        if (future == null) {
            log.warn("Terminal fill {} for unknown or abandoned order {}", event.getStatus(), id);
            return;
        }
        future.complete(event);
    }

    /**
     * Latest partial fill seen for an order that has not yet reached a terminal state.
     */
    public Optional<FillEvent> lastPartial(String clientOrderId) {
        return Optional.ofNullable(partials.get(clientOrderId));
    }

    public void discard(String clientOrderId) {
        pending.remove(clientOrderId);
        partials.remove(clientOrderId);
    }

    public int inFlight() {
        return pending.size();
    }
}

package com.venuearb.core;

import com.venuearb.domain.Path;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;

/**
 * Mutable state of one execution while it holds its locks. Only the executing thread moves it.
 */
@Slf4j
@Getter
public final class InFlightExecution {

    private final String executionId;
    private final Path path;
    private final Instant startedAt;
    private volatile ExecutionState state = ExecutionState.PENDING;

    InFlightExecution(String executionId, Path path, Instant startedAt) {
        this.executionId = executionId;
        this.path = path;
        this.startedAt = startedAt;
    }

    void moveTo(ExecutionState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Execution " + executionId + " cannot move from " + state + " to " + next);
        }
        log.debug("[EXECUTION] {} {} -> {}", executionId, state, next);
        state = next;
    }
}

package com.venuearb.core;

import java.util.EnumSet;
import java.util.Set;

public enum ExecutionState {
    PENDING,
    LEG1_COMMITTED,
    LEG2_COMMITTED,
    LEG3_COMMITTED,
    COMPLETED,
    LEG_FAILED,
    REMEDIATING,
    ROLLED_BACK,
    PARTIALLY_STRANDED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK || this == PARTIALLY_STRANDED;
    }

    public boolean canMoveTo(ExecutionState next) {
        return successors().contains(next);
    }

    private Set<ExecutionState> successors() {
        switch (this) {
            case PENDING:
                // ROLLED_BACK here means the opportunity was withdrawn before any order went out
                return EnumSet.of(LEG1_COMMITTED, LEG_FAILED, ROLLED_BACK);
            case LEG1_COMMITTED:
                return EnumSet.of(LEG2_COMMITTED, LEG_FAILED);
            case LEG2_COMMITTED:
                return EnumSet.of(LEG3_COMMITTED, COMPLETED, LEG_FAILED);
            case LEG3_COMMITTED:
                return EnumSet.of(COMPLETED);
            case LEG_FAILED:
                return EnumSet.of(REMEDIATING, ROLLED_BACK);
            case REMEDIATING:
                return EnumSet.of(COMPLETED, ROLLED_BACK, PARTIALLY_STRANDED);
            default:
                return EnumSet.noneOf(ExecutionState.class);
        }
    }

    /**
     * State reached once the leg at {@code legIndex} (zero based) is confirmed.
     */
    public static ExecutionState committed(int legIndex) {
        switch (legIndex) {
            case 0:
                return LEG1_COMMITTED;
            case 1:
                return LEG2_COMMITTED;
            case 2:
                return LEG3_COMMITTED;
            default:
                throw new IllegalArgumentException("No committed state for leg " + (legIndex + 1));
        }
    }
}

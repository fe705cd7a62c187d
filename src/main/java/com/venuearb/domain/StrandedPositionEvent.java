package com.venuearb.domain;

import lombok.Value;

import java.util.List;

/**
 * Remediation could not return these holdings to the start asset; they need manual handling.
 */
@Value
public class StrandedPositionEvent {
    String executionId;
    Path path;
    List<Holding> holdings;
    String reason;
}

package com.venuearb.domain;

import lombok.Value;

@Value
public class ExecutionResultEvent {
    ExecutionResult result;
}

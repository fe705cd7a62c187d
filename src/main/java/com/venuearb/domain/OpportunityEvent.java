package com.venuearb.domain;

import lombok.Value;

/**
 * Published for every evaluable opportunity whose net profit is positive, admitted or not.
 */
@Value
public class OpportunityEvent {
    Opportunity opportunity;
    Admission admission;
}

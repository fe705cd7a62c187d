package com.venuearb.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Evaluation {

    private final Opportunity opportunity;
    private final UnevaluableReason reason;
    private final String detail;

    public static Evaluation of(Opportunity opportunity) {
        return new Evaluation(opportunity, null, null);
    }

    public static Evaluation unevaluable(UnevaluableReason reason, String detail) {
        return new Evaluation(null, reason, detail);
    }

    public boolean isEvaluable() {
        return opportunity != null;
    }
}

package com.venuearb.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Risk gate verdict. An accepted admission carries the opportunity sized to {@link #getSizeCap()}.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class Admission {

    private final Opportunity opportunity;
    private final BigDecimal sizeCap;
    private final RejectReason rejectReason;
    private final String detail;
    private final BigDecimal thresholdPct;

    public static Admission accept(Opportunity sized, BigDecimal thresholdPct) {
        return new Admission(sized, sized.getMaxSafeSizeInStartAsset(), null, null, thresholdPct);
    }

    public static Admission reject(RejectReason reason, String detail, BigDecimal thresholdPct) {
        return new Admission(null, BigDecimal.ZERO, reason, detail, thresholdPct);
    }

    public boolean isAccepted() {
        return rejectReason == null;
    }
}

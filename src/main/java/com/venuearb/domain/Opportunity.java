package com.venuearb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A scored path for one scan cycle. Everything here derives from the snapshots and fees it was
 * evaluated against, so the same inputs always produce an equal instance.
 */
@Value
@Builder(toBuilder = true)
public class Opportunity {
    Path path;
    BigDecimal grossProfitPct;
    BigDecimal netProfitPct;

    /** Ask for buy legs, bid for sell legs, as seen at evaluation. */
    List<BigDecimal> referencePrices;

    /** Amount of each leg's consumed asset entering that leg per unit of start asset, net of earlier deductions. */
    List<BigDecimal> legInputsPerUnit;

    List<Instant> snapshotTimestamps;

    /** Zero until the risk gate sizes it. */
    @Builder.Default
    BigDecimal maxSafeSizeInStartAsset = BigDecimal.ZERO;

    Instant detectedAt;

    public Opportunity withMaxSafeSize(BigDecimal size) {
        return toBuilder().maxSafeSizeInStartAsset(size).build();
    }

    public boolean isSized() {
        return maxSafeSizeInStartAsset != null && maxSafeSizeInStartAsset.signum() > 0;
    }
}

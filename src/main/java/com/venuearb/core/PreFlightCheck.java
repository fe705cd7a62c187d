package com.venuearb.core;

import com.venuearb.domain.Opportunity;

/**
 * Last look before the first leg is placed, run while the path's resources are already locked.
 */
@FunctionalInterface
public interface PreFlightCheck {

    PreFlightCheck NONE = opportunity -> true;

    boolean stillValid(Opportunity opportunity);
}

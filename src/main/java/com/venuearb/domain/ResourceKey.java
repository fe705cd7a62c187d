package com.venuearb.domain;

import lombok.Value;

/**
 * A balance of one asset on one venue; the unit of execution locking.
 */
@Value(staticConstructor = "of")
public class ResourceKey {
    String venue;
    Asset asset;

    @Override
    public String toString() {
        return asset + "@" + venue;
    }
}
